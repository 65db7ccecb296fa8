package io.sansred.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Worker pool sizing for batch commands. Without options rows run one at a time;
 * {@code --parallel} sizes the pool to the machine and {@code --threads} fixes it.
 */
public class ParallelExecutionOption {

    private static final Logger logger = LogManager.getLogger(ParallelExecutionOption.class);

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Reduce rows concurrently, one worker per spare CPU core"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        paramLabel = "N",
        description = "Reduce at most N rows at once (overrides --parallel)"
    )
    private Integer threads;

    /**
     * Resolves the number of workers for a batch of {@code rowCount} rows. The pool never
     * holds more workers than there are rows to reduce.
     *
     * @param rowCount rows that will be dispatched
     * @param spec     the running command, for usage errors
     * @return the worker count, at least 1
     * @throws CommandLine.ParameterException if {@code --threads} is below 1
     */
    public int workersFor(int rowCount, CommandLine.Model.CommandSpec spec) {
        int cores = Runtime.getRuntime().availableProcessors();
        int workers;
        if (threads != null) {
            if (threads < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "--threads must be at least 1, was " + threads);
            }
            if (threads > cores) {
                logger.warn("{} threads requested on {} cores; rows will contend for CPU", threads, cores);
            }
            workers = threads;
        } else {
            workers = parallel ? cores - 1 : 1;
        }
        return Math.max(1, Math.min(workers, Math.max(1, rowCount)));
    }
}
