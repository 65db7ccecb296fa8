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

import picocli.CommandLine;

/**
 * How much a batch command prints. {@code -v} adds per-row signals and output names,
 * {@code -q} leaves only errors.
 */
public class VerbosityOption {

    /** Printed detail, from least to most. */
    public enum Level {
        QUIET,
        NORMAL,
        VERBOSE
    }

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Print row signals and the names of produced outputs")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Print errors only")
    private boolean quiet = false;

    /**
     * @param spec the running command, for usage errors
     * @return the requested level
     * @throws CommandLine.ParameterException if both flags are given
     */
    public Level level(CommandLine.Model.CommandSpec spec) {
        if (verbose && quiet) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Cannot specify both --verbose and --quiet options");
        }
        if (quiet) {
            return Level.QUIET;
        }
        return verbose ? Level.VERBOSE : Level.NORMAL;
    }
}
