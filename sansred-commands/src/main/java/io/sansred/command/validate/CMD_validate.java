package io.sansred.command.validate;

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

import io.sansred.state.BatchStates;
import io.sansred.state.CompositeState;
import io.sansred.state.ConfigurationException;
import io.sansred.state.StateSerializer;
import io.sansred.state.io.BatchFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Builds the state of every row of a batch file without reducing anything.
///
/// Prints one line per row: `row <n>: ok`, `row <n>: skipped` for blank rows, or
/// `row <n>: error: <message>`. With `--json` each valid row's state follows its line.
@CommandLine.Command(name = "validate",
    description = "Check that every row of a batch file builds a valid reduction state")
public class CMD_validate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_validate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_INVALID_ROWS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", description = "Batch file (YAML)")
    private Path batchFile;

    @CommandLine.Option(names = {"--json"}, description = "Print the state of each valid row as JSON")
    private boolean json = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        BatchStates states;
        try {
            states = BatchFile.read(batchFile).createStates();
        } catch (ConfigurationException e) {
            logger.debug("could not read batch file {}", batchFile, e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }

        for (int row = 0; row < states.rowCount(); row++) {
            CompositeState state = states.states().get(row);
            if (state != null) {
                out.println("row " + row + ": ok");
                if (json) {
                    out.println(StateSerializer.toJson(state));
                }
            } else if (states.skipped().contains(row)) {
                out.println("row " + row + ": skipped");
            } else {
                out.println("row " + row + ": error: " + states.errors().get(row));
            }
        }
        out.flush();
        logger.info("validated {}: {}", batchFile, states);
        return states.errors().isEmpty() ? EXIT_SUCCESS : EXIT_INVALID_ROWS;
    }
}
