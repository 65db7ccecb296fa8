package io.sansred.command;

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

import io.sansred.command.reduce.CMD_reduce;
import io.sansred.command.validate.CMD_validate;
import picocli.CommandLine;

/// Batch reduction of small-angle neutron scattering data
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "sansred",
    mixinStandardHelpOptions = true,
    description = "Validate and run batch reductions of SANS data",
    subcommands = {CommandLine.HelpCommand.class, CMD_validate.class, CMD_reduce.class})
public class CMD_sansred {

    /// run a sansred command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return the command line with the options every invocation uses
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_sansred()).setCaseInsensitiveEnumValuesAllowed(true);
    }
}
