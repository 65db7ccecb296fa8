package io.sansred.command.reduce;

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

import io.sansred.command.common.ParallelExecutionOption;
import io.sansred.command.common.VerbosityOption;
import io.sansred.pipeline.batch.BatchOptions;
import io.sansred.pipeline.batch.BatchOrchestrator;
import io.sansred.pipeline.batch.BatchReport;
import io.sansred.pipeline.batch.LoggingRowStatusListener;
import io.sansred.pipeline.batch.OutputMode;
import io.sansred.pipeline.batch.RowOutcome;
import io.sansred.pipeline.batch.RowStatusListener;
import io.sansred.pipeline.reference.ArrayReductionEngine;
import io.sansred.pipeline.reference.ColumnTextWorkspaceSaver;
import io.sansred.pipeline.reference.YamlRunLoader;
import io.sansred.pipeline.workspace.InMemoryResultRegistry;
import io.sansred.state.BatchStates;
import io.sansred.state.ConfigurationException;
import io.sansred.state.io.BatchFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Runs every row of a batch file through the reduction.
///
/// Runs are read as YAML histograms relative to the batch file, and reduced curves are written
/// as column text. In `PUBLISH_TO_ADS` mode the outputs only live for the duration of the
/// command, which is useful to check that a batch reduces cleanly.
///
/// Exit codes: 0 when every row succeeded, 1 when any row failed or could not be configured,
/// 2 when the batch file could not be read.
@CommandLine.Command(name = "reduce",
    description = "Reduce every row of a batch file")
public class CMD_reduce implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_reduce.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ROWS_FAILED = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", description = "Batch file (YAML)")
    private Path batchFile;

    @CommandLine.Option(names = {"--output-mode"},
        description = "Where outputs go: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "SAVE_TO_FILE")
    private OutputMode outputMode = OutputMode.SAVE_TO_FILE;

    @CommandLine.Option(names = {"--use-optimizations"},
        description = "Load each run once and share can reductions between rows")
    private boolean useOptimizations = false;

    @CommandLine.Option(names = {"--save-can"},
        description = "Also publish the reduced can of each row")
    private boolean saveCan = false;

    @CommandLine.Option(names = {"-o", "--output-dir"},
        description = "Directory for saved files (default: the batch file's output_directory)")
    private Path outputDirectory;

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        VerbosityOption.Level level = verbosityOption.level(spec);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        BatchFile batch;
        try {
            batch = BatchFile.read(batchFile);
        } catch (ConfigurationException e) {
            logger.debug("could not read batch file {}", batchFile, e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }
        BatchStates states = batch.createStates();

        BatchOptions options = BatchOptions.defaults()
            .withUseOptimizations(useOptimizations)
            .withOutputMode(outputMode)
            .withSaveCan(saveCan)
            .withThreads(parallelExecutionOption.workersFor(states.states().size(), spec))
            .withOutputDirectory(outputDirectory != null ? outputDirectory : batch.outputDirectory());

        BatchOrchestrator orchestrator = new BatchOrchestrator(new ArrayReductionEngine(),
            new YamlRunLoader(batch.baseDirectory()), new InMemoryResultRegistry(), new ColumnTextWorkspaceSaver());
        RowStatusListener listener = level == VerbosityOption.Level.VERBOSE
            ? RowStatusListener.composite(new LoggingRowStatusListener(), new PrintingRowStatusListener(out))
            : new LoggingRowStatusListener();

        BatchReport report = orchestrator.processStates(states, options, listener);

        if (level != VerbosityOption.Level.QUIET) {
            printSummary(out, report, level == VerbosityOption.Level.VERBOSE);
        }
        report.failedRows().forEach(row -> err.println("row " + row + " failed: "
            + report.outcome(row).map(RowOutcome::message).orElse("")));
        out.flush();
        err.flush();
        return report.isSuccess() ? EXIT_SUCCESS : EXIT_ROWS_FAILED;
    }

    private static void printSummary(PrintWriter out, BatchReport report, boolean listOutputs) {
        for (RowOutcome outcome : report.outcomes().values()) {
            switch (outcome.state()) {
                case SUCCESS -> {
                    out.println("row " + outcome.rowIndex() + ": ok (" + outcome.outputNames().size() + " outputs)");
                    if (listOutputs) {
                        outcome.outputNames().forEach(name -> out.println("  " + name));
                    }
                }
                case FAILED -> out.println("row " + outcome.rowIndex() + ": failed");
                case CANCELLED -> out.println("row " + outcome.rowIndex() + ": cancelled");
                default -> out.println("row " + outcome.rowIndex() + ": " + outcome.state());
            }
        }
        report.skipped().forEach(row -> out.println("row " + row + ": skipped"));
        out.printf("%d succeeded, %d failed, %d cancelled, %d skipped%n",
            report.succeededRows().size(), report.failedRows().size(), report.cancelledRows().size(),
            report.skipped().size());
    }
}
