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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("sansred command line")
class CMD_sansredTest {

    @TempDir
    Path tempDir;

    private BatchWorkspace workspace;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        workspace = new BatchWorkspace(tempDir);
    }

    private int run(String... args) {
        CommandLine commandLine = CMD_sansred.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("should report each row as ok, skipped or in error")
        void reportsRows() throws IOException {
            Path batch = workspace.batch(
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", output_name: first}",
                "{}",
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", colour: red}");

            int exitCode = run("validate", batch.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(out.toString()).contains("row 0: ok", "row 1: skipped", "row 2: error:", "colour");
        }

        @Test
        @DisplayName("a valid batch should exit with 0 and print states on request")
        void printsJson() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("validate", "--json", batch.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("row 0: ok", "\"fragments\"", "\"q_max\"");
        }

        @Test
        @DisplayName("an unreadable batch file should exit with 2")
        void missingBatch() {
            int exitCode = run("validate", tempDir.resolve("absent.yaml").toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("error:");
        }
    }

    @Nested
    @DisplayName("reduce")
    class Reduce {

        @Test
        @DisplayName("should save one file per reduced curve into the output directory")
        void savesFiles() throws IOException {
            Path batch = workspace.batch(
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", output_name: first}",
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", can_scatter: " + BatchWorkspace.CAN + ", output_name: second}");

            int exitCode = run("reduce", batch.toString());

            assertThat(exitCode).as(err.toString()).isZero();
            assertThat(tempDir.resolve("out").resolve("first_lab_1D_2.0_10.0.csv")).isRegularFile();
            assertThat(tempDir.resolve("out").resolve("second_lab_1D_2.0_10.0.csv")).isRegularFile();
            assertThat(out.toString()).contains("row 0: ok", "row 1: ok", "2 succeeded, 0 failed");
        }

        @Test
        @DisplayName("an explicit output directory should take precedence")
        void outputDirOption() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");
            Path target = tempDir.resolve("elsewhere");

            int exitCode = run("reduce", "--output-dir", target.toString(), "--use-optimizations", batch.toString());

            assertThat(exitCode).isZero();
            assertThat(target.resolve("SANS2D00022024_lab_1D_2.0_10.0.csv")).isRegularFile();
            assertThat(tempDir.resolve("out")).doesNotExist();
        }

        @Test
        @DisplayName("publishing only should not write files")
        void publishOnly() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("reduce", "--output-mode", "publish_to_ads", batch.toString());

            assertThat(exitCode).isZero();
            assertThat(tempDir.resolve("out")).doesNotExist();
        }

        @Test
        @DisplayName("a failing row should give exit code 1 without stopping the others")
        void failingRow() throws IOException {
            Path batch = workspace.batch(
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", output_name: good}",
                "{sample_scatter: missing.yaml, output_name: bad}",
                "{sample_scatter: " + BatchWorkspace.SAMPLE + ", output_name: also_good}");

            int exitCode = run("reduce", "--threads", "2", batch.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(out.toString()).contains("2 succeeded, 1 failed");
            assertThat(err.toString()).contains("row 1 failed", "missing.yaml");
            assertThat(Files.exists(tempDir.resolve("out").resolve("also_good_lab_1D_2.0_10.0.csv"))).isTrue();
        }

        @Test
        @DisplayName("verbose output should list signals and output names")
        void verbose() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("reduce", "-v", batch.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("row 0 started", "row 0 processed", "  SANS2D00022024_lab_1D_2.0_10.0");
        }

        @Test
        @DisplayName("quiet output should print nothing on success")
        void quiet() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("reduce", "-q", batch.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString()).isEmpty();
        }

        @Test
        @DisplayName("verbose and quiet together should be a usage error")
        void verboseAndQuiet() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("reduce", "-v", "-q", batch.toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("--verbose and --quiet");
        }

        @Test
        @DisplayName("a thread count below one should be a usage error")
        void zeroThreads() throws IOException {
            Path batch = workspace.batch("{sample_scatter: " + BatchWorkspace.SAMPLE + "}");

            int exitCode = run("reduce", "--threads", "0", batch.toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("--threads must be at least 1");
        }
    }
}
