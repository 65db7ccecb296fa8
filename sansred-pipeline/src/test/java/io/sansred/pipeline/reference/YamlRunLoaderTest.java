package io.sansred.pipeline.reference;

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

import io.sansred.pipeline.DataLoadException;
import io.sansred.pipeline.workspace.LoadedRun;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.types.ReductionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("YamlRunLoader")
class YamlRunLoaderTest {

    private static final String SINGLE_PERIOD = """
        run_duration: 100.0
        edges: [1.0, 2.0, 3.0]
        monitors:
          - {spectrum: 1, counts: [1000, 1000]}
          - {spectrum: 3, counts: [500, 500], errors: [1.0, 1.0]}
        detectors:
          - {spectrum: 100, bank: LAB, position: [0.02, 0.0, 4.0], counts: [16, 9]}
          - {spectrum: 200, bank: hab, position: [0.3, 0.0, 2.0], counts: [4, 1], edges: [1.0, 1.5, 3.0]}
        """;

    @Test
    @DisplayName("should read monitors, detectors and geometry")
    void readsSinglePeriod() {
        LoadedRun run = YamlRunLoader.parse("SANS2D00022024.yaml", SINGLE_PERIOD);

        assertThat(run.periodCount()).isEqualTo(1);
        Workspace scatter = run.scatter(1);
        assertThat(scatter.name()).isEqualTo("SANS2D00022024");
        assertThat(scatter.spectrumCount()).isEqualTo(2);
        assertThat(scatter.bank(1)).isEqualTo(ReductionMode.HAB);
        assertThat(scatter.readX(1)).containsExactly(1.0, 1.5, 3.0);
        assertThat(scatter.readE(0)).containsExactly(4.0, 3.0);
        assertThat(scatter.runMetadata()).containsEntry("run_duration", 100.0);

        Workspace monitors = run.monitor(1);
        assertThat(monitors.indexOf(3)).isEqualTo(1);
        assertThat(monitors.readE(1)).containsExactly(1.0, 1.0);
    }

    @Test
    @DisplayName("should read one workspace pair per period")
    void readsPeriods() {
        String yaml = """
            edges: [1.0, 2.0]
            periods:
              - monitors: [{spectrum: 1, counts: [10]}]
                detectors: [{spectrum: 100, bank: LAB, position: [0.1, 0, 4], counts: [1]}]
              - monitors: [{spectrum: 1, counts: [20]}]
                detectors: [{spectrum: 100, bank: LAB, position: [0.1, 0, 4], counts: [2]}]
            """;

        LoadedRun run = YamlRunLoader.parse("multi.yaml", yaml);

        assertThat(run.isMultiPeriod()).isTrue();
        assertThat(run.scatter(2).name()).isEqualTo("multi_p2");
        assertThat(run.scatter(2).readY(0)).containsExactly(2.0);
        assertThat(run.monitor(1).readY(0)).containsExactly(10.0);
    }

    @Test
    @DisplayName("should resolve files against the base directory")
    void loadsFromDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("run.yaml"), SINGLE_PERIOD);

        LoadedRun run = new YamlRunLoader(dir).load("run.yaml");

        assertThat(run.file()).isEqualTo("run.yaml");
    }

    @Test
    @DisplayName("a missing file should be a load failure")
    void missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> new YamlRunLoader(dir).load("absent.yaml"))
            .isInstanceOf(DataLoadException.class)
            .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("a detector without a position should be rejected")
    void needsPosition() {
        String yaml = """
            edges: [1.0, 2.0]
            monitors: [{spectrum: 1, counts: [10]}]
            detectors: [{spectrum: 100, bank: LAB, counts: [1]}]
            """;

        assertThatThrownBy(() -> YamlRunLoader.parse("bad.yaml", yaml))
            .isInstanceOf(DataLoadException.class)
            .hasMessageContaining("position of spectrum 100");
    }

    @Test
    @DisplayName("mismatched edges and counts should be rejected")
    void rejectsBadBinning() {
        String yaml = """
            monitors: [{spectrum: 1, edges: [1.0, 2.0], counts: [10, 20]}]
            """;

        assertThatThrownBy(() -> YamlRunLoader.parse("bad.yaml", yaml))
            .isInstanceOf(DataLoadException.class)
            .hasMessageContaining("spectrum 1");
    }

    @Test
    @DisplayName("malformed YAML should be a load failure")
    void malformedYaml() {
        assertThatThrownBy(() -> YamlRunLoader.parse("bad.yaml", "monitors: [unclosed"))
            .isInstanceOf(DataLoadException.class)
            .hasMessageContaining("malformed YAML");
    }
}
