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

import io.sansred.pipeline.PipelineFixtures;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.types.SaveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ColumnTextWorkspaceSaver")
class ColumnTextWorkspaceSaverTest {

    private final ColumnTextWorkspaceSaver saver = new ColumnTextWorkspaceSaver();
    private final Workspace curve = PipelineFixtures.curve("reduced", new double[]{0.0, 0.1, 0.2}, new double[]{5.0, 2.5});

    @Test
    @DisplayName("CSV should carry metadata and one row per bin centre")
    void writesCsv(@TempDir Path dir) throws IOException {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("sample_scatter", "SANS2D00022024.yaml");
        metadata.put("merge_scale", "1.25");
        Path file = dir.resolve("out/reduced.csv");

        saver.save(curve, file, SaveType.CSV, metadata);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).startsWith("# name: reduced", "# sample_scatter: SANS2D00022024.yaml", "# merge_scale: 1.25", "Q,I,dI");
        assertThat(lines).hasSize(6);
        assertThat(lines.get(4)).startsWith("0.0500000").contains(",5.00000");
    }

    @Test
    @DisplayName("RKH should give the point count before the columns")
    void writesRkh(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("reduced.txt");

        saver.save(curve, file, SaveType.RKH, Map.of());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(1).trim()).isEqualTo("2");
        assertThat(lines).hasSize(4);
    }

    @Test
    @DisplayName("multi-spectrum workspaces should be rejected")
    void rejectsMultiSpectrum(@TempDir Path dir) {
        Workspace monitors = PipelineFixtures.monitors("m", 1.0);

        assertThatThrownBy(() -> saver.save(monitors, dir.resolve("m.csv"), SaveType.CSV, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("single-spectrum");
    }
}
