package io.sansred.state;

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

import io.sansred.state.io.UserFileLookup;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.SampleShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StateDirector")
class StateDirectorTest {

    private final StateDirector director = new StateDirector(SettingsMap.of(StateFixtures.shared()));
    private final InstrumentMetadata instrument = StateFixtures.instrument();

    private final UserFileLookup noLookup = name -> {
        throw new ConfigurationException("unexpected lookup of " + name);
    };

    @Test
    @DisplayName("should skip a row with an empty sample scatter and build its siblings")
    void shouldSkipBlankRow() {
        List<BatchRow> rows = List.of(
            BatchRow.of(0, Map.of("sample_scatter", "A.yaml")),
            BatchRow.of(1, Map.of("sample_scatter", "")),
            BatchRow.of(2, Map.of("sample_scatter", "C.yaml")));

        assertThat(director.createState(rows.get(1), instrument, noLookup)).isEmpty();

        BatchStates states = director.createStates(rows, instrument, noLookup);
        assertThat(states.states()).containsOnlyKeys(0, 2);
        assertThat(states.errors()).isEmpty();
        assertThat(states.skipped()).containsExactly(1);
        assertThat(states.states().get(2).data().sampleScatter()).isEqualTo("C.yaml");
    }

    @Test
    @DisplayName("should apply row columns on top of the shared settings")
    void shouldApplyRowColumns() {
        BatchRow row = BatchRow.of(4, Map.of(
            "sample_scatter", "A.yaml",
            "sample_scatter_period", 2,
            "output_name", "first",
            "sample_thickness", "2.0",
            "sample_shape", "disc"));

        CompositeState state = director.createState(row, instrument, noLookup).orElseThrow();

        assertThat(state.data().sampleScatterPeriod()).isEqualTo(2);
        assertThat(state.data().instrument()).isEqualTo("SANS2D");
        assertThat(state.save().outputName()).isEqualTo("first");
        assertThat(state.scale().thickness()).isEqualTo(2.0);
        assertThat(state.scale().shape()).isEqualTo(SampleShape.DISC);
    }

    @Test
    @DisplayName("an override user file should replace the shared settings entirely")
    void overrideReplacesShared() {
        Map<String, Object> override = new HashMap<>(StateFixtures.shared());
        override.put("reduction_mode", "HAB");
        override.put("q_max", 0.9);
        UserFileLookup lookup = name -> {
            assertThat(name).isEqualTo("override.yaml");
            return SettingsMap.of(override);
        };
        StateDirector withMergedShared = new StateDirector(
            SettingsMap.of(StateFixtures.shared()).with("mask_spectra", "5"));

        CompositeState state = withMergedShared.createState(
            BatchRow.of(0, Map.of("sample_scatter", "A.yaml", "user_file", "override.yaml")), instrument, lookup)
            .orElseThrow();

        assertThat(state.reduction().reductionMode()).isEqualTo(ReductionMode.HAB);
        assertThat(state.convertToQ().qMax()).isEqualTo(0.9);
        assertThat(state.mask().spectra()).as("shared-only settings must not leak in").isEmpty();
        assertThat(state.data().userFile()).isEqualTo("override.yaml");
        assertThat(state.data().sampleScatter()).isEqualTo("A.yaml");
    }

    @Test
    @DisplayName("should report a bad row with its index and keep going")
    void shouldReportBadRow() {
        List<BatchRow> rows = List.of(
            BatchRow.of(0, Map.of("sample_scatter", "A.yaml", "sample_thickness", "thick")),
            BatchRow.of(1, Map.of("sample_scatter", "B.yaml")),
            BatchRow.of(2, Map.of("sample_scatter", "C.yaml", "not_a_column", 1)));

        assertThatThrownBy(() -> director.createState(rows.get(0), instrument, noLookup))
            .isInstanceOf(RowConfigurationException.class)
            .hasMessageContaining("Row 0")
            .hasMessageContaining("sample_thickness")
            .satisfies(e -> assertThat(((RowConfigurationException) e).getRowIndex()).isZero());

        BatchStates states = director.createStates(rows, instrument, noLookup);
        assertThat(states.states()).containsOnlyKeys(1);
        assertThat(states.errors()).containsOnlyKeys(0, 2);
        assertThat(states.errors().get(2)).contains("not_a_column");
    }

    @Test
    @DisplayName("a failing user file lookup should become a row configuration error")
    void failingLookupIsRowError() {
        UserFileLookup missing = name -> {
            throw new ConfigurationException("could not read " + name);
        };

        assertThatThrownBy(() -> director.createState(
            BatchRow.of(3, Map.of("sample_scatter", "A.yaml", "user_file", "gone.yaml")), instrument, missing))
            .isInstanceOf(RowConfigurationException.class)
            .hasMessageContaining("Row 3")
            .hasMessageContaining("gone.yaml");
    }
}
