package io.sansred.pipeline.batch;

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
import io.sansred.pipeline.FakeRunLoader;
import io.sansred.pipeline.PipelineFixtures;
import io.sansred.pipeline.bundle.ReducedSlice;
import io.sansred.pipeline.core.ReductionCore;
import io.sansred.pipeline.reference.ArrayReductionEngine;
import io.sansred.pipeline.workspace.InMemoryResultRegistry;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.CompositeState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RowReducer")
class RowReducerTest {

    private final FakeRunLoader loader = FakeRunLoader.standard();
    private final ReductionCore core = new ReductionCore(new ArrayReductionEngine(), new InMemoryResultRegistry());

    private RowResult reduce(Map<String, ?> overrides) {
        return new RowReducer(core, loader, null).reduce(0, PipelineFixtures.state(overrides));
    }

    private static List<ReducedOutput> ofKind(RowResult result, OutputKind kind) {
        return result.outputs().stream().filter(o -> o.kind() == kind).toList();
    }

    private static void assertProportional(Workspace actual, Workspace expected, double factor) {
        double[] a = actual.readY(0);
        double[] e = expected.readY(0);
        assertThat(a).hasSameSizeAs(e);
        for (int i = 0; i < a.length; i++) {
            assertThat(a[i]).as("bin %d", i).isCloseTo(e[i] * factor, within(1e-9 * Math.max(1.0, Math.abs(e[i]))));
        }
    }

    @Test
    @DisplayName("a single-bank row should produce one reduced curve per range")
    void singleBank() {
        RowResult result = reduce(Map.of("wavelength_low", List.of(2.0, 2.0), "wavelength_high", List.of(10.0, 6.0)));

        assertThat(result.outputs()).extracting(ReducedOutput::kind).containsOnly(OutputKind.REDUCED);
        assertThat(result.outputs()).extracting(o -> o.range().high()).containsExactly(10.0, 6.0);
        assertThat(result.outputs()).allSatisfy(o -> {
            assertThat(o.mode()).isEqualTo(ReductionMode.LAB);
            assertThat(o.period()).isZero();
            assertThat(o.slice()).isNull();
        });
        assertThat(result.merges()).isEmpty();
    }

    @Test
    @DisplayName("the can should be subtracted and published alongside")
    void canSubtracted() {
        RowResult plain = reduce(Map.of());
        RowResult withCan = reduce(Map.of("can_scatter", PipelineFixtures.CAN));

        List<ReducedOutput> reduced = ofKind(withCan, OutputKind.REDUCED);
        List<ReducedOutput> can = ofKind(withCan, OutputKind.CAN);
        assertThat(reduced).hasSize(1);
        assertThat(can).singleElement().extracting(ReducedOutput::dataType).isEqualTo(DataType.CAN);
        assertProportional(reduced.get(0).workspace(), plain.outputs().get(0).workspace(), 0.9);
        assertProportional(can.get(0).workspace(), plain.outputs().get(0).workspace(), 0.1);
    }

    @Test
    @DisplayName("transmission curves should be reported when transmission runs are given")
    void transmissions() {
        RowResult result = reduce(Map.of(
            "sample_transmission", PipelineFixtures.SAMPLE_TRANSMISSION,
            "sample_direct", PipelineFixtures.DIRECT));

        assertThat(result.outputs()).extracting(ReducedOutput::kind)
            .containsExactly(OutputKind.REDUCED, OutputKind.TRANSMISSION, OutputKind.TRANSMISSION_UNFITTED);
        assertThat(Arrays.stream(ofKind(result, OutputKind.TRANSMISSION_UNFITTED).get(0).workspace().readY(0)).boxed().toList())
            .allSatisfy(t -> assertThat(t).isCloseTo(0.5, within(1e-9)));
    }

    @Nested
    @DisplayName("Periods")
    class Periods {

        @Test
        @DisplayName("period 0 on a multi-period run should reduce every period")
        void allPeriods() {
            RowResult result = reduce(Map.of("sample_scatter", PipelineFixtures.MULTI_PERIOD));

            assertThat(result.outputs()).extracting(ReducedOutput::period).containsExactly(1, 2);
            assertProportional(result.outputs().get(1).workspace(), result.outputs().get(0).workspace(), 2.0);
        }

        @Test
        @DisplayName("an explicit period should reduce only that period")
        void explicitPeriod() {
            RowResult result = reduce(Map.of("sample_scatter", PipelineFixtures.MULTI_PERIOD, "sample_scatter_period", 2));

            assertThat(result.outputs()).singleElement().extracting(ReducedOutput::period).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("each slice window should give its own reduction of the row")
    void slices() {
        RowResult whole = reduce(Map.of());
        RowResult sliced = reduce(Map.of(
            "slice_start_time", List.of(0.0, 50.0),
            "slice_end_time", List.of(50.0, 100.0)));

        assertThat(sliced.outputs()).hasSize(2);
        assertThat(sliced.outputs()).extracting(o -> o.slice().start()).containsExactly(0.0, 50.0);
        for (ReducedOutput output : sliced.outputs()) {
            assertProportional(output.workspace(), whole.outputs().get(0).workspace(), 1.0);
        }
    }

    @Test
    @DisplayName("merged mode should report both banks, the merged curve and the scaled HAB curve")
    void merged() {
        RowResult result = reduce(Map.of(
            "reduction_mode", "MERGED",
            "merge_fit_mode", "SCALE_ONLY",
            "can_scatter", PipelineFixtures.CAN));

        assertThat(ofKind(result, OutputKind.REDUCED)).extracting(ReducedOutput::mode)
            .containsExactly(ReductionMode.LAB, ReductionMode.HAB, ReductionMode.MERGED);
        assertThat(ofKind(result, OutputKind.SCALED_HAB)).hasSize(1);
        assertThat(result.merges()).hasSize(1);
        assertThat(result.scales().get(0)).isCloseTo(1.0 / PipelineFixtures.HAB_EFFICIENCY, within(0.05));
        assertThat(result.shifts()).containsExactly(0.0);
    }

    @Test
    @DisplayName("the can cache should reduce a shared can once")
    void canCache() {
        OnceCache<String, ReducedSlice> canCache = new OnceCache<>();
        RowReducer reducer = new RowReducer(core, loader, canCache);

        RowResult first = reducer.reduce(0, PipelineFixtures.state(Map.of("can_scatter", PipelineFixtures.CAN)));
        RowResult second = reducer.reduce(1, PipelineFixtures.state(Map.of(
            "can_scatter", PipelineFixtures.CAN, "output_name", "elsewhere")));

        assertThat(canCache.size()).isEqualTo(1);
        assertThat(ofKind(second, OutputKind.CAN).get(0).workspace())
            .isSameAs(ofKind(first, OutputKind.CAN).get(0).workspace());
    }

    @Test
    @DisplayName("a missing run should fail the row")
    void missingRun() {
        assertThatThrownBy(() -> reduce(Map.of("can_scatter", "nowhere.yaml")))
            .isInstanceOf(DataLoadException.class)
            .hasMessageContaining("nowhere.yaml");
    }
}
