package io.sansred.pipeline.core;

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
import io.sansred.pipeline.PipelineStageException;
import io.sansred.pipeline.ReductionStage;
import io.sansred.pipeline.bundle.ReducedSlice;
import io.sansred.pipeline.bundle.ReductionSettingsBundle;
import io.sansred.pipeline.workspace.InMemoryResultRegistry;
import io.sansred.pipeline.workspace.ResultRegistry;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.CompositeState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;
import io.sansred.state.types.WavRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReductionCore")
class ReductionCoreTest {

    private static final WavRange RANGE = new WavRange(2.0, 10.0);

    /// A 10 mm cube: 1 cm³, so the absolute scale equals the scale factor.
    private static CompositeState unitVolume(Map<String, ?> overrides) {
        Map<String, Object> settings = new HashMap<>(overrides);
        settings.put("sample_width", 10.0);
        settings.put("sample_height", 10.0);
        settings.put("sample_thickness", 10.0);
        return PipelineFixtures.state(settings);
    }

    private final RecordingEngine engine = new RecordingEngine();
    private final ResultRegistry registry = new InMemoryResultRegistry();
    private final ReductionCore core = new ReductionCore(engine, registry);

    private static ReductionSettingsBundle bundle(CompositeState state, ReductionMode bank, boolean parts) {
        return new ReductionSettingsBundle(3, state, DataType.SAMPLE, bank, parts, 0,
            PipelineFixtures.detectors("SANS2D00022024", 1.0), PipelineFixtures.monitors("SANS2D00022024_monitors", 0.5),
            PipelineFixtures.monitors("trans_monitors", 0.5), PipelineFixtures.monitors("direct_monitors", 1.0), null);
    }

    private static ReductionSettingsBundle withoutTransmission(CompositeState state) {
        return new ReductionSettingsBundle(3, state, DataType.SAMPLE, ReductionMode.LAB, false, 0,
            PipelineFixtures.detectors("SANS2D00022024", 1.0), PipelineFixtures.monitors("m", 1.0), null, null, null);
    }

    @Nested
    @DisplayName("Stage order")
    class StageOrder {

        @Test
        @DisplayName("should run every enabled stage in the fixed order")
        void runsStagesInOrder() {
            CompositeState state = PipelineFixtures.state(Map.of(
                "mask_lab_spectra", "101",
                "lab_z_translation", 0.1,
                "scale_factor", 2.0));

            core.reduce(bundle(state, ReductionMode.LAB, false).withSliceWindow(new TimeWindow(0, 50)), RANGE);

            assertThat(engine.calls()).containsSubsequence(
                "sliceEvents", "cropToBank", "mask", "move", "normalizeToMonitor", "transmission",
                "convertToWavelength", "convertToQ", "scale");
        }

        @Test
        @DisplayName("disabled stages should not call the engine")
        void skipsDisabledStages() {
            core.reduce(withoutTransmission(unitVolume(Map.of())), RANGE);

            assertThat(engine.calls()).containsExactly(
                "cropToBank", "normalizeToMonitor", "convertToWavelength", "convertToQ");
        }

        @Test
        @DisplayName("the order should not depend on the bank")
        void sameOrderForBothBanks() {
            CompositeState state = PipelineFixtures.state();
            core.reduce(bundle(state, ReductionMode.LAB, false), RANGE);
            var labCalls = engine.calls();

            RecordingEngine habEngine = new RecordingEngine();
            new ReductionCore(habEngine, registry).reduce(bundle(state, ReductionMode.HAB, false), RANGE);

            assertThat(habEngine.calls()).isEqualTo(labCalls);
        }

        @Test
        @DisplayName("a partial reduction should stop after the requested stage")
        void stopsAfterStage() {
            ReducedSlice slice = core.reduce(bundle(PipelineFixtures.state(), ReductionMode.HAB, true), RANGE,
                ReductionStage.MOVE);

            assertThat(engine.calls()).containsExactly("cropToBank");
            assertThat(slice.parts()).isNull();
            assertThat(slice.output().workspace().spectrumCount()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Outputs")
    class Outputs {

        @Test
        @DisplayName("parts should be produced on request along with the divided curve")
        void producesParts() {
            ReducedSlice slice = core.reduce(bundle(PipelineFixtures.state(), ReductionMode.LAB, true), RANGE);

            assertThat(slice.partsIfPresent()).isPresent();
            assertThat(slice.parts().counts().readX(0)).isEqualTo(slice.output().workspace().readX(0));
            assertThat(slice.transmissionIfPresent()).isPresent();
            assertThat(slice.output().identity().row()).isEqualTo(3);
            assertThat(slice.wavRange()).isEqualTo(RANGE);
        }

        @Test
        @DisplayName("without parts only the divided curve should be returned")
        void omitsParts() {
            ReducedSlice slice = core.reduce(bundle(PipelineFixtures.state(), ReductionMode.LAB, false), RANGE);

            assertThat(slice.partsIfPresent()).isEmpty();
        }

        @Test
        @DisplayName("the absolute scale should multiply the output and the counts")
        void appliesScale() {
            ReducedSlice plain = core.reduce(withoutTransmission(PipelineFixtures.state()), RANGE);
            ReducedSlice scaled = core.reduce(withoutTransmission(PipelineFixtures.state(Map.of("scale_factor", 3.0))),
                RANGE);

            assertThat(engine.calls()).contains("scale");

            double[] expected = plain.output().workspace().readY(0);
            double[] actual = scaled.output().workspace().readY(0);
            for (int i = 0; i < expected.length; i++) {
                assertThat(actual[i]).isCloseTo(expected[i] * 3.0, within(1e-9));
            }
        }

        @Test
        @DisplayName("background subtraction should remove the scaled published background")
        void subtractsBackground() {
            ReducedSlice plain = core.reduce(withoutTransmission(unitVolume(Map.of())), RANGE);
            Workspace background = plain.output().workspace();
            registry.publish("bg1", background);
            CompositeState state = unitVolume(Map.of(
                "background_workspace", "bg1", "background_scale_factor", 0.5));

            ReducedSlice subtracted = core.reduce(withoutTransmission(state), RANGE);

            double[] before = background.readY(0);
            double[] after = subtracted.output().workspace().readY(0);
            for (int i = 0; i < before.length; i++) {
                assertThat(after[i]).isCloseTo(before[i] * 0.5, within(1e-9));
            }
        }

        @Test
        @DisplayName("can data should not have the background subtracted")
        void canSkipsBackground() {
            CompositeState state = PipelineFixtures.state(Map.of(
                "background_workspace", "missing", "background_scale_factor", 0.5));
            ReductionSettingsBundle can = new ReductionSettingsBundle(1, state, DataType.CAN, ReductionMode.LAB, false, 0,
                PipelineFixtures.detectors("can", 0.1), PipelineFixtures.monitors("can_monitors", 1.0), null, null, null);

            assertThatNoException().isThrownBy(() -> core.reduce(can, RANGE));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failing kernel should be reported against its stage and bundle")
        void wrapsFailure() {
            engine.failOn("mask");
            CompositeState state = PipelineFixtures.state(Map.of("mask_lab_spectra", "101"));

            assertThatThrownBy(() -> core.reduce(bundle(state, ReductionMode.LAB, false), RANGE))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("MASK")
                .hasMessageContaining("row 3")
                .hasRootCauseMessage("mask exploded")
                .satisfies(e -> {
                    PipelineStageException stage = (PipelineStageException) e;
                    assertThat(stage.getStage()).isEqualTo(ReductionStage.MASK);
                    assertThat(stage.getBundle().reductionMode()).isEqualTo(ReductionMode.LAB);
                });
            assertThat(engine.calls()).doesNotContain("move", "normalizeToMonitor");
        }

        @Test
        @DisplayName("a missing background should fail the background stage")
        void missingBackground() {
            CompositeState state = PipelineFixtures.state(Map.of(
                "background_workspace", "nowhere", "background_scale_factor", 1.0));

            assertThatThrownBy(() -> core.reduce(withoutTransmission(state), RANGE))
                .isInstanceOf(PipelineStageException.class)
                .extracting(e -> ((PipelineStageException) e).getStage())
                .isEqualTo(ReductionStage.BACKGROUND_SUBTRACTION);
        }

        @Test
        @DisplayName("an unsupported dimensionality should fail the Q conversion")
        void twoDimensionalFails() {
            CompositeState state = PipelineFixtures.state(Map.of(
                "reduction_dimensionality", "TWO_DIM", "q_xy_max", 0.1, "q_xy_step", 0.01));

            assertThatThrownBy(() -> core.reduce(withoutTransmission(state), RANGE))
                .isInstanceOf(PipelineStageException.class)
                .extracting(e -> ((PipelineStageException) e).getStage())
                .isEqualTo(ReductionStage.CONVERT_TO_Q);
        }

        @ParameterizedTest
        @EnumSource(value = ReductionMode.class, names = {"MERGED", "ALL"})
        @DisplayName("multi-bank modes should be rejected")
        void rejectsMultiBankModes(ReductionMode mode) {
            ReductionSettingsBundle bundle = bundle(PipelineFixtures.state(), mode, false);

            assertThatThrownBy(() -> core.reduce(bundle, RANGE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(mode.name());
        }
    }
}
