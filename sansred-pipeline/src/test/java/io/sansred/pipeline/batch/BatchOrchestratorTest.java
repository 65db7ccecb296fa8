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

import io.sansred.pipeline.FakeRunLoader;
import io.sansred.pipeline.PipelineFixtures;
import io.sansred.pipeline.RecordingSaver;
import io.sansred.pipeline.reference.ArrayReductionEngine;
import io.sansred.pipeline.workspace.InMemoryResultRegistry;
import io.sansred.state.BatchStates;
import io.sansred.state.CompositeState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BatchOrchestrator")
class BatchOrchestratorTest {

    private static final String LAB_OUTPUT = "SANS2D00022024_lab_1D_2.0_10.0";

    private final FakeRunLoader loader = FakeRunLoader.standard();
    private final InMemoryResultRegistry registry = new InMemoryResultRegistry();
    private final RecordingSaver saver = new RecordingSaver();
    private final BatchOrchestrator orchestrator =
        new BatchOrchestrator(new ArrayReductionEngine(), loader, registry, saver);

    private static Map<Integer, CompositeState> rows(int count, Map<String, ?> overrides) {
        Map<Integer, CompositeState> states = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> settings = new LinkedHashMap<>(overrides);
            settings.put("output_name", "row" + i);
            states.put(i, PipelineFixtures.state(settings));
        }
        return states;
    }

    @Nested
    @DisplayName("Row isolation")
    class Isolation {

        @Test
        @DisplayName("a failing row should not affect the others")
        void failingRowIsolated() {
            Map<Integer, CompositeState> states = rows(4, Map.of());
            states.put(2, PipelineFixtures.state(Map.of("can_scatter", "nowhere.yaml")));
            RecordingListener listener = new RecordingListener();

            BatchReport report = orchestrator.processStates(states, false, OutputMode.PUBLISH_TO_ADS, listener);

            assertThat(report.succeededRows()).containsExactly(0, 1, 3);
            assertThat(report.failedRows()).containsExactly(2);
            assertThat(listener.failures()).containsOnlyKeys(2);
            assertThat(listener.failures().get(2)).contains("nowhere.yaml");
            assertThat(report.outcome(2).orElseThrow().message()).contains("nowhere.yaml");
            assertThat(report.isSuccess()).isFalse();
            assertThat(report.statistics().getCompleted()).isEqualTo(3);
            assertThat(report.statistics().getFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing stage should name the stage in the row's failure")
        void stageFailureMessage() {
            Map<Integer, CompositeState> states = Map.of(0,
                PipelineFixtures.state(Map.of("mask_files", "edges.xml")));
            RecordingListener listener = new RecordingListener();

            orchestrator.processStates(states, false, OutputMode.PUBLISH_TO_ADS, listener);

            assertThat(listener.failures().get(0)).contains("MASK").contains("row 0");
        }

        @Test
        @DisplayName("rows that could not be configured should fail without running")
        void configurationErrors() {
            BatchStates states = new BatchStates(rows(1, Map.of()), Map.of(1, "q_max: must be at least q_min"), Set.of(2));
            RecordingListener listener = new RecordingListener();

            BatchReport report = orchestrator.processStates(states, BatchOptions.defaults(), listener);

            assertThat(listener.events()).doesNotContain("started:1");
            assertThat(listener.failures()).containsEntry(1, "q_max: must be at least q_min");
            assertThat(report.succeededRows()).containsExactly(0);
            assertThat(report.skipped()).containsExactly(2);
            assertThat(report.statistics().getSubmitted()).isEqualTo(2);
        }

        @Test
        @DisplayName("a listener that throws should not break the batch")
        void throwingListener() {
            RecordingListener recording = new RecordingListener();
            RowStatusListener exploding = new RowStatusListener() {
                @Override
                public void rowStarted(int row) {
                    throw new IllegalStateException("listener bug");
                }

                @Override
                public void rowProcessed(int row) {
                    throw new IllegalStateException("listener bug");
                }

                @Override
                public void rowFailed(int row, String message) {
                    throw new IllegalStateException("listener bug");
                }
            };

            BatchReport report = orchestrator.processStates(rows(2, Map.of()), false, OutputMode.PUBLISH_TO_ADS,
                RowStatusListener.composite(exploding, recording));

            assertThat(report.succeededRows()).containsExactly(0, 1);
            assertThat(recording.terminal()).containsExactlyInAnyOrder("processed:0", "processed:1");
            assertThat(recording.finished()).isSameAs(report);
        }
    }

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("parallel rows should each get exactly one terminal signal")
        void parallelSignals() {
            Map<Integer, CompositeState> states = rows(8, Map.of());
            states.put(5, PipelineFixtures.state(Map.of("sample_scatter", "missing.yaml")));
            RecordingListener listener = new RecordingListener();

            BatchReport report = orchestrator.processStates(BatchStates.of(states),
                BatchOptions.defaults().withThreads(4), listener);

            assertThat(listener.terminal()).hasSize(8).doesNotHaveDuplicates();
            assertThat(listener.terminal()).contains("failed:5");
            assertThat(report.succeededRows()).hasSize(7);
            assertThat(report.statistics().isComplete()).isTrue();
            assertThat(listener.finished()).isSameAs(report);
        }

        @Test
        @DisplayName("cancelling should stop rows that have not started")
        void cancel() {
            RecordingListener recording = new RecordingListener();
            RowStatusListener cancelling = new RowStatusListener() {
                @Override
                public void rowStarted(int row) {
                    orchestrator.cancel();
                }

                @Override
                public void rowProcessed(int row) {
                }

                @Override
                public void rowFailed(int row, String message) {
                }
            };

            BatchReport report = orchestrator.processStates(rows(4, Map.of()), false, OutputMode.PUBLISH_TO_ADS,
                RowStatusListener.composite(cancelling, recording));

            assertThat(orchestrator.isCancelled()).isTrue();
            assertThat(report.succeededRows()).containsExactly(0);
            assertThat(report.cancelledRows()).containsExactly(1, 2, 3);
            assertThat(recording.terminal()).containsExactly("processed:0", "cancelled:1", "cancelled:2", "cancelled:3");
        }

        @Test
        @DisplayName("a new batch should run after a cancelled one")
        void cancelResets() {
            orchestrator.cancel();

            BatchReport report = orchestrator.processStates(rows(1, Map.of()), false, OutputMode.PUBLISH_TO_ADS,
                RowStatusListener.noop());

            assertThat(report.succeededRows()).containsExactly(0);
        }
    }

    @Nested
    @DisplayName("Outputs")
    class Outputs {

        @Test
        @DisplayName("BOTH should publish and save the reduced curve")
        void publishAndSave(@TempDir Path dir) {
            Map<Integer, CompositeState> states = Map.of(0, PipelineFixtures.state());

            BatchReport report = orchestrator.processStates(BatchStates.of(states),
                BatchOptions.defaults().withOutputMode(OutputMode.BOTH).withOutputDirectory(dir), RowStatusListener.noop());

            assertThat(registry.contains(LAB_OUTPUT)).isTrue();
            assertThat(saver.saved()).singleElement().satisfies(saved -> {
                assertThat(saved.path()).isEqualTo(dir.resolve(LAB_OUTPUT + ".csv"));
                assertThat(saved.metadata()).containsEntry("sample_scatter", PipelineFixtures.SAMPLE)
                    .containsEntry("reduction_mode", "LAB");
            });
            assertThat(report.outcome(0).orElseThrow().outputNames()).containsExactly(LAB_OUTPUT);
        }

        @Test
        @DisplayName("SAVE_TO_FILE should leave the registry untouched")
        void saveOnly() {
            orchestrator.processStates(Map.of(0, PipelineFixtures.state()), false, OutputMode.SAVE_TO_FILE,
                RowStatusListener.noop());

            assertThat(registry.names()).isEmpty();
            assertThat(saver.fileNames()).containsExactly(LAB_OUTPUT + ".csv");
        }

        @Test
        @DisplayName("can outputs should only be published on request")
        void canOnRequest() {
            Map<Integer, CompositeState> states = Map.of(0, PipelineFixtures.state(Map.of("can_scatter", PipelineFixtures.CAN)));

            orchestrator.processStates(states, false, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());
            assertThat(registry.names()).containsExactly(LAB_OUTPUT);

            orchestrator.processStates(BatchStates.of(states), BatchOptions.defaults().withSaveCan(true),
                RowStatusListener.noop());
            assertThat(registry.names()).contains(LAB_OUTPUT + "_can");
        }

        @Test
        @DisplayName("rows with the same base name should not overwrite each other")
        void distinctNames() {
            Map<Integer, CompositeState> states = Map.of(
                0, PipelineFixtures.state(),
                1, PipelineFixtures.state(Map.of("scale_factor", 2.0)));

            orchestrator.processStates(states, false, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            assertThat(registry.names()).containsExactlyInAnyOrder(
                "SANS2D00022024_row0_lab_1D_2.0_10.0", "SANS2D00022024_row1_lab_1D_2.0_10.0");
        }

        @Test
        @DisplayName("a merged row should report the fitted scale")
        void mergedScale() {
            Map<Integer, CompositeState> states = Map.of(0, PipelineFixtures.state(Map.of(
                "reduction_mode", "MERGED", "merge_fit_mode", "SCALE_ONLY")));

            BatchReport report = orchestrator.processStates(states, false, OutputMode.PUBLISH_TO_ADS,
                RowStatusListener.noop());

            RowOutcome outcome = report.outcome(0).orElseThrow();
            assertThat(outcome.state()).isEqualTo(RowRunState.SUCCESS);
            assertThat(outcome.scales()).singleElement().satisfies(s -> assertThat(s).isCloseTo(1.25, within(0.05)));
            assertThat(outcome.shifts()).containsExactly(0.0);
            assertThat(registry.names()).contains("SANS2D00022024_merged_1D_2.0_10.0",
                "SANS2D00022024_hab_scaled_1D_2.0_10.0");
        }
    }

    @Nested
    @DisplayName("Optimizations")
    class Optimizations {

        @Test
        @DisplayName("with optimizations each run should be loaded once per batch")
        void loadsOnce() {
            orchestrator.processStates(rows(3, Map.of("can_scatter", PipelineFixtures.CAN)), true,
                OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            assertThat(loader.loadCount(PipelineFixtures.SAMPLE)).isEqualTo(1);
            assertThat(loader.loadCount(PipelineFixtures.CAN)).isEqualTo(1);
        }

        @Test
        @DisplayName("without optimizations every row should load its own runs")
        void loadsPerRow() {
            orchestrator.processStates(rows(3, Map.of()), false, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            assertThat(loader.loadCount(PipelineFixtures.SAMPLE)).isEqualTo(3);
        }

        @Test
        @DisplayName("optimizations should not change the results")
        void sameResults() {
            Map<Integer, CompositeState> states = rows(2, Map.of("can_scatter", PipelineFixtures.CAN));
            InMemoryResultRegistry plainRegistry = new InMemoryResultRegistry();
            new BatchOrchestrator(new ArrayReductionEngine(), FakeRunLoader.standard(), plainRegistry, new RecordingSaver())
                .processStates(states, false, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            orchestrator.processStates(states, true, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            for (String name : plainRegistry.names()) {
                assertThat(registry.retrieve(name)).get()
                    .satisfies(w -> assertThat(w.readY(0)).containsExactly(plainRegistry.retrieve(name).orElseThrow().readY(0)));
            }
            assertThat(registry.names()).isEqualTo(plainRegistry.names());
        }

        @Test
        @DisplayName("a merged row should not reuse a can reduced for a single-bank row")
        void sharedCanAcrossModes() {
            Map<Integer, CompositeState> states = new LinkedHashMap<>();
            states.put(0, PipelineFixtures.state(Map.of("can_scatter", PipelineFixtures.CAN,
                "reduction_mode", "LAB", "output_name", "single")));
            states.put(1, PipelineFixtures.state(Map.of("can_scatter", PipelineFixtures.CAN,
                "reduction_mode", "MERGED", "merge_fit_mode", "SCALE_ONLY", "output_name", "merged")));
            InMemoryResultRegistry plainRegistry = new InMemoryResultRegistry();
            BatchReport plain = new BatchOrchestrator(new ArrayReductionEngine(), FakeRunLoader.standard(),
                plainRegistry, new RecordingSaver())
                .processStates(states, false, OutputMode.PUBLISH_TO_ADS, RowStatusListener.noop());

            BatchReport optimized = orchestrator.processStates(states, true, OutputMode.PUBLISH_TO_ADS,
                RowStatusListener.noop());

            assertThat(plain.failedRows()).isEmpty();
            assertThat(optimized.failedRows()).isEmpty();
            assertThat(optimized.succeededRows()).containsExactlyInAnyOrder(0, 1);
            assertThat(registry.names()).isEqualTo(plainRegistry.names());
            for (String name : plainRegistry.names()) {
                assertThat(registry.retrieve(name).orElseThrow().readY(0))
                    .containsExactly(plainRegistry.retrieve(name).orElseThrow().readY(0));
            }
        }
    }
}
