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
import io.sansred.pipeline.bundle.ReductionSettingsBundle;
import io.sansred.state.CompositeState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventSliceSplitter")
class EventSliceSplitterTest {

    private final EventSliceSplitter splitter = new EventSliceSplitter();

    private static ReductionSettingsBundle bundle(CompositeState state, ReductionMode bank) {
        return new ReductionSettingsBundle(0, state, DataType.SAMPLE, bank, false, 0,
            PipelineFixtures.detectors("s", 1.0), PipelineFixtures.monitors("s_monitors", 1.0), null, null, null);
    }

    @Test
    @DisplayName("should produce one bundle per window differing only in the window")
    void oneBundlePerWindow() {
        ReductionSettingsBundle source = bundle(PipelineFixtures.state(), ReductionMode.LAB);
        List<TimeWindow> windows = List.of(new TimeWindow(0, 50), new TimeWindow(25, 75), new TimeWindow(50, 100));

        List<ReductionSettingsBundle> split = splitter.split(source, windows);

        assertThat(split).hasSize(3);
        assertThat(split).extracting(ReductionSettingsBundle::sliceWindow).containsExactlyElementsOf(windows);
        assertThat(split).allSatisfy(b -> {
            assertThat(b.state()).isSameAs(source.state());
            assertThat(b.scatter()).isSameAs(source.scatter());
            assertThat(b.reductionMode()).isEqualTo(ReductionMode.LAB);
        });
        assertThat(split).extracting(ReductionSettingsBundle::identity).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("no windows should return the bundle itself")
    void noWindows() {
        ReductionSettingsBundle source = bundle(PipelineFixtures.state(), ReductionMode.LAB);

        assertThat(splitter.split(source, List.of())).containsExactly(source);
        assertThat(splitter.split(source)).singleElement().isSameAs(source);
    }

    @Test
    @DisplayName("should take windows from the slice settings of the state")
    void windowsFromState() {
        CompositeState state = PipelineFixtures.state(Map.of(
            "slice_start_time", List.of(0.0, 40.0),
            "slice_end_time", List.of(40.0, 100.0)));

        List<ReductionSettingsBundle> split = splitter.split(bundle(state, ReductionMode.HAB));

        assertThat(split).extracting(ReductionSettingsBundle::sliceWindow)
            .containsExactly(new TimeWindow(0, 40), new TimeWindow(40, 100));
        assertThat(split).allMatch(ReductionSettingsBundle::isSliced);
    }

    @Test
    @DisplayName("grouping should keep window order and collect every bank under its window")
    void groupsByWindow() {
        CompositeState state = PipelineFixtures.state(Map.of(
            "slice_start_time", List.of(50.0, 0.0),
            "slice_end_time", List.of(100.0, 50.0)));

        Map<TimeWindow, List<ReductionSettingsBundle>> grouped = splitter.splitByWindow(
            List.of(bundle(state, ReductionMode.LAB), bundle(state, ReductionMode.HAB)));

        assertThat(grouped.keySet()).containsExactly(new TimeWindow(50, 100), new TimeWindow(0, 50));
        assertThat(grouped.values()).allSatisfy(group -> assertThat(group)
            .extracting(ReductionSettingsBundle::reductionMode)
            .containsExactly(ReductionMode.LAB, ReductionMode.HAB));
    }

    @Test
    @DisplayName("unsliced bundles should be grouped under no window")
    void unslicedGroup() {
        ReductionSettingsBundle lab = bundle(PipelineFixtures.state(), ReductionMode.LAB);

        Map<TimeWindow, List<ReductionSettingsBundle>> grouped = splitter.splitByWindow(List.of(lab));

        assertThat(grouped).hasSize(1).containsKey(null);
        assertThat(grouped.get(null)).containsExactly(lab);
    }
}
