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

import io.sansred.pipeline.bundle.ReductionSettingsBundle;
import io.sansred.state.types.TimeWindow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Fans a bundle out into one bundle per time window. Windows are half-open and may overlap;
/// each copy differs from the source only in its slice window.
public class EventSliceSplitter {

    /// Splits by the windows of the bundle state's slice fragment.
    public List<ReductionSettingsBundle> split(ReductionSettingsBundle bundle) {
        return split(bundle, bundle.state().slice().windows());
    }

    /// @return one bundle per window in order, or the unmodified bundle alone when there are
    /// no windows
    public List<ReductionSettingsBundle> split(ReductionSettingsBundle bundle, List<TimeWindow> windows) {
        if (windows == null || windows.isEmpty()) {
            return List.of(bundle);
        }
        List<ReductionSettingsBundle> out = new ArrayList<>(windows.size());
        for (TimeWindow window : windows) {
            out.add(bundle.withSliceWindow(window));
        }
        return List.copyOf(out);
    }

    /// Splits every bundle and groups the results by window, in window order. Unsliced bundles
    /// are grouped under a null key.
    public Map<TimeWindow, List<ReductionSettingsBundle>> splitByWindow(List<ReductionSettingsBundle> bundles) {
        Map<TimeWindow, List<ReductionSettingsBundle>> byWindow = new LinkedHashMap<>();
        for (ReductionSettingsBundle bundle : bundles) {
            for (ReductionSettingsBundle sliced : split(bundle)) {
                byWindow.computeIfAbsent(sliced.sliceWindow(), w -> new ArrayList<>()).add(sliced);
            }
        }
        return byWindow;
    }
}
