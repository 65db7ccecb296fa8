package io.sansred.state.fragment;

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

import io.sansred.state.Concern;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragment;
import io.sansred.state.types.SliceTimeUnit;
import io.sansred.state.types.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/// Event slicing. Each (start, end) pair yields one independent reduction of the same row.
/// Windows may overlap; an empty fragment means the whole run is reduced once.
public record SliceEventState(
    List<Double> startTimes,
    List<Double> endTimes,
    SliceTimeUnit timeUnit
) implements StateFragment {

    public static final String START_TIME = "slice_start_time";
    public static final String END_TIME = "slice_end_time";
    public static final String TIME_UNIT = "slice_time_unit";

    public static final List<String> KEYS = List.of(START_TIME, END_TIME, TIME_UNIT);

    public SliceEventState {
        startTimes = Fragments.copy(startTimes);
        endTimes = Fragments.copy(endTimes);
    }

    @Override
    public Concern concern() {
        return Concern.SLICE;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.SLICE);
        v.require(timeUnit, TIME_UNIT);
        if (startTimes.isEmpty() != endTimes.isEmpty()) {
            v.bothOrNeither(startTimes.isEmpty() ? null : startTimes, START_TIME,
                endTimes.isEmpty() ? null : endTimes, END_TIME);
        } else if (startTimes.size() != endTimes.size()) {
            v.add(END_TIME, "must have as many entries as " + START_TIME
                + " (" + endTimes.size() + " vs " + startTimes.size() + ")");
        } else {
            for (int i = 0; i < startTimes.size(); i++) {
                v.ordered(startTimes.get(i), START_TIME, endTimes.get(i), END_TIME);
            }
        }
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return startTimes.isEmpty();
    }

    /// @return the slice windows in configuration order, in {@link #timeUnit()} units
    public List<TimeWindow> windows() {
        List<TimeWindow> windows = new ArrayList<>(startTimes.size());
        for (int i = 0; i < startTimes.size(); i++) {
            windows.add(new TimeWindow(startTimes.get(i), endTimes.get(i)));
        }
        return windows;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(START_TIME, startTimes, END_TIME, endTimes, TIME_UNIT, timeUnit);
    }
}
