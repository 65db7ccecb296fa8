package io.sansred.state.builder;

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
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.SliceEventState;
import io.sansred.state.types.SliceTimeUnit;

import java.util.List;

import static io.sansred.state.fragment.SliceEventState.*;

public class SliceEventStateBuilder extends StateFragmentBuilder<SliceEventState> {

    private List<Double> startTimes;
    private List<Double> endTimes;
    private SliceTimeUnit timeUnit;

    public SliceEventStateBuilder() {
        super(Concern.SLICE, SliceEventState.KEYS);
    }

    public SliceEventStateBuilder windows(List<Double> start, List<Double> end) {
        this.startTimes = start;
        this.endTimes = end;
        return this;
    }

    public SliceEventStateBuilder timeUnit(SliceTimeUnit unit) {
        this.timeUnit = unit;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case START_TIME -> startTimes = settings.getDoubleList(key);
            case END_TIME -> endTimes = settings.getDoubleList(key);
            case TIME_UNIT -> timeUnit(settings.getEnum(key, SliceTimeUnit.class));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected SliceEventState create() {
        return new SliceEventState(startTimes, endTimes, timeUnit == null ? SliceTimeUnit.SECONDS : timeUnit);
    }
}
