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
import io.sansred.state.fragment.WavelengthState;
import io.sansred.state.types.RangeStepType;

import java.util.List;

import static io.sansred.state.fragment.WavelengthState.*;

public class WavelengthStateBuilder extends StateFragmentBuilder<WavelengthState> {

    private List<Double> low;
    private List<Double> high;
    private Double step;
    private RangeStepType stepType;

    public WavelengthStateBuilder() {
        super(Concern.WAVELENGTH, WavelengthState.KEYS);
    }

    public WavelengthStateBuilder range(double low, double high) {
        return ranges(List.of(low), List.of(high));
    }

    public WavelengthStateBuilder ranges(List<Double> low, List<Double> high) {
        this.low = low;
        this.high = high;
        return this;
    }

    public WavelengthStateBuilder step(Double step, RangeStepType type) {
        this.step = step;
        this.stepType = type;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case LOW -> low = settings.getDoubleList(key);
            case HIGH -> high = settings.getDoubleList(key);
            case STEP -> step = settings.getDouble(key);
            case STEP_TYPE -> stepType = settings.getEnum(key, RangeStepType.class);
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected WavelengthState create() {
        return new WavelengthState(low, high, step, stepType);
    }
}
