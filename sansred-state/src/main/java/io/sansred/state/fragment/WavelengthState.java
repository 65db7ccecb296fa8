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
import io.sansred.state.types.RangeStepType;
import io.sansred.state.types.WavRange;

import java.util.ArrayList;
import java.util.List;

/// Wavelength ranges and binning. Each (low, high) pair is reduced separately.
public record WavelengthState(
    List<Double> low,
    List<Double> high,
    Double step,
    RangeStepType stepType
) implements StateFragment {

    public static final String LOW = "wavelength_low";
    public static final String HIGH = "wavelength_high";
    public static final String STEP = "wavelength_step";
    public static final String STEP_TYPE = "wavelength_step_type";

    public static final List<String> KEYS = List.of(LOW, HIGH, STEP, STEP_TYPE);

    public WavelengthState {
        low = Fragments.copy(low);
        high = Fragments.copy(high);
    }

    @Override
    public Concern concern() {
        return Concern.WAVELENGTH;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.WAVELENGTH);
        v.require(low, LOW);
        v.require(high, HIGH);
        v.require(step, STEP);
        v.require(stepType, STEP_TYPE);
        v.positive(step, STEP);
        if (low.size() != high.size()) {
            v.add(HIGH, "must have as many entries as " + LOW + " (" + high.size() + " vs " + low.size() + ")");
        } else {
            for (int i = 0; i < low.size(); i++) {
                v.ordered(low.get(i), LOW, high.get(i), HIGH);
            }
        }
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return low.isEmpty();
    }

    public List<WavRange> ranges() {
        List<WavRange> ranges = new ArrayList<>(low.size());
        for (int i = 0; i < low.size(); i++) {
            ranges.add(new WavRange(low.get(i), high.get(i)));
        }
        return ranges;
    }

    /// @return the range spanning every configured range
    public WavRange fullRange() {
        double lo = low.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double hi = high.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        return new WavRange(lo, hi);
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(LOW, low, HIGH, high, STEP, step, STEP_TYPE, stepType);
    }
}
