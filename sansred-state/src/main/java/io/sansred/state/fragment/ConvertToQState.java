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
import io.sansred.state.types.ReductionDimensionality;

import java.util.List;

/// Momentum transfer binning. Q is in inverse Angstrom; the radius cutoff is in mm and the
/// wavelength cutoff in Angstrom.
public record ConvertToQState(
    ReductionDimensionality dimensionality,
    Double qMin,
    Double qMax,
    Double qStep,
    RangeStepType qStepType,
    Double qXyMax,
    Double qXyStep,
    boolean useGravity,
    double radiusCutoff,
    double wavelengthCutoff
) implements StateFragment {

    public static final String DIMENSIONALITY = "reduction_dimensionality";
    public static final String Q_MIN = "q_min";
    public static final String Q_MAX = "q_max";
    public static final String Q_STEP = "q_step";
    public static final String Q_STEP_TYPE = "q_step_type";
    public static final String Q_XY_MAX = "q_xy_max";
    public static final String Q_XY_STEP = "q_xy_step";
    public static final String USE_GRAVITY = "use_gravity";
    public static final String RADIUS_CUTOFF = "radius_cutoff";
    public static final String WAVELENGTH_CUTOFF = "wavelength_cutoff";

    public static final List<String> KEYS = List.of(DIMENSIONALITY, Q_MIN, Q_MAX, Q_STEP, Q_STEP_TYPE,
        Q_XY_MAX, Q_XY_STEP, USE_GRAVITY, RADIUS_CUTOFF, WAVELENGTH_CUTOFF);

    @Override
    public Concern concern() {
        return Concern.CONVERT_TO_Q;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.CONVERT_TO_Q);
        v.require(dimensionality, DIMENSIONALITY);
        if (dimensionality == ReductionDimensionality.TWO_DIM) {
            v.require(qXyMax, Q_XY_MAX);
            v.require(qXyStep, Q_XY_STEP);
            v.positive(qXyMax, Q_XY_MAX);
            v.positive(qXyStep, Q_XY_STEP);
        } else {
            v.require(qMin, Q_MIN);
            v.require(qMax, Q_MAX);
            v.require(qStep, Q_STEP);
            v.require(qStepType, Q_STEP_TYPE);
            v.nonNegative(qMin, Q_MIN);
            v.ordered(qMin, Q_MIN, qMax, Q_MAX);
            v.positive(qStep, Q_STEP);
            v.check(qStepType != RangeStepType.LOG || qMin == null || qMin > 0, Q_MIN,
                "must be positive for LOG binning");
        }
        v.nonNegative(radiusCutoff, RADIUS_CUTOFF);
        v.nonNegative(wavelengthCutoff, WAVELENGTH_CUTOFF);
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return false;
    }

    public boolean isOneDimensional() {
        return dimensionality != ReductionDimensionality.TWO_DIM;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            DIMENSIONALITY, dimensionality, Q_MIN, qMin, Q_MAX, qMax, Q_STEP, qStep, Q_STEP_TYPE, qStepType,
            Q_XY_MAX, qXyMax, Q_XY_STEP, qXyStep, USE_GRAVITY, useGravity,
            RADIUS_CUTOFF, radiusCutoff, WAVELENGTH_CUTOFF, wavelengthCutoff);
    }
}
