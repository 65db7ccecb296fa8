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
import io.sansred.state.fragment.ConvertToQState;
import io.sansred.state.types.RangeStepType;
import io.sansred.state.types.ReductionDimensionality;

import static io.sansred.state.fragment.ConvertToQState.*;

public class ConvertToQStateBuilder extends StateFragmentBuilder<ConvertToQState> {

    private ReductionDimensionality dimensionality;
    private Double qMin;
    private Double qMax;
    private Double qStep;
    private RangeStepType qStepType;
    private Double qXyMax;
    private Double qXyStep;
    private Boolean useGravity;
    private Double radiusCutoff;
    private Double wavelengthCutoff;

    public ConvertToQStateBuilder() {
        super(Concern.CONVERT_TO_Q, ConvertToQState.KEYS);
    }

    public ConvertToQStateBuilder dimensionality(ReductionDimensionality dimensionality) {
        this.dimensionality = dimensionality;
        return this;
    }

    public ConvertToQStateBuilder qRange(Double min, Double max, Double step, RangeStepType type) {
        this.qMin = min;
        this.qMax = max;
        this.qStep = step;
        this.qStepType = type;
        return this;
    }

    public ConvertToQStateBuilder qXy(Double max, Double step) {
        this.qXyMax = max;
        this.qXyStep = step;
        return this;
    }

    public ConvertToQStateBuilder useGravity(Boolean useGravity) {
        this.useGravity = useGravity;
        return this;
    }

    public ConvertToQStateBuilder cutoffs(Double radius, Double wavelength) {
        this.radiusCutoff = radius;
        this.wavelengthCutoff = wavelength;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case DIMENSIONALITY -> dimensionality(settings.getEnum(key, ReductionDimensionality.class));
            case Q_MIN -> qMin = settings.getDouble(key);
            case Q_MAX -> qMax = settings.getDouble(key);
            case Q_STEP -> qStep = settings.getDouble(key);
            case Q_STEP_TYPE -> qStepType = settings.getEnum(key, RangeStepType.class);
            case Q_XY_MAX -> qXyMax = settings.getDouble(key);
            case Q_XY_STEP -> qXyStep = settings.getDouble(key);
            case USE_GRAVITY -> useGravity(settings.getBoolean(key));
            case RADIUS_CUTOFF -> radiusCutoff = settings.getDouble(key);
            case WAVELENGTH_CUTOFF -> wavelengthCutoff = settings.getDouble(key);
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected ConvertToQState create() {
        return new ConvertToQState(
            dimensionality == null ? ReductionDimensionality.ONE_DIM : dimensionality,
            qMin, qMax, qStep, qStepType == null ? RangeStepType.LIN : qStepType,
            qXyMax, qXyStep, useGravity != null && useGravity,
            radiusCutoff == null ? 0.0 : radiusCutoff,
            wavelengthCutoff == null ? 0.0 : wavelengthCutoff);
    }
}
