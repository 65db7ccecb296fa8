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
import io.sansred.state.fragment.ReductionState;
import io.sansred.state.types.FitMode;
import io.sansred.state.types.ReductionMode;

import static io.sansred.state.fragment.ReductionState.*;

public class ReductionStateBuilder extends StateFragmentBuilder<ReductionState> {

    private ReductionMode reductionMode;
    private FitMode mergeFitMode;
    private Double mergeShift;
    private Double mergeScale;
    private Double mergeFitQMin;
    private Double mergeFitQMax;
    private Double mergeQMin;
    private Double mergeQMax;

    public ReductionStateBuilder() {
        super(Concern.REDUCTION, ReductionState.KEYS);
    }

    public ReductionStateBuilder reductionMode(ReductionMode mode) {
        this.reductionMode = mode;
        return this;
    }

    public ReductionStateBuilder mergeFitMode(FitMode mode) {
        this.mergeFitMode = mode;
        return this;
    }

    public ReductionStateBuilder mergeShift(Double shift) {
        this.mergeShift = shift;
        return this;
    }

    public ReductionStateBuilder mergeScale(Double scale) {
        this.mergeScale = scale;
        return this;
    }

    public ReductionStateBuilder mergeFitRange(Double qMin, Double qMax) {
        this.mergeFitQMin = qMin;
        this.mergeFitQMax = qMax;
        return this;
    }

    public ReductionStateBuilder mergeRange(Double qMin, Double qMax) {
        this.mergeQMin = qMin;
        this.mergeQMax = qMax;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case REDUCTION_MODE -> reductionMode(settings.getEnum(key, ReductionMode.class));
            case MERGE_FIT_MODE -> mergeFitMode(settings.getEnum(key, FitMode.class));
            case MERGE_SHIFT -> mergeShift(settings.getDouble(key));
            case MERGE_SCALE -> mergeScale(settings.getDouble(key));
            case MERGE_FIT_Q_MIN -> mergeFitQMin = settings.getDouble(key);
            case MERGE_FIT_Q_MAX -> mergeFitQMax = settings.getDouble(key);
            case MERGE_Q_MIN -> mergeQMin = settings.getDouble(key);
            case MERGE_Q_MAX -> mergeQMax = settings.getDouble(key);
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected ReductionState create() {
        return new ReductionState(
            reductionMode == null ? ReductionMode.LAB : reductionMode,
            mergeFitMode == null ? FitMode.NONE : mergeFitMode,
            mergeShift == null ? 0.0 : mergeShift,
            mergeScale == null ? 1.0 : mergeScale,
            mergeFitQMin, mergeFitQMax, mergeQMin, mergeQMax);
    }
}
