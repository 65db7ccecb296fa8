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
import io.sansred.state.types.FitMode;
import io.sansred.state.types.ReductionMode;

import java.util.List;

/// Reduction mode and the LAB/HAB merge settings.
///
/// The merge fits {@code LAB ≈ scale · HAB + shift} over the fit window and stitches the curves
/// over the merge window. Either window defaults to the overlap of the two curves when unset.
public record ReductionState(
    ReductionMode reductionMode,
    FitMode mergeFitMode,
    double mergeShift,
    double mergeScale,
    Double mergeFitQMin,
    Double mergeFitQMax,
    Double mergeQMin,
    Double mergeQMax
) implements StateFragment {

    public static final String REDUCTION_MODE = "reduction_mode";
    public static final String MERGE_FIT_MODE = "merge_fit_mode";
    public static final String MERGE_SHIFT = "merge_shift";
    public static final String MERGE_SCALE = "merge_scale";
    public static final String MERGE_FIT_Q_MIN = "merge_fit_q_min";
    public static final String MERGE_FIT_Q_MAX = "merge_fit_q_max";
    public static final String MERGE_Q_MIN = "merge_q_min";
    public static final String MERGE_Q_MAX = "merge_q_max";

    public static final List<String> KEYS = List.of(REDUCTION_MODE, MERGE_FIT_MODE, MERGE_SHIFT, MERGE_SCALE,
        MERGE_FIT_Q_MIN, MERGE_FIT_Q_MAX, MERGE_Q_MIN, MERGE_Q_MAX);

    @Override
    public Concern concern() {
        return Concern.REDUCTION;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.REDUCTION);
        v.require(reductionMode, REDUCTION_MODE);
        v.require(mergeFitMode, MERGE_FIT_MODE);
        v.bothOrNeither(mergeFitQMin, MERGE_FIT_Q_MIN, mergeFitQMax, MERGE_FIT_Q_MAX);
        v.ordered(mergeFitQMin, MERGE_FIT_Q_MIN, mergeFitQMax, MERGE_FIT_Q_MAX);
        v.bothOrNeither(mergeQMin, MERGE_Q_MIN, mergeQMax, MERGE_Q_MAX);
        v.ordered(mergeQMin, MERGE_Q_MIN, mergeQMax, MERGE_Q_MAX);
        v.check(mergeScale != 0 && Double.isFinite(mergeScale), MERGE_SCALE, "must be finite and non-zero");
        v.check(Double.isFinite(mergeShift), MERGE_SHIFT, "must be finite");
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return false;
    }

    public boolean isMerged() {
        return reductionMode == ReductionMode.MERGED;
    }

    public List<ReductionMode> detectorBanks() {
        return reductionMode.detectorBanks();
    }

    public boolean hasFitWindow() {
        return mergeFitQMin != null && mergeFitQMax != null;
    }

    public boolean hasMergeWindow() {
        return mergeQMin != null && mergeQMax != null;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            REDUCTION_MODE, reductionMode, MERGE_FIT_MODE, mergeFitMode, MERGE_SHIFT, mergeShift,
            MERGE_SCALE, mergeScale, MERGE_FIT_Q_MIN, mergeFitQMin, MERGE_FIT_Q_MAX, mergeFitQMax,
            MERGE_Q_MIN, mergeQMin, MERGE_Q_MAX, mergeQMax);
    }
}
