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

import java.util.List;

/// Subtraction of a previously published background curve, multiplied by a scale factor, from
/// the reduced output.
public record BackgroundSubtractionState(
    String workspace,
    Double scaleFactor
) implements StateFragment {

    public static final String WORKSPACE = "background_workspace";
    public static final String SCALE_FACTOR = "background_scale_factor";

    public static final List<String> KEYS = List.of(WORKSPACE, SCALE_FACTOR);

    @Override
    public Concern concern() {
        return Concern.BACKGROUND_SUBTRACTION;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.BACKGROUND_SUBTRACTION);
        v.bothOrNeither(workspace, WORKSPACE, scaleFactor, SCALE_FACTOR);
        v.check(scaleFactor == null || Double.isFinite(scaleFactor), SCALE_FACTOR, "must be finite");
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return workspace == null;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(WORKSPACE, workspace, SCALE_FACTOR, scaleFactor);
    }
}
