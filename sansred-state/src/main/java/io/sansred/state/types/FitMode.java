package io.sansred.state.types;

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

/// How the LAB/HAB merge determines its scale and shift.
public enum FitMode {
    /// fit scale and shift together
    BOTH,
    /// fit scale, use the configured shift
    SCALE_ONLY,
    /// fit shift, use the configured scale
    SHIFT_ONLY,
    /// use the configured scale and shift as given
    NONE;

    public boolean fitsScale() {
        return this == BOTH || this == SCALE_ONLY;
    }

    public boolean fitsShift() {
        return this == BOTH || this == SHIFT_ONLY;
    }
}
