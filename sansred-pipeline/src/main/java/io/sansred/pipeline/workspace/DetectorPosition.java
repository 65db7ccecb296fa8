package io.sansred.pipeline.workspace;

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

import io.sansred.state.types.ReductionMode;

/// Position of one detector pixel relative to the sample, in metres, with the beam along z.
public record DetectorPosition(int spectrum, ReductionMode bank, double x, double y, double z) {

    /// @return distance from the beam axis in metres
    public double radius() {
        return Math.hypot(x, y);
    }

    /// @return azimuthal angle in degrees, in (-180, 180]
    public double phiDegrees() {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /// @return the scattering angle 2θ in radians
    public double twoTheta() {
        return Math.atan2(radius(), z);
    }

    public DetectorPosition movedTo(double x, double y, double z) {
        return new DetectorPosition(spectrum, bank, x, y, z);
    }
}
