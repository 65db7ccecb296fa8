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

import java.util.List;

/// Which detector bank(s) a reduction covers.
///
/// {@link #LAB} and {@link #HAB} are the single-bank modes that a core reduction runs in.
/// {@link #MERGED} reduces both banks and stitches them; {@link #ALL} reduces both and keeps
/// them separate.
public enum ReductionMode {
    LAB("lab"),
    HAB("hab"),
    MERGED("merged"),
    ALL("all");

    private final String token;

    ReductionMode(String token) {
        this.token = token;
    }

    /// @return the lower-case name used in output names
    public String token() {
        return token;
    }

    public boolean isDetectorBank() {
        return this == LAB || this == HAB;
    }

    /// @return the single-bank modes this mode reduces, in LAB, HAB order
    public List<ReductionMode> detectorBanks() {
        return switch (this) {
            case LAB -> List.of(LAB);
            case HAB -> List.of(HAB);
            case MERGED, ALL -> List.of(LAB, HAB);
        };
    }
}
