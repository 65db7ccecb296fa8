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

import java.util.Locale;

/// A closed wavelength interval in Angstrom. Reductions run once per range.
public record WavRange(double low, double high) {

    public WavRange {
        if (!(low < high)) {
            throw new IllegalArgumentException("wavelength range needs low < high, got " + low + ".." + high);
        }
    }

    public boolean contains(double wavelength) {
        return wavelength >= low && wavelength <= high;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%s, %s]", low, high);
    }
}
