package io.sansred.pipeline.bundle;

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

import io.sansred.state.types.WavRange;

import java.util.Objects;
import java.util.Optional;

/// The results of reducing one bundle over one wavelength range. Parts are present when the
/// bundle asked for them; the transmission when the bundle carried transmission data.
public record ReducedSlice(WavRange wavRange, OutputBundle output, OutputPartsBundle parts,
                           OutputTransmissionBundle transmission) {

    public ReducedSlice {
        Objects.requireNonNull(wavRange, "wavRange");
        Objects.requireNonNull(output, "output");
    }

    public Optional<OutputPartsBundle> partsIfPresent() {
        return Optional.ofNullable(parts);
    }

    public Optional<OutputTransmissionBundle> transmissionIfPresent() {
        return Optional.ofNullable(transmission);
    }
}
