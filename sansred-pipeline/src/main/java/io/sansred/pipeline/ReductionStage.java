package io.sansred.pipeline;

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

/// The stages of a single-bank reduction, in the order they run.
public enum ReductionStage {
    /// select the events of one time slice; no-op without a slice window
    SLICE_EVENTS,
    /// keep only the spectra of the bundle's detector bank
    CROP_TO_BANK,
    MASK,
    MOVE,
    /// wavelength-dependent incident monitor adjustment
    NORMALIZE_TO_MONITOR,
    /// multiply the adjustment by the fitted sample transmission
    TRANSMISSION,
    /// convert to wavelength, then to Q as counts and normalization parts
    CONVERT_TO_Q,
    BACKGROUND_SUBTRACTION,
    /// absolute scaling by {@code scale_factor / volume}
    SCALE
}
