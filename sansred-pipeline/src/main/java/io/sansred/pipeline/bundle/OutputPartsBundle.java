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

import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.CompositeState;
import io.sansred.state.types.WavRange;

/// The numerator and denominator of a reduced curve, kept apart so they can be summed across
/// detector banks before dividing.
public record OutputPartsBundle(CompositeState state, BundleIdentity identity, WavRange wavRange,
                                Workspace counts, Workspace normalization) {
}
