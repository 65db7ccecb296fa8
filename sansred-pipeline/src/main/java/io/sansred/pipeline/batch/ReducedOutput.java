package io.sansred.pipeline.batch;

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

import io.sansred.pipeline.bundle.MergeBundle;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;
import io.sansred.state.types.WavRange;

/// One workspace a row produced, tagged with what it is and where it came from.
///
/// @param slice  the time window, or null when the row was not sliced
/// @param period the period, or 0 for single-period data
/// @param merge  the merge that produced the workspace, for merged and scaled HAB curves
public record ReducedOutput(ReductionMode mode, DataType dataType, WavRange range, TimeWindow slice, int period,
                            OutputKind kind, Workspace workspace, MergeBundle merge) {
}
