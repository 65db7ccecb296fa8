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
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;

import java.util.Objects;

/// Everything one core reduction needs: the state, the data role, the detector bank, and
/// handles to the loaded data. The transmission and direct handles are the monitor workspaces
/// of those runs and are both present or both absent.
///
/// @param period      1-based period the handles were taken from, 0 for single-period data
/// @param sliceWindow time window to keep, or null to reduce the whole run
public record ReductionSettingsBundle(
    int rowIndex,
    CompositeState state,
    DataType dataType,
    ReductionMode reductionMode,
    boolean outputParts,
    int period,
    Workspace scatter,
    Workspace scatterMonitor,
    Workspace transmission,
    Workspace direct,
    TimeWindow sliceWindow
) {

    public ReductionSettingsBundle {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(reductionMode, "reductionMode");
        Objects.requireNonNull(scatter, "scatter");
        Objects.requireNonNull(scatterMonitor, "scatterMonitor");
        if ((transmission == null) != (direct == null)) {
            throw new IllegalArgumentException("transmission and direct data must be given together");
        }
    }

    public boolean hasTransmission() {
        return transmission != null;
    }

    public boolean isSliced() {
        return sliceWindow != null;
    }

    /// @return a copy reducing only the given time window
    public ReductionSettingsBundle withSliceWindow(TimeWindow window) {
        return new ReductionSettingsBundle(rowIndex, state, dataType, reductionMode, outputParts, period,
            scatter, scatterMonitor, transmission, direct, window);
    }

    public ReductionSettingsBundle withReductionMode(ReductionMode mode) {
        return new ReductionSettingsBundle(rowIndex, state, dataType, mode, outputParts, period,
            scatter, scatterMonitor, transmission, direct, sliceWindow);
    }

    public BundleIdentity identity() {
        return new BundleIdentity(rowIndex, dataType, reductionMode, period, sliceWindow);
    }
}
