package io.sansred.pipeline.engine;

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
import io.sansred.state.fragment.ConvertToQState;
import io.sansred.state.fragment.MaskState;
import io.sansred.state.fragment.MoveState;
import io.sansred.state.fragment.NormalizeToMonitorState;
import io.sansred.state.fragment.TransmissionState;
import io.sansred.state.fragment.WavelengthState;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.SliceTimeUnit;
import io.sansred.state.types.TimeWindow;
import io.sansred.state.types.WavRange;

/// The numeric kernels a reduction is composed of.
///
/// Every operation returns a new workspace and leaves its inputs unchanged, so inputs may be
/// shared between rows reduced in parallel. Failures are raised as unchecked exceptions and
/// reported by the caller against the stage that invoked the kernel.
public interface ReductionEngine {

    /// Keeps the part of the data recorded inside the window.
    Workspace sliceEvents(Workspace workspace, TimeWindow window, SliceTimeUnit unit);

    Workspace cropToBank(Workspace workspace, ReductionMode bank);

    Workspace mask(Workspace workspace, MaskState mask, ReductionMode bank);

    Workspace move(Workspace workspace, MoveState.BankMove move, double sampleOffset);

    /// Rebins every spectrum onto the wavelength binning of the range.
    Workspace convertToWavelength(Workspace workspace, WavelengthState wavelength, WavRange range);

    /// @return a single spectrum: the incident monitor on the wavelength binning of the range
    Workspace normalizeToMonitor(Workspace monitors, NormalizeToMonitorState normalize,
                                 WavelengthState wavelength, WavRange range);

    /// Computes the transmission from the monitor workspaces of a transmission and a direct run,
    /// each normalized by its incident monitor.
    TransmissionResult transmission(Workspace transmissionMonitors, Workspace directMonitors,
                                    TransmissionState transmission, int incidentMonitor,
                                    WavelengthState wavelength, WavRange range);

    /// Sums wavelength-binned counts and the per-wavelength adjustment into Q bins.
    QParts convertToQ(Workspace wavelengthCounts, Workspace wavelengthAdjustment, ConvertToQState q);

    /// Elementwise division with error propagation. Bins with a zero denominator become zero.
    Workspace divide(Workspace numerator, Workspace denominator);

    /// Elementwise product. A single-spectrum second operand applies to every spectrum.
    Workspace multiply(Workspace a, Workspace b);

    Workspace plus(Workspace a, Workspace b);

    Workspace minus(Workspace a, Workspace b);

    Workspace scale(Workspace workspace, double factor);

    /// @return a single-spectrum workspace with the X axis of the template's first spectrum
    Workspace create(String name, Workspace template, double[] y, double[] e);
}
