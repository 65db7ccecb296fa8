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

import java.util.Map;

/// A handle on histogram data: one or more spectra, each with bin edges X and values Y with
/// errors E, plus the instrument geometry and run metadata.
///
/// The pipeline treats workspaces handed to it as read-only. Numeric kernels return new
/// workspaces; the write methods are only called on workspaces the caller has just created.
/// Loaded and published workspaces may be read by several rows at once.
public interface Workspace {

    String name();

    int spectrumCount();

    int spectrumNumber(int index);

    /// @return the index of the spectrum with the given number, or -1
    default int indexOf(int spectrumNumber) {
        for (int i = 0; i < spectrumCount(); i++) {
            if (spectrumNumber(i) == spectrumNumber) {
                return i;
            }
        }
        return -1;
    }

    /// @return a copy of the bin edges, one longer than the values
    double[] readX(int index);

    double[] readY(int index);

    double[] readE(int index);

    void writeY(int index, double[] values);

    void writeE(int index, double[] errors);

    /// @return true when the whole spectrum is masked
    boolean isMasked(int index);

    InstrumentGeometry geometry();

    void setGeometry(InstrumentGeometry geometry);

    Map<String, Object> runMetadata();

    /// @return the detector bank of the spectrum at the index, or null for monitors
    default ReductionMode bank(int index) {
        return geometry().bankOf(spectrumNumber(index));
    }
}
