package io.sansred.state.fragment;

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

import io.sansred.state.Concern;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragment;
import io.sansred.state.types.ReductionMode;

import java.util.ArrayList;
import java.util.List;

/// Detector and time masking. Radii are in mm from the beam axis, angles in degrees.
public record MaskState(
    Double radiusMin,
    Double radiusMax,
    Double phiMin,
    Double phiMax,
    boolean phiMirror,
    List<Integer> spectra,
    List<Integer> labSpectra,
    List<Integer> habSpectra,
    List<Double> timeStart,
    List<Double> timeStop,
    List<String> maskFiles
) implements StateFragment {

    public static final String RADIUS_MIN = "mask_radius_min";
    public static final String RADIUS_MAX = "mask_radius_max";
    public static final String PHI_MIN = "mask_phi_min";
    public static final String PHI_MAX = "mask_phi_max";
    public static final String PHI_MIRROR = "mask_phi_mirror";
    public static final String SPECTRA = "mask_spectra";
    public static final String LAB_SPECTRA = "mask_lab_spectra";
    public static final String HAB_SPECTRA = "mask_hab_spectra";
    public static final String TIME_START = "mask_time_start";
    public static final String TIME_STOP = "mask_time_stop";
    public static final String FILES = "mask_files";

    public static final List<String> KEYS = List.of(RADIUS_MIN, RADIUS_MAX, PHI_MIN, PHI_MAX, PHI_MIRROR,
        SPECTRA, LAB_SPECTRA, HAB_SPECTRA, TIME_START, TIME_STOP, FILES);

    public MaskState {
        spectra = Fragments.copy(spectra);
        labSpectra = Fragments.copy(labSpectra);
        habSpectra = Fragments.copy(habSpectra);
        timeStart = Fragments.copy(timeStart);
        timeStop = Fragments.copy(timeStop);
        maskFiles = Fragments.copy(maskFiles);
    }

    @Override
    public Concern concern() {
        return Concern.MASK;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.MASK);
        v.bothOrNeither(radiusMin, RADIUS_MIN, radiusMax, RADIUS_MAX);
        v.ordered(radiusMin, RADIUS_MIN, radiusMax, RADIUS_MAX);
        v.nonNegative(radiusMin, RADIUS_MIN);
        v.bothOrNeither(phiMin, PHI_MIN, phiMax, PHI_MAX);
        v.ordered(phiMin, PHI_MIN, phiMax, PHI_MAX);
        v.check(timeStart.size() == timeStop.size(), TIME_STOP,
            "must have as many entries as " + TIME_START + " (" + timeStop.size() + " vs " + timeStart.size() + ")");
        if (timeStart.size() == timeStop.size()) {
            for (int i = 0; i < timeStart.size(); i++) {
                v.ordered(timeStart.get(i), TIME_START, timeStop.get(i), TIME_STOP);
            }
        }
        for (List<Integer> list : List.of(spectra, labSpectra, habSpectra)) {
            for (Integer spectrum : list) {
                v.positive(spectrum, list == spectra ? SPECTRA : list == labSpectra ? LAB_SPECTRA : HAB_SPECTRA);
            }
        }
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return radiusMin == null && phiMin == null && spectra.isEmpty() && labSpectra.isEmpty()
            && habSpectra.isEmpty() && timeStart.isEmpty() && maskFiles.isEmpty();
    }

    public boolean hasRadiusMask() {
        return radiusMin != null && radiusMax != null;
    }

    public boolean hasPhiMask() {
        return phiMin != null && phiMax != null;
    }

    /// @return spectra masked on every bank plus those masked on the given bank
    public List<Integer> spectraFor(ReductionMode bank) {
        List<Integer> all = new ArrayList<>(spectra);
        if (bank == ReductionMode.LAB) {
            all.addAll(labSpectra);
        } else if (bank == ReductionMode.HAB) {
            all.addAll(habSpectra);
        }
        return all;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            RADIUS_MIN, radiusMin, RADIUS_MAX, radiusMax, PHI_MIN, phiMin, PHI_MAX, phiMax,
            PHI_MIRROR, phiMirror, SPECTRA, spectra, LAB_SPECTRA, labSpectra, HAB_SPECTRA, habSpectra,
            TIME_START, timeStart, TIME_STOP, timeStop, FILES, maskFiles);
    }
}
