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

import java.util.List;

/// Detector bank placement. Translations are in metres, rotations in degrees about the beam
/// axis, beam centre positions in metres on the detector plane.
public record MoveState(
    double labX,
    double labY,
    double labZ,
    double habX,
    double habY,
    double habZ,
    double labRotation,
    double habRotation,
    Double labCentrePos1,
    Double labCentrePos2,
    Double habCentrePos1,
    Double habCentrePos2,
    double sampleOffset,
    String labDetectorName,
    String habDetectorName
) implements StateFragment {

    public static final String LAB_X = "lab_x_translation";
    public static final String LAB_Y = "lab_y_translation";
    public static final String LAB_Z = "lab_z_translation";
    public static final String HAB_X = "hab_x_translation";
    public static final String HAB_Y = "hab_y_translation";
    public static final String HAB_Z = "hab_z_translation";
    public static final String LAB_ROTATION = "lab_rotation";
    public static final String HAB_ROTATION = "hab_rotation";
    public static final String LAB_CENTRE_POS1 = "lab_centre_pos1";
    public static final String LAB_CENTRE_POS2 = "lab_centre_pos2";
    public static final String HAB_CENTRE_POS1 = "hab_centre_pos1";
    public static final String HAB_CENTRE_POS2 = "hab_centre_pos2";
    public static final String SAMPLE_OFFSET = "sample_offset";
    public static final String LAB_DETECTOR_NAME = "lab_detector_name";
    public static final String HAB_DETECTOR_NAME = "hab_detector_name";

    public static final List<String> KEYS = List.of(LAB_X, LAB_Y, LAB_Z, HAB_X, HAB_Y, HAB_Z,
        LAB_ROTATION, HAB_ROTATION, LAB_CENTRE_POS1, LAB_CENTRE_POS2, HAB_CENTRE_POS1, HAB_CENTRE_POS2,
        SAMPLE_OFFSET, LAB_DETECTOR_NAME, HAB_DETECTOR_NAME);

    /// Placement of one bank.
    public record BankMove(ReductionMode bank, double x, double y, double z, double rotation,
                           Double centrePos1, Double centrePos2, String detectorName) {

        public boolean hasCentre() {
            return centrePos1 != null && centrePos2 != null;
        }

        public boolean isIdentity() {
            return x == 0 && y == 0 && z == 0 && rotation == 0 && !hasCentre();
        }
    }

    @Override
    public Concern concern() {
        return Concern.MOVE;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.MOVE);
        v.bothOrNeither(labCentrePos1, LAB_CENTRE_POS1, labCentrePos2, LAB_CENTRE_POS2);
        v.bothOrNeither(habCentrePos1, HAB_CENTRE_POS1, habCentrePos2, HAB_CENTRE_POS2);
        for (double value : new double[]{labX, labY, labZ, habX, habY, habZ, labRotation, habRotation, sampleOffset}) {
            if (!Double.isFinite(value)) {
                v.add("translation", "must be finite");
                break;
            }
        }
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return bankMove(ReductionMode.LAB).isIdentity() && bankMove(ReductionMode.HAB).isIdentity()
            && sampleOffset == 0;
    }

    public String detectorName(ReductionMode bank) {
        return bank == ReductionMode.HAB ? habDetectorName : labDetectorName;
    }

    public BankMove bankMove(ReductionMode bank) {
        if (bank == ReductionMode.LAB) {
            return new BankMove(bank, labX, labY, labZ, labRotation, labCentrePos1, labCentrePos2, labDetectorName);
        }
        if (bank == ReductionMode.HAB) {
            return new BankMove(bank, habX, habY, habZ, habRotation, habCentrePos1, habCentrePos2, habDetectorName);
        }
        throw new IllegalArgumentException("not a detector bank: " + bank);
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            LAB_X, labX, LAB_Y, labY, LAB_Z, labZ, HAB_X, habX, HAB_Y, habY, HAB_Z, habZ,
            LAB_ROTATION, labRotation, HAB_ROTATION, habRotation,
            LAB_CENTRE_POS1, labCentrePos1, LAB_CENTRE_POS2, labCentrePos2,
            HAB_CENTRE_POS1, habCentrePos1, HAB_CENTRE_POS2, habCentrePos2,
            SAMPLE_OFFSET, sampleOffset, LAB_DETECTOR_NAME, labDetectorName, HAB_DETECTOR_NAME, habDetectorName);
    }
}
