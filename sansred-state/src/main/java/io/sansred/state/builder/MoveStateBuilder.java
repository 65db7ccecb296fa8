package io.sansred.state.builder;

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
import io.sansred.state.InstrumentMetadata;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.MoveState;

import static io.sansred.state.fragment.MoveState.*;

public class MoveStateBuilder extends StateFragmentBuilder<MoveState> {

    private Double labX;
    private Double labY;
    private Double labZ;
    private Double habX;
    private Double habY;
    private Double habZ;
    private Double labRotation;
    private Double habRotation;
    private Double labCentrePos1;
    private Double labCentrePos2;
    private Double habCentrePos1;
    private Double habCentrePos2;
    private Double sampleOffset;
    private String labDetectorName;
    private String habDetectorName;

    public MoveStateBuilder() {
        super(Concern.MOVE, MoveState.KEYS);
    }

    public MoveStateBuilder labTranslation(Double x, Double y, Double z) {
        this.labX = x;
        this.labY = y;
        this.labZ = z;
        return this;
    }

    public MoveStateBuilder habTranslation(Double x, Double y, Double z) {
        this.habX = x;
        this.habY = y;
        this.habZ = z;
        return this;
    }

    public MoveStateBuilder labRotation(Double degrees) {
        this.labRotation = degrees;
        return this;
    }

    public MoveStateBuilder habRotation(Double degrees) {
        this.habRotation = degrees;
        return this;
    }

    public MoveStateBuilder labCentre(Double pos1, Double pos2) {
        this.labCentrePos1 = pos1;
        this.labCentrePos2 = pos2;
        return this;
    }

    public MoveStateBuilder habCentre(Double pos1, Double pos2) {
        this.habCentrePos1 = pos1;
        this.habCentrePos2 = pos2;
        return this;
    }

    public MoveStateBuilder sampleOffset(Double offset) {
        this.sampleOffset = offset;
        return this;
    }

    public MoveStateBuilder labDetectorName(String name) {
        this.labDetectorName = name;
        return this;
    }

    public MoveStateBuilder habDetectorName(String name) {
        this.habDetectorName = name;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case LAB_X -> labX = settings.getDouble(key);
            case LAB_Y -> labY = settings.getDouble(key);
            case LAB_Z -> labZ = settings.getDouble(key);
            case HAB_X -> habX = settings.getDouble(key);
            case HAB_Y -> habY = settings.getDouble(key);
            case HAB_Z -> habZ = settings.getDouble(key);
            case LAB_ROTATION -> labRotation(settings.getDouble(key));
            case HAB_ROTATION -> habRotation(settings.getDouble(key));
            case LAB_CENTRE_POS1 -> labCentrePos1 = settings.getDouble(key);
            case LAB_CENTRE_POS2 -> labCentrePos2 = settings.getDouble(key);
            case HAB_CENTRE_POS1 -> habCentrePos1 = settings.getDouble(key);
            case HAB_CENTRE_POS2 -> habCentrePos2 = settings.getDouble(key);
            case SAMPLE_OFFSET -> sampleOffset(settings.getDouble(key));
            case LAB_DETECTOR_NAME -> labDetectorName(settings.getString(key));
            case HAB_DETECTOR_NAME -> habDetectorName(settings.getString(key));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    public MoveStateBuilder applyInstrumentDefaults(InstrumentMetadata instrument) {
        if (labDetectorName == null) {
            labDetectorName = instrument.getString(InstrumentMetadata.LAB_DETECTOR_NAME);
        }
        if (habDetectorName == null) {
            habDetectorName = instrument.getString(InstrumentMetadata.HAB_DETECTOR_NAME);
        }
        return this;
    }

    @Override
    protected MoveState create() {
        return new MoveState(zero(labX), zero(labY), zero(labZ), zero(habX), zero(habY), zero(habZ),
            zero(labRotation), zero(habRotation), labCentrePos1, labCentrePos2, habCentrePos1, habCentrePos2,
            zero(sampleOffset), labDetectorName, habDetectorName);
    }

    private static double zero(Double value) {
        return value == null ? 0.0 : value;
    }
}
