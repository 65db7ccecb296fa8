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
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.MaskState;

import java.util.List;

import static io.sansred.state.fragment.MaskState.*;

public class MaskStateBuilder extends StateFragmentBuilder<MaskState> {

    private Double radiusMin;
    private Double radiusMax;
    private Double phiMin;
    private Double phiMax;
    private Boolean phiMirror;
    private List<Integer> spectra;
    private List<Integer> labSpectra;
    private List<Integer> habSpectra;
    private List<Double> timeStart;
    private List<Double> timeStop;
    private List<String> maskFiles;

    public MaskStateBuilder() {
        super(Concern.MASK, MaskState.KEYS);
    }

    public MaskStateBuilder radius(Double min, Double max) {
        this.radiusMin = min;
        this.radiusMax = max;
        return this;
    }

    public MaskStateBuilder phi(Double min, Double max) {
        this.phiMin = min;
        this.phiMax = max;
        return this;
    }

    public MaskStateBuilder phiMirror(Boolean mirror) {
        this.phiMirror = mirror;
        return this;
    }

    public MaskStateBuilder spectra(List<Integer> spectra) {
        this.spectra = spectra;
        return this;
    }

    public MaskStateBuilder labSpectra(List<Integer> spectra) {
        this.labSpectra = spectra;
        return this;
    }

    public MaskStateBuilder habSpectra(List<Integer> spectra) {
        this.habSpectra = spectra;
        return this;
    }

    public MaskStateBuilder timeWindows(List<Double> start, List<Double> stop) {
        this.timeStart = start;
        this.timeStop = stop;
        return this;
    }

    public MaskStateBuilder maskFiles(List<String> files) {
        this.maskFiles = files;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case RADIUS_MIN -> radiusMin = settings.getDouble(key);
            case RADIUS_MAX -> radiusMax = settings.getDouble(key);
            case PHI_MIN -> phiMin = settings.getDouble(key);
            case PHI_MAX -> phiMax = settings.getDouble(key);
            case PHI_MIRROR -> phiMirror(settings.getBoolean(key));
            case SPECTRA -> spectra(settings.getIntegerList(key));
            case LAB_SPECTRA -> labSpectra(settings.getIntegerList(key));
            case HAB_SPECTRA -> habSpectra(settings.getIntegerList(key));
            case TIME_START -> timeStart = settings.getDoubleList(key);
            case TIME_STOP -> timeStop = settings.getDoubleList(key);
            case FILES -> maskFiles(settings.getStringList(key));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected MaskState create() {
        return new MaskState(radiusMin, radiusMax, phiMin, phiMax, phiMirror == null || phiMirror,
            spectra, labSpectra, habSpectra, timeStart, timeStop, maskFiles);
    }
}
