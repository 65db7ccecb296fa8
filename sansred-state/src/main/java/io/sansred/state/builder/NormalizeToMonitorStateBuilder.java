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
import io.sansred.state.fragment.NormalizeToMonitorState;
import io.sansred.state.types.RebinType;

import static io.sansred.state.fragment.NormalizeToMonitorState.*;

public class NormalizeToMonitorStateBuilder extends StateFragmentBuilder<NormalizeToMonitorState> {

    private Integer incidentMonitor;
    private Double promptPeakMin;
    private Double promptPeakMax;
    private Double backgroundTofStart;
    private Double backgroundTofStop;
    private RebinType rebinType;

    public NormalizeToMonitorStateBuilder() {
        super(Concern.NORMALIZE_TO_MONITOR, NormalizeToMonitorState.KEYS);
    }

    public NormalizeToMonitorStateBuilder incidentMonitor(Integer spectrum) {
        this.incidentMonitor = spectrum;
        return this;
    }

    public NormalizeToMonitorStateBuilder promptPeak(Double min, Double max) {
        this.promptPeakMin = min;
        this.promptPeakMax = max;
        return this;
    }

    public NormalizeToMonitorStateBuilder backgroundWindow(Double start, Double stop) {
        this.backgroundTofStart = start;
        this.backgroundTofStop = stop;
        return this;
    }

    public NormalizeToMonitorStateBuilder rebinType(RebinType type) {
        this.rebinType = type;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case INCIDENT_MONITOR -> incidentMonitor(settings.getInteger(key));
            case PROMPT_PEAK_MIN -> promptPeakMin = settings.getDouble(key);
            case PROMPT_PEAK_MAX -> promptPeakMax = settings.getDouble(key);
            case BACKGROUND_TOF_START -> backgroundTofStart = settings.getDouble(key);
            case BACKGROUND_TOF_STOP -> backgroundTofStop = settings.getDouble(key);
            case REBIN_TYPE -> rebinType(settings.getEnum(key, RebinType.class));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    public NormalizeToMonitorStateBuilder applyInstrumentDefaults(InstrumentMetadata instrument) {
        if (incidentMonitor == null) {
            incidentMonitor = instrument.getInteger(InstrumentMetadata.DEFAULT_INCIDENT_MONITOR);
        }
        return this;
    }

    @Override
    protected NormalizeToMonitorState create() {
        return new NormalizeToMonitorState(incidentMonitor, promptPeakMin, promptPeakMax,
            backgroundTofStart, backgroundTofStop, rebinType == null ? RebinType.REBIN : rebinType);
    }
}
