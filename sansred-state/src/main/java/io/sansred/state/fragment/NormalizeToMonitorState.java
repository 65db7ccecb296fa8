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
import io.sansred.state.types.RebinType;

import java.util.List;

/// Incident monitor normalization. The prompt peak window and the flat background window are in
/// the units of the monitor's raw axis.
public record NormalizeToMonitorState(
    Integer incidentMonitor,
    Double promptPeakMin,
    Double promptPeakMax,
    Double backgroundTofStart,
    Double backgroundTofStop,
    RebinType rebinType
) implements StateFragment {

    public static final String INCIDENT_MONITOR = "incident_monitor";
    public static final String PROMPT_PEAK_MIN = "prompt_peak_min";
    public static final String PROMPT_PEAK_MAX = "prompt_peak_max";
    public static final String BACKGROUND_TOF_START = "monitor_background_tof_start";
    public static final String BACKGROUND_TOF_STOP = "monitor_background_tof_stop";
    public static final String REBIN_TYPE = "monitor_rebin_type";

    public static final List<String> KEYS = List.of(INCIDENT_MONITOR, PROMPT_PEAK_MIN, PROMPT_PEAK_MAX,
        BACKGROUND_TOF_START, BACKGROUND_TOF_STOP, REBIN_TYPE);

    @Override
    public Concern concern() {
        return Concern.NORMALIZE_TO_MONITOR;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.NORMALIZE_TO_MONITOR);
        v.require(incidentMonitor, INCIDENT_MONITOR);
        v.positive(incidentMonitor, INCIDENT_MONITOR);
        v.bothOrNeither(promptPeakMin, PROMPT_PEAK_MIN, promptPeakMax, PROMPT_PEAK_MAX);
        v.ordered(promptPeakMin, PROMPT_PEAK_MIN, promptPeakMax, PROMPT_PEAK_MAX);
        v.bothOrNeither(backgroundTofStart, BACKGROUND_TOF_START, backgroundTofStop, BACKGROUND_TOF_STOP);
        v.ordered(backgroundTofStart, BACKGROUND_TOF_START, backgroundTofStop, BACKGROUND_TOF_STOP);
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return incidentMonitor == null;
    }

    public boolean hasPromptPeak() {
        return promptPeakMin != null && promptPeakMax != null;
    }

    public boolean hasBackgroundWindow() {
        return backgroundTofStart != null && backgroundTofStop != null;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            INCIDENT_MONITOR, incidentMonitor, PROMPT_PEAK_MIN, promptPeakMin, PROMPT_PEAK_MAX, promptPeakMax,
            BACKGROUND_TOF_START, backgroundTofStart, BACKGROUND_TOF_STOP, backgroundTofStop,
            REBIN_TYPE, rebinType);
    }
}
