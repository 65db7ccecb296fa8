package io.sansred.state;

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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Read-only description of the instrument a batch runs against: its name and a set of named
/// parameters supplying defaults for unset fields.
public final class InstrumentMetadata {

    public static final String DEFAULT_INCIDENT_MONITOR = "default-incident-monitor-spectrum";
    public static final String DEFAULT_TRANSMISSION_MONITOR = "default-transmission-monitor-spectrum";
    public static final String MONITOR_SPECTRA = "monitor-spectra";
    public static final String LAB_DETECTOR_NAME = "lab-detector-name";
    public static final String HAB_DETECTOR_NAME = "hab-detector-name";

    private final String name;
    private final SettingsMap parameters;

    public InstrumentMetadata(String name, SettingsMap parameters) {
        this.name = Objects.requireNonNull(name, "instrument name");
        this.parameters = parameters == null ? SettingsMap.empty() : parameters;
    }

    public InstrumentMetadata(String name, Map<String, ?> parameters) {
        this(name, SettingsMap.of(parameters));
    }

    public static InstrumentMetadata unnamed() {
        return new InstrumentMetadata("", SettingsMap.empty());
    }

    public String getName() {
        return name;
    }

    public SettingsMap getParameters() {
        return parameters;
    }

    public boolean hasParameter(String key) {
        return parameters.contains(key);
    }

    public Integer getInteger(String key) {
        return parameters.getInteger(key);
    }

    public String getString(String key) {
        return parameters.getString(key);
    }

    /// @return the declared monitor spectra, or an empty list when the instrument declares none
    public List<Integer> getMonitorSpectra() {
        List<Integer> spectra = parameters.getIntegerList(MONITOR_SPECTRA);
        return spectra == null ? List.of() : spectra;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InstrumentMetadata other
            && name.equals(other.name) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters);
    }

    @Override
    public String toString() {
        return "InstrumentMetadata{" + name + ", " + parameters.sorted() + "}";
    }
}
