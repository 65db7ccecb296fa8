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

import io.sansred.state.fragment.BackgroundSubtractionState;
import io.sansred.state.fragment.ConvertToQState;
import io.sansred.state.fragment.DataState;
import io.sansred.state.fragment.MaskState;
import io.sansred.state.fragment.MoveState;
import io.sansred.state.fragment.NormalizeToMonitorState;
import io.sansred.state.fragment.ReductionState;
import io.sansred.state.fragment.SaveState;
import io.sansred.state.fragment.ScaleState;
import io.sansred.state.fragment.SliceEventState;
import io.sansred.state.fragment.TransmissionState;
import io.sansred.state.fragment.Violations;
import io.sansred.state.fragment.WavelengthState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/// The complete, validated description of how one batch row is reduced: exactly one fragment
/// per {@link Concern}, plus the instrument metadata the fragments were defaulted from.
///
/// Instances are immutable and safe to share between threads. The {@code with*} methods return
/// validated copies.
public final class CompositeState {

    /// Incremented whenever the settings layout changes incompatibly.
    public static final int STATE_VERSION = 1;

    public static final String COMPOSITE_SCOPE = "composite";

    private static final Set<String> CAN_DATA_KEYS = Set.of(
        DataState.CAN_SCATTER, DataState.CAN_SCATTER_PERIOD, DataState.CAN_TRANSMISSION,
        DataState.CAN_TRANSMISSION_PERIOD, DataState.CAN_DIRECT, DataState.CAN_DIRECT_PERIOD,
        DataState.INSTRUMENT);

    private static final Set<Concern> NOT_AFFECTING_CAN = EnumSet.of(
        Concern.DATA, Concern.REDUCTION, Concern.BACKGROUND_SUBTRACTION, Concern.SAVE, Concern.SLICE);

    private final Map<Concern, StateFragment> fragments;
    private final InstrumentMetadata instrument;

    private CompositeState(Map<Concern, StateFragment> fragments, InstrumentMetadata instrument) {
        this.fragments = Collections.unmodifiableMap(new EnumMap<>(fragments));
        this.instrument = instrument;
    }

    /// Builds every fragment from the given settings, fills instrument defaults and validates.
    ///
    /// @throws ConfigurationException when a value cannot be cast
    /// @throws ValidationException when a fragment or a cross-fragment rule fails
    public static CompositeState fromSettings(SettingsMap settings, InstrumentMetadata instrument) {
        Map<Concern, StateFragment> fragments = new EnumMap<>(Concern.class);
        for (Concern concern : Concern.values()) {
            fragments.put(concern, concern.newBuilder()
                .applySettings(settings)
                .applyInstrumentDefaults(instrument)
                .build());
        }
        CompositeState state = new CompositeState(fragments, instrument);
        state.validateCrossRules();
        return state;
    }

    public static Builder builder(InstrumentMetadata instrument) {
        return new Builder(instrument);
    }

    /// Validates every fragment, then the rules spanning several fragments. Repeated calls on the
    /// same state give the same outcome.
    public void validate() {
        fragments.values().forEach(StateFragment::validate);
        validateCrossRules();
    }

    private void validateCrossRules() {
        Violations v = new Violations(COMPOSITE_SCOPE);
        ReductionMode mode = reduction().reductionMode();
        if (!backgroundSubtraction().isDisabled() && mode == ReductionMode.ALL) {
            v.add(BackgroundSubtractionState.WORKSPACE, "cannot be combined with reduction mode ALL");
        }
        List<Integer> monitors = instrument.getMonitorSpectra();
        if (!monitors.isEmpty()) {
            Integer incident = normalizeToMonitor().incidentMonitor();
            v.check(incident == null || monitors.contains(incident), NormalizeToMonitorState.INCIDENT_MONITOR,
                "must be one of the instrument monitors " + monitors);
            Integer transmissionMonitor = transmission().transmissionMonitor();
            v.check(transmissionMonitor == null || monitors.contains(transmissionMonitor),
                TransmissionState.TRANSMISSION_MONITOR, "must be one of the instrument monitors " + monitors);
        }
        if (mode == ReductionMode.MERGED) {
            v.require(move().labDetectorName(), MoveState.LAB_DETECTOR_NAME);
            v.require(move().habDetectorName(), MoveState.HAB_DETECTOR_NAME);
        }
        boolean transmissionRuns = data().hasTransmission(DataType.SAMPLE) || data().hasTransmission(DataType.CAN);
        v.check(!transmissionRuns || transmission().transmissionMonitor() != null,
            TransmissionState.TRANSMISSION_MONITOR, "is required when transmission runs are given");
        v.throwIfAny();
    }

    public StateFragment fragment(Concern concern) {
        return fragments.get(concern);
    }

    public DataState data() {
        return (DataState) fragments.get(Concern.DATA);
    }

    public MaskState mask() {
        return (MaskState) fragments.get(Concern.MASK);
    }

    public MoveState move() {
        return (MoveState) fragments.get(Concern.MOVE);
    }

    public ReductionState reduction() {
        return (ReductionState) fragments.get(Concern.REDUCTION);
    }

    public NormalizeToMonitorState normalizeToMonitor() {
        return (NormalizeToMonitorState) fragments.get(Concern.NORMALIZE_TO_MONITOR);
    }

    public TransmissionState transmission() {
        return (TransmissionState) fragments.get(Concern.TRANSMISSION);
    }

    public WavelengthState wavelength() {
        return (WavelengthState) fragments.get(Concern.WAVELENGTH);
    }

    public ConvertToQState convertToQ() {
        return (ConvertToQState) fragments.get(Concern.CONVERT_TO_Q);
    }

    public BackgroundSubtractionState backgroundSubtraction() {
        return (BackgroundSubtractionState) fragments.get(Concern.BACKGROUND_SUBTRACTION);
    }

    public ScaleState scale() {
        return (ScaleState) fragments.get(Concern.SCALE);
    }

    public SaveState save() {
        return (SaveState) fragments.get(Concern.SAVE);
    }

    public SliceEventState slice() {
        return (SliceEventState) fragments.get(Concern.SLICE);
    }

    public InstrumentMetadata instrument() {
        return instrument;
    }

    public int version() {
        return STATE_VERSION;
    }

    /// @return a validated copy with one fragment replaced
    public CompositeState with(StateFragment replacement) {
        Map<Concern, StateFragment> copy = new EnumMap<>(fragments);
        replacement.validate();
        copy.put(replacement.concern(), replacement);
        CompositeState state = new CompositeState(copy, instrument);
        state.validateCrossRules();
        return state;
    }

    public CompositeState withSlice(SliceEventState slice) {
        return with(slice);
    }

    public CompositeState withReduction(ReductionState reduction) {
        return with(reduction);
    }

    /// @return the flat settings of every fragment, in concern order
    public SettingsMap toSettings() {
        Map<String, Object> all = new LinkedHashMap<>();
        for (StateFragment fragment : fragments.values()) {
            all.putAll(fragment.toSettings().asMap());
        }
        return SettingsMap.of(all);
    }

    /// @return a stable SHA-256 hex digest of every setting and the instrument
    public String fingerprint() {
        return digest(key -> true, concern -> true);
    }

    /// @return a digest over only the settings a can reduction depends on, so two rows sharing a
    /// can run and its processing share the digest
    public String canFingerprint() {
        return digest(CAN_DATA_KEYS::contains, concern -> !NOT_AFFECTING_CAN.contains(concern));
    }

    private String digest(Predicate<String> dataKeys, Predicate<Concern> concerns) {
        StringBuilder text = new StringBuilder("version=").append(STATE_VERSION).append('\n');
        text.append("instrument=").append(instrument.getName()).append(instrument.getParameters().sorted()).append('\n');
        for (Map.Entry<Concern, StateFragment> entry : fragments.entrySet()) {
            Concern concern = entry.getKey();
            boolean data = concern == Concern.DATA;
            if (!data && !concerns.test(concern)) {
                continue;
            }
            entry.getValue().toSettings().sorted().forEach((key, value) -> {
                if (!data || dataKeys.test(key)) {
                    text.append(key).append('=').append(value).append('\n');
                }
            });
        }
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompositeState other
            && fragments.equals(other.fragments) && instrument.equals(other.instrument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fragments, instrument);
    }

    @Override
    public String toString() {
        return "CompositeState{v" + STATE_VERSION + ", sample=" + data().sampleScatter()
            + ", mode=" + reduction().reductionMode() + "}";
    }

    /// Assembles a state from explicitly built fragments. Concerns left out are built from
    /// empty settings and instrument defaults.
    public static final class Builder {

        private final InstrumentMetadata instrument;
        private final Map<Concern, StateFragment> fragments = new EnumMap<>(Concern.class);

        private Builder(InstrumentMetadata instrument) {
            this.instrument = Objects.requireNonNull(instrument, "instrument");
        }

        public Builder with(StateFragment fragment) {
            fragments.put(fragment.concern(), fragment);
            return this;
        }

        public CompositeState build() {
            Map<Concern, StateFragment> complete = new EnumMap<>(fragments);
            for (Concern concern : Concern.values()) {
                complete.computeIfAbsent(concern,
                    c -> c.newBuilder().applyInstrumentDefaults(instrument).build());
            }
            CompositeState state = new CompositeState(complete, instrument);
            state.validate();
            return state;
        }
    }
}
