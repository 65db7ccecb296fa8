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

import io.sansred.state.builder.SliceEventStateBuilder;
import io.sansred.state.fragment.SliceEventState;
import io.sansred.state.types.FitMode;
import io.sansred.state.types.ReductionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CompositeState")
class CompositeStateTest {

    @Test
    @DisplayName("should build one fragment per concern")
    void shouldHoldEveryConcern() {
        CompositeState state = StateFixtures.state();

        for (Concern concern : Concern.values()) {
            assertThat(state.fragment(concern)).isNotNull();
            assertThat(state.fragment(concern).concern()).isEqualTo(concern);
        }
        assertThat(state.version()).isEqualTo(CompositeState.STATE_VERSION);
        assertThat(state.normalizeToMonitor().incidentMonitor()).isEqualTo(1);
        assertThat(state.reduction().reductionMode()).isEqualTo(ReductionMode.LAB);
        assertThat(state.reduction().mergeFitMode()).isEqualTo(FitMode.NONE);
    }

    @Test
    @DisplayName("validation should be idempotent")
    void validationIsIdempotent() {
        CompositeState state = StateFixtures.state();

        assertThatNoException().isThrownBy(state::validate);
        assertThatNoException().isThrownBy(state::validate);
    }

    @Test
    @DisplayName("settings should round trip field for field")
    void settingsRoundTrip() {
        SettingsMap settings = StateFixtures.completeSettings().with(SettingsMap.of(Map.of(
            "reduction_mode", "MERGED",
            "merge_fit_mode", "BOTH",
            "mask_spectra", "5, 6",
            "slice_start_time", List.of(0.0, 10.0),
            "slice_end_time", List.of(10.0, 20.0),
            "can_scatter", "SANS2D00022025.yaml",
            "save_file_formats", "CSV RKH")));
        CompositeState state = CompositeState.fromSettings(settings, StateFixtures.instrument());

        CompositeState rebuilt = CompositeState.fromSettings(state.toSettings(), StateFixtures.instrument());

        assertThat(rebuilt).isEqualTo(state);
        for (Concern concern : Concern.values()) {
            assertThat(rebuilt.fragment(concern)).isEqualTo(state.fragment(concern));
        }
        assertThat(rebuilt.fingerprint()).isEqualTo(state.fingerprint());
    }

    @Nested
    @DisplayName("cross-fragment rules")
    class CrossRules {

        @Test
        @DisplayName("background subtraction cannot be used with ALL")
        void backgroundWithAllIsInvalid() {
            SettingsMap settings = StateFixtures.completeSettings().with(SettingsMap.of(Map.of(
                "reduction_mode", "ALL", "background_workspace", "bg1", "background_scale_factor", 1.0)));

            assertThatThrownBy(() -> CompositeState.fromSettings(settings, StateFixtures.instrument()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ALL")
                .satisfies(e -> assertThat(((ValidationException) e).getScope()).isEqualTo("composite"));
        }

        @Test
        @DisplayName("monitors must be declared by the instrument")
        void monitorMustBeDeclared() {
            SettingsMap settings = StateFixtures.completeSettings().with("incident_monitor", 9);

            assertThatThrownBy(() -> CompositeState.fromSettings(settings, StateFixtures.instrument()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("incident_monitor");
        }

        @Test
        @DisplayName("a merged reduction needs both detector names")
        void mergedNeedsDetectorNames() {
            InstrumentMetadata bare = new InstrumentMetadata("BARE",
                Map.of(InstrumentMetadata.DEFAULT_INCIDENT_MONITOR, 1));
            SettingsMap settings = StateFixtures.completeSettings().with("reduction_mode", "MERGED");

            assertThatThrownBy(() -> CompositeState.fromSettings(settings, bare))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hab_detector_name");
        }

        @Test
        @DisplayName("transmission runs need a transmission monitor")
        void transmissionNeedsMonitor() {
            InstrumentMetadata bare = new InstrumentMetadata("BARE",
                Map.of(InstrumentMetadata.DEFAULT_INCIDENT_MONITOR, 1));
            SettingsMap settings = StateFixtures.completeSettings().with(SettingsMap.of(Map.of(
                "sample_transmission", "T.yaml", "sample_direct", "D.yaml")));

            assertThatThrownBy(() -> CompositeState.fromSettings(settings, bare))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("transmission_monitor");
        }
    }

    @Test
    @DisplayName("copies should leave the original untouched")
    void copiesLeaveOriginal() {
        CompositeState state = StateFixtures.state();
        SliceEventState slice = new SliceEventStateBuilder().windows(List.of(0.0), List.of(5.0)).build();

        CompositeState sliced = state.withSlice(slice);

        assertThat(sliced.slice().windows()).hasSize(1);
        assertThat(state.slice().isDisabled()).isTrue();
        assertThat(sliced).isNotEqualTo(state);
    }

    @Nested
    @DisplayName("fingerprints")
    class Fingerprints {

        @Test
        @DisplayName("should be stable and sensitive to settings")
        void fingerprintStable() {
            CompositeState a = StateFixtures.state();
            CompositeState b = StateFixtures.state();
            CompositeState c = CompositeState.fromSettings(
                StateFixtures.completeSettings().with("q_max", 0.6), StateFixtures.instrument());

            assertThat(a.fingerprint()).isEqualTo(b.fingerprint()).hasSize(64);
            assertThat(c.fingerprint()).isNotEqualTo(a.fingerprint());
        }

        @Test
        @DisplayName("can fingerprint should ignore the sample runs and output settings")
        void canFingerprintIgnoresSample() {
            SettingsMap base = StateFixtures.completeSettings().with("can_scatter", "CAN.yaml");
            CompositeState first = CompositeState.fromSettings(base, StateFixtures.instrument());
            CompositeState second = CompositeState.fromSettings(
                base.with(SettingsMap.of(Map.of("sample_scatter", "OTHER.yaml", "output_name", "other"))),
                StateFixtures.instrument());
            CompositeState otherCan = CompositeState.fromSettings(
                base.with("can_scatter", "CAN2.yaml"), StateFixtures.instrument());

            assertThat(second.canFingerprint()).isEqualTo(first.canFingerprint());
            assertThat(second.fingerprint()).isNotEqualTo(first.fingerprint());
            assertThat(otherCan.canFingerprint()).isNotEqualTo(first.canFingerprint());
        }
    }

    @Test
    @DisplayName("builder should default concerns left out")
    void builderDefaultsMissingConcerns() {
        CompositeState state = StateFixtures.state();

        CompositeState assembled = CompositeState.builder(StateFixtures.instrument())
            .with(state.data())
            .with(state.wavelength())
            .with(state.convertToQ())
            .build();

        assertThat(assembled).isEqualTo(state);
    }
}
