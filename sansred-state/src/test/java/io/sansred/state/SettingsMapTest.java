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

import io.sansred.state.types.ReductionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SettingsMap")
class SettingsMapTest {

    @Nested
    @DisplayName("typed reads")
    class TypedReads {

        @Test
        @DisplayName("should cast numeric strings")
        void shouldCastNumericStrings() {
            SettingsMap settings = SettingsMap.of(Map.of("a", "1.5", "b", " 7 ", "c", 3));

            assertThat(settings.getDouble("a")).isEqualTo(1.5);
            assertThat(settings.getInteger("b")).isEqualTo(7);
            assertThat(settings.getDouble("c")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should accept integral doubles as integers")
        void shouldAcceptIntegralDoubles() {
            SettingsMap settings = SettingsMap.of(Map.of("a", 2.0, "b", "4.0"));

            assertThat(settings.getInteger("a")).isEqualTo(2);
            assertThat(settings.getInteger("b")).isEqualTo(4);
        }

        @Test
        @DisplayName("should split comma separated lists")
        void shouldSplitLists() {
            SettingsMap settings = SettingsMap.of(Map.of("wl", "2.0, 4.0 6", "one", 5.0));

            assertThat(settings.getDoubleList("wl")).containsExactly(2.0, 4.0, 6.0);
            assertThat(settings.getDoubleList("one")).containsExactly(5.0);
        }

        @ParameterizedTest
        @ValueSource(strings = {"merged", "MERGED", " Merged "})
        @DisplayName("should read enums ignoring case")
        void shouldReadEnums(String raw) {
            assertThat(SettingsMap.of("mode", raw).getEnum("mode", ReductionMode.class))
                .isEqualTo(ReductionMode.MERGED);
        }

        @Test
        @DisplayName("should read boolean words")
        void shouldReadBooleans() {
            SettingsMap settings = SettingsMap.of(Map.of("a", "yes", "b", "False", "c", true));

            assertThat(settings.getBoolean("a")).isTrue();
            assertThat(settings.getBoolean("b")).isFalse();
            assertThat(settings.getBoolean("c")).isTrue();
        }
    }

    @Nested
    @DisplayName("absent values")
    class Absent {

        @Test
        @DisplayName("should treat blank strings and empty lists as absent")
        void shouldTreatBlankAsAbsent() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("blank", "   ");
            raw.put("empty", List.of());
            raw.put("nothing", null);
            SettingsMap settings = SettingsMap.of(raw);

            assertThat(settings.contains("blank")).isFalse();
            assertThat(settings.getString("blank")).isNull();
            assertThat(settings.getDoubleList("empty")).isNull();
            assertThat(settings.getInteger("nothing")).isNull();
            assertThat(settings.getDouble("missing")).isNull();
        }

        @Test
        @DisplayName("should drop null list elements")
        void shouldDropNullListElements() {
            SettingsMap settings = SettingsMap.of(Map.of("list", Arrays.asList(1, null, 2)));

            assertThat(settings.getIntegerList("list")).containsExactly(1, 2);
        }
    }

    @Nested
    @DisplayName("cast failures")
    class CastFailures {

        @Test
        @DisplayName("should name key and value when a number cannot be read")
        void shouldNameKeyAndValue() {
            SettingsMap settings = SettingsMap.of("q_min", "abc");

            assertThatThrownBy(() -> settings.getDouble("q_min"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("q_min")
                .hasMessageContaining("abc")
                .satisfies(e -> assertThat(((ConfigurationException) e).getKey()).isEqualTo("q_min"));
        }

        @Test
        @DisplayName("should reject fractional integers")
        void shouldRejectFractionalIntegers() {
            assertThatThrownBy(() -> SettingsMap.of("n", 2.5).getInteger("n"))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> SettingsMap.of("n", "2.5").getInteger("n"))
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a list where a single value is expected")
        void shouldRejectListForScalar() {
            assertThatThrownBy(() -> SettingsMap.of("x", List.of(1.0, 2.0)).getDouble("x"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("list");
        }

        @Test
        @DisplayName("should list the allowed constants for an unknown enum")
        void shouldListAllowedEnumConstants() {
            assertThatThrownBy(() -> SettingsMap.of("mode", "SIDEWAYS").getEnum("mode", ReductionMode.class))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MERGED");
        }
    }

    @Test
    @DisplayName("should overlay entries without changing the original")
    void shouldOverlay() {
        SettingsMap base = SettingsMap.of(Map.of("a", 1, "b", 2));
        SettingsMap merged = base.with(SettingsMap.of(Map.of("b", 3, "c", 4)));

        assertThat(merged.getInteger("a")).isEqualTo(1);
        assertThat(merged.getInteger("b")).isEqualTo(3);
        assertThat(merged.getInteger("c")).isEqualTo(4);
        assertThat(base.getInteger("b")).isEqualTo(2);
        assertThat(base.contains("c")).isFalse();
    }
}
