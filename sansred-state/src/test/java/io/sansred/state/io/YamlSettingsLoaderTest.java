package io.sansred.state.io;

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

import io.sansred.state.ConfigurationException;
import io.sansred.state.InstrumentMetadata;
import io.sansred.state.SettingsMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("YamlSettingsLoader")
class YamlSettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should lift settings out of section headings")
    void shouldFlattenSections() {
        SettingsMap settings = YamlSettingsLoader.parseSettings("""
            wavelength:
              wavelength_low: [2.0]
              wavelength_high: [10.0]
            incident_monitor: 1
            reduction_mode: MERGED
            """, "inline");

        assertThat(settings.getDoubleList("wavelength_low")).containsExactly(2.0);
        assertThat(settings.getInteger("incident_monitor")).isEqualTo(1);
        assertThat(settings.getString("reduction_mode")).isEqualTo("MERGED");
        assertThat(settings.contains("wavelength")).isFalse();
    }

    @Test
    @DisplayName("should reject a setting given twice")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> YamlSettingsLoader.parseSettings("""
            q_min: 0.1
            q:
              q_min: 0.2
            """, "dup.yaml"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("q_min")
            .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("should reject settings nested too deeply")
    void shouldRejectDeepNesting() {
        assertThatThrownBy(() -> YamlSettingsLoader.parseSettings("""
            a:
              b:
                c: 1
            """, "deep.yaml"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("one level");
    }

    @Test
    @DisplayName("should resolve user files against the base directory")
    void shouldResolveAgainstBase() throws IOException {
        Files.writeString(tempDir.resolve("user.yaml"), "q_max: 0.4\n");
        YamlSettingsLoader loader = new YamlSettingsLoader(tempDir);

        assertThat(loader.load("user.yaml").getDouble("q_max")).isEqualTo(0.4);
        assertThat(loader.load("./user.yaml")).isSameAs(loader.load("user.yaml"));
    }

    @Test
    @DisplayName("should report a missing user file as a configuration error")
    void shouldReportMissingFile() {
        YamlSettingsLoader loader = new YamlSettingsLoader(tempDir);

        assertThatThrownBy(() -> loader.load("absent.yaml"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("should read an instrument description")
    void shouldReadInstrument() throws IOException {
        Path file = tempDir.resolve("sans2d.yaml");
        Files.writeString(file, """
            name: SANS2D
            parameters:
              default-incident-monitor-spectrum: 1
              monitor-spectra: [1, 2, 3, 4]
            """);

        InstrumentMetadata instrument = YamlSettingsLoader.readInstrument(file);

        assertThat(instrument.getName()).isEqualTo("SANS2D");
        assertThat(instrument.getInteger(InstrumentMetadata.DEFAULT_INCIDENT_MONITOR)).isEqualTo(1);
        assertThat(instrument.getMonitorSpectra()).containsExactly(1, 2, 3, 4);
    }
}
