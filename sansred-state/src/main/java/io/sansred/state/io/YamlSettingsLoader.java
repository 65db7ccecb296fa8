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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// Reads user files and instrument files written as YAML.
///
/// A user file is a mapping of setting name to value. Settings may be grouped one level deep
/// under section headings, which are ignored:
/// ```yaml
/// wavelength:
///   wavelength_low: [2.0]
///   wavelength_high: [10.0]
/// incident_monitor: 1
/// ```
/// An instrument file has a {@code name} and a {@code parameters} mapping.
///
/// As a {@link UserFileLookup}, names resolve against a base directory and each file is read
/// once.
public class YamlSettingsLoader implements UserFileLookup {

    private static final Logger logger = LogManager.getLogger(YamlSettingsLoader.class);
    private static final LoadSettings loadSettings = LoadSettings.builder().setLabel("settings").build();

    private final Path baseDirectory;
    private final Map<Path, SettingsMap> loaded = new ConcurrentHashMap<>();

    public YamlSettingsLoader(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public SettingsMap load(String userFile) {
        return loaded.computeIfAbsent(resolve(userFile), YamlSettingsLoader::readSettings);
    }

    public Path resolve(String file) {
        return baseDirectory.resolve(file).normalize();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public static SettingsMap readSettings(Path path) {
        logger.debug("reading user file {}", path);
        return parseSettings(readText(path), path.toString());
    }

    public static SettingsMap parseSettings(String yaml, String origin) {
        Object document = loadYaml(yaml, origin);
        if (document == null) {
            return SettingsMap.empty();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException(origin + " must contain a mapping of setting names to values");
        }
        return flatten(map, origin);
    }

    /// Flattens a settings mapping, lifting entries of one level of section headings.
    public static SettingsMap flatten(Map<?, ?> map, String origin) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (entry.getValue() instanceof Map<?, ?> section) {
                for (Map.Entry<?, ?> inner : section.entrySet()) {
                    if (inner.getValue() instanceof Map<?, ?>) {
                        throw new ConfigurationException(key + "." + inner.getKey(), inner.getValue(),
                            "settings in " + origin + " may only be nested one level deep");
                    }
                    put(flat, String.valueOf(inner.getKey()), inner.getValue(), origin);
                }
            } else {
                put(flat, key, entry.getValue(), origin);
            }
        }
        return SettingsMap.of(flat);
    }

    private static void put(Map<String, Object> flat, String key, Object value, String origin) {
        if (flat.containsKey(key)) {
            throw new ConfigurationException(key, value, "is given more than once in " + origin);
        }
        flat.put(key, value);
    }

    public static InstrumentMetadata readInstrument(Path path) {
        logger.debug("reading instrument file {}", path);
        return parseInstrument(loadYaml(readText(path), path.toString()), path.toString());
    }

    /// Reads an instrument description node of the form {@code {name: X, parameters: {...}}}.
    public static InstrumentMetadata parseInstrument(Object node, String origin) {
        if (!(node instanceof Map<?, ?> map) || map.get("name") == null) {
            throw new ConfigurationException(origin + " must be a mapping with an instrument 'name'");
        }
        Object parameters = map.get("parameters");
        if (parameters != null && !(parameters instanceof Map<?, ?>)) {
            throw new ConfigurationException("parameters", parameters, "must be a mapping in " + origin);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        if (parameters instanceof Map<?, ?> p) {
            p.forEach((k, v) -> params.put(String.valueOf(k), v));
        }
        return new InstrumentMetadata(String.valueOf(map.get("name")), SettingsMap.of(params));
    }

    static Object loadYaml(String yaml, String origin) {
        try {
            return new Load(loadSettings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("could not parse YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    static String readText(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("could not read " + path + ": " + e.getMessage(), e);
        }
    }
}
