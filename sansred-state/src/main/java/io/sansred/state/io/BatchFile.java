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

import io.sansred.state.BatchRow;
import io.sansred.state.BatchStates;
import io.sansred.state.ConfigurationException;
import io.sansred.state.InstrumentMetadata;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateDirector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A batch definition read from YAML:
/// ```yaml
/// instrument: sans2d.yaml        # file name, or an inline {name, parameters} mapping
/// user_file: shared.yaml         # shared settings for every row
/// settings:                      # optional inline shared settings, applied over user_file
///   reduction_mode: MERGED
/// output_directory: out
/// rows:
///   - sample_scatter: SANS2D00022024.yaml
///     can_scatter: SANS2D00022025.yaml
///     output_name: first
///   - {}                         # blank row, skipped
/// ```
/// Relative paths resolve against the directory holding the batch file. Row indices follow file
/// order from 0.
public record BatchFile(
    Path source,
    InstrumentMetadata instrument,
    SettingsMap sharedSettings,
    Path outputDirectory,
    List<BatchRow> rows
) {

    private static final Set<String> TOP_LEVEL = Set.of("instrument", "user_file", "settings", "output_directory", "rows");

    public BatchFile {
        rows = List.copyOf(rows);
    }

    public static BatchFile read(Path path) {
        Path source = path.toAbsolutePath().normalize();
        return parse(YamlSettingsLoader.readText(source), source);
    }

    public static BatchFile parse(String yaml, Path source) {
        Object document = YamlSettingsLoader.loadYaml(yaml, source.toString());
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException(source + " must contain a batch mapping");
        }
        for (Object key : map.keySet()) {
            if (!TOP_LEVEL.contains(String.valueOf(key))) {
                throw new ConfigurationException(String.valueOf(key), map.get(key), "is not a batch file entry");
            }
        }
        Path base = source.getParent() == null ? Path.of(".") : source.getParent();

        InstrumentMetadata instrument = InstrumentMetadata.unnamed();
        Object inst = map.get("instrument");
        if (inst instanceof String file) {
            instrument = YamlSettingsLoader.readInstrument(base.resolve(file));
        } else if (inst != null) {
            instrument = YamlSettingsLoader.parseInstrument(inst, source + " instrument");
        }

        SettingsMap shared = SettingsMap.empty();
        if (map.get("user_file") instanceof String userFile) {
            shared = YamlSettingsLoader.readSettings(base.resolve(userFile))
                .with(BatchRow.USER_FILE, userFile);
        }
        if (map.get("settings") instanceof Map<?, ?> inline) {
            shared = shared.with(YamlSettingsLoader.flatten(inline, source + " settings"));
        }

        Object out = map.get("output_directory");
        Path outputDirectory = out == null ? base : base.resolve(String.valueOf(out));

        List<BatchRow> rows = new ArrayList<>();
        Object rowNode = map.get("rows");
        if (rowNode != null && !(rowNode instanceof List<?>)) {
            throw new ConfigurationException("rows", rowNode, "must be a list");
        }
        if (rowNode instanceof List<?> list) {
            for (Object row : list) {
                int index = rows.size();
                Map<String, Object> columns = new LinkedHashMap<>();
                if (row instanceof Map<?, ?> rowMap) {
                    rowMap.forEach((k, v) -> columns.put(String.valueOf(k), v));
                } else if (row != null) {
                    throw new ConfigurationException("rows[" + index + "]", row, "must be a mapping");
                }
                rows.add(BatchRow.of(index, columns));
            }
        }
        return new BatchFile(source, instrument, shared, outputDirectory, rows);
    }

    public Path baseDirectory() {
        return source.getParent() == null ? Path.of(".") : source.getParent();
    }

    public YamlSettingsLoader userFileLookup() {
        return new YamlSettingsLoader(baseDirectory());
    }

    public BatchStates createStates() {
        return new StateDirector(sharedSettings).createStates(rows, instrument, userFileLookup());
    }
}
