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

import io.sansred.state.fragment.DataState;
import io.sansred.state.fragment.SaveState;
import io.sansred.state.fragment.ScaleState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// One row of a batch: its position in the batch and the columns given for it.
///
/// Columns name runs and periods, an optional output name, an optional override user file and
/// the sample geometry. They are applied on top of whichever user file settings the row uses.
public record BatchRow(int index, SettingsMap columns) {

    public static final String USER_FILE = DataState.USER_FILE;

    public static final Set<String> COLUMNS = Set.copyOf(List.of(
        DataState.SAMPLE_SCATTER, DataState.SAMPLE_SCATTER_PERIOD,
        DataState.SAMPLE_TRANSMISSION, DataState.SAMPLE_TRANSMISSION_PERIOD,
        DataState.SAMPLE_DIRECT, DataState.SAMPLE_DIRECT_PERIOD,
        DataState.CAN_SCATTER, DataState.CAN_SCATTER_PERIOD,
        DataState.CAN_TRANSMISSION, DataState.CAN_TRANSMISSION_PERIOD,
        DataState.CAN_DIRECT, DataState.CAN_DIRECT_PERIOD,
        SaveState.OUTPUT_NAME, USER_FILE,
        ScaleState.THICKNESS, ScaleState.HEIGHT, ScaleState.WIDTH, ScaleState.SHAPE));

    public BatchRow {
        if (index < 0) {
            throw new IllegalArgumentException("row index must not be negative: " + index);
        }
        columns = columns == null ? SettingsMap.empty() : columns;
    }

    public static BatchRow of(int index, Map<String, ?> columns) {
        return new BatchRow(index, SettingsMap.of(columns));
    }

    /// @throws ConfigurationException naming the first column that is not a row column
    public void checkColumns() {
        for (String key : columns.keys()) {
            if (!COLUMNS.contains(key)) {
                throw new ConfigurationException(key, columns.asMap().get(key), "is not a batch row column");
            }
        }
    }

    public String sampleScatter() {
        return columns.getString(DataState.SAMPLE_SCATTER);
    }

    /// @return true when the row names no sample scatter run and is skipped
    public boolean isBlank() {
        return sampleScatter() == null;
    }

    public String userFile() {
        return columns.getString(USER_FILE);
    }

    public boolean hasUserFile() {
        return userFile() != null;
    }

    /// @return every column except the override user file
    public SettingsMap overrides() {
        Map<String, Object> out = new LinkedHashMap<>(columns.asMap());
        out.remove(USER_FILE);
        return SettingsMap.of(out);
    }
}
