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
import io.sansred.state.io.UserFileLookup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Builds one {@link CompositeState} per batch row.
///
/// A row's state starts from the shared user file settings, or, when the row names its own user
/// file, from that file's settings alone. The row's columns are applied on top either way.
public class StateDirector {

    private static final Logger logger = LogManager.getLogger(StateDirector.class);

    private final SettingsMap sharedSettings;

    public StateDirector(SettingsMap sharedSettings) {
        this.sharedSettings = sharedSettings == null ? SettingsMap.empty() : sharedSettings;
    }

    /// @return the row's state, or empty when the row has no sample scatter run
    /// @throws RowConfigurationException when the row's settings cannot be read, cast or
    /// validated
    public Optional<CompositeState> createState(BatchRow row, InstrumentMetadata instrument, UserFileLookup lookup) {
        if (row.isBlank()) {
            logger.debug("row {} has no sample scatter run, skipping", row.index());
            return Optional.empty();
        }
        try {
            row.checkColumns();
            SettingsMap base = sharedSettings;
            if (row.hasUserFile()) {
                if (lookup == null) {
                    throw new ConfigurationException(BatchRow.USER_FILE, row.userFile(), "no user file lookup is available");
                }
                logger.debug("row {} uses override user file {}", row.index(), row.userFile());
                base = lookup.load(row.userFile()).with(DataState.USER_FILE, row.userFile());
            }
            SettingsMap settings = base.with(row.overrides());
            if (!settings.contains(DataState.INSTRUMENT) && !instrument.getName().isBlank()) {
                settings = settings.with(DataState.INSTRUMENT, instrument.getName());
            }
            CompositeState state = CompositeState.fromSettings(settings, instrument);
            logger.trace("row {} state {}", row.index(), state.fingerprint());
            return Optional.of(state);
        } catch (ReductionException | IllegalArgumentException e) {
            throw new RowConfigurationException(row.index(), e);
        }
    }

    public BatchStates createStates(List<BatchRow> rows, InstrumentMetadata instrument, UserFileLookup lookup) {
        Map<Integer, CompositeState> states = new LinkedHashMap<>();
        Map<Integer, String> errors = new LinkedHashMap<>();
        Set<Integer> skipped = new TreeSet<>();
        for (BatchRow row : rows) {
            try {
                Optional<CompositeState> state = createState(row, instrument, lookup);
                if (state.isPresent()) {
                    states.put(row.index(), state.get());
                } else {
                    skipped.add(row.index());
                }
            } catch (RowConfigurationException e) {
                logger.warn("{}", e.getMessage());
                errors.put(row.index(), e.getMessage());
            }
        }
        logger.info("built {} states, {} rows in error, {} skipped", states.size(), errors.size(), skipped.size());
        return new BatchStates(states, errors, skipped);
    }
}
