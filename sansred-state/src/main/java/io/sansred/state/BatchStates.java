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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Result of building states for a whole batch: a state for each buildable row, an error
/// message for each row that could not be configured, and the rows skipped as blank.
public final class BatchStates {

    private final Map<Integer, CompositeState> states;
    private final Map<Integer, String> errors;
    private final Set<Integer> skipped;

    public BatchStates(Map<Integer, CompositeState> states, Map<Integer, String> errors, Set<Integer> skipped) {
        this.states = Collections.unmodifiableMap(new TreeMap<>(states));
        this.errors = Collections.unmodifiableMap(new TreeMap<>(errors));
        this.skipped = Collections.unmodifiableSet(new TreeSet<>(skipped));
    }

    public static BatchStates of(Map<Integer, CompositeState> states) {
        return new BatchStates(states, Map.of(), Set.of());
    }

    /// @return row index to state, ordered by row index
    public Map<Integer, CompositeState> states() {
        return states;
    }

    /// @return row index to configuration error message, ordered by row index
    public Map<Integer, String> errors() {
        return errors;
    }

    public Set<Integer> skipped() {
        return skipped;
    }

    public int rowCount() {
        return states.size() + errors.size() + skipped.size();
    }

    @Override
    public String toString() {
        return "BatchStates[states=" + states.size() + ", errors=" + errors.size() + ", skipped=" + skipped.size() + "]";
    }
}
