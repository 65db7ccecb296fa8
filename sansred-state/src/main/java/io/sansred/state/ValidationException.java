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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// A fragment or composite state failed validation.
///
/// Carries every offending field with a description of what is wrong with it, so a batch
/// front end can point the user at exactly the columns to fix.
public class ValidationException extends ReductionException {

    private final String scope;
    private final Map<String, String> problems;

    public ValidationException(String scope, Map<String, String> problems) {
        super(describe(scope, problems));
        this.scope = scope;
        this.problems = Collections.unmodifiableMap(new LinkedHashMap<>(problems));
    }

    public ValidationException(String scope, String field, String problem) {
        this(scope, Map.of(field, problem));
    }

    private static String describe(String scope, Map<String, String> problems) {
        return "Invalid " + scope + " state: " + problems.entrySet().stream()
            .map(e -> e.getKey() + " " + e.getValue())
            .collect(Collectors.joining("; "));
    }

    /// @return the concern key, or {@code composite} for cross-fragment rules
    public String getScope() {
        return scope;
    }

    /// @return field name to problem description, in detection order
    public Map<String, String> getProblems() {
        return problems;
    }

    public List<String> getFields() {
        return List.copyOf(problems.keySet());
    }
}
