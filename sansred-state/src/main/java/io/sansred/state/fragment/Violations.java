package io.sansred.state.fragment;

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

import io.sansred.state.Concern;
import io.sansred.state.ValidationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/// Collects field problems during validation and raises them together.
public final class Violations {

    private final String scope;
    private final Map<String, String> problems = new LinkedHashMap<>();

    public Violations(Concern concern) {
        this(concern.key());
    }

    public Violations(String scope) {
        this.scope = scope;
    }

    public Violations add(String key, String problem) {
        problems.merge(key, problem, (a, b) -> a + ", " + b);
        return this;
    }

    public Violations check(boolean ok, String key, String problem) {
        return ok ? this : add(key, problem);
    }

    public Violations require(Object value, String key) {
        boolean missing = value == null || value instanceof Collection<?> c && c.isEmpty();
        return check(!missing, key, "is mandatory");
    }

    public Violations bothOrNeither(Object a, String keyA, Object b, String keyB) {
        if (a != null && b == null) {
            add(keyB, "must be set together with " + keyA);
        } else if (a == null && b != null) {
            add(keyA, "must be set together with " + keyB);
        }
        return this;
    }

    public Violations ordered(Double low, String lowKey, Double high, String highKey) {
        if (low != null && high != null && !(low < high)) {
            add(lowKey, "must be less than " + highKey + " (" + low + " >= " + high + ")");
        }
        return this;
    }

    public Violations positive(Number value, String key) {
        return check(value == null || value.doubleValue() > 0, key, "must be positive");
    }

    public Violations nonNegative(Number value, String key) {
        return check(value == null || value.doubleValue() >= 0, key, "must not be negative");
    }

    public boolean isEmpty() {
        return problems.isEmpty();
    }

    public void throwIfAny() {
        if (!problems.isEmpty()) {
            throw new ValidationException(scope, problems);
        }
    }
}
