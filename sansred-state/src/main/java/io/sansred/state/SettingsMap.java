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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/// An immutable, flat mapping of option name to raw value, as read from a user file or a batch
/// row.
///
/// Values may be strings, numbers, booleans or lists of those. The typed accessors cast on read,
/// so {@code "1.5"} reads as a double and {@code "2.0, 4.0"} reads as a list of two doubles.
/// Blank strings and empty lists read as absent. A value that cannot be cast raises
/// {@link ConfigurationException} naming the key and the value.
public final class SettingsMap {

    private static final SettingsMap EMPTY = new SettingsMap(Map.of());

    private final Map<String, Object> values;

    private SettingsMap(Map<String, Object> values) {
        this.values = values;
    }

    public static SettingsMap empty() {
        return EMPTY;
    }

    /// Copies the given entries. Null values are dropped.
    public static SettingsMap of(Map<String, ?> entries) {
        Map<String, Object> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> {
            if (k == null) {
                throw new ConfigurationException("settings key must not be null");
            }
            if (v != null) {
                copy.put(k.trim(), v instanceof List<?> list ? List.copyOf(dropNulls(list)) : v);
            }
        });
        return new SettingsMap(Collections.unmodifiableMap(copy));
    }

    public static SettingsMap of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return of(map);
    }

    private static List<Object> dropNulls(List<?> list) {
        List<Object> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o != null) {
                out.add(o);
            }
        }
        return out;
    }

    /// Returns a new map holding these entries overlaid by the given ones.
    public SettingsMap with(SettingsMap overrides) {
        if (overrides.values.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides.values);
        return of(merged);
    }

    public SettingsMap with(String key, Object value) {
        return with(of(key, value));
    }

    /// @return true if the key is present with a non-blank value
    public boolean contains(String key) {
        Object v = values.get(key);
        if (v == null) {
            return false;
        }
        if (v instanceof String s) {
            return !s.isBlank();
        }
        if (v instanceof List<?> l) {
            return !l.isEmpty();
        }
        return true;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object getRaw(String key) {
        return contains(key) ? values.get(key) : null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /// @return the entries sorted by key with numbers in canonical form, for stable fingerprints
    /// and diagnostics
    @SuppressWarnings("unchecked")
    public Map<String, Object> sorted() {
        return Collections.unmodifiableMap((Map<String, Object>) canonical(values));
    }

    public String getString(String key) {
        if (!contains(key)) {
            return null;
        }
        Object v = values.get(key);
        if (v instanceof List<?> || v instanceof Map<?, ?>) {
            throw new ConfigurationException(key, v, "expected a single text value");
        }
        return String.valueOf(v).trim();
    }

    public Double getDouble(String key) {
        return contains(key) ? toDouble(key, scalar(key)) : null;
    }

    public Integer getInteger(String key) {
        return contains(key) ? toInteger(key, scalar(key)) : null;
    }

    public Boolean getBoolean(String key) {
        if (!contains(key)) {
            return null;
        }
        Object v = scalar(key);
        if (v instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true", "yes", "on", "1":
                return true;
            case "false", "no", "off", "0":
                return false;
            default:
                throw new ConfigurationException(key, v, "expected a boolean");
        }
    }

    public List<Double> getDoubleList(String key) {
        return list(key, v -> toDouble(key, v));
    }

    public List<Integer> getIntegerList(String key) {
        return list(key, v -> toInteger(key, v));
    }

    public List<String> getStringList(String key) {
        return list(key, v -> String.valueOf(v).trim());
    }

    /// Reads an enum constant by name, ignoring case and treating {@code -} and spaces as
    /// {@code _}.
    public <E extends Enum<E>> E getEnum(String key, Class<E> type) {
        return contains(key) ? toEnum(key, scalar(key), type) : null;
    }

    public <E extends Enum<E>> List<E> getEnumList(String key, Class<E> type) {
        return list(key, v -> toEnum(key, v, type));
    }

    private Object scalar(String key) {
        Object v = values.get(key);
        if (v instanceof List<?> l) {
            if (l.size() == 1) {
                return l.get(0);
            }
            throw new ConfigurationException(key, v, "expected a single value but found a list");
        }
        if (v instanceof Map<?, ?>) {
            throw new ConfigurationException(key, v, "expected a single value but found a mapping");
        }
        return v;
    }

    private <T> List<T> list(String key, Function<Object, T> cast) {
        if (!contains(key)) {
            return null;
        }
        Object v = values.get(key);
        List<T> out = new ArrayList<>();
        if (v instanceof List<?> l) {
            for (Object element : l) {
                out.add(cast.apply(element));
            }
        } else if (v instanceof String s) {
            for (String part : s.split("[,\\s]+")) {
                if (!part.isBlank()) {
                    out.add(cast.apply(part));
                }
            }
        } else {
            out.add(cast.apply(v));
        }
        return List.copyOf(out);
    }

    private static Double toDouble(String key, Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, v, "expected a number", e);
        }
    }

    private static Integer toInteger(String key, Object v) {
        if (v instanceof Integer i) {
            return i;
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new ConfigurationException(key, v, "expected an integer");
            }
            return Math.toIntExact(n.longValue());
        }
        String text = String.valueOf(v).trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            if (text.matches("[+-]?\\d+\\.0*")) {
                return Integer.parseInt(text.substring(0, text.indexOf('.')));
            }
            throw new ConfigurationException(key, v, "expected an integer", e);
        }
    }

    private static <E extends Enum<E>> E toEnum(String key, Object v, Class<E> type) {
        if (type.isInstance(v)) {
            return type.cast(v);
        }
        String text = String.valueOf(v).trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return Enum.valueOf(type, text);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, v,
                "expected one of " + Arrays.toString(type.getEnumConstants()), e);
        }
    }

    /// Equality compares numbers by value, so {@code 1}, {@code 1L} and {@code 1.0} are equal.
    @Override
    public boolean equals(Object o) {
        return o instanceof SettingsMap other && canonical(values).equals(canonical(other.values));
    }

    @Override
    public int hashCode() {
        return canonical(values).hashCode();
    }

    private static Object canonical(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? (Object) n.longValue() : (Object) d;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(o -> out.add(canonical(o)));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new TreeMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), canonical(v)));
            return out;
        }
        return value;
    }

    @Override
    public String toString() {
        return "SettingsMap" + sorted();
    }
}
