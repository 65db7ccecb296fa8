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

/// A settings value could not be read or cast to the type its field requires, or a
/// configuration source could not be loaded.
public class ConfigurationException extends ReductionException {

    private final String key;
    private final Object value;

    public ConfigurationException(String message) {
        this(null, null, message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public ConfigurationException(String key, Object value, String message) {
        this(key, value, message, null);
    }

    public ConfigurationException(String key, Object value, String message, Throwable cause) {
        super(key == null ? message : "Setting '" + key + "' = '" + value + "': " + message, cause);
        this.key = key;
        this.value = value;
    }

    /// @return the settings key at fault, or null when the failure is not tied to one key
    public String getKey() {
        return key;
    }

    /// @return the offending raw value, or null
    public Object getValue() {
        return value;
    }
}
