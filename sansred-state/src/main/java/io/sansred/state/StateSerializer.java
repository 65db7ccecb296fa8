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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/// JSON form of a {@link CompositeState}: the state version, the instrument and the settings of
/// each fragment keyed by concern. Reading validates exactly as building from settings does.
public final class StateSerializer {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private StateSerializer() {
    }

    public static String toJson(CompositeState state) {
        Map<String, Object> instrument = new LinkedHashMap<>();
        instrument.put("name", state.instrument().getName());
        instrument.put("parameters", state.instrument().getParameters().asMap());

        Map<String, Object> fragments = new LinkedHashMap<>();
        for (Concern concern : Concern.values()) {
            fragments.put(concern.key(), state.fragment(concern).toSettings().asMap());
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", state.version());
        root.put("instrument", instrument);
        root.put("fragments", fragments);
        return gson.toJson(root);
    }

    /// @throws ConfigurationException for malformed JSON or a different state version
    public static CompositeState fromJson(String json) {
        Map<String, Object> root;
        try {
            root = gson.fromJson(json, MAP_TYPE);
        } catch (JsonParseException e) {
            throw new ConfigurationException("state JSON could not be parsed: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new ConfigurationException("state JSON is empty");
        }
        Object version = root.get("version");
        if (!(version instanceof Number n) || n.intValue() != CompositeState.STATE_VERSION) {
            throw new ConfigurationException("version", version,
                "state version " + CompositeState.STATE_VERSION + " expected");
        }

        InstrumentMetadata instrument = InstrumentMetadata.unnamed();
        if (root.get("instrument") instanceof Map<?, ?> inst) {
            Object parameters = inst.get("parameters");
            instrument = new InstrumentMetadata(String.valueOf(inst.get("name")),
                parameters instanceof Map<?, ?> p ? SettingsMap.of(stringKeys(p)) : SettingsMap.empty());
        }

        Map<String, Object> settings = new LinkedHashMap<>();
        if (root.get("fragments") instanceof Map<?, ?> fragments) {
            for (Map.Entry<?, ?> entry : fragments.entrySet()) {
                Concern.fromKey(String.valueOf(entry.getKey()));
                if (entry.getValue() instanceof Map<?, ?> values) {
                    settings.putAll(stringKeys(values));
                }
            }
        }
        return CompositeState.fromSettings(SettingsMap.of(settings), instrument);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
