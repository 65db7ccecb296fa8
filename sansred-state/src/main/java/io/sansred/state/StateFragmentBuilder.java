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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Base for the per-concern builders.
///
/// Fields arrive either through the typed setters of a subclass, through the generic
/// {@link #set(String, Object)}, or in bulk through {@link #applySettings(SettingsMap)}.
/// {@link #applyInstrumentDefaults(InstrumentMetadata)} then fills whatever is still unset.
/// {@link #build()} validates and returns an immutable fragment.
///
/// @param <T> the fragment type built
public abstract class StateFragmentBuilder<T extends StateFragment> {

    private final Concern concern;
    private final Set<String> keys;

    protected StateFragmentBuilder(Concern concern, List<String> keys) {
        this.concern = concern;
        this.keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    }

    public Concern concern() {
        return concern;
    }

    /// @return the settings keys this builder understands
    public Set<String> keys() {
        return keys;
    }

    /// Sets one field by its settings key. A null value clears the field.
    ///
    /// @throws ConfigurationException when the key is not a field of this concern or the value
    /// cannot be cast to the field's type
    public StateFragmentBuilder<T> set(String key, Object value) {
        if (!keys.contains(key)) {
            throw new ConfigurationException(key, value, "not a field of concern '" + concern.key() + "'");
        }
        apply(key, SettingsMap.of(key, value));
        return this;
    }

    /// Copies every key of this concern that is present in the given settings. Other keys are
    /// ignored.
    public StateFragmentBuilder<T> applySettings(SettingsMap settings) {
        for (String key : keys) {
            if (settings.contains(key)) {
                apply(key, settings);
            }
        }
        return this;
    }

    /// Fills unset fields from instrument defaults. Explicit values are never overridden.
    public StateFragmentBuilder<T> applyInstrumentDefaults(InstrumentMetadata instrument) {
        return this;
    }

    public T build() {
        T fragment = create();
        fragment.validate();
        return fragment;
    }

    /// Reads {@code key} from {@code settings} with the field's typed accessor and stores it.
    /// An absent key stores null.
    protected abstract void apply(String key, SettingsMap settings);

    protected abstract T create();
}
