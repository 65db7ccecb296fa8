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

/// One concern's slice of a reduction state.
///
/// Implementations are immutable records produced by their {@link StateFragmentBuilder}.
public interface StateFragment {

    Concern concern();

    /// Checks this fragment's own rules.
    ///
    /// @throws ValidationException naming every offending field
    void validate();

    /// @return true when the fragment holds no settings that would change a reduction
    boolean isDisabled();

    /// @return the flat settings that rebuild an equal fragment
    SettingsMap toSettings();
}
