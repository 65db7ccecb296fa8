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

import io.sansred.state.builder.BackgroundSubtractionStateBuilder;
import io.sansred.state.builder.ConvertToQStateBuilder;
import io.sansred.state.builder.DataStateBuilder;
import io.sansred.state.builder.MaskStateBuilder;
import io.sansred.state.builder.MoveStateBuilder;
import io.sansred.state.builder.NormalizeToMonitorStateBuilder;
import io.sansred.state.builder.ReductionStateBuilder;
import io.sansred.state.builder.SaveStateBuilder;
import io.sansred.state.builder.ScaleStateBuilder;
import io.sansred.state.builder.SliceEventStateBuilder;
import io.sansred.state.builder.TransmissionStateBuilder;
import io.sansred.state.builder.WavelengthStateBuilder;

import java.util.function.Supplier;

/// The concerns a reduction state is partitioned into. A {@link CompositeState} holds exactly
/// one fragment per concern.
public enum Concern {
    DATA("data", DataStateBuilder::new),
    MASK("mask", MaskStateBuilder::new),
    MOVE("move", MoveStateBuilder::new),
    REDUCTION("reduction", ReductionStateBuilder::new),
    NORMALIZE_TO_MONITOR("normalize_to_monitor", NormalizeToMonitorStateBuilder::new),
    TRANSMISSION("transmission", TransmissionStateBuilder::new),
    WAVELENGTH("wavelength", WavelengthStateBuilder::new),
    CONVERT_TO_Q("convert_to_q", ConvertToQStateBuilder::new),
    BACKGROUND_SUBTRACTION("background_subtraction", BackgroundSubtractionStateBuilder::new),
    SCALE("scale", ScaleStateBuilder::new),
    SAVE("save", SaveStateBuilder::new),
    SLICE("slice", SliceEventStateBuilder::new);

    private final String key;
    private final Supplier<? extends StateFragmentBuilder<? extends StateFragment>> builders;

    Concern(String key, Supplier<? extends StateFragmentBuilder<? extends StateFragment>> builders) {
        this.key = key;
        this.builders = builders;
    }

    public String key() {
        return key;
    }

    /// @return a fresh, empty builder for this concern's fragment
    public StateFragmentBuilder<? extends StateFragment> newBuilder() {
        return builders.get();
    }

    public static Concern fromKey(String key) {
        for (Concern concern : values()) {
            if (concern.key.equals(key)) {
                return concern;
            }
        }
        throw new ConfigurationException("unknown concern '" + key + "'");
    }
}
