package io.sansred.pipeline.core;

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

import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.workspace.ResultRegistry;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.fragment.BackgroundSubtractionState;
import io.sansred.state.types.ReductionMode;

/// Subtracts a published background curve, scaled by the fragment's factor, from divided data.
public final class BackgroundSubtraction {

    private BackgroundSubtraction() {
    }

    /// Looks up the background under its exact name, then under {@code <name>_<mode>} for
    /// backgrounds published per bank.
    ///
    /// @param extraScale further factor on the background, for curves that were scaled after
    ///                   reduction
    /// @throws IllegalStateException when no such background is published
    public static Workspace subtract(ReductionEngine engine, ResultRegistry registry, Workspace data,
                                     BackgroundSubtractionState background, ReductionMode mode, double extraScale) {
        String name = background.workspace();
        Workspace found = registry.retrieve(name)
            .or(() -> registry.retrieve(name + "_" + mode.token()))
            .orElseThrow(() -> new IllegalStateException("background workspace '" + name + "' is not published"));
        return engine.minus(data, engine.scale(found, background.scaleFactor() * extraScale));
    }
}
