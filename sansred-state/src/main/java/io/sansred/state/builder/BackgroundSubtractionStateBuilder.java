package io.sansred.state.builder;

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
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.BackgroundSubtractionState;

import static io.sansred.state.fragment.BackgroundSubtractionState.*;

public class BackgroundSubtractionStateBuilder extends StateFragmentBuilder<BackgroundSubtractionState> {

    private String workspace;
    private Double scaleFactor;

    public BackgroundSubtractionStateBuilder() {
        super(Concern.BACKGROUND_SUBTRACTION, BackgroundSubtractionState.KEYS);
    }

    public BackgroundSubtractionStateBuilder workspace(String name) {
        this.workspace = name;
        return this;
    }

    public BackgroundSubtractionStateBuilder scaleFactor(Double factor) {
        this.scaleFactor = factor;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case WORKSPACE -> workspace(settings.getString(key));
            case SCALE_FACTOR -> scaleFactor(settings.getDouble(key));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected BackgroundSubtractionState create() {
        return new BackgroundSubtractionState(workspace, scaleFactor);
    }
}
