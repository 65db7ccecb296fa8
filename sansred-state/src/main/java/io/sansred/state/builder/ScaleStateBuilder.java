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
import io.sansred.state.fragment.ScaleState;
import io.sansred.state.types.SampleShape;

import static io.sansred.state.fragment.ScaleState.*;

public class ScaleStateBuilder extends StateFragmentBuilder<ScaleState> {

    static final double DEFAULT_DIMENSION_MM = 1.0;

    private Double scaleFactor;
    private SampleShape shape;
    private Double width;
    private Double height;
    private Double thickness;

    public ScaleStateBuilder() {
        super(Concern.SCALE, ScaleState.KEYS);
    }

    public ScaleStateBuilder scaleFactor(Double factor) {
        this.scaleFactor = factor;
        return this;
    }

    public ScaleStateBuilder shape(SampleShape shape) {
        this.shape = shape;
        return this;
    }

    public ScaleStateBuilder dimensions(Double width, Double height, Double thickness) {
        this.width = width;
        this.height = height;
        this.thickness = thickness;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case SCALE_FACTOR -> scaleFactor(settings.getDouble(key));
            case SHAPE -> shape(settings.getEnum(key, SampleShape.class));
            case WIDTH -> width = settings.getDouble(key);
            case HEIGHT -> height = settings.getDouble(key);
            case THICKNESS -> thickness = settings.getDouble(key);
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected ScaleState create() {
        return new ScaleState(
            scaleFactor == null ? 1.0 : scaleFactor,
            shape == null ? SampleShape.FLAT_PLATE : shape,
            width == null ? DEFAULT_DIMENSION_MM : width,
            height == null ? DEFAULT_DIMENSION_MM : height,
            thickness == null ? DEFAULT_DIMENSION_MM : thickness);
    }
}
