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
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragment;
import io.sansred.state.types.SampleShape;

import java.util.List;

/// Absolute scaling. Sample dimensions are in mm; {@link #volume()} is in cm³.
public record ScaleState(
    double scaleFactor,
    SampleShape shape,
    double width,
    double height,
    double thickness
) implements StateFragment {

    public static final String SCALE_FACTOR = "scale_factor";
    public static final String SHAPE = "sample_shape";
    public static final String WIDTH = "sample_width";
    public static final String HEIGHT = "sample_height";
    public static final String THICKNESS = "sample_thickness";

    public static final List<String> KEYS = List.of(SCALE_FACTOR, SHAPE, WIDTH, HEIGHT, THICKNESS);

    @Override
    public Concern concern() {
        return Concern.SCALE;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.SCALE);
        v.require(shape, SHAPE);
        v.positive(width, WIDTH);
        v.positive(height, HEIGHT);
        v.positive(thickness, THICKNESS);
        v.check(scaleFactor != 0 && Double.isFinite(scaleFactor), SCALE_FACTOR, "must be finite and non-zero");
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return absoluteScale() == 1.0;
    }

    public double volume() {
        double radius = width / 2.0;
        double mm3 = switch (shape) {
            case CYLINDER -> Math.PI * radius * radius * thickness;
            case FLAT_PLATE -> width * height * thickness;
            case DISC -> Math.PI * radius * radius * height;
        };
        return mm3 / 1000.0;
    }

    /// @return the factor reduced intensities are multiplied by, {@code scale_factor / volume}
    public double absoluteScale() {
        return scaleFactor / volume();
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(SCALE_FACTOR, scaleFactor, SHAPE, shape, WIDTH, width, HEIGHT, height,
            THICKNESS, thickness);
    }
}
