package io.sansred.state.types;

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

/// Unit of event slice boundaries.
public enum SliceTimeUnit {
    SECONDS(1.0),
    MILLISECONDS(1.0e-3),
    MICROSECONDS(1.0e-6);

    private final double seconds;

    SliceTimeUnit(double seconds) {
        this.seconds = seconds;
    }

    public double toSeconds(double value) {
        return value * seconds;
    }
}
