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

import java.util.Locale;

/// One event slice: a half-open time interval {@code [start, end)} relative to the run start.
public record TimeWindow(double start, double end) {

    public TimeWindow {
        if (!(start < end)) {
            throw new IllegalArgumentException("slice window needs start < end, got " + start + ".." + end);
        }
    }

    public double length() {
        return end - start;
    }

    /// @return the length of the part of this window that lies inside {@code [0, duration)}
    public double overlapWith(double duration) {
        double lo = Math.max(0.0, start);
        double hi = Math.min(duration, end);
        return Math.max(0.0, hi - lo);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%s, %s)", start, end);
    }
}
