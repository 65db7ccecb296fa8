package io.sansred.pipeline.workspace;

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

import io.sansred.state.types.ReductionMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/// Detector pixel positions of a workspace, keyed by spectrum number. Monitors have none.
public final class InstrumentGeometry {

    private static final InstrumentGeometry EMPTY = new InstrumentGeometry(List.of());

    private final Map<Integer, DetectorPosition> positions;

    public InstrumentGeometry(List<DetectorPosition> detectors) {
        Map<Integer, DetectorPosition> byNumber = new LinkedHashMap<>();
        for (DetectorPosition detector : detectors) {
            if (byNumber.put(detector.spectrum(), detector) != null) {
                throw new IllegalArgumentException("spectrum " + detector.spectrum() + " is positioned twice");
            }
        }
        this.positions = Collections.unmodifiableMap(byNumber);
    }

    public static InstrumentGeometry empty() {
        return EMPTY;
    }

    public Optional<DetectorPosition> position(int spectrum) {
        return Optional.ofNullable(positions.get(spectrum));
    }

    public ReductionMode bankOf(int spectrum) {
        DetectorPosition position = positions.get(spectrum);
        return position == null ? null : position.bank();
    }

    public List<DetectorPosition> detectors() {
        return List.copyOf(positions.values());
    }

    /// @return a copy with the detectors of one bank transformed and the others unchanged
    public InstrumentGeometry mapBank(ReductionMode bank, UnaryOperator<DetectorPosition> move) {
        return new InstrumentGeometry(positions.values().stream()
            .map(p -> p.bank() == bank ? move.apply(p) : p)
            .toList());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InstrumentGeometry other && positions.equals(other.positions);
    }

    @Override
    public int hashCode() {
        return positions.hashCode();
    }
}
