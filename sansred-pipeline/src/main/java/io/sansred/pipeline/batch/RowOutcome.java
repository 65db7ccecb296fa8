package io.sansred.pipeline.batch;

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

import java.util.List;

/// The terminal result of one row.
///
/// @param outputNames names published or saved for the row, in publication order
/// @param scales      merge scale factors, one per merged curve
/// @param shifts      merge shift factors, one per merged curve
public record RowOutcome(int rowIndex, RowRunState state, String message, List<String> outputNames,
                         List<Double> scales, List<Double> shifts) {

    public RowOutcome {
        outputNames = List.copyOf(outputNames);
        scales = List.copyOf(scales);
        shifts = List.copyOf(shifts);
    }

    public static RowOutcome success(int row, List<String> outputNames, List<Double> scales, List<Double> shifts) {
        return new RowOutcome(row, RowRunState.SUCCESS, null, outputNames, scales, shifts);
    }

    public static RowOutcome failed(int row, String message) {
        return new RowOutcome(row, RowRunState.FAILED, message, List.of(), List.of(), List.of());
    }

    public static RowOutcome cancelled(int row) {
        return new RowOutcome(row, RowRunState.CANCELLED, "cancelled before start", List.of(), List.of(), List.of());
    }

    public boolean isSuccess() {
        return state == RowRunState.SUCCESS;
    }
}
