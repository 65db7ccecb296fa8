package io.sansred.pipeline.bundle;

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

import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;

/// Identifies one reduction invocation within a batch: the row, the data role, the detector
/// bank, the period and the optional time slice.
public record BundleIdentity(int row, DataType dataType, ReductionMode reductionMode, int period, TimeWindow slice) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("row ").append(row).append(' ')
            .append(dataType).append('/').append(reductionMode);
        if (period > 0) {
            sb.append(" period ").append(period);
        }
        if (slice != null) {
            sb.append(" slice ").append(slice);
        }
        return sb.toString();
    }
}
