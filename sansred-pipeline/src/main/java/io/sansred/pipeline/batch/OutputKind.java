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

/// What a reduced output holds.
public enum OutputKind {
    /// the final curve of a bank or the merged curve, can subtracted
    REDUCED,
    /// the reduced can alone
    CAN,
    /// the HAB curve after applying the merge scale and shift
    SCALED_HAB,
    TRANSMISSION,
    TRANSMISSION_UNFITTED;

    public boolean isTransmission() {
        return this == TRANSMISSION || this == TRANSMISSION_UNFITTED;
    }
}
