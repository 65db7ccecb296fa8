package io.sansred.state;

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

/// State for one batch row could not be built. The row is reported as failed and its siblings
/// continue.
public class RowConfigurationException extends ReductionException {

    private final int rowIndex;

    public RowConfigurationException(int rowIndex, Exception cause) {
        super("Row " + rowIndex + ": " + cause.getMessage(), cause);
        this.rowIndex = rowIndex;
    }

    public RowConfigurationException(int rowIndex, String message) {
        super("Row " + rowIndex + ": " + message);
        this.rowIndex = rowIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
