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

/// Root of every failure raised while composing reduction state or running a reduction.
///
/// All subtypes are unchecked. Callers that must keep one batch row from aborting its siblings
/// catch this type at the row boundary.
public class ReductionException extends RuntimeException {

    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
