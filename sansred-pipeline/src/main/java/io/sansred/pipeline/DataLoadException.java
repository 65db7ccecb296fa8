package io.sansred.pipeline;

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

import io.sansred.state.ReductionException;

/// A run file could not be loaded or does not hold what the reduction needs.
public class DataLoadException extends ReductionException {

    private final String file;

    public DataLoadException(String file, String message) {
        super("Could not load '" + file + "': " + message);
        this.file = file;
    }

    public DataLoadException(String file, String message, Throwable cause) {
        super("Could not load '" + file + "': " + message, cause);
        this.file = file;
    }

    public String getFile() {
        return file;
    }
}
