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

/// Where reduced outputs go: the in-process result registry, files, or both.
public enum OutputMode {
    PUBLISH_TO_ADS,
    SAVE_TO_FILE,
    BOTH;

    public boolean publishes() {
        return this != SAVE_TO_FILE;
    }

    public boolean saves() {
        return this != PUBLISH_TO_ADS;
    }
}
