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

import java.nio.file.Path;

/// Options of one batch run.
///
/// @param useOptimizations reuse loaded runs and can reductions across rows
/// @param saveCan          also publish the reduced can of each row
/// @param threads          worker threads; 1 reduces rows one at a time
/// @param outputDirectory  directory for saved files when a row's state names none, and the
///                         base for relative ones; null means the working directory
public record BatchOptions(boolean useOptimizations, OutputMode outputMode, boolean saveCan, int threads,
                           Path outputDirectory) {

    public BatchOptions {
        if (outputMode == null) {
            outputMode = OutputMode.PUBLISH_TO_ADS;
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(false, OutputMode.PUBLISH_TO_ADS, false, 1, null);
    }

    public BatchOptions withUseOptimizations(boolean value) {
        return new BatchOptions(value, outputMode, saveCan, threads, outputDirectory);
    }

    public BatchOptions withOutputMode(OutputMode value) {
        return new BatchOptions(useOptimizations, value, saveCan, threads, outputDirectory);
    }

    public BatchOptions withSaveCan(boolean value) {
        return new BatchOptions(useOptimizations, outputMode, value, threads, outputDirectory);
    }

    public BatchOptions withThreads(int value) {
        return new BatchOptions(useOptimizations, outputMode, saveCan, value, outputDirectory);
    }

    public BatchOptions withOutputDirectory(Path value) {
        return new BatchOptions(useOptimizations, outputMode, saveCan, threads, value);
    }
}
