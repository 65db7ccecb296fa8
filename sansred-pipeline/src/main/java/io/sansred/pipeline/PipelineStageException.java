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

import io.sansred.pipeline.bundle.BundleIdentity;
import io.sansred.state.ReductionException;

/// A stage of the core reduction failed. Carries the stage and the identity of the bundle
/// being reduced; the original failure is the cause.
public class PipelineStageException extends ReductionException {

    private final ReductionStage stage;
    private final BundleIdentity bundle;

    public PipelineStageException(ReductionStage stage, BundleIdentity bundle, Throwable cause) {
        super("Stage " + stage + " failed for " + bundle + ": " + describe(cause), cause);
        this.stage = stage;
        this.bundle = bundle;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    public ReductionStage getStage() {
        return stage;
    }

    public BundleIdentity getBundle() {
        return bundle;
    }
}
