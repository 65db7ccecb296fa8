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

import io.sansred.pipeline.workspace.LoadedRun;
import io.sansred.pipeline.workspace.WorkspaceLoader;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// Serves prepared runs by file name and counts how often each file is loaded.
public class FakeRunLoader implements WorkspaceLoader {

    private final Map<String, LoadedRun> runs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> loads = new ConcurrentHashMap<>();

    /// The sample, can, transmission and direct runs of {@link PipelineFixtures}.
    public static FakeRunLoader standard() {
        return new FakeRunLoader()
            .with(PipelineFixtures.SAMPLE, PipelineFixtures.run(PipelineFixtures.SAMPLE, 1.0))
            .with(PipelineFixtures.CAN, PipelineFixtures.run(PipelineFixtures.CAN, 0.1))
            .with(PipelineFixtures.SAMPLE_TRANSMISSION, PipelineFixtures.run(PipelineFixtures.SAMPLE_TRANSMISSION, 1.0, 1, 0.5))
            .with(PipelineFixtures.DIRECT, PipelineFixtures.run(PipelineFixtures.DIRECT, 1.0, 1, 1.0))
            .with(PipelineFixtures.MULTI_PERIOD, PipelineFixtures.run(PipelineFixtures.MULTI_PERIOD, 1.0, 2, 1.0));
    }

    public FakeRunLoader with(String file, LoadedRun run) {
        runs.put(file, run);
        return this;
    }

    @Override
    public LoadedRun load(String file) {
        loads.computeIfAbsent(file, f -> new AtomicInteger()).incrementAndGet();
        LoadedRun run = runs.get(file);
        if (run == null) {
            throw new DataLoadException(file, "no such run");
        }
        return run;
    }

    public int loadCount(String file) {
        AtomicInteger count = loads.get(file);
        return count == null ? 0 : count.get();
    }
}
