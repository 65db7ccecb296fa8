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

import io.sansred.pipeline.workspace.LoadedRun;
import io.sansred.pipeline.workspace.WorkspaceLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// A {@link WorkspaceLoader} that loads each file once and hands the same {@link LoadedRun} to
/// every row. Rows asking for a file that is being loaded wait for it; a failed load is
/// forgotten so a later row tries again.
public class LoadCache implements WorkspaceLoader {

    private static final Logger logger = LogManager.getLogger(LoadCache.class);

    private final WorkspaceLoader delegate;
    private final OnceCache<String, LoadedRun> runs = new OnceCache<>();

    public LoadCache(WorkspaceLoader delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public LoadedRun load(String file) {
        return runs.get(file, f -> {
            logger.debug("loading {} into the shared cache", f);
            return delegate.load(f);
        });
    }

    public boolean isLoaded(String file) {
        return runs.contains(file);
    }

    public void clear() {
        runs.clear();
    }
}
