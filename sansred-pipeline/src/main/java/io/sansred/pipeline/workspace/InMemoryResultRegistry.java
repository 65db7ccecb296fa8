package io.sansred.pipeline.workspace;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/// In-process {@link ResultRegistry} backed by a concurrent map.
public class InMemoryResultRegistry implements ResultRegistry {

    private static final Logger logger = LogManager.getLogger(InMemoryResultRegistry.class);

    private final ConcurrentMap<String, Workspace> workspaces = new ConcurrentHashMap<>();

    @Override
    public void publish(String name, Workspace workspace) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(workspace, "workspace");
        if (workspaces.put(name, workspace) != null) {
            logger.debug("replaced published workspace {}", name);
        }
    }

    @Override
    public Optional<Workspace> retrieve(String name) {
        return Optional.ofNullable(workspaces.get(name));
    }

    @Override
    public boolean contains(String name) {
        return workspaces.containsKey(name);
    }

    @Override
    public boolean remove(String name) {
        return workspaces.remove(name) != null;
    }

    @Override
    public Set<String> names() {
        return new TreeSet<>(workspaces.keySet());
    }
}
