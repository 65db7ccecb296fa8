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

import java.util.Optional;
import java.util.Set;

/// Named store of published workspaces, shared by every row of a batch. Implementations are
/// thread-safe.
public interface ResultRegistry {

    /// Publishes under the name, replacing any earlier workspace of that name.
    void publish(String name, Workspace workspace);

    Optional<Workspace> retrieve(String name);

    boolean contains(String name);

    boolean remove(String name);

    Set<String> names();
}
