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

import io.sansred.state.types.SaveType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/// Writes a reduced workspace to a file in one of the supported formats.
public interface WorkspaceSaver {

    void save(Workspace workspace, Path path, SaveType type, Map<String, String> metadata) throws IOException;
}
