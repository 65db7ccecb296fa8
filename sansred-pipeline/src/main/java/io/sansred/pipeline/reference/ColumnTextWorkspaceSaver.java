package io.sansred.pipeline.reference;

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

import io.sansred.pipeline.workspace.Workspace;
import io.sansred.pipeline.workspace.WorkspaceSaver;
import io.sansred.state.types.SaveType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/// Saves single-spectrum reduced workspaces as column text, one row per bin centre.
///
/// CSV files start with {@code # key: value} metadata lines and a {@code Q,I,dI} header. RKH
/// files carry the workspace name as title, the point count, then space-separated columns.
public class ColumnTextWorkspaceSaver implements WorkspaceSaver {

    private static final Logger logger = LogManager.getLogger(ColumnTextWorkspaceSaver.class);

    @Override
    public void save(Workspace workspace, Path path, SaveType type, Map<String, String> metadata) throws IOException {
        if (workspace.spectrumCount() != 1) {
            throw new IllegalArgumentException("can only save single-spectrum workspaces, " + workspace.name()
                + " has " + workspace.spectrumCount());
        }
        double[] centres = Binning.centres(workspace.readX(0));
        double[] y = workspace.readY(0);
        double[] e = workspace.readE(0);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            switch (type) {
                case CSV -> {
                    out.write("# name: " + workspace.name());
                    out.newLine();
                    for (Map.Entry<String, String> entry : metadata.entrySet()) {
                        out.write("# " + entry.getKey() + ": " + entry.getValue());
                        out.newLine();
                    }
                    out.write("Q,I,dI");
                    out.newLine();
                    for (int i = 0; i < centres.length; i++) {
                        out.write(String.format(Locale.ROOT, "%.8g,%.8g,%.8g", centres[i], y[i], e[i]));
                        out.newLine();
                    }
                }
                case RKH -> {
                    out.write(" " + workspace.name() + " " + metadata);
                    out.newLine();
                    out.write(String.format(Locale.ROOT, "%5d", centres.length));
                    out.newLine();
                    for (int i = 0; i < centres.length; i++) {
                        out.write(String.format(Locale.ROOT, " %14.6E %14.6E %14.6E", centres[i], y[i], e[i]));
                        out.newLine();
                    }
                }
                default -> throw new IllegalArgumentException("unsupported save type " + type);
            }
        }
        logger.debug("saved {} as {} to {}", workspace.name(), type, path);
    }
}
