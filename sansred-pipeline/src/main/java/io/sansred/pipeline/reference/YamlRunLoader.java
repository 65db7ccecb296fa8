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

import io.sansred.pipeline.DataLoadException;
import io.sansred.pipeline.workspace.DetectorPosition;
import io.sansred.pipeline.workspace.InstrumentGeometry;
import io.sansred.pipeline.workspace.LoadedRun;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.pipeline.workspace.WorkspaceLoader;
import io.sansred.state.types.ReductionMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Loads run files written as YAML histograms.
///
/// ```yaml
/// run_duration: 100.0
/// edges: [1.0, 1.5, 2.0]          # default bin edges for every spectrum
/// periods:
///   - monitors:
///       - {spectrum: 1, counts: [1000, 1000]}
///     detectors:
///       - {spectrum: 100, bank: LAB, position: [0.02, 0.0, 4.0], counts: [10, 12]}
/// ```
/// A file without {@code periods} holds a single period with {@code monitors} and
/// {@code detectors} at the top level. Spectra may carry their own {@code edges} and
/// {@code errors}; errors default to the square root of the counts.
public class YamlRunLoader implements WorkspaceLoader {

    private static final Logger logger = LogManager.getLogger(YamlRunLoader.class);
    private static final LoadSettings loadSettings = LoadSettings.builder().setLabel("run").build();

    private final Path baseDirectory;

    public YamlRunLoader(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public LoadedRun load(String file) {
        Path path = baseDirectory.resolve(file).normalize();
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new DataLoadException(file, "cannot read " + path + ": " + e.getMessage(), e);
        }
        logger.debug("loading run {}", path);
        return parse(file, text);
    }

    /// Parses a run document; {@code file} names the run in workspace names and errors.
    public static LoadedRun parse(String file, String yaml) {
        Object document;
        try {
            document = new Load(loadSettings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new DataLoadException(file, "malformed YAML: " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new DataLoadException(file, "expected a mapping at the top level");
        }
        String stem = stem(file);
        double[] defaultEdges = root.containsKey("edges") ? doubles(file, root.get("edges"), "edges") : null;
        List<?> periods = root.containsKey("periods") ? list(file, root.get("periods"), "periods") : List.of(root);
        if (periods.isEmpty()) {
            throw new DataLoadException(file, "has no periods");
        }
        List<Workspace> scatter = new ArrayList<>();
        List<Workspace> monitors = new ArrayList<>();
        for (int p = 0; p < periods.size(); p++) {
            if (!(periods.get(p) instanceof Map<?, ?> period)) {
                throw new DataLoadException(file, "period " + (p + 1) + " is not a mapping");
            }
            String suffix = periods.size() > 1 ? "_p" + (p + 1) : "";
            monitors.add(readMonitors(file, stem + suffix + "_monitors", period, root, defaultEdges));
            scatter.add(readDetectors(file, stem + suffix, period, root, defaultEdges));
        }
        return new LoadedRun(file, scatter, monitors);
    }

    private static Workspace readMonitors(String file, String name, Map<?, ?> period, Map<?, ?> root, double[] edges) {
        ArrayWorkspace.Builder builder = ArrayWorkspace.builder(name);
        copyMetadata(root, builder);
        for (Object node : list(file, period.get("monitors"), "monitors")) {
            addSpectrum(file, builder, spectrumNode(file, node), edges);
        }
        return builder.build();
    }

    private static Workspace readDetectors(String file, String name, Map<?, ?> period, Map<?, ?> root, double[] edges) {
        ArrayWorkspace.Builder builder = ArrayWorkspace.builder(name);
        copyMetadata(root, builder);
        List<DetectorPosition> positions = new ArrayList<>();
        for (Object node : list(file, period.get("detectors"), "detectors")) {
            Map<?, ?> spectrum = spectrumNode(file, node);
            int number = addSpectrum(file, builder, spectrum, edges);
            double[] position = doubles(file, spectrum.get("position"), "position of spectrum " + number);
            if (position.length != 3) {
                throw new DataLoadException(file, "position of spectrum " + number + " must be [x, y, z]");
            }
            ReductionMode bank;
            try {
                bank = ReductionMode.valueOf(String.valueOf(spectrum.get("bank")).toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new DataLoadException(file, "spectrum " + number + " has unknown bank " + spectrum.get("bank"), e);
            }
            if (!bank.isDetectorBank()) {
                throw new DataLoadException(file, "spectrum " + number + " bank must be LAB or HAB, got " + bank);
            }
            positions.add(new DetectorPosition(number, bank, position[0], position[1], position[2]));
        }
        try {
            builder.geometry(new InstrumentGeometry(positions));
        } catch (IllegalArgumentException e) {
            throw new DataLoadException(file, e.getMessage(), e);
        }
        return builder.build();
    }

    private static int addSpectrum(String file, ArrayWorkspace.Builder builder, Map<?, ?> node, double[] defaultEdges) {
        if (!(node.get("spectrum") instanceof Number number)) {
            throw new DataLoadException(file, "every spectrum needs an integer 'spectrum' number");
        }
        int spectrum = number.intValue();
        double[] counts = doubles(file, node.get("counts"), "counts of spectrum " + spectrum);
        double[] edges = node.containsKey("edges") ? doubles(file, node.get("edges"), "edges of spectrum " + spectrum)
            : defaultEdges;
        if (edges == null) {
            throw new DataLoadException(file, "spectrum " + spectrum + " has no edges and the file gives no default");
        }
        try {
            if (node.containsKey("errors")) {
                builder.spectrum(spectrum, edges, counts, doubles(file, node.get("errors"), "errors of spectrum " + spectrum), false);
            } else {
                builder.spectrum(spectrum, edges, counts);
            }
        } catch (IllegalArgumentException e) {
            throw new DataLoadException(file, e.getMessage(), e);
        }
        return spectrum;
    }

    private static void copyMetadata(Map<?, ?> root, ArrayWorkspace.Builder builder) {
        root.forEach((key, value) -> {
            if (!(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
                builder.metadata(String.valueOf(key), value);
            }
        });
    }

    private static Map<?, ?> spectrumNode(String file, Object node) {
        if (!(node instanceof Map<?, ?> map)) {
            throw new DataLoadException(file, "spectrum entries must be mappings, got " + node);
        }
        return map;
    }

    private static List<?> list(String file, Object node, String what) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            throw new DataLoadException(file, what + " must be a list");
        }
        return list;
    }

    private static double[] doubles(String file, Object node, String what) {
        List<?> values = list(file, node, what);
        if (values.isEmpty()) {
            throw new DataLoadException(file, what + " are missing");
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            if (!(values.get(i) instanceof Number n)) {
                throw new DataLoadException(file, what + " must be numbers, got " + values.get(i));
            }
            out[i] = n.doubleValue();
        }
        return out;
    }

    private static String stem(String file) {
        String name = Path.of(file).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
