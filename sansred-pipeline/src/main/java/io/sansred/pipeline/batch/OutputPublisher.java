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

import io.sansred.pipeline.workspace.ResultRegistry;
import io.sansred.pipeline.workspace.WorkspaceSaver;
import io.sansred.state.CompositeState;
import io.sansred.state.fragment.DataState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.SaveType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Publishes a row's outputs to the result registry and saves its reduced curves to files,
/// according to the {@link OutputMode}.
///
/// Every output is published. Only {@link OutputKind#REDUCED} curves are saved, and can
/// outputs only when the options ask for them. Saved files go to the save fragment's output
/// directory, resolved against the batch output directory, one file per save format.
public class OutputPublisher {

    private static final Logger logger = LogManager.getLogger(OutputPublisher.class);

    private final ResultRegistry registry;
    private final WorkspaceSaver saver;

    public OutputPublisher(ResultRegistry registry, WorkspaceSaver saver) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.saver = Objects.requireNonNull(saver, "saver");
    }

    /// @return the distinct output names published or saved, in order
    public List<String> publish(CompositeState state, String baseName, RowResult result, BatchOptions options)
        throws IOException {
        Set<String> names = new LinkedHashSet<>();
        for (ReducedOutput output : result.outputs()) {
            if (output.kind() == OutputKind.CAN && !options.saveCan()) {
                continue;
            }
            String name = OutputNamer.name(baseName, state, output);
            if (!names.add(name)) {
                continue;
            }
            if (options.outputMode().publishes()) {
                registry.publish(name, output.workspace());
            }
            if (options.outputMode().saves() && output.kind() == OutputKind.REDUCED) {
                save(state, name, output, options);
            }
        }
        logger.debug("row {}: {} outputs via {}", result.row(), names.size(), options.outputMode());
        return new ArrayList<>(names);
    }

    private void save(CompositeState state, String name, ReducedOutput output, BatchOptions options) throws IOException {
        Path directory = directory(state, options);
        Map<String, String> metadata = metadata(state, output);
        for (SaveType type : state.save().fileFormats()) {
            Path file = directory.resolve(name + type.extension());
            saver.save(output.workspace(), file, type, metadata);
            logger.debug("saved {}", file);
        }
    }

    static Path directory(CompositeState state, BatchOptions options) {
        Path base = options.outputDirectory() == null ? Path.of(".") : options.outputDirectory();
        String own = state.save().outputDirectory();
        return own == null || own.isBlank() ? base : base.resolve(own);
    }

    static Map<String, String> metadata(CompositeState state, ReducedOutput output) {
        DataState data = state.data();
        Map<String, String> metadata = new LinkedHashMap<>();
        put(metadata, "sample_scatter", data.scatter(DataType.SAMPLE));
        put(metadata, "sample_transmission", data.transmission(DataType.SAMPLE));
        put(metadata, "sample_direct", data.direct(DataType.SAMPLE));
        put(metadata, "can_scatter", data.scatter(DataType.CAN));
        put(metadata, "can_transmission", data.transmission(DataType.CAN));
        put(metadata, "can_direct", data.direct(DataType.CAN));
        put(metadata, "user_file", data.userFile());
        put(metadata, "reduction_mode", output.mode().name());
        put(metadata, "wavelength_range", output.range().toString());
        if (output.merge() != null) {
            put(metadata, "merge_scale", Double.toString(output.merge().scale()));
            put(metadata, "merge_shift", Double.toString(output.merge().shift()));
        }
        put(metadata, "state_version", Integer.toString(state.version()));
        return metadata;
    }

    private static void put(Map<String, String> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
