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

import io.sansred.pipeline.workspace.InstrumentGeometry;
import io.sansred.pipeline.workspace.Workspace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// {@link Workspace} held in plain arrays.
public final class ArrayWorkspace implements Workspace {

    /// Run metadata key holding the run length in seconds, needed for event slicing.
    public static final String RUN_DURATION = "run_duration";

    private final String name;
    private final int[] spectrumNumbers;
    private final double[][] x;
    private final double[][] y;
    private final double[][] e;
    private final boolean[] masked;
    private final Map<String, Object> metadata;
    private volatile InstrumentGeometry geometry;

    private ArrayWorkspace(Builder builder) {
        this.name = builder.name;
        int n = builder.numbers.size();
        this.spectrumNumbers = new int[n];
        this.x = new double[n][];
        this.y = new double[n][];
        this.e = new double[n][];
        this.masked = new boolean[n];
        for (int i = 0; i < n; i++) {
            spectrumNumbers[i] = builder.numbers.get(i);
            x[i] = builder.x.get(i);
            y[i] = builder.y.get(i);
            e[i] = builder.e.get(i);
            masked[i] = builder.masked.get(i);
        }
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.geometry = builder.geometry;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /// @return a builder pre-filled with this workspace's metadata and geometry but no spectra
    public static Builder like(Workspace template, String name) {
        Builder builder = new Builder(name);
        builder.metadata.putAll(template.runMetadata());
        builder.geometry = template.geometry();
        return builder;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int spectrumCount() {
        return spectrumNumbers.length;
    }

    @Override
    public int spectrumNumber(int index) {
        return spectrumNumbers[index];
    }

    @Override
    public double[] readX(int index) {
        return x[index].clone();
    }

    @Override
    public double[] readY(int index) {
        return y[index].clone();
    }

    @Override
    public double[] readE(int index) {
        return e[index].clone();
    }

    @Override
    public void writeY(int index, double[] values) {
        checkLength(index, values);
        y[index] = values.clone();
    }

    @Override
    public void writeE(int index, double[] errors) {
        checkLength(index, errors);
        e[index] = errors.clone();
    }

    private void checkLength(int index, double[] values) {
        if (values.length != y[index].length) {
            throw new IllegalArgumentException(name + " spectrum " + spectrumNumbers[index] + " has "
                + y[index].length + " bins, got " + values.length + " values");
        }
    }

    @Override
    public boolean isMasked(int index) {
        return masked[index];
    }

    @Override
    public InstrumentGeometry geometry() {
        return geometry;
    }

    @Override
    public void setGeometry(InstrumentGeometry geometry) {
        this.geometry = geometry == null ? InstrumentGeometry.empty() : geometry;
    }

    @Override
    public Map<String, Object> runMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ArrayWorkspace{" + name + ", spectra=" + Arrays.toString(spectrumNumbers) + "}";
    }

    public static final class Builder {

        private final String name;
        private final List<Integer> numbers = new ArrayList<>();
        private final Set<Integer> seen = new HashSet<>();
        private final List<double[]> x = new ArrayList<>();
        private final List<double[]> y = new ArrayList<>();
        private final List<double[]> e = new ArrayList<>();
        private final List<Boolean> masked = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private InstrumentGeometry geometry = InstrumentGeometry.empty();

        private Builder(String name) {
            this.name = name;
        }

        /// Adds a spectrum with Poisson errors.
        public Builder spectrum(int number, double[] edges, double[] values) {
            double[] errors = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                errors[i] = Math.sqrt(Math.abs(values[i]));
            }
            return spectrum(number, edges, values, errors, false);
        }

        public Builder spectrum(int number, double[] edges, double[] values, double[] errors, boolean isMasked) {
            if (!seen.add(number)) {
                throw new IllegalArgumentException(name + ": spectrum " + number + " added twice");
            }
            if (edges.length != values.length + 1 || errors.length != values.length) {
                throw new IllegalArgumentException(name + ": spectrum " + number + " needs " + (values.length + 1)
                    + " edges and " + values.length + " errors, got " + edges.length + " and " + errors.length);
            }
            for (int i = 1; i < edges.length; i++) {
                if (!(edges[i] > edges[i - 1])) {
                    throw new IllegalArgumentException(name + ": spectrum " + number + " bin edges must increase");
                }
            }
            numbers.add(number);
            x.add(edges.clone());
            y.add(values.clone());
            e.add(errors.clone());
            masked.add(isMasked);
            return this;
        }

        public Builder geometry(InstrumentGeometry geometry) {
            this.geometry = geometry;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public ArrayWorkspace build() {
            return new ArrayWorkspace(this);
        }
    }
}
