package io.sansred.pipeline.core;

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

import io.sansred.pipeline.PipelineStageException;
import io.sansred.pipeline.ReductionStage;
import io.sansred.pipeline.bundle.BundleIdentity;
import io.sansred.pipeline.bundle.OutputBundle;
import io.sansred.pipeline.bundle.OutputPartsBundle;
import io.sansred.pipeline.bundle.OutputTransmissionBundle;
import io.sansred.pipeline.bundle.ReducedSlice;
import io.sansred.pipeline.bundle.ReductionSettingsBundle;
import io.sansred.pipeline.engine.QParts;
import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.engine.TransmissionResult;
import io.sansred.pipeline.workspace.ResultRegistry;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.CompositeState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.WavRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/// Runs one {@link ReductionSettingsBundle} through the stages of {@link ReductionStage} in
/// their fixed order for one wavelength range.
///
/// Stages whose fragment is disabled pass their input through. The first failing stage
/// raises a {@link PipelineStageException}; nothing is retried. The core holds no per-run
/// state and may be shared by concurrent rows.
public class ReductionCore {

    private static final Logger logger = LogManager.getLogger(ReductionCore.class);

    private final ReductionEngine engine;
    private final ResultRegistry registry;

    public ReductionCore(ReductionEngine engine, ResultRegistry registry) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ReductionEngine engine() {
        return engine;
    }

    public ResultRegistry registry() {
        return registry;
    }

    /// Reduces the bundle over the range through every stage.
    public ReducedSlice reduce(ReductionSettingsBundle bundle, WavRange range) {
        return reduce(bundle, range, ReductionStage.SCALE);
    }

    /// Reduces the bundle over the range, stopping after the given stage. Before
    /// {@link ReductionStage#CONVERT_TO_Q} the output holds the prepared scatter workspace and
    /// no parts.
    public ReducedSlice reduce(ReductionSettingsBundle bundle, WavRange range, ReductionStage stopAfter) {
        if (!bundle.reductionMode().isDetectorBank()) {
            throw new IllegalArgumentException("a core reduction needs a single bank, got " + bundle.reductionMode());
        }
        Run run = new Run(bundle, range);
        for (ReductionStage stage : ReductionStage.values()) {
            run.execute(stage);
            if (stage == stopAfter) {
                break;
            }
        }
        return run.result();
    }

    /// Mutable working set of a single reduction.
    private final class Run {

        private final ReductionSettingsBundle bundle;
        private final CompositeState state;
        private final BundleIdentity identity;
        private final WavRange range;

        private Workspace scatter;
        private Workspace monitor;
        private Workspace adjustment;
        private TransmissionResult transmission;
        private Workspace output;
        private Workspace counts;
        private Workspace normalization;

        Run(ReductionSettingsBundle bundle, WavRange range) {
            this.bundle = bundle;
            this.state = bundle.state();
            this.identity = bundle.identity();
            this.range = range;
            this.scatter = bundle.scatter();
            this.monitor = bundle.scatterMonitor();
        }

        void execute(ReductionStage stage) {
            logger.trace("{}: {} over {}", identity, stage, range);
            switch (stage) {
                case SLICE_EVENTS -> {
                    if (bundle.isSliced()) {
                        scatter = guarded(stage, () -> engine.sliceEvents(scatter, bundle.sliceWindow(), state.slice().timeUnit()));
                        monitor = guarded(stage, () -> engine.sliceEvents(monitor, bundle.sliceWindow(), state.slice().timeUnit()));
                    }
                }
                case CROP_TO_BANK -> scatter = guarded(stage, () -> engine.cropToBank(scatter, bundle.reductionMode()));
                case MASK -> {
                    if (!state.mask().isDisabled()) {
                        scatter = guarded(stage, () -> engine.mask(scatter, state.mask(), bundle.reductionMode()));
                    }
                }
                case MOVE -> {
                    if (!state.move().isDisabled()) {
                        scatter = guarded(stage, () -> engine.move(scatter,
                            state.move().bankMove(bundle.reductionMode()), state.move().sampleOffset()));
                    }
                }
                case NORMALIZE_TO_MONITOR -> adjustment = guarded(stage, () ->
                    engine.normalizeToMonitor(monitor, state.normalizeToMonitor(), state.wavelength(), range));
                case TRANSMISSION -> {
                    if (bundle.hasTransmission()) {
                        transmission = guarded(stage, () -> engine.transmission(bundle.transmission(), bundle.direct(),
                            state.transmission(), state.normalizeToMonitor().incidentMonitor(), state.wavelength(), range));
                        adjustment = guarded(stage, () -> engine.multiply(adjustment, transmission.fitted()));
                    }
                }
                case CONVERT_TO_Q -> {
                    QParts parts = guarded(stage, () -> engine.convertToQ(
                        engine.convertToWavelength(scatter, state.wavelength(), range), adjustment, state.convertToQ()));
                    counts = parts.counts();
                    normalization = parts.normalization();
                    output = guarded(stage, () -> engine.divide(counts, normalization));
                }
                case BACKGROUND_SUBTRACTION -> {
                    if (bundle.dataType() == DataType.SAMPLE && !state.backgroundSubtraction().isDisabled()) {
                        output = guarded(stage, () -> BackgroundSubtraction.subtract(engine, registry, output,
                            state.backgroundSubtraction(), bundle.reductionMode(), 1.0));
                    }
                }
                case SCALE -> {
                    double factor = state.scale().absoluteScale();
                    if (factor != 1.0) {
                        output = guarded(stage, () -> engine.scale(output, factor));
                        counts = guarded(stage, () -> engine.scale(counts, factor));
                    }
                }
                default -> throw new IllegalStateException("unhandled stage " + stage);
            }
        }

        private <T> T guarded(ReductionStage stage, Supplier<T> body) {
            try {
                return body.get();
            } catch (PipelineStageException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.debug("{} failed in {}: {}", identity, stage, e.toString());
                throw new PipelineStageException(stage, identity, e);
            }
        }

        ReducedSlice result() {
            if (output == null) {
                return new ReducedSlice(range, new OutputBundle(state, identity, range, scatter), null, null);
            }
            OutputPartsBundle parts = bundle.outputParts()
                ? new OutputPartsBundle(state, identity, range, counts, normalization)
                : null;
            OutputTransmissionBundle trans = transmission == null ? null
                : new OutputTransmissionBundle(state, identity, range, transmission.fitted(), transmission.unfitted());
            return new ReducedSlice(range, new OutputBundle(state, identity, range, output), parts, trans);
        }
    }
}
