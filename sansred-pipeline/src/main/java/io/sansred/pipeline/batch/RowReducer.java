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

import io.sansred.pipeline.bundle.MergeBundle;
import io.sansred.pipeline.bundle.OutputPartsBundle;
import io.sansred.pipeline.bundle.OutputTransmissionBundle;
import io.sansred.pipeline.bundle.ReducedSlice;
import io.sansred.pipeline.bundle.ReductionSettingsBundle;
import io.sansred.pipeline.core.BackgroundSubtraction;
import io.sansred.pipeline.core.EventSliceSplitter;
import io.sansred.pipeline.core.MergeStage;
import io.sansred.pipeline.core.ReductionCore;
import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.workspace.LoadedRun;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.pipeline.workspace.WorkspaceLoader;
import io.sansred.state.CompositeState;
import io.sansred.state.fragment.BackgroundSubtractionState;
import io.sansred.state.fragment.DataState;
import io.sansred.state.fragment.ReductionState;
import io.sansred.state.types.DataType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.TimeWindow;
import io.sansred.state.types.WavRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/// Reduces one row: loads its runs, builds bundles for each period, data role and bank,
/// fans out time slices, runs the core for every wavelength range, subtracts the can, and
/// merges the banks in merged mode.
///
/// A sample scatter period of 0 on a multi-period file reduces every period. The other runs
/// use their own period when one is set, else the sample's period, else their last period.
///
/// With a can cache, can reductions are shared between rows whose can inputs and settings
/// match.
public class RowReducer {

    private static final Logger logger = LogManager.getLogger(RowReducer.class);

    private final ReductionCore core;
    private final ReductionEngine engine;
    private final MergeStage mergeStage;
    private final EventSliceSplitter splitter = new EventSliceSplitter();
    private final WorkspaceLoader loader;
    private final OnceCache<String, ReducedSlice> canCache;

    /// @param canCache shared can reductions, or null to reduce the can of every row afresh
    public RowReducer(ReductionCore core, WorkspaceLoader loader, OnceCache<String, ReducedSlice> canCache) {
        this.core = Objects.requireNonNull(core, "core");
        this.engine = core.engine();
        this.mergeStage = new MergeStage(engine);
        this.loader = Objects.requireNonNull(loader, "loader");
        this.canCache = canCache;
    }

    public RowResult reduce(int row, CompositeState state) {
        DataState data = state.data();
        Runs sample = Runs.load(loader, data, DataType.SAMPLE);
        Runs can = data.hasCan() ? Runs.load(loader, data, DataType.CAN) : null;
        List<Integer> periods = samplePeriods(sample.scatter(), data.scatterPeriod(DataType.SAMPLE));
        logger.debug("row {}: {} period(s), banks {}", row, periods.size(), state.reduction().detectorBanks());

        List<ReducedOutput> outputs = new ArrayList<>();
        List<MergeBundle> merges = new ArrayList<>();
        for (int period : periods) {
            int label = sample.scatter().isMultiPeriod() ? period : 0;
            reducePeriod(row, state, sample, can, period, label, outputs, merges);
        }
        return new RowResult(row, outputs, merges);
    }

    static List<Integer> samplePeriods(LoadedRun scatter, int requested) {
        if (requested > 0) {
            return List.of(requested);
        }
        return IntStream.rangeClosed(1, scatter.periodCount()).boxed().toList();
    }

    private void reducePeriod(int row, CompositeState state, Runs sample, Runs can, int period, int label,
                              List<ReducedOutput> outputs, List<MergeBundle> merges) {
        ReductionState reduction = state.reduction();
        List<ReductionSettingsBundle> sampleBundles = new ArrayList<>();
        List<ReductionSettingsBundle> canBundles = new ArrayList<>();
        for (ReductionMode bank : reduction.detectorBanks()) {
            sampleBundles.add(sample.bundle(row, state, DataType.SAMPLE, bank, reduction.isMerged(), period, label));
            if (can != null) {
                canBundles.add(can.bundle(row, state, DataType.CAN, bank, reduction.isMerged(), period, label));
            }
        }
        Map<TimeWindow, List<ReductionSettingsBundle>> sampleByWindow = splitter.splitByWindow(sampleBundles);
        Map<TimeWindow, List<ReductionSettingsBundle>> canByWindow = splitter.splitByWindow(canBundles);
        for (Map.Entry<TimeWindow, List<ReductionSettingsBundle>> entry : sampleByWindow.entrySet()) {
            TimeWindow slice = entry.getKey();
            List<ReductionSettingsBundle> cans = canByWindow.getOrDefault(slice, List.of());
            for (WavRange range : state.wavelength().ranges()) {
                Map<ReductionMode, ReducedSlice> sampleSlices = new EnumMap<>(ReductionMode.class);
                Map<ReductionMode, ReducedSlice> canSlices = new EnumMap<>(ReductionMode.class);
                for (ReductionSettingsBundle bundle : entry.getValue()) {
                    sampleSlices.put(bundle.reductionMode(), core.reduce(bundle, range));
                }
                for (ReductionSettingsBundle bundle : cans) {
                    canSlices.put(bundle.reductionMode(), reduceCan(bundle, range));
                }
                collect(state, range, slice, label, sampleSlices, canSlices, outputs, merges);
            }
        }
    }

    private void collect(CompositeState state, WavRange range, TimeWindow slice, int label,
                         Map<ReductionMode, ReducedSlice> sampleSlices, Map<ReductionMode, ReducedSlice> canSlices,
                         List<ReducedOutput> outputs, List<MergeBundle> merges) {
        for (Map.Entry<ReductionMode, ReducedSlice> entry : sampleSlices.entrySet()) {
            ReductionMode bank = entry.getKey();
            ReducedSlice sampleSlice = entry.getValue();
            ReducedSlice canSlice = canSlices.get(bank);
            Workspace reduced = sampleSlice.output().workspace();
            if (canSlice != null) {
                reduced = engine.minus(reduced, canSlice.output().workspace());
                outputs.add(new ReducedOutput(bank, DataType.CAN, range, slice, label, OutputKind.CAN,
                    canSlice.output().workspace(), null));
                canSlice.transmissionIfPresent().ifPresent(t -> addTransmission(outputs, DataType.CAN, t, slice, label));
            }
            outputs.add(new ReducedOutput(bank, DataType.SAMPLE, range, slice, label, OutputKind.REDUCED, reduced, null));
            sampleSlice.transmissionIfPresent().ifPresent(t -> addTransmission(outputs, DataType.SAMPLE, t, slice, label));
        }
        ReductionState reduction = state.reduction();
        if (!reduction.isMerged()) {
            return;
        }
        MergeBundle merge = mergeStage.merge(reduction,
            parts(sampleSlices, ReductionMode.LAB), parts(sampleSlices, ReductionMode.HAB),
            canSlices.isEmpty() ? null : parts(canSlices, ReductionMode.LAB),
            canSlices.isEmpty() ? null : parts(canSlices, ReductionMode.HAB));
        Workspace merged = merge.merged();
        BackgroundSubtractionState background = state.backgroundSubtraction();
        if (!background.isDisabled()) {
            merged = BackgroundSubtraction.subtract(engine, core.registry(), merged, background,
                ReductionMode.MERGED, state.scale().absoluteScale());
        }
        outputs.add(new ReducedOutput(ReductionMode.MERGED, DataType.SAMPLE, range, slice, label, OutputKind.REDUCED,
            merged, merge));
        outputs.add(new ReducedOutput(ReductionMode.HAB, DataType.SAMPLE, range, slice, label, OutputKind.SCALED_HAB,
            merge.scaledHab(), merge));
        merges.add(merge);
    }

    private static OutputPartsBundle parts(Map<ReductionMode, ReducedSlice> slices, ReductionMode bank) {
        ReducedSlice slice = slices.get(bank);
        if (slice == null || slice.parts() == null) {
            throw new IllegalStateException("merged reduction has no " + bank + " parts");
        }
        return slice.parts();
    }

    private static void addTransmission(List<ReducedOutput> outputs, DataType type, OutputTransmissionBundle t,
                                        TimeWindow slice, int label) {
        ReductionMode bank = t.identity().reductionMode();
        outputs.add(new ReducedOutput(bank, type, t.wavRange(), slice, label, OutputKind.TRANSMISSION, t.calculated(), null));
        outputs.add(new ReducedOutput(bank, type, t.wavRange(), slice, label, OutputKind.TRANSMISSION_UNFITTED,
            t.unfitted(), null));
    }

    private ReducedSlice reduceCan(ReductionSettingsBundle bundle, WavRange range) {
        if (canCache == null) {
            return core.reduce(bundle, range);
        }
        // parts are only produced for merged rows, so a parts-less can cannot serve one
        String key = bundle.state().canFingerprint() + '|' + bundle.reductionMode() + '|' + range
            + '|' + bundle.period() + '|' + bundle.sliceWindow() + '|' + (bundle.outputParts() ? "parts" : "divided");
        return canCache.get(key, k -> {
            logger.debug("reducing can {} for row {}", k, bundle.rowIndex());
            return core.reduce(bundle, range);
        });
    }

    /// The loaded runs of one data role with their configured periods.
    private record Runs(LoadedRun scatter, int scatterPeriod, LoadedRun transmission, int transmissionPeriod,
                        LoadedRun direct, int directPeriod) {

        static Runs load(WorkspaceLoader loader, DataState data, DataType type) {
            LoadedRun scatter = loader.load(data.scatter(type));
            LoadedRun transmission = null;
            LoadedRun direct = null;
            if (data.hasTransmission(type)) {
                transmission = loader.load(data.transmission(type));
                direct = loader.load(data.direct(type));
            }
            return new Runs(scatter, data.scatterPeriod(type), transmission, data.transmissionPeriod(type),
                direct, data.directPeriod(type));
        }

        ReductionSettingsBundle bundle(int row, CompositeState state, DataType type, ReductionMode bank,
                                       boolean parts, int samplePeriod, int label) {
            int p = pick(scatter, scatterPeriod, samplePeriod);
            Workspace trans = transmission == null ? null
                : transmission.monitor(pick(transmission, transmissionPeriod, samplePeriod));
            Workspace dir = direct == null ? null : direct.monitor(pick(direct, directPeriod, samplePeriod));
            return new ReductionSettingsBundle(row, state, type, bank, parts, label,
                scatter.scatter(p), scatter.monitor(p), trans, dir, null);
        }

        private static int pick(LoadedRun run, int explicit, int samplePeriod) {
            if (explicit > 0) {
                return explicit;
            }
            return Math.min(samplePeriod, run.periodCount());
        }
    }
}
