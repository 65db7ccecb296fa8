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

import io.sansred.pipeline.engine.QParts;
import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.engine.TransmissionResult;
import io.sansred.pipeline.workspace.DetectorPosition;
import io.sansred.pipeline.workspace.InstrumentGeometry;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.fragment.ConvertToQState;
import io.sansred.state.fragment.MaskState;
import io.sansred.state.fragment.MoveState;
import io.sansred.state.fragment.NormalizeToMonitorState;
import io.sansred.state.fragment.TransmissionState;
import io.sansred.state.fragment.WavelengthState;
import io.sansred.state.types.RebinType;
import io.sansred.state.types.ReductionMode;
import io.sansred.state.types.SliceTimeUnit;
import io.sansred.state.types.TimeWindow;
import io.sansred.state.types.TransmissionFitType;
import io.sansred.state.types.WavRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;

/// {@link ReductionEngine} over {@link ArrayWorkspace}s. Input X axes are taken to be
/// wavelength in Ångström already, so time-of-flight conversion is the identity and the
/// kernels only rebin, weight and sum.
///
/// Geometry positions are in metres; mask radii are in millimetres.
public class ArrayReductionEngine implements ReductionEngine {

    private static final Logger logger = LogManager.getLogger(ArrayReductionEngine.class);

    @Override
    public Workspace sliceEvents(Workspace workspace, TimeWindow window, SliceTimeUnit unit) {
        double duration = runDuration(workspace);
        TimeWindow seconds = new TimeWindow(unit.toSeconds(window.start()), unit.toSeconds(window.end()));
        double kept = seconds.overlapWith(duration);
        double fraction = kept / duration;
        double errorFraction = Math.sqrt(fraction);
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name() + "_sliced")
            .metadata(ArrayWorkspace.RUN_DURATION, kept)
            .metadata("slice_start", seconds.start())
            .metadata("slice_end", seconds.end());
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            out.spectrum(workspace.spectrumNumber(i), workspace.readX(i),
                times(workspace.readY(i), fraction), times(workspace.readE(i), errorFraction), workspace.isMasked(i));
        }
        logger.debug("sliced {} to {} ({} of {}s)", workspace.name(), seconds, kept, duration);
        return out.build();
    }

    private static double runDuration(Workspace workspace) {
        Object value = workspace.runMetadata().get(ArrayWorkspace.RUN_DURATION);
        if (!(value instanceof Number number) || !(number.doubleValue() > 0)) {
            throw new IllegalStateException(workspace.name() + " has no positive " + ArrayWorkspace.RUN_DURATION
                + " to slice against");
        }
        return number.doubleValue();
    }

    @Override
    public Workspace cropToBank(Workspace workspace, ReductionMode bank) {
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name() + "_" + bank.token());
        int kept = 0;
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            if (workspace.bank(i) == bank) {
                copySpectrum(workspace, i, out, workspace.isMasked(i));
                kept++;
            }
        }
        if (kept == 0) {
            throw new IllegalStateException(workspace.name() + " has no spectra in bank " + bank);
        }
        return out.build();
    }

    @Override
    public Workspace mask(Workspace workspace, MaskState mask, ReductionMode bank) {
        if (mask.maskFiles() != null && !mask.maskFiles().isEmpty()) {
            throw new UnsupportedOperationException("mask files are not supported: " + mask.maskFiles());
        }
        Set<Integer> spectra = new HashSet<>(mask.spectraFor(bank));
        InstrumentGeometry geometry = workspace.geometry();
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name() + "_masked");
        int maskedCount = 0;
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            int number = workspace.spectrumNumber(i);
            boolean masked = workspace.isMasked(i) || spectra.contains(number)
                || geometry.position(number).map(p -> outsideGeometricMask(p, mask)).orElse(false);
            double[] x = workspace.readX(i);
            double[] y = workspace.readY(i);
            double[] e = workspace.readE(i);
            if (masked) {
                maskedCount++;
                Arrays.fill(y, 0.0);
                Arrays.fill(e, 0.0);
            } else {
                maskTimeBins(x, y, e, mask);
            }
            out.spectrum(number, x, y, e, masked);
        }
        logger.debug("masked {} of {} spectra in {}", maskedCount, workspace.spectrumCount(), workspace.name());
        return out.build();
    }

    private static boolean outsideGeometricMask(DetectorPosition position, MaskState mask) {
        if (mask.hasRadiusMask()) {
            double radiusMm = position.radius() * 1000.0;
            if (radiusMm < mask.radiusMin() || radiusMm > mask.radiusMax()) {
                return true;
            }
        }
        if (mask.hasPhiMask()) {
            double phi = position.phiDegrees();
            boolean inside = phi >= mask.phiMin() && phi <= mask.phiMax();
            if (!inside && mask.phiMirror()) {
                double mirrored = phi > 0 ? phi - 180.0 : phi + 180.0;
                inside = mirrored >= mask.phiMin() && mirrored <= mask.phiMax();
            }
            return !inside;
        }
        return false;
    }

    private static void maskTimeBins(double[] x, double[] y, double[] e, MaskState mask) {
        if (mask.timeStart() == null || mask.timeStart().isEmpty()) {
            return;
        }
        double[] centres = Binning.centres(x);
        for (int k = 0; k < mask.timeStart().size(); k++) {
            double start = mask.timeStart().get(k);
            double stop = mask.timeStop().get(k);
            for (int j = 0; j < centres.length; j++) {
                if (centres[j] >= start && centres[j] <= stop) {
                    y[j] = 0.0;
                    e[j] = 0.0;
                }
            }
        }
    }

    @Override
    public Workspace move(Workspace workspace, MoveState.BankMove move, double sampleOffset) {
        double angle = Math.toRadians(move.rotation());
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        InstrumentGeometry moved = workspace.geometry().mapBank(move.bank(), p -> {
            double x = p.x();
            double y = p.y();
            if (move.hasCentre()) {
                x -= move.centrePos1();
                y -= move.centrePos2();
            }
            double rx = x * cos - y * sin;
            double ry = x * sin + y * cos;
            return p.movedTo(rx + move.x(), ry + move.y(), p.z() + move.z() - sampleOffset);
        });
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name() + "_moved").geometry(moved);
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            copySpectrum(workspace, i, out, workspace.isMasked(i));
        }
        return out.build();
    }

    @Override
    public Workspace convertToWavelength(Workspace workspace, WavelengthState wavelength, WavRange range) {
        double[] edges = edges(wavelength, range);
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name() + "_wl_" + range.low() + "_" + range.high());
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            double[][] rebinned = Binning.rebin(workspace.readX(i), workspace.readY(i), workspace.readE(i), edges);
            out.spectrum(workspace.spectrumNumber(i), edges, rebinned[0], rebinned[1], workspace.isMasked(i));
        }
        return out.build();
    }

    private static double[] edges(WavelengthState wavelength, WavRange range) {
        return Binning.edges(range.low(), range.high(), wavelength.step(), wavelength.stepType());
    }

    @Override
    public Workspace normalizeToMonitor(Workspace monitors, NormalizeToMonitorState normalize,
                                        WavelengthState wavelength, WavRange range) {
        int index = requireSpectrum(monitors, normalize.incidentMonitor());
        double[] x = monitors.readX(index);
        double[] y = monitors.readY(index);
        double[] e = monitors.readE(index);
        double[] centres = Binning.centres(x);
        if (normalize.hasPromptPeak()) {
            interpolateOver(centres, y, normalize.promptPeakMin(), normalize.promptPeakMax());
        }
        if (normalize.hasBackgroundWindow()) {
            double sum = 0;
            int n = 0;
            for (int j = 0; j < centres.length; j++) {
                if (centres[j] >= normalize.backgroundTofStart() && centres[j] <= normalize.backgroundTofStop()) {
                    sum += y[j];
                    n++;
                }
            }
            if (n > 0) {
                double flat = sum / n;
                for (int j = 0; j < y.length; j++) {
                    y[j] -= flat;
                }
            }
        }
        RebinType rebinType = normalize.rebinType() == null ? RebinType.REBIN : normalize.rebinType();
        double[] edges = edges(wavelength, range);
        double[][] rebinned = Binning.rebin(rebinType, x, y, e, edges);
        return ArrayWorkspace.like(monitors, monitors.name() + "_incident")
            .geometry(InstrumentGeometry.empty())
            .spectrum(normalize.incidentMonitor(), edges, rebinned[0], rebinned[1], false)
            .build();
    }

    private static void interpolateOver(double[] centres, double[] y, double from, double to) {
        int first = -1;
        int last = -1;
        for (int j = 0; j < centres.length; j++) {
            if (centres[j] >= from && centres[j] <= to) {
                if (first < 0) {
                    first = j;
                }
                last = j;
            }
        }
        if (first < 0) {
            return;
        }
        int lo = first - 1;
        int hi = last + 1;
        if (lo < 0 && hi >= y.length) {
            return;
        }
        double left = lo < 0 ? y[hi] : y[lo];
        double right = hi >= y.length ? y[lo] : y[hi];
        double leftX = lo < 0 ? centres[first] : centres[lo];
        double rightX = hi >= y.length ? centres[last] : centres[hi];
        for (int j = first; j <= last; j++) {
            double t = rightX == leftX ? 0 : (centres[j] - leftX) / (rightX - leftX);
            y[j] = left + t * (right - left);
        }
    }

    @Override
    public TransmissionResult transmission(Workspace transmissionMonitors, Workspace directMonitors,
                                           TransmissionState transmission, int incidentMonitor,
                                           WavelengthState wavelength, WavRange range) {
        double[] edges = edges(wavelength, range);
        double[][] trans = monitorRatio(transmissionMonitors, transmission.transmissionMonitor(), incidentMonitor, edges);
        double[][] direct = monitorRatio(directMonitors, transmission.transmissionMonitor(), incidentMonitor, edges);
        double[][] ratio = combine(trans[0], trans[1], direct[0], direct[1], Op.DIVIDE);

        String base = transmissionMonitors.name() + "_trans_" + range.low() + "_" + range.high();
        Workspace unfitted = ArrayWorkspace.builder(base + "_unfitted")
            .spectrum(transmission.transmissionMonitor(), edges, ratio[0], ratio[1], false)
            .build();
        TransmissionFitType fitType = transmission.fitType() == null ? TransmissionFitType.LOG : transmission.fitType();
        if (fitType == TransmissionFitType.NONE) {
            return new TransmissionResult(unfitted, unfitted);
        }
        double[] fitted = fit(edges, ratio[0], transmission, fitType, range);
        Workspace fittedWs = ArrayWorkspace.builder(base)
            .spectrum(transmission.transmissionMonitor(), edges, fitted, new double[fitted.length], false)
            .build();
        return new TransmissionResult(fittedWs, unfitted);
    }

    private double[][] monitorRatio(Workspace monitors, int monitor, int incident, double[] edges) {
        int m = requireSpectrum(monitors, monitor);
        int inc = requireSpectrum(monitors, incident);
        double[][] num = Binning.rebin(monitors.readX(m), monitors.readY(m), monitors.readE(m), edges);
        double[][] den = Binning.rebin(monitors.readX(inc), monitors.readY(inc), monitors.readE(inc), edges);
        return combine(num[0], num[1], den[0], den[1], Op.DIVIDE);
    }

    private static double[] fit(double[] edges, double[] ratio, TransmissionState transmission,
                                TransmissionFitType fitType, WavRange range) {
        double low = transmission.hasFitWindow() ? transmission.fitWavelengthLow() : range.low();
        double high = transmission.hasFitWindow() ? transmission.fitWavelengthHigh() : range.high();
        double[] centres = Binning.centres(edges);
        List<double[]> points = new ArrayList<>();
        for (int j = 0; j < centres.length; j++) {
            if (centres[j] >= low && centres[j] <= high && ratio[j] > 0 && Double.isFinite(ratio[j])) {
                points.add(new double[]{centres[j], fitType == TransmissionFitType.LOG ? Math.log(ratio[j]) : ratio[j]});
            }
        }
        double[] xs = points.stream().mapToDouble(p -> p[0]).toArray();
        double[] ys = points.stream().mapToDouble(p -> p[1]).toArray();
        int order = fitType == TransmissionFitType.POLYNOMIAL ? transmission.polynomialOrder() : 1;
        double[] coefficients = LeastSquares.polynomial(xs, ys, order);
        double[] fitted = new double[centres.length];
        for (int j = 0; j < centres.length; j++) {
            double value = LeastSquares.evaluate(coefficients, centres[j]);
            fitted[j] = fitType == TransmissionFitType.LOG ? Math.exp(value) : value;
        }
        logger.debug("{} transmission fit over [{}, {}] with {} points", fitType, low, high, xs.length);
        return fitted;
    }

    @Override
    public QParts convertToQ(Workspace wavelengthCounts, Workspace wavelengthAdjustment, ConvertToQState q) {
        if (!q.isOneDimensional()) {
            throw new UnsupportedOperationException("only one-dimensional reduction is supported");
        }
        if (q.useGravity()) {
            logger.debug("gravity correction is not modelled for {}", wavelengthCounts.name());
        }
        double[] qEdges = Binning.edges(q.qMin(), q.qMax(), q.qStep(), q.qStepType());
        int bins = qEdges.length - 1;
        double[] counts = new double[bins];
        double[] countErr2 = new double[bins];
        double[] norm = new double[bins];
        double[] adjustment = wavelengthAdjustment.readY(0);
        for (int i = 0; i < wavelengthCounts.spectrumCount(); i++) {
            if (wavelengthCounts.isMasked(i)) {
                continue;
            }
            int number = wavelengthCounts.spectrumNumber(i);
            DetectorPosition position = wavelengthCounts.geometry().position(number)
                .orElseThrow(() -> new IllegalStateException("spectrum " + number + " has no detector position"));
            double[] x = wavelengthCounts.readX(i);
            if (!Binning.sameEdges(x, wavelengthAdjustment.readX(0))) {
                throw new IllegalArgumentException("wavelength binning of " + wavelengthCounts.name()
                    + " differs from " + wavelengthAdjustment.name());
            }
            double[] y = wavelengthCounts.readY(i);
            double[] e = wavelengthCounts.readE(i);
            double sinTheta = Math.sin(position.twoTheta() / 2.0);
            double radiusMm = position.radius() * 1000.0;
            double[] lambda = Binning.centres(x);
            for (int j = 0; j < lambda.length; j++) {
                if (q.radiusCutoff() > 0 && radiusMm < q.radiusCutoff() && lambda[j] < q.wavelengthCutoff()) {
                    continue;
                }
                int k = Binning.findBin(qEdges, 4.0 * Math.PI * sinTheta / lambda[j]);
                if (k < 0) {
                    continue;
                }
                counts[k] += y[j];
                countErr2[k] += e[j] * e[j];
                norm[k] += adjustment[j];
            }
        }
        for (int k = 0; k < bins; k++) {
            countErr2[k] = Math.sqrt(countErr2[k]);
        }
        Workspace countWs = ArrayWorkspace.like(wavelengthCounts, wavelengthCounts.name() + "_q_counts")
            .geometry(InstrumentGeometry.empty())
            .spectrum(1, qEdges, counts, countErr2, false)
            .build();
        Workspace normWs = ArrayWorkspace.builder(wavelengthCounts.name() + "_q_norm")
            .spectrum(1, qEdges, norm, new double[bins], false)
            .build();
        return new QParts(countWs, normWs);
    }

    @Override
    public Workspace divide(Workspace numerator, Workspace denominator) {
        return binary(numerator, denominator, Op.DIVIDE);
    }

    @Override
    public Workspace multiply(Workspace a, Workspace b) {
        return binary(a, b, Op.MULTIPLY);
    }

    @Override
    public Workspace plus(Workspace a, Workspace b) {
        return binary(a, b, Op.PLUS);
    }

    @Override
    public Workspace minus(Workspace a, Workspace b) {
        return binary(a, b, Op.MINUS);
    }

    @Override
    public Workspace scale(Workspace workspace, double factor) {
        ArrayWorkspace.Builder out = ArrayWorkspace.like(workspace, workspace.name());
        for (int i = 0; i < workspace.spectrumCount(); i++) {
            out.spectrum(workspace.spectrumNumber(i), workspace.readX(i), times(workspace.readY(i), factor),
                times(workspace.readE(i), Math.abs(factor)), workspace.isMasked(i));
        }
        return out.build();
    }

    @Override
    public Workspace create(String name, Workspace template, double[] y, double[] e) {
        return ArrayWorkspace.like(template, name)
            .geometry(InstrumentGeometry.empty())
            .spectrum(template.spectrumNumber(0), template.readX(0), y, e, false)
            .build();
    }

    private enum Op {
        PLUS((a, b) -> a + b),
        MINUS((a, b) -> a - b),
        MULTIPLY((a, b) -> a * b),
        DIVIDE((a, b) -> b == 0 ? 0.0 : a / b);

        private final DoubleBinaryOperator value;

        Op(DoubleBinaryOperator value) {
            this.value = value;
        }

        double error(double a, double ea, double b, double eb) {
            switch (this) {
                case PLUS:
                case MINUS:
                    return Math.hypot(ea, eb);
                case MULTIPLY:
                    return Math.hypot(ea * b, a * eb);
                default:
                    return b == 0 ? 0.0 : Math.hypot(ea / b, a * eb / (b * b));
            }
        }
    }

    private static Workspace binary(Workspace a, Workspace b, Op op) {
        boolean broadcast = b.spectrumCount() == 1 && a.spectrumCount() > 1;
        if (!broadcast && a.spectrumCount() != b.spectrumCount()) {
            throw new IllegalArgumentException(a.name() + " has " + a.spectrumCount() + " spectra, "
                + b.name() + " has " + b.spectrumCount());
        }
        ArrayWorkspace.Builder out = ArrayWorkspace.like(a, a.name());
        for (int i = 0; i < a.spectrumCount(); i++) {
            int bi = broadcast ? 0 : i;
            double[] x = a.readX(i);
            if (!Binning.sameEdges(x, b.readX(bi))) {
                throw new IllegalArgumentException("binning of " + a.name() + " differs from " + b.name());
            }
            double[][] result = combine(a.readY(i), a.readE(i), b.readY(bi), b.readE(bi), op);
            out.spectrum(a.spectrumNumber(i), x, result[0], result[1], a.isMasked(i));
        }
        return out.build();
    }

    private static double[][] combine(double[] ay, double[] ae, double[] by, double[] be, Op op) {
        double[] y = new double[ay.length];
        double[] e = new double[ay.length];
        for (int j = 0; j < y.length; j++) {
            y[j] = op.value.applyAsDouble(ay[j], by[j]);
            e[j] = op.error(ay[j], ae[j], by[j], be[j]);
        }
        return new double[][]{y, e};
    }

    private static int requireSpectrum(Workspace workspace, Integer number) {
        int index = number == null ? -1 : workspace.indexOf(number);
        if (index < 0) {
            throw new IllegalArgumentException(workspace.name() + " has no spectrum " + number);
        }
        return index;
    }

    private static void copySpectrum(Workspace from, int index, ArrayWorkspace.Builder to, boolean masked) {
        to.spectrum(from.spectrumNumber(index), from.readX(index), from.readY(index), from.readE(index), masked);
    }

    private static double[] times(double[] values, double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * factor;
        }
        return out;
    }
}
