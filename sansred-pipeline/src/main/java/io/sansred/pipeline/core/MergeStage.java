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

import io.sansred.pipeline.MergeException;
import io.sansred.pipeline.bundle.MergeBundle;
import io.sansred.pipeline.bundle.OutputBundle;
import io.sansred.pipeline.bundle.OutputPartsBundle;
import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.workspace.Workspace;
import io.sansred.state.fragment.ReductionState;
import io.sansred.state.types.FitMode;
import io.sansred.state.types.WavRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// Joins LAB and HAB curves of one wavelength range into a single curve.
///
/// The fit finds {@code LAB ≈ scale · HAB + shift} over the fit Q window, which defaults to
/// the Q range where both curves hold data. Merging from parts sums counts and normalizations
/// of both banks inside the merge window and divides once:
/// ```
/// (C_lab + scale·C_hab + shift·N_hab) / (N_lab + N_hab)
/// ```
/// Below the merge window only LAB is used, above it only the scaled HAB curve. Without a
/// merge window the sum covers the whole Q axis.
public class MergeStage {

    private static final Logger logger = LogManager.getLogger(MergeStage.class);

    private final ReductionEngine engine;

    public MergeStage(ReductionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /// Result of a scale and shift fit.
    public record Fit(double scale, double shift, int points) {
    }

    /// Merges sample parts of both banks, with can parts subtracted when given.
    ///
    /// @param labCan can parts for LAB, or null when there is no can
    /// @param habCan can parts for HAB, or null when there is no can
    public MergeBundle merge(ReductionState reduction, OutputPartsBundle lab, OutputPartsBundle hab,
                             OutputPartsBundle labCan, OutputPartsBundle habCan) {
        if ((labCan == null) != (habCan == null)) {
            throw new IllegalArgumentException("can parts must be given for both banks or neither");
        }
        double[] edges = lab.counts().readX(0);
        checkBinning(edges, hab.counts(), labCan == null ? null : labCan.counts(), habCan == null ? null : habCan.counts());
        int n = edges.length - 1;
        Curve labCurve = Curve.of(lab.counts(), lab.normalization());
        Curve habCurve = Curve.of(hab.counts(), hab.normalization());
        Curve labCanCurve = labCan == null ? Curve.empty(n) : Curve.of(labCan.counts(), labCan.normalization());
        Curve habCanCurve = habCan == null ? Curve.empty(n) : Curve.of(habCan.counts(), habCan.normalization());

        double[] l = subtract(labCurve.divided(), labCanCurve.divided());
        double[] h = subtract(habCurve.divided(), habCanCurve.divided());
        boolean[] lPresent = labCurve.present();
        boolean[] hPresent = habCurve.present();
        double[] q = centres(edges);
        Fit fit = fit(reduction, q, l, lPresent, h, hPresent);

        double[] y = new double[n];
        double[] e = new double[n];
        double[] scaledY = new double[n];
        double[] scaledE = new double[n];
        for (int i = 0; i < n; i++) {
            Region region = region(reduction, q[i]);
            double[] sample = mergeBin(region, fit, labCurve, habCurve, i, true);
            double[] can = mergeBin(region, fit, labCanCurve, habCanCurve, i, false);
            y[i] = sample[0] - can[0];
            e[i] = Math.hypot(sample[1], can[1]);
            scaledY[i] = hPresent[i] ? fit.scale() * h[i] + fit.shift() : 0.0;
            scaledE[i] = hPresent[i] ? Math.abs(fit.scale()) * Math.hypot(habCurve.dividedError(i), habCanCurve.dividedError(i)) : 0.0;
        }
        Workspace merged = engine.create(lab.counts().name() + "_merged", lab.counts(), y, e);
        Workspace scaledHab = engine.create(hab.counts().name() + "_scaled", hab.counts(), scaledY, scaledE);
        return new MergeBundle(merged, fit.shift(), fit.scale(), scaledHab, lab.wavRange());
    }

    /// Merges divided curves: the mean of LAB and the scaled HAB curve inside the merge window.
    public MergeBundle merge(ReductionState reduction, OutputBundle lab, OutputBundle hab) {
        Workspace labWs = lab.workspace();
        Workspace habWs = hab.workspace();
        double[] edges = labWs.readX(0);
        checkBinning(edges, habWs, null, null);
        double[] l = labWs.readY(0);
        double[] le = labWs.readE(0);
        double[] h = habWs.readY(0);
        double[] he = habWs.readE(0);
        boolean[] lPresent = present(l, le);
        boolean[] hPresent = present(h, he);
        double[] q = centres(edges);
        Fit fit = fit(reduction, q, l, lPresent, h, hPresent);

        int n = l.length;
        double[] y = new double[n];
        double[] e = new double[n];
        double[] scaledY = new double[n];
        double[] scaledE = new double[n];
        double s = fit.scale();
        for (int i = 0; i < n; i++) {
            double sh = s * h[i] + fit.shift();
            double she = Math.abs(s) * he[i];
            scaledY[i] = hPresent[i] ? sh : 0.0;
            scaledE[i] = hPresent[i] ? she : 0.0;
            Region region = region(reduction, q[i]);
            boolean useLab = lPresent[i] && region != Region.ABOVE;
            boolean useHab = hPresent[i] && region != Region.BELOW;
            if (useLab && useHab) {
                y[i] = 0.5 * (l[i] + sh);
                e[i] = 0.5 * Math.hypot(le[i], she);
            } else if (useLab) {
                y[i] = l[i];
                e[i] = le[i];
            } else if (useHab) {
                y[i] = sh;
                e[i] = she;
            }
        }
        Workspace merged = engine.create(labWs.name() + "_merged", labWs, y, e);
        Workspace scaledHab = engine.create(habWs.name() + "_scaled", habWs, scaledY, scaledE);
        return new MergeBundle(merged, fit.shift(), fit.scale(), scaledHab, lab.wavRange());
    }

    /// Fits {@code l ≈ scale · h + shift} over the fit window according to the fit mode.
    ///
    /// @throws MergeException with fewer than two usable points or a degenerate fit
    public Fit fit(ReductionState reduction, double[] q, double[] l, boolean[] lPresent, double[] h, boolean[] hPresent) {
        FitMode mode = reduction.mergeFitMode() == null ? FitMode.NONE : reduction.mergeFitMode();
        if (mode == FitMode.NONE) {
            return new Fit(reduction.mergeScale(), reduction.mergeShift(), 0);
        }
        double low;
        double high;
        if (reduction.hasFitWindow()) {
            low = reduction.mergeFitQMin();
            high = reduction.mergeFitQMax();
        } else {
            low = Math.max(firstPresent(q, lPresent), firstPresent(q, hPresent));
            high = Math.min(lastPresent(q, lPresent), lastPresent(q, hPresent));
        }
        int count = 0;
        double[] xs = new double[q.length];
        double[] ys = new double[q.length];
        for (int i = 0; i < q.length; i++) {
            if (q[i] >= low && q[i] <= high && lPresent[i] && hPresent[i]) {
                xs[count] = h[i];
                ys[count] = l[i];
                count++;
            }
        }
        if (count < 2) {
            throw new MergeException("need at least 2 overlapping points to fit " + mode + " between Q "
                + low + " and " + high + ", found " + count);
        }
        double scale = reduction.mergeScale();
        double shift = reduction.mergeShift();
        switch (mode) {
            case BOTH -> {
                double meanX = mean(xs, count);
                double meanY = mean(ys, count);
                double sxx = 0;
                double sxy = 0;
                for (int i = 0; i < count; i++) {
                    sxx += (xs[i] - meanX) * (xs[i] - meanX);
                    sxy += (xs[i] - meanX) * (ys[i] - meanY);
                }
                if (sxx == 0) {
                    throw new MergeException("HAB is constant over the fit window; scale and shift are undetermined");
                }
                scale = sxy / sxx;
                shift = meanY - scale * meanX;
            }
            case SCALE_ONLY -> {
                double sxx = 0;
                double sxy = 0;
                for (int i = 0; i < count; i++) {
                    sxx += xs[i] * xs[i];
                    sxy += xs[i] * (ys[i] - shift);
                }
                if (sxx == 0) {
                    throw new MergeException("HAB is zero over the fit window; scale is undetermined");
                }
                scale = sxy / sxx;
            }
            case SHIFT_ONLY -> {
                double sum = 0;
                for (int i = 0; i < count; i++) {
                    sum += ys[i] - scale * xs[i];
                }
                shift = sum / count;
            }
            default -> throw new IllegalStateException("unhandled fit mode " + mode);
        }
        if (!Double.isFinite(scale) || !Double.isFinite(shift) || scale == 0) {
            throw new MergeException("fit gave unusable scale " + scale + " and shift " + shift);
        }
        logger.debug("merge fit {} over Q [{}, {}] with {} points: scale={} shift={}", mode, low, high, count, scale, shift);
        return new Fit(scale, shift, count);
    }

    private enum Region {
        BELOW,
        INSIDE,
        ABOVE
    }

    private static Region region(ReductionState reduction, double q) {
        if (!reduction.hasMergeWindow()) {
            return Region.INSIDE;
        }
        if (q < reduction.mergeQMin()) {
            return Region.BELOW;
        }
        return q > reduction.mergeQMax() ? Region.ABOVE : Region.INSIDE;
    }

    /// @return {value, error} of one merged bin; the shift only applies to sample data
    private static double[] mergeBin(Region region, Fit fit, Curve lab, Curve hab, int i, boolean sample) {
        double shift = sample ? fit.shift() : 0.0;
        double s = fit.scale();
        return switch (region) {
            case BELOW -> new double[]{lab.dividedValue(i), lab.dividedError(i)};
            case ABOVE -> hab.norm[i] == 0 ? new double[]{0, 0}
                : new double[]{s * hab.dividedValue(i) + shift, Math.abs(s) * hab.dividedError(i)};
            case INSIDE -> {
                double norm = lab.norm[i] + hab.norm[i];
                if (norm == 0) {
                    yield new double[]{0, 0};
                }
                double numerator = lab.counts[i] + s * hab.counts[i] + shift * hab.norm[i];
                double error = Math.hypot(lab.countErrors[i], s * hab.countErrors[i]);
                yield new double[]{numerator / norm, error / norm};
            }
        };
    }

    private static void checkBinning(double[] edges, Workspace hab, Workspace labCan, Workspace habCan) {
        for (Workspace other : new Workspace[]{hab, labCan, habCan}) {
            if (other != null && !Arrays.equals(edges, other.readX(0))) {
                throw new MergeException("Q binning of " + other.name() + " differs from LAB");
            }
        }
    }

    /// Counts and normalization of one bank.
    private static final class Curve {

        private final double[] counts;
        private final double[] countErrors;
        private final double[] norm;

        private Curve(double[] counts, double[] countErrors, double[] norm) {
            this.counts = counts;
            this.countErrors = countErrors;
            this.norm = norm;
        }

        static Curve of(Workspace counts, Workspace normalization) {
            return new Curve(counts.readY(0), counts.readE(0), normalization.readY(0));
        }

        static Curve empty(int bins) {
            return new Curve(new double[bins], new double[bins], new double[bins]);
        }

        double dividedValue(int i) {
            return norm[i] == 0 ? 0.0 : counts[i] / norm[i];
        }

        double dividedError(int i) {
            return norm[i] == 0 ? 0.0 : countErrors[i] / norm[i];
        }

        double[] divided() {
            double[] out = new double[counts.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = dividedValue(i);
            }
            return out;
        }

        boolean[] present() {
            boolean[] out = new boolean[norm.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = norm[i] > 0;
            }
            return out;
        }
    }

    private static boolean[] present(double[] y, double[] e) {
        boolean[] out = new boolean[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = y[i] != 0 || e[i] != 0;
        }
        return out;
    }

    private static double[] subtract(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }

    static double[] centres(double[] edges) {
        double[] c = new double[edges.length - 1];
        for (int i = 0; i < c.length; i++) {
            c[i] = 0.5 * (edges[i] + edges[i + 1]);
        }
        return c;
    }

    private static double firstPresent(double[] q, boolean[] present) {
        for (int i = 0; i < q.length; i++) {
            if (present[i]) {
                return q[i];
            }
        }
        return Double.POSITIVE_INFINITY;
    }

    private static double lastPresent(double[] q, boolean[] present) {
        for (int i = q.length - 1; i >= 0; i--) {
            if (present[i]) {
                return q[i];
            }
        }
        return Double.NEGATIVE_INFINITY;
    }

    private static double mean(double[] values, int count) {
        double sum = 0;
        for (int i = 0; i < count; i++) {
            sum += values[i];
        }
        return sum / count;
    }
}
