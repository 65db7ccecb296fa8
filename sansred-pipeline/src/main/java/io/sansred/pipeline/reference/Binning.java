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

import io.sansred.state.types.RangeStepType;
import io.sansred.state.types.RebinType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Bin edge generation and histogram rebinning.
final class Binning {

    private static final double EDGE_TOLERANCE = 1e-9;

    private Binning() {
    }

    /// @return edges from low to high; LIN steps add {@code step}, LOG steps multiply by
    /// {@code 1 + step}. The last bin is truncated at high.
    static double[] edges(double low, double high, double step, RangeStepType type) {
        if (!(low < high) || !(step > 0)) {
            throw new IllegalArgumentException("cannot bin " + low + ".." + high + " with step " + step);
        }
        if (type == RangeStepType.LOG && !(low > 0)) {
            throw new IllegalArgumentException("LOG binning needs a positive start, got " + low);
        }
        List<Double> edges = new ArrayList<>();
        edges.add(low);
        double current = low;
        int i = 0;
        while (true) {
            i++;
            double next = type == RangeStepType.LOG ? current * (1 + step) : low + i * step;
            if (next >= high - EDGE_TOLERANCE * Math.max(1.0, Math.abs(high))) {
                edges.add(high);
                break;
            }
            edges.add(next);
            current = next;
        }
        return edges.stream().mapToDouble(Double::doubleValue).toArray();
    }

    static double[] centres(double[] edges) {
        double[] c = new double[edges.length - 1];
        for (int i = 0; i < c.length; i++) {
            c[i] = 0.5 * (edges[i] + edges[i + 1]);
        }
        return c;
    }

    /// @return the bin holding the value, or -1 outside the edges
    static int findBin(double[] edges, double value) {
        if (value < edges[0] || value >= edges[edges.length - 1]) {
            return -1;
        }
        int pos = Arrays.binarySearch(edges, value);
        return pos >= 0 ? pos : -pos - 2;
    }

    static boolean sameEdges(double[] a, double[] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > EDGE_TOLERANCE * Math.max(1.0, Math.abs(a[i]))) {
                return false;
            }
        }
        return true;
    }

    /// Rebins counts by the fraction of each old bin that overlaps each new bin. Errors add in
    /// quadrature with the same fractions. Returns {values, errors}.
    static double[][] rebin(double[] oldEdges, double[] values, double[] errors, double[] newEdges) {
        double[] out = new double[newEdges.length - 1];
        double[] err2 = new double[out.length];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            double lo = oldEdges[i];
            double hi = oldEdges[i + 1];
            double width = hi - lo;
            while (j > 0 && newEdges[j] > lo) {
                j--;
            }
            for (int k = j; k < out.length; k++) {
                double overlap = Math.min(hi, newEdges[k + 1]) - Math.max(lo, newEdges[k]);
                if (newEdges[k] >= hi) {
                    break;
                }
                if (overlap > 0) {
                    double fraction = overlap / width;
                    out[k] += values[i] * fraction;
                    err2[k] += errors[i] * errors[i] * fraction * fraction;
                    j = k;
                }
            }
        }
        for (int k = 0; k < err2.length; k++) {
            err2[k] = Math.sqrt(err2[k]);
        }
        return new double[][]{out, err2};
    }

    /// Rebins by interpolating the count density at the new bin centres.
    static double[][] interpolate(double[] oldEdges, double[] values, double[] errors, double[] newEdges) {
        double[] oldCentres = centres(oldEdges);
        double[] density = new double[values.length];
        double[] errDensity = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double width = oldEdges[i + 1] - oldEdges[i];
            density[i] = values[i] / width;
            errDensity[i] = errors[i] / width;
        }
        double[] newCentres = centres(newEdges);
        double[] out = new double[newCentres.length];
        double[] err = new double[newCentres.length];
        for (int k = 0; k < newCentres.length; k++) {
            double width = newEdges[k + 1] - newEdges[k];
            out[k] = interpolateAt(oldCentres, density, newCentres[k]) * width;
            err[k] = interpolateAt(oldCentres, errDensity, newCentres[k]) * width;
        }
        return new double[][]{out, err};
    }

    static double[][] rebin(RebinType type, double[] oldEdges, double[] values, double[] errors, double[] newEdges) {
        return type == RebinType.INTERPOLATING_REBIN
            ? interpolate(oldEdges, values, errors, newEdges)
            : rebin(oldEdges, values, errors, newEdges);
    }

    private static double interpolateAt(double[] xs, double[] ys, double at) {
        if (at <= xs[0]) {
            return ys[0];
        }
        if (at >= xs[xs.length - 1]) {
            return ys[ys.length - 1];
        }
        int pos = Arrays.binarySearch(xs, at);
        if (pos >= 0) {
            return ys[pos];
        }
        int hi = -pos - 1;
        int lo = hi - 1;
        double t = (at - xs[lo]) / (xs[hi] - xs[lo]);
        return ys[lo] + t * (ys[hi] - ys[lo]);
    }
}
