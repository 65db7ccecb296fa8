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

/// Polynomial least-squares fitting through the normal equations.
final class LeastSquares {

    private LeastSquares() {
    }

    /// @return coefficients c0..cN of {@code y = c0 + c1·x + … + cN·x^N}
    static double[] polynomial(double[] x, double[] y, int order) {
        int n = order + 1;
        if (x.length < n) {
            throw new IllegalStateException("a fit of order " + order + " needs at least " + n + " points, got " + x.length);
        }
        double[][] a = new double[n][n + 1];
        for (int p = 0; p < x.length; p++) {
            double[] powers = new double[2 * n - 1];
            powers[0] = 1.0;
            for (int k = 1; k < powers.length; k++) {
                powers[k] = powers[k - 1] * x[p];
            }
            for (int r = 0; r < n; r++) {
                for (int c = 0; c < n; c++) {
                    a[r][c] += powers[r + c];
                }
                a[r][n] += powers[r] * y[p];
            }
        }
        return solve(a, n);
    }

    static double evaluate(double[] coefficients, double x) {
        double value = 0;
        for (int k = coefficients.length - 1; k >= 0; k--) {
            value = value * x + coefficients[k];
        }
        return value;
    }

    private static double[] solve(double[][] a, int n) {
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(a[pivot][col]) < 1e-300) {
                throw new IllegalStateException("fit is degenerate");
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;
            for (int r = 0; r < n; r++) {
                if (r != col) {
                    double factor = a[r][col] / a[col][col];
                    for (int c = col; c <= n; c++) {
                        a[r][c] -= factor * a[col][c];
                    }
                }
            }
        }
        double[] solution = new double[n];
        for (int r = 0; r < n; r++) {
            solution[r] = a[r][n] / a[r][r];
        }
        return solution;
    }
}
