/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.celldegradation.detector;

import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.exceptions.DetectorConvergenceException;

/**
 * Boundary detector. Solves the dual of the nu one-class SVM
 *
 * <pre>
 *   min 1/2 a'Qa   subject to 0 &lt;= a_i &lt;= 1, sum(a) = nu * n
 * </pre>
 *
 * by sequential minimal optimization with maximal violating pair selection.
 * The score of a row is rho - sum_j a_j K(x_j, x), positive outside the
 * learned boundary. A solve that does not reach the tolerance within the
 * iteration budget raises {@link DetectorConvergenceException}.
 */
public class OneClassSvmDetector extends AbstractAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(OneClassSvmDetector.class);

    public static final double DEFAULT_NU = 0.05;

    public static final double DEFAULT_TOLERANCE = 1e-3;

    public static final int DEFAULT_MAX_ITERATIONS = 100000;

    static final double TAU = 1e-12;

    // kernel rows kept in memory, in doubles
    static final long CACHE_BUDGET = 16_000_000L;

    private final double nu;
    private final SvmKernel kernel;
    private final double gamma;
    private final double coef0;
    private final int degree;
    private final double tolerance;
    private final int maxIterations;

    protected OneClassSvmDetector(Builder builder) {
        super(DetectorType.ONE_CLASS_SVM, builder);
        checkParameter(builder.nu > 0 && builder.nu <= 1, "nu must be in (0, 1]");
        checkParameter(builder.kernel != null, "kernel cannot be null");
        checkParameter(Double.isNaN(builder.gamma) || builder.gamma > 0, "gamma must be positive");
        checkParameter(builder.degree >= 1, "degree must be at least 1");
        checkParameter(builder.tolerance > 0, "tolerance must be positive");
        checkParameter(builder.maxIterations > 0, "max_iterations must be positive");
        nu = builder.nu;
        kernel = builder.kernel;
        gamma = builder.gamma;
        coef0 = builder.coef0;
        degree = builder.degree;
        tolerance = builder.tolerance;
        maxIterations = builder.maxIterations;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected double[] score(double[][] points) {
        int n = points.length;
        double effectiveGamma = Double.isNaN(gamma) ? 1.0 / Math.max(1, points[0].length) : gamma;
        KernelRows q = new KernelRows(points, effectiveGamma);

        double[] alpha = new double[n];
        double mass = nu * n;
        int full = (int) Math.floor(mass);
        for (int i = 0; i < Math.min(full, n); i++) {
            alpha[i] = 1;
        }
        if (full < n) {
            alpha[full] = mass - full;
        }

        double[] gradient = new double[n];
        for (int j = 0; j < n; j++) {
            if (alpha[j] > 0) {
                double[] row = q.row(j);
                for (int k = 0; k < n; k++) {
                    gradient[k] += alpha[j] * row[k];
                }
            }
        }

        int iterations = 0;
        while (true) {
            int i = -1;
            int j = -1;
            double gmax = Double.NEGATIVE_INFINITY;
            double gmax2 = Double.NEGATIVE_INFINITY;
            for (int t = 0; t < n; t++) {
                if (alpha[t] < 1 && -gradient[t] > gmax) {
                    gmax = -gradient[t];
                    i = t;
                }
                if (alpha[t] > 0 && gradient[t] > gmax2) {
                    gmax2 = gradient[t];
                    j = t;
                }
            }
            if (i == -1 || j == -1 || gmax + gmax2 < tolerance) {
                break;
            }
            if (++iterations > maxIterations) {
                throw new DetectorConvergenceException(name, maxIterations,
                        "one-class SVM did not reach tolerance " + tolerance);
            }

            double[] rowI = q.row(i);
            double[] rowJ = q.row(j);
            double quad = rowI[i] + rowJ[j] - 2 * rowI[j];
            if (quad <= 0) {
                quad = TAU;
            }
            double oldI = alpha[i];
            double oldJ = alpha[j];
            double delta = (gradient[i] - gradient[j]) / quad;
            double sum = oldI + oldJ;
            double newI = oldI - delta;
            double newJ = oldJ + delta;
            if (newI > 1) {
                newI = 1;
                newJ = sum - 1;
            } else if (newI < 0) {
                newI = 0;
                newJ = sum;
            }
            if (newJ > 1) {
                newJ = 1;
                newI = sum - 1;
            } else if (newJ < 0) {
                newJ = 0;
                newI = sum;
            }
            alpha[i] = newI;
            alpha[j] = newJ;
            double deltaI = newI - oldI;
            double deltaJ = newJ - oldJ;
            for (int k = 0; k < n; k++) {
                gradient[k] += rowI[k] * deltaI + rowJ[k] * deltaJ;
            }
        }

        double rho = offset(alpha, gradient);
        log.debug("{} converged after {} iterations, rho {}", name, iterations, rho);

        double[] scores = new double[n];
        for (int k = 0; k < n; k++) {
            double decision = 0;
            for (int j = 0; j < n; j++) {
                if (alpha[j] > 0) {
                    decision += alpha[j] * kernel.apply(points[j], points[k], effectiveGamma, coef0, degree);
                }
            }
            scores[k] = rho - decision;
        }
        return scores;
    }

    /**
     * rho is the gradient averaged over the free multipliers, or the midpoint of
     * the feasible interval when every multiplier is at a bound
     */
    static double offset(double[] alpha, double[] gradient) {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double sum = 0;
        int free = 0;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] >= 1) {
                lower = Math.max(lower, gradient[t]);
            } else if (alpha[t] <= 0) {
                upper = Math.min(upper, gradient[t]);
            } else {
                sum += gradient[t];
                ++free;
            }
        }
        if (free > 0) {
            return sum / free;
        }
        if (Double.isInfinite(upper)) {
            return lower;
        }
        if (Double.isInfinite(lower)) {
            return upper;
        }
        return (upper + lower) / 2;
    }

    public double getNu() {
        return nu;
    }

    public SvmKernel getKernel() {
        return kernel;
    }

    public double getGamma() {
        return gamma;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Kernel matrix rows computed on demand and kept in a bounded LRU cache.
     */
    private class KernelRows {

        private final double[][] points;
        private final double effectiveGamma;
        private final Map<Integer, double[]> cache;

        KernelRows(double[][] points, double effectiveGamma) {
            this.points = points;
            this.effectiveGamma = effectiveGamma;
            final int capacity = (int) Math.max(2, Math.min(points.length, CACHE_BUDGET / points.length));
            this.cache = new LinkedHashMap<Integer, double[]>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                    return size() > capacity;
                }
            };
        }

        double[] row(int i) {
            double[] row = cache.get(i);
            if (row == null) {
                row = new double[points.length];
                for (int k = 0; k < points.length; k++) {
                    row[k] = kernel.apply(points[i], points[k], effectiveGamma, coef0, degree);
                }
                cache.put(i, row);
            }
            return row;
        }
    }

    public static class Builder extends AbstractAnomalyDetector.Builder<Builder> {

        private double nu = DEFAULT_NU;
        private SvmKernel kernel = SvmKernel.RBF;
        private double gamma = Double.NaN;
        private double coef0 = 0;
        private int degree = 3;
        private double tolerance = DEFAULT_TOLERANCE;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;

        public Builder nu(double nu) {
            this.nu = nu;
            return this;
        }

        public Builder kernel(SvmKernel kernel) {
            this.kernel = kernel;
            return this;
        }

        /**
         * @param gamma kernel coefficient; NaN selects 1 / number of features
         * @return this builder
         */
        public Builder gamma(double gamma) {
            this.gamma = gamma;
            return this;
        }

        public Builder coef0(double coef0) {
            this.coef0 = coef0;
            return this;
        }

        public Builder degree(int degree) {
            this.degree = degree;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public OneClassSvmDetector build() {
            return new OneClassSvmDetector(this);
        }
    }
}
