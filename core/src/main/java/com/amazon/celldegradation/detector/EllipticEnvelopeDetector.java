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

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.exceptions.DetectorConvergenceException;

/**
 * Covariance detector. Estimates a robust location and scatter with the
 * minimum covariance determinant: several random starting subsets are refined
 * by concentration steps (keep the h rows closest in Mahalanobis distance,
 * re-estimate) until the subset stops changing, and the subset with the
 * smallest determinant wins. The estimate is then reweighted with the rows
 * inside the 97.5% chi-squared quantile. The score of a row is its squared
 * Mahalanobis distance under the final estimate.
 */
public class EllipticEnvelopeDetector extends AbstractAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(EllipticEnvelopeDetector.class);

    public static final int DEFAULT_NUMBER_OF_STARTS = 10;

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    public static final double DEFAULT_RIDGE = 1e-6;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    static final double REWEIGHT_QUANTILE = 0.975;

    private final double supportFraction;
    private final int numberOfStarts;
    private final int maxIterations;
    private final double ridge;
    private final long randomSeed;

    protected EllipticEnvelopeDetector(Builder builder) {
        super(DetectorType.ELLIPTIC_ENVELOPE, builder);
        checkParameter(Double.isNaN(builder.supportFraction)
                || (builder.supportFraction > 0 && builder.supportFraction <= 1), "support_fraction must be in (0, 1]");
        checkParameter(builder.numberOfStarts > 0, "number_of_starts must be positive");
        checkParameter(builder.maxIterations > 0, "max_iterations must be positive");
        checkParameter(builder.ridge >= 0, "ridge cannot be negative");
        supportFraction = builder.supportFraction;
        numberOfStarts = builder.numberOfStarts;
        maxIterations = builder.maxIterations;
        ridge = builder.ridge;
        randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected double[] score(double[][] points) {
        int n = points.length;
        int d = points[0].length;
        int h = Double.isNaN(supportFraction) ? (n + d + 1) / 2 : (int) Math.ceil(supportFraction * n);
        h = Math.max(1, Math.min(n, h));

        Random random = new Random(randomSeed);
        Estimate best = null;
        int converged = 0;
        for (int start = 0; start < numberOfStarts; start++) {
            int[] subset = randomSubset(n, Math.min(n, d + 1), random);
            Estimate estimate = Estimate.of(points, subset, ridge, name);
            boolean stable = false;
            for (int iteration = 0; iteration < maxIterations && !stable; iteration++) {
                int[] next = closest(points, estimate, h);
                stable = Arrays.equals(next, subset);
                subset = next;
                if (!stable) {
                    estimate = Estimate.of(points, subset, ridge, name);
                }
            }
            if (stable) {
                ++converged;
                if (best == null || estimate.determinant < best.determinant) {
                    best = estimate;
                }
            }
        }
        if (best == null) {
            throw new DetectorConvergenceException(name, maxIterations,
                    "no concentration run stabilised within the iteration budget");
        }
        log.debug("{}: {} of {} starts converged, determinant {}", name, converged, numberOfStarts, best.determinant);

        // reweighting step
        double cutoff = (d > 0) ? new ChiSquaredDistribution(d).inverseCumulativeProbability(REWEIGHT_QUANTILE)
                : Double.POSITIVE_INFINITY;
        double[] distances = best.distances(points);
        int count = 0;
        int[] inliers = new int[n];
        for (int i = 0; i < n; i++) {
            if (distances[i] <= cutoff) {
                inliers[count++] = i;
            }
        }
        if (count > d) {
            best = Estimate.of(points, Arrays.copyOf(inliers, count), ridge, name);
            distances = best.distances(points);
        }
        return distances;
    }

    static int[] randomSubset(int n, int size, Random random) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int swap = order[i];
            order[i] = order[j];
            order[j] = swap;
        }
        int[] subset = Arrays.copyOf(order, size);
        Arrays.sort(subset);
        return subset;
    }

    static int[] closest(double[][] points, Estimate estimate, int h) {
        final double[] distances = estimate.distances(points);
        Integer[] order = new Integer[points.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> distances[i]).thenComparingInt(i -> i));
        int[] subset = new int[h];
        for (int i = 0; i < h; i++) {
            subset[i] = order[i];
        }
        Arrays.sort(subset);
        return subset;
    }

    public double getSupportFraction() {
        return supportFraction;
    }

    public int getNumberOfStarts() {
        return numberOfStarts;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    /**
     * location, regularised scatter and its inverse for one subset of rows
     */
    static class Estimate {

        final double[] location;
        final double[][] precision;
        final double determinant;

        Estimate(double[] location, double[][] precision, double determinant) {
            this.location = location;
            this.precision = precision;
            this.determinant = determinant;
        }

        static Estimate of(double[][] points, int[] subset, double ridge, String detector) {
            int d = points[0].length;
            double[] location = new double[d];
            for (int index : subset) {
                for (int j = 0; j < d; j++) {
                    location[j] += points[index][j];
                }
            }
            for (int j = 0; j < d; j++) {
                location[j] /= subset.length;
            }
            double[][] scatter = new double[d][d];
            for (int index : subset) {
                for (int a = 0; a < d; a++) {
                    double da = points[index][a] - location[a];
                    for (int b = 0; b < d; b++) {
                        scatter[a][b] += da * (points[index][b] - location[b]);
                    }
                }
            }
            double trace = 0;
            for (int a = 0; a < d; a++) {
                for (int b = 0; b < d; b++) {
                    scatter[a][b] /= subset.length;
                }
                trace += scatter[a][a];
            }
            double lambda = ridge * Math.max(1.0, trace / Math.max(1, d));
            for (int a = 0; a < d; a++) {
                scatter[a][a] += lambda;
            }
            if (d == 0) {
                return new Estimate(location, scatter, 0);
            }
            RealMatrix matrix = new Array2DRowRealMatrix(scatter, false);
            LUDecomposition decomposition = new LUDecomposition(matrix, 0);
            DecompositionSolver solver = decomposition.getSolver();
            if (!solver.isNonSingular()) {
                throw new DetectorConvergenceException(detector, 0, "scatter matrix is singular");
            }
            return new Estimate(location, solver.getInverse().getData(), decomposition.getDeterminant());
        }

        double[] distances(double[][] points) {
            int d = location.length;
            double[] answer = new double[points.length];
            double[] centered = new double[d];
            for (int i = 0; i < points.length; i++) {
                for (int j = 0; j < d; j++) {
                    centered[j] = points[i][j] - location[j];
                }
                double sum = 0;
                for (int a = 0; a < d; a++) {
                    double row = 0;
                    for (int b = 0; b < d; b++) {
                        row += precision[a][b] * centered[b];
                    }
                    sum += centered[a] * row;
                }
                answer[i] = sum;
            }
            return answer;
        }
    }

    public static class Builder extends AbstractAnomalyDetector.Builder<Builder> {

        private double supportFraction = Double.NaN;
        private int numberOfStarts = DEFAULT_NUMBER_OF_STARTS;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double ridge = DEFAULT_RIDGE;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        /**
         * @param supportFraction fraction of rows in the robust subset; NaN
         *                        selects (n + d + 1) / 2 rows
         * @return this builder
         */
        public Builder supportFraction(double supportFraction) {
            this.supportFraction = supportFraction;
            return this;
        }

        public Builder numberOfStarts(int numberOfStarts) {
            this.numberOfStarts = numberOfStarts;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder ridge(double ridge) {
            this.ridge = ridge;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public EllipticEnvelopeDetector build() {
            return new EllipticEnvelopeDetector(this);
        }
    }
}
