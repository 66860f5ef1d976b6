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

import com.amazon.celldegradation.config.DetectorType;

/**
 * Local density detector. The local reachability density of a row is the
 * inverse mean reachability distance to its k nearest neighbours; the score is
 * the mean ratio of the neighbours' densities to the row's own density, so
 * rows in regions sparser than their neighbourhood score above 1.
 */
public class LocalOutlierFactorDetector extends AbstractAnomalyDetector {

    public static final int DEFAULT_NUMBER_OF_NEIGHBORS = 20;

    static final double DENSITY_EPSILON = 1e-10;

    private final int numberOfNeighbors;

    protected LocalOutlierFactorDetector(Builder builder) {
        super(DetectorType.LOCAL_OUTLIER_FACTOR, builder);
        checkParameter(builder.numberOfNeighbors > 0, "n_neighbors must be positive");
        numberOfNeighbors = builder.numberOfNeighbors;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected double[] score(double[][] points) {
        int n = points.length;
        int k = Math.min(numberOfNeighbors, n - 1);
        double[] scores = new double[n];
        if (k == 0) {
            return scores;
        }
        int[][] neighbors = new int[n][];
        double[][] neighborDistances = new double[n][];
        double[] kDistance = new double[n];
        Integer[] candidates = new Integer[n - 1];
        for (int i = 0; i < n; i++) {
            final double[] distances = new double[n];
            int position = 0;
            for (int j = 0; j < n; j++) {
                distances[j] = distance(points[i], points[j]);
                if (j != i) {
                    candidates[position++] = j;
                }
            }
            // ties are broken by row so that the neighbourhoods are reproducible
            Arrays.sort(candidates, Comparator.comparingDouble((Integer j) -> distances[j]).thenComparingInt(j -> j));
            neighbors[i] = new int[k];
            neighborDistances[i] = new double[k];
            for (int m = 0; m < k; m++) {
                neighbors[i][m] = candidates[m];
                neighborDistances[i][m] = distances[candidates[m]];
            }
            kDistance[i] = neighborDistances[i][k - 1];
        }

        double[] density = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int m = 0; m < k; m++) {
                sum += Math.max(kDistance[neighbors[i][m]], neighborDistances[i][m]);
            }
            density[i] = k / (sum + DENSITY_EPSILON);
        }
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int m = 0; m < k; m++) {
                sum += density[neighbors[i][m]];
            }
            scores[i] = sum / k / density[i];
        }
        return scores;
    }

    static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return Math.sqrt(sum);
    }

    public int getNumberOfNeighbors() {
        return numberOfNeighbors;
    }

    public static class Builder extends AbstractAnomalyDetector.Builder<Builder> {

        private int numberOfNeighbors = DEFAULT_NUMBER_OF_NEIGHBORS;

        public Builder numberOfNeighbors(int numberOfNeighbors) {
            this.numberOfNeighbors = numberOfNeighbors;
            return this;
        }

        public LocalOutlierFactorDetector build() {
            return new LocalOutlierFactorDetector(this);
        }
    }
}
