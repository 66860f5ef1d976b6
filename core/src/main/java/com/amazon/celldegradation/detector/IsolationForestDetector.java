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

import static com.amazon.celldegradation.CommonUtils.averagePathLength;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.Random;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.tree.IsolationTree;

/**
 * Partition based detector. Each tree is grown on a random subsample of the
 * rows; points that are isolated after few cuts get scores close to 1 and
 * points deep inside the data get scores below 0.5. The score of a row is
 * 2^(-E(h)/c(psi)) where E(h) is the mean path length over the forest and psi
 * the subsample size.
 */
public class IsolationForestDetector extends AbstractAnomalyDetector {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;

    protected IsolationForestDetector(Builder builder) {
        super(DetectorType.ISOLATION_FOREST, builder);
        checkParameter(builder.numberOfTrees > 0, "number_of_trees must be positive");
        checkParameter(builder.sampleSize > 1, "sample_size must be greater than 1");
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected double[] score(double[][] points) {
        int n = points.length;
        int psi = Math.min(sampleSize, n);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Random random = new Random(randomSeed);
        int[] order = new int[n];
        double[] totalPath = new double[n];

        for (int t = 0; t < numberOfTrees; t++) {
            for (int i = 0; i < n; i++) {
                order[i] = i;
            }
            // partial Fisher-Yates draws psi rows without replacement
            double[][] sample = new double[psi][];
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(n - i);
                int swap = order[i];
                order[i] = order[j];
                order[j] = swap;
                sample[i] = points[order[i]];
            }
            IsolationTree tree = IsolationTree.build(sample, heightLimit, random.nextLong());
            for (int i = 0; i < n; i++) {
                totalPath[i] += tree.pathLength(points[i]);
            }
        }

        double normalizer = averagePathLength(psi);
        if (normalizer <= 0) {
            normalizer = 1;
        }
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Math.pow(2, -(totalPath[i] / numberOfTrees) / normalizer);
        }
        return scores;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public static class Builder extends AbstractAnomalyDetector.Builder<Builder> {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public IsolationForestDetector build() {
            return new IsolationForestDetector(this);
        }
    }
}
