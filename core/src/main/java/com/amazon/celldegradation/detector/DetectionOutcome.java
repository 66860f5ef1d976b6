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

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Raw scores and binary flags produced by one detector over the rows of a
 * feature matrix. Larger scores are more anomalous; the scale is specific to
 * the detector family.
 */
public class DetectionOutcome {

    private final double[] scores;
    private final boolean[] flags;
    private final double threshold;

    public DetectionOutcome(double[] scores, boolean[] flags, double threshold) {
        checkNotNull(scores, "scores cannot be null");
        checkNotNull(flags, "flags cannot be null");
        checkArgument(scores.length == flags.length, "scores and flags must have the same length");
        this.scores = Arrays.copyOf(scores, scores.length);
        this.flags = Arrays.copyOf(flags, flags.length);
        this.threshold = threshold;
    }

    /**
     * Flags the rows whose score is strictly greater than the score ranked
     * ceil(contamination * n) + 1 from the top. At most ceil(contamination * n)
     * rows are flagged, and none when all scores are equal.
     *
     * @param scores        raw scores, larger is more anomalous
     * @param contamination expected fraction of anomalies
     * @return the outcome
     */
    public static DetectionOutcome fromScores(double[] scores, double contamination) {
        checkNotNull(scores, "scores cannot be null");
        int n = scores.length;
        boolean[] flags = new boolean[n];
        if (n == 0) {
            return new DetectionOutcome(scores, flags, Double.NaN);
        }
        double[] sorted = Arrays.copyOf(scores, n);
        Arrays.sort(sorted);
        int expected = (int) Math.ceil(contamination * n);
        double threshold = sorted[Math.max(0, n - expected - 1)];
        for (int i = 0; i < n; i++) {
            flags[i] = scores[i] > threshold;
        }
        return new DetectionOutcome(scores, flags, threshold);
    }

    public int size() {
        return scores.length;
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public double getScore(int row) {
        return scores[row];
    }

    public boolean[] getFlags() {
        return Arrays.copyOf(flags, flags.length);
    }

    public boolean isFlagged(int row) {
        return flags[row];
    }

    public int flaggedCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                ++count;
            }
        }
        return count;
    }

    public double getThreshold() {
        return threshold;
    }
}
