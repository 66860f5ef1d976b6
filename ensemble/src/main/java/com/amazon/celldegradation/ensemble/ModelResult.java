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

package com.amazon.celldegradation.ensemble;

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Getter;

import com.amazon.celldegradation.config.DetectorType;

/**
 * The output of one detector in one ensemble run: for every sample index a
 * flag, a raw score, a score normalized to [0, 1] and a rank (1 is the most
 * anomalous). Immutable; every accessor returns a copy.
 */
public class ModelResult {

    @Getter
    private final String name;
    @Getter
    private final DetectorType type;
    @Getter
    private final double weight;
    private final long[] indices;
    private final boolean[] flags;
    private final double[] rawScores;
    private final double[] scores;
    private final int[] ranks;

    public ModelResult(String name, DetectorType type, double weight, long[] indices, boolean[] flags,
            double[] rawScores, double[] scores) {
        checkNotNull(name, "name cannot be null");
        checkNotNull(indices, "indices cannot be null");
        checkArgument(indices.length == flags.length && flags.length == rawScores.length
                && rawScores.length == scores.length, "inconsistent lengths");
        this.name = name;
        this.type = type;
        this.weight = weight;
        this.indices = Arrays.copyOf(indices, indices.length);
        this.flags = Arrays.copyOf(flags, flags.length);
        this.rawScores = Arrays.copyOf(rawScores, rawScores.length);
        this.scores = Arrays.copyOf(scores, scores.length);
        this.ranks = rank(scores);
    }

    static int[] rank(double[] scores) {
        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -scores[i]).thenComparingInt(i -> i));
        int[] answer = new int[scores.length];
        for (int position = 0; position < order.length; position++) {
            answer[order[position]] = position + 1;
        }
        return answer;
    }

    public int size() {
        return indices.length;
    }

    public long[] getIndices() {
        return Arrays.copyOf(indices, indices.length);
    }

    public long getIndex(int row) {
        return indices[row];
    }

    public boolean[] getFlags() {
        return Arrays.copyOf(flags, flags.length);
    }

    public boolean isFlagged(int row) {
        return flags[row];
    }

    public double[] getRawScores() {
        return Arrays.copyOf(rawScores, rawScores.length);
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public double getScore(int row) {
        return scores[row];
    }

    public int[] getRanks() {
        return Arrays.copyOf(ranks, ranks.length);
    }

    public int getRank(int row) {
        return ranks[row];
    }

    /**
     * @return the sample indices this detector flagged, in row order
     */
    public Set<Long> flaggedIndices() {
        Set<Long> answer = new LinkedHashSet<>();
        for (int i = 0; i < indices.length; i++) {
            if (flags[i]) {
                answer.add(indices[i]);
            }
        }
        return answer;
    }
}
