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

package com.amazon.celldegradation.ensemble.config;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Maps raw detector scores onto [0, 1] so that detectors of different families
 * can be combined. Larger values stay more anomalous.
 */
public enum ScoreNormalization {
    /**
     * (s - min) / (max - min); constant scores map to 0
     */
    MIN_MAX,
    /**
     * average rank of the score divided by the number of scores minus one,
     * ties share their mean rank; constant scores map to 0
     */
    RANK;

    public double[] normalize(double[] scores) {
        int n = scores.length;
        double[] answer = new double[n];
        if (n == 0) {
            return answer;
        }
        if (this == MIN_MAX) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double score : scores) {
                min = Math.min(min, score);
                max = Math.max(max, score);
            }
            double range = max - min;
            if (range > 0) {
                for (int i = 0; i < n; i++) {
                    answer[i] = (scores[i] - min) / range;
                }
            }
            return answer;
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                ++j;
            }
            double rank = (i + j) / 2.0;
            for (int k = i; k <= j; k++) {
                answer[order[k]] = rank;
            }
            i = j + 1;
        }
        double lowest = answer[order[0]];
        double span = (n - 1) - lowest;
        for (int k = 0; k < n; k++) {
            answer[k] = (span > 0) ? (answer[k] - lowest) / span : 0;
        }
        return answer;
    }
}
