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

package com.amazon.celldegradation.ensemble.consensus;

import static com.amazon.celldegradation.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.amazon.celldegradation.ensemble.ModelResult;

/**
 * Pairwise Jaccard similarity of the flagged index sets of the detectors.
 * Two detectors that flag nothing agree completely; a detector that flags
 * nothing and one that flags something do not agree at all.
 */
public class AgreementMatrix {

    private final List<String> modelNames;
    private final double[][] values;

    AgreementMatrix(List<String> modelNames, double[][] values) {
        this.modelNames = Collections.unmodifiableList(new ArrayList<>(modelNames));
        this.values = values;
    }

    public static AgreementMatrix of(List<ModelResult> results) {
        int m = results.size();
        List<String> names = new ArrayList<>();
        List<Set<Long>> flagged = new ArrayList<>();
        for (ModelResult result : results) {
            names.add(result.getName());
            flagged.add(result.flaggedIndices());
        }
        double[][] values = new double[m][m];
        for (int i = 0; i < m; i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < m; j++) {
                values[i][j] = values[j][i] = jaccard(flagged.get(i), flagged.get(j));
            }
        }
        return new AgreementMatrix(names, values);
    }

    public static double jaccard(Set<Long> a, Set<Long> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (Long index : a) {
            if (b.contains(index)) {
                ++intersection;
            }
        }
        return (double) intersection / (a.size() + b.size() - intersection);
    }

    public List<String> getModelNames() {
        return modelNames;
    }

    public int size() {
        return modelNames.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String first, String second) {
        int i = modelNames.indexOf(first);
        int j = modelNames.indexOf(second);
        checkArgument(i >= 0 && j >= 0, "unknown model " + ((i < 0) ? first : second));
        return values[i][j];
    }

    /**
     * @return mean agreement over distinct pairs, NaN with fewer than two models
     */
    public double meanOffDiagonal() {
        int m = modelNames.size();
        if (m < 2) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < m; i++) {
            for (int j = i + 1; j < m; j++) {
                sum += values[i][j];
            }
        }
        return sum / (m * (m - 1) / 2.0);
    }

    public double[][] toArray() {
        double[][] answer = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            answer[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return answer;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AgreementMatrix)) {
            return false;
        }
        AgreementMatrix that = (AgreementMatrix) other;
        return modelNames.equals(that.modelNames) && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * modelNames.hashCode() + Arrays.deepHashCode(values);
    }
}
