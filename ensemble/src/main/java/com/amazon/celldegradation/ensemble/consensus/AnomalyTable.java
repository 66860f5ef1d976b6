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
import java.util.Collections;
import java.util.List;

/**
 * The ranked anomaly table: every sample flagged by at least one detector, in
 * rank order. The views returned by {@link #top(int)} and
 * {@link #highConfidence(int)} are subsets of this table in the same order.
 */
public class AnomalyTable {

    private final List<String> modelNames;
    private final List<String> featureNames;
    private final List<AnomalyRow> rows;

    public AnomalyTable(List<String> modelNames, List<String> featureNames, List<AnomalyRow> rows) {
        this.modelNames = Collections.unmodifiableList(new ArrayList<>(modelNames));
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<AnomalyRow> getRows() {
        return rows;
    }

    public List<String> getModelNames() {
        return modelNames;
    }

    /**
     * @return names of the attribution entries, empty without features
     */
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public AnomalyRow get(int position) {
        return rows.get(position);
    }

    public List<Long> indices() {
        List<Long> answer = new ArrayList<>();
        for (AnomalyRow row : rows) {
            answer.add(row.getIndex());
        }
        return answer;
    }

    public AnomalyTable top(int n) {
        checkArgument(n >= 0, "n cannot be negative");
        return new AnomalyTable(modelNames, featureNames, rows.subList(0, Math.min(n, rows.size())));
    }

    /**
     * @param quorum minimum number of detectors that must agree
     * @return the rows flagged by at least quorum detectors
     */
    public AnomalyTable highConfidence(int quorum) {
        checkArgument(quorum >= 1, "quorum must be at least 1");
        List<AnomalyRow> kept = new ArrayList<>();
        for (AnomalyRow row : rows) {
            if (row.getCount() >= quorum) {
                kept.add(row);
            }
        }
        return new AnomalyTable(modelNames, featureNames, kept);
    }
}
