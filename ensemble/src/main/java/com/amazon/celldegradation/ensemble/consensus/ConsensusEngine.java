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
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.ensemble.ModelResult;
import com.amazon.celldegradation.ensemble.config.AggregationMethod;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * Combines the results of the effective detectors. Every sample gets the
 * number of detectors that flagged it and an aggregated normalized score;
 * samples are ranked by count, then score, then index.
 */
public class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    private final AggregationMethod aggregation;

    public ConsensusEngine() {
        this(AggregationMethod.MEAN_OF_FLAGGING);
    }

    public ConsensusEngine(AggregationMethod aggregation) {
        this.aggregation = checkNotNull(aggregation, "aggregation cannot be null");
    }

    public AggregationMethod getAggregation() {
        return aggregation;
    }

    /**
     * @param results results over identical sample indices
     * @return one record per sample, in rank order
     */
    public List<ConsensusRecord> consensus(List<ModelResult> results) {
        checkNotNull(results, "results cannot be null");
        if (results.isEmpty()) {
            return Collections.emptyList();
        }
        long[] indices = results.get(0).getIndices();
        for (ModelResult result : results) {
            checkArgument(Arrays.equals(indices, result.getIndices()),
                    "model " + result.getName() + " was run over different samples");
        }
        int n = indices.length;
        final int[] counts = new int[n];
        final double[] combined = new double[n];
        for (int row = 0; row < n; row++) {
            double sum = 0;
            double weighted = 0;
            double totalWeight = 0;
            double max = 0;
            double flaggedSum = 0;
            for (ModelResult result : results) {
                double score = result.getScore(row);
                sum += score;
                weighted += result.getWeight() * score;
                totalWeight += result.getWeight();
                max = Math.max(max, score);
                if (result.isFlagged(row)) {
                    ++counts[row];
                    flaggedSum += score;
                }
            }
            switch (aggregation) {
            case MEAN_OF_ALL:
                combined[row] = sum / results.size();
                break;
            case MAX:
                combined[row] = max;
                break;
            case WEIGHTED_MEAN:
                combined[row] = (totalWeight > 0) ? weighted / totalWeight : 0;
                break;
            default:
                combined[row] = (counts[row] > 0) ? flaggedSum / counts[row] : 0;
            }
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingInt((Integer i) -> -counts[i])
                .thenComparingDouble(i -> -combined[i]).thenComparingLong(i -> indices[i]));
        List<ConsensusRecord> answer = new ArrayList<>(n);
        for (int position = 0; position < n; position++) {
            int row = order[position];
            answer.add(new ConsensusRecord(indices[row], counts[row], combined[row], position + 1));
        }
        return answer;
    }

    public AgreementMatrix agreement(List<ModelResult> results) {
        checkNotNull(results, "results cannot be null");
        return AgreementMatrix.of(results);
    }

    public AnomalyTable table(List<ModelResult> results) {
        return table(results, null);
    }

    /**
     * Builds the ranked table of flagged samples.
     *
     * @param results  results over identical sample indices
     * @param features standardized features of those samples, used for
     *                 attribution; may be null
     * @return the table
     */
    public AnomalyTable table(List<ModelResult> results, FeatureMatrix features) {
        List<ConsensusRecord> records = consensus(results);
        List<String> modelNames = new ArrayList<>();
        for (ModelResult result : results) {
            modelNames.add(result.getName());
        }
        Map<Long, Integer> rowOfIndex = new HashMap<>();
        if (!results.isEmpty()) {
            for (int row = 0; row < results.get(0).size(); row++) {
                rowOfIndex.put(results.get(0).getIndex(row), row);
            }
        }
        Map<Long, Integer> featureRow = new HashMap<>();
        if (features != null) {
            for (int row = 0; row < features.rows(); row++) {
                featureRow.put(features.getIndex(row), row);
            }
        }

        List<AnomalyRow> rows = new ArrayList<>();
        for (ConsensusRecord record : records) {
            if (record.getCount() == 0) {
                break;
            }
            int row = rowOfIndex.get(record.getIndex());
            Map<String, Boolean> flags = new LinkedHashMap<>();
            for (ModelResult result : results) {
                flags.put(result.getName(), result.isFlagged(row));
            }
            double[] attribution = null;
            String dominant = null;
            Integer position = featureRow.get(record.getIndex());
            if (position != null) {
                attribution = features.row(position);
                int best = -1;
                for (int j = 0; j < attribution.length; j++) {
                    if (best < 0 || Math.abs(attribution[j]) > Math.abs(attribution[best])) {
                        best = j;
                    }
                }
                dominant = (best < 0) ? null : features.getColumnNames().get(best);
            }
            rows.add(new AnomalyRow(record, flags, attribution, dominant));
        }
        log.debug("anomaly table holds {} of {} samples", rows.size(), records.size());
        List<String> featureNames = (features == null) ? Collections.<String>emptyList() : features.getColumnNames();
        return new AnomalyTable(modelNames, featureNames, rows);
    }
}
