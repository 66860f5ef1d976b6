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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.ensemble.ModelResult;
import com.amazon.celldegradation.ensemble.config.AggregationMethod;
import com.amazon.celldegradation.features.FeatureMatrix;

public class ConsensusEngineTest {

    private static final long[] INDICES = { 10, 11, 12, 13, 14 };

    private List<ModelResult> results;

    private static ModelResult result(String name, double weight, boolean[] flags, double[] scores) {
        return new ModelResult(name, DetectorType.LOCAL_OUTLIER_FACTOR, weight, INDICES, flags, scores, scores);
    }

    @BeforeEach
    public void setUp() {
        results = Arrays.asList(
                result("m1", 2.0, new boolean[] { false, true, false, true, false },
                        new double[] { 0, 1, 0.2, 0.8, 0.1 }),
                result("m2", 0.0, new boolean[] { false, true, false, false, false },
                        new double[] { 0, 0.9, 0.3, 0.4, 1 }),
                result("m3", 1.0, new boolean[5], new double[] { 0, 0, 0, 0, 0 }));
    }

    private static List<Long> order(List<ConsensusRecord> records) {
        List<Long> answer = new ArrayList<>();
        for (ConsensusRecord record : records) {
            answer.add(record.getIndex());
        }
        return answer;
    }

    @Test
    public void testMeanOfFlagging() {
        List<ConsensusRecord> records = new ConsensusEngine().consensus(results);
        assertThat(order(records), contains(11L, 13L, 10L, 12L, 14L));
        assertEquals(2, records.get(0).getCount());
        assertEquals(0.95, records.get(0).getCombinedScore(), 1e-12);
        assertEquals(0.8, records.get(1).getCombinedScore(), 1e-12);
        assertEquals(0.0, records.get(4).getCombinedScore(), 0.0);
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i + 1, records.get(i).getRank());
        }
    }

    @Test
    public void testOtherAggregations() {
        List<ConsensusRecord> max = new ConsensusEngine(AggregationMethod.MAX).consensus(results);
        assertThat(order(max), contains(11L, 13L, 14L, 12L, 10L));

        List<ConsensusRecord> all = new ConsensusEngine(AggregationMethod.MEAN_OF_ALL).consensus(results);
        assertEquals(1.1 / 3, all.get(2).getCombinedScore(), 1e-12);
        assertEquals(14L, all.get(2).getIndex());

        List<ConsensusRecord> weighted = new ConsensusEngine(AggregationMethod.WEIGHTED_MEAN).consensus(results);
        assertEquals(11L, weighted.get(0).getIndex());
        assertEquals(2.0 / 3, weighted.get(0).getCombinedScore(), 1e-12);
        // m2 has no weight, so its score of 1 at index 14 does not lift it above 12
        assertEquals(14L, weighted.get(3).getIndex());
        assertEquals(0.2 / 3, weighted.get(3).getCombinedScore(), 1e-12);
    }

    @Test
    public void testTable() {
        ConsensusEngine engine = new ConsensusEngine();
        double[][] values = new double[5][];
        for (int i = 0; i < 5; i++) {
            values[i] = new double[] { 0.1 * i, -3.0 * i };
        }
        FeatureMatrix features = new FeatureMatrix(Arrays.asList("capacity.delta", "capacity.residual"), INDICES,
                values);
        AnomalyTable table = engine.table(results, features);

        assertEquals(2, table.size());
        assertThat(table.indices(), contains(11L, 13L));
        assertThat(table.getModelNames(), contains("m1", "m2", "m3"));
        AnomalyRow first = table.get(0);
        assertTrue(first.isFlaggedBy("m1"));
        assertTrue(first.isFlaggedBy("m2"));
        assertFalse(first.isFlaggedBy("m3"));
        assertFalse(first.isFlaggedBy("unknown"));
        assertEquals("capacity.residual", first.getDominantFeature());
        assertEquals(-3.0, first.getAttribution()[1], 0.0);

        assertThat(table.highConfidence(2).indices(), contains(11L));
        assertThat(table.top(1).indices(), contains(11L));
        assertEquals(2, table.top(10).size());
        assertNull(engine.table(results).get(0).getAttribution());
    }

    @ParameterizedTest
    @ValueSource(longs = { 1, 2, 3, 4, 5 })
    public void testCountsAndConfidenceViews(long seed) {
        Random random = new Random(seed);
        int models = 1 + random.nextInt(5);
        int n = 60;
        long[] indices = new long[n];
        for (int i = 0; i < n; i++) {
            indices[i] = 100 + 2 * i;
        }
        List<ModelResult> generated = new ArrayList<>();
        for (int m = 0; m < models; m++) {
            boolean[] flags = new boolean[n];
            double[] scores = new double[n];
            for (int i = 0; i < n; i++) {
                flags[i] = random.nextDouble() < 0.15;
                scores[i] = random.nextDouble();
            }
            generated.add(new ModelResult("m" + m, DetectorType.ONE_CLASS_SVM, 1.0, indices, flags, scores, scores));
        }
        ConsensusEngine engine = new ConsensusEngine();
        List<ConsensusRecord> records = engine.consensus(generated);
        assertEquals(n, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertTrue(records.get(i).getCount() <= models);
            if (i > 0) {
                assertTrue(records.get(i - 1).getCount() >= records.get(i).getCount());
            }
        }
        AnomalyTable table = engine.table(generated);
        for (int quorum = 1; quorum <= models + 1; quorum++) {
            AnomalyTable confident = table.highConfidence(quorum);
            assertTrue(table.indices().containsAll(confident.indices()));
            for (AnomalyRow row : confident.getRows()) {
                assertTrue(row.getCount() >= quorum);
            }
        }
        assertEquals(0, table.highConfidence(models + 1).size());
    }

    @Test
    public void testEmptyAndMismatchedResults() {
        ConsensusEngine engine = new ConsensusEngine();
        assertTrue(engine.consensus(Collections.<ModelResult>emptyList()).isEmpty());
        assertTrue(engine.table(Collections.<ModelResult>emptyList()).isEmpty());

        ModelResult other = new ModelResult("other", DetectorType.ELLIPTIC_ENVELOPE, 1.0, new long[] { 1, 2, 3, 4, 5 },
                new boolean[5], new double[5], new double[5]);
        List<ModelResult> mismatched = new ArrayList<>(results);
        mismatched.add(other);
        assertThrows(IllegalArgumentException.class, () -> engine.consensus(mismatched));
    }
}
