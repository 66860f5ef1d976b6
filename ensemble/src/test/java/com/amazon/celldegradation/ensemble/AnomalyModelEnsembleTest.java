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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.detector.DetectionOutcome;
import com.amazon.celldegradation.detector.IsolationForestDetector;
import com.amazon.celldegradation.detector.LocalOutlierFactorDetector;
import com.amazon.celldegradation.exceptions.DetectorConvergenceException;
import com.amazon.celldegradation.exceptions.InvalidParameterException;
import com.amazon.celldegradation.features.FeatureMatrix;

@ExtendWith(MockitoExtension.class)
public class AnomalyModelEnsembleTest {

    private FeatureMatrix features;

    @Mock
    private AnomalyDetector broken;

    @Mock
    private AnomalyDetector truncated;

    @BeforeEach
    public void setUp() {
        Random random = new Random(77);
        int n = 120;
        long[] indices = new long[n];
        double[][] values = new double[n][];
        boolean[] valid = new boolean[n];
        for (int i = 0; i < n; i++) {
            indices[i] = 500 + i;
            values[i] = new double[] { 10 + random.nextGaussian(), 0.01 * random.nextGaussian() };
            valid[i] = i >= 3;
        }
        values[0][0] = Double.NaN;
        values[60] = new double[] { 25, 0.2 };
        features = new FeatureMatrix(Arrays.asList("capacity.delta", "capacity.slope"), indices, values, valid);
    }

    private static List<DetectorConfig> configs() {
        return Arrays.asList(DetectorConfig.of(DetectorType.ISOLATION_FOREST, "number_of_trees", 40),
                DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR, "n_neighbors", 10),
                DetectorConfig.of(DetectorType.ONE_CLASS_SVM), DetectorConfig.of(DetectorType.ELLIPTIC_ENVELOPE));
    }

    @Test
    public void testOnlyValidRowsAreScored() {
        EnsembleResult result = AnomalyModelEnsemble.detect(features, configs());
        assertEquals(4, result.getEffectiveDetectors());
        assertEquals(4, result.getConfiguredDetectors());
        assertTrue(result.getExclusions().isEmpty());
        for (ModelResult model : result.getResults()) {
            assertEquals(117, model.size());
            assertEquals(503L, model.getIndex(0));
            assertTrue(model.flaggedIndices().contains(560L), model.getName());
            assertEquals(1, model.getRank(57));
            assertEquals(1.0, model.getScore(57), 0.0);
        }
    }

    @Test
    public void testFailingDetectorIsExcluded() {
        when(broken.getName()).thenReturn("broken");
        when(broken.fitPredict(any(FeatureMatrix.class)))
                .thenThrow(new DetectorConvergenceException("broken", 10, "no progress"));
        when(truncated.getName()).thenReturn("truncated");
        when(truncated.fitPredict(any(FeatureMatrix.class)))
                .thenReturn(DetectionOutcome.fromScores(new double[] { 1, 2 }, 0.1));

        AnomalyModelEnsemble ensemble = AnomalyModelEnsemble.builder().detector(broken)
                .detector(IsolationForestDetector.builder().numberOfTrees(30).build(), 3.0).detector(truncated)
                .detector(LocalOutlierFactorDetector.builder().build()).consensusQuorum(3).build();
        EnsembleResult result = ensemble.detect(features);

        assertEquals(4, result.getConfiguredDetectors());
        assertEquals(2, result.getEffectiveDetectors());
        assertEquals("isolation_forest", result.getResults().get(0).getName());
        assertEquals(3.0, result.getResults().get(0).getWeight(), 0.0);
        assertEquals(1.0, result.getResults().get(1).getWeight(), 0.0);
        assertEquals(2, result.getExclusions().size());
        Exclusion first = result.getExclusions().get(0);
        assertEquals(Exclusion.Stage.DETECTION, first.getStage());
        assertEquals("broken", first.getName());
        assertThat(first.getReason(), containsString("DetectorConvergenceException"));
        assertEquals("truncated", result.getExclusions().get(1).getName());
        verify(broken, times(1)).fitPredict(any(FeatureMatrix.class));
    }

    @Test
    public void testParallelMatchesSequential() {
        EnsembleResult sequential = AnomalyModelEnsemble.builder().detectorConfigs(configs()).build()
                .detect(features);
        AnomalyModelEnsemble parallelEnsemble = AnomalyModelEnsemble.builder().detectorConfigs(configs())
                .parallelExecutionEnabled(true).threadPoolSize(3).build();
        assertTrue(parallelEnsemble.isParallelExecutionEnabled());
        EnsembleResult parallel = parallelEnsemble.detect(features);
        assertEquals(sequential.getEffectiveDetectors(), parallel.getEffectiveDetectors());
        for (int m = 0; m < sequential.getEffectiveDetectors(); m++) {
            ModelResult expected = sequential.getResults().get(m);
            ModelResult actual = parallel.getResults().get(m);
            assertEquals(expected.getName(), actual.getName());
            assertArrayEquals(expected.getRawScores(), actual.getRawScores(), 0.0);
            assertArrayEquals(expected.getFlags(), actual.getFlags());
        }
    }

    @Test
    public void testConfigurationErrors() {
        assertThrows(InvalidParameterException.class, () -> AnomalyModelEnsemble.builder().build());
        assertThrows(InvalidParameterException.class,
                () -> AnomalyModelEnsemble.builder().detectorConfigs(configs()).consensusQuorum(0).build());
        assertThrows(InvalidParameterException.class,
                () -> AnomalyModelEnsemble.builder().detectorConfigs(configs()).normalization(null).build());
    }
}
