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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.exceptions.InvalidParameterException;

public class DetectorFactoryTest {

    @Test
    public void testHyperparametersAreApplied() {
        IsolationForestDetector forest = (IsolationForestDetector) DetectorFactory
                .create(DetectorConfig.of(DetectorType.ISOLATION_FOREST, "number_of_trees", 30, "sample_size", 64,
                        "random_seed", 7, "contamination", 0.05));
        assertEquals(30, forest.getNumberOfTrees());
        assertEquals(64, forest.getSampleSize());
        assertEquals(7L, forest.getRandomSeed());
        assertEquals(0.05, forest.getContamination(), 0.0);

        LocalOutlierFactorDetector lof = (LocalOutlierFactorDetector) DetectorFactory
                .create(DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR, "n_neighbors", "35"));
        assertEquals(35, lof.getNumberOfNeighbors());

        OneClassSvmDetector svm = (OneClassSvmDetector) DetectorFactory.create(DetectorConfig
                .of(DetectorType.ONE_CLASS_SVM, "kernel", "polynomial", "gamma", 0.25, "nu", 0.1));
        assertEquals(SvmKernel.POLY, svm.getKernel());
        assertEquals(0.25, svm.getGamma(), 0.0);
        assertEquals(0.1, svm.getNu(), 0.0);

        EllipticEnvelopeDetector envelope = (EllipticEnvelopeDetector) DetectorFactory
                .create(DetectorConfig.of(DetectorType.ELLIPTIC_ENVELOPE, "support_fraction", 0.75));
        assertEquals(0.75, envelope.getSupportFraction(), 0.0);
        assertEquals(EllipticEnvelopeDetector.DEFAULT_NUMBER_OF_STARTS, envelope.getNumberOfStarts());
    }

    @Test
    public void testAutoGammaIsResolvedFromDimension() {
        OneClassSvmDetector svm = (OneClassSvmDetector) DetectorFactory
                .create(DetectorConfig.of(DetectorType.ONE_CLASS_SVM, "gamma", "scale"));
        assertTrue(Double.isNaN(svm.getGamma()));
        svm = (OneClassSvmDetector) DetectorFactory.create(DetectorConfig.of(DetectorType.ONE_CLASS_SVM));
        assertTrue(Double.isNaN(svm.getGamma()));
        assertEquals(OneClassSvmDetector.DEFAULT_NU, svm.getNu(), 0.0);
    }

    @Test
    public void testUnknownHyperparameterIsRejected() {
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR, "nu", 0.1)));
        assertThat(exception.getMessage(), containsString("nu"));
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.ISOLATION_FOREST, "n_estimators", 10)));
    }

    @Test
    public void testOutOfRangeValuesAreRejected() {
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.ISOLATION_FOREST, "contamination", 0.0)));
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.ISOLATION_FOREST, "contamination", 0.6)));
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.ONE_CLASS_SVM, "nu", 1.5)));
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.ONE_CLASS_SVM, "kernel", "sigmoid")));
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.create(DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR, "n_neighbors", 2.5)));

        DetectorConfig negative = DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR);
        negative.setWeight(-1);
        assertThrows(InvalidParameterException.class, () -> DetectorFactory.create(negative));

        DetectorConfig untyped = new DetectorConfig();
        assertThrows(InvalidParameterException.class, () -> DetectorFactory.create(untyped));
    }

    @Test
    public void testCreateAll() {
        DetectorConfig first = DetectorConfig.of(DetectorType.ISOLATION_FOREST);
        Map<String, Object> params = new HashMap<>();
        params.put("random_seed", 3);
        DetectorConfig second = new DetectorConfig(DetectorType.ISOLATION_FOREST, "forest_3", params);
        List<AnomalyDetector> detectors = DetectorFactory.createAll(Arrays.asList(first, second));
        assertEquals(2, detectors.size());
        assertEquals("isolation_forest", detectors.get(0).getName());
        assertEquals("forest_3", detectors.get(1).getName());
        assertThat(detectors.get(1), instanceOf(IsolationForestDetector.class));

        DetectorConfig duplicate = DetectorConfig.of(DetectorType.ISOLATION_FOREST);
        assertThrows(InvalidParameterException.class,
                () -> DetectorFactory.createAll(Arrays.asList(first, duplicate)));
        assertThrows(InvalidParameterException.class, () -> DetectorFactory.createAll(Arrays.asList()));
    }

    @Test
    public void testNamesDoNotDependOnTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            List<AnomalyDetector> detectors = DetectorFactory.createAll(
                    Arrays.asList(DetectorConfig.of(DetectorType.ISOLATION_FOREST),
                            DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR),
                            DetectorConfig.of(DetectorType.ONE_CLASS_SVM, "kernel", "linear")));
            assertEquals("isolation_forest", detectors.get(0).getName());
            assertEquals("local_outlier_factor", detectors.get(1).getName());
            assertEquals("isolation_forest", DetectorConfig.of(DetectorType.ISOLATION_FOREST).effectiveName());
            assertEquals(SvmKernel.LINEAR, ((OneClassSvmDetector) detectors.get(2)).getKernel());
            assertEquals("isolation_forest", IsolationForestDetector.builder().build().getName());

            DetectorConfig named = DetectorConfig.of(DetectorType.ISOLATION_FOREST);
            named.setName("isolation_forest");
            assertThrows(InvalidParameterException.class, () -> DetectorFactory
                    .createAll(Arrays.asList(DetectorConfig.of(DetectorType.ISOLATION_FOREST), named)));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
