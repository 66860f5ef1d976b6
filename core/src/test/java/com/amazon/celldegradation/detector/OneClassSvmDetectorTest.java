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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.celldegradation.exceptions.DetectorConvergenceException;
import com.amazon.celldegradation.exceptions.InvalidParameterException;
import com.amazon.celldegradation.features.FeatureMatrix;

public class OneClassSvmDetectorTest {

    private static FeatureMatrix gaussian(int n, long seed) {
        Random random = new Random(seed);
        double[][] values = new double[n][];
        long[] indices = new long[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
            values[i] = new double[] { random.nextGaussian(), random.nextGaussian(), random.nextGaussian() };
        }
        return new FeatureMatrix(Arrays.asList("a", "b", "c"), indices, values);
    }

    @Test
    public void testIterationBudgetExceeded() {
        OneClassSvmDetector detector = OneClassSvmDetector.builder().name("svm").maxIterations(1).build();
        DetectorConvergenceException exception = assertThrows(DetectorConvergenceException.class,
                () -> detector.fitPredict(gaussian(200, 1)));
        assertEquals("svm", exception.getDetector());
        assertEquals(1, exception.getIterations());
    }

    @Test
    public void testKernels() {
        double[] a = { 1, 2 };
        double[] b = { 3, -1 };
        assertEquals(1.0, SvmKernel.RBF.apply(a, a, 0.5, 0, 3), 0.0);
        assertEquals(Math.exp(-0.5 * 13), SvmKernel.RBF.apply(a, b, 0.5, 0, 3), 1e-15);
        assertEquals(1.0, SvmKernel.LINEAR.apply(a, b, 0.5, 0, 3), 0.0);
        assertEquals(Math.pow(0.5 + 1, 3), SvmKernel.POLY.apply(a, b, 0.5, 1, 3), 1e-12);
        assertSame(SvmKernel.POLY, SvmKernel.fromString(" Polynomial "));
        assertSame(SvmKernel.RBF, SvmKernel.fromString("rbf"));
        assertThrows(InvalidParameterException.class, () -> SvmKernel.fromString(null));
    }

    @Test
    public void testOffset() {
        // free multipliers average their gradients
        assertEquals(2.0, OneClassSvmDetector.offset(new double[] { 0.5, 0.2, 1, 0 },
                new double[] { 1.5, 2.5, 0.1, 9 }), 1e-12);
        // all at bounds: midpoint of max over upper bound and min over lower bound
        assertEquals(1.5, OneClassSvmDetector.offset(new double[] { 1, 0 }, new double[] { 1, 2 }), 1e-12);
    }

    @Test
    public void testFractionOfOutliersTracksNu() {
        FeatureMatrix features = gaussian(300, 9);
        OneClassSvmDetector detector = OneClassSvmDetector.builder().nu(0.1).contamination(0.5).build();
        double[] scores = detector.fitPredict(features).getScores();
        int outside = 0;
        for (double score : scores) {
            if (score > 0.01) {
                ++outside;
            }
        }
        // only bounded support vectors sit clearly outside, and nu caps their number
        assertTrue(outside <= 0.1 * 300 + 1, "outside " + outside);
    }
}
