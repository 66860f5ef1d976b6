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

package com.amazon.celldegradation.smoothing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.celldegradation.CommonUtils;
import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.exceptions.InsufficientDataException;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.series.CleaningReport;
import com.amazon.celldegradation.series.Series;
import com.amazon.celldegradation.testutils.BatteryCycleTestData;

public class SmoothingEngineTest {

    private SmoothingEngine engine;
    private CleanedSeries noisy;

    @BeforeEach
    public void setUp() {
        engine = new SmoothingEngine();
        double[] values = BatteryCycleTestData.noise(200, 0.05, 11);
        for (int i = 0; i < values.length; i++) {
            values[i] += 2.0 - 0.001 * i;
        }
        noisy = new CleanedSeries("capacity", Series.of(values), new CleaningReport());
    }

    @Test
    public void testSmoothKeepsIndicesAndReportsDiagnostics() {
        SmoothingResult result = engine.smooth(noisy, SmoothingConfig.of(SmoothingMethod.MA,
                SmootherFactory.WINDOW_SIZE, 9));
        assertEquals("capacity", result.getChannel());
        assertEquals(SmoothingMethod.MA, result.getMethod());
        assertArrayEquals(noisy.getSeries().getIndices(), result.getSmoothed().getIndices());
        assertThat(result.getDiagnostics().getDerivativeRoughness(),
                lessThan(CommonUtils.derivativeRoughness(noisy.getSeries().getValues())));
        assertTrue(result.getDiagnostics().getResidStd() > 0);
    }

    @Test
    public void testWiderWindowIsSmootherButFurtherFromInput() {
        List<SmoothingResult> results = engine.compare(noisy,
                Arrays.asList(SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.WINDOW_SIZE, 3),
                        SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.WINDOW_SIZE, 21)));
        Diagnostics narrow = results.get(0).getDiagnostics();
        Diagnostics wide = results.get(1).getDiagnostics();
        assertThat(wide.getDerivativeRoughness(), lessThan(narrow.getDerivativeRoughness()));
        assertThat(narrow.getResidStd(), lessThan(wide.getResidStd()));
    }

    @Test
    public void testSeriesShorterThanWindow() {
        CleanedSeries shortSeries = new CleanedSeries("capacity", Series.of(1, 2, 3), new CleaningReport());
        InsufficientDataException exception = assertThrows(InsufficientDataException.class, () -> engine
                .smooth(shortSeries, SmoothingConfig.of(SmoothingMethod.SG, SmootherFactory.WINDOW_SIZE, 7)));
        assertEquals(3, exception.getAvailable());
        assertEquals(7, exception.getRequired());
    }

    @Test
    public void testCompareSkipsInapplicableConfigurations() {
        CleanedSeries shortSeries = new CleanedSeries("capacity", Series.of(1, 2, 3, 4, 5), new CleaningReport());
        List<SmoothingResult> results = engine.compare(shortSeries,
                Arrays.asList(SmoothingConfig.of(SmoothingMethod.SG, SmootherFactory.WINDOW_SIZE, 11),
                        new SmoothingConfig(SmoothingMethod.EMA, null),
                        new SmoothingConfig(SmoothingMethod.KALMAN, null)));
        assertThat(results.stream().map(SmoothingResult::getMethod).collect(Collectors.toList()),
                contains(SmoothingMethod.EMA, SmoothingMethod.KALMAN));
    }
}
