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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.exceptions.InvalidParameterException;

public class SmootherFactoryTest {

    @Test
    public void testEveryMethodHasAnImplementation() {
        for (SmoothingMethod method : SmoothingMethod.values()) {
            Smoother smoother = SmootherFactory.create(new SmoothingConfig(method, null));
            assertEquals(method, smoother.getMethod());
        }
    }

    @Test
    public void testParametersAreApplied() {
        Smoother smoother = SmootherFactory.create(SmoothingConfig.of(SmoothingMethod.SG,
                SmootherFactory.WINDOW_SIZE, 9, SmootherFactory.POLYNOMIAL_ORDER, 3));
        assertThat(smoother, instanceOf(SavitzkyGolaySmoother.class));
        assertEquals(9, ((SavitzkyGolaySmoother) smoother).getWindowSize());
        assertEquals(3, ((SavitzkyGolaySmoother) smoother).getPolynomialOrder());
        assertEquals(9, smoother.minimumLength());

        Smoother ema = SmootherFactory.create(SmoothingConfig.of(SmoothingMethod.EMA, SmootherFactory.ALPHA, "0.8"));
        assertEquals(0.8, ((ExponentialMovingAverageSmoother) ema).getAlpha(), 0.0);

        Smoother butterworth = SmootherFactory.create(SmoothingConfig.of(SmoothingMethod.BUTTERWORTH,
                SmootherFactory.ORDER, 5, SmootherFactory.CUTOFF_FREQUENCY, 0.1));
        assertThat(((IirLowPassSmoother) butterworth).getSections(), hasSize(3));
    }

    static Stream<Arguments> rejectedShapes() {
        return Stream.of(Arguments.of(3, 3), Arguments.of(2, 3), Arguments.of(6, 2), Arguments.of(3, 2),
                Arguments.of(4, 1), Arguments.of(5, 4), Arguments.of(5, 5), Arguments.of(1, 0), Arguments.of(0, 0),
                Arguments.of(5, -1));
    }

    static Stream<Arguments> acceptedShapes() {
        return Stream.of(Arguments.of(3, 0), Arguments.of(3, 1), Arguments.of(5, 3), Arguments.of(7, 2),
                Arguments.of(9, 7), Arguments.of(11, 2));
    }

    @ParameterizedTest
    @MethodSource("rejectedShapes")
    public void testLocalPolynomialWindowMustExceedOrder(int windowSize, int order) {
        for (SmoothingMethod method : new SmoothingMethod[] { SmoothingMethod.SG, SmoothingMethod.LOESS }) {
            assertThrows(InvalidParameterException.class, () -> SmootherFactory.create(SmoothingConfig.of(method,
                    SmootherFactory.WINDOW_SIZE, windowSize, SmootherFactory.POLYNOMIAL_ORDER, order)));
        }
    }

    @ParameterizedTest
    @MethodSource("acceptedShapes")
    public void testLocalPolynomialShapesAccepted(int windowSize, int order) {
        for (SmoothingMethod method : new SmoothingMethod[] { SmoothingMethod.SG, SmoothingMethod.LOESS }) {
            Smoother smoother = SmootherFactory.create(SmoothingConfig.of(method, SmootherFactory.WINDOW_SIZE,
                    windowSize, SmootherFactory.POLYNOMIAL_ORDER, order));
            assertEquals(windowSize, ((LocalPolynomialSmoother) smoother).getWindowSize());
            assertEquals(order, ((LocalPolynomialSmoother) smoother).getPolynomialOrder());
        }
    }

    @Test
    public void testUnknownParametersAreRejected() {
        InvalidParameterException misspelt = assertThrows(InvalidParameterException.class,
                () -> SmootherFactory.create(SmoothingConfig.of(SmoothingMethod.SG, "windowsize", 7)));
        assertThat(misspelt.getMessage(), containsString("windowsize"));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.SG, SmootherFactory.WINDOW_SIZE, 7, "polyorder", 2)));
        assertThrows(InvalidParameterException.class,
                () -> SmootherFactory.create(SmoothingConfig.of(SmoothingMethod.EMA, "span", 10)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.EMA, SmootherFactory.WINDOW_SIZE, 5)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.POLYNOMIAL_ORDER, 2)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.BUTTERWORTH, SmootherFactory.RIPPLE_DB, 1.0)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.KALMAN, SmootherFactory.INITIAL_RATE, 0.1)));
    }

    @ParameterizedTest
    @EnumSource(SmoothingMethod.class)
    public void testEveryAllowedKeyIsAccepted(SmoothingMethod method) {
        Map<String, Object> valid = new HashMap<>();
        valid.put(SmootherFactory.WINDOW_SIZE, 5);
        valid.put(SmootherFactory.POLYNOMIAL_ORDER, 1);
        valid.put(SmootherFactory.ALPHA, 0.3);
        valid.put(SmootherFactory.CUTOFF_FREQUENCY, 0.05);
        valid.put(SmootherFactory.SAMPLING_RATE, 1.0);
        valid.put(SmootherFactory.ORDER, 2);
        valid.put(SmootherFactory.RIPPLE_DB, 0.5);
        valid.put(SmootherFactory.PROCESS_NOISE, 1e-4);
        valid.put(SmootherFactory.MEASUREMENT_NOISE, 1e-2);
        valid.put(SmootherFactory.INITIAL_COVARIANCE, 1e-2);
        valid.put(SmootherFactory.RATE_PROCESS_NOISE, 1e-7);
        valid.put(SmootherFactory.INITIAL_RATE, 0.0);
        Map<String, Object> all = new HashMap<>();
        for (String key : SmootherFactory.allowedKeys(method)) {
            assertEquals(method, SmootherFactory.create(SmoothingConfig.of(method, key, valid.get(key))).getMethod());
            all.put(key, valid.get(key));
        }
        assertEquals(method, SmootherFactory.create(new SmoothingConfig(method, all)).getMethod());
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.WINDOW_SIZE, 0)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.EMA, SmootherFactory.ALPHA, 0.0)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.EMA, SmootherFactory.ALPHA, 1.5)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.FOURIER, SmootherFactory.CUTOFF_FREQUENCY, 0.5)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.BUTTERWORTH, SmootherFactory.ORDER, 9)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.CHEBYSHEV, SmootherFactory.RIPPLE_DB, -1)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.KALMAN, SmootherFactory.MEASUREMENT_NOISE, 0)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.WINDOW_SIZE, "wide")));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory
                .create(SmoothingConfig.of(SmoothingMethod.MA, SmootherFactory.WINDOW_SIZE, 2.5)));
        assertThrows(InvalidParameterException.class, () -> SmootherFactory.create(null));
    }
}
