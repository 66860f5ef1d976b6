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

package com.amazon.celldegradation.config;

import java.util.Locale;

/**
 * The smoothing filters that can be applied to a channel before features are
 * derived. Each is one variant of the same smoothing capability; the choice is
 * made per channel.
 */
public enum SmoothingMethod {

    /**
     * centred moving average, the window shrinks near the boundaries
     */
    MA("MovingAverage", "SMA"),
    /**
     * centred moving average with linearly decaying weights
     */
    WMA("WeightedMovingAverage"),
    /**
     * exponential moving average, output[t] = alpha * input[t] + (1 - alpha) *
     * output[t-1]
     */
    EMA("ExponentialMovingAverage", "EWMA"),
    /**
     * Savitzky-Golay, least squares polynomial over a sliding window
     */
    SG("SavitzkyGolay", "Savgol"),
    /**
     * locally weighted polynomial regression with tricube weights
     */
    LOESS("LOWESS"),
    /**
     * low pass in the frequency domain after removing a linear trend
     */
    FOURIER("FFT", "FourierLowPass"),
    /**
     * maximally flat IIR low pass, applied forward and backward
     */
    BUTTERWORTH(),
    /**
     * equiripple (type I) IIR low pass, applied forward and backward
     */
    CHEBYSHEV("Chebyshev1"),
    /**
     * local level Kalman filter
     */
    KALMAN("KalmanFilter", "KF"),
    /**
     * extended Kalman filter over an exponential decay model
     */
    EXTENDED_KALMAN("EKF", "ExtendedKalmanFilter"),
    /**
     * centred running median
     */
    MEDIAN_FILTER("Median", "MedianFilter");

    private final String[] aliases;

    SmoothingMethod(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * resolves a method from its name or one of its aliases, ignoring case,
     * underscores, dashes and spaces
     *
     * @param value the configured name
     * @return the method, or null if nothing matches
     */
    public static SmoothingMethod fromString(String value) {
        if (value == null) {
            return null;
        }
        String key = normalize(value);
        for (SmoothingMethod method : values()) {
            if (normalize(method.name()).equals(key)) {
                return method;
            }
            for (String alias : method.aliases) {
                if (normalize(alias).equals(key)) {
                    return method;
                }
            }
        }
        return null;
    }

    static String normalize(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
