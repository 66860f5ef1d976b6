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

import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.celldegradation.config.Parameters;
import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Builds a {@link Smoother} from a {@link SmoothingConfig}. Every parameter is
 * validated here, so a bad configuration fails before any data is smoothed.
 */
public class SmootherFactory {

    public static final String WINDOW_SIZE = "window_size";
    public static final String ALPHA = "alpha";
    public static final String POLYNOMIAL_ORDER = "polynomial_order";
    public static final String CUTOFF_FREQUENCY = "cutoff_frequency";
    public static final String SAMPLING_RATE = "sampling_rate";
    public static final String ORDER = "order";
    public static final String RIPPLE_DB = "ripple_db";
    public static final String PROCESS_NOISE = "process_noise";
    public static final String MEASUREMENT_NOISE = "measurement_noise";
    public static final String INITIAL_COVARIANCE = "initial_covariance";
    public static final String RATE_PROCESS_NOISE = "rate_process_noise";
    public static final String INITIAL_RATE = "initial_rate";

    public static final int DEFAULT_WINDOW_SIZE = 5;
    public static final double DEFAULT_ALPHA = 0.3;
    public static final int DEFAULT_POLYNOMIAL_ORDER = 2;
    public static final double DEFAULT_CUTOFF_FREQUENCY = 0.05;
    public static final double DEFAULT_SAMPLING_RATE = 1.0;
    public static final int DEFAULT_FILTER_ORDER = 2;
    public static final double DEFAULT_RIPPLE_DB = 0.5;
    public static final double DEFAULT_PROCESS_NOISE = 1e-5;
    public static final double DEFAULT_MEASUREMENT_NOISE = 1e-2;

    private static final List<String> WINDOW_KEYS = Collections.singletonList(WINDOW_SIZE);
    private static final List<String> LOCAL_POLYNOMIAL_KEYS = Arrays.asList(WINDOW_SIZE, POLYNOMIAL_ORDER);
    private static final List<String> EMA_KEYS = Collections.singletonList(ALPHA);
    private static final List<String> FOURIER_KEYS = Arrays.asList(CUTOFF_FREQUENCY, SAMPLING_RATE);
    private static final List<String> BUTTERWORTH_KEYS = Arrays.asList(CUTOFF_FREQUENCY, SAMPLING_RATE, ORDER);
    private static final List<String> CHEBYSHEV_KEYS = Arrays.asList(CUTOFF_FREQUENCY, SAMPLING_RATE, ORDER,
            RIPPLE_DB);
    private static final List<String> KALMAN_KEYS = Arrays.asList(PROCESS_NOISE, MEASUREMENT_NOISE,
            INITIAL_COVARIANCE);
    private static final List<String> EXTENDED_KALMAN_KEYS = Arrays.asList(PROCESS_NOISE, RATE_PROCESS_NOISE,
            MEASUREMENT_NOISE, INITIAL_RATE);

    private SmootherFactory() {
    }

    public static Smoother create(SmoothingConfig config) {
        checkParameter(config != null, "smoothing configuration cannot be null");
        checkParameter(config.getSmoothingMethod() != null, "smoothing_method cannot be null");
        Parameters params = config.parameters();
        params.checkKnown(allowedKeys(config.getSmoothingMethod()), config.getSmoothingMethod().name());
        switch (config.getSmoothingMethod()) {
        case MA:
            return new MovingAverageSmoother(params.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
        case WMA:
            return new WeightedMovingAverageSmoother(params.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
        case MEDIAN_FILTER:
            return new MedianFilterSmoother(params.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
        case EMA:
            return new ExponentialMovingAverageSmoother(params.getDouble(ALPHA, DEFAULT_ALPHA));
        case SG:
            return new SavitzkyGolaySmoother(params.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE),
                    params.getInt(POLYNOMIAL_ORDER, DEFAULT_POLYNOMIAL_ORDER));
        case LOESS:
            return new LoessSmoother(params.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE),
                    params.getInt(POLYNOMIAL_ORDER, 1));
        case FOURIER:
            return new FourierLowPassSmoother(cutoff(params));
        case BUTTERWORTH:
            return IirLowPassSmoother.butterworth(cutoff(params), params.getInt(ORDER, DEFAULT_FILTER_ORDER));
        case CHEBYSHEV:
            return IirLowPassSmoother.chebyshev(cutoff(params), params.getInt(ORDER, DEFAULT_FILTER_ORDER),
                    params.getDouble(RIPPLE_DB, DEFAULT_RIPPLE_DB));
        case KALMAN: {
            double measurementNoise = params.getDouble(MEASUREMENT_NOISE, DEFAULT_MEASUREMENT_NOISE);
            return new KalmanSmoother(params.getDouble(PROCESS_NOISE, DEFAULT_PROCESS_NOISE), measurementNoise,
                    params.getDouble(INITIAL_COVARIANCE, measurementNoise));
        }
        case EXTENDED_KALMAN: {
            double processNoise = params.getDouble(PROCESS_NOISE, DEFAULT_PROCESS_NOISE);
            return new ExtendedKalmanSmoother(processNoise, params.getDouble(RATE_PROCESS_NOISE, 1e-3 * processNoise),
                    params.getDouble(MEASUREMENT_NOISE, DEFAULT_MEASUREMENT_NOISE), params.getDouble(INITIAL_RATE, 0));
        }
        default:
            throw new IllegalStateException("unknown smoothing method " + config.getSmoothingMethod());
        }
    }

    static List<String> allowedKeys(SmoothingMethod method) {
        switch (method) {
        case MA:
        case WMA:
        case MEDIAN_FILTER:
            return WINDOW_KEYS;
        case EMA:
            return EMA_KEYS;
        case SG:
        case LOESS:
            return LOCAL_POLYNOMIAL_KEYS;
        case FOURIER:
            return FOURIER_KEYS;
        case BUTTERWORTH:
            return BUTTERWORTH_KEYS;
        case CHEBYSHEV:
            return CHEBYSHEV_KEYS;
        case KALMAN:
            return KALMAN_KEYS;
        case EXTENDED_KALMAN:
            return EXTENDED_KALMAN_KEYS;
        default:
            throw new IllegalStateException("unknown smoothing method " + method);
        }
    }

    static FrequencyCutoff cutoff(Parameters params) {
        return new FrequencyCutoff(params.getDouble(CUTOFF_FREQUENCY, DEFAULT_CUTOFF_FREQUENCY),
                params.getDouble(SAMPLING_RATE, DEFAULT_SAMPLING_RATE));
    }
}
