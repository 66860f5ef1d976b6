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

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Local level Kalman filter. Strictly sequential within a series; the state is
 * created per call, so distinct series may be filtered concurrently.
 */
public class KalmanSmoother implements Smoother {

    private final double processNoise;
    private final double measurementNoise;
    private final double initialCovariance;

    public KalmanSmoother(double processNoise, double measurementNoise, double initialCovariance) {
        checkParameter(processNoise > 0, "process_noise must be positive");
        checkParameter(measurementNoise > 0, "measurement_noise must be positive");
        checkParameter(initialCovariance > 0, "initial_covariance must be positive");
        this.processNoise = processNoise;
        this.measurementNoise = measurementNoise;
        this.initialCovariance = initialCovariance;
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.KALMAN;
    }

    public KalmanState initialState(double firstValue) {
        return new KalmanState(firstValue, initialCovariance);
    }

    @Override
    public double[] apply(double[] values) {
        double[] answer = new double[values.length];
        if (values.length == 0) {
            return answer;
        }
        KalmanState state = initialState(values[0]);
        for (int t = 0; t < values.length; t++) {
            state = state.predict(processNoise).update(values[t], measurementNoise);
            answer[t] = state.getEstimate();
        }
        return answer;
    }
}
