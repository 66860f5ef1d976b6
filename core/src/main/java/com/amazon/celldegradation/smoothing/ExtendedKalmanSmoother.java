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
 * Extended Kalman filter tracking a level that decays exponentially at an
 * unknown, slowly varying rate; a natural model for capacity fade.
 */
public class ExtendedKalmanSmoother implements Smoother {

    private final double processNoise;
    private final double rateProcessNoise;
    private final double measurementNoise;
    private final double initialRate;

    public ExtendedKalmanSmoother(double processNoise, double rateProcessNoise, double measurementNoise,
            double initialRate) {
        checkParameter(processNoise > 0, "process_noise must be positive");
        checkParameter(rateProcessNoise >= 0, "rate_process_noise cannot be negative");
        checkParameter(measurementNoise > 0, "measurement_noise must be positive");
        checkParameter(Double.isFinite(initialRate), "initial_rate must be finite");
        this.processNoise = processNoise;
        this.rateProcessNoise = rateProcessNoise;
        this.measurementNoise = measurementNoise;
        this.initialRate = initialRate;
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.EXTENDED_KALMAN;
    }

    public ExtendedKalmanState initialState(double firstValue) {
        return new ExtendedKalmanState(firstValue, initialRate, measurementNoise, 0, Math.max(rateProcessNoise, 1e-8));
    }

    @Override
    public double[] apply(double[] values) {
        double[] answer = new double[values.length];
        if (values.length == 0) {
            return answer;
        }
        ExtendedKalmanState state = initialState(values[0]);
        answer[0] = values[0];
        for (int t = 1; t < values.length; t++) {
            state = state.predict(processNoise, rateProcessNoise).update(values[t], measurementNoise);
            answer[t] = state.getLevel();
        }
        return answer;
    }
}
