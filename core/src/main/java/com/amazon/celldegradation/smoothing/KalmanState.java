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

/**
 * Estimate and error variance of a scalar local level model. Immutable: each
 * predict or update step returns the next state, so a channel run threads one
 * chain of states through its samples in order and nothing is shared between
 * runs.
 */
public final class KalmanState {

    private final double estimate;
    private final double errorCovariance;

    public KalmanState(double estimate, double errorCovariance) {
        this.estimate = estimate;
        this.errorCovariance = errorCovariance;
    }

    public double getEstimate() {
        return estimate;
    }

    public double getErrorCovariance() {
        return errorCovariance;
    }

    /**
     * random walk prediction, the level is carried over and uncertainty grows
     */
    public KalmanState predict(double processNoise) {
        return new KalmanState(estimate, errorCovariance + processNoise);
    }

    public KalmanState update(double measurement, double measurementNoise) {
        double gain = errorCovariance / (errorCovariance + measurementNoise);
        return new KalmanState(estimate + gain * (measurement - estimate), (1 - gain) * errorCovariance);
    }
}
