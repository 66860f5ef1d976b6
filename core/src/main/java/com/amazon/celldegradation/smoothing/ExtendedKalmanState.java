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
 * State of the exponential decay model used by the extended Kalman filter: the
 * level c and the per sample decay rate k, with transition c' = c * exp(-k),
 * k' = k. The covariance is stored as its three distinct entries.
 */
public final class ExtendedKalmanState {

    private final double level;
    private final double rate;
    private final double p00;
    private final double p01;
    private final double p11;

    public ExtendedKalmanState(double level, double rate, double p00, double p01, double p11) {
        this.level = level;
        this.rate = rate;
        this.p00 = p00;
        this.p01 = p01;
        this.p11 = p11;
    }

    public double getLevel() {
        return level;
    }

    public double getRate() {
        return rate;
    }

    public double getLevelVariance() {
        return p00;
    }

    /**
     * propagate through the nonlinear transition, the covariance through its
     * Jacobian F = [[exp(-k), -c exp(-k)], [0, 1]]
     */
    public ExtendedKalmanState predict(double levelNoise, double rateNoise) {
        double decay = Math.exp(-rate);
        double f00 = decay;
        double f01 = -level * decay;
        // F P F^T + Q with f10 = 0, f11 = 1
        double n00 = f00 * f00 * p00 + 2 * f00 * f01 * p01 + f01 * f01 * p11 + levelNoise;
        double n01 = f00 * p01 + f01 * p11;
        double n11 = p11 + rateNoise;
        return new ExtendedKalmanState(level * decay, rate, n00, n01, n11);
    }

    /**
     * measurement of the level only, H = [1, 0]
     */
    public ExtendedKalmanState update(double measurement, double measurementNoise) {
        double innovation = measurement - level;
        double s = p00 + measurementNoise;
        double k0 = p00 / s;
        double k1 = p01 / s;
        return new ExtendedKalmanState(level + k0 * innovation, rate + k1 * innovation, (1 - k0) * p00,
                (1 - k0) * p01, p11 - k1 * p01);
    }
}
