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

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Triangular weights: the centre sample has weight reach + 1 and the weight
 * drops by one per step away from it.
 */
public class WeightedMovingAverageSmoother extends AbstractWindowSmoother {

    public WeightedMovingAverageSmoother(int windowSize) {
        super(windowSize);
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.WMA;
    }

    @Override
    protected double aggregate(double[] values, int from, int to, int center) {
        int reach = center - from;
        double reference = values[center];
        double sum = 0;
        double weightSum = 0;
        for (int j = from; j <= to; j++) {
            double weight = reach + 1 - Math.abs(j - center);
            sum += weight * (values[j] - reference);
            weightSum += weight;
        }
        return reference + sum / weightSum;
    }
}
