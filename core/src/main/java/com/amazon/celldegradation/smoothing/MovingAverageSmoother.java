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

public class MovingAverageSmoother extends AbstractWindowSmoother {

    public MovingAverageSmoother(int windowSize) {
        super(windowSize);
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.MA;
    }

    @Override
    protected double aggregate(double[] values, int from, int to, int center) {
        // deviations from the centre keep a constant window exact
        double reference = values[center];
        double sum = 0;
        for (int j = from; j <= to; j++) {
            sum += values[j] - reference;
        }
        return reference + sum / (to - from + 1);
    }
}
