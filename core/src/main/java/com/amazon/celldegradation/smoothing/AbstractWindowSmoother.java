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

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

/**
 * Centred window filters. A window of size w covers w / 2 samples on either
 * side (even sizes are widened by one to stay centred). Within half a window of
 * either boundary the window shrinks symmetrically, so no values are invented
 * beyond the ends of the series.
 */
public abstract class AbstractWindowSmoother implements Smoother {

    protected final int windowSize;

    protected final int halfWindow;

    protected AbstractWindowSmoother(int windowSize) {
        checkParameter(windowSize >= 1, "window_size must be at least 1");
        this.windowSize = windowSize;
        this.halfWindow = windowSize / 2;
    }

    public int getWindowSize() {
        return windowSize;
    }

    @Override
    public double[] apply(double[] values) {
        checkArgument(values.length >= minimumLength(), "series too short");
        double[] answer = new double[values.length];
        int n = values.length;
        for (int i = 0; i < n; i++) {
            int reach = Math.min(halfWindow, Math.min(i, n - 1 - i));
            answer[i] = aggregate(values, i - reach, i + reach, i);
        }
        return answer;
    }

    /**
     * combine values[from..to] (inclusive), centred at position center
     */
    protected abstract double aggregate(double[] values, int from, int to, int center);
}
