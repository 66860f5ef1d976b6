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

import java.util.Arrays;

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Running median; removes isolated spikes entirely instead of spreading them
 * over the window.
 */
public class MedianFilterSmoother extends AbstractWindowSmoother {

    public MedianFilterSmoother(int windowSize) {
        super(windowSize);
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.MEDIAN_FILTER;
    }

    @Override
    protected double aggregate(double[] values, int from, int to, int center) {
        double[] window = Arrays.copyOfRange(values, from, to + 1);
        Arrays.sort(window);
        // symmetric windows always hold an odd number of samples
        return window[window.length / 2];
    }
}
