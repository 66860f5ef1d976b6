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
 * Locally weighted regression with tricube weights around the sample being
 * smoothed. The tricube radius is one step beyond the farthest window sample so
 * that every sample in the window contributes.
 */
public class LoessSmoother extends LocalPolynomialSmoother {

    public LoessSmoother(int windowSize, int polynomialOrder) {
        super(windowSize, polynomialOrder);
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.LOESS;
    }

    @Override
    protected double regressionWeight(int j, int r) {
        double radius = Math.max(r, windowSize - 1 - r) + 1.0;
        double u = Math.abs(j - r) / radius;
        double t = 1 - u * u * u;
        return t * t * t;
    }
}
