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
 * Savitzky-Golay: unweighted least squares polynomial over each window.
 */
public class SavitzkyGolaySmoother extends LocalPolynomialSmoother {

    public SavitzkyGolaySmoother(int windowSize, int polynomialOrder) {
        super(windowSize, polynomialOrder);
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.SG;
    }

    @Override
    protected double regressionWeight(int j, int r) {
        return 1.0;
    }
}
