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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Fits a polynomial of the configured order to every window of windowSize
 * consecutive samples by weighted least squares and evaluates it at the sample
 * being smoothed. Near the boundaries the window is pinned to the first (or
 * last) windowSize samples and the fit is evaluated off centre, so polynomials
 * up to the configured order are reproduced everywhere.
 *
 * The evaluation weights depend only on the offset of the sample within its
 * window; they are computed once per offset at construction.
 */
public abstract class LocalPolynomialSmoother implements Smoother {

    protected final int windowSize;

    protected final int polynomialOrder;

    // weights[r][j]: contribution of window sample j when evaluating at offset r
    private final double[][] weights;

    protected LocalPolynomialSmoother(int windowSize, int polynomialOrder) {
        checkParameter(polynomialOrder >= 0, "polynomial_order cannot be negative");
        checkParameter(windowSize > polynomialOrder, "window_size must exceed polynomial_order");
        checkParameter(windowSize >= polynomialOrder + 2, "window_size must be at least polynomial_order + 2");
        checkParameter(windowSize % 2 == 1, "window_size must be odd");
        this.windowSize = windowSize;
        this.polynomialOrder = polynomialOrder;
        this.weights = new double[windowSize][];
        for (int r = 0; r < windowSize; r++) {
            weights[r] = evaluationWeights(r);
        }
    }

    /**
     * regression weight of window sample j when the fit is evaluated at offset r
     */
    protected abstract double regressionWeight(int j, int r);

    double[] evaluationWeights(int r) {
        double scale = Math.max(1, windowSize / 2);
        double[][] design = new double[windowSize][polynomialOrder + 1];
        double[] root = new double[windowSize];
        for (int j = 0; j < windowSize; j++) {
            root[j] = Math.sqrt(regressionWeight(j, r));
            double x = (j - r) / scale;
            double power = 1;
            for (int k = 0; k <= polynomialOrder; k++) {
                design[j][k] = root[j] * power;
                power *= x;
            }
        }
        RealMatrix pseudoInverse = new QRDecomposition(new Array2DRowRealMatrix(design, false)).getSolver()
                .getInverse();
        // the fitted polynomial at x = 0 is its constant coefficient
        double[] answer = new double[windowSize];
        for (int j = 0; j < windowSize; j++) {
            answer[j] = pseudoInverse.getEntry(0, j) * root[j];
        }
        return answer;
    }

    @Override
    public int minimumLength() {
        return windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getPolynomialOrder() {
        return polynomialOrder;
    }

    @Override
    public double[] apply(double[] values) {
        checkArgument(values.length >= windowSize, "series shorter than window_size");
        int n = values.length;
        int half = windowSize / 2;
        double[] answer = new double[n];
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, Math.min(i - half, n - windowSize));
            double[] row = weights[i - start];
            // the weights sum to one, working with deviations keeps constants exact
            double reference = values[i];
            double sum = 0;
            for (int j = 0; j < windowSize; j++) {
                sum += row[j] * (values[start + j] - reference);
            }
            answer[i] = reference + sum;
        }
        return answer;
    }
}
