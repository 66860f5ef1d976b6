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

package com.amazon.celldegradation.detector;

import java.util.Locale;

import com.amazon.celldegradation.exceptions.InvalidParameterException;

/**
 * Kernels available to the one-class SVM.
 */
public enum SvmKernel {
    /**
     * exp(-gamma * |x - y|^2)
     */
    RBF,
    /**
     * x . y
     */
    LINEAR,
    /**
     * (gamma * x . y + coef0)^degree
     */
    POLY;

    public static SvmKernel fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            if ("POLYNOMIAL".equals(normalized)) {
                return POLY;
            }
            for (SvmKernel kernel : values()) {
                if (kernel.name().equals(normalized)) {
                    return kernel;
                }
            }
        }
        throw new InvalidParameterException("unknown kernel: " + value);
    }

    double apply(double[] a, double[] b, double gamma, double coef0, int degree) {
        switch (this) {
        case LINEAR:
            return dot(a, b);
        case POLY:
            return Math.pow(gamma * dot(a, b) + coef0, degree);
        default:
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                double t = a[i] - b[i];
                sum += t * t;
            }
            return Math.exp(-gamma * sum);
        }
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
