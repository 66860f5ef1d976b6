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

package com.amazon.celldegradation;

import java.util.Objects;

import com.amazon.celldegradation.exceptions.InvalidParameterException;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link InvalidParameterException} with the specified message if
     * the specified input is false. Used for user supplied configuration, which is
     * validated before any computation starts.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws InvalidParameterException if {@code condition} is false.
     */
    public static void checkParameter(boolean condition, String message) {
        if (!condition) {
            throw new InvalidParameterException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * population standard deviation of the difference of two arrays of equal
     * length
     *
     * @param a first array
     * @param b second array
     * @return standard deviation of a - b, 0 for empty input
     */
    public static double residualStandardDeviation(double[] a, double[] b) {
        checkArgument(a.length == b.length, "arrays must have the same length");
        if (a.length == 0) {
            return 0;
        }
        double sum = 0;
        double sumSquared = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff;
            sumSquared += diff * diff;
        }
        double mean = sum / a.length;
        double variance = sumSquared / a.length - mean * mean;
        return (variance > 0) ? Math.sqrt(variance) : 0;
    }

    /**
     * mean squared second difference; a measure of the high frequency content
     * left in a series
     *
     * @param values the series
     * @return the mean of (x[t+1] - 2x[t] + x[t-1])^2, 0 if fewer than 3 values
     */
    public static double derivativeRoughness(double[] values) {
        if (values.length < 3) {
            return 0;
        }
        double sum = 0;
        for (int i = 1; i < values.length - 1; i++) {
            double second = values[i + 1] - 2 * values[i] + values[i - 1];
            sum += second * second;
        }
        return sum / (values.length - 2);
    }

    /**
     * the average path length of an unsuccessful search in a binary search tree
     * with n entries; normalizes isolation depths
     *
     * @param n number of points
     * @return c(n)
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1) + 0.5772156649015329) - 2.0 * (n - 1) / n;
    }
}
