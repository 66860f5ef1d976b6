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

package com.amazon.celldegradation.series;

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An ordered sequence of (index, value) pairs of one signal. The index is a
 * cycle number or a timestamp. A raw series may be unsorted and may hold NaN
 * values or repeated indices; a cleaned series has strictly increasing indices.
 * Instances are immutable, accessors return copies.
 */
public class Series {

    private final long[] indices;
    private final double[] values;

    public Series(long[] indices, double[] values) {
        checkNotNull(indices, "indices cannot be null");
        checkNotNull(values, "values cannot be null");
        checkArgument(indices.length == values.length, "indices and values must have the same length");
        this.indices = Arrays.copyOf(indices, indices.length);
        this.values = Arrays.copyOf(values, values.length);
    }

    /**
     * a series indexed 0, 1, 2, ...
     */
    public static Series of(double... values) {
        long[] indices = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }
        return new Series(indices, values);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public long getIndex(int position) {
        return indices[position];
    }

    public double getValue(int position) {
        return values[position];
    }

    public long[] getIndices() {
        return Arrays.copyOf(indices, indices.length);
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * a series with the same indices and new values
     */
    public Series withValues(double[] newValues) {
        checkArgument(newValues.length == values.length, "incorrect length of values");
        return new Series(indices, newValues);
    }

    public boolean isStrictlyIncreasing() {
        for (int i = 1; i < indices.length; i++) {
            if (indices[i] <= indices[i - 1]) {
                return false;
            }
        }
        return true;
    }

    /**
     * position of an index in a strictly increasing series
     *
     * @param index the index to look up
     * @return the position, or a negative insertion point as in
     *         {@link Arrays#binarySearch(long[], long)}
     */
    public int positionOf(long index) {
        return Arrays.binarySearch(indices, index);
    }

    /**
     * linear interpolation of the value at an index of a strictly increasing
     * series; NaN outside [first index, last index]
     */
    public double interpolate(long index) {
        if (indices.length == 0 || index < indices[0] || index > indices[indices.length - 1]) {
            return Double.NaN;
        }
        int position = positionOf(index);
        if (position >= 0) {
            return values[position];
        }
        int upper = -position - 1;
        int lower = upper - 1;
        double fraction = (double) (index - indices[lower]) / (indices[upper] - indices[lower]);
        return values[lower] + fraction * (values[upper] - values[lower]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series)) {
            return false;
        }
        Series other = (Series) o;
        return Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Series(size=" + values.length + ")";
    }
}
