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

package com.amazon.celldegradation.features;

import java.util.Arrays;

import lombok.Getter;

/**
 * One row of engineered features, keyed by the series index of its sample.
 * Invalid rows have at least one feature that could not be computed.
 */
@Getter
public class FeatureRecord {

    private final int row;
    private final long index;
    private final double[] values;
    private final boolean valid;

    public FeatureRecord(int row, long index, double[] values, boolean valid) {
        this.row = row;
        this.index = index;
        this.values = Arrays.copyOf(values, values.length);
        this.valid = valid;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double getValue(int column) {
        return values[column];
    }
}
