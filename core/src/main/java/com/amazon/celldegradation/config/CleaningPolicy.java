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

package com.amazon.celldegradation.config;

import lombok.Data;

/**
 * How a raw channel is repaired before smoothing. Values outside
 * [physicalMin, physicalMax] are treated as invalid and repaired by the
 * interpolation policy. A positive gapStep declares the series to be on a
 * regular grid; absent grid indices are inserted and repaired as well.
 */
@Data
public class CleaningPolicy {

    public static final int DEFAULT_MIN_VALID_POINTS = 10;

    private InterpolationPolicy interpolation = InterpolationPolicy.LINEAR;

    private double physicalMin = Double.NEGATIVE_INFINITY;

    private double physicalMax = Double.POSITIVE_INFINITY;

    private int minValidPoints = DEFAULT_MIN_VALID_POINTS;

    private long gapStep = 0;
}
