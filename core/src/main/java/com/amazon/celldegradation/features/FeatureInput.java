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

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.celldegradation.config.DegradationDirection;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.series.Series;

/**
 * The cleaned and smoothed versions of one channel, on the same indices.
 */
@Getter
public class FeatureInput {

    private final String channel;
    private final Series cleaned;
    private final Series smoothed;
    private final DegradationDirection direction;

    public FeatureInput(CleanedSeries cleaned, Series smoothed, DegradationDirection direction) {
        checkNotNull(cleaned, "cleaned series cannot be null");
        checkNotNull(smoothed, "smoothed series cannot be null");
        checkArgument(Arrays.equals(cleaned.getSeries().getIndices(), smoothed.getIndices()),
                "cleaned and smoothed series must share indices");
        this.channel = cleaned.getChannel();
        this.cleaned = cleaned.getSeries();
        this.smoothed = smoothed;
        this.direction = checkNotNull(direction, "degradation direction cannot be null");
    }
}
