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

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Settings of the feature engineer. Ratios are written as
 * "numerator/denominator" with channel names, for example
 * "charge_voltage/discharge_temp".
 */
@Data
public class FeatureConfig {

    public static final int DEFAULT_TREND_HORIZON = 10;

    private int trendHorizon = DEFAULT_TREND_HORIZON;

    private List<String> ratios = new ArrayList<>();

    /**
     * channel whose cleaned indices form the row grid; the first surviving
     * channel when null
     */
    private String primaryChannel;
}
