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
 * Metadata and per channel processing choices. Channels are processed
 * independently; nothing here refers to another channel.
 */
@Data
public class ChannelConfig {

    private String name;

    private String unit = "";

    /**
     * expected standard deviation of measurement noise, informational
     */
    private double noiseScale = 0;

    private DegradationDirection degradationDirection = DegradationDirection.DECREASING;

    private SmoothingConfig smoothing = new SmoothingConfig();

    private CleaningPolicy cleaning = new CleaningPolicy();

    public ChannelConfig() {
    }

    public ChannelConfig(String name) {
        this.name = name;
    }
}
