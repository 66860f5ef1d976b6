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

import lombok.Getter;

import com.amazon.celldegradation.config.ChannelConfig;

/**
 * A named raw series together with its metadata and processing choices.
 */
@Getter
public class Channel {

    private final String name;
    private final Series series;
    private final ChannelConfig config;

    public Channel(Series series, ChannelConfig config) {
        this.series = checkNotNull(series, "series cannot be null");
        this.config = checkNotNull(config, "channel configuration cannot be null");
        checkArgument(config.getName() != null && !config.getName().isEmpty(), "channel name cannot be empty");
        this.name = config.getName();
    }

    public Channel(String name, Series series) {
        this(series, new ChannelConfig(name));
    }
}
