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

import lombok.Getter;

import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.series.Series;

@Getter
public class SmoothingResult {

    private final String channel;
    private final SmoothingMethod method;
    private final Series smoothed;
    private final Diagnostics diagnostics;

    public SmoothingResult(String channel, SmoothingMethod method, Series smoothed, Diagnostics diagnostics) {
        this.channel = channel;
        this.method = method;
        this.smoothed = smoothed;
        this.diagnostics = diagnostics;
    }
}
