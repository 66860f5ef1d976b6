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

import lombok.Getter;

/**
 * Output of the cleaner: a series with strictly increasing indices and only
 * finite values, plus the report of what was changed to get there.
 */
@Getter
public class CleanedSeries {

    private final String channel;
    private final Series series;
    private final CleaningReport report;

    public CleanedSeries(String channel, Series series, CleaningReport report) {
        checkArgument(series.isStrictlyIncreasing(), "cleaned series must have strictly increasing indices");
        this.channel = channel;
        this.series = series;
        this.report = report;
    }

    public int size() {
        return series.size();
    }
}
