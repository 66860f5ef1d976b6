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

package com.amazon.celldegradation.ensemble.config;

/**
 * How the normalized scores of the detectors are combined into one score per
 * sample.
 */
public enum AggregationMethod {

    /**
     * mean of the scores of the detectors that flagged the sample, 0 when none did
     */
    MEAN_OF_FLAGGING,
    /**
     * mean of the scores of every effective detector
     */
    MEAN_OF_ALL,
    /**
     * largest score among the effective detectors
     */
    MAX,
    /**
     * mean of every effective detector's score weighted by its configured weight
     */
    WEIGHTED_MEAN
}
