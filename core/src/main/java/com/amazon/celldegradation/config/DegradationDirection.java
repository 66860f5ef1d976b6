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

/**
 * The sign of change that corresponds to wear for a channel. Capacity fades,
 * internal resistance and cell temperature rise.
 */
public enum DegradationDirection {

    DECREASING,

    INCREASING;

    /**
     * the degradation carried by a single smoothed delta
     *
     * @param delta first difference of the smoothed series
     * @return a non-negative amount
     */
    public double degradation(double delta) {
        if (this == DECREASING) {
            return (delta < 0) ? -delta : 0;
        }
        return (delta > 0) ? delta : 0;
    }
}
