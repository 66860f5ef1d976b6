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

import com.amazon.celldegradation.CommonUtils;

/**
 * Over/under smoothing indicators. A large residual standard deviation with a
 * tiny roughness suggests over smoothing; a small residual with a large
 * roughness suggests noise is still passing through.
 */
@Getter
public class Diagnostics {

    private final double residStd;
    private final double derivativeRoughness;

    public Diagnostics(double residStd, double derivativeRoughness) {
        this.residStd = residStd;
        this.derivativeRoughness = derivativeRoughness;
    }

    public static Diagnostics of(double[] input, double[] smoothed) {
        return new Diagnostics(CommonUtils.residualStandardDeviation(input, smoothed),
                CommonUtils.derivativeRoughness(smoothed));
    }

    @Override
    public String toString() {
        return String.format("Diagnostics(residStd=%.6g, derivativeRoughness=%.6g)", residStd, derivativeRoughness);
    }
}
