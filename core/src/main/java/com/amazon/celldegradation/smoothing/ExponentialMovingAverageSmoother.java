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

import static com.amazon.celldegradation.CommonUtils.checkParameter;

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * output[0] = input[0]; output[t] = alpha * input[t] + (1 - alpha) *
 * output[t-1]
 */
public class ExponentialMovingAverageSmoother implements Smoother {

    private final double alpha;

    public ExponentialMovingAverageSmoother(double alpha) {
        checkParameter(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]");
        this.alpha = alpha;
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.EMA;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public double[] apply(double[] values) {
        double[] answer = new double[values.length];
        if (values.length == 0) {
            return answer;
        }
        answer[0] = values[0];
        for (int t = 1; t < values.length; t++) {
            answer[t] = answer[t - 1] + alpha * (values[t] - answer[t - 1]);
        }
        return answer;
    }
}
