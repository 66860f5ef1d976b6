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

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * A denoising filter over the values of one channel. Implementations are
 * configured at construction, validate their parameters eagerly and hold no
 * state between calls, so one instance may be shared across channels and
 * threads.
 */
public interface Smoother {

    SmoothingMethod getMethod();

    /**
     * smooth a series of values
     *
     * @param values the input, not modified
     * @return a new array of the same length
     */
    double[] apply(double[] values);

    /**
     * @return the smallest input length the filter accepts
     */
    default int minimumLength() {
        return 1;
    }
}
