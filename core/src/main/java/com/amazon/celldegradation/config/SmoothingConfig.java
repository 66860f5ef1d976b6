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

import java.util.HashMap;
import java.util.Map;

import lombok.Data;

/**
 * The smoothing choice of one channel: a method and its method specific
 * parameters (window_size, alpha, polynomial_order, cutoff_frequency, ...).
 */
@Data
public class SmoothingConfig {

    private SmoothingMethod smoothingMethod = SmoothingMethod.MA;

    private Map<String, Object> smoothingParams = new HashMap<>();

    public SmoothingConfig() {
    }

    public SmoothingConfig(SmoothingMethod smoothingMethod, Map<String, Object> smoothingParams) {
        this.smoothingMethod = smoothingMethod;
        this.smoothingParams = (smoothingParams == null) ? new HashMap<>() : new HashMap<>(smoothingParams);
    }

    public static SmoothingConfig of(SmoothingMethod method, Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new SmoothingConfig(method, params);
    }

    public Parameters parameters() {
        return new Parameters(smoothingParams);
    }
}
