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
import java.util.Locale;
import java.util.Map;

import lombok.Data;

/**
 * One ensemble member: its family, a unique name, the weight used by weighted
 * aggregation and its own hyperparameters (contamination, n_neighbors, nu,
 * kernel, gamma, random_seed, max_iterations, ...).
 */
@Data
public class DetectorConfig {

    private DetectorType type;

    private String name;

    private double weight = 1.0;

    private Map<String, Object> hyperparameters = new HashMap<>();

    public DetectorConfig() {
    }

    public DetectorConfig(DetectorType type, String name, Map<String, Object> hyperparameters) {
        this.type = type;
        this.name = name;
        this.hyperparameters = (hyperparameters == null) ? new HashMap<>() : new HashMap<>(hyperparameters);
    }

    public static DetectorConfig of(DetectorType type, Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new DetectorConfig(type, null, params);
    }

    public Parameters parameters() {
        return new Parameters(hyperparameters);
    }

    /**
     * the configured name, or the family name when none was given
     */
    public String effectiveName() {
        return (name == null || name.isEmpty()) ? type.name().toLowerCase(Locale.ROOT) : name;
    }
}
