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

import static com.amazon.celldegradation.config.SmoothingMethod.normalize;

/**
 * The outlier detector families available to the ensemble.
 */
public enum DetectorType {

    /**
     * partition based; anomalies are isolated by few random cuts
     */
    ISOLATION_FOREST("IsolationForest", "IForest", "IF"),
    /**
     * local density relative to the k nearest neighbors
     */
    LOCAL_OUTLIER_FACTOR("LOF"),
    /**
     * boundary based, a kernel support estimate of the bulk of the data
     */
    ONE_CLASS_SVM("OCSVM", "OneClassSVM"),
    /**
     * covariance based, Mahalanobis distance under a robust covariance estimate
     */
    ELLIPTIC_ENVELOPE("EllipticEnvelope", "MCD", "RobustCovariance");

    private final String[] aliases;

    DetectorType(String... aliases) {
        this.aliases = aliases;
    }

    public static DetectorType fromString(String value) {
        if (value == null) {
            return null;
        }
        String key = normalize(value);
        for (DetectorType type : values()) {
            if (normalize(type.name()).equals(key)) {
                return type;
            }
            for (String alias : type.aliases) {
                if (normalize(alias).equals(key)) {
                    return type;
                }
            }
        }
        return null;
    }
}
