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

package com.amazon.celldegradation.ensemble;

import java.util.Collections;
import java.util.List;

import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * Runs every detector of an ensemble over the same feature matrix. The
 * returned runs are in the order of the detectors, whatever the order of
 * completion.
 */
public abstract class AbstractEnsembleExecutor {

    protected final List<AnomalyDetector> detectors;

    protected AbstractEnsembleExecutor(List<AnomalyDetector> detectors) {
        this.detectors = Collections.unmodifiableList(detectors);
    }

    public abstract List<DetectorRun> execute(FeatureMatrix features);

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
