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

import lombok.Getter;

import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.detector.DetectionOutcome;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * One detector invocation; holds either the outcome or the failure.
 */
@Getter
public class DetectorRun {

    private final AnomalyDetector detector;
    private final DetectionOutcome outcome;
    private final RuntimeException failure;

    private DetectorRun(AnomalyDetector detector, DetectionOutcome outcome, RuntimeException failure) {
        this.detector = detector;
        this.outcome = outcome;
        this.failure = failure;
    }

    /**
     * Runs the detector, capturing any runtime failure instead of propagating
     * it.
     */
    public static DetectorRun of(AnomalyDetector detector, FeatureMatrix features) {
        try {
            return new DetectorRun(detector, detector.fitPredict(features), null);
        } catch (RuntimeException e) {
            return new DetectorRun(detector, null, e);
        }
    }

    public boolean isSuccessful() {
        return failure == null && outcome != null;
    }
}
