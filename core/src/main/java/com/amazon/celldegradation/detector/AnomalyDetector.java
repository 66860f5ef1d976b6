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

package com.amazon.celldegradation.detector;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * A batch outlier detector. Implementations fit on the rows they are given and
 * score the same rows; they must not modify the matrix, which is shared by
 * concurrent detectors.
 */
public interface AnomalyDetector {

    String getName();

    DetectorType getType();

    double getContamination();

    /**
     * Fit the detector to every row of the matrix and score those rows.
     *
     * @param features the feature rows; every value must be finite
     * @return one score and one flag per row, in row order
     * @throws com.amazon.celldegradation.exceptions.DetectorConvergenceException
     *         if the fit does not converge within its iteration budget
     */
    DetectionOutcome fitPredict(FeatureMatrix features);
}
