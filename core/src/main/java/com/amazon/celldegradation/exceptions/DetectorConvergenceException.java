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

package com.amazon.celldegradation.exceptions;

import lombok.Getter;

/**
 * Thrown when a single detector fails to converge within its iteration budget
 * or runs into a numerical failure. The ensemble excludes that detector and
 * continues with the rest.
 */
@Getter
public class DetectorConvergenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final int iterations;

    public DetectorConvergenceException(String detector, int iterations, String message) {
        super(String.format("detector %s failed after %d iterations: %s", detector, iterations, message));
        this.detector = detector;
        this.iterations = iterations;
    }
}
