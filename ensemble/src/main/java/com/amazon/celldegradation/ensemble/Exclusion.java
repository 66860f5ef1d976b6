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

/**
 * A channel or detector left out of a run, with the stage and the reason.
 */
@Getter
public class Exclusion {

    public enum Stage {
        CLEANING, SMOOTHING, FEATURES, DETECTION
    }

    private final Stage stage;
    private final String name;
    private final String reason;

    public Exclusion(Stage stage, String name, String reason) {
        this.stage = stage;
        this.name = name;
        this.reason = reason;
    }

    @Override
    public String toString() {
        return stage + " " + name + ": " + reason;
    }
}
