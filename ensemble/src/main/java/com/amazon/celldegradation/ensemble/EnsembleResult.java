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

import lombok.Getter;

/**
 * The results of the detectors that completed, the exclusions of those that
 * did not, and the number configured.
 */
@Getter
public class EnsembleResult {

    private final List<ModelResult> results;
    private final List<Exclusion> exclusions;
    private final int configuredDetectors;

    public EnsembleResult(List<ModelResult> results, List<Exclusion> exclusions, int configuredDetectors) {
        this.results = Collections.unmodifiableList(results);
        this.exclusions = Collections.unmodifiableList(exclusions);
        this.configuredDetectors = configuredDetectors;
    }

    public int getEffectiveDetectors() {
        return results.size();
    }
}
