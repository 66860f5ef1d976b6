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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * What a pipeline run actually used: the channels and detectors that took part
 * and every exclusion with its reason.
 */
@Getter
public class RunManifest {

    private final List<String> configuredChannels;
    private final List<String> effectiveChannels;
    private final List<String> configuredDetectors;
    private final List<String> effectiveDetectors;
    private final List<Exclusion> exclusions;

    public RunManifest(List<String> configuredChannels, List<String> effectiveChannels,
            List<String> configuredDetectors, List<String> effectiveDetectors, List<Exclusion> exclusions) {
        this.configuredChannels = Collections.unmodifiableList(new ArrayList<>(configuredChannels));
        this.effectiveChannels = Collections.unmodifiableList(new ArrayList<>(effectiveChannels));
        this.configuredDetectors = Collections.unmodifiableList(new ArrayList<>(configuredDetectors));
        this.effectiveDetectors = Collections.unmodifiableList(new ArrayList<>(effectiveDetectors));
        this.exclusions = Collections.unmodifiableList(new ArrayList<>(exclusions));
    }

    public boolean isComplete() {
        return exclusions.isEmpty();
    }

    public List<Exclusion> exclusionsAt(Exclusion.Stage stage) {
        List<Exclusion> answer = new ArrayList<>();
        for (Exclusion exclusion : exclusions) {
            if (exclusion.getStage() == stage) {
                answer.add(exclusion);
            }
        }
        return answer;
    }
}
