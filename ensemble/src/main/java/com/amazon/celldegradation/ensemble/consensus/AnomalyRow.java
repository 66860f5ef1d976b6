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

package com.amazon.celldegradation.ensemble.consensus;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * One row of the ranked anomaly table: the consensus record, the flag of every
 * effective detector and, when the features are known, the standardized
 * feature values of the sample with the feature that deviates most.
 */
public class AnomalyRow {

    @Getter
    private final ConsensusRecord record;
    private final Map<String, Boolean> modelFlags;
    private final double[] attribution;
    @Getter
    private final String dominantFeature;

    public AnomalyRow(ConsensusRecord record, Map<String, Boolean> modelFlags, double[] attribution,
            String dominantFeature) {
        this.record = record;
        this.modelFlags = Collections.unmodifiableMap(new LinkedHashMap<>(modelFlags));
        this.attribution = (attribution == null) ? null : Arrays.copyOf(attribution, attribution.length);
        this.dominantFeature = dominantFeature;
    }

    public long getIndex() {
        return record.getIndex();
    }

    public int getCount() {
        return record.getCount();
    }

    public double getCombinedScore() {
        return record.getCombinedScore();
    }

    public int getRank() {
        return record.getRank();
    }

    /**
     * @return detector name to flag, in detector order
     */
    public Map<String, Boolean> getModelFlags() {
        return modelFlags;
    }

    public boolean isFlaggedBy(String model) {
        return Boolean.TRUE.equals(modelFlags.get(model));
    }

    /**
     * @return standardized feature values of the sample, or null when the table
     *         was built without features
     */
    public double[] getAttribution() {
        return (attribution == null) ? null : Arrays.copyOf(attribution, attribution.length);
    }
}
