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

package com.amazon.celldegradation.ensemble.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.celldegradation.ensemble.ModelResult;
import com.amazon.celldegradation.ensemble.RunManifest;
import com.amazon.celldegradation.ensemble.consensus.AgreementMatrix;
import com.amazon.celldegradation.ensemble.consensus.AnomalyTable;
import com.amazon.celldegradation.ensemble.consensus.ConsensusRecord;
import com.amazon.celldegradation.features.FeatureMatrix;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.smoothing.SmoothingResult;

/**
 * Everything a run hands to reporting: the ranked table and its views, the
 * agreement matrix, the per model results, the intermediate series and
 * features, and the manifest of what was excluded.
 */
@Getter
public class PipelineResult {

    private final Map<String, CleanedSeries> cleaned;
    private final Map<String, SmoothingResult> smoothed;
    private final FeatureMatrix features;
    private final List<ModelResult> modelResults;
    private final List<ConsensusRecord> consensus;
    private final AnomalyTable anomalyTable;
    private final AnomalyTable topAnomalies;
    private final AnomalyTable highConfidenceAnomalies;
    private final AgreementMatrix agreement;
    private final RunManifest manifest;

    public PipelineResult(Map<String, CleanedSeries> cleaned, Map<String, SmoothingResult> smoothed,
            FeatureMatrix features, List<ModelResult> modelResults, List<ConsensusRecord> consensus,
            AnomalyTable anomalyTable, int topN, int quorum, AgreementMatrix agreement, RunManifest manifest) {
        this.cleaned = Collections.unmodifiableMap(cleaned);
        this.smoothed = Collections.unmodifiableMap(smoothed);
        this.features = features;
        this.modelResults = Collections.unmodifiableList(modelResults);
        this.consensus = Collections.unmodifiableList(consensus);
        this.anomalyTable = anomalyTable;
        this.topAnomalies = anomalyTable.top(topN);
        this.highConfidenceAnomalies = anomalyTable.highConfidence(quorum);
        this.agreement = agreement;
        this.manifest = manifest;
    }
}
