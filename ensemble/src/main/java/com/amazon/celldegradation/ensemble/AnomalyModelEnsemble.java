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

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.detector.DetectionOutcome;
import com.amazon.celldegradation.detector.DetectorFactory;
import com.amazon.celldegradation.ensemble.config.ScoreNormalization;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * Runs a set of independently configured detectors over one feature matrix.
 * Only valid rows are scored and, unless disabled, the columns are z-scored
 * first. A detector that throws is excluded and recorded; the others still
 * produce their {@link ModelResult}, with scores normalized to a common scale.
 */
public class AnomalyModelEnsemble {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelEnsemble.class);

    private final List<AnomalyDetector> detectors;
    private final Map<String, Double> weights;
    private final ScoreNormalization normalization;
    private final boolean standardizeFeatures;
    private final int consensusQuorum;
    private final AbstractEnsembleExecutor executor;

    protected AnomalyModelEnsemble(Builder builder) {
        List<AnomalyDetector> list = new ArrayList<>(builder.detectors);
        Map<String, Double> weightMap = new HashMap<>(builder.weights);
        if (builder.detectorConfigs != null) {
            List<AnomalyDetector> created = DetectorFactory.createAll(builder.detectorConfigs);
            for (int i = 0; i < created.size(); i++) {
                list.add(created.get(i));
                weightMap.put(created.get(i).getName(), builder.detectorConfigs.get(i).getWeight());
            }
        }
        checkParameter(!list.isEmpty(), "at least one detector must be configured");
        checkParameter(builder.normalization != null, "normalization cannot be null");
        checkParameter(builder.consensusQuorum >= 1, "consensus_quorum must be at least 1");
        checkParameter(!builder.parallelExecutionEnabled || builder.threadPoolSize >= 0,
                "thread_pool_size cannot be negative");
        detectors = list;
        weights = weightMap;
        normalization = builder.normalization;
        standardizeFeatures = builder.standardizeFeatures;
        consensusQuorum = builder.consensusQuorum;
        if (builder.parallelExecutionEnabled) {
            int poolSize = (builder.threadPoolSize > 0) ? builder.threadPoolSize
                    : Math.max(1, Math.min(list.size(), Runtime.getRuntime().availableProcessors()));
            executor = new ParallelEnsembleExecutor(list, poolSize);
        } else {
            executor = new SequentialEnsembleExecutor(list);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience for a one-off run with default settings.
     */
    public static EnsembleResult detect(FeatureMatrix features, List<DetectorConfig> configs) {
        return builder().detectorConfigs(configs).build().detect(features);
    }

    public EnsembleResult detect(FeatureMatrix features) {
        checkNotNull(features, "features cannot be null");
        FeatureMatrix input = features.validRows();
        if (standardizeFeatures) {
            input = input.standardized();
        }
        long start = System.currentTimeMillis();
        List<DetectorRun> runs = executor.execute(input);
        checkArgument(runs.size() == detectors.size(), "executor lost detector runs");

        List<ModelResult> results = new ArrayList<>();
        List<Exclusion> exclusions = new ArrayList<>();
        for (DetectorRun run : runs) {
            AnomalyDetector detector = run.getDetector();
            if (!run.isSuccessful()) {
                log.warn("detector {} excluded from the ensemble", detector.getName(), run.getFailure());
                exclusions.add(new Exclusion(Exclusion.Stage.DETECTION, detector.getName(), describe(run)));
                continue;
            }
            DetectionOutcome outcome = run.getOutcome();
            if (outcome.size() != input.rows()) {
                log.warn("detector {} returned {} rows for {} samples, excluded", detector.getName(), outcome.size(),
                        input.rows());
                exclusions.add(new Exclusion(Exclusion.Stage.DETECTION, detector.getName(),
                        "returned " + outcome.size() + " rows for " + input.rows() + " samples"));
                continue;
            }
            double[] raw = outcome.getScores();
            results.add(new ModelResult(detector.getName(), detector.getType(), weight(detector), input.getIndices(),
                    outcome.getFlags(), raw, normalization.normalize(raw)));
        }
        if (results.size() < consensusQuorum) {
            log.warn("{} of {} detectors effective, below the consensus quorum of {}", results.size(),
                    detectors.size(), consensusQuorum);
        }
        log.info("ensemble of {} detectors scored {} samples in {} ms", results.size(), input.rows(),
                System.currentTimeMillis() - start);
        return new EnsembleResult(results, exclusions, detectors.size());
    }

    private double weight(AnomalyDetector detector) {
        Double weight = weights.get(detector.getName());
        return (weight == null) ? 1.0 : weight;
    }

    private static String describe(DetectorRun run) {
        RuntimeException failure = run.getFailure();
        if (failure == null) {
            return "no outcome";
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    public ScoreNormalization getNormalization() {
        return normalization;
    }

    public boolean isParallelExecutionEnabled() {
        return executor instanceof ParallelEnsembleExecutor;
    }

    public static class Builder {

        private final List<AnomalyDetector> detectors = new ArrayList<>();
        private final Map<String, Double> weights = new HashMap<>();
        private List<DetectorConfig> detectorConfigs;
        private ScoreNormalization normalization = ScoreNormalization.MIN_MAX;
        private boolean standardizeFeatures = true;
        private boolean parallelExecutionEnabled = false;
        private int threadPoolSize = 0;
        private int consensusQuorum = 1;

        public Builder detector(AnomalyDetector detector) {
            detectors.add(checkNotNull(detector, "detector cannot be null"));
            return this;
        }

        public Builder detector(AnomalyDetector detector, double weight) {
            weights.put(detector.getName(), weight);
            return detector(detector);
        }

        public Builder detectorConfigs(List<DetectorConfig> detectorConfigs) {
            this.detectorConfigs = detectorConfigs;
            return this;
        }

        public Builder normalization(ScoreNormalization normalization) {
            this.normalization = normalization;
            return this;
        }

        public Builder standardizeFeatures(boolean standardizeFeatures) {
            this.standardizeFeatures = standardizeFeatures;
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder consensusQuorum(int consensusQuorum) {
            this.consensusQuorum = consensusQuorum;
            return this;
        }

        public AnomalyModelEnsemble build() {
            return new AnomalyModelEnsemble(this);
        }
    }
}
