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

import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.cleaner.SignalCleaner;
import com.amazon.celldegradation.config.ChannelConfig;
import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.ensemble.AnomalyModelEnsemble;
import com.amazon.celldegradation.ensemble.EnsembleResult;
import com.amazon.celldegradation.ensemble.Exclusion;
import com.amazon.celldegradation.ensemble.ModelResult;
import com.amazon.celldegradation.ensemble.RunManifest;
import com.amazon.celldegradation.ensemble.config.PipelineConfig;
import com.amazon.celldegradation.ensemble.consensus.AgreementMatrix;
import com.amazon.celldegradation.ensemble.consensus.AnomalyTable;
import com.amazon.celldegradation.ensemble.consensus.ConsensusEngine;
import com.amazon.celldegradation.ensemble.consensus.ConsensusRecord;
import com.amazon.celldegradation.exceptions.InsufficientDataException;
import com.amazon.celldegradation.features.FeatureEngineer;
import com.amazon.celldegradation.features.FeatureInput;
import com.amazon.celldegradation.features.FeatureMatrix;
import com.amazon.celldegradation.series.Channel;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.series.Series;
import com.amazon.celldegradation.smoothing.SmootherFactory;
import com.amazon.celldegradation.smoothing.SmoothingEngine;
import com.amazon.celldegradation.smoothing.SmoothingResult;

/**
 * Wires the stages of a run: cleaning and smoothing per channel, feature
 * engineering across channels, the detector ensemble, consensus and
 * agreement.
 *
 * The whole configuration is validated when the pipeline is built, and the
 * configuration of every channel again at the start of a run, so a caller
 * error fails before any data is processed. A channel with too little data is
 * excluded and a failing detector is excluded; neither aborts the run, and
 * both appear in the {@link RunManifest}.
 */
public class DegradationPipeline {

    private static final Logger log = LoggerFactory.getLogger(DegradationPipeline.class);

    private final PipelineConfig config;
    private final SignalCleaner cleaner = new SignalCleaner();
    private final SmoothingEngine smoothingEngine = new SmoothingEngine();
    private final FeatureEngineer featureEngineer;
    private final AnomalyModelEnsemble ensemble;
    private final ConsensusEngine consensusEngine;
    private ForkJoinPool forkJoinPool;

    protected DegradationPipeline(Builder builder) {
        PipelineConfig pipelineConfig = builder.config;
        checkParameter(pipelineConfig != null, "pipeline configuration cannot be null");
        validate(pipelineConfig);
        config = pipelineConfig;
        featureEngineer = new FeatureEngineer(pipelineConfig.getFeatures());
        ensemble = AnomalyModelEnsemble.builder().detectorConfigs(pipelineConfig.getDetectorConfigs())
                .normalization(pipelineConfig.getNormalization())
                .standardizeFeatures(pipelineConfig.isStandardizeFeatures())
                .parallelExecutionEnabled(pipelineConfig.isParallelExecutionEnabled())
                .threadPoolSize(pipelineConfig.getThreadPoolSize())
                .consensusQuorum(pipelineConfig.getConsensusQuorum()).build();
        consensusEngine = new ConsensusEngine(pipelineConfig.getAggregation());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every stated constraint of a configuration.
     *
     * @param config the configuration
     * @throws com.amazon.celldegradation.exceptions.InvalidParameterException on
     *         the first violation
     */
    public static void validate(PipelineConfig config) {
        checkParameter(config.getConsensusQuorum() >= 1, "consensus_quorum must be at least 1");
        checkParameter(config.getTopN() >= 1, "top_n must be at least 1");
        checkParameter(config.getAggregation() != null, "aggregation cannot be null");
        checkParameter(config.getNormalization() != null, "normalization cannot be null");
        checkParameter(config.getThreadPoolSize() >= 0, "thread_pool_size cannot be negative");
        SmootherFactory.create(new SmoothingConfig(config.getSmoothingMethod(), config.getSmoothingParams()));
        checkParameter(config.getChannels() != null, "channels cannot be null");
        Set<String> names = new LinkedHashSet<>();
        for (ChannelConfig channel : config.getChannels()) {
            validate(channel);
            checkParameter(names.add(channel.getName()), "duplicate channel " + channel.getName());
        }
        FeatureEngineer.validate(config.getFeatures());
        checkParameter(config.getDetectorConfigs() != null && !config.getDetectorConfigs().isEmpty(),
                "detector_configs cannot be empty");
    }

    static void validate(ChannelConfig channel) {
        checkParameter(channel != null, "channel configuration cannot be null");
        checkParameter(channel.getName() != null && !channel.getName().isEmpty(), "channel name cannot be empty");
        checkParameter(channel.getDegradationDirection() != null,
                "degradation_direction cannot be null for channel " + channel.getName());
        SignalCleaner.validate(channel.getCleaning());
        SmootherFactory.create(channel.getSmoothing());
    }

    /**
     * Runs over raw series keyed by channel name; each channel takes its
     * configuration from {@link PipelineConfig#channelConfig(String)}.
     */
    public PipelineResult run(Map<String, Series> raw) {
        checkNotNull(raw, "raw channels cannot be null");
        List<Channel> channels = new ArrayList<>();
        for (Map.Entry<String, Series> entry : raw.entrySet()) {
            channels.add(new Channel(entry.getValue(), config.channelConfig(entry.getKey())));
        }
        return run(channels);
    }

    /**
     * Runs over channels that carry their own configuration.
     */
    public PipelineResult run(List<Channel> channels) {
        checkNotNull(channels, "channels cannot be null");
        checkParameter(!channels.isEmpty(), "at least one channel is required");
        Set<String> names = new LinkedHashSet<>();
        for (Channel channel : channels) {
            validate(channel.getConfig());
            checkParameter(names.add(channel.getName()), "duplicate channel " + channel.getName());
        }
        long start = System.currentTimeMillis();
        List<Exclusion> exclusions = new ArrayList<>();

        List<ChannelOutcome> outcomes;
        if (config.isParallelExecutionEnabled()) {
            outcomes = submitAndJoin(
                    () -> channels.parallelStream().map(this::process).collect(Collectors.toList()));
        } else {
            outcomes = channels.stream().map(this::process).collect(Collectors.toList());
        }

        Map<String, CleanedSeries> cleaned = new LinkedHashMap<>();
        Map<String, SmoothingResult> smoothed = new LinkedHashMap<>();
        List<FeatureInput> inputs = new ArrayList<>();
        for (int i = 0; i < channels.size(); i++) {
            ChannelOutcome outcome = outcomes.get(i);
            if (outcome.exclusion != null) {
                log.warn("channel {} excluded: {}", outcome.channel, outcome.exclusion.getReason());
                exclusions.add(outcome.exclusion);
                continue;
            }
            cleaned.put(outcome.channel, outcome.cleaned);
            smoothed.put(outcome.channel, outcome.smoothing);
            inputs.add(new FeatureInput(outcome.cleaned, outcome.smoothing.getSmoothed(),
                    channels.get(i).getConfig().getDegradationDirection()));
        }
        log.debug("cleaning and smoothing of {} channels took {} ms", channels.size(),
                System.currentTimeMillis() - start);

        List<String> configuredDetectors = new ArrayList<>();
        for (AnomalyDetector detector : ensemble.getDetectors()) {
            configuredDetectors.add(detector.getName());
        }
        if (inputs.isEmpty()) {
            log.warn("no channel survived cleaning and smoothing, nothing to rank");
            RunManifest manifest = new RunManifest(new ArrayList<>(names), Collections.<String>emptyList(),
                    configuredDetectors, Collections.<String>emptyList(), exclusions);
            return emptyResult(cleaned, smoothed, manifest);
        }
        String primary = config.getFeatures().getPrimaryChannel();
        if (primary != null && !cleaned.containsKey(primary)) {
            log.warn("primary channel {} unavailable, using {} for the row grid", primary,
                    inputs.get(0).getChannel());
        }

        FeatureMatrix features = featureEngineer.engineer(inputs);
        if (features.validCount() == 0) {
            exclusions.add(new Exclusion(Exclusion.Stage.FEATURES, "features", "no row has a complete feature set"));
        }
        EnsembleResult ensembleResult = ensemble.detect(features);
        exclusions.addAll(ensembleResult.getExclusions());
        List<ModelResult> results = ensembleResult.getResults();

        List<ConsensusRecord> consensus = consensusEngine.consensus(results);
        AnomalyTable table = consensusEngine.table(results, features.validRows().standardized());
        AgreementMatrix agreement = consensusEngine.agreement(results);

        List<String> effectiveDetectors = new ArrayList<>();
        for (ModelResult result : results) {
            effectiveDetectors.add(result.getName());
        }
        RunManifest manifest = new RunManifest(new ArrayList<>(names), new ArrayList<>(cleaned.keySet()),
                configuredDetectors, effectiveDetectors, exclusions);
        log.info("run over {} channels and {} samples: {} flagged, {} high confidence, {} exclusions in {} ms",
                cleaned.size(), features.rows(), table.size(), table.highConfidence(config.getConsensusQuorum()).size(),
                exclusions.size(), System.currentTimeMillis() - start);
        return new PipelineResult(cleaned, smoothed, features, results, consensus, table, config.getTopN(),
                config.getConsensusQuorum(), agreement, manifest);
    }

    private PipelineResult emptyResult(Map<String, CleanedSeries> cleaned, Map<String, SmoothingResult> smoothed,
            RunManifest manifest) {
        FeatureMatrix features = new FeatureMatrix(Collections.<String>emptyList(), new long[0], new double[0][]);
        AnomalyTable table = consensusEngine.table(Collections.<ModelResult>emptyList());
        return new PipelineResult(cleaned, smoothed, features, Collections.<ModelResult>emptyList(),
                Collections.<ConsensusRecord>emptyList(), table, config.getTopN(), config.getConsensusQuorum(),
                consensusEngine.agreement(Collections.<ModelResult>emptyList()), manifest);
    }

    private ChannelOutcome process(Channel channel) {
        CleanedSeries cleanedSeries;
        try {
            cleanedSeries = cleaner.clean(channel);
        } catch (InsufficientDataException e) {
            return new ChannelOutcome(channel.getName(),
                    new Exclusion(Exclusion.Stage.CLEANING, channel.getName(), e.getMessage()));
        }
        try {
            SmoothingResult result = smoothingEngine.smooth(cleanedSeries, channel.getConfig().getSmoothing());
            return new ChannelOutcome(channel.getName(), cleanedSeries, result);
        } catch (InsufficientDataException e) {
            return new ChannelOutcome(channel.getName(),
                    new Exclusion(Exclusion.Stage.SMOOTHING, channel.getName(), e.getMessage()));
        }
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            int size = (config.getThreadPoolSize() > 0) ? config.getThreadPoolSize()
                    : Runtime.getRuntime().availableProcessors();
            forkJoinPool = new ForkJoinPool(size);
        }
        return forkJoinPool.submit(callable).join();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public AnomalyModelEnsemble getEnsemble() {
        return ensemble;
    }

    private static class ChannelOutcome {

        final String channel;
        final CleanedSeries cleaned;
        final SmoothingResult smoothing;
        final Exclusion exclusion;

        ChannelOutcome(String channel, CleanedSeries cleaned, SmoothingResult smoothing) {
            this.channel = channel;
            this.cleaned = cleaned;
            this.smoothing = smoothing;
            this.exclusion = null;
        }

        ChannelOutcome(String channel, Exclusion exclusion) {
            this.channel = channel;
            this.cleaned = null;
            this.smoothing = null;
            this.exclusion = exclusion;
        }
    }

    public static class Builder {

        private PipelineConfig config = new PipelineConfig();

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public DegradationPipeline build() {
            return new DegradationPipeline(this);
        }
    }
}
