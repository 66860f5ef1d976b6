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

package com.amazon.celldegradation.ensemble.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.amazon.celldegradation.config.ChannelConfig;
import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.FeatureConfig;
import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Run wide configuration, passed explicitly through every stage. The top level
 * smoothing method and parameters apply to every channel without an entry in
 * {@code channels}.
 */
@Data
public class PipelineConfig {

    public static final int DEFAULT_CONSENSUS_QUORUM = 3;

    public static final int DEFAULT_TOP_N = 10;

    private SmoothingMethod smoothingMethod = SmoothingMethod.MA;

    private Map<String, Object> smoothingParams = new HashMap<>();

    private List<ChannelConfig> channels = new ArrayList<>();

    private FeatureConfig features = new FeatureConfig();

    private List<DetectorConfig> detectorConfigs = new ArrayList<>();

    private int consensusQuorum = DEFAULT_CONSENSUS_QUORUM;

    private int topN = DEFAULT_TOP_N;

    private AggregationMethod aggregation = AggregationMethod.MEAN_OF_FLAGGING;

    private ScoreNormalization normalization = ScoreNormalization.MIN_MAX;

    /**
     * z-score the feature columns before detection
     */
    private boolean standardizeFeatures = true;

    private boolean parallelExecutionEnabled = false;

    private int threadPoolSize = 0;

    /**
     * The configuration of the named channel: its entry in {@code channels}, or
     * a default channel using the top level smoothing choice.
     */
    public ChannelConfig channelConfig(String name) {
        if (channels != null) {
            for (ChannelConfig channel : channels) {
                if (name.equals(channel.getName())) {
                    return channel;
                }
            }
        }
        ChannelConfig answer = new ChannelConfig(name);
        answer.setSmoothing(new SmoothingConfig(smoothingMethod, smoothingParams));
        return answer;
    }
}
