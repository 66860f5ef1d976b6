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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.celldegradation.config.ChannelConfig;
import com.amazon.celldegradation.config.DegradationDirection;
import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.exceptions.InvalidParameterException;

public class PipelineConfigLoaderTest {

    private PipelineConfigLoader loader;

    @BeforeEach
    public void setUp() {
        loader = new PipelineConfigLoader();
    }

    @Test
    public void testDefaultResource() throws IOException {
        PipelineConfig config = loader.loadDefault();
        assertEquals(SmoothingMethod.SG, config.getSmoothingMethod());
        assertEquals(11, config.getSmoothingParams().get("window_size"));
        assertEquals(4, config.getDetectorConfigs().size());
        assertEquals(DetectorType.LOCAL_OUTLIER_FACTOR, config.getDetectorConfigs().get(1).getType());
        assertEquals(PipelineConfig.DEFAULT_CONSENSUS_QUORUM, config.getConsensusQuorum());
        assertEquals(PipelineConfig.DEFAULT_TOP_N, config.getTopN());
        for (DetectorConfig detector : config.getDetectorConfigs()) {
            assertEquals(0.01, detector.parameters().getDouble("contamination", 0), 0.0);
        }

        ChannelConfig capacity = config.channelConfig("capacity");
        assertEquals(SmoothingMethod.MEDIAN_FILTER, capacity.getSmoothing().getSmoothingMethod());
        assertEquals(0.0, capacity.getCleaning().getPhysicalMin(), 0.0);
        assertEquals("Ah", capacity.getUnit());
    }

    @Test
    public void testAliasesAndChannelFallback() throws IOException {
        PipelineConfig config;
        try (InputStream input = PipelineConfigLoaderTest.class.getResourceAsStream("/two-channel-pipeline.json")) {
            config = loader.load(input);
        }
        assertEquals(SmoothingMethod.SG, config.getSmoothingMethod());
        assertEquals(DetectorType.ISOLATION_FOREST, config.getDetectorConfigs().get(0).getType());
        assertEquals("forest", config.getDetectorConfigs().get(0).getName());
        assertEquals(2.0, config.getDetectorConfigs().get(0).getWeight(), 0.0);
        assertNull(config.getDetectorConfigs().get(1).getName());
        assertEquals(AggregationMethod.WEIGHTED_MEAN, config.getAggregation());
        assertEquals(ScoreNormalization.RANK, config.getNormalization());
        assertEquals(5, config.getFeatures().getTrendHorizon());

        assertEquals(SmoothingMethod.MEDIAN_FILTER, config.channelConfig("capacity").getSmoothing()
                .getSmoothingMethod());
        ChannelConfig temperature = config.channelConfig("discharge_temp");
        assertEquals(DegradationDirection.INCREASING, temperature.getDegradationDirection());
        assertEquals(SmoothingMethod.MA, temperature.getSmoothing().getSmoothingMethod());

        // channels without an entry take the top level smoothing
        ChannelConfig voltage = config.channelConfig("charge_voltage");
        assertEquals(SmoothingMethod.SG, voltage.getSmoothing().getSmoothingMethod());
        assertEquals(7, voltage.getSmoothing().getSmoothingParams().get("window_size"));
    }

    @Test
    public void testWrittenConfigurationReadsBack() throws IOException {
        PipelineConfig config = loader.loadDefault();
        String json = loader.toJson(config);
        assertThat(json, containsString("\"consensus_quorum\""));
        assertEquals(config, loader.fromJson(json));
    }

    @Test
    public void testInvalidDocuments() {
        InvalidParameterException unknownKey = assertThrows(InvalidParameterException.class,
                () -> loader.fromJson("{\"consensus_quorum\": 2, \"quorum\": 3}"));
        assertThat(unknownKey.getMessage(), containsString("quorum"));
        assertThrows(InvalidParameterException.class, () -> loader.fromJson("{\"smoothing_method\": \"spline\"}"));
        assertThrows(InvalidParameterException.class,
                () -> loader.fromJson("{\"detector_configs\": [{\"type\": \"autoencoder\"}]}"));
        assertThrows(InvalidParameterException.class, () -> loader.fromJson("{\"top_n\": null}"));
        assertThrows(InvalidParameterException.class, () -> loader.fromJson("{\"top_n\": "));
    }

    @Test
    public void testPartialDocumentKeepsDefaults() {
        PipelineConfig config = loader.fromJson("{\"top_n\": 3, \"smoothing_method\": \"ewma\"}");
        assertEquals(3, config.getTopN());
        assertEquals(SmoothingMethod.EMA, config.getSmoothingMethod());
        assertEquals(PipelineConfig.DEFAULT_CONSENSUS_QUORUM, config.getConsensusQuorum());
        assertTrue(config.isStandardizeFeatures());
        assertTrue(config.getDetectorConfigs().isEmpty());
    }
}
