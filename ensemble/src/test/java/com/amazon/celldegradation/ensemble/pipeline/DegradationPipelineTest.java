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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.config.SmoothingMethod;
import com.amazon.celldegradation.ensemble.Exclusion;
import com.amazon.celldegradation.ensemble.RunManifest;
import com.amazon.celldegradation.ensemble.config.PipelineConfig;
import com.amazon.celldegradation.ensemble.config.PipelineConfigLoader;
import com.amazon.celldegradation.ensemble.consensus.AnomalyRow;
import com.amazon.celldegradation.ensemble.consensus.AnomalyTable;
import com.amazon.celldegradation.ensemble.consensus.ConsensusRecord;
import com.amazon.celldegradation.exceptions.InvalidParameterException;
import com.amazon.celldegradation.series.Series;
import com.amazon.celldegradation.testutils.BatteryCycleTestData;
import com.amazon.celldegradation.testutils.CycleDataWithKey;

public class DegradationPipelineTest {

    private PipelineConfigLoader loader;
    private PipelineConfig config;

    @BeforeEach
    public void setUp() throws IOException {
        loader = new PipelineConfigLoader();
        config = loader.loadDefault();
    }

    private static Map<String, Series> series(CycleDataWithKey data) {
        Map<String, Series> answer = new LinkedHashMap<>();
        for (int c = 0; c < data.channelNames.length; c++) {
            answer.put(data.channelNames[c], new Series(data.indices, data.channels[c]));
        }
        return answer;
    }

    private static Series shortSeries(int length, double level) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = level + 0.01 * i;
        }
        return Series.of(values);
    }

    @Test
    public void testInjectedDropsRankAtTheTop() {
        CycleDataWithKey data = new BatteryCycleTestData().generateCapacityWithDrops(1000, 5, 42L);
        assertEquals(5, data.injectedIndices.length);

        PipelineResult result = DegradationPipeline.builder().config(config).build().run(series(data));

        RunManifest manifest = result.getManifest();
        assertTrue(manifest.isComplete());
        assertThat(manifest.getEffectiveChannels(), contains("capacity"));
        assertEquals(4, manifest.getEffectiveDetectors().size());
        assertEquals(4, result.getModelResults().size());
        assertEquals(4, result.getAgreement().size());

        AnomalyTable top = result.getTopAnomalies();
        assertTrue(top.size() <= config.getTopN());
        AnomalyTable confident = result.getHighConfidenceAnomalies();
        for (long injected : data.injectedIndices) {
            assertThat(top.indices(), hasItem(injected));
            assertThat(confident.indices(), hasItem(injected));
        }
        for (AnomalyRow row : result.getAnomalyTable().getRows()) {
            assertTrue(row.getCount() >= 1 && row.getCount() <= 4);
            assertEquals(4, row.getModelFlags().size());
        }
        AnomalyRow first = top.get(0);
        assertEquals("capacity.residual", first.getDominantFeature());
        assertTrue(first.getAttribution()[result.getFeatures().columnIndex("capacity.residual")] < 0);
        assertEquals(1, first.getRank());
    }

    @Test
    public void testFlatInputProducesEmptyTable() {
        CycleDataWithKey data = BatteryCycleTestData.generateFlat(300, new double[] { 1.9876543210123 },
                new String[] { BatteryCycleTestData.CAPACITY });
        PipelineResult result = DegradationPipeline.builder().config(config).build().run(series(data));

        assertTrue(result.getAnomalyTable().isEmpty());
        assertTrue(result.getTopAnomalies().isEmpty());
        assertTrue(result.getHighConfidenceAnomalies().isEmpty());
        assertEquals(4, result.getModelResults().size());
        for (ConsensusRecord record : result.getConsensus()) {
            assertEquals(0, record.getCount());
        }
        // every detector flagged nothing, which counts as full agreement
        assertEquals(1.0, result.getAgreement().meanOffDiagonal(), 0.0);
        assertTrue(result.getManifest().isComplete());
    }

    @Test
    public void testRepeatedRunsAreIdentical() {
        CycleDataWithKey data = new BatteryCycleTestData().generateCapacityWithDrops(500, 3, 7L);
        DegradationPipeline pipeline = DegradationPipeline.builder().config(config).build();
        PipelineResult first = pipeline.run(series(data));
        PipelineResult second = DegradationPipeline.builder().config(config).build().run(series(data));
        assertEquals(first.getConsensus(), second.getConsensus());
        assertEquals(first.getAgreement(), second.getAgreement());
        assertEquals(first.getAnomalyTable().indices(), second.getAnomalyTable().indices());
        assertEquals(first.getConsensus(), pipeline.run(series(data)).getConsensus());
    }

    @Test
    public void testShortChannelsAreExcluded() {
        CycleDataWithKey data = new BatteryCycleTestData().generateCapacityWithDrops(400, 2, 3L);
        Map<String, Series> raw = series(data);
        // too few points to clean, and enough to clean but not for an 11 point smoothing window
        raw.put(BatteryCycleTestData.CHARGE_VOLTAGE, shortSeries(5, 4.2));
        raw.put(BatteryCycleTestData.DISCHARGE_TEMP, shortSeries(10, 25.0));

        PipelineResult result = DegradationPipeline.builder().config(config).build().run(raw);
        RunManifest manifest = result.getManifest();
        assertFalse(manifest.isComplete());
        assertThat(manifest.getConfiguredChannels(), contains("capacity", "charge_voltage", "discharge_temp"));
        assertThat(manifest.getEffectiveChannels(), contains("capacity"));
        List<Exclusion> cleaning = manifest.exclusionsAt(Exclusion.Stage.CLEANING);
        assertEquals(1, cleaning.size());
        assertEquals("charge_voltage", cleaning.get(0).getName());
        List<Exclusion> smoothing = manifest.exclusionsAt(Exclusion.Stage.SMOOTHING);
        assertEquals(1, smoothing.size());
        assertEquals("discharge_temp", smoothing.get(0).getName());
        assertEquals(4, result.getModelResults().size());
        assertFalse(result.getAnomalyTable().isEmpty());
    }

    @Test
    public void testNoSurvivingChannel() {
        Map<String, Series> raw = Collections.singletonMap("capacity", shortSeries(4, 2.0));
        PipelineResult result = DegradationPipeline.builder().config(config).build().run(raw);
        assertTrue(result.getAnomalyTable().isEmpty());
        assertTrue(result.getModelResults().isEmpty());
        assertTrue(result.getManifest().getEffectiveChannels().isEmpty());
        assertTrue(result.getManifest().getEffectiveDetectors().isEmpty());
        assertEquals(4, result.getManifest().getConfiguredDetectors().size());
        assertEquals(0, result.getFeatures().rows());
    }

    @Test
    public void testParallelChannelsMatchSequential() throws IOException {
        PipelineConfig twoChannel;
        try (InputStream input = DegradationPipelineTest.class.getResourceAsStream("/two-channel-pipeline.json")) {
            twoChannel = loader.load(input);
        }
        CycleDataWithKey data = new BatteryCycleTestData().generateMultiChannelWithDrops(600, 3, 11L);

        PipelineResult sequential = DegradationPipeline.builder().config(twoChannel).build().run(series(data));
        twoChannel.setParallelExecutionEnabled(true);
        twoChannel.setThreadPoolSize(2);
        PipelineResult parallel = DegradationPipeline.builder().config(twoChannel).build().run(series(data));

        assertEquals(3, sequential.getManifest().getEffectiveChannels().size());
        assertEquals(sequential.getFeatures().getColumnNames(), parallel.getFeatures().getColumnNames());
        assertEquals(sequential.getConsensus(), parallel.getConsensus());
        assertEquals(sequential.getAgreement(), parallel.getAgreement());
        assertTrue(sequential.getTopAnomalies().size() <= 5);
        assertThat(sequential.getAgreement().getModelNames(), contains("forest", "local_outlier_factor"));
    }

    @Test
    public void testInvalidConfigurationFailsWhenBuilt() {
        config.setConsensusQuorum(0);
        assertThrows(InvalidParameterException.class, () -> DegradationPipeline.builder().config(config).build());

        PipelineConfig noDetectors = new PipelineConfig();
        assertThrows(InvalidParameterException.class,
                () -> DegradationPipeline.builder().config(noDetectors).build());

        PipelineConfig evenWindow = new PipelineConfig();
        evenWindow.setDetectorConfigs(new ArrayList<>(Collections.singletonList(
                DetectorConfig.of(DetectorType.ISOLATION_FOREST))));
        evenWindow.setSmoothingMethod(SmoothingMethod.SG);
        evenWindow.getSmoothingParams().put("window_size", 10);
        assertThrows(InvalidParameterException.class,
                () -> DegradationPipeline.builder().config(evenWindow).build());

        PipelineConfig unknownHyperparameter = new PipelineConfig();
        unknownHyperparameter.setDetectorConfigs(Collections.singletonList(
                DetectorConfig.of(DetectorType.LOCAL_OUTLIER_FACTOR, "n_estimators", 10)));
        assertThrows(InvalidParameterException.class,
                () -> DegradationPipeline.builder().config(unknownHyperparameter).build());

        assertThrows(InvalidParameterException.class, () -> DegradationPipeline.builder().config(null).build());
    }
}
