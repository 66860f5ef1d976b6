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

package com.amazon.celldegradation.smoothing;

import static com.amazon.celldegradation.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.SmoothingConfig;
import com.amazon.celldegradation.exceptions.InsufficientDataException;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.series.Series;

/**
 * Applies a configured smoother to one channel and measures the result. The
 * engine keeps no state, each channel is smoothed on its own with its own
 * configuration, so channels can be processed in parallel.
 */
public class SmoothingEngine {

    private static final Logger log = LoggerFactory.getLogger(SmoothingEngine.class);

    public SmoothingResult smooth(CleanedSeries cleaned, SmoothingConfig config) {
        return smooth(cleaned.getChannel(), cleaned.getSeries(), SmootherFactory.create(config));
    }

    public SmoothingResult smooth(String channel, Series series, Smoother smoother) {
        checkNotNull(smoother, "smoother cannot be null");
        if (series.size() < smoother.minimumLength()) {
            throw new InsufficientDataException(channel, series.size(), smoother.minimumLength());
        }
        double[] input = series.getValues();
        double[] output = smoother.apply(input);
        Diagnostics diagnostics = Diagnostics.of(input, output);
        log.debug("channel {} smoothed with {}: {}", channel, smoother.getMethod(), diagnostics);
        return new SmoothingResult(channel, smoother.getMethod(), series.withValues(output), diagnostics);
    }

    /**
     * Smooths the same channel with several configurations, for judging which
     * one separates trend from noise best. Configurations that cannot be applied
     * to a series this short are skipped.
     *
     * @param cleaned the channel
     * @param configs candidate configurations, validated eagerly
     * @return one result per applicable configuration, in the given order
     */
    public List<SmoothingResult> compare(CleanedSeries cleaned, List<SmoothingConfig> configs) {
        List<Smoother> smoothers = new ArrayList<>();
        for (SmoothingConfig config : configs) {
            smoothers.add(SmootherFactory.create(config));
        }
        List<SmoothingResult> answer = new ArrayList<>();
        for (Smoother smoother : smoothers) {
            try {
                answer.add(smooth(cleaned.getChannel(), cleaned.getSeries(), smoother));
            } catch (InsufficientDataException e) {
                log.info("skipping {} for channel {}: {}", smoother.getMethod(), cleaned.getChannel(), e.getMessage());
            }
        }
        return answer;
    }
}
