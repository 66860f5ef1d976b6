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

package com.amazon.celldegradation.features;

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.FeatureConfig;
import com.amazon.celldegradation.series.Series;

/**
 * Derives degradation features from cleaned and smoothed channels.
 *
 * Rows follow the cleaned indices of the primary channel; the other channels
 * are linearly interpolated onto those indices. For every channel c the
 * columns are
 * <ul>
 * <li>c.delta: first difference of the smoothed series</li>
 * <li>c.slope: least squares slope of the smoothed series over the last
 * trendHorizon rows</li>
 * <li>c.residual: cleaned minus smoothed</li>
 * <li>c.degradation_index: running sum of the smoothed deltas in the channel's
 * degradation direction, non decreasing by construction</li>
 * </ul>
 * followed by one column per configured ratio of smoothed values. A row with
 * any value that cannot be computed is marked invalid, never filled with a
 * default.
 */
public class FeatureEngineer {

    private static final Logger log = LoggerFactory.getLogger(FeatureEngineer.class);

    public static final String DELTA = "delta";
    public static final String SLOPE = "slope";
    public static final String RESIDUAL = "residual";
    public static final String DEGRADATION_INDEX = "degradation_index";

    private final FeatureConfig config;

    public FeatureEngineer(FeatureConfig config) {
        validate(config);
        this.config = config;
    }

    public static void validate(FeatureConfig config) {
        checkParameter(config != null, "feature configuration cannot be null");
        checkParameter(config.getTrendHorizon() >= 2, "trend_horizon must be at least 2");
        checkParameter(config.getRatios() != null, "ratios cannot be null");
        for (String ratio : config.getRatios()) {
            String[] parts = (ratio == null) ? new String[0] : ratio.split("/");
            checkParameter(parts.length == 2 && !parts[0].trim().isEmpty() && !parts[1].trim().isEmpty(),
                    "ratio must be written numerator/denominator: " + ratio);
        }
    }

    public static String columnName(String channel, String feature) {
        return channel + "." + feature;
    }

    /**
     * single channel convenience
     */
    public FeatureMatrix engineer(FeatureInput input) {
        List<FeatureInput> inputs = new ArrayList<>();
        inputs.add(input);
        return engineer(inputs);
    }

    public FeatureMatrix engineer(List<FeatureInput> inputs) {
        checkNotNull(inputs, "inputs cannot be null");
        checkArgument(!inputs.isEmpty(), "at least one channel is required");
        Map<String, FeatureInput> byName = new LinkedHashMap<>();
        for (FeatureInput input : inputs) {
            checkArgument(byName.put(input.getChannel(), input) == null, "duplicate channel " + input.getChannel());
        }
        FeatureInput primary = inputs.get(0);
        if (config.getPrimaryChannel() != null && byName.containsKey(config.getPrimaryChannel())) {
            primary = byName.get(config.getPrimaryChannel());
        }
        long[] grid = primary.getCleaned().getIndices();
        int n = grid.length;

        List<String> names = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        Map<String, double[]> smoothedOnGrid = new LinkedHashMap<>();
        for (FeatureInput input : byName.values()) {
            double[] cleaned = onGrid(input.getCleaned(), grid, input == primary);
            double[] smoothed = onGrid(input.getSmoothed(), grid, input == primary);
            smoothedOnGrid.put(input.getChannel(), smoothed);

            double[] delta = delta(smoothed);
            names.add(columnName(input.getChannel(), DELTA));
            columns.add(delta);
            names.add(columnName(input.getChannel(), SLOPE));
            columns.add(slope(grid, smoothed, config.getTrendHorizon()));
            names.add(columnName(input.getChannel(), RESIDUAL));
            columns.add(residual(cleaned, smoothed));
            names.add(columnName(input.getChannel(), DEGRADATION_INDEX));
            double[] index = new double[n];
            double accumulated = 0;
            for (int i = 0; i < n; i++) {
                if (Double.isFinite(delta[i])) {
                    accumulated += input.getDirection().degradation(delta[i]);
                    index[i] = accumulated;
                } else {
                    index[i] = Double.NaN;
                }
            }
            columns.add(index);
        }

        for (String ratio : config.getRatios()) {
            String[] parts = ratio.split("/");
            double[] numerator = smoothedOnGrid.get(parts[0].trim());
            double[] denominator = smoothedOnGrid.get(parts[1].trim());
            if (numerator == null || denominator == null) {
                log.warn("ratio {} skipped, channel not available", ratio);
                continue;
            }
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = (denominator[i] == 0) ? Double.NaN : numerator[i] / denominator[i];
            }
            names.add(parts[0].trim() + "/" + parts[1].trim());
            columns.add(column);
        }

        double[][] values = new double[n][names.size()];
        boolean[] valid = new boolean[n];
        int validCount = 0;
        for (int i = 0; i < n; i++) {
            boolean ok = true;
            for (int j = 0; j < names.size(); j++) {
                values[i][j] = columns.get(j)[i];
                ok &= Double.isFinite(values[i][j]);
            }
            valid[i] = ok;
            if (ok) {
                ++validCount;
            }
        }
        log.debug("engineered {} features over {} rows, {} valid", names.size(), n, validCount);
        return new FeatureMatrix(names, grid, values, valid);
    }

    static double[] onGrid(Series series, long[] grid, boolean aligned) {
        if (aligned) {
            return series.getValues();
        }
        double[] answer = new double[grid.length];
        for (int i = 0; i < grid.length; i++) {
            answer[i] = series.interpolate(grid[i]);
        }
        return answer;
    }

    static double[] delta(double[] smoothed) {
        double[] answer = new double[smoothed.length];
        if (smoothed.length > 0) {
            answer[0] = Double.NaN;
        }
        for (int i = 1; i < smoothed.length; i++) {
            answer[i] = smoothed[i] - smoothed[i - 1];
        }
        return answer;
    }

    static double[] residual(double[] cleaned, double[] smoothed) {
        double[] answer = new double[cleaned.length];
        for (int i = 0; i < cleaned.length; i++) {
            answer[i] = cleaned[i] - smoothed[i];
        }
        return answer;
    }

    /**
     * Least squares slope over a trailing window. Both coordinates are taken
     * relative to the last sample of the window, so a flat window has a slope of
     * exactly zero.
     */
    static double[] slope(long[] grid, double[] smoothed, int horizon) {
        double[] answer = new double[smoothed.length];
        Arrays.fill(answer, Double.NaN);
        for (int i = horizon - 1; i < smoothed.length; i++) {
            double sumX = 0;
            double sumY = 0;
            boolean finite = true;
            for (int j = i - horizon + 1; j <= i; j++) {
                sumX += grid[j] - grid[i];
                sumY += smoothed[j] - smoothed[i];
                finite &= Double.isFinite(smoothed[j]);
            }
            if (!finite) {
                continue;
            }
            double meanX = sumX / horizon;
            double meanY = sumY / horizon;
            double covariance = 0;
            double variance = 0;
            for (int j = i - horizon + 1; j <= i; j++) {
                double x = (grid[j] - grid[i]) - meanX;
                covariance += x * ((smoothed[j] - smoothed[i]) - meanY);
                variance += x * x;
            }
            answer[i] = (variance > 0) ? covariance / variance : Double.NaN;
        }
        return answer;
    }
}
