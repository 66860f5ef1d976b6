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

package com.amazon.celldegradation.cleaner;

import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.CleaningPolicy;
import com.amazon.celldegradation.config.InterpolationPolicy;
import com.amazon.celldegradation.exceptions.InsufficientDataException;
import com.amazon.celldegradation.series.Channel;
import com.amazon.celldegradation.series.CleanedSeries;
import com.amazon.celldegradation.series.CleaningReport;
import com.amazon.celldegradation.series.CleaningReport.Reason;
import com.amazon.celldegradation.series.Series;

/**
 * Turns a raw series into one with strictly increasing indices and finite,
 * physically plausible values. Duplicates are removed (first occurrence wins),
 * invalid values and inserted grid gaps are repaired by the interpolation
 * policy, and every change is written to the {@link CleaningReport}.
 */
public class SignalCleaner {

    private static final Logger log = LoggerFactory.getLogger(SignalCleaner.class);

    /**
     * upper bound on the number of indices that gap filling may create
     */
    public static final long MAX_GRID_SIZE = 10_000_000L;

    /**
     * Validates a cleaning policy. Called during configuration validation, before
     * any channel is touched, and fails with an InvalidParameterException.
     *
     * @param policy the policy
     */
    public static void validate(CleaningPolicy policy) {
        checkNotNull(policy, "cleaning policy cannot be null");
        checkParameter(policy.getInterpolation() != null, "interpolation policy cannot be null");
        checkParameter(!Double.isNaN(policy.getPhysicalMin()) && !Double.isNaN(policy.getPhysicalMax()),
                "physical range cannot be NaN");
        checkParameter(policy.getPhysicalMin() <= policy.getPhysicalMax(),
                "physical_min must not exceed physical_max");
        checkParameter(policy.getMinValidPoints() >= 1, "min_valid_points must be at least 1");
        checkParameter(policy.getGapStep() >= 0, "gap_step cannot be negative");
    }

    public CleanedSeries clean(Channel channel) {
        return clean(channel.getName(), channel.getSeries(), channel.getConfig().getCleaning());
    }

    public CleanedSeries clean(String name, Series raw, CleaningPolicy policy) {
        validate(policy);
        CleaningReport report = new CleaningReport();

        // stable sort keeps the first occurrence of a repeated index in front
        Integer[] order = new Integer[raw.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingLong(raw::getIndex));

        List<Long> indices = new ArrayList<>(raw.size());
        List<Double> values = new ArrayList<>(raw.size());
        List<Boolean> valid = new ArrayList<>(raw.size());
        for (int position : order) {
            long index = raw.getIndex(position);
            double value = raw.getValue(position);
            if (!indices.isEmpty() && indices.get(indices.size() - 1) == index) {
                report.add(index, value, Reason.DUPLICATE);
                continue;
            }
            indices.add(index);
            values.add(value);
            if (!Double.isFinite(value)) {
                report.add(index, value, Reason.NON_FINITE_VALUE);
                valid.add(false);
            } else if (value < policy.getPhysicalMin() || value > policy.getPhysicalMax()) {
                report.add(index, value, Reason.OUT_OF_RANGE);
                valid.add(false);
            } else {
                valid.add(true);
            }
        }

        if (policy.getGapStep() > 0 && policy.getInterpolation() != InterpolationPolicy.DROP
                && indices.size() > 1) {
            fillGaps(policy.getGapStep(), indices, values, valid, report);
        }

        int validCount = 0;
        for (boolean flag : valid) {
            if (flag) {
                ++validCount;
            }
        }
        if (validCount < policy.getMinValidPoints()) {
            throw new InsufficientDataException(name, validCount, policy.getMinValidPoints());
        }

        Series cleaned = repair(indices, values, valid, policy.getInterpolation(), report);
        if (!report.isEmpty()) {
            log.warn("channel {}: cleaner changed {} samples {}", name, report.getEntries().size(), report);
            if (log.isDebugEnabled()) {
                report.getEntries().forEach(e -> log.debug("channel {}: {}", name, e));
            }
        }
        return new CleanedSeries(name, cleaned, report);
    }

    void fillGaps(long step, List<Long> indices, List<Double> values, List<Boolean> valid, CleaningReport report) {
        long first = indices.get(0);
        long last = indices.get(indices.size() - 1);
        long span = last - first;
        // a negative span means the index range overflowed
        checkParameter(span >= 0 && span / step <= MAX_GRID_SIZE, "gap_step is too small for the index range");
        long gridPoints = span / step;

        List<Long> newIndices = new ArrayList<>();
        List<Double> newValues = new ArrayList<>();
        List<Boolean> newValid = new ArrayList<>();
        int position = 0;
        for (long k = 0; k <= gridPoints; k++) {
            long gridIndex = first + k * step;
            while (position < indices.size() && indices.get(position) < gridIndex) {
                newIndices.add(indices.get(position));
                newValues.add(values.get(position));
                newValid.add(valid.get(position));
                ++position;
            }
            if (position < indices.size() && indices.get(position) == gridIndex) {
                continue;
            }
            newIndices.add(gridIndex);
            newValues.add(Double.NaN);
            newValid.add(false);
            report.add(gridIndex, Double.NaN, Reason.GAP_FILLED);
        }
        while (position < indices.size()) {
            newIndices.add(indices.get(position));
            newValues.add(values.get(position));
            newValid.add(valid.get(position));
            ++position;
        }
        indices.clear();
        indices.addAll(newIndices);
        values.clear();
        values.addAll(newValues);
        valid.clear();
        valid.addAll(newValid);
    }

    Series repair(List<Long> indices, List<Double> values, List<Boolean> valid, InterpolationPolicy policy,
            CleaningReport report) {
        int n = indices.size();
        if (policy == InterpolationPolicy.DROP) {
            long[] keptIndices = new long[n];
            double[] keptValues = new double[n];
            int count = 0;
            for (int i = 0; i < n; i++) {
                if (valid.get(i)) {
                    keptIndices[count] = indices.get(i);
                    keptValues[count++] = values.get(i);
                } else {
                    report.add(indices.get(i), values.get(i), Reason.DROPPED);
                }
            }
            return new Series(Arrays.copyOf(keptIndices, count), Arrays.copyOf(keptValues, count));
        }

        int[] previousValid = new int[n];
        int[] nextValid = new int[n];
        int last = -1;
        for (int i = 0; i < n; i++) {
            if (valid.get(i)) {
                last = i;
            }
            previousValid[i] = last;
        }
        last = -1;
        for (int i = n - 1; i >= 0; i--) {
            if (valid.get(i)) {
                last = i;
            }
            nextValid[i] = last;
        }

        long[] outIndices = new long[n];
        double[] outValues = new double[n];
        for (int i = 0; i < n; i++) {
            outIndices[i] = indices.get(i);
            if (valid.get(i)) {
                outValues[i] = values.get(i);
                continue;
            }
            int before = previousValid[i];
            int after = nextValid[i];
            if (before < 0) {
                outValues[i] = values.get(after);
            } else if (after < 0) {
                outValues[i] = values.get(before);
            } else if (policy == InterpolationPolicy.NEAREST) {
                long toBefore = indices.get(i) - indices.get(before);
                long toAfter = indices.get(after) - indices.get(i);
                outValues[i] = (toAfter < toBefore) ? values.get(after) : values.get(before);
            } else {
                double fraction = (double) (indices.get(i) - indices.get(before))
                        / (indices.get(after) - indices.get(before));
                outValues[i] = values.get(before) + fraction * (values.get(after) - values.get(before));
            }
        }
        return new Series(outIndices, outValues);
    }
}
