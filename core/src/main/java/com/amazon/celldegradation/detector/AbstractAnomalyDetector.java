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

package com.amazon.celldegradation.detector;

import static com.amazon.celldegradation.CommonUtils.checkArgument;
import static com.amazon.celldegradation.CommonUtils.checkNotNull;
import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.celldegradation.config.DetectorType;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * Common part of the detector family: naming, the contamination rule that
 * turns scores into flags, and input checks. Subclasses only compute scores.
 */
public abstract class AbstractAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AbstractAnomalyDetector.class);

    public static final double DEFAULT_CONTAMINATION = 0.01;

    protected final String name;
    protected final DetectorType type;
    protected final double contamination;

    protected AbstractAnomalyDetector(DetectorType type, Builder<?> builder) {
        checkParameter(builder.contamination > 0 && builder.contamination <= 0.5,
                "contamination must be in (0, 0.5]");
        this.type = checkNotNull(type, "detector type cannot be null");
        this.name = (builder.name == null || builder.name.isEmpty()) ? type.name().toLowerCase(Locale.ROOT)
                : builder.name;
        this.contamination = builder.contamination;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return type;
    }

    @Override
    public double getContamination() {
        return contamination;
    }

    @Override
    public DetectionOutcome fitPredict(FeatureMatrix features) {
        checkNotNull(features, "features cannot be null");
        double[][] points = features.toArray();
        for (double[] point : points) {
            for (double value : point) {
                checkArgument(Double.isFinite(value), "detectors require finite feature values");
            }
        }
        if (points.length == 0) {
            return DetectionOutcome.fromScores(new double[0], contamination);
        }
        long start = System.currentTimeMillis();
        double[] scores = score(points);
        DetectionOutcome outcome = DetectionOutcome.fromScores(scores, contamination);
        log.debug("{} scored {} rows in {} ms, {} flagged", name, points.length, System.currentTimeMillis() - start,
                outcome.flaggedCount());
        return outcome;
    }

    /**
     * Fit on the points and score each of them.
     *
     * @param points the rows, never empty
     * @return anomaly scores, larger is more anomalous
     */
    protected abstract double[] score(double[][] points);

    public static class Builder<T extends Builder<T>> {

        protected String name;
        protected double contamination = DEFAULT_CONTAMINATION;

        public T name(String name) {
            this.name = name;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }
    }
}
