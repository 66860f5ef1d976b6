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

import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.amazon.celldegradation.config.DetectorConfig;
import com.amazon.celldegradation.config.Parameters;

/**
 * Builds an {@link AnomalyDetector} from a {@link DetectorConfig}. Unknown
 * hyperparameters and out of range values are rejected here, before any data
 * is seen.
 */
public class DetectorFactory {

    public static final String CONTAMINATION = "contamination";
    public static final String RANDOM_SEED = "random_seed";
    public static final String NUMBER_OF_TREES = "number_of_trees";
    public static final String SAMPLE_SIZE = "sample_size";
    public static final String N_NEIGHBORS = "n_neighbors";
    public static final String NU = "nu";
    public static final String KERNEL = "kernel";
    public static final String GAMMA = "gamma";
    public static final String COEF0 = "coef0";
    public static final String DEGREE = "degree";
    public static final String TOLERANCE = "tolerance";
    public static final String MAX_ITERATIONS = "max_iterations";
    public static final String SUPPORT_FRACTION = "support_fraction";
    public static final String NUMBER_OF_STARTS = "number_of_starts";
    public static final String RIDGE = "ridge";

    private static final List<String> ISOLATION_FOREST_KEYS = Arrays.asList(CONTAMINATION, RANDOM_SEED,
            NUMBER_OF_TREES, SAMPLE_SIZE);
    private static final List<String> LOF_KEYS = Arrays.asList(CONTAMINATION, N_NEIGHBORS);
    private static final List<String> SVM_KEYS = Arrays.asList(CONTAMINATION, NU, KERNEL, GAMMA, COEF0, DEGREE,
            TOLERANCE, MAX_ITERATIONS);
    private static final List<String> ENVELOPE_KEYS = Arrays.asList(CONTAMINATION, RANDOM_SEED, SUPPORT_FRACTION,
            NUMBER_OF_STARTS, MAX_ITERATIONS, RIDGE);

    private DetectorFactory() {
    }

    public static AnomalyDetector create(DetectorConfig config) {
        checkParameter(config != null, "detector configuration cannot be null");
        checkParameter(config.getType() != null, "detector type cannot be null");
        checkParameter(config.getWeight() >= 0 && Double.isFinite(config.getWeight()),
                "detector weight must be finite and non-negative");
        Parameters params = config.parameters();
        String name = config.effectiveName();
        double contamination = params.getDouble(CONTAMINATION, AbstractAnomalyDetector.DEFAULT_CONTAMINATION);
        switch (config.getType()) {
        case ISOLATION_FOREST:
            params.checkKnown(ISOLATION_FOREST_KEYS, name);
            return IsolationForestDetector.builder().name(name).contamination(contamination)
                    .numberOfTrees(params.getInt(NUMBER_OF_TREES, IsolationForestDetector.DEFAULT_NUMBER_OF_TREES))
                    .sampleSize(params.getInt(SAMPLE_SIZE, IsolationForestDetector.DEFAULT_SAMPLE_SIZE))
                    .randomSeed(params.getLong(RANDOM_SEED, IsolationForestDetector.DEFAULT_RANDOM_SEED)).build();
        case LOCAL_OUTLIER_FACTOR:
            params.checkKnown(LOF_KEYS, name);
            return LocalOutlierFactorDetector.builder().name(name).contamination(contamination)
                    .numberOfNeighbors(
                            params.getInt(N_NEIGHBORS, LocalOutlierFactorDetector.DEFAULT_NUMBER_OF_NEIGHBORS))
                    .build();
        case ONE_CLASS_SVM:
            params.checkKnown(SVM_KEYS, name);
            return OneClassSvmDetector.builder().name(name).contamination(contamination)
                    .nu(params.getDouble(NU, OneClassSvmDetector.DEFAULT_NU))
                    .kernel(SvmKernel.fromString(params.getString(KERNEL, SvmKernel.RBF.name())))
                    .gamma(gamma(params)).coef0(params.getDouble(COEF0, 0)).degree(params.getInt(DEGREE, 3))
                    .tolerance(params.getDouble(TOLERANCE, OneClassSvmDetector.DEFAULT_TOLERANCE))
                    .maxIterations(params.getInt(MAX_ITERATIONS, OneClassSvmDetector.DEFAULT_MAX_ITERATIONS))
                    .build();
        case ELLIPTIC_ENVELOPE:
            params.checkKnown(ENVELOPE_KEYS, name);
            return EllipticEnvelopeDetector.builder().name(name).contamination(contamination)
                    .supportFraction(params.getDouble(SUPPORT_FRACTION, Double.NaN))
                    .numberOfStarts(params.getInt(NUMBER_OF_STARTS, EllipticEnvelopeDetector.DEFAULT_NUMBER_OF_STARTS))
                    .maxIterations(params.getInt(MAX_ITERATIONS, EllipticEnvelopeDetector.DEFAULT_MAX_ITERATIONS))
                    .ridge(params.getDouble(RIDGE, EllipticEnvelopeDetector.DEFAULT_RIDGE))
                    .randomSeed(params.getLong(RANDOM_SEED, EllipticEnvelopeDetector.DEFAULT_RANDOM_SEED)).build();
        default:
            throw new IllegalStateException("unknown detector type " + config.getType());
        }
    }

    /**
     * builds every detector, failing on the first invalid configuration, and
     * rejects duplicate names
     */
    public static List<AnomalyDetector> createAll(List<DetectorConfig> configs) {
        checkParameter(configs != null && !configs.isEmpty(), "at least one detector must be configured");
        Set<String> names = new HashSet<>();
        AnomalyDetector[] detectors = new AnomalyDetector[configs.size()];
        for (int i = 0; i < detectors.length; i++) {
            detectors[i] = create(configs.get(i));
            checkParameter(names.add(detectors[i].getName()), "duplicate detector name " + detectors[i].getName());
        }
        return Collections.unmodifiableList(Arrays.asList(detectors));
    }

    static double gamma(Parameters params) {
        String value = params.getString(GAMMA, null);
        if (value == null || "auto".equalsIgnoreCase(value) || "scale".equalsIgnoreCase(value)) {
            return Double.NaN;
        }
        return params.getDouble(GAMMA, Double.NaN);
    }
}
