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

import static com.amazon.celldegradation.CommonUtils.checkParameter;

/**
 * A low pass cutoff expressed in the units of the sampling rate. The cutoff
 * must lie strictly between 0 and the Nyquist frequency.
 */
public class FrequencyCutoff {

    private final double cutoffFrequency;
    private final double samplingRate;

    public FrequencyCutoff(double cutoffFrequency, double samplingRate) {
        checkParameter(samplingRate > 0 && Double.isFinite(samplingRate), "sampling_rate must be positive");
        checkParameter(cutoffFrequency > 0, "cutoff_frequency must be positive");
        checkParameter(cutoffFrequency < samplingRate / 2, "cutoff_frequency must be below the Nyquist frequency "
                + samplingRate / 2);
        this.cutoffFrequency = cutoffFrequency;
        this.samplingRate = samplingRate;
    }

    public double getCutoffFrequency() {
        return cutoffFrequency;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public double getNyquist() {
        return samplingRate / 2;
    }
}
