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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Ideal low pass in the frequency domain. The straight line through the first
 * and last sample is removed first so that the remainder starts and ends at
 * zero; it is then zero padded to a power of two, transformed, every bin above
 * the cutoff is cleared and the line is added back after the inverse
 * transform.
 */
public class FourierLowPassSmoother implements Smoother {

    private final FrequencyCutoff cutoff;

    public FourierLowPassSmoother(FrequencyCutoff cutoff) {
        this.cutoff = cutoff;
    }

    @Override
    public SmoothingMethod getMethod() {
        return SmoothingMethod.FOURIER;
    }

    @Override
    public int minimumLength() {
        return 2;
    }

    @Override
    public double[] apply(double[] values) {
        int n = values.length;
        if (n < 2) {
            return values.clone();
        }
        double first = values[0];
        double slope = (values[n - 1] - first) / (n - 1);
        double[] trend = new double[n];
        int size = Integer.highestOneBit(n);
        if (size < n) {
            size <<= 1;
        }
        double[] padded = new double[size];
        for (int i = 0; i < n; i++) {
            trend[i] = first + slope * i;
            padded[i] = values[i] - trend[i];
        }

        FastFourierTransformer transformer = new FastFourierTransformer(DftNormalization.STANDARD);
        Complex[] spectrum = transformer.transform(padded, TransformType.FORWARD);
        double resolution = cutoff.getSamplingRate() / size;
        for (int k = 0; k < size; k++) {
            int bin = (k <= size / 2) ? k : size - k;
            if (bin * resolution > cutoff.getCutoffFrequency()) {
                spectrum[k] = Complex.ZERO;
            }
        }
        Complex[] filtered = transformer.transform(spectrum, TransformType.INVERSE);

        double[] answer = new double[n];
        for (int i = 0; i < n; i++) {
            answer[i] = trend[i] + filtered[i].getReal();
        }
        return answer;
    }
}
