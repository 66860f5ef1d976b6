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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.complex.Complex;

import com.amazon.celldegradation.config.SmoothingMethod;

/**
 * Butterworth and Chebyshev (type I) low pass filters of a given order. The
 * analog prototype poles are scaled to the prewarped cutoff, mapped to the z
 * plane by the bilinear transform and grouped into second order sections.
 *
 * The cascade runs forward and then backward over the series so the output has
 * no phase lag. Each pass filters the deviation from its first sample, which
 * keeps the start-up transient out of the output and maps a constant input to
 * itself exactly.
 */
public class IirLowPassSmoother implements Smoother {

    public static final int MAX_ORDER = 8;

    private final SmoothingMethod method;
    private final FrequencyCutoff cutoff;
    private final int order;
    private final double rippleDb;
    private final List<BiquadSection> sections;

    public static IirLowPassSmoother butterworth(FrequencyCutoff cutoff, int order) {
        return new IirLowPassSmoother(SmoothingMethod.BUTTERWORTH, cutoff, order, 0);
    }

    public static IirLowPassSmoother chebyshev(FrequencyCutoff cutoff, int order, double rippleDb) {
        checkParameter(rippleDb > 0, "ripple_db must be positive");
        return new IirLowPassSmoother(SmoothingMethod.CHEBYSHEV, cutoff, order, rippleDb);
    }

    IirLowPassSmoother(SmoothingMethod method, FrequencyCutoff cutoff, int order, double rippleDb) {
        checkParameter(order >= 1 && order <= MAX_ORDER, "order must be between 1 and " + MAX_ORDER);
        this.method = method;
        this.cutoff = cutoff;
        this.order = order;
        this.rippleDb = rippleDb;
        this.sections = Collections.unmodifiableList(design());
    }

    @Override
    public SmoothingMethod getMethod() {
        return method;
    }

    public List<BiquadSection> getSections() {
        return sections;
    }

    List<BiquadSection> design() {
        double fs = cutoff.getSamplingRate();
        double warped = 2 * fs * Math.tan(Math.PI * cutoff.getCutoffFrequency() / fs);
        double realScale = 1;
        double imaginaryScale = 1;
        if (method == SmoothingMethod.CHEBYSHEV) {
            double epsilon = Math.sqrt(Math.pow(10, rippleDb / 10) - 1);
            double mu = asinh(1 / epsilon) / order;
            realScale = Math.sinh(mu);
            imaginaryScale = Math.cosh(mu);
        }

        List<BiquadSection> answer = new ArrayList<>();
        for (int k = 1; k <= order / 2; k++) {
            double theta = Math.PI * (2 * k - 1) / (2.0 * order);
            Complex analog = new Complex(-realScale * Math.sin(theta), imaginaryScale * Math.cos(theta))
                    .multiply(warped);
            answer.add(BiquadSection.fromPolePair(bilinear(analog, fs)));
        }
        if (order % 2 == 1) {
            Complex analog = new Complex(-realScale * warped, 0);
            answer.add(BiquadSection.fromRealPole(bilinear(analog, fs).getReal()));
        }
        return answer;
    }

    static Complex bilinear(Complex s, double fs) {
        Complex half = s.divide(2 * fs);
        return Complex.ONE.add(half).divide(Complex.ONE.subtract(half));
    }

    static double asinh(double x) {
        return Math.log(x + Math.sqrt(x * x + 1));
    }

    @Override
    public double[] apply(double[] values) {
        if (values.length == 0) {
            return new double[0];
        }
        double[] forward = pass(values);
        double[] reversed = reverse(forward);
        return reverse(pass(reversed));
    }

    double[] pass(double[] values) {
        double origin = values[0];
        double[] current = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            current[i] = values[i] - origin;
        }
        for (BiquadSection section : sections) {
            current = section.filter(current);
        }
        for (int i = 0; i < current.length; i++) {
            current[i] += origin;
        }
        return current;
    }

    static double[] reverse(double[] values) {
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = values[values.length - 1 - i];
        }
        return answer;
    }
}
