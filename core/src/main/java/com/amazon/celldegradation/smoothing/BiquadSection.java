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

/**
 * One second order section of a digital low pass, normalised to unit gain at
 * DC. Zeros sit at z = -1. A first order section is the special case b2 = a2 =
 * 0.
 */
public class BiquadSection {

    final double b0;
    final double b1;
    final double b2;
    final double a1;
    final double a2;

    BiquadSection(double b0, double b1, double b2, double a1, double a2) {
        this.b0 = b0;
        this.b1 = b1;
        this.b2 = b2;
        this.a1 = a1;
        this.a2 = a2;
    }

    /**
     * section for a conjugate pair of digital poles
     */
    static BiquadSection fromPolePair(Complex pole) {
        double a1 = -2 * pole.getReal();
        double a2 = pole.abs() * pole.abs();
        double gain = (1 + a1 + a2) / 4;
        return new BiquadSection(gain, 2 * gain, gain, a1, a2);
    }

    /**
     * section for a single real digital pole
     */
    static BiquadSection fromRealPole(double pole) {
        double gain = (1 - pole) / 2;
        return new BiquadSection(gain, gain, 0, -pole, 0);
    }

    /**
     * filter with zero initial state, transposed direct form II
     */
    double[] filter(double[] input) {
        double[] output = new double[input.length];
        double s1 = 0;
        double s2 = 0;
        for (int i = 0; i < input.length; i++) {
            double x = input[i];
            double y = b0 * x + s1;
            s1 = b1 * x - a1 * y + s2;
            s2 = b2 * x - a2 * y;
            output[i] = y;
        }
        return output;
    }

    double dcGain() {
        return (b0 + b1 + b2) / (1 + a1 + a2);
    }
}
