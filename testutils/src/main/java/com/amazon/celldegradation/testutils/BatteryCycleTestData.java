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

package com.amazon.celldegradation.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates cycle-indexed battery measurements: a capacity channel that fades
 * monotonically with Gaussian measurement noise, and optionally charge voltage
 * and discharge temperature channels that drift with the fade. Large drops can
 * be injected at randomly chosen cycles, and the chosen cycles are returned as
 * the key.
 */
public class BatteryCycleTestData {

    public static final String CAPACITY = "capacity";
    public static final String CHARGE_VOLTAGE = "charge_voltage";
    public static final String DISCHARGE_TEMP = "discharge_temp";

    private final double initialCapacity;
    private final double fadePerCycle;
    private final double noiseSigma;
    private final double dropSize;

    public BatteryCycleTestData(double initialCapacity, double fadePerCycle, double noiseSigma, double dropSize) {
        this.initialCapacity = initialCapacity;
        this.fadePerCycle = fadePerCycle;
        this.noiseSigma = noiseSigma;
        this.dropSize = dropSize;
    }

    public BatteryCycleTestData() {
        this(2.0, 0.0006, 0.004, 0.25);
    }

    /**
     * a single capacity channel with injected drops
     *
     * @param numberOfCycles length of the series
     * @param numberOfDrops  number of injected drops, kept away from the ends and
     *                       from each other
     * @param seed           seed for noise and drop placement
     * @return data and the injected cycle indices
     */
    public CycleDataWithKey generateCapacityWithDrops(int numberOfCycles, int numberOfDrops, long seed) {
        return generate(numberOfCycles, numberOfDrops, seed, false);
    }

    public CycleDataWithKey generateMultiChannelWithDrops(int numberOfCycles, int numberOfDrops, long seed) {
        return generate(numberOfCycles, numberOfDrops, seed, true);
    }

    private CycleDataWithKey generate(int numberOfCycles, int numberOfDrops, long seed, boolean allChannels) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        long[] indices = new long[numberOfCycles];
        double[] capacity = new double[numberOfCycles];
        double[] voltage = new double[numberOfCycles];
        double[] temperature = new double[numberOfCycles];

        for (int i = 0; i < numberOfCycles; i++) {
            indices[i] = i;
            double fade = fadePerCycle * i;
            capacity[i] = initialCapacity - fade + dist.nextDouble(0, noiseSigma);
            voltage[i] = 4.2 - 0.1 * fade + dist.nextDouble(0, noiseSigma);
            temperature[i] = 25.0 + 2.0 * fade + dist.nextDouble(0, 10 * noiseSigma);
        }

        long[] injected = pickDropIndices(numberOfCycles, numberOfDrops, rng);
        for (long index : injected) {
            capacity[(int) index] -= dropSize;
        }

        if (allChannels) {
            return new CycleDataWithKey(indices, new double[][] { capacity, voltage, temperature },
                    new String[] { CAPACITY, CHARGE_VOLTAGE, DISCHARGE_TEMP }, injected);
        }
        return new CycleDataWithKey(indices, new double[][] { capacity }, new String[] { CAPACITY }, injected);
    }

    private long[] pickDropIndices(int numberOfCycles, int numberOfDrops, Random rng) {
        int margin = Math.max(20, numberOfCycles / 20);
        int spacing = Math.max(10, (numberOfCycles - 2 * margin) / (2 * Math.max(1, numberOfDrops)));
        long[] answer = new long[numberOfDrops];
        int count = 0;
        int attempts = 0;
        while (count < numberOfDrops && attempts < 100000) {
            ++attempts;
            long candidate = margin + rng.nextInt(numberOfCycles - 2 * margin);
            boolean tooClose = false;
            for (int j = 0; j < count; j++) {
                if (Math.abs(answer[j] - candidate) < spacing) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) {
                answer[count++] = candidate;
            }
        }
        long[] result = Arrays.copyOf(answer, count);
        Arrays.sort(result);
        return result;
    }

    /**
     * constant channels, every value identical
     */
    public static CycleDataWithKey generateFlat(int numberOfCycles, double[] levels, String[] names) {
        long[] indices = new long[numberOfCycles];
        double[][] channels = new double[levels.length][numberOfCycles];
        for (int i = 0; i < numberOfCycles; i++) {
            indices[i] = i;
            for (int c = 0; c < levels.length; c++) {
                channels[c][i] = levels[c];
            }
        }
        return new CycleDataWithKey(indices, channels, names, new long[0]);
    }

    /**
     * Gaussian noise around zero, used for smoothing tests
     */
    public static double[] noise(int length, double sigma, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[] answer = new double[length];
        for (int i = 0; i < length; i++) {
            answer[i] = dist.nextDouble(0, sigma);
        }
        return answer;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(1.0 - u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
