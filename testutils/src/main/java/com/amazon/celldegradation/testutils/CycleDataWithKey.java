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

/**
 * Synthetic per-channel cycle data together with the cycle indices at which
 * artificial anomalies were injected. The key is what a test checks the ranked
 * output against.
 */
public class CycleDataWithKey {

    public final long[] indices;
    public final double[][] channels;
    public final String[] channelNames;
    public final long[] injectedIndices;

    public CycleDataWithKey(long[] indices, double[][] channels, String[] channelNames, long[] injectedIndices) {
        this.indices = indices;
        this.channels = channels;
        this.channelNames = channelNames;
        this.injectedIndices = injectedIndices;
    }

    public double[] channel(String name) {
        for (int i = 0; i < channelNames.length; i++) {
            if (channelNames[i].equals(name)) {
                return channels[i];
            }
        }
        throw new IllegalArgumentException("no channel named " + name);
    }
}
