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

package com.amazon.celldegradation.ensemble.consensus;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per sample summary of an ensemble run: how many detectors flagged it, the
 * aggregated score and the final rank (1 is the strongest anomaly).
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConsensusRecord {

    private final long index;
    private final int count;
    private final double combinedScore;
    private final int rank;

    public ConsensusRecord(long index, int count, double combinedScore, int rank) {
        this.index = index;
        this.count = count;
        this.combinedScore = combinedScore;
        this.rank = rank;
    }
}
