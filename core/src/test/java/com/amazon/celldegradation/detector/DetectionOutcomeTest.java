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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DetectionOutcomeTest {

    @Test
    public void testTopScoresAreFlagged() {
        double[] scores = { 0.1, 0.9, 0.2, 0.3, 0.8, 0.0, 0.4, 0.5, 0.6, 0.7 };
        DetectionOutcome outcome = DetectionOutcome.fromScores(scores, 0.2);
        assertEquals(2, outcome.flaggedCount());
        assertTrue(outcome.isFlagged(1));
        assertTrue(outcome.isFlagged(4));
        assertEquals(0.7, outcome.getThreshold(), 0.0);
    }

    @Test
    public void testContaminationRoundsUp() {
        double[] scores = new double[150];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = i;
        }
        // ceil(0.01 * 150) = 2
        assertEquals(2, DetectionOutcome.fromScores(scores, 0.01).flaggedCount());
    }

    @Test
    public void testTiesAtThresholdAreNotFlagged() {
        double[] scores = { 1, 1, 1, 5, 5 };
        DetectionOutcome outcome = DetectionOutcome.fromScores(scores, 0.2);
        // the top two are tied, so the second highest is the threshold
        assertEquals(0, outcome.flaggedCount());

        DetectionOutcome constant = DetectionOutcome.fromScores(new double[] { 3, 3, 3, 3 }, 0.5);
        assertEquals(0, constant.flaggedCount());
    }

    @Test
    public void testSingleRow() {
        DetectionOutcome outcome = DetectionOutcome.fromScores(new double[] { 4.0 }, 0.5);
        assertFalse(outcome.isFlagged(0));
        assertEquals(0, DetectionOutcome.fromScores(new double[0], 0.1).size());
    }

    @Test
    public void testCopiesAreReturned() {
        double[] scores = { 1, 2 };
        DetectionOutcome outcome = new DetectionOutcome(scores, new boolean[] { false, true }, 1.0);
        scores[0] = 10;
        outcome.getScores()[1] = 20;
        outcome.getFlags()[0] = true;
        assertArrayEquals(new double[] { 1, 2 }, outcome.getScores(), 0.0);
        assertArrayEquals(new boolean[] { false, true }, outcome.getFlags());
        assertThrows(IllegalArgumentException.class,
                () -> new DetectionOutcome(new double[1], new boolean[2], 0.0));
    }
}
