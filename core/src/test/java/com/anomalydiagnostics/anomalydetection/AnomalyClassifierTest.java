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

package com.anomalydiagnostics.anomalydetection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.anomalydiagnostics.returntypes.Direction;

public class AnomalyClassifierTest {

    // lower bound -7, upper bound 7
    private static final RemainderBounds BOUNDS = new RemainderBounds(0.0, -1.0, 1.0, 3.0);

    @Test
    public void testFlagsOutsideBand() {
        double[] remainder = new double[] { 0, 7, 7.5, -7, -8, 3, 0, 0, 0, 0 };
        boolean[] flags = new AnomalyClassifier(0.5).classify(remainder, BOUNDS);
        assertArrayEquals(new boolean[] { false, false, true, false, true, false, false, false, false, false },
                flags);
    }

    @Test
    public void testCapKeepsLargestDistances() {
        // five points outside, the cap allows ceil(0.2 * 10) = 2
        double[] remainder = new double[] { 8, 0, -20, 0, 9, 0, 30, 0, -7.5, 0 };
        boolean[] flags = new AnomalyClassifier(0.2).classify(remainder, BOUNDS);
        assertArrayEquals(new boolean[] { false, false, true, false, false, false, true, false, false, false },
                flags);
    }

    @Test
    public void testTiesKeepEarlierIndex() {
        double[] remainder = new double[] { 0, 10, 0, -10, 0, 10, 0, 0, 0, 0 };
        boolean[] flags = new AnomalyClassifier(0.1).classify(remainder, BOUNDS);
        assertArrayEquals(new boolean[] { false, true, false, false, false, false, false, false, false, false },
                flags);

        flags = new AnomalyClassifier(0.2).classify(remainder, BOUNDS);
        assertArrayEquals(new boolean[] { false, true, false, true, false, false, false, false, false, false },
                flags);
    }

    @Test
    public void testNothingOutside() {
        double[] remainder = new double[] { 0, 1, -1, 6.9 };
        assertArrayEquals(new boolean[4], new AnomalyClassifier().classify(remainder, BOUNDS));
    }

    @Test
    public void testCapIsHonored() {
        double[] remainder = new double[104];
        for (int i = 0; i < remainder.length; i++) {
            remainder[i] = (i % 2 == 0) ? 100.0 + i : 0.0;
        }
        boolean[] flags = new AnomalyClassifier(0.2).classify(remainder, BOUNDS);
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        assertEquals(21, count);
        // the largest remainders are at the end
        assertEquals(true, flags[102]);
        assertEquals(false, flags[0]);
    }

    @ParameterizedTest
    @CsvSource({ "0.2, 104, 21", "0.2, 10, 2", "0.1, 30, 3", "0.2, 3, 1", "1.0, 7, 7", "0.05, 1, 1", "0.3, 10, 3" })
    public void testAnomalyLimit(double maxAnomalies, int n, int expected) {
        assertEquals(expected, AnomalyClassifier.anomalyLimit(maxAnomalies, n));
    }

    @Test
    public void testDirection() {
        assertEquals(Direction.UP, AnomalyClassifier.directionOf(8.0, true, BOUNDS));
        assertEquals(Direction.DOWN, AnomalyClassifier.directionOf(-8.0, true, BOUNDS));
        assertEquals(Direction.NONE, AnomalyClassifier.directionOf(8.0, false, BOUNDS));
    }

    @Test
    public void testInvalidMaxAnomalies() {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyClassifier(0.0));
        assertThrows(IllegalArgumentException.class, () -> new AnomalyClassifier(1.01));
    }
}
