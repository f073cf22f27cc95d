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

package com.anomalydiagnostics.decomposition;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class RobustnessWeightsTest {

    @Test
    public void testBisquare() {
        // median absolute residual is 1, so the cutoff is 6
        double[] residuals = new double[] { 0.0, 1.0, -1.0, 1.0, -3.0, 7.0, -0.001 };
        double[] weights = RobustnessWeights.bisquare(residuals);
        assertEquals(1.0, weights[0]);
        double expected = Math.pow(1 - 1.0 / 36, 2);
        assertEquals(expected, weights[1], 1e-12);
        assertEquals(expected, weights[2], 1e-12);
        assertEquals(Math.pow(1 - 0.25, 2), weights[4], 1e-12);
        assertEquals(0.0, weights[5]);
        assertEquals(1.0, weights[6]);
    }

    @Test
    public void testZeroScale() {
        double[] weights = RobustnessWeights.bisquare(new double[] { 0.0, 0.0, 0.0, 5.0 });
        assertArrayEquals(new double[] { 1.0, 1.0, 1.0, 0.0 }, weights, 0.0);
    }

    @Test
    public void testEmpty() {
        assertEquals(0, RobustnessWeights.bisquare(new double[0]).length);
    }

    @Test
    public void testRunningMedianDownWeightsSpike() {
        double[] values = new double[] { 1.0, 1.1, 0.9, 1.0, 50.0, 1.05, 0.95, 1.0, 1.1 };
        double[] weights = RobustnessWeights.fromRunningMedian(values, 5);
        assertEquals(0.0, weights[4]);
        for (int i = 0; i < values.length; i++) {
            if (i != 4) {
                assertTrue(weights[i] > 0.5);
            }
        }
    }
}
