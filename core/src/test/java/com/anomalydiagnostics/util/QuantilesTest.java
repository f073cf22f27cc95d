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

package com.anomalydiagnostics.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class QuantilesTest {

    @Test
    public void testLinearInterpolation() {
        double[] values = new double[] { 4.0, 1.0, 3.0, 2.0 };
        assertEquals(1.75, Quantiles.quantile(values, 0.25), 1e-12);
        assertEquals(2.5, Quantiles.median(values), 1e-12);
        assertEquals(3.25, Quantiles.quantile(values, 0.75), 1e-12);
        assertEquals(4.0, Quantiles.quantile(values, 1.0), 1e-12);
        // input is left unmodified
        assertArrayEquals(new double[] { 4.0, 1.0, 3.0, 2.0 }, values);
    }

    @Test
    public void testQuantiles() {
        double[] values = new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
        assertArrayEquals(new double[] { 3.25, 5.5, 7.75 }, Quantiles.quantiles(values, 0.25, 0.5, 0.75), 1e-12);
    }

    @Test
    public void testSingleValue() {
        assertEquals(7.0, Quantiles.quantile(new double[] { 7.0 }, 0.25));
        assertEquals(7.0, Quantiles.median(new double[] { 7.0 }));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Quantiles.median(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> Quantiles.quantile(new double[] { 1.0 }, 0.0));
        assertThrows(IllegalArgumentException.class, () -> Quantiles.quantile(new double[] { 1.0 }, 1.5));
        assertThrows(NullPointerException.class, () -> Quantiles.median(null));
    }

    @Test
    public void testRunningMedian() {
        double[] values = new double[] { 1, 9, 2, 8, 3, 100, 4 };
        double[] median = Quantiles.runningMedian(values, 3);
        assertArrayEquals(new double[] { 5, 2, 8, 3, 8, 4, 52 }, median, 1e-12);

        assertArrayEquals(values, Quantiles.runningMedian(values, 1), 0.0);
    }
}
