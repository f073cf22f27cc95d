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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.anomalydiagnostics.exceptions.InsufficientDataException;
import com.anomalydiagnostics.testutils.SeasonalTestData;
import com.anomalydiagnostics.util.Quantiles;

public class SeasonalDecomposerTest {

    private SeasonalDecomposer decomposer;

    @BeforeEach
    public void setUp() {
        decomposer = new SeasonalDecomposer();
    }

    @ParameterizedTest
    @CsvSource({ "104, 52, 53, 0", "200, 12, 31, 1", "50, 1, 7, 2", "30, 7, 3, 3", "20, 10, 101, 4" })
    public void testComponentsAddUp(int n, int frequency, int trendWindow, long seed) {
        double[] observed = SeasonalTestData.seasonal(n, Math.max(2, frequency), 1000.0, 25.0, 5.0, seed);
        Decomposition decomposition = decomposer.decompose(observed, frequency, trendWindow);
        assertEquals(n, decomposition.size());
        for (int i = 0; i < n; i++) {
            double sum = decomposition.getSeasonal()[i] + decomposition.getTrend()[i]
                    + decomposition.getRemainder()[i];
            assertEquals(observed[i], sum, 1e-9 * Math.abs(observed[i]));
        }
    }

    @Test
    public void testConstantSeriesIsExact() {
        double[] observed = SeasonalTestData.constant(104, 5.0);
        Decomposition decomposition = decomposer.decompose(observed, 13, 53);
        double[] zeros = new double[104];
        assertArrayEquals(zeros, decomposition.getSeasonal(), 0.0);
        assertArrayEquals(observed, decomposition.getTrend(), 0.0);
        assertArrayEquals(zeros, decomposition.getRemainder(), 0.0);
    }

    @Test
    public void testTrendOnly() {
        double[] observed = SeasonalTestData.seasonal(40, 10, 3.0, 1.0, 0.5, 7L);
        Decomposition decomposition = decomposer.decompose(observed, 1, 9);
        assertArrayEquals(new double[40], decomposition.getSeasonal(), 0.0);
    }

    @Test
    public void testPurePeriodicSignal() {
        int frequency = 12;
        double[] observed = SeasonalTestData.seasonal(48, frequency, 10.0, 2.0, 0.0, 0L);
        Decomposition decomposition = decomposer.decompose(observed, frequency, 13);
        for (int i = 0; i < observed.length; i++) {
            assertThat(decomposition.getTrend()[i], closeTo(10.0, 1e-8));
            assertThat(decomposition.getSeasonal()[i], closeTo(observed[i] - 10.0, 1e-8));
            assertThat(Math.abs(decomposition.getRemainder()[i]), lessThan(1e-8));
        }
    }

    @Test
    public void testSeasonalIsCentered() {
        int frequency = 7;
        double[] observed = SeasonalTestData.seasonal(70, frequency, 100.0, 10.0, 2.0, 11L);
        double[] seasonal = decomposer.decompose(observed, frequency, 15).getSeasonal();
        double sum = 0;
        for (int i = 0; i < frequency; i++) {
            sum += seasonal[i];
            // periodic seasonal component
            assertEquals(seasonal[i], seasonal[i + frequency], 0.0);
        }
        assertEquals(0.0, sum, 1e-9);
    }

    @Test
    public void testSpikeEndsUpInRemainder() {
        double[] observed = SeasonalTestData.seasonal(104, 52, 50.0, 10.0, 1.0, 42L);
        observed[60] += 150.0;
        Decomposition decomposition = decomposer.decompose(observed, 52, 53);
        assertThat(decomposition.getRemainder()[60], closeTo(150.0, 5.0));
        assertThat(Math.abs(decomposition.getRemainder()[8]), lessThan(0.5));
    }

    @ParameterizedTest
    @CsvSource({ "42", "7", "99", "1", "2023" })
    public void testTwoPointPhasesKeepTheirSpread(long seed) {
        double[] observed = SeasonalTestData.seasonal(104, 52, 50.0, 10.0, 1.0, seed);
        double[] single = new SeasonalDecomposer(1, 2).decompose(observed, 52, 53).getRemainder();
        double[] robust = decomposer.decompose(observed, 52, 53).getRemainder();
        assertThat(interQuartileRange(robust), greaterThan(0.9 * interQuartileRange(single)));
        assertThat(interQuartileRange(robust), greaterThan(0.3));
    }

    @ParameterizedTest
    @CsvSource({ "42", "7", "99" })
    public void testSpikeDoesNotLeakIntoPhasePartner(long seed) {
        double[] observed = SeasonalTestData.seasonal(104, 52, 50.0, 10.0, 1.0, seed);
        double[] q = Quantiles.quantiles(observed, 0.25, 0.5, 0.75);
        observed[60] = q[1] + 10 * (q[2] - q[0]);
        double[] remainder = decomposer.decompose(observed, 52, 53).getRemainder();
        assertThat(remainder[60], greaterThan(100.0));
        assertThat(Math.abs(remainder[8]), lessThan(0.5));
    }

    private static double interQuartileRange(double[] values) {
        double[] q = Quantiles.quantiles(values, 0.25, 0.75);
        return q[1] - q[0];
    }

    @Test
    public void testSeasonallyAdjusted() {
        double[] observed = SeasonalTestData.seasonal(28, 7, 10.0, 3.0, 0.5, 3L);
        Decomposition decomposition = decomposer.decompose(observed, 7, 7);
        double[] adjusted = decomposition.getSeasonallyAdjusted();
        for (int i = 0; i < observed.length; i++) {
            assertEquals(observed[i] - decomposition.getSeasonal()[i], adjusted[i], 0.0);
        }
    }

    @Test
    public void testInputIsNotModified() {
        double[] observed = SeasonalTestData.seasonal(30, 5, 10.0, 3.0, 0.5, 5L);
        double[] copy = Arrays.copyOf(observed, observed.length);
        decomposer.decompose(observed, 5, 7);
        assertArrayEquals(copy, observed, 0.0);
    }

    @Test
    public void testInsufficientData() {
        assertThrows(InsufficientDataException.class, () -> decomposer.decompose(new double[] { 1, 2, 3 }, 52, 5));
        assertThrows(InsufficientDataException.class, () -> decomposer.decompose(new double[7], 4, 5));
        assertThrows(InsufficientDataException.class, () -> decomposer.decompose(new double[1], 1, 3));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> decomposer.decompose(new double[20], 0, 5));
        assertThrows(IllegalArgumentException.class, () -> decomposer.decompose(new double[20], 2, 4));
        assertThrows(IllegalArgumentException.class, () -> new SeasonalDecomposer(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new SeasonalDecomposer(5, 0));
    }
}
