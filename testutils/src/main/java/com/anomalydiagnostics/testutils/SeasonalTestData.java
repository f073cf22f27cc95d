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

package com.anomalydiagnostics.testutils;

import static java.lang.Math.PI;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Random;

/**
 * Generators for equally spaced seasonal series: a level, a sine wave of a
 * given period, uniform noise and optionally injected spikes whose positions
 * are returned with the data.
 */
public class SeasonalTestData {

    public static final Instant DEFAULT_START = LocalDate.of(2020, 1, 6).atStartOfDay().toInstant(ZoneOffset.UTC);

    private SeasonalTestData() {
    }

    public static Instant[] timestamps(Instant start, Duration step, int num) {
        Instant[] answer = new Instant[num];
        for (int i = 0; i < num; i++) {
            answer[i] = start.plus(step.multipliedBy(i));
        }
        return answer;
    }

    public static Instant[] weekly(int num) {
        return timestamps(DEFAULT_START, Duration.ofDays(7), num);
    }

    public static Instant[] daily(int num) {
        return timestamps(DEFAULT_START, Duration.ofDays(1), num);
    }

    public static Instant[] hourly(int num) {
        return timestamps(DEFAULT_START, Duration.ofHours(1), num);
    }

    /**
     * @param num       number of observations
     * @param period    observations per cycle of the sine wave
     * @param level     mean of the series
     * @param amplitude amplitude of the sine wave
     * @param noise     half width of the uniform noise
     * @param seed      random seed
     * @return the series
     */
    public static double[] seasonal(int num, int period, double level, double amplitude, double noise, long seed) {
        Random prg = new Random(seed);
        double[] data = new double[num];
        for (int i = 0; i < num; i++) {
            data[i] = level + amplitude * Math.sin(2 * PI * i / period) + noise * (2 * prg.nextDouble() - 1);
        }
        return data;
    }

    public static double[] constant(int num, double value) {
        double[] data = new double[num];
        Arrays.fill(data, value);
        return data;
    }

    /**
     * Adds a single spike to a copy of the data.
     *
     * @param timestamps timestamps of the series
     * @param data       the series
     * @param index      position of the spike
     * @param magnitude  value added at that position
     * @return the series with the spike
     */
    public static SeriesWithAnomalies withSpike(Instant[] timestamps, double[] data, int index, double magnitude) {
        double[] copy = Arrays.copyOf(data, data.length);
        copy[index] += magnitude;
        return new SeriesWithAnomalies(timestamps, copy, new int[] { index }, new double[] { magnitude });
    }

    /**
     * A seasonal series in which each observation turns into a spike with
     * probability {@code anomalyRate}. Spikes are at least {@code anomalyFactor}
     * times the amplitude, upwards or downwards with equal probability.
     */
    public static SeriesWithAnomalies getSeasonalData(Instant[] timestamps, int period, double level,
            double amplitude, double noise, double anomalyRate, double anomalyFactor, long seed) {
        int num = timestamps.length;
        Random prg = new Random(seed);
        double[] data = seasonal(num, period, level, amplitude, noise, prg.nextLong());
        Random anomalyPrg = new Random(prg.nextLong());
        int[] indices = new int[num];
        double[] changes = new double[num];
        int counter = 0;
        for (int i = 0; i < num; i++) {
            if (anomalyPrg.nextDouble() < anomalyRate) {
                double factor = anomalyFactor * (1 + anomalyPrg.nextDouble());
                double change = anomalyPrg.nextDouble() < 0.5 ? factor * amplitude : -factor * amplitude;
                data[i] += change;
                indices[counter] = i;
                changes[counter++] = change;
            }
        }
        return new SeriesWithAnomalies(timestamps, data, Arrays.copyOf(indices, counter),
                Arrays.copyOf(changes, counter));
    }
}
