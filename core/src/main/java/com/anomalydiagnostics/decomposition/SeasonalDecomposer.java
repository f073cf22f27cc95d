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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.anomalydiagnostics.exceptions.InsufficientDataException;

/**
 * Robust seasonal-trend decomposition by loess with a periodic seasonal
 * component.
 * <p>
 * The seasonal component of a phase is the robustness weighted mean of the
 * detrended observations of that phase, centered over one cycle. A phase with
 * fewer than {@link #MIN_WEIGHTED_PHASE_SIZE} observations only drops the
 * observations whose weight is zero and averages the rest with equal weight,
 * so the mean of a short phase never drifts onto one of its members. The trend is
 * a local linear loess of the deseasonalized series. Both are refined in an
 * inner loop; the outer loop recomputes bisquare robustness weights from the
 * remainder, so isolated outliers end up in the remainder instead of being
 * absorbed by the seasonal or trend components.
 */
@Slf4j
@Getter
public class SeasonalDecomposer {

    public static final int DEFAULT_OUTER_ITERATIONS = 5;

    public static final int DEFAULT_INNER_ITERATIONS = 2;

    public static final int INITIAL_MEDIAN_WIDTH = 5;

    public static final int MIN_WEIGHTED_PHASE_SIZE = 3;

    private final int outerIterations;

    private final int innerIterations;

    public SeasonalDecomposer() {
        this(DEFAULT_OUTER_ITERATIONS, DEFAULT_INNER_ITERATIONS);
    }

    public SeasonalDecomposer(int outerIterations, int innerIterations) {
        checkArgument(outerIterations > 0, "outerIterations must be positive");
        checkArgument(innerIterations > 0, "innerIterations must be positive");
        this.outerIterations = outerIterations;
        this.innerIterations = innerIterations;
    }

    /**
     * Decomposes an equally spaced series.
     *
     * @param observed    the observations, left unmodified
     * @param frequency   observations per seasonal cycle; 1 disables the
     *                    seasonal component
     * @param trendWindow odd number of observations in each trend fit
     * @return the decomposition
     * @throws InsufficientDataException if the series does not cover two full
     *                                   cycles
     */
    public Decomposition decompose(double[] observed, int frequency, int trendWindow) {
        checkNotNull(observed, "observed must not be null");
        checkArgument(frequency >= 1, "frequency must be at least 1");
        checkArgument(trendWindow >= 1 && trendWindow % 2 == 1, "trend window must be a positive odd number");
        int n = observed.length;
        if (n < 2 * frequency || n < 2) {
            throw new InsufficientDataException(String.format(
                    "%d observation(s) cannot be decomposed with frequency %d, at least %d are needed", n, frequency,
                    Math.max(2, 2 * frequency)));
        }

        double[] seasonal = new double[n];
        double[] trend = new double[n];
        double[] remainder = new double[n];
        double[] detrended = new double[n];
        double[] deseasonalized = new double[n];
        double[] weights = RobustnessWeights.fromRunningMedian(observed, INITIAL_MEDIAN_WIDTH);
        LoessSmoother smoother = new LoessSmoother(trendWindow);

        for (int outer = 0; outer < outerIterations; outer++) {
            for (int inner = 0; inner < innerIterations; inner++) {
                if (frequency > 1) {
                    for (int i = 0; i < n; i++) {
                        detrended[i] = observed[i] - trend[i];
                    }
                    periodicSeasonal(detrended, weights, frequency, seasonal);
                }
                for (int i = 0; i < n; i++) {
                    deseasonalized[i] = observed[i] - seasonal[i];
                }
                smoother.smooth(deseasonalized, weights, trend);
            }
            for (int i = 0; i < n; i++) {
                remainder[i] = observed[i] - seasonal[i] - trend[i];
            }
            if (outer < outerIterations - 1) {
                weights = RobustnessWeights.bisquare(remainder);
            }
            if (log.isDebugEnabled()) {
                log.debug("pass {}: {} observation(s) with zero robustness weight", outer + 1, countZero(weights));
            }
        }
        return new Decomposition(observed.clone(), seasonal, trend, remainder);
    }

    /**
     * Writes the centered periodic seasonal component of {@code detrended} into
     * {@code seasonal}.
     */
    static void periodicSeasonal(double[] detrended, double[] weights, int frequency, double[] seasonal) {
        double[] phaseMeans = new double[frequency];
        for (int phase = 0; phase < frequency; phase++) {
            phaseMeans[phase] = phaseMean(detrended, weights, phase, frequency);
        }
        double reference = phaseMeans[0];
        double offset = 0;
        for (int phase = 0; phase < frequency; phase++) {
            offset += phaseMeans[phase] - reference;
        }
        double cycleMean = reference + offset / frequency;
        for (int i = 0; i < detrended.length; i++) {
            seasonal[i] = phaseMeans[i % frequency] - cycleMean;
        }
    }

    static double phaseMean(double[] values, double[] weights, int phase, int frequency) {
        double reference = values[phase];
        boolean equalWeights = phaseSize(values.length, phase, frequency) < MIN_WEIGHTED_PHASE_SIZE;
        double sumWeights = 0;
        double sum = 0;
        for (int i = phase; i < values.length; i += frequency) {
            double w = equalWeights ? (weights[i] > 0 ? 1.0 : 0.0) : weights[i];
            sumWeights += w;
            sum += w * (values[i] - reference);
        }
        if (sumWeights > 0) {
            return reference + sum / sumWeights;
        }
        // every observation of this phase is an outlier
        int count = 0;
        sum = 0;
        for (int i = phase; i < values.length; i += frequency) {
            sum += values[i] - reference;
            count++;
        }
        return reference + sum / count;
    }

    static int phaseSize(int n, int phase, int frequency) {
        return (n - phase + frequency - 1) / frequency;
    }

    private static int countZero(double[] weights) {
        int count = 0;
        for (double w : weights) {
            if (w == 0) {
                count++;
            }
        }
        return count;
    }
}
