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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Sample quantiles with linear interpolation between order statistics (the R-7
 * definition, which is also the default of most statistics packages).
 */
public class Quantiles {

    private Quantiles() {
    }

    /**
     * @param values the sample, left unmodified
     * @param p      the probability in (0, 1]
     * @return the p-th sample quantile
     */
    public static double quantile(double[] values, double p) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "values must not be empty");
        checkArgument(p > 0 && p <= 1, "p must be in the range (0, 1]");
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, 100.0 * p);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * Evaluates several quantiles over one sorted copy of the sample.
     *
     * @param values the sample, left unmodified
     * @param probabilities probabilities in (0, 1]
     * @return the quantiles in the order of the probabilities
     */
    public static double[] quantiles(double[] values, double... probabilities) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "values must not be empty");
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(values);
        double[] answer = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            checkArgument(probabilities[i] > 0 && probabilities[i] <= 1, "probabilities must be in the range (0, 1]");
            answer[i] = percentile.evaluate(100.0 * probabilities[i]);
        }
        return answer;
    }

    /**
     * Centered running median. Windows are truncated at the ends of the array
     * rather than padded.
     *
     * @param values the series
     * @param width  the window width, at least 1
     * @return an array of the same length holding the median around each point
     */
    public static double[] runningMedian(double[] values, int width) {
        checkNotNull(values, "values must not be null");
        checkArgument(width > 0, "width must be positive");
        int half = width / 2;
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int left = Math.max(0, i - half);
            int right = Math.min(values.length - 1, i + half);
            double[] window = new double[right - left + 1];
            System.arraycopy(values, left, window, 0, window.length);
            answer[i] = median(window);
        }
        return answer;
    }
}
