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

/**
 * Locally weighted linear regression over an equally spaced series. Each point
 * is fitted from the {@code window} nearest observations, weighted by the
 * tricube kernel and by per observation robustness weights. Windows are
 * centered and become one sided only where the series ends.
 */
public class LoessSmoother {

    // relative spread of the positions below which the local fit is a weighted
    // mean
    static final double FLAT_FIT_TOLERANCE = 1e-8;

    private final int window;

    public LoessSmoother(int window) {
        checkArgument(window > 0, "window must be positive");
        this.window = window;
    }

    public int getWindow() {
        return window;
    }

    /**
     * Smooths {@code values} into {@code output}.
     *
     * @param values            the series
     * @param robustnessWeights weights in [0, 1], one per observation
     * @param output            array receiving the smoothed series; may not
     *                          alias {@code values}
     */
    public void smooth(double[] values, double[] robustnessWeights, double[] output) {
        checkNotNull(values, "values must not be null");
        checkNotNull(robustnessWeights, "robustness weights must not be null");
        checkNotNull(output, "output must not be null");
        checkArgument(values.length == robustnessWeights.length && values.length == output.length,
                "values, weights and output must have the same length");
        checkArgument(values != output, "output must not alias values");
        int n = values.length;
        double[] kernel = new double[Math.min(window, n)];
        for (int i = 0; i < n; i++) {
            output[i] = fit(values, robustnessWeights, i, kernel);
        }
    }

    double fit(double[] values, double[] robustnessWeights, int index, double[] kernel) {
        int n = values.length;
        int left;
        int right;
        double bandwidth;
        if (window >= n) {
            left = 0;
            right = n - 1;
            // a window longer than the series widens the kernel instead
            bandwidth = Math.max(index, n - 1 - index) + 1 + (window - n) / 2.0;
        } else {
            left = index - window / 2;
            right = left + window - 1;
            if (left < 0) {
                left = 0;
                right = window - 1;
            } else if (right > n - 1) {
                right = n - 1;
                left = n - window;
            }
            // +1 keeps the outermost observation at a positive weight
            bandwidth = Math.max(index - left, right - index) + 1;
        }

        for (int j = left; j <= right; j++) {
            kernel[j - left] = tricube(Math.abs(j - index) / bandwidth) * robustnessWeights[j];
        }
        double value = localLinear(values, index, left, right, kernel);
        if (Double.isNaN(value)) {
            // every neighbour was rejected as an outlier; fall back to the kernel alone
            for (int j = left; j <= right; j++) {
                kernel[j - left] = tricube(Math.abs(j - index) / bandwidth);
            }
            value = localLinear(values, index, left, right, kernel);
        }
        return value;
    }

    /**
     * Weighted least squares line through the window, evaluated at
     * {@code index}. Positions and values are taken relative to the point being
     * fitted, so a locally constant series is reproduced exactly.
     *
     * @return the fitted value, or NaN if all weights are zero
     */
    static double localLinear(double[] values, int index, int left, int right, double[] weights) {
        double reference = values[index];
        double sumWeights = 0;
        double sumX = 0;
        double sumY = 0;
        for (int j = left; j <= right; j++) {
            double w = weights[j - left];
            sumWeights += w;
            sumX += w * (j - index);
            sumY += w * (values[j] - reference);
        }
        if (sumWeights <= 0) {
            return Double.NaN;
        }
        double meanX = sumX / sumWeights;
        double meanY = sumY / sumWeights;
        double sxx = 0;
        double sxy = 0;
        for (int j = left; j <= right; j++) {
            double w = weights[j - left];
            double dx = (j - index) - meanX;
            sxx += w * dx * dx;
            sxy += w * dx * (values[j] - reference - meanY);
        }
        double slope = (sxx > FLAT_FIT_TOLERANCE * sumWeights) ? sxy / sxx : 0.0;
        return reference + meanY - slope * meanX;
    }

    static double tricube(double u) {
        if (u >= 1) {
            return 0.0;
        }
        double t = 1 - u * u * u;
        return t * t * t;
    }
}
