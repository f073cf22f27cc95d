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

import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import com.anomalydiagnostics.util.Quantiles;

/**
 * Bisquare robustness weights. Residuals beyond six median absolute residuals
 * get weight zero, small residuals weight one.
 */
public class RobustnessWeights {

    public static final double SCALE_MULTIPLIER = 6.0;

    private static final double LOWER_CUTOFF = 0.001;

    private static final double UPPER_CUTOFF = 0.999;

    private RobustnessWeights() {
    }

    /**
     * @param residuals the residuals of the current fit
     * @return one weight in [0, 1] per residual
     */
    public static double[] bisquare(double[] residuals) {
        checkNotNull(residuals, "residuals must not be null");
        double[] answer = new double[residuals.length];
        if (residuals.length == 0) {
            return answer;
        }
        double[] absolute = new double[residuals.length];
        for (int i = 0; i < residuals.length; i++) {
            absolute[i] = Math.abs(residuals[i]);
        }
        double scale = SCALE_MULTIPLIER * Quantiles.median(absolute);
        for (int i = 0; i < residuals.length; i++) {
            if (scale <= 0) {
                // more than half of the residuals are exactly zero
                answer[i] = (absolute[i] == 0) ? 1.0 : 0.0;
                continue;
            }
            double u = absolute[i] / scale;
            if (u <= LOWER_CUTOFF) {
                answer[i] = 1.0;
            } else if (u <= UPPER_CUTOFF) {
                double t = 1 - u * u;
                answer[i] = t * t;
            } else {
                answer[i] = 0.0;
            }
        }
        return answer;
    }

    /**
     * Starting weights for the first decomposition pass, taken from the
     * residuals against a short running median. An isolated spike is
     * down-weighted before it can leak into the seasonal estimate of its phase.
     *
     * @param values the observed series
     * @param width  width of the running median
     * @return one weight per observation
     */
    public static double[] fromRunningMedian(double[] values, int width) {
        double[] median = Quantiles.runningMedian(values, width);
        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - median[i];
        }
        return bisquare(residuals);
    }
}
