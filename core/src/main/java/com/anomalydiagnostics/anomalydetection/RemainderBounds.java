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

import java.util.Locale;

import lombok.Getter;

/**
 * Acceptance band of one group's remainder, together with the statistics it
 * was derived from.
 */
@Getter
public class RemainderBounds {

    private final double median;

    private final double firstQuartile;

    private final double thirdQuartile;

    private final double factor;

    private final double lower;

    private final double upper;

    public RemainderBounds(double median, double firstQuartile, double thirdQuartile, double factor) {
        this.median = median;
        this.firstQuartile = firstQuartile;
        this.thirdQuartile = thirdQuartile;
        this.factor = factor;
        double iqr = thirdQuartile - firstQuartile;
        this.lower = firstQuartile - factor * iqr;
        this.upper = thirdQuartile + factor * iqr;
    }

    public double getIqr() {
        return thirdQuartile - firstQuartile;
    }

    public double getWidth() {
        return upper - lower;
    }

    /**
     * @param value a remainder value
     * @return true if the value lies strictly outside the band
     */
    public boolean isOutside(double value) {
        return value < lower || value > upper;
    }

    /**
     * @param value a remainder value
     * @return how far the value lies beyond the nearest bound, 0 inside the band
     */
    public double distanceOutside(double value) {
        if (value > upper) {
            return value - upper;
        }
        if (value < lower) {
            return lower - value;
        }
        return 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%.6g, %.6g] (median %.6g, iqr %.6g, factor %.4g)", lower, upper, median,
                getIqr(), factor);
    }
}
