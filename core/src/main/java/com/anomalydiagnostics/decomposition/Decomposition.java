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

import lombok.Getter;

/**
 * Observed series split into seasonal, trend and remainder components, aligned
 * by position. {@code observed = seasonal + trend + remainder} holds for every
 * position up to rounding.
 */
@Getter
public class Decomposition {

    private final double[] observed;

    private final double[] seasonal;

    private final double[] trend;

    private final double[] remainder;

    public Decomposition(double[] observed, double[] seasonal, double[] trend, double[] remainder) {
        checkArgument(
                observed.length == seasonal.length && seasonal.length == trend.length
                        && trend.length == remainder.length,
                "components must have the same length");
        this.observed = observed;
        this.seasonal = seasonal;
        this.trend = trend;
        this.remainder = remainder;
    }

    public int size() {
        return observed.length;
    }

    /**
     * @return the observed series with the seasonal component removed
     */
    public double[] getSeasonallyAdjusted() {
        double[] answer = new double[observed.length];
        for (int i = 0; i < observed.length; i++) {
            answer[i] = observed[i] - seasonal[i];
        }
        return answer;
    }
}
