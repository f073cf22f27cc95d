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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;
import static com.anomalydiagnostics.CommonUtils.checkOpenUnitInterval;

import lombok.Getter;

import com.anomalydiagnostics.util.Quantiles;

/**
 * Derives remainder bounds from the interquartile range. The band extends
 * {@code 0.15 / alpha} interquartile ranges beyond each quartile, so alpha 0.05
 * gives the familiar three IQR fences; smaller alpha widens the band.
 */
@Getter
public class IqrBoundEstimator {

    public static final double DEFAULT_ALPHA = 0.05;

    public static final double FACTOR_NUMERATOR = 0.15;

    private final double alpha;

    private final double factor;

    public IqrBoundEstimator() {
        this(DEFAULT_ALPHA);
    }

    public IqrBoundEstimator(double alpha) {
        this.alpha = checkOpenUnitInterval(alpha, "alpha");
        this.factor = iqrFactor(alpha);
    }

    public static double iqrFactor(double alpha) {
        checkOpenUnitInterval(alpha, "alpha");
        return FACTOR_NUMERATOR / alpha;
    }

    /**
     * @param remainder the remainder of one group
     * @return the bounds of the remainder
     */
    public RemainderBounds estimate(double[] remainder) {
        checkNotNull(remainder, "remainder must not be null");
        checkArgument(remainder.length > 0, "remainder must not be empty");
        double[] q = Quantiles.quantiles(remainder, 0.25, 0.5, 0.75);
        return new RemainderBounds(q[1], q[0], q[2], factor);
    }
}
