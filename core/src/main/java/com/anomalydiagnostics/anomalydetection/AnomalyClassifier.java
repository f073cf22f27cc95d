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

import static com.anomalydiagnostics.CommonUtils.checkHalfOpenUnitInterval;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import lombok.Getter;

import com.anomalydiagnostics.returntypes.Direction;

/**
 * Flags remainder values outside their bounds and caps the number of flags per
 * group. When the cap binds, the values farthest from the band are kept; equal
 * distances keep the earlier observation.
 */
@Getter
public class AnomalyClassifier {

    public static final double DEFAULT_MAX_ANOMALIES = 0.2;

    // absorbs representation error in maxAnomalies * n, e.g. 0.1 * 30
    static final double CEILING_TOLERANCE = 1e-9;

    private final double maxAnomalies;

    public AnomalyClassifier() {
        this(DEFAULT_MAX_ANOMALIES);
    }

    public AnomalyClassifier(double maxAnomalies) {
        this.maxAnomalies = checkHalfOpenUnitInterval(maxAnomalies, "maxAnomalies");
    }

    /**
     * @param maxAnomalies the maximum anomaly fraction
     * @param n            the number of observations
     * @return the largest number of anomalies reported for n observations
     */
    public static int anomalyLimit(double maxAnomalies, int n) {
        return (int) Math.ceil(maxAnomalies * n - CEILING_TOLERANCE);
    }

    /**
     * @param remainder the remainder of one group
     * @param bounds    the bounds of that remainder
     * @return one flag per observation, true for reported anomalies
     */
    public boolean[] classify(double[] remainder, RemainderBounds bounds) {
        checkNotNull(remainder, "remainder must not be null");
        checkNotNull(bounds, "bounds must not be null");
        boolean[] flags = new boolean[remainder.length];
        List<Integer> outside = new ArrayList<>();
        for (int i = 0; i < remainder.length; i++) {
            if (bounds.isOutside(remainder[i])) {
                outside.add(i);
            }
        }
        int limit = anomalyLimit(maxAnomalies, remainder.length);
        if (outside.size() > limit) {
            // List.sort is stable, so equal distances stay in index order
            outside.sort(Comparator.comparingDouble((Integer i) -> bounds.distanceOutside(remainder[i])).reversed());
            outside = outside.subList(0, limit);
        }
        for (int i : outside) {
            flags[i] = true;
        }
        return flags;
    }

    /**
     * @param value   a remainder value
     * @param anomaly whether the value was reported as an anomaly
     * @param bounds  the bounds of the remainder
     * @return the side of the band the anomaly lies on
     */
    public static Direction directionOf(double value, boolean anomaly, RemainderBounds bounds) {
        if (!anomaly) {
            return Direction.NONE;
        }
        return (value > bounds.getUpper()) ? Direction.UP : Direction.DOWN;
    }
}
