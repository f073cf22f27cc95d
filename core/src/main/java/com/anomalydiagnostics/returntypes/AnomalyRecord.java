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

package com.anomalydiagnostics.returntypes;

import java.time.Instant;

import lombok.Getter;

import com.anomalydiagnostics.inputtypes.GroupKey;

/**
 * One output row: the decomposition of an observation, the bounds of its
 * group and the anomaly verdict.
 */
@Getter
public class AnomalyRecord {

    public static final String YES = "Yes";

    public static final String NO = "No";

    private final GroupKey groupKey;

    // position of the observation in the input table
    private final int rowIndex;

    private final Instant timestamp;

    private final double observed;

    private final double seasonal;

    private final double trend;

    private final double remainder;

    private final double remainderLowerBound;

    private final double remainderUpperBound;

    private final boolean anomaly;

    private final Direction direction;

    public AnomalyRecord(GroupKey groupKey, int rowIndex, Instant timestamp, double observed, double seasonal,
            double trend, double remainder, double remainderLowerBound, double remainderUpperBound, boolean anomaly,
            Direction direction) {
        this.groupKey = groupKey;
        this.rowIndex = rowIndex;
        this.timestamp = timestamp;
        this.observed = observed;
        this.seasonal = seasonal;
        this.trend = trend;
        this.remainder = remainder;
        this.remainderLowerBound = remainderLowerBound;
        this.remainderUpperBound = remainderUpperBound;
        this.anomaly = anomaly;
        this.direction = direction;
    }

    public double getSeasonallyAdjusted() {
        return observed - seasonal;
    }

    /**
     * @return the lower remainder bound on the scale of the observations
     */
    public double getRecomposedLowerBound() {
        return trend + seasonal + remainderLowerBound;
    }

    /**
     * @return the upper remainder bound on the scale of the observations
     */
    public double getRecomposedUpperBound() {
        return trend + seasonal + remainderUpperBound;
    }

    public String getAnomalyLabel() {
        return anomaly ? YES : NO;
    }
}
