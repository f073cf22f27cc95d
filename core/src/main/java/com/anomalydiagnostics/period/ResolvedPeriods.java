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

package com.anomalydiagnostics.period;

import java.util.Locale;

import lombok.Getter;

import com.anomalydiagnostics.config.TimeScale;

/**
 * The concrete window lengths used for one group, in number of observations.
 */
@Getter
public class ResolvedPeriods {

    // observations per seasonal cycle; 1 means no seasonal component
    private final int frequency;

    // odd length of the trend smoothing window
    private final int trend;

    private final TimeScale timeScale;

    // median gap between observations
    private final double intervalSeconds;

    // true if the requested frequency did not fit the series and the
    // decomposition fell back to trend only
    private final boolean frequencyFallback;

    public ResolvedPeriods(int frequency, int trend, TimeScale timeScale, double intervalSeconds,
            boolean frequencyFallback) {
        this.frequency = frequency;
        this.trend = trend;
        this.timeScale = timeScale;
        this.intervalSeconds = intervalSeconds;
        this.frequencyFallback = frequencyFallback;
    }

    @Override
    public String toString() {
        return String.format("frequency = %d observations, trend = %d observations (%s scale%s)", frequency, trend,
                timeScale.name().toLowerCase(Locale.ROOT), frequencyFallback ? ", trend only" : "");
    }
}
