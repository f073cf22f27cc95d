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

package com.anomalydiagnostics.config;

/**
 * Classification of a series by its median sampling interval, together with the
 * default frequency and trend used when either is requested as "auto".
 */
public enum TimeScale {

    SECOND(60.0, "1 hour", "12 hours"),

    MINUTE(3_600.0, "1 day", "14 days"),

    HOUR(86_400.0, "1 day", "1 month"),

    DAY(604_800.0, "1 week", "3 months"),

    WEEK(2_678_400.0, "1 quarter", "1 year"),

    MONTH(7_948_800.0, "1 year", "5 years"),

    QUARTER(31_795_200.0, "1 year", "10 years"),

    YEAR(Double.POSITIVE_INFINITY, "5 years", "30 years");

    // exclusive upper bound of the median interval in seconds
    private final double intervalLimit;

    private final PeriodSpec defaultFrequency;

    private final PeriodSpec defaultTrend;

    TimeScale(double intervalLimit, String defaultFrequency, String defaultTrend) {
        this.intervalLimit = intervalLimit;
        this.defaultFrequency = PeriodSpec.parse(defaultFrequency);
        this.defaultTrend = PeriodSpec.parse(defaultTrend);
    }

    public PeriodSpec getDefaultFrequency() {
        return defaultFrequency;
    }

    public PeriodSpec getDefaultTrend() {
        return defaultTrend;
    }

    /**
     * @param intervalSeconds the median gap between consecutive observations
     * @return the time scale of a series sampled at that interval
     */
    public static TimeScale classify(double intervalSeconds) {
        for (TimeScale scale : values()) {
            if (intervalSeconds < scale.intervalLimit) {
                return scale;
            }
        }
        return YEAR;
    }
}
