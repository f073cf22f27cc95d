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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.time.Duration;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

import com.anomalydiagnostics.config.PeriodSpec;
import com.anomalydiagnostics.config.TimeScale;
import com.anomalydiagnostics.exceptions.InsufficientDataException;
import com.anomalydiagnostics.exceptions.InvalidPeriodSpecException;
import com.anomalydiagnostics.util.Quantiles;

/**
 * Turns frequency and trend specifications into window lengths measured in
 * observations. Durations are divided by the median sampling interval of the
 * series; "auto" first picks a duration from the {@link TimeScale} of the
 * series.
 */
@Slf4j
public class PeriodResolver {

    public static final int MINIMUM_DURATION_COUNT = 2;

    public static final int MINIMUM_TREND_WINDOW = 3;

    /**
     * Resolves both periods for one series. A frequency given as "auto" or as a
     * duration that does not fit twice into the series is replaced by 1 (trend
     * only decomposition). A frequency given as a count is kept as is; the
     * decomposer rejects it if the series is too short.
     *
     * @param groupLabel    label used in log messages
     * @param timestamps    strictly increasing timestamps of the series
     * @param frequencySpec the requested seasonal frequency
     * @param trendSpec     the requested trend window
     * @return the resolved periods
     * @throws InsufficientDataException if the series has fewer than two
     *                                   observations
     */
    public ResolvedPeriods resolve(String groupLabel, Instant[] timestamps, PeriodSpec frequencySpec,
            PeriodSpec trendSpec) {
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(frequencySpec, "frequency specification must not be null");
        checkNotNull(trendSpec, "trend specification must not be null");
        if (timestamps.length < 2) {
            throw new InsufficientDataException(String.format(
                    "group %s has %d observation(s), at least 2 are needed to infer the sampling interval", groupLabel,
                    timestamps.length));
        }
        double interval = medianIntervalSeconds(timestamps);
        TimeScale scale = TimeScale.classify(interval);

        int frequency;
        boolean fallback = false;
        if (frequencySpec.getKind() == PeriodSpec.Kind.COUNT) {
            frequency = frequencySpec.getCount();
        } else {
            try {
                frequency = resolveFrequency(frequencySpec, scale, interval, timestamps.length);
            } catch (InvalidPeriodSpecException e) {
                log.warn("group {}: {}; decomposing without a seasonal component", groupLabel, e.getMessage());
                frequency = 1;
                fallback = true;
            }
        }
        int trend = resolveTrend(trendSpec, scale, interval);
        return new ResolvedPeriods(frequency, trend, scale, interval, fallback);
    }

    /**
     * @param spec     the frequency specification
     * @param scale    time scale of the series, used for "auto"
     * @param interval median sampling interval in seconds
     * @param length   number of observations in the series
     * @return the number of observations in one seasonal cycle
     * @throws InvalidPeriodSpecException if the cycle is longer than half the
     *                                    series
     */
    public int resolveFrequency(PeriodSpec spec, TimeScale scale, double interval, int length) {
        int frequency = toObservations(spec, scale.getDefaultFrequency(), interval);
        if (frequency > length / 2.0) {
            throw new InvalidPeriodSpecException(String.format(
                    "frequency %s resolves to %d observations, more than half of the %d available", spec, frequency,
                    length));
        }
        return frequency;
    }

    /**
     * @param spec     the trend specification
     * @param scale    time scale of the series, used for "auto"
     * @param interval median sampling interval in seconds
     * @return an odd trend window of at least {@link #MINIMUM_TREND_WINDOW}
     *         observations
     */
    public int resolveTrend(PeriodSpec spec, TimeScale scale, double interval) {
        int trend = toObservations(spec, scale.getDefaultTrend(), interval);
        if (trend % 2 == 0) {
            trend++;
        }
        return Math.max(MINIMUM_TREND_WINDOW, trend);
    }

    int toObservations(PeriodSpec spec, PeriodSpec autoDefault, double interval) {
        PeriodSpec effective = (spec.getKind() == PeriodSpec.Kind.AUTO) ? autoDefault : spec;
        if (effective.getKind() == PeriodSpec.Kind.COUNT) {
            return effective.getCount();
        }
        checkArgument(interval > 0, "sampling interval must be positive");
        long count = Math.round(effective.toSeconds() / interval);
        return (int) Math.max(MINIMUM_DURATION_COUNT, Math.min(Integer.MAX_VALUE, count));
    }

    /**
     * @param timestamps strictly increasing timestamps, at least two
     * @return the median gap between consecutive timestamps in seconds
     */
    public static double medianIntervalSeconds(Instant[] timestamps) {
        checkArgument(timestamps.length > 1, "at least two timestamps are needed");
        double[] gaps = new double[timestamps.length - 1];
        for (int i = 1; i < timestamps.length; i++) {
            Duration gap = Duration.between(timestamps[i - 1], timestamps[i]);
            gaps[i - 1] = gap.getSeconds() + gap.getNano() / 1e9;
        }
        return Quantiles.median(gaps);
    }
}
