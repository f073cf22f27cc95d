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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.anomalydiagnostics.config.PeriodSpec;
import com.anomalydiagnostics.config.TimeScale;
import com.anomalydiagnostics.exceptions.InsufficientDataException;
import com.anomalydiagnostics.exceptions.InvalidPeriodSpecException;
import com.anomalydiagnostics.testutils.SeasonalTestData;

public class PeriodResolverTest {

    private PeriodResolver resolver;

    @BeforeEach
    public void setUp() {
        resolver = new PeriodResolver();
    }

    @Test
    public void testAutoWeekly() {
        ResolvedPeriods periods = resolver.resolve("weekly", SeasonalTestData.weekly(104), PeriodSpec.auto(),
                PeriodSpec.auto());
        assertEquals(TimeScale.WEEK, periods.getTimeScale());
        // one quarter is 13.04 weeks, one year 52.18 weeks rounded up to odd
        assertEquals(13, periods.getFrequency());
        assertEquals(53, periods.getTrend());
        assertFalse(periods.isFrequencyFallback());
        assertEquals(604800.0, periods.getIntervalSeconds());
    }

    @Test
    public void testAutoDaily() {
        ResolvedPeriods periods = resolver.resolve("daily", SeasonalTestData.daily(365), PeriodSpec.auto(),
                PeriodSpec.auto());
        assertEquals(TimeScale.DAY, periods.getTimeScale());
        assertEquals(7, periods.getFrequency());
        assertEquals(91, periods.getTrend());
    }

    @Test
    public void testAutoHourly() {
        ResolvedPeriods periods = resolver.resolve("hourly", SeasonalTestData.hourly(24 * 30), PeriodSpec.auto(),
                PeriodSpec.auto());
        assertEquals(TimeScale.HOUR, periods.getTimeScale());
        assertEquals(24, periods.getFrequency());
        // 730.5 hours round to 731, already odd
        assertEquals(731, periods.getTrend());
    }

    @Test
    public void testDurationSpecs() {
        ResolvedPeriods periods = resolver.resolve("daily", SeasonalTestData.daily(100), PeriodSpec.parse("2 weeks"),
                PeriodSpec.parse("30 days"));
        assertEquals(14, periods.getFrequency());
        assertEquals(31, periods.getTrend());
    }

    @Test
    public void testCountSpecsAreLiteral() {
        ResolvedPeriods periods = resolver.resolve("weekly", SeasonalTestData.weekly(3), PeriodSpec.count(52),
                PeriodSpec.count(4));
        assertEquals(52, periods.getFrequency());
        assertEquals(5, periods.getTrend());
        assertFalse(periods.isFrequencyFallback());
    }

    @Test
    public void testMinimumTrendWindow() {
        ResolvedPeriods periods = resolver.resolve("daily", SeasonalTestData.daily(30), PeriodSpec.count(2),
                PeriodSpec.count(1));
        assertEquals(PeriodResolver.MINIMUM_TREND_WINDOW, periods.getTrend());
    }

    @Test
    public void testFallbackWhenFrequencyTooLong() {
        ResolvedPeriods periods = resolver.resolve("short", SeasonalTestData.daily(10), PeriodSpec.auto(),
                PeriodSpec.auto());
        assertEquals(1, periods.getFrequency());
        assertTrue(periods.isFrequencyFallback());

        periods = resolver.resolve("short", SeasonalTestData.daily(13), PeriodSpec.parse("1 week"),
                PeriodSpec.auto());
        assertEquals(1, periods.getFrequency());
        assertTrue(periods.isFrequencyFallback());

        periods = resolver.resolve("exact", SeasonalTestData.daily(14), PeriodSpec.parse("1 week"),
                PeriodSpec.auto());
        assertEquals(7, periods.getFrequency());
        assertFalse(periods.isFrequencyFallback());
    }

    @Test
    public void testResolveFrequencyThrows() {
        assertThrows(InvalidPeriodSpecException.class,
                () -> resolver.resolveFrequency(PeriodSpec.parse("1 week"), TimeScale.DAY, 86400.0, 13));
    }

    @Test
    public void testShortDurationsAreAtLeastTwo() {
        assertEquals(PeriodResolver.MINIMUM_DURATION_COUNT,
                resolver.resolveFrequency(PeriodSpec.parse("1 hour"), TimeScale.DAY, 86400.0, 100));
    }

    @Test
    public void testTooFewObservations() {
        assertThrows(InsufficientDataException.class, () -> resolver.resolve("single",
                new Instant[] { SeasonalTestData.DEFAULT_START }, PeriodSpec.auto(), PeriodSpec.auto()));
    }

    @Test
    public void testMedianInterval() {
        Instant start = SeasonalTestData.DEFAULT_START;
        Instant[] timestamps = new Instant[] { start, start.plus(Duration.ofDays(1)), start.plus(Duration.ofDays(2)),
                start.plus(Duration.ofDays(9)), start.plus(Duration.ofDays(10)) };
        assertEquals(86400.0, PeriodResolver.medianIntervalSeconds(timestamps));
        assertEquals(0.5, PeriodResolver.medianIntervalSeconds(
                new Instant[] { start, start.plusMillis(500), start.plusMillis(1000) }));
    }
}
