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

package com.anomalydiagnostics.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.anomalydiagnostics.config.DurationUnit;
import com.anomalydiagnostics.config.PeriodSpec;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(PeriodSpec.auto(), parser.getFrequency());
        assertEquals(PeriodSpec.auto(), parser.getTrend());
        assertEquals(0.05, parser.getAlpha());
        assertEquals(0.2, parser.getMaxAnomalies());
        assertFalse(parser.getVerbose());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(Collections.emptyList(), parser.getGroupColumns());
        assertEquals("0", parser.getTimestampColumn());
        assertEquals("1", parser.getValueColumn());
        assertFalse(parser.getParallel());
        assertEquals(0, parser.getThreadPoolSize());
    }

    @Test
    public void testParse() {
        parser.parse("--frequency", "1 week", "--trend", "3 months", "--alpha", "0.1", "--max-anomalies", "0.05",
                "--verbose", "true", "--delimiter", "\t", "--header-row", "true", "--group-columns", "store, region",
                "--timestamp-column", "date", "--value-column", "sales", "--parallel", "true", "--thread-pool-size",
                "3");

        assertEquals(PeriodSpec.duration(1, DurationUnit.WEEK), parser.getFrequency());
        assertEquals(PeriodSpec.duration(3, DurationUnit.MONTH), parser.getTrend());
        assertEquals(0.1, parser.getAlpha());
        assertEquals(0.05, parser.getMaxAnomalies());
        assertTrue(parser.getVerbose());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(Arrays.asList("store", "region"), parser.getGroupColumns());
        assertEquals("date", parser.getTimestampColumn());
        assertEquals("sales", parser.getValueColumn());
        assertTrue(parser.getParallel());
        assertEquals(3, parser.getThreadPoolSize());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-f", "7", "-t", "29", "-a", "0.01", "-m", "0.1", "-v", "true", "-d", ";", "-g", "2", "-p",
                "true");

        assertEquals(PeriodSpec.count(7), parser.getFrequency());
        assertEquals(PeriodSpec.count(29), parser.getTrend());
        assertEquals(0.01, parser.getAlpha());
        assertEquals(0.1, parser.getMaxAnomalies());
        assertTrue(parser.getVerbose());
        assertEquals(";", parser.getDelimiter());
        assertEquals(Collections.singletonList("2"), parser.getGroupColumns());
        assertTrue(parser.getParallel());
    }
}
