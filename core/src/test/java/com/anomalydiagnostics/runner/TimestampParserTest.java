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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.Test;

import com.anomalydiagnostics.exceptions.MalformedInputException;

public class TimestampParserTest {

    @Test
    public void testAcceptedFormats() {
        Instant expected = Instant.parse("2021-03-01T10:15:30Z");
        assertEquals(expected, TimestampParser.parse("2021-03-01T10:15:30Z"));
        assertEquals(expected, TimestampParser.parse("2021-03-01T12:15:30+02:00"));
        assertEquals(expected, TimestampParser.parse(" 2021-03-01T10:15:30 "));
        assertEquals(Instant.parse("2021-03-01T00:00:00Z"), TimestampParser.parse("2021-03-01"));
    }

    @Test
    public void testRejectedFormats() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TimestampParser.parse("03/01/2021"));
        assertEquals(DateTimeParseException.class, e.getCause().getClass());
        assertThrows(MalformedInputException.class, () -> TimestampParser.parse(""));
    }
}
