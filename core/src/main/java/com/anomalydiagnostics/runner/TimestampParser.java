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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import com.anomalydiagnostics.exceptions.MalformedInputException;

/**
 * Parses the timestamp column of delimited input. Accepted are ISO-8601
 * instants ("2021-03-01T10:15:30Z"), date-times with an offset, local
 * date-times (taken as UTC) and dates (UTC midnight).
 */
public class TimestampParser {

    private static final List<Function<String, Instant>> FORMATS = Arrays.asList(Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(), s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC));

    private TimestampParser() {
    }

    /**
     * @param text the timestamp text
     * @return the instant
     * @throws MalformedInputException if the text is in none of the accepted
     *                                 formats
     */
    public static Instant parse(String text) {
        String trimmed = text.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> format : FORMATS) {
            try {
                return format.apply(trimmed);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new MalformedInputException("not an ISO-8601 timestamp or date: '" + text + "'", last);
    }
}
