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

package com.anomalydiagnostics.inputtypes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * One input row: the values of the grouping columns (if any), a timestamp and a
 * numeric value. Rows are not validated on construction; the
 * {@link DiagnosticsInput} checks the whole table before any group is processed.
 */
@Getter
public class TimeSeriesRow {

    private final List<String> groupValues;

    private final Instant timestamp;

    // boxed so that a missing value reaches validation instead of failing here
    private final Double value;

    public TimeSeriesRow(List<String> groupValues, Instant timestamp, Double value) {
        this.groupValues = (groupValues == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(groupValues));
        this.timestamp = timestamp;
        this.value = value;
    }

    public static TimeSeriesRow of(Instant timestamp, double value) {
        return new TimeSeriesRow(Collections.emptyList(), timestamp, value);
    }

    public static TimeSeriesRow of(LocalDate date, double value) {
        return of(date.atStartOfDay().toInstant(ZoneOffset.UTC), value);
    }

    public static TimeSeriesRow of(LocalDateTime dateTime, double value) {
        return of(dateTime.toInstant(ZoneOffset.UTC), value);
    }

    public static TimeSeriesRow of(List<String> groupValues, Instant timestamp, double value) {
        return new TimeSeriesRow(groupValues, timestamp, value);
    }
}
