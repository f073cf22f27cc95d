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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.anomalydiagnostics.exceptions.InvalidPeriodSpecException;

/**
 * A user supplied period for the seasonal frequency or the trend window. A
 * specification is one of three kinds, parsed once from text:
 * <ul>
 * <li>{@link Kind#AUTO}: "auto", resolved from the time scale of the
 * series</li>
 * <li>{@link Kind#DURATION}: a magnitude and a calendar unit, e.g. "6
 * weeks"</li>
 * <li>{@link Kind#COUNT}: a literal number of observations, e.g. "52"</li>
 * </ul>
 * Everything downstream of the {@code PeriodResolver} only sees resolved
 * integer window lengths.
 */
@Getter
@EqualsAndHashCode
public final class PeriodSpec {

    public enum Kind {
        AUTO, DURATION, COUNT
    }

    public static final String AUTO_TOKEN = "auto";

    private static final Pattern COUNT_PATTERN = Pattern.compile("\\d+");

    private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-z]+)");

    private static final PeriodSpec AUTO = new PeriodSpec(Kind.AUTO, 0.0, null, 0);

    private final Kind kind;

    // only meaningful for DURATION
    private final double magnitude;

    private final DurationUnit unit;

    // only meaningful for COUNT
    private final int count;

    private PeriodSpec(Kind kind, double magnitude, DurationUnit unit, int count) {
        this.kind = kind;
        this.magnitude = magnitude;
        this.unit = unit;
        this.count = count;
    }

    public static PeriodSpec auto() {
        return AUTO;
    }

    public static PeriodSpec duration(double magnitude, DurationUnit unit) {
        checkArgument(magnitude > 0, "duration magnitude must be positive");
        checkNotNull(unit, "unit must not be null");
        return new PeriodSpec(Kind.DURATION, magnitude, unit, 0);
    }

    public static PeriodSpec count(int count) {
        checkArgument(count > 0, "count must be positive");
        return new PeriodSpec(Kind.COUNT, 0.0, null, count);
    }

    /**
     * Parses "auto", a duration string such as "6 weeks" or "1 quarter", or a
     * positive integer.
     *
     * @param text the specification
     * @return the parsed specification
     * @throws InvalidPeriodSpecException if the text matches none of the forms
     */
    public static PeriodSpec parse(String text) {
        if (text == null) {
            throw new InvalidPeriodSpecException("period specification must not be null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (AUTO_TOKEN.equals(normalized)) {
            return AUTO;
        }
        if (COUNT_PATTERN.matcher(normalized).matches()) {
            int value;
            try {
                value = Integer.parseInt(normalized);
            } catch (NumberFormatException e) {
                throw new InvalidPeriodSpecException("period count is out of range: " + text);
            }
            if (value <= 0) {
                throw new InvalidPeriodSpecException("period count must be positive: " + text);
            }
            return count(value);
        }
        Matcher matcher = DURATION_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            DurationUnit unit = DurationUnit.fromLabel(matcher.group(2));
            double magnitude = Double.parseDouble(matcher.group(1));
            if (unit == null) {
                throw new InvalidPeriodSpecException("unknown time unit in period specification: " + text);
            }
            if (magnitude <= 0) {
                throw new InvalidPeriodSpecException("period duration must be positive: " + text);
            }
            return duration(magnitude, unit);
        }
        throw new InvalidPeriodSpecException(
                "period must be 'auto', a duration such as '6 weeks' or a positive integer, found: " + text);
    }

    /**
     * @return the duration in seconds; only defined for {@link Kind#DURATION}
     */
    public double toSeconds() {
        checkArgument(kind == Kind.DURATION, "only durations have a length in seconds");
        return magnitude * unit.getSeconds();
    }

    @Override
    public String toString() {
        switch (kind) {
        case AUTO:
            return AUTO_TOKEN;
        case COUNT:
            return Integer.toString(count);
        default:
            String amount = (magnitude == Math.rint(magnitude)) ? Long.toString((long) magnitude)
                    : Double.toString(magnitude);
            return amount + " " + unit.label() + ((magnitude == 1.0) ? "" : "s");
        }
    }
}
