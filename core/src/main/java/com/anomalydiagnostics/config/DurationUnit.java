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

import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.Locale;

/**
 * Calendar units understood in duration strings such as "6 weeks". Months,
 * quarters and years use the average Gregorian year of 365.25 days.
 */
public enum DurationUnit {

    SECOND(1.0),

    MINUTE(60.0),

    HOUR(3_600.0),

    DAY(86_400.0),

    WEEK(604_800.0),

    MONTH(2_629_800.0),

    QUARTER(7_889_400.0),

    YEAR(31_557_600.0);

    private final double seconds;

    DurationUnit(double seconds) {
        this.seconds = seconds;
    }

    /**
     * @return the length of one unit in seconds
     */
    public double getSeconds() {
        return seconds;
    }

    /**
     * @return the singular lower case name, as used in duration strings
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a unit by its singular or plural name, ignoring case.
     *
     * @param label a name such as "week" or "Weeks"
     * @return the matching unit, or null if the name is unknown
     */
    public static DurationUnit fromLabel(String label) {
        checkNotNull(label, "label must not be null");
        String singular = label.trim().toLowerCase(Locale.ROOT);
        if (singular.endsWith("s")) {
            singular = singular.substring(0, singular.length() - 1);
        }
        for (DurationUnit unit : values()) {
            if (unit.label().equals(singular)) {
                return unit;
            }
        }
        return null;
    }
}
