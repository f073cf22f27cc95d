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

package com.anomalydiagnostics.returntypes;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Columns of the output table that follow the group columns, in output order.
 */
public enum OutputColumn {

    TIMESTAMP("timestamp", r -> r.getTimestamp().toString()),

    OBSERVED("observed", r -> number(r.getObserved())),

    SEASONAL("seasonal", r -> number(r.getSeasonal())),

    TREND("trend", r -> number(r.getTrend())),

    REMAINDER("remainder", r -> number(r.getRemainder())),

    SEASADJ("seasadj", r -> number(r.getSeasonallyAdjusted())),

    REMAINDER_LOWER_BOUND("remainder_lower_bound", r -> number(r.getRemainderLowerBound())),

    REMAINDER_UPPER_BOUND("remainder_upper_bound", r -> number(r.getRemainderUpperBound())),

    RECOMPOSED_L1("recomposed_l1", r -> number(r.getRecomposedLowerBound())),

    RECOMPOSED_L2("recomposed_l2", r -> number(r.getRecomposedUpperBound())),

    IS_ANOMALY("is_anomaly", AnomalyRecord::getAnomalyLabel),

    DIRECTION("direction", r -> r.getDirection().label());

    private final String columnName;

    private final Function<AnomalyRecord, String> formatter;

    OutputColumn(String columnName, Function<AnomalyRecord, String> formatter) {
        this.columnName = columnName;
        this.formatter = formatter;
    }

    public String columnName() {
        return columnName;
    }

    public String format(AnomalyRecord record) {
        return formatter.apply(record);
    }

    /**
     * @param groupColumns names of the group columns
     * @return the complete header row
     */
    public static List<String> header(List<String> groupColumns) {
        List<String> header = new ArrayList<>(groupColumns);
        for (OutputColumn column : values()) {
            header.add(column.columnName);
        }
        return header;
    }

    static String number(double value) {
        return Double.toString(value);
    }
}
