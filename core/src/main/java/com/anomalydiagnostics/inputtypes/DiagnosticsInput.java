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

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.anomalydiagnostics.exceptions.MalformedInputException;

/**
 * The input table, tagged with its shape. Ungrouped input is a single series;
 * grouped input carries the names of the grouping columns and every row holds
 * one value per grouping column. Either way the detection pipeline only sees
 * the list of {@link GroupSeries} produced by {@link #toGroups()}.
 */
@Getter
public class DiagnosticsInput {

    private final InputShape shape;

    private final List<String> groupColumns;

    private final List<TimeSeriesRow> rows;

    private DiagnosticsInput(InputShape shape, List<String> groupColumns, List<TimeSeriesRow> rows) {
        this.shape = shape;
        this.groupColumns = groupColumns;
        this.rows = rows;
    }

    public static DiagnosticsInput ungrouped(List<TimeSeriesRow> rows) {
        checkNotNull(rows, "rows must not be null");
        return new DiagnosticsInput(InputShape.UNGROUPED, Collections.emptyList(),
                Collections.unmodifiableList(new ArrayList<>(rows)));
    }

    public static DiagnosticsInput grouped(List<TimeSeriesRow> rows, List<String> groupColumns) {
        checkNotNull(rows, "rows must not be null");
        checkNotNull(groupColumns, "groupColumns must not be null");
        checkArgument(!groupColumns.isEmpty(), "grouped input needs at least one group column");
        return new DiagnosticsInput(InputShape.GROUPED, Collections.unmodifiableList(new ArrayList<>(groupColumns)),
                Collections.unmodifiableList(new ArrayList<>(rows)));
    }

    /**
     * Validates the table and splits it into one series per group key, in order
     * of first appearance of each key.
     *
     * @return the groups
     * @throws MalformedInputException if a row lacks a timestamp or a finite
     *                                 value, carries the wrong number of group
     *                                 values or a missing one, or if the timestamps of a group are
     *                                 not strictly increasing
     */
    public List<GroupSeries> toGroups() {
        if (rows.isEmpty()) {
            throw new MalformedInputException("input contains no rows");
        }
        Map<GroupKey, List<Integer>> positions = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            TimeSeriesRow row = rows.get(i);
            if (row == null) {
                throw new MalformedInputException("row " + i + " is missing");
            }
            if (row.getTimestamp() == null) {
                throw new MalformedInputException("row " + i + " has no timestamp");
            }
            if (row.getValue() == null || !Double.isFinite(row.getValue())) {
                throw new MalformedInputException("row " + i + " has a non numeric value: " + row.getValue());
            }
            if (row.getGroupValues().size() != groupColumns.size()) {
                throw new MalformedInputException(String.format("row %d has %d group values, expected %d", i,
                        row.getGroupValues().size(), groupColumns.size()));
            }
            if (row.getGroupValues().contains(null)) {
                throw new MalformedInputException("row " + i + " has a missing group value");
            }
            positions.computeIfAbsent(GroupKey.of(row.getGroupValues()), k -> new ArrayList<>()).add(i);
        }

        List<GroupSeries> groups = new ArrayList<>(positions.size());
        for (Map.Entry<GroupKey, List<Integer>> entry : positions.entrySet()) {
            List<Integer> indices = entry.getValue();
            Instant[] timestamps = new Instant[indices.size()];
            double[] values = new double[indices.size()];
            int[] rowIndices = new int[indices.size()];
            for (int j = 0; j < indices.size(); j++) {
                TimeSeriesRow row = rows.get(indices.get(j));
                timestamps[j] = row.getTimestamp();
                values[j] = row.getValue();
                rowIndices[j] = indices.get(j);
                if (j > 0 && !timestamps[j].isAfter(timestamps[j - 1])) {
                    String problem = timestamps[j].equals(timestamps[j - 1]) ? "duplicate timestamp"
                            : "timestamps are not increasing";
                    throw new MalformedInputException(String.format("group %s: %s at row %d (%s)", entry.getKey(),
                            problem, rowIndices[j], timestamps[j]));
                }
            }
            groups.add(new GroupSeries(entry.getKey(), timestamps, values, rowIndices));
        }
        return groups;
    }
}
