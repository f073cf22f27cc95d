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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.anomalydiagnostics.exceptions.MalformedInputException;

public class DiagnosticsInputTest {

    private static Instant day(int dayOfMonth) {
        return LocalDate.of(2021, 3, dayOfMonth).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    @Test
    public void testUngrouped() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(day(1), 1.0), TimeSeriesRow.of(day(2), 2.0),
                TimeSeriesRow.of(day(3), 3.0));
        DiagnosticsInput input = DiagnosticsInput.ungrouped(rows);
        assertEquals(InputShape.UNGROUPED, input.getShape());
        List<GroupSeries> groups = input.toGroups();
        assertEquals(1, groups.size());
        assertTrue(groups.get(0).getKey().isImplicit());
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0 }, groups.get(0).getValues(), 0.0);
        assertArrayEquals(new int[] { 0, 1, 2 }, groups.get(0).getRowIndices());
    }

    @Test
    public void testGroupsInOrderOfFirstAppearance() {
        List<TimeSeriesRow> rows = new ArrayList<>();
        rows.add(TimeSeriesRow.of(Arrays.asList("b", "x"), day(1), 1.0));
        rows.add(TimeSeriesRow.of(Arrays.asList("a", "x"), day(1), 10.0));
        rows.add(TimeSeriesRow.of(Arrays.asList("b", "x"), day(2), 2.0));
        rows.add(TimeSeriesRow.of(Arrays.asList("a", "x"), day(2), 20.0));
        rows.add(TimeSeriesRow.of(Arrays.asList("b", "y"), day(1), 5.0));
        DiagnosticsInput input = DiagnosticsInput.grouped(rows, Arrays.asList("store", "region"));
        assertEquals(InputShape.GROUPED, input.getShape());

        List<GroupSeries> groups = input.toGroups();
        assertEquals(3, groups.size());
        assertEquals(GroupKey.of("b", "x"), groups.get(0).getKey());
        assertEquals(GroupKey.of("a", "x"), groups.get(1).getKey());
        assertEquals(GroupKey.of("b", "y"), groups.get(2).getKey());
        assertArrayEquals(new int[] { 0, 2 }, groups.get(0).getRowIndices());
        assertArrayEquals(new double[] { 10.0, 20.0 }, groups.get(1).getValues(), 0.0);
        assertArrayEquals(new Instant[] { day(1), day(2) }, groups.get(1).getTimestamps());
        assertEquals(1, groups.get(2).size());
    }

    @Test
    public void testLocalDatesAreUtcMidnight() {
        TimeSeriesRow row = TimeSeriesRow.of(LocalDate.of(2021, 3, 1), 1.0);
        assertEquals(Instant.parse("2021-03-01T00:00:00Z"), row.getTimestamp());
    }

    @Test
    public void testEmptyInput() {
        assertThrows(MalformedInputException.class,
                () -> DiagnosticsInput.ungrouped(Collections.emptyList()).toGroups());
    }

    @Test
    public void testMissingTimestamp() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(day(1), 1.0),
                new TimeSeriesRow(null, null, 2.0));
        assertThrows(MalformedInputException.class, () -> DiagnosticsInput.ungrouped(rows).toGroups());
    }

    @Test
    public void testNonFiniteValues() {
        for (Double value : new Double[] { null, Double.NaN, Double.POSITIVE_INFINITY }) {
            List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(day(1), 1.0),
                    new TimeSeriesRow(null, day(2), value));
            assertThrows(MalformedInputException.class, () -> DiagnosticsInput.ungrouped(rows).toGroups());
        }
    }

    @Test
    public void testDuplicateTimestampInGroup() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(day(1), 1.0), TimeSeriesRow.of(day(2), 2.0),
                TimeSeriesRow.of(day(2), 3.0));
        MalformedInputException exception = assertThrows(MalformedInputException.class,
                () -> DiagnosticsInput.ungrouped(rows).toGroups());
        assertTrue(exception.getMessage().contains("duplicate timestamp"));
    }

    @Test
    public void testDecreasingTimestamps() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(day(2), 1.0), TimeSeriesRow.of(day(1), 2.0));
        assertThrows(MalformedInputException.class, () -> DiagnosticsInput.ungrouped(rows).toGroups());
    }

    @Test
    public void testSameTimestampInDifferentGroups() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(Collections.singletonList("a"), day(1), 1.0),
                TimeSeriesRow.of(Collections.singletonList("b"), day(1), 2.0));
        assertEquals(2, DiagnosticsInput.grouped(rows, Collections.singletonList("g")).toGroups().size());
    }

    @Test
    public void testWrongNumberOfGroupValues() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(Arrays.asList("a", "b"), day(1), 1.0));
        assertThrows(MalformedInputException.class,
                () -> DiagnosticsInput.grouped(rows, Collections.singletonList("g")).toGroups());
        assertThrows(MalformedInputException.class, () -> DiagnosticsInput.ungrouped(rows).toGroups());
    }

    @Test
    public void testMissingGroupValue() {
        List<TimeSeriesRow> rows = Arrays.asList(TimeSeriesRow.of(Collections.singletonList("a"), day(1), 1.0),
                new TimeSeriesRow(Arrays.asList((String) null), day(2), 2.0));
        MalformedInputException exception = assertThrows(MalformedInputException.class,
                () -> DiagnosticsInput.grouped(rows, Collections.singletonList("g")).toGroups());
        assertTrue(exception.getMessage().contains("row 1"));
    }

    @Test
    public void testGroupedNeedsColumns() {
        assertThrows(IllegalArgumentException.class,
                () -> DiagnosticsInput.grouped(Collections.emptyList(), Collections.emptyList()));
    }
}
