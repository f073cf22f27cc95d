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

import lombok.Getter;

/**
 * The series of one group, in input order, together with the position of each
 * observation in the original table. Instances are created by
 * {@link DiagnosticsInput#toGroups()} and owned by the task processing the
 * group; the arrays are never shared between groups.
 */
@Getter
public class GroupSeries {

    private final GroupKey key;

    private final Instant[] timestamps;

    private final double[] values;

    private final int[] rowIndices;

    public GroupSeries(GroupKey key, Instant[] timestamps, double[] values, int[] rowIndices) {
        checkNotNull(key, "key must not be null");
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(values, "values must not be null");
        checkNotNull(rowIndices, "rowIndices must not be null");
        checkArgument(timestamps.length == values.length && values.length == rowIndices.length,
                "timestamps, values and row indices must have the same length");
        this.key = key;
        this.timestamps = timestamps;
        this.values = values;
        this.rowIndices = rowIndices;
    }

    public int size() {
        return values.length;
    }
}
