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

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.anomalydiagnostics.anomalydetection.RemainderBounds;
import com.anomalydiagnostics.inputtypes.GroupKey;
import com.anomalydiagnostics.period.ResolvedPeriods;

/**
 * The output of one successfully processed group.
 */
@Getter
public class GroupResult {

    private final GroupKey key;

    private final ResolvedPeriods periods;

    private final RemainderBounds bounds;

    private final List<AnomalyRecord> records;

    public GroupResult(GroupKey key, ResolvedPeriods periods, RemainderBounds bounds, List<AnomalyRecord> records) {
        this.key = key;
        this.periods = periods;
        this.bounds = bounds;
        this.records = Collections.unmodifiableList(records);
    }

    public int getAnomalyCount() {
        int count = 0;
        for (AnomalyRecord record : records) {
            if (record.isAnomaly()) {
                count++;
            }
        }
        return count;
    }
}
