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
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Getter;

import com.anomalydiagnostics.inputtypes.GroupKey;

/**
 * Result of one detection call: the processed groups in order of first
 * appearance and the groups that failed.
 */
@Getter
public class DiagnosticsResult {

    private final List<String> groupColumns;

    private final List<GroupResult> groups;

    private final List<GroupFailure> failures;

    public DiagnosticsResult(List<String> groupColumns, List<GroupResult> groups, List<GroupFailure> failures) {
        this.groupColumns = Collections.unmodifiableList(new ArrayList<>(groupColumns));
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    /**
     * @return the output rows, group by group, each group in input order
     */
    public List<AnomalyRecord> getRecords() {
        List<AnomalyRecord> records = new ArrayList<>();
        for (GroupResult group : groups) {
            records.addAll(group.getRecords());
        }
        return records;
    }

    public List<AnomalyRecord> getAnomalies() {
        return getRecords().stream().filter(AnomalyRecord::isAnomaly).collect(Collectors.toList());
    }

    public Optional<GroupResult> getGroup(GroupKey key) {
        return groups.stream().filter(g -> g.getKey().equals(key)).findFirst();
    }

    public Optional<GroupFailure> getFailure(GroupKey key) {
        return failures.stream().filter(f -> f.getKey().equals(key)).findFirst();
    }

    /**
     * @return true if some groups were excluded because they failed
     */
    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
