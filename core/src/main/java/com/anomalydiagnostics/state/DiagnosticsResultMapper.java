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

package com.anomalydiagnostics.state;

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.anomalydiagnostics.anomalydetection.RemainderBounds;
import com.anomalydiagnostics.config.GroupStage;
import com.anomalydiagnostics.config.TimeScale;
import com.anomalydiagnostics.inputtypes.GroupKey;
import com.anomalydiagnostics.period.ResolvedPeriods;
import com.anomalydiagnostics.returntypes.AnomalyRecord;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.returntypes.Direction;
import com.anomalydiagnostics.returntypes.GroupFailure;
import com.anomalydiagnostics.returntypes.GroupResult;

/**
 * Converts a {@link DiagnosticsResult} to and from a
 * {@link DiagnosticsResultState}. Failures keep their stage, error type and
 * message; the original exception is not part of the state.
 */
@Getter
@Setter
public class DiagnosticsResultMapper implements IStateMapper<DiagnosticsResult, DiagnosticsResultState> {

    /**
     * If true, only the rows reported as anomalies are written to the state.
     * A state written this way reads back as a result holding only those rows.
     */
    private boolean anomaliesOnly = false;

    @Override
    public DiagnosticsResultState toState(DiagnosticsResult model) {
        checkNotNull(model, "model must not be null");
        DiagnosticsResultState state = new DiagnosticsResultState();
        state.setGroupColumns(new ArrayList<>(model.getGroupColumns()));
        List<GroupResultState> groups = new ArrayList<>();
        for (GroupResult group : model.getGroups()) {
            groups.add(toState(group));
        }
        state.setGroups(groups);
        List<GroupFailureState> failures = new ArrayList<>();
        for (GroupFailure failure : model.getFailures()) {
            GroupFailureState failureState = new GroupFailureState();
            failureState.setGroupValues(new ArrayList<>(failure.getKey().getValues()));
            failureState.setStage(failure.getStage().name());
            failureState.setErrorType(failure.getErrorType());
            failureState.setMessage(failure.getMessage());
            failures.add(failureState);
        }
        state.setFailures(failures);
        return state;
    }

    @Override
    public DiagnosticsResult toModel(DiagnosticsResultState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());
        List<GroupResult> groups = new ArrayList<>();
        for (GroupResultState groupState : state.getGroups()) {
            groups.add(toModel(groupState));
        }
        List<GroupFailure> failures = new ArrayList<>();
        for (GroupFailureState failureState : state.getFailures()) {
            failures.add(new GroupFailure(GroupKey.of(failureState.getGroupValues()),
                    GroupStage.valueOf(failureState.getStage()), failureState.getErrorType(),
                    failureState.getMessage()));
        }
        return new DiagnosticsResult(state.getGroupColumns(), groups, failures);
    }

    GroupResultState toState(GroupResult group) {
        GroupResultState state = new GroupResultState();
        state.setGroupValues(new ArrayList<>(group.getKey().getValues()));

        ResolvedPeriods periods = group.getPeriods();
        ResolvedPeriodsState periodsState = new ResolvedPeriodsState();
        periodsState.setFrequency(periods.getFrequency());
        periodsState.setTrend(periods.getTrend());
        periodsState.setTimeScale(periods.getTimeScale().name());
        periodsState.setIntervalSeconds(periods.getIntervalSeconds());
        periodsState.setFrequencyFallback(periods.isFrequencyFallback());
        state.setPeriods(periodsState);

        RemainderBounds bounds = group.getBounds();
        RemainderBoundsState boundsState = new RemainderBoundsState();
        boundsState.setMedian(bounds.getMedian());
        boundsState.setFirstQuartile(bounds.getFirstQuartile());
        boundsState.setThirdQuartile(bounds.getThirdQuartile());
        boundsState.setFactor(bounds.getFactor());
        boundsState.setLower(bounds.getLower());
        boundsState.setUpper(bounds.getUpper());
        state.setBounds(boundsState);

        List<AnomalyRecordState> records = new ArrayList<>();
        for (AnomalyRecord record : group.getRecords()) {
            if (!anomaliesOnly || record.isAnomaly()) {
                records.add(toState(record));
            }
        }
        state.setRecords(records);
        return state;
    }

    AnomalyRecordState toState(AnomalyRecord record) {
        AnomalyRecordState state = new AnomalyRecordState();
        state.setRowIndex(record.getRowIndex());
        state.setTimestamp(record.getTimestamp().toString());
        state.setObserved(record.getObserved());
        state.setSeasonal(record.getSeasonal());
        state.setTrend(record.getTrend());
        state.setRemainder(record.getRemainder());
        state.setSeasadj(record.getSeasonallyAdjusted());
        state.setRemainderLowerBound(record.getRemainderLowerBound());
        state.setRemainderUpperBound(record.getRemainderUpperBound());
        state.setRecomposedL1(record.getRecomposedLowerBound());
        state.setRecomposedL2(record.getRecomposedUpperBound());
        state.setIsAnomaly(record.getAnomalyLabel());
        state.setDirection(record.getDirection().label());
        return state;
    }

    GroupResult toModel(GroupResultState state) {
        GroupKey key = GroupKey.of(state.getGroupValues());
        ResolvedPeriodsState periodsState = state.getPeriods();
        ResolvedPeriods periods = new ResolvedPeriods(periodsState.getFrequency(), periodsState.getTrend(),
                TimeScale.valueOf(periodsState.getTimeScale()), periodsState.getIntervalSeconds(),
                periodsState.isFrequencyFallback());
        RemainderBoundsState boundsState = state.getBounds();
        RemainderBounds bounds = new RemainderBounds(boundsState.getMedian(), boundsState.getFirstQuartile(),
                boundsState.getThirdQuartile(), boundsState.getFactor());
        List<AnomalyRecord> records = new ArrayList<>();
        for (AnomalyRecordState recordState : state.getRecords()) {
            records.add(new AnomalyRecord(key, recordState.getRowIndex(), Instant.parse(recordState.getTimestamp()),
                    recordState.getObserved(), recordState.getSeasonal(), recordState.getTrend(),
                    recordState.getRemainder(), recordState.getRemainderLowerBound(),
                    recordState.getRemainderUpperBound(), AnomalyRecord.YES.equals(recordState.getIsAnomaly()),
                    Direction.fromLabel(recordState.getDirection())));
        }
        return new GroupResult(key, periods, bounds, records);
    }
}
