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

package com.anomalydiagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.TimeSeriesRow;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.testutils.SeasonalTestData;
import com.anomalydiagnostics.testutils.SeriesWithAnomalies;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class GroupedDiagnosticsBenchmark {

    public final static int NUMBER_OF_GROUPS = 64;

    public final static int GROUP_LENGTH = 365;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        DiagnosticsInput input;
        AnomalyDiagnostics diagnostics;

        @Setup(Level.Trial)
        public void setUpData() {
            List<TimeSeriesRow> rows = new ArrayList<>(NUMBER_OF_GROUPS * GROUP_LENGTH);
            for (int group = 0; group < NUMBER_OF_GROUPS; group++) {
                SeriesWithAnomalies series = SeasonalTestData.getSeasonalData(SeasonalTestData.daily(GROUP_LENGTH), 7,
                        100.0 + group, 10.0, 2.0, 0.02, 5.0, group);
                List<String> key = Collections.singletonList("group" + group);
                for (int i = 0; i < GROUP_LENGTH; i++) {
                    rows.add(TimeSeriesRow.of(key, series.timestamps[i], series.data[i]));
                }
            }
            input = DiagnosticsInput.grouped(rows, Collections.singletonList("group"));
            diagnostics = AnomalyDiagnostics.builder().parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @Benchmark
    @OperationsPerInvocation(NUMBER_OF_GROUPS)
    public DiagnosticsResult detect(BenchmarkState state) {
        return state.diagnostics.detect(state.input);
    }
}
