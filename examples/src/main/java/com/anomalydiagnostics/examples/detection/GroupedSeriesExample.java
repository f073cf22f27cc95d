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

package com.anomalydiagnostics.examples.detection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.anomalydiagnostics.AnomalyDiagnostics;
import com.anomalydiagnostics.examples.Example;
import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.TimeSeriesRow;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.returntypes.GroupFailure;
import com.anomalydiagnostics.returntypes.GroupResult;
import com.anomalydiagnostics.testutils.SeasonalTestData;
import com.anomalydiagnostics.testutils.SeriesWithAnomalies;

/**
 * Daily sales of several stores, one of which opened only recently. The stores
 * are processed in parallel; the new store is reported as a failure while the
 * others produce results.
 */
public class GroupedSeriesExample implements Example {

    public static void main(String[] args) throws Exception {
        new GroupedSeriesExample().run();
    }

    @Override
    public String command() {
        return "grouped";
    }

    @Override
    public String description() {
        return "detect anomalies per store in daily data, in parallel, with one store too short to analyze";
    }

    @Override
    public void run() throws Exception {
        int stores = 6;
        int days = 120;
        List<TimeSeriesRow> rows = new ArrayList<>();
        for (int store = 0; store < stores; store++) {
            SeriesWithAnomalies series = SeasonalTestData.getSeasonalData(SeasonalTestData.daily(days), 7,
                    100.0 * (store + 1), 10.0, 2.0, 0.03, 5.0, store);
            for (int i = 0; i < days; i++) {
                rows.add(TimeSeriesRow.of(Arrays.asList("store" + store, "north"), series.timestamps[i],
                        series.data[i]));
            }
        }
        // ten days are less than two weekly cycles
        double[] opening = SeasonalTestData.seasonal(10, 7, 50.0, 5.0, 1.0, 99L);
        Instant[] openingDays = SeasonalTestData.daily(opening.length);
        for (int i = 0; i < opening.length; i++) {
            rows.add(TimeSeriesRow.of(Arrays.asList("store" + stores, "south"), openingDays[i], opening[i]));
        }

        DiagnosticsInput input = DiagnosticsInput.grouped(rows, Arrays.asList("store", "region"));
        // a literal count of observations is never shortened to fit a short group
        DiagnosticsResult parallel = AnomalyDiagnostics.builder().frequency("7").parallelExecutionEnabled(true)
                .threadPoolSize(4).build().detect(input);
        DiagnosticsResult sequential = AnomalyDiagnostics.builder().frequency("7").build().detect(input);

        for (GroupResult group : parallel.getGroups()) {
            System.out.printf("%s: frequency = %d, trend = %d, anomalies = %d%n", group.getKey().label(),
                    group.getPeriods().getFrequency(), group.getPeriods().getTrend(), group.getAnomalyCount());
        }
        for (GroupFailure failure : parallel.getFailures()) {
            System.out.println(failure.describe());
        }

        if (parallel.getGroups().size() != stores || parallel.getFailures().size() != 1) {
            throw new IllegalStateException("expected " + stores + " results and a single failure");
        }
        if (parallel.getAnomalies().size() != sequential.getAnomalies().size()) {
            throw new IllegalStateException("parallel and sequential runs disagree");
        }

        System.out.println("Looks good!");
    }
}
