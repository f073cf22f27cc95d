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

package com.anomalydiagnostics.examples.serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.anomalydiagnostics.AnomalyDiagnostics;
import com.anomalydiagnostics.examples.Example;
import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.TimeSeriesRow;
import com.anomalydiagnostics.returntypes.AnomalyRecord;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.serialize.DiagnosticsResultSerDe;
import com.anomalydiagnostics.testutils.SeasonalTestData;
import com.anomalydiagnostics.testutils.SeriesWithAnomalies;

/**
 * Serialize a diagnostics result to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a diagnostics result as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Detect anomalies in two weeks of hourly data

        int hours = 24 * 14;
        SeriesWithAnomalies series = SeasonalTestData.getSeasonalData(SeasonalTestData.hourly(hours), 24, 20.0, 4.0,
                0.5, 0.01, 3.0, 17L);
        List<TimeSeriesRow> rows = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            rows.add(TimeSeriesRow.of(Collections.singletonList("sensor-1"), series.timestamps[i], series.data[i]));
        }
        DiagnosticsResult result = AnomalyDiagnostics.builder().build()
                .detect(DiagnosticsInput.grouped(rows, Collections.singletonList("sensor")));

        // Convert to JSON and print the number of bytes

        DiagnosticsResultSerDe serDe = new DiagnosticsResultSerDe();
        String json = serDe.toJson(result);
        System.out.printf("rows = %d, anomalies = %d%n", result.getRecords().size(), result.getAnomalies().size());
        System.out.printf("JSON size = %d bytes%n", json.getBytes().length);

        // Restore from JSON and compare the two results

        DiagnosticsResult restored = serDe.fromJson(json);
        List<AnomalyRecord> expected = result.getRecords();
        List<AnomalyRecord> actual = restored.getRecords();
        if (expected.size() != actual.size()) {
            throw new IllegalStateException("restored result has a different number of rows");
        }
        for (int i = 0; i < expected.size(); i++) {
            if (expected.get(i).isAnomaly() != actual.get(i).isAnomaly()
                    || expected.get(i).getRemainder() != actual.get(i).getRemainder()) {
                throw new IllegalStateException("restored result does not agree with original result at row " + i);
            }
        }

        System.out.println("Looks good!");
    }
}
