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

import java.util.ArrayList;
import java.util.List;

import com.anomalydiagnostics.AnomalyDiagnostics;
import com.anomalydiagnostics.examples.Example;
import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.TimeSeriesRow;
import com.anomalydiagnostics.returntypes.AnomalyRecord;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.returntypes.GroupResult;
import com.anomalydiagnostics.testutils.SeasonalTestData;
import com.anomalydiagnostics.testutils.SeriesWithAnomalies;
import com.anomalydiagnostics.util.Quantiles;

/**
 * Two years of weekly observations with a yearly cycle and a single spike.
 * The spike is the only observation reported as an anomaly.
 */
public class WeeklySpikeExample implements Example {

    public static void main(String[] args) throws Exception {
        new WeeklySpikeExample().run();
    }

    @Override
    public String command() {
        return "weekly_spike";
    }

    @Override
    public String description() {
        return "find a single spike in two years of weekly data with a yearly cycle";
    }

    @Override
    public void run() throws Exception {
        int weeks = 104;
        int spikeIndex = 60;
        double[] data = SeasonalTestData.seasonal(weeks, 52, 50.0, 10.0, 1.0, 42L);
        // the spike sits ten interquartile ranges above the median
        double[] q = Quantiles.quantiles(data, 0.25, 0.5, 0.75);
        double spike = q[1] + 10 * (q[2] - q[0]);
        SeriesWithAnomalies series = SeasonalTestData.withSpike(SeasonalTestData.weekly(weeks), data, spikeIndex,
                spike - data[spikeIndex]);

        List<TimeSeriesRow> rows = new ArrayList<>(weeks);
        for (int i = 0; i < weeks; i++) {
            rows.add(TimeSeriesRow.of(series.timestamps[i], series.data[i]));
        }

        // a yearly cycle of weekly data; "auto" would pick a quarter
        AnomalyDiagnostics diagnostics = AnomalyDiagnostics.builder().frequency("52").verbose(true).build();
        DiagnosticsResult result = diagnostics.detect(DiagnosticsInput.ungrouped(rows));

        GroupResult group = result.getGroups().get(0);
        System.out.printf("frequency = %d, trend = %d, bounds = %s%n", group.getPeriods().getFrequency(),
                group.getPeriods().getTrend(), group.getBounds());
        for (AnomalyRecord record : result.getAnomalies()) {
            System.out.printf("%s observed = %.2f expected range = [%.2f, %.2f] direction = %s%n",
                    record.getTimestamp(), record.getObserved(), record.getRecomposedLowerBound(),
                    record.getRecomposedUpperBound(), record.getDirection().label());
        }

        List<AnomalyRecord> anomalies = result.getAnomalies();
        if (anomalies.size() != 1 || anomalies.get(0).getRowIndex() != spikeIndex) {
            throw new IllegalStateException("expected only the spike at week " + spikeIndex + " to be reported");
        }

        System.out.println("Looks good!");
    }
}
