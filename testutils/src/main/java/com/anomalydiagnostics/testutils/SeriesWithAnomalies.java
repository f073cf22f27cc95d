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

package com.anomalydiagnostics.testutils;

import java.time.Instant;

/**
 * A synthetic series together with the positions and sizes of the anomalies
 * injected into it.
 */
public class SeriesWithAnomalies {

    public Instant[] timestamps;
    public double[] data;
    public int[] anomalyIndices;
    public double[] anomalies;

    public SeriesWithAnomalies(Instant[] timestamps, double[] data, int[] anomalyIndices, double[] anomalies) {
        this.timestamps = timestamps;
        this.data = data;
        this.anomalyIndices = anomalyIndices;
        this.anomalies = anomalies;
    }
}
