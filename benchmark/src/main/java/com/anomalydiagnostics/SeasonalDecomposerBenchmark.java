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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.anomalydiagnostics.decomposition.Decomposition;
import com.anomalydiagnostics.decomposition.SeasonalDecomposer;
import com.anomalydiagnostics.testutils.SeasonalTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class SeasonalDecomposerBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "104", "1000", "10000" })
        int length;

        @Param({ "7", "52" })
        int frequency;

        @Param({ "13", "101" })
        int trendWindow;

        double[] data;
        SeasonalDecomposer decomposer;

        @Setup(Level.Trial)
        public void setUpData() {
            data = SeasonalTestData.getSeasonalData(SeasonalTestData.daily(length), frequency, 100.0, 10.0, 2.0,
                    0.01, 5.0, 17L).data;
            decomposer = new SeasonalDecomposer();
        }
    }

    @Benchmark
    public Decomposition decompose(BenchmarkState state) {
        return state.decomposer.decompose(state.data, state.frequency, state.trendWindow);
    }
}
