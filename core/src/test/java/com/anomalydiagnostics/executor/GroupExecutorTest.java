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

package com.anomalydiagnostics.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.anomalydiagnostics.config.GroupStage;
import com.anomalydiagnostics.inputtypes.GroupKey;
import com.anomalydiagnostics.inputtypes.GroupSeries;
import com.anomalydiagnostics.returntypes.GroupFailure;
import com.anomalydiagnostics.returntypes.GroupOutcome;

public class GroupExecutorTest {

    static Stream<Arguments> executorProvider() {
        return Stream.of(Arguments.of(new SequentialGroupExecutor()), Arguments.of(new ParallelGroupExecutor(4)));
    }

    private static List<GroupSeries> groups(int count) {
        List<GroupSeries> groups = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            groups.add(new GroupSeries(GroupKey.of("g" + i), new Instant[0], new double[0], new int[0]));
        }
        return groups;
    }

    @ParameterizedTest
    @MethodSource("executorProvider")
    public void testOutcomesKeepGroupOrder(AbstractGroupExecutor executor) {
        Function<GroupSeries, GroupOutcome> task = series -> GroupOutcome.failure(
                new GroupFailure(series.getKey(), GroupStage.FAILED, new IllegalStateException("x")));
        List<GroupSeries> groups = groups(50);
        List<GroupOutcome> outcomes = executor.execute(groups, task);
        assertEquals(50, outcomes.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(GroupKey.of("g" + i), outcomes.get(i).getFailure().get().getKey());
        }
    }

    @ParameterizedTest
    @MethodSource("executorProvider")
    public void testEmpty(AbstractGroupExecutor executor) {
        assertEquals(0, executor.execute(new ArrayList<>(), s -> null).size());
    }

    @Test
    public void testPoolIsCreatedOnFirstUse() {
        ParallelGroupExecutor executor = new ParallelGroupExecutor(2);
        assertFalse(executor.isPoolStarted());
        executor.execute(groups(3), series -> GroupOutcome.failure(
                new GroupFailure(series.getKey(), GroupStage.FAILED, new IllegalStateException("x"))));
        assertTrue(executor.isPoolStarted());
        assertEquals(2, executor.getThreadPoolSize());
    }

    @Test
    public void testInvalidPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelGroupExecutor(0));
    }
}
