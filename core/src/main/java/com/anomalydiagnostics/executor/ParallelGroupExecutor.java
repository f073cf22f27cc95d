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

import static com.anomalydiagnostics.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.anomalydiagnostics.inputtypes.GroupSeries;
import com.anomalydiagnostics.returntypes.GroupOutcome;

/**
 * Processes groups concurrently on a private thread pool. Groups share no
 * mutable state; the outcomes are collected in group order once every group is
 * done. The pool is created by the first call to {@link #execute}.
 */
public class ParallelGroupExecutor extends AbstractGroupExecutor {

    private ForkJoinPool forkJoinPool;

    private final int threadPoolSize;

    public ParallelGroupExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    public List<GroupOutcome> execute(List<GroupSeries> groups, Function<GroupSeries, GroupOutcome> task) {
        return submitAndJoin(() -> groups.parallelStream().map(task).collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return getForkJoinPool().submit(callable).join();
    }

    private synchronized ForkJoinPool getForkJoinPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    synchronized boolean isPoolStarted() {
        return forkJoinPool != null;
    }
}
