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

import java.util.List;
import java.util.function.Function;

import com.anomalydiagnostics.inputtypes.GroupSeries;
import com.anomalydiagnostics.returntypes.GroupOutcome;

/**
 * Runs the per group pipeline over all groups of a call. Implementations must
 * return the outcomes in the order of the groups, whatever order the groups
 * were processed in.
 */
public abstract class AbstractGroupExecutor {

    /**
     * @param groups the groups of the call
     * @param task   the pipeline applied to each group; must not throw
     * @return one outcome per group, in group order
     */
    public abstract List<GroupOutcome> execute(List<GroupSeries> groups, Function<GroupSeries, GroupOutcome> task);
}
