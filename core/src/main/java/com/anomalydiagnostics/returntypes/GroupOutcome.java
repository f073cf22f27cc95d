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

package com.anomalydiagnostics.returntypes;

import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.Optional;

/**
 * The outcome of processing one group: either a result or a failure.
 */
public class GroupOutcome {

    private final GroupResult result;

    private final GroupFailure failure;

    private GroupOutcome(GroupResult result, GroupFailure failure) {
        this.result = result;
        this.failure = failure;
    }

    public static GroupOutcome success(GroupResult result) {
        return new GroupOutcome(checkNotNull(result, "result must not be null"), null);
    }

    public static GroupOutcome failure(GroupFailure failure) {
        return new GroupOutcome(null, checkNotNull(failure, "failure must not be null"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<GroupResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<GroupFailure> getFailure() {
        return Optional.ofNullable(failure);
    }
}
