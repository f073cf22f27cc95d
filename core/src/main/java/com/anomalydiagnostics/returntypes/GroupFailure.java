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

import lombok.Getter;

import com.anomalydiagnostics.config.GroupStage;
import com.anomalydiagnostics.inputtypes.GroupKey;

/**
 * A group that was excluded from the result, with the stage it reached and the
 * reason. Failures read back from a serialized result carry the error type and
 * message but no cause.
 */
@Getter
public class GroupFailure {

    private final GroupKey key;

    private final GroupStage stage;

    private final String errorType;

    private final String message;

    private final Throwable cause;

    public GroupFailure(GroupKey key, GroupStage stage, Throwable cause) {
        this(key, stage, checkNotNull(cause, "cause must not be null").getClass().getSimpleName(),
                cause.getMessage(), cause);
    }

    public GroupFailure(GroupKey key, GroupStage stage, String errorType, String message) {
        this(key, stage, errorType, message, null);
    }

    private GroupFailure(GroupKey key, GroupStage stage, String errorType, String message, Throwable cause) {
        this.key = checkNotNull(key, "key must not be null");
        this.stage = checkNotNull(stage, "stage must not be null");
        this.errorType = checkNotNull(errorType, "errorType must not be null");
        this.message = message;
        this.cause = cause;
    }

    /**
     * @return a one line description naming the group, stage and reason
     */
    public String describe() {
        return String.format("group %s failed during %s: %s: %s", key, stage, errorType, message);
    }

    @Override
    public String toString() {
        return describe();
    }
}
