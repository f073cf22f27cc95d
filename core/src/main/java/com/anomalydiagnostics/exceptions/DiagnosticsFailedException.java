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

package com.anomalydiagnostics.exceptions;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.anomalydiagnostics.returntypes.GroupFailure;

/**
 * Raised when not a single group could be processed. The individual failures
 * are available through {@link #getFailures()}.
 */
@Getter
public class DiagnosticsFailedException extends AnomalyDiagnosticsException {

    private final List<GroupFailure> failures;

    public DiagnosticsFailedException(List<GroupFailure> failures) {
        super(describe(failures));
        this.failures = Collections.unmodifiableList(failures);
    }

    private static String describe(List<GroupFailure> failures) {
        StringBuilder builder = new StringBuilder("no group could be processed");
        for (GroupFailure failure : failures) {
            builder.append("; ").append(failure.describe());
        }
        return builder.toString();
    }
}
