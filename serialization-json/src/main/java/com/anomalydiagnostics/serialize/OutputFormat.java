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

package com.anomalydiagnostics.serialize;

import java.util.Locale;

/**
 * Formats in which the command-line runner writes its result.
 */
public enum OutputFormat {

    /**
     * One delimited line per input row, preceded by a header line.
     */
    CSV,

    /**
     * A single JSON document holding groups, bounds, rows and failures.
     */
    JSON;

    /**
     * @param text "csv" or "json", ignoring case
     * @return the matching format
     * @throws IllegalArgumentException if the text names no format
     */
    public static OutputFormat parse(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
