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

package com.anomalydiagnostics.state;

import java.io.Serializable;

import lombok.Data;

/**
 * One output row. Field names follow the columns of the output table; the
 * timestamp is an ISO-8601 instant.
 */
@Data
public class AnomalyRecordState implements Serializable {
    private static final long serialVersionUID = 1L;

    private int rowIndex;
    private String timestamp;
    private double observed;
    private double seasonal;
    private double trend;
    private double remainder;
    private double seasadj;
    private double remainderLowerBound;
    private double remainderUpperBound;
    private double recomposedL1;
    private double recomposedL2;
    private String isAnomaly;
    private String direction;
}
