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

package com.anomalydiagnostics.serialize.runner;

import com.anomalydiagnostics.runner.ArgumentParser;
import com.anomalydiagnostics.serialize.OutputFormat;

/**
 * Adds the JSON output options to the arguments of the delimited runner.
 */
public class JsonArgumentParser extends ArgumentParser {

    private final Argument<OutputFormat> outputFormat;
    private final BooleanArgument prettyPrint;
    private final BooleanArgument anomaliesOnly;

    public JsonArgumentParser(String runnerClass, String runnerDescription) {
        super(runnerClass, runnerDescription);

        outputFormat = new Argument<>("-o", "--output-format", "Write the result as 'csv' or 'json'.",
                OutputFormat.CSV, OutputFormat::parse);

        addArgument(outputFormat);

        prettyPrint = new BooleanArgument(null, "--pretty-print", "Set to 'true' to indent JSON output.", false);

        addArgument(prettyPrint);

        anomaliesOnly = new BooleanArgument(null, "--anomalies-only",
                "Set to 'true' to leave rows that are not anomalies out of JSON output.", false);

        addArgument(anomaliesOnly);
    }

    public OutputFormat getOutputFormat() {
        return outputFormat.getValue();
    }

    public boolean getPrettyPrint() {
        return prettyPrint.getValue();
    }

    public boolean getAnomaliesOnly() {
        return anomaliesOnly.getValue();
    }
}
