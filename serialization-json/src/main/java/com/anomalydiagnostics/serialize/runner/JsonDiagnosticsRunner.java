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

import java.io.IOException;
import java.io.PrintWriter;

import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.runner.AnomalyDiagnosticsRunner;
import com.anomalydiagnostics.serialize.DiagnosticsResultSerDe;
import com.anomalydiagnostics.serialize.OutputFormat;

/**
 * The delimited runner with an additional JSON output format. With
 * {@code --output-format json} the whole result, failures included, is written
 * to STDOUT as one JSON document.
 */
public class JsonDiagnosticsRunner extends AnomalyDiagnosticsRunner {

    private final JsonArgumentParser jsonArgumentParser;

    public JsonDiagnosticsRunner() {
        this(new JsonArgumentParser(JsonDiagnosticsRunner.class.getName(), DESCRIPTION));
    }

    public JsonDiagnosticsRunner(JsonArgumentParser argumentParser) {
        super(argumentParser);
        this.jsonArgumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        JsonDiagnosticsRunner runner = new JsonDiagnosticsRunner();
        runner.parse(args);
        execute(runner);
    }

    @Override
    protected void writeResult(DiagnosticsResult result, PrintWriter out) {
        if (jsonArgumentParser.getOutputFormat() != OutputFormat.JSON) {
            super.writeResult(result, out);
            return;
        }
        DiagnosticsResultSerDe serDe = new DiagnosticsResultSerDe();
        serDe.setPrettyPrint(jsonArgumentParser.getPrettyPrint());
        serDe.getMapper().setAnomaliesOnly(jsonArgumentParser.getAnomaliesOnly());
        out.println(serDe.toJson(result));
    }
}
