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

package com.anomalydiagnostics.examples;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.anomalydiagnostics.examples.detection.GroupedSeriesExample;
import com.anomalydiagnostics.examples.detection.WeeklySpikeExample;
import com.anomalydiagnostics.examples.serialization.JsonExample;

/**
 * Runs one of the examples, selected by its command name.
 */
public class Main {

    public static final String ARCHIVE_NAME = "anomaly-diagnostics-examples-1.0.0.jar";

    private final List<Example> examples = Arrays.asList(new WeeklySpikeExample(), new GroupedSeriesExample(),
            new JsonExample());

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    public void run(String[] args) throws Exception {
        if (args == null || args.length == 0 || "-h".equals(args[0]) || "--help".equals(args[0])) {
            printUsage();
            return;
        }
        Example example = find(args[0]).orElseThrow(() -> new IllegalArgumentException(
                "No such example: " + args[0] + ". Run with --help to list the examples."));
        example.run();
    }

    Optional<Example> find(String command) {
        return examples.stream().filter(e -> e.command().equals(command)).findFirst();
    }

    public void printUsage() {
        int width = examples.stream().mapToInt(e -> e.command().length()).max().orElse(0);
        System.out.printf("Usage: java -cp %s %s <example>%n", ARCHIVE_NAME, Main.class.getName());
        System.out.println("Examples:");
        for (Example example : examples) {
            System.out.printf("  %-" + width + "s  %s%n", example.command(), example.description());
        }
    }
}
