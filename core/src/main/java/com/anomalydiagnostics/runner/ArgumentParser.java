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

package com.anomalydiagnostics.runner;

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.anomalydiagnostics.config.PeriodSpec;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/anomaly-diagnostics-core-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument frequency;
    private final StringArgument trend;
    private final DoubleArgument alpha;
    private final DoubleArgument maxAnomalies;
    private final BooleanArgument verbose;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final StringArgument groupColumns;
    private final StringArgument timestampColumn;
    private final StringArgument valueColumn;
    private final BooleanArgument parallel;
    private final IntegerArgument threadPoolSize;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        frequency = new StringArgument("-f", "--frequency",
                "Seasonal frequency: 'auto', a duration such as '1 week', or a number of observations.", "auto",
                PeriodSpec::parse);

        addArgument(frequency);

        trend = new StringArgument("-t", "--trend",
                "Trend window: 'auto', a duration such as '3 months', or a number of observations.", "auto",
                PeriodSpec::parse);

        addArgument(trend);

        alpha = new DoubleArgument("-a", "--alpha",
                "Width of the normal range; smaller values make the band wider.", 0.05,
                x -> checkArgument(x > 0 && x < 1, "alpha should be in the range (0, 1)"));

        addArgument(alpha);

        maxAnomalies = new DoubleArgument("-m", "--max-anomalies",
                "Maximum fraction of observations of a group reported as anomalies.", 0.2,
                x -> checkArgument(x > 0 && x <= 1, "max anomalies should be in the range (0, 1]"));

        addArgument(maxAnomalies);

        verbose = new BooleanArgument("-v", "--verbose", "Set to 'true' to log the parameters used for each group.",
                false);

        addArgument(verbose);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);

        groupColumns = new StringArgument("-g", "--group-columns",
                "Comma separated names or zero based indices of the grouping columns.", "");

        addArgument(groupColumns);

        timestampColumn = new StringArgument(null, "--timestamp-column",
                "Name or zero based index of the timestamp column.", "0");

        addArgument(timestampColumn);

        valueColumn = new StringArgument(null, "--value-column", "Name or zero based index of the value column.",
                "1");

        addArgument(valueColumn);

        parallel = new BooleanArgument("-p", "--parallel", "Set to 'true' to process groups in parallel.", false);

        addArgument(parallel);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of threads used with --parallel, or 0 for one less than the number of processors.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be greater than or equal to 0"));

        addArgument(threadPoolSize);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Remove the argument with the given long flag from help messages. This
     * allows subclasses to suppress arguments as needed. The argument will still
     * exist in this object with its default value.
     *
     * @param longFlag The long flag corresponding to the argument being removed
     */
    protected void removeArgument(String longFlag) {
        Argument<?> argument = longFlags.get(longFlag);
        if (argument != null) {
            longFlags.remove(longFlag);
            shortFlags.remove(argument.getShortFlag());
        }
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the user-specified value of the frequency parameter
     */
    public PeriodSpec getFrequency() {
        return PeriodSpec.parse(frequency.getValue());
    }

    /**
     * @return the user-specified value of the trend parameter
     */
    public PeriodSpec getTrend() {
        return PeriodSpec.parse(trend.getValue());
    }

    public double getAlpha() {
        return alpha.getValue();
    }

    public double getMaxAnomalies() {
        return maxAnomalies.getValue();
    }

    public boolean getVerbose() {
        return verbose.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    /**
     * @return the group column names or indices, empty for ungrouped input
     */
    public List<String> getGroupColumns() {
        String value = groupColumns.getValue().trim();
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public String getTimestampColumn() {
        return timestampColumn.getValue();
    }

    public String getValueColumn() {
        return valueColumn.getValue();
    }

    public boolean getParallel() {
        return parallel.getValue();
    }

    /**
     * @return the user-specified thread pool size, 0 if the default should be
     *         used
     */
    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
