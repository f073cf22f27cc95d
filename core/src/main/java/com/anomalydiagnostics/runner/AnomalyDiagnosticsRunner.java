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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.anomalydiagnostics.AnomalyDiagnostics;
import com.anomalydiagnostics.exceptions.AnomalyDiagnosticsException;
import com.anomalydiagnostics.exceptions.MalformedInputException;
import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.TimeSeriesRow;
import com.anomalydiagnostics.returntypes.AnomalyRecord;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.returntypes.OutputColumn;

/**
 * A command-line application that reads delimited rows from STDIN, runs
 * anomaly detection on every group and writes the decomposition, bounds and
 * verdict of each row to STDOUT. Unlike a streaming scorer the whole input is
 * read before any output is written, since every group is decomposed as a
 * whole.
 */
@Slf4j
public class AnomalyDiagnosticsRunner {

    public static final String DESCRIPTION = "Decompose each group of the input series into seasonal, trend and "
            + "remainder components and flag observations whose remainder lies outside the interquartile band.";

    private static final Pattern INDEX_PATTERN = Pattern.compile("\\d+");

    protected final ArgumentParser argumentParser;
    protected List<String> header;
    protected int width;
    protected int timestampIndex;
    protected int valueIndex;
    protected int[] groupIndices;
    protected List<String> groupColumnNames;
    protected final List<String> timestampText = new ArrayList<>();
    protected int lineNumber;

    public AnomalyDiagnosticsRunner() {
        this(new ArgumentParser(AnomalyDiagnosticsRunner.class.getName(), DESCRIPTION));
    }

    /**
     * @param argumentParser A argument parser that will be used by this runner to
     *                       parse command-line arguments.
     */
    public AnomalyDiagnosticsRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        AnomalyDiagnosticsRunner runner = new AnomalyDiagnosticsRunner();
        runner.parse(args);
        execute(runner);
    }

    /**
     * Runs the given runner on STDIN and STDOUT. A failure to process the input
     * is reported on STDERR and terminates the application with status 1.
     *
     * @param runner a runner whose arguments have been parsed
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    protected static void execute(AnomalyDiagnosticsRunner runner) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(
                new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        try {
            runner.run(in, out);
        } catch (AnomalyDiagnosticsException e) {
            out.flush();
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
        in.close();
        out.close();
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read all rows from an input stream, run the detection, and write the
     * result to an output stream.
     *
     * @param in  An input stream where input rows will be read.
     * @param out An output stream where the result rows will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        reset();
        List<TimeSeriesRow> rows = new ArrayList<>();
        boolean headerPending = argumentParser.getHeaderRow();
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(Pattern.quote(argumentParser.getDelimiter()), -1);

            // the header is the first non-blank line
            if (headerPending) {
                header = new ArrayList<>();
                Arrays.stream(values).map(String::trim).forEach(header::add);
                headerPending = false;
                continue;
            }

            if (groupIndices == null) {
                prepareColumns(values.length);
            }

            rows.add(parseRow(values));
        }

        DiagnosticsResult result = prepareDiagnostics().detect(toInput(rows));
        writeResult(result, out);
        out.flush();
    }

    /**
     * Forget the columns and timestamps of a previous run.
     */
    protected void reset() {
        lineNumber = 0;
        header = null;
        width = 0;
        groupIndices = null;
        groupColumnNames = null;
        timestampText.clear();
    }

    /**
     * Locate the timestamp, value and group columns.
     *
     * @param numberOfColumns The number of fields in each input row.
     */
    protected void prepareColumns(int numberOfColumns) {
        width = numberOfColumns;
        timestampIndex = resolveColumn(argumentParser.getTimestampColumn());
        valueIndex = resolveColumn(argumentParser.getValueColumn());
        List<String> groupColumns = argumentParser.getGroupColumns();
        groupIndices = new int[groupColumns.size()];
        groupColumnNames = new ArrayList<>();
        for (int i = 0; i < groupIndices.length; i++) {
            groupIndices[i] = resolveColumn(groupColumns.get(i));
            groupColumnNames.add((header != null) ? header.get(groupIndices[i]) : "column_" + groupIndices[i]);
        }
    }

    /**
     * @param column a column name from the header row or a zero based index
     * @return the index of the column
     */
    protected int resolveColumn(String column) {
        int index;
        if (INDEX_PATTERN.matcher(column).matches()) {
            index = Integer.parseInt(column);
        } else if (header != null) {
            index = header.indexOf(column);
            if (index < 0) {
                throw new MalformedInputException("column '" + column + "' is not in the header row " + header);
            }
        } else {
            throw new MalformedInputException(
                    "column '" + column + "' is given by name, which needs --header-row true");
        }
        if (index >= width) {
            throw new MalformedInputException(
                    String.format("column %s does not exist, the input has %d columns", column, width));
        }
        return index;
    }

    /**
     * Parse the fields of one input line into a row.
     *
     * @param values the fields of the line
     * @return the row
     */
    protected TimeSeriesRow parseRow(String[] values) {
        if (values.length != width) {
            throw new MalformedInputException(String.format(
                    "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, width, values.length));
        }
        String timestamp = values[timestampIndex].trim();
        String value = values[valueIndex].trim();
        double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(
                    String.format("line %d: value '%s' is not a number", lineNumber, value), e);
        }
        List<String> groupValues = new ArrayList<>(groupIndices.length);
        for (int index : groupIndices) {
            groupValues.add(values[index].trim());
        }
        timestampText.add(timestamp);
        return new TimeSeriesRow(groupValues, TimestampParser.parse(timestamp), number);
    }

    protected DiagnosticsInput toInput(List<TimeSeriesRow> rows) {
        if (groupIndices == null || groupIndices.length == 0) {
            return DiagnosticsInput.ungrouped(rows);
        }
        return DiagnosticsInput.grouped(rows, groupColumnNames);
    }

    /**
     * @return the detector configured from the command-line arguments
     */
    protected AnomalyDiagnostics prepareDiagnostics() {
        AnomalyDiagnostics.Builder builder = AnomalyDiagnostics.builder().frequency(argumentParser.getFrequency())
                .trend(argumentParser.getTrend()).alpha(argumentParser.getAlpha())
                .maxAnomalies(argumentParser.getMaxAnomalies()).verbose(argumentParser.getVerbose())
                .parallelExecutionEnabled(argumentParser.getParallel());
        if (argumentParser.getThreadPoolSize() > 0) {
            builder.threadPoolSize(argumentParser.getThreadPoolSize());
        }
        return builder.build();
    }

    /**
     * Write the result table. Failed groups are not part of the table; they are
     * logged as they occur and summarized here.
     *
     * @param result the detection result
     * @param out    The output stream where the result will be written.
     */
    protected void writeResult(DiagnosticsResult result, PrintWriter out) {
        if (result.isPartial()) {
            log.warn("{} group(s) could not be processed and are missing from the output", result.getFailures().size());
        }
        writeHeader(result.getGroupColumns(), out);
        for (AnomalyRecord record : result.getRecords()) {
            writeRecord(record, out);
        }
    }

    protected void writeHeader(List<String> groupColumns, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        OutputColumn.header(groupColumns).stream().map(this::quote).forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected void writeRecord(AnomalyRecord record, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        record.getGroupKey().getValues().stream().map(this::quote).forEach(joiner::add);
        for (OutputColumn column : OutputColumn.values()) {
            if (column == OutputColumn.TIMESTAMP) {
                joiner.add(quote(timestampText.get(record.getRowIndex())));
            } else {
                joiner.add(column.format(record));
            }
        }
        out.println(joiner.toString());
    }

    /**
     * Quote a text field that contains the delimiter, a double quote or a line
     * break. Embedded double quotes are doubled.
     *
     * @param field the field as read from the input
     * @return the field as it is written to the output
     */
    protected String quote(String field) {
        if (field.contains(argumentParser.getDelimiter()) || field.indexOf('"') >= 0 || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0) {
            return '"' + field.replace("\"", "\"\"") + '"';
        }
        return field;
    }
}
