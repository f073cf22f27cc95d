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

package com.anomalydiagnostics;

import static com.anomalydiagnostics.CommonUtils.checkArgument;
import static com.anomalydiagnostics.CommonUtils.checkHalfOpenUnitInterval;
import static com.anomalydiagnostics.CommonUtils.checkNotNull;
import static com.anomalydiagnostics.CommonUtils.checkOpenUnitInterval;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.anomalydiagnostics.anomalydetection.AnomalyClassifier;
import com.anomalydiagnostics.anomalydetection.IqrBoundEstimator;
import com.anomalydiagnostics.anomalydetection.RemainderBounds;
import com.anomalydiagnostics.config.GroupStage;
import com.anomalydiagnostics.config.PeriodSpec;
import com.anomalydiagnostics.decomposition.Decomposition;
import com.anomalydiagnostics.decomposition.SeasonalDecomposer;
import com.anomalydiagnostics.exceptions.DiagnosticsFailedException;
import com.anomalydiagnostics.exceptions.MalformedInputException;
import com.anomalydiagnostics.executor.AbstractGroupExecutor;
import com.anomalydiagnostics.executor.ParallelGroupExecutor;
import com.anomalydiagnostics.executor.SequentialGroupExecutor;
import com.anomalydiagnostics.inputtypes.DiagnosticsInput;
import com.anomalydiagnostics.inputtypes.GroupKey;
import com.anomalydiagnostics.inputtypes.GroupSeries;
import com.anomalydiagnostics.period.PeriodResolver;
import com.anomalydiagnostics.period.ResolvedPeriods;
import com.anomalydiagnostics.returntypes.AnomalyRecord;
import com.anomalydiagnostics.returntypes.DiagnosticsResult;
import com.anomalydiagnostics.returntypes.GroupFailure;
import com.anomalydiagnostics.returntypes.GroupOutcome;
import com.anomalydiagnostics.returntypes.GroupResult;

/**
 * Detects anomalies in one or more time series. Every group of the input is
 * decomposed into seasonal, trend and remainder components; remainder values
 * outside an interquartile band are reported as anomalies, at most a fixed
 * fraction per group.
 * <p>
 * A group that cannot be processed is reported as a {@link GroupFailure} and
 * does not affect the other groups. Instances hold no state between calls and
 * may be shared between threads.
 *
 * <pre>
 * AnomalyDiagnostics diagnostics = AnomalyDiagnostics.builder().frequency("1 week").alpha(0.025).build();
 * DiagnosticsResult result = diagnostics.detect(DiagnosticsInput.ungrouped(rows));
 * </pre>
 */
@Slf4j
@Getter
public class AnomalyDiagnostics {

    public static final double DEFAULT_ALPHA = IqrBoundEstimator.DEFAULT_ALPHA;

    public static final double DEFAULT_MAX_ANOMALIES = AnomalyClassifier.DEFAULT_MAX_ANOMALIES;

    public static final boolean DEFAULT_VERBOSE = false;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final PeriodSpec frequency;

    private final PeriodSpec trend;

    private final double alpha;

    private final double maxAnomalies;

    private final boolean verbose;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final BooleanSupplier cancellation;

    private final PeriodResolver periodResolver;

    private final SeasonalDecomposer decomposer;

    private final IqrBoundEstimator boundEstimator;

    private final AnomalyClassifier classifier;

    private final AbstractGroupExecutor executor;

    protected AnomalyDiagnostics(Builder<?> builder) {
        checkNotNull(builder.frequency, "frequency must not be null");
        checkNotNull(builder.trend, "trend must not be null");
        checkOpenUnitInterval(builder.alpha, "alpha");
        checkHalfOpenUnitInterval(builder.maxAnomalies, "maxAnomalies");
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. "
                        + "To disable thread pool, set parallel execution to 'false'."));
        checkNotNull(builder.clock, "clock must not be null");

        frequency = builder.frequency;
        trend = builder.trend;
        alpha = builder.alpha;
        maxAnomalies = builder.maxAnomalies;
        verbose = builder.verbose;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        cancellation = builder.cancellationSupplier();

        periodResolver = new PeriodResolver();
        decomposer = new SeasonalDecomposer(builder.outerIterations, builder.innerIterations);
        boundEstimator = new IqrBoundEstimator(alpha);
        classifier = new AnomalyClassifier(maxAnomalies);

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            executor = new ParallelGroupExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialGroupExecutor();
        }
    }

    /**
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the detection on every group of the input.
     *
     * @param input the input table
     * @return the output rows of all groups that could be processed, and the
     *         failures of the others
     * @throws MalformedInputException    if the input table is invalid
     * @throws DiagnosticsFailedException if no group could be processed
     */
    public DiagnosticsResult detect(DiagnosticsInput input) {
        checkNotNull(input, "input must not be null");
        List<GroupSeries> groups = input.toGroups();
        List<GroupOutcome> outcomes = executor.execute(groups, this::processGroup);

        List<GroupResult> results = new ArrayList<>();
        List<GroupFailure> failures = new ArrayList<>();
        for (GroupOutcome outcome : outcomes) {
            outcome.getResult().ifPresent(results::add);
            outcome.getFailure().ifPresent(failures::add);
        }
        if (results.isEmpty()) {
            throw new DiagnosticsFailedException(failures);
        }
        DiagnosticsResult result = new DiagnosticsResult(input.getGroupColumns(), results, failures);
        if (verbose) {
            log.info("{} of {} group(s) processed, {} anomalies found", results.size(), groups.size(),
                    result.getAnomalies().size());
        }
        return result;
    }

    /**
     * Runs the pipeline on a single group. Never throws; a failure at any
     * stage is returned as a {@link GroupFailure}.
     *
     * @param series the group
     * @return the outcome
     */
    GroupOutcome processGroup(GroupSeries series) {
        GroupKey key = series.getKey();
        if (cancellation.getAsBoolean()) {
            return GroupOutcome.failure(new GroupFailure(key, GroupStage.PENDING,
                    new CancellationException("cancelled before group " + key + " started")));
        }
        GroupStage stage = GroupStage.RESOLVING_PARAMETERS;
        try {
            ResolvedPeriods periods = periodResolver.resolve(key.toString(), series.getTimestamps(), frequency,
                    trend);
            if (verbose) {
                log.info("group {}: {}", key, periods);
            }

            stage = GroupStage.DECOMPOSING;
            Decomposition decomposition = decomposer.decompose(series.getValues(), periods.getFrequency(),
                    periods.getTrend());

            stage = GroupStage.BOUNDING;
            RemainderBounds bounds = boundEstimator.estimate(decomposition.getRemainder());

            stage = GroupStage.CLASSIFYING;
            boolean[] flags = classifier.classify(decomposition.getRemainder(), bounds);

            List<AnomalyRecord> records = toRecords(series, decomposition, bounds, flags);
            return GroupOutcome.success(new GroupResult(key, periods, bounds, records));
        } catch (RuntimeException e) {
            log.warn("group {} failed during {}: {}", key, stage, e.getMessage());
            return GroupOutcome.failure(new GroupFailure(key, stage, e));
        }
    }

    static List<AnomalyRecord> toRecords(GroupSeries series, Decomposition decomposition, RemainderBounds bounds,
            boolean[] flags) {
        double[] remainder = decomposition.getRemainder();
        List<AnomalyRecord> records = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            records.add(new AnomalyRecord(series.getKey(), series.getRowIndices()[i], series.getTimestamps()[i],
                    decomposition.getObserved()[i], decomposition.getSeasonal()[i], decomposition.getTrend()[i],
                    remainder[i], bounds.getLower(), bounds.getUpper(), flags[i],
                    AnomalyClassifier.directionOf(remainder[i], flags[i], bounds)));
        }
        return records;
    }

    public static class Builder<T extends Builder<T>> {

        private PeriodSpec frequency = PeriodSpec.auto();
        private PeriodSpec trend = PeriodSpec.auto();
        private double alpha = DEFAULT_ALPHA;
        private double maxAnomalies = DEFAULT_MAX_ANOMALIES;
        private boolean verbose = DEFAULT_VERBOSE;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<BooleanSupplier> cancellation = Optional.empty();
        private Optional<Instant> deadline = Optional.empty();
        private Clock clock = Clock.systemUTC();
        private int outerIterations = SeasonalDecomposer.DEFAULT_OUTER_ITERATIONS;
        private int innerIterations = SeasonalDecomposer.DEFAULT_INNER_ITERATIONS;

        public T frequency(String frequency) {
            this.frequency = PeriodSpec.parse(frequency);
            return (T) this;
        }

        public T frequency(PeriodSpec frequency) {
            this.frequency = frequency;
            return (T) this;
        }

        public T trend(String trend) {
            this.trend = PeriodSpec.parse(trend);
            return (T) this;
        }

        public T trend(PeriodSpec trend) {
            this.trend = trend;
            return (T) this;
        }

        public T alpha(double alpha) {
            this.alpha = alpha;
            return (T) this;
        }

        public T maxAnomalies(double maxAnomalies) {
            this.maxAnomalies = maxAnomalies;
            return (T) this;
        }

        public T verbose(boolean verbose) {
            this.verbose = verbose;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        /**
         * @param cancellation polled before each group starts; groups not yet
         *                     started when it returns true are reported as
         *                     cancelled
         * @return this builder
         */
        public T cancellation(BooleanSupplier cancellation) {
            this.cancellation = Optional.of(checkNotNull(cancellation, "cancellation must not be null"));
            return (T) this;
        }

        /**
         * @param deadline groups not started by this instant are reported as
         *                 cancelled
         * @return this builder
         */
        public T deadline(Instant deadline) {
            this.deadline = Optional.of(checkNotNull(deadline, "deadline must not be null"));
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }

        public T outerIterations(int outerIterations) {
            this.outerIterations = outerIterations;
            return (T) this;
        }

        public T innerIterations(int innerIterations) {
            this.innerIterations = innerIterations;
            return (T) this;
        }

        public AnomalyDiagnostics build() {
            return new AnomalyDiagnostics(this);
        }

        BooleanSupplier cancellationSupplier() {
            BooleanSupplier requested = cancellation.orElse(() -> false);
            if (!deadline.isPresent()) {
                return requested;
            }
            Instant limit = deadline.get();
            Clock source = clock;
            return () -> requested.getAsBoolean() || !source.instant().isBefore(limit);
        }
    }
}
