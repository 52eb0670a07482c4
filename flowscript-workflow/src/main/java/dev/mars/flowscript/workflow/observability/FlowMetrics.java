/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowscript.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the flow executor.
 *
 * Provides:
 * - flowscript.flow.active (gauge) - Flows currently executing
 * - flowscript.flow.started (counter) - Flows started
 * - flowscript.flow.completed (counter) - Flows that ran every statement
 * - flowscript.flow.returned (counter) - Flows halted by a return statement
 * - flowscript.flow.failed (counter) - Flows aborted by a terminal failure
 * - flowscript.flow.cancelled (counter) - Flows stopped by cancellation
 * - flowscript.flow.duration.seconds (histogram) - Flow duration distribution
 * - flowscript.statements.total (counter) - Statements executed, by type
 * - flowscript.step.attempts (counter) - Step handler invocations
 * - flowscript.step.retries (counter) - Attempts after the first
 * - flowscript.step.failed (counter) - Failed handler attempts
 *
 * Without an OpenTelemetry SDK on the classpath every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(FlowMetrics.class);
    private static final String METER_NAME = "flowscript-workflow";

    private static FlowMetrics instance;

    private final LongCounter flowsStarted;
    private final LongCounter flowsCompleted;
    private final LongCounter flowsReturned;
    private final LongCounter flowsFailed;
    private final LongCounter flowsCancelled;
    private final LongCounter statementsTotal;
    private final LongCounter stepAttempts;
    private final LongCounter stepRetries;
    private final LongCounter stepsFailed;

    private final DoubleHistogram flowDuration;

    private final AtomicLong activeFlows = new AtomicLong(0);

    private static final AttributeKey<String> STATEMENT_TYPE_KEY = AttributeKey.stringKey("statement.type");
    private static final AttributeKey<String> STEP_NAME_KEY = AttributeKey.stringKey("step.name");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("flow.outcome");

    public FlowMetrics(Meter meter) {
        flowsStarted = meter.counterBuilder("flowscript.flow.started")
                .setDescription("Number of flows started")
                .setUnit("1")
                .build();

        flowsCompleted = meter.counterBuilder("flowscript.flow.completed")
                .setDescription("Number of flows that ran every statement")
                .setUnit("1")
                .build();

        flowsReturned = meter.counterBuilder("flowscript.flow.returned")
                .setDescription("Number of flows halted by a return statement")
                .setUnit("1")
                .build();

        flowsFailed = meter.counterBuilder("flowscript.flow.failed")
                .setDescription("Number of flows aborted by a terminal failure")
                .setUnit("1")
                .build();

        flowsCancelled = meter.counterBuilder("flowscript.flow.cancelled")
                .setDescription("Number of cancelled flows")
                .setUnit("1")
                .build();

        statementsTotal = meter.counterBuilder("flowscript.statements.total")
                .setDescription("Number of statements executed")
                .setUnit("1")
                .build();

        stepAttempts = meter.counterBuilder("flowscript.step.attempts")
                .setDescription("Number of step handler invocations")
                .setUnit("1")
                .build();

        stepRetries = meter.counterBuilder("flowscript.step.retries")
                .setDescription("Number of step handler retries")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("flowscript.step.failed")
                .setDescription("Number of failed step handler attempts")
                .setUnit("1")
                .build();

        flowDuration = meter.histogramBuilder("flowscript.flow.duration.seconds")
                .setDescription("Flow duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("flowscript.flow.active")
                .setDescription("Number of currently executing flows")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeFlows.get()));

        logger.debug("FlowMetrics initialized");
    }

    /**
     * Get the singleton instance bound to {@link GlobalOpenTelemetry}.
     */
    public static synchronized FlowMetrics getInstance() {
        if (instance == null) {
            instance = new FlowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for when monitoring is switched off.
     */
    public static FlowMetrics disabled() {
        return new FlowMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordFlowStarted() {
        flowsStarted.add(1);
        activeFlows.incrementAndGet();
    }

    public void recordFlowCompleted(double durationSeconds) {
        activeFlows.decrementAndGet();
        flowsCompleted.add(1);
        flowDuration.record(durationSeconds, Attributes.of(OUTCOME_KEY, "completed"));
    }

    public void recordFlowReturned(double durationSeconds) {
        activeFlows.decrementAndGet();
        flowsReturned.add(1);
        flowDuration.record(durationSeconds, Attributes.of(OUTCOME_KEY, "returned"));
    }

    public void recordFlowFailed(double durationSeconds, String failureReason) {
        activeFlows.decrementAndGet();
        flowsFailed.add(1, Attributes.of(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown"));
        flowDuration.record(durationSeconds, Attributes.of(OUTCOME_KEY, "failed"));
    }

    public void recordFlowCancelled(double durationSeconds) {
        activeFlows.decrementAndGet();
        flowsCancelled.add(1);
        flowDuration.record(durationSeconds, Attributes.of(OUTCOME_KEY, "cancelled"));
    }

    public void recordStatementExecuted(String statementType) {
        statementsTotal.add(1, Attributes.of(STATEMENT_TYPE_KEY, statementType));
    }

    /**
     * Record one handler invocation; attempts after the first also count as retries.
     */
    public void recordStepAttempt(String stepName, int attempt) {
        Attributes attrs = Attributes.of(STEP_NAME_KEY, stepName);
        stepAttempts.add(1, attrs);
        if (attempt > 0) {
            stepRetries.add(1, attrs);
        }
    }

    public void recordStepFailed(String stepName, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(STEP_NAME_KEY, stepName)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        stepsFailed.add(1, attrs);
    }

    public long getActiveFlows() {
        return activeFlows.get();
    }
}
