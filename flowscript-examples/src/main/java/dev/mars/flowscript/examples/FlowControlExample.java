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


package dev.mars.flowscript.examples;

import dev.mars.flowscript.config.FlowScriptConfiguration;
import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.exceptions.FlowCancelledException;
import dev.mars.flowscript.core.exceptions.RetriesExhaustedException;
import dev.mars.flowscript.examples.util.ExampleLogger;
import dev.mars.flowscript.workflow.FlowListener;
import dev.mars.flowscript.workflow.SimpleFlowEngine;
import dev.mars.flowscript.workflow.SimpleFlowSourceParser;
import dev.mars.flowscript.workflow.StepHandlerRegistry;
import dev.mars.flowscript.workflow.StepResult;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs two flows side by side on one engine, stops one of them by id and lets the other finish,
 * then shows a step that keeps failing until its retries run out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowControlExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(FlowControlExample.class);

    static final String POLLING_FLOW = String.join("\n",
            "poll = jobs.status.Poll(jobId: string \"Job to watch\") -> (state: string \"Final job state\");",
            "report = jobs.report.Publish(state: string \"Job state\") -> (url: string \"Report location\");",
            "",
            "func main() {",
            "    state := poll(input[\"jobId\"])",
            "    url := report(state)",
            "}",
            "",
            "var input = { \"jobId\": \"job-42\" }");

    static final String FLAKY_FLOW = String.join("\n",
            "charge = billing.cards.Charge(amount: int \"Amount in cents\") -> (receipt: string \"Receipt id\");",
            "",
            "func main() {",
            "    receipt := charge(1999){retry: 2}",
            "}");

    public static void main(String[] args) {
        log.header("FlowScript Flow Control Example");
        try {
            FlowControlExample example = new FlowControlExample();
            example.runStopExample();
            example.runRetryExample();
            log.completion("Flow Control Example");
        } catch (Exception e) {
            log.unexpectedError("Flow Control Example", e);
            System.exit(1);
        }
    }

    /**
     * @return the flow that was allowed to finish
     */
    public FlowModel runStopExample() throws Exception {
        log.step(1, "Starting two polling flows...");
        CountDownLatch bothPolling = new CountDownLatch(2);
        StepHandlerRegistry handlers = new StepHandlerRegistry()
                .register("poll", (context, request) -> {
                    bothPolling.countDown();
                    // Poll until the job is done or the flow is stopped
                    for (int i = 0; i < 5; i++) {
                        if (context.await(Duration.ofMillis(100))) {
                            return StepResult.failure("polling stopped");
                        }
                    }
                    return StepResult.success(Map.of("state", "done"));
                })
                .register("report", (context, request) -> StepResult.builder()
                        .output("url", "https://reports.example.com/" + request.getInput("state").asText())
                        .build());

        SimpleFlowEngine engine = new SimpleFlowEngine(handlers, FlowListener.NONE, quickRetries());
        SimpleFlowSourceParser parser = new SimpleFlowSourceParser();
        FlowModel kept = parser.parse("poll-kept", POLLING_FLOW);
        FlowModel stopped = parser.parse("poll-stopped", POLLING_FLOW);

        try {
            CompletableFuture<FlowModel> keptFuture = engine.startAsync(kept);
            CompletableFuture<FlowModel> stoppedFuture = engine.startAsync(stopped);
            bothPolling.await(5, TimeUnit.SECONDS);

            log.step(2, "Stopping flow " + stopped.getFlowId() + "...");
            engine.stop(stopped.getFlowId());
            try {
                stoppedFuture.get(5, TimeUnit.SECONDS);
                log.failure("Stopped flow finished normally");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof FlowCancelledException) {
                    log.expectedFailure("Flow was cancelled", (FlowCancelledException) e.getCause());
                } else {
                    throw e;
                }
            }

            FlowModel result = keptFuture.get(5, TimeUnit.SECONDS);
            log.success("Flow " + result.getFlowId() + " finished");
            log.statements(stopped);
            log.variables(result);
            return result;
        } finally {
            engine.shutdown();
        }
    }

    /**
     * @return the exception that ended the flow
     */
    public RetriesExhaustedException runRetryExample() throws Exception {
        log.step(3, "Running a flow whose step always fails...");
        StepHandlerRegistry handlers = new StepHandlerRegistry()
                .register("charge", (context, request) -> {
                    throw new IllegalStateException("card issuer timeout on attempt " + (request.getAttempt() + 1));
                });
        SimpleFlowEngine engine = new SimpleFlowEngine(handlers, FlowListener.NONE, quickRetries());
        FlowModel flow = new SimpleFlowSourceParser().parse("charge-flaky", FLAKY_FLOW);
        try {
            engine.startAsync(flow).join();
            log.failure("Flow finished although every attempt failed");
            return null;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RetriesExhaustedException) {
                RetriesExhaustedException exhausted = (RetriesExhaustedException) e.getCause();
                log.expectedFailure("Gave up after " + exhausted.getAttempts() + " attempts", exhausted);
                log.statements(flow);
                return exhausted;
            }
            throw e;
        } finally {
            engine.shutdown();
        }
    }

    private static FlowScriptConfiguration quickRetries() {
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "50");
        properties.setProperty(FlowScriptConfiguration.METRICS_ENABLED, "false");
        return new FlowScriptConfiguration(properties);
    }
}
