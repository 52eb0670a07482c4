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
import dev.mars.flowscript.core.FlowModelCodec;
import dev.mars.flowscript.core.FlowView;
import dev.mars.flowscript.core.StepLog;
import dev.mars.flowscript.examples.util.ExampleLogger;
import dev.mars.flowscript.workflow.FlowContext;
import dev.mars.flowscript.workflow.FlowListener;
import dev.mars.flowscript.workflow.FlowSourceParser;
import dev.mars.flowscript.workflow.SimpleFlowEngine;
import dev.mars.flowscript.workflow.SimpleFlowSourceParser;
import dev.mars.flowscript.workflow.StepHandlerRegistry;
import dev.mars.flowscript.workflow.StepResult;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parses and runs the user registration flow in {@code flows/user-registration.flow}.
 * This example shows how to:
 * 1. Parse flow source into a model
 * 2. Register step handlers by alias
 * 3. Observe retries, a tolerated failure and progress notifications
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class BasicFlowExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(BasicFlowExample.class);

    static final String FLOW_RESOURCE = "flows/user-registration.flow";

    public static void main(String[] args) {
        log.header("FlowScript Basic Flow Example");
        try {
            new BasicFlowExample().runExample();
            log.completion("Basic Flow Example");
        } catch (Exception e) {
            log.unexpectedError("Basic Flow Example", e);
            System.exit(1);
        }
    }

    public FlowModel runExample() throws Exception {
        log.step(1, "Parsing flow source...");
        FlowSourceParser parser = new SimpleFlowSourceParser();
        FlowModel flow = parser.parse("user-registration-" + System.currentTimeMillis(), loadSource());
        if (!flow.isSuccess()) {
            log.failure("Flow could not be parsed: " + flow.getError());
            return flow;
        }
        log.success("Parsed " + flow.getSteps().size() + " steps and "
                + flow.getMainStatements().size() + " statements");

        log.step(2, "Registering step handlers...");
        StepHandlerRegistry handlers = createHandlers();
        log.detail("Handlers: " + handlers.getRegisteredNames());

        log.step(3, "Running flow...");
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "100");
        AtomicInteger checkpoints = new AtomicInteger();
        FlowListener listener = new FlowListener() {
            @Override
            public void onProgress(FlowView view) {
                checkpoints.incrementAndGet();
            }

            @Override
            public void onCompleted(FlowView view) {
                log.success("Flow " + view.getFlowId() + " completed");
            }

            @Override
            public void onReturned(FlowView view) {
                log.success("Flow " + view.getFlowId() + " returned early");
            }
        };

        SimpleFlowEngine engine = new SimpleFlowEngine(handlers, listener, new FlowScriptConfiguration(properties));
        try {
            engine.start(FlowContext.root(flow.getFlowId()), flow);
        } finally {
            engine.shutdown();
        }

        log.step(4, "Results");
        log.detail("Progress notifications: " + checkpoints.get());
        log.statements(flow);
        log.variables(flow);
        for (StepLog entry : flow.getGlobalLogs()) {
            log.detail("[" + entry.getLevel() + "] " + entry.getSource() + ": " + entry.getMessage());
        }

        log.step(5, "Checkpoint JSON");
        log.detail(new FlowModelCodec().toPrettyJson(flow));
        return flow;
    }

    /**
     * Handlers standing in for real services. Account creation fails once with a transient
     * error and the mail service is down.
     */
    static StepHandlerRegistry createHandlers() {
        AtomicInteger createCalls = new AtomicInteger();
        return new StepHandlerRegistry()
                .register("validate", (context, request) -> {
                    String email = request.getInput("email").asText();
                    return StepResult.builder()
                            .output("valid", email.contains("@"))
                            .output("err", null)
                            .log("validated " + email)
                            .build();
                })
                .register("users.accounts.Create", (context, request) -> {
                    if (createCalls.incrementAndGet() == 1) {
                        throw new IllegalStateException("database busy");
                    }
                    return StepResult.builder()
                            .output("userId", "u-" + Math.abs(request.getInput("email").asText().hashCode() % 10000))
                            .output("err", null)
                            .build();
                })
                .register("notify", (context, request) -> StepResult.failure("smtp relay unavailable"))
                .register("audit", (context, request) -> StepResult.builder()
                        .output("auditId", request.getStep().getCaseId() + "-" + request.getFlowId())
                        .build());
    }

    static String loadSource() throws IOException {
        try (InputStream input = BasicFlowExample.class.getClassLoader().getResourceAsStream(FLOW_RESOURCE)) {
            if (input == null) {
                throw new IOException("Flow resource not found: " + FLOW_RESOURCE);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
