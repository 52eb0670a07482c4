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


package dev.mars.flowscript.workflow;

import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.exceptions.FlowNotRunningException;
import dev.mars.flowscript.core.exceptions.FlowScriptException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Executes parsed flows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface FlowEngine {

    /**
     * Runs the flow on the calling thread until it completes, returns early, fails terminally
     * or is cancelled through {@code context} or {@link #stop(String)}.
     *
     * @throws dev.mars.flowscript.core.exceptions.FlowParseException if the model records a parse failure
     * @throws dev.mars.flowscript.core.exceptions.FlowAlreadyRunningException if a flow with the same id is running
     * @throws dev.mars.flowscript.core.exceptions.FlowExecutionException on a terminal step failure or cancellation
     */
    void start(FlowContext context, FlowModel flow) throws FlowScriptException;

    /**
     * Runs the flow on the engine's worker pool. The flow is registered before this method
     * returns, so it can be stopped straight away.
     */
    CompletableFuture<FlowModel> startAsync(FlowModel flow);

    CompletableFuture<FlowModel> startAsync(FlowContext context, FlowModel flow);

    void stop(String flowId) throws FlowNotRunningException;

    boolean isRunning(String flowId);

    /**
     * The last model started under {@code flowId}, running or finished.
     */
    Optional<FlowModel> get(String flowId);

    boolean evict(String flowId);

    void shutdown();
}
