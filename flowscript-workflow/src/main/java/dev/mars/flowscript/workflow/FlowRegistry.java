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

import dev.mars.flowscript.core.exceptions.FlowAlreadyRunningException;
import dev.mars.flowscript.core.exceptions.FlowNotRunningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the flows that are currently executing, keyed by flow ID, together with their
 * cancellation handles. At most one execution per flow ID is registered at a time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FlowRegistry.class);

    private final Map<String, FlowContext> runningFlows = new ConcurrentHashMap<>();

    public void register(String flowId, FlowContext context) throws FlowAlreadyRunningException {
        Objects.requireNonNull(flowId, "Flow ID cannot be null");
        Objects.requireNonNull(context, "Flow context cannot be null");
        if (runningFlows.putIfAbsent(flowId, context) != null) {
            throw new FlowAlreadyRunningException(flowId);
        }
        logger.debug("Registered flow {}", flowId);
    }

    /**
     * Removes the entry only if it still belongs to {@code context}.
     */
    public boolean unregister(String flowId, FlowContext context) {
        boolean removed = runningFlows.remove(flowId, context);
        if (removed) {
            logger.debug("Unregistered flow {}", flowId);
        }
        return removed;
    }

    public void cancel(String flowId) throws FlowNotRunningException {
        FlowContext context = flowId != null ? runningFlows.get(flowId) : null;
        if (context == null) {
            throw new FlowNotRunningException(flowId);
        }
        context.cancel("stopped");
        logger.info("Stop requested for flow {}", flowId);
    }

    public int cancelAll() {
        int count = 0;
        for (Map.Entry<String, FlowContext> entry : runningFlows.entrySet()) {
            entry.getValue().cancel("engine shutdown");
            count++;
        }
        return count;
    }

    public boolean isRunning(String flowId) {
        return flowId != null && runningFlows.containsKey(flowId);
    }

    public Set<String> getRunningFlowIds() {
        return Set.copyOf(runningFlows.keySet());
    }

    public int size() {
        return runningFlows.size();
    }
}
