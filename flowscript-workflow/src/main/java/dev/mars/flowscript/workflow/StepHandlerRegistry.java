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

import dev.mars.flowscript.core.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link StepHandler} that routes each call to a handler registered for the step.
 *
 * <p>Lookup order: the step alias, then the step's fully qualified function id, then the
 * fallback handler. A step with no handler gets a failed result, which the engine treats
 * like any other step failure.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class StepHandlerRegistry implements StepHandler {

    private static final Logger logger = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<String, StepHandler> handlers = new ConcurrentHashMap<>();
    private volatile StepHandler fallback;

    /**
     * Registers a handler under a step alias or a fully qualified function id.
     */
    public StepHandlerRegistry register(String name, StepHandler handler) {
        Objects.requireNonNull(name, "Step name cannot be null");
        Objects.requireNonNull(handler, "Step handler cannot be null");
        StepHandler previous = handlers.put(name, handler);
        if (previous != null) {
            logger.debug("Replaced handler for {}", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return handlers.remove(name) != null;
    }

    public StepHandlerRegistry fallback(StepHandler handler) {
        this.fallback = handler;
        return this;
    }

    public boolean hasHandler(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public StepResult executeStep(FlowContext context, StepRequest request) throws Exception {
        StepHandler handler = resolve(request.getStep());
        if (handler == null) {
            logger.warn("No handler registered for step {} ({})", request.getStepName(), request.getStep().getFunction());
            return StepResult.failure("no handler registered for step " + request.getStepName());
        }
        StepResult result = handler.executeStep(context, request);
        if (result == null) {
            return StepResult.failure("handler for step " + request.getStepName() + " returned no result");
        }
        return result;
    }

    private StepHandler resolve(StepDefinition step) {
        StepHandler handler = handlers.get(step.getName());
        if (handler == null) {
            handler = handlers.get(step.getFunction());
        }
        return handler != null ? handler : fallback;
    }
}
