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

import dev.mars.flowscript.core.ExecutionOptions;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.StepDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for handler lookup by alias, function id and fallback.
 */
class StepHandlerRegistryTest {

    private StepHandlerRegistry registry;
    private StepDefinition step;

    @BeforeEach
    void setUp() {
        registry = new StepHandlerRegistry();
        step = StepDefinition.builder().name("create").function("users.Create").build();
    }

    private StepRequest request() {
        return new StepRequest("flow-1", step, 3, "", Map.of(), ExecutionOptions.DEFAULTS, 0);
    }

    @Test
    void testAliasTakesPrecedenceOverFunctionId() throws Exception {
        registry.register("users.Create", (context, request) -> StepResult.success(Map.of("by", "function")));
        registry.register("create", (context, request) -> StepResult.success(Map.of("by", "alias")));

        StepResult result = registry.executeStep(FlowContext.root(), request());

        assertEquals(FlowValue.ofString("alias"), result.getOutputs().get("by"));
    }

    @Test
    void testFunctionIdLookup() throws Exception {
        registry.register("users.Create", (context, request) -> StepResult.success(Map.of("by", "function")));

        StepResult result = registry.executeStep(FlowContext.root(), request());

        assertTrue(result.isSuccess());
        assertEquals(FlowValue.ofString("function"), result.getOutputs().get("by"));
    }

    @Test
    void testFallback() throws Exception {
        registry.fallback((context, request) -> StepResult.success(Map.of("step", request.getStepName())));

        StepResult result = registry.executeStep(FlowContext.root(), request());

        assertEquals(FlowValue.ofString("create"), result.getOutputs().get("step"));
    }

    @Test
    void testMissingHandlerFails() throws Exception {
        StepResult result = registry.executeStep(FlowContext.root(), request());

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("create"));
    }

    @Test
    void testNullResultBecomesFailure() throws Exception {
        registry.register("create", (context, request) -> null);

        StepResult result = registry.executeStep(FlowContext.root(), request());

        assertFalse(result.isSuccess());
    }

    @Test
    void testRegisterAndUnregister() {
        registry.register("create", (context, request) -> StepResult.success(Map.of()));

        assertTrue(registry.hasHandler("create"));
        assertTrue(registry.getRegisteredNames().contains("create"));
        assertTrue(registry.unregister("create"));
        assertFalse(registry.hasHandler("create"));
        assertThrows(NullPointerException.class, () -> registry.register(null, (context, request) -> null));
    }
}
