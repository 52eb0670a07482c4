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


package dev.mars.flowscript.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for typing call-site metadata into {@link ExecutionOptions}.
 */
class ExecutionOptionsTest {

    private final List<String> warnings = new ArrayList<>();

    @Test
    void testDefaults() {
        ExecutionOptions options = ExecutionOptions.fromMetadata(Map.of(), warnings::add);
        assertEquals(0, options.getRetry());
        assertEquals(1, options.getMaxAttempts());
        assertTrue(options.getTimeout().isEmpty());
        assertFalse(options.isAsync());
        assertEquals(0, options.getPriority());
        assertFalse(options.isDebug());
        assertEquals("info", options.getLogLevel());
        assertEquals("", options.getAiModel());
        assertNull(options.getErrContinue());
        assertEquals(ExecutionOptions.DEFAULTS, options);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testTypedValues() {
        Map<String, FlowValue> metadata = new LinkedHashMap<>();
        metadata.put("retry", FlowValue.ofInteger(3));
        metadata.put("timeout", FlowValue.ofInteger(5000));
        metadata.put("async", FlowValue.ofBoolean(true));
        metadata.put("priority", FlowValue.ofString("high"));
        metadata.put("debug", FlowValue.ofBoolean(true));
        metadata.put("log_level", FlowValue.ofString("DEBUG"));
        metadata.put("ai_model", FlowValue.ofString("summarizer-small"));

        ExecutionOptions options = ExecutionOptions.fromMetadata(metadata, warnings::add);

        assertEquals(3, options.getRetry());
        assertEquals(4, options.getMaxAttempts());
        assertEquals(Duration.ofSeconds(5), options.getTimeout().orElseThrow());
        assertTrue(options.isAsync());
        assertEquals(1, options.getPriority());
        assertTrue(options.isDebug());
        assertEquals("debug", options.getLogLevel());
        assertEquals("summarizer-small", options.getAiModel());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testRetryCountAlias() {
        ExecutionOptions options = ExecutionOptions.fromMetadata(
                Map.of("retry_count", FlowValue.ofInteger(2)), warnings::add);
        assertEquals(2, options.getRetry());
    }

    @Test
    void testTimeoutWithUnits() {
        assertEquals(Duration.ofMillis(250), timeoutOf("250ms"));
        assertEquals(Duration.ofSeconds(30), timeoutOf("30s"));
        assertEquals(Duration.ofMinutes(2), timeoutOf("2m"));
    }

    @Test
    void testInvalidValuesFallBackWithWarnings() {
        Map<String, FlowValue> metadata = new LinkedHashMap<>();
        metadata.put("retry", FlowValue.ofInteger(-1));
        metadata.put("timeout", FlowValue.ofString("soon"));
        metadata.put("priority", FlowValue.ofString("urgent"));
        metadata.put("async", FlowValue.ofString("maybe"));

        ExecutionOptions options = ExecutionOptions.fromMetadata(metadata, warnings::add);

        assertEquals(0, options.getRetry());
        assertTrue(options.getTimeout().isEmpty());
        assertEquals(0, options.getPriority());
        assertFalse(options.isAsync());
        assertEquals(4, warnings.size());
    }

    @Test
    void testCallSiteErrContinueOverridesStep() {
        StepDefinition tolerant = StepDefinition.builder()
                .name("notify")
                .function("mail.Send")
                .metadata(StepDefinition.ERR_CONTINUE, FlowValue.ofBoolean(true))
                .build();
        StepDefinition strict = StepDefinition.builder().name("create").function("users.Create").build();

        assertTrue(ExecutionOptions.DEFAULTS.isErrContinue(tolerant));
        assertFalse(ExecutionOptions.DEFAULTS.isErrContinue(strict));

        ExecutionOptions off = ExecutionOptions.fromMetadata(
                Map.of(StepDefinition.ERR_CONTINUE, FlowValue.ofBoolean(false)), warnings::add);
        ExecutionOptions on = ExecutionOptions.fromMetadata(
                Map.of(StepDefinition.ERR_CONTINUE, FlowValue.ofBoolean(true)), warnings::add);
        assertFalse(off.isErrContinue(tolerant));
        assertTrue(on.isErrContinue(strict));
    }

    @Test
    void testBuilderRejectsNegativeRetry() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().retry(-2));
    }

    @Test
    void testRetryAtIntLimitIsRejected() {
        ExecutionOptions options = ExecutionOptions.fromMetadata(
                Map.of("retry", FlowValue.ofInteger(Integer.MAX_VALUE)), warnings::add);

        assertEquals(0, options.getRetry());
        assertEquals(1, options.getMaxAttempts());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("invalid retry value"));

        ExecutionOptions largest = ExecutionOptions.fromMetadata(
                Map.of("retry", FlowValue.ofInteger(Integer.MAX_VALUE - 1L)), warnings::add);
        assertEquals(Integer.MAX_VALUE, largest.getMaxAttempts());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().retry(Integer.MAX_VALUE));
    }

    private Duration timeoutOf(String text) {
        return ExecutionOptions.fromMetadata(Map.of("timeout", FlowValue.ofString(text)), warnings::add)
                .getTimeout()
                .orElseThrow();
    }
}
