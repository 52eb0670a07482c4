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


package dev.mars.flowscript.core.exceptions;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FlowScriptExceptionTest {

    @Test
    void testParseExceptionMessage() {
        FlowParseException exception = new FlowParseException("flow-1", 12, "unterminated input block");
        assertEquals("Flow 'flow-1': Line 12: unterminated input block", exception.getMessage());
        assertEquals(12, exception.getLineNumber());
        assertEquals("flow-1", exception.getFlowId());
    }

    @Test
    void testParseExceptionWithoutLocation() {
        FlowParseException exception = new FlowParseException("Failed to read flow source");
        assertEquals("Failed to read flow source", exception.getMessage());
        assertNull(exception.getFlowId());
    }

    @Test
    void testExecutionExceptionHierarchy() {
        assertInstanceOf(FlowExecutionException.class, new StepNotFoundException("f", 3, "step9"));
        assertInstanceOf(FlowExecutionException.class, new FlowCancelledException("f", 3));
        assertInstanceOf(FlowExecutionException.class, new StepTimeoutException("f", 3, "step1", Duration.ofMillis(50)));
        assertInstanceOf(FlowScriptException.class, new FlowAlreadyRunningException("f"));
        assertInstanceOf(FlowScriptException.class, new FlowNotRunningException("f"));
    }

    @Test
    void testStepNotFound() {
        StepNotFoundException exception = new StepNotFoundException("flow-1", 7, "step9");
        assertEquals("step9", exception.getStepName());
        assertEquals(7, exception.getLineNumber());
        assertTrue(exception.getMessage().contains("step9"));
    }

    @Test
    void testRetriesExhaustedKeepsLastCause() {
        IllegalStateException cause = new IllegalStateException("database busy");
        RetriesExhaustedException exception = new RetriesExhaustedException("flow-1", 4, "create", 3, cause);

        assertSame(cause, exception.getCause());
        assertEquals(3, exception.getAttempts());
        assertEquals("create", exception.getStepName());
        assertTrue(exception.getMessage().contains("database busy"));
    }

    @Test
    void testStepTimeout() {
        StepTimeoutException exception = new StepTimeoutException("flow-1", 2, "poll", Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), exception.getTimeout());
        assertTrue(exception.getMessage().contains("250 ms"));
    }
}
