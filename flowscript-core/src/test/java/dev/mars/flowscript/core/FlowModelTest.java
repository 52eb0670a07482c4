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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowModelTest {

    @Test
    void testBindVariableIsLastWriteWins() {
        FlowModel flow = FlowModel.builder()
                .flowId("flow-1")
                .variable(VariableInfo.assignment("result", "draft", 3))
                .build();

        flow.bindVariable(VariableInfo.stepOutput("result", "int", FlowValue.ofInteger(9), "step2", 8));

        VariableInfo result = flow.getVariable("result").orElseThrow();
        assertEquals(FlowValue.ofInteger(9), result.getValue());
        assertEquals("int", result.getType());
        assertEquals("step2", result.getSource());
        assertEquals(8, result.getLineNum());
        assertEquals(1, flow.getVariables().size());
    }

    @Test
    void testVariablesViewIsReadOnly() {
        FlowModel flow = FlowModel.builder().flowId("flow-1").build();
        assertThrows(UnsupportedOperationException.class,
                () -> flow.getVariables().put("x", VariableInfo.assignment("x", "y", 1)));
    }

    @Test
    void testFindStep() {
        StepDefinition step = StepDefinition.builder().name("step1").function("a.b.c").build();
        FlowModel flow = FlowModel.builder().flowId("flow-1").steps(List.of(step)).build();

        assertSame(step, flow.findStep("step1").orElseThrow());
        assertTrue(flow.findStep("a.b.c").isEmpty());
    }

    @Test
    void testFailure() {
        FlowModel flow = FlowModel.failure("flow-1", "missing func main()", List.of());
        assertFalse(flow.isSuccess());
        assertEquals("missing func main()", flow.getError());
        assertTrue(flow.getMainStatements().isEmpty());
    }

    @Test
    void testEqualityIgnoresGlobalLogs() {
        FlowModel first = FlowModel.builder().flowId("flow-1").build();
        FlowModel second = FlowModel.builder().flowId("flow-1").build();
        second.addGlobalLog(StepLog.of(StepLog.WARN, "line 3: ignored", "parser"));
        assertEquals(first, second);
    }
}
