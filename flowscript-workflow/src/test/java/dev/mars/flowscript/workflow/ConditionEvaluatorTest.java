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

import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.VariableInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static Map<String, VariableInfo> variables() {
        Map<String, VariableInfo> variables = new HashMap<>();
        variables.put("err", VariableInfo.stepOutput("err", "error", FlowValue.ofError("boom"), "step1", 3));
        variables.put("noErr", VariableInfo.stepOutput("noErr", "error", FlowValue.NULL, "step1", 3));
        variables.put("yes", VariableInfo.stepOutput("yes", "bool", FlowValue.ofBoolean(true), "step1", 3));
        variables.put("no", VariableInfo.stepOutput("no", "bool", FlowValue.ofBoolean(false), "step1", 3));
        variables.put("text", VariableInfo.assignment("text", "true", 4));
        return variables;
    }

    @ParameterizedTest
    @CsvSource({
            "err != nil, true",
            "noErr != nil, false",
            "unknown != nil, false",
            "yes == true, true",
            "no == true, false",
            "text == true, false",
            "no == false, true",
            "noErr == false, true",
            "unknown == false, true",
            "yes == false, false",
            "yes != true, false",
            "no != true, true",
            "unknown != true, true",
            "(err != nil), true",
            "err == nil, false",
            "yes > 1, false"
    })
    void testConditions(String condition, boolean expected) {
        assertEquals(expected, evaluator.evaluate(condition, variables()));
    }

    @Test
    void testSupportedForms() {
        assertTrue(evaluator.isSupported("err != nil"));
        assertTrue(evaluator.isSupported("  ok == false "));
        assertFalse(evaluator.isSupported("a && b"));
        assertFalse(evaluator.isSupported(null));
        assertFalse(evaluator.evaluate(null, variables()));
    }
}
