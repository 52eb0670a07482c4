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

import static org.junit.jupiter.api.Assertions.*;

class ArgumentTest {

    @Test
    void testInputReference() {
        Argument argument = Argument.parse("input[\"email\"]");
        assertEquals(ArgumentKind.INPUT, argument.getKind());
        assertTrue(argument.isInput());
        assertEquals("email", argument.inputKey());
    }

    @Test
    void testSingleQuotedInputReference() {
        assertEquals("user_id", Argument.parse("input['user_id']").inputKey());
    }

    @Test
    void testLiterals() {
        assertEquals(ArgumentKind.LITERAL, Argument.parse("\"text\"").getKind());
        assertEquals(ArgumentKind.LITERAL, Argument.parse("12").getKind());
        assertEquals(ArgumentKind.LITERAL, Argument.parse("true").getKind());
        assertEquals(ArgumentKind.LITERAL, Argument.parse("nil").getKind());
        assertEquals(FlowValue.ofString("text"), Argument.parse("\"text\"").literalValue());
        assertEquals(FlowValue.ofInteger(12), Argument.parse("12").literalValue());
    }

    @Test
    void testVariableReference() {
        Argument argument = Argument.parse(" userId ");
        assertEquals(ArgumentKind.VARIABLE, argument.getKind());
        assertEquals("userId", argument.getValue());
        assertEquals("userId", argument.inputKey());
    }

    @Test
    void testUnicodeVariableReference() {
        assertEquals(ArgumentKind.VARIABLE, Argument.parse("名前").getKind());
    }
}
