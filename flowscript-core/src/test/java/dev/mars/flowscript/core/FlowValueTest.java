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

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FlowValueTest {

    @Test
    void testOfConvertsJavaScalars() {
        assertEquals(new FlowValue.StringValue("abc"), FlowValue.of("abc"));
        assertEquals(new FlowValue.IntegerValue(42), FlowValue.of(42));
        assertEquals(new FlowValue.IntegerValue(42), FlowValue.of(42L));
        assertEquals(new FlowValue.DecimalValue(1.5), FlowValue.of(1.5));
        assertEquals(new FlowValue.DecimalValue(2.25), FlowValue.of(new BigDecimal("2.25")));
        assertEquals(new FlowValue.IntegerValue(7), FlowValue.of(BigInteger.valueOf(7)));
        assertSame(FlowValue.BooleanValue.TRUE, FlowValue.of(true));
        assertSame(FlowValue.NULL, FlowValue.of(null));
    }

    @Test
    void testOfReturnsFlowValuesUnchanged() {
        FlowValue value = FlowValue.ofString("x");
        assertSame(value, FlowValue.of(value));
    }

    @Test
    void testThrowableBecomesErrorValue() {
        FlowValue value = FlowValue.of(new IllegalStateException("boom"));
        assertEquals("error", value.typeName());
        assertEquals("boom", value.asText());
    }

    @Test
    void testTypeNames() {
        assertEquals("string", FlowValue.ofString("a").typeName());
        assertEquals("int", FlowValue.ofInteger(1).typeName());
        assertEquals("float", FlowValue.of(0.5).typeName());
        assertEquals("bool", FlowValue.ofBoolean(false).typeName());
        assertEquals("nil", FlowValue.NULL.typeName());
    }

    @Test
    void testAsTextUsedForTemplates() {
        assertEquals("Ann", FlowValue.ofString("Ann").asText());
        assertEquals("12", FlowValue.ofInteger(12).asText());
        assertEquals("true", FlowValue.ofBoolean(true).asText());
        assertEquals("null", FlowValue.NULL.asText());
    }

    @Test
    void testToJava() {
        assertEquals("a", FlowValue.ofString("a").toJava());
        assertEquals(3L, FlowValue.ofInteger(3).toJava());
        assertEquals(Boolean.TRUE, FlowValue.ofBoolean(true).toJava());
        assertNull(FlowValue.NULL.toJava());
    }

    @Test
    void testIsNull() {
        assertTrue(FlowValue.NULL.isNull());
        assertTrue(FlowValue.ofString(null).isNull());
        assertFalse(FlowValue.ofString("").isNull());
    }
}
