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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A dynamically typed value flowing through a flow: input literals, argument values,
 * handler outputs and variable contents.
 *
 * <p>The set of variants is closed. Anything a handler returns that is not one of the
 * scalar kinds is captured through {@link #of(Object)}: throwables become an
 * {@link ErrorValue}, other objects fall back to their {@code toString()} text.</p>
 *
 * <p>JSON form is the raw scalar, except {@link ErrorValue} which is written as
 * {@code {"error": "message"}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonSerialize(using = FlowValueSerializer.class)
@JsonDeserialize(using = FlowValueDeserializer.class)
public sealed interface FlowValue {

    FlowValue NULL = NullValue.INSTANCE;

    /**
     * Text used when the value is substituted into a {@code {{name}}} template.
     */
    String asText();

    /**
     * Short type tag: {@code string}, {@code int}, {@code float}, {@code bool}, {@code nil} or {@code error}.
     */
    String typeName();

    /**
     * The plain Java object behind this value, as handed to step handlers.
     */
    Object toJava();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    static FlowValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof FlowValue) {
            return (FlowValue) value;
        }
        if (value instanceof CharSequence) {
            return new StringValue(value.toString());
        }
        if (value instanceof Boolean) {
            return BooleanValue.of((Boolean) value);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.bitLength() < Long.SIZE) {
                return new IntegerValue(big.longValue());
            }
            return new DecimalValue(big.doubleValue());
        }
        if (value instanceof BigDecimal || value instanceof Number) {
            return new DecimalValue(((Number) value).doubleValue());
        }
        if (value instanceof Character) {
            return new StringValue(String.valueOf(value));
        }
        if (value instanceof Throwable) {
            Throwable t = (Throwable) value;
            return new ErrorValue(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }
        return new StringValue(value.toString());
    }

    static FlowValue ofString(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static FlowValue ofInteger(long value) {
        return new IntegerValue(value);
    }

    static FlowValue ofBoolean(boolean value) {
        return BooleanValue.of(value);
    }

    static FlowValue ofError(String message) {
        return new ErrorValue(message);
    }

    record StringValue(String value) implements FlowValue {
        public StringValue {
            Objects.requireNonNull(value, "String value cannot be null");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record IntegerValue(long value) implements FlowValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }

        @Override
        public String typeName() {
            return "int";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record DecimalValue(double value) implements FlowValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }

        @Override
        public String typeName() {
            return "float";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements FlowValue {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public String typeName() {
            return "bool";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record NullValue() implements FlowValue {
        public static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "null";
        }

        @Override
        public String typeName() {
            return "nil";
        }

        @Override
        public Object toJava() {
            return null;
        }
    }

    /**
     * Marks a value that carries an error produced by a handler, such as the {@code err} output of a step.
     */
    record ErrorValue(String message) implements FlowValue {
        public ErrorValue {
            Objects.requireNonNull(message, "Error message cannot be null");
        }

        @Override
        public String asText() {
            return message;
        }

        @Override
        public String typeName() {
            return "error";
        }

        @Override
        public Object toJava() {
            return message;
        }
    }
}
