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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An actual parameter at a function-call site, kept as source text plus its kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class Argument {

    private static final Pattern INPUT_REFERENCE = Pattern.compile("^input\\[\\s*[\"']?([^\"'\\]]*)[\"']?\\s*]$");

    private final String value;
    private final ArgumentKind kind;

    @JsonCreator
    public Argument(@JsonProperty("value") String value, @JsonProperty("kind") ArgumentKind kind) {
        this.value = Objects.requireNonNull(value, "Argument value cannot be null");
        this.kind = kind != null ? kind : ArgumentKind.VARIABLE;
    }

    /**
     * Classifies raw argument text the way the statement parser does.
     */
    public static Argument parse(String text) {
        String trimmed = text.trim();
        if (INPUT_REFERENCE.matcher(trimmed).matches()) {
            return new Argument(trimmed, ArgumentKind.INPUT);
        }
        if (isLiteral(trimmed)) {
            return new Argument(trimmed, ArgumentKind.LITERAL);
        }
        return new Argument(trimmed, ArgumentKind.VARIABLE);
    }

    static boolean isLiteral(String text) {
        if (text.isEmpty()) {
            return true;
        }
        if (text.length() >= 2 && ((text.startsWith("\"") && text.endsWith("\""))
                || (text.startsWith("'") && text.endsWith("'"))
                || (text.startsWith("`") && text.endsWith("`")))) {
            return true;
        }
        if ("true".equals(text) || "false".equals(text) || "nil".equals(text)) {
            return true;
        }
        return Literals.isNumeric(text);
    }

    @JsonProperty("value")
    public String getValue() {
        return value;
    }

    @JsonProperty("kind")
    public ArgumentKind getKind() {
        return kind;
    }

    @JsonIgnore
    public boolean isInput() {
        return kind == ArgumentKind.INPUT;
    }

    /**
     * @return the key inside {@code input["key"]}, or the raw text for non-input arguments
     */
    @JsonIgnore
    public String inputKey() {
        Matcher matcher = INPUT_REFERENCE.matcher(value);
        return matcher.matches() ? matcher.group(1) : value;
    }

    /**
     * The value this argument stands for when nothing in the flow state resolves it.
     */
    @JsonIgnore
    public FlowValue literalValue() {
        return Literals.parse(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Argument argument = (Argument) o;
        return value.equals(argument.value) && kind == argument.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind);
    }

    @Override
    public String toString() {
        return value;
    }
}
