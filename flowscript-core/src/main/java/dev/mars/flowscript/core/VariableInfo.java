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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entry of the flow's flat variable table.
 *
 * <p>{@code source} names the producing step alias, {@link #SOURCE_ASSIGNMENT} or
 * {@link #SOURCE_INPUT}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class VariableInfo {

    public static final String SOURCE_ASSIGNMENT = "assignment";
    public static final String SOURCE_INPUT = "input";

    private final String name;
    private final String type;
    private final FlowValue value;
    private final String source;
    private final int lineNum;
    private final boolean isInput;

    @JsonCreator
    public VariableInfo(@JsonProperty("name") String name,
                        @JsonProperty("type") String type,
                        @JsonProperty("value") FlowValue value,
                        @JsonProperty("source") String source,
                        @JsonProperty("line_num") int lineNum,
                        @JsonProperty("is_input") boolean isInput) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null");
        this.type = type != null ? type : "";
        this.value = value != null ? value : FlowValue.NULL;
        this.source = source != null ? source : "";
        this.lineNum = lineNum;
        this.isInput = isInput;
    }

    public static VariableInfo input(String name, FlowValue value) {
        return new VariableInfo(name, value != null ? value.typeName() : "nil", value, SOURCE_INPUT, 0, true);
    }

    public static VariableInfo assignment(String name, String value, int lineNum) {
        return new VariableInfo(name, "string", FlowValue.ofString(value), SOURCE_ASSIGNMENT, lineNum, false);
    }

    public static VariableInfo stepOutput(String name, String type, FlowValue value, String stepName, int lineNum) {
        return new VariableInfo(name, type, value, stepName, lineNum, false);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("value")
    public FlowValue getValue() {
        return value;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonProperty("line_num")
    public int getLineNum() {
        return lineNum;
    }

    @JsonProperty("is_input")
    public boolean isInput() {
        return isInput;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariableInfo that = (VariableInfo) o;
        return lineNum == that.lineNum &&
                isInput == that.isInput &&
                name.equals(that.name) &&
                type.equals(that.type) &&
                value.equals(that.value) &&
                source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value, source, lineNum, isInput);
    }

    @Override
    public String toString() {
        return "VariableInfo{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", value=" + value.asText() +
                ", source='" + source + '\'' +
                ", line=" + lineNum +
                '}';
    }
}
