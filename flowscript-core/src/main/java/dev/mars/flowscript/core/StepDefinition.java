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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declared step: a local alias bound to a fully qualified external function with an
 * ordered formal parameter contract.
 *
 * <p>Dynamic steps are called with positional arguments that are remapped onto
 * {@link #getInputParams()} names. Static steps replay a fixed recorded case
 * ({@link #getCaseId()}) and take no arguments.</p>
 *
 * <p>Instances are immutable and created through {@link Builder}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonDeserialize(builder = StepDefinition.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StepDefinition {

    public static final String ERR_CONTINUE = "err_continue";

    private final String name;
    private final String function;
    private final List<ParameterInfo> inputParams;
    private final List<ParameterInfo> outputParams;
    private final boolean isStatic;
    private final String caseId;
    private final String desc;
    private final Map<String, FlowValue> metadata;

    private StepDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Step name cannot be null");
        this.function = Objects.requireNonNull(builder.function, "Step function cannot be null");
        this.inputParams = Collections.unmodifiableList(new ArrayList<>(builder.inputParams));
        this.outputParams = Collections.unmodifiableList(new ArrayList<>(builder.outputParams));
        this.isStatic = builder.isStatic;
        this.caseId = builder.caseId;
        this.desc = builder.desc != null ? builder.desc : "";
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("function")
    public String getFunction() {
        return function;
    }

    @JsonProperty("input_params")
    public List<ParameterInfo> getInputParams() {
        return inputParams;
    }

    @JsonProperty("output_params")
    public List<ParameterInfo> getOutputParams() {
        return outputParams;
    }

    @JsonProperty("is_static")
    public boolean isStatic() {
        return isStatic;
    }

    @JsonProperty("case_id")
    public String getCaseId() {
        return caseId;
    }

    @JsonProperty("desc")
    public String getDesc() {
        return desc;
    }

    @JsonProperty("metadata")
    public Map<String, FlowValue> getMetadata() {
        return metadata;
    }

    /**
     * Whether failures of this step are logged and skipped instead of aborting the flow.
     */
    @JsonIgnore
    public boolean isErrContinue() {
        FlowValue value = metadata.get(ERR_CONTINUE);
        return value instanceof FlowValue.BooleanValue && ((FlowValue.BooleanValue) value).value();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return isStatic == that.isStatic &&
                name.equals(that.name) &&
                function.equals(that.function) &&
                inputParams.equals(that.inputParams) &&
                outputParams.equals(that.outputParams) &&
                Objects.equals(caseId, that.caseId) &&
                desc.equals(that.desc) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, function, inputParams, outputParams, isStatic, caseId, desc, metadata);
    }

    @Override
    public String toString() {
        return "StepDefinition{" +
                "name='" + name + '\'' +
                ", function='" + function + '\'' +
                ", inputParams=" + inputParams +
                ", outputParams=" + outputParams +
                (isStatic ? ", caseId='" + caseId + '\'' : "") +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String name;
        private String function;
        private List<ParameterInfo> inputParams = new ArrayList<>();
        private List<ParameterInfo> outputParams = new ArrayList<>();
        private boolean isStatic;
        private String caseId;
        private String desc;
        private Map<String, FlowValue> metadata = new LinkedHashMap<>();

        @JsonProperty("name")
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        @JsonProperty("function")
        public Builder function(String function) {
            this.function = function;
            return this;
        }

        @JsonProperty("input_params")
        public Builder inputParams(List<ParameterInfo> inputParams) {
            this.inputParams = inputParams != null ? new ArrayList<>(inputParams) : new ArrayList<>();
            return this;
        }

        public Builder inputParam(ParameterInfo param) {
            this.inputParams.add(Objects.requireNonNull(param, "Parameter cannot be null"));
            return this;
        }

        @JsonProperty("output_params")
        public Builder outputParams(List<ParameterInfo> outputParams) {
            this.outputParams = outputParams != null ? new ArrayList<>(outputParams) : new ArrayList<>();
            return this;
        }

        public Builder outputParam(ParameterInfo param) {
            this.outputParams.add(Objects.requireNonNull(param, "Parameter cannot be null"));
            return this;
        }

        @JsonProperty("is_static")
        public Builder isStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        @JsonProperty("case_id")
        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        @JsonProperty("desc")
        public Builder desc(String desc) {
            this.desc = desc;
            return this;
        }

        @JsonProperty("metadata")
        public Builder metadata(Map<String, FlowValue> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public Builder metadata(String key, FlowValue value) {
            this.metadata.put(key, value);
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
