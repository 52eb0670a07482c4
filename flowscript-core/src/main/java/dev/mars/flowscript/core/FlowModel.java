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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The parsed form of a flow together with its execution state.
 *
 * <p>Everything except {@link #getVariables() variables} and {@link #getGlobalLogs() global logs}
 * (plus per-statement status) is fixed once parsing completes. The variable table is a single
 * flat namespace where the last write wins; it is mutated only by the flow's own driver loop,
 * so no locking is applied. This is the state an external store checkpoints from
 * progress notifications.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonDeserialize(builder = FlowModel.Builder.class)
@JsonPropertyOrder({"flow_id", "input_vars", "steps", "main_func", "variables", "global_logs", "success", "error"})
public final class FlowModel implements FlowView {

    private final String flowId;
    private final Map<String, FlowValue> inputVars;
    private final List<StepDefinition> steps;
    private final Map<String, StepDefinition> stepsByName;
    private final List<Statement> mainStatements;
    private final Map<String, VariableInfo> variables;
    private final List<StepLog> globalLogs;
    private final boolean success;
    private final String error;

    private FlowModel(Builder builder) {
        this.flowId = Objects.requireNonNull(builder.flowId, "Flow ID cannot be null");
        this.inputVars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputVars));
        this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
        this.mainStatements = Collections.unmodifiableList(new ArrayList<>(builder.mainStatements));
        this.variables = new LinkedHashMap<>(builder.variables);
        this.globalLogs = new ArrayList<>(builder.globalLogs);
        this.success = builder.success;
        this.error = builder.error != null ? builder.error : "";

        Map<String, StepDefinition> index = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            index.put(step.getName(), step);
        }
        this.stepsByName = Collections.unmodifiableMap(index);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a model that records a structural parse failure.
     */
    public static FlowModel failure(String flowId, String error, List<StepLog> logs) {
        return builder().flowId(flowId).success(false).error(error).globalLogs(logs).build();
    }

    @Override
    @JsonProperty("flow_id")
    public String getFlowId() {
        return flowId;
    }

    @Override
    @JsonProperty("input_vars")
    public Map<String, FlowValue> getInputVars() {
        return inputVars;
    }

    @Override
    @JsonProperty("steps")
    public List<StepDefinition> getSteps() {
        return steps;
    }

    @Override
    public Optional<StepDefinition> findStep(String name) {
        return Optional.ofNullable(stepsByName.get(name));
    }

    @Override
    @JsonIgnore
    public List<Statement> getMainStatements() {
        return mainStatements;
    }

    @JsonProperty("main_func")
    public MainFunc getMainFunc() {
        return new MainFunc(mainStatements);
    }

    @Override
    @JsonProperty("variables")
    public Map<String, VariableInfo> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public Optional<VariableInfo> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * Writes a variable, replacing any earlier entry with the same name including its type and source.
     */
    public void bindVariable(VariableInfo variable) {
        Objects.requireNonNull(variable, "Variable cannot be null");
        variables.put(variable.getName(), variable);
    }

    @Override
    @JsonProperty("global_logs")
    public List<StepLog> getGlobalLogs() {
        return Collections.unmodifiableList(globalLogs);
    }

    public void addGlobalLog(StepLog log) {
        globalLogs.add(Objects.requireNonNull(log, "Log cannot be null"));
    }

    @Override
    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @Override
    @JsonProperty("error")
    public String getError() {
        return error;
    }

    /**
     * Equality covers the parsed structure, variables and outcome. Global logs are excluded
     * because they carry wall-clock timestamps.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowModel that = (FlowModel) o;
        return success == that.success &&
                flowId.equals(that.flowId) &&
                inputVars.equals(that.inputVars) &&
                steps.equals(that.steps) &&
                mainStatements.equals(that.mainStatements) &&
                variables.equals(that.variables) &&
                error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flowId, inputVars, steps, mainStatements, success, error);
    }

    @Override
    public String toString() {
        return "FlowModel{" +
                "flowId='" + flowId + '\'' +
                ", steps=" + steps.size() +
                ", statements=" + mainStatements.size() +
                ", variables=" + variables.size() +
                ", success=" + success +
                (error.isEmpty() ? "" : ", error='" + error + '\'') +
                '}';
    }

    /**
     * JSON wrapper for the {@code main} body.
     */
    public record MainFunc(@JsonProperty("statements") List<Statement> statements) {
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String flowId;
        private Map<String, FlowValue> inputVars = new LinkedHashMap<>();
        private List<StepDefinition> steps = new ArrayList<>();
        private List<Statement> mainStatements = new ArrayList<>();
        private Map<String, VariableInfo> variables = new LinkedHashMap<>();
        private List<StepLog> globalLogs = new ArrayList<>();
        private boolean success = true;
        private String error;

        @JsonProperty("flow_id")
        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        @JsonProperty("input_vars")
        public Builder inputVars(Map<String, FlowValue> inputVars) {
            this.inputVars = inputVars != null ? new LinkedHashMap<>(inputVars) : new LinkedHashMap<>();
            return this;
        }

        @JsonProperty("steps")
        public Builder steps(List<StepDefinition> steps) {
            this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        @JsonProperty("main_func")
        public Builder mainFunc(MainFunc mainFunc) {
            return mainStatements(mainFunc != null ? mainFunc.statements() : null);
        }

        public Builder mainStatements(List<Statement> statements) {
            this.mainStatements = statements != null ? new ArrayList<>(statements) : new ArrayList<>();
            return this;
        }

        @JsonProperty("variables")
        public Builder variables(Map<String, VariableInfo> variables) {
            this.variables = variables != null ? new LinkedHashMap<>(variables) : new LinkedHashMap<>();
            return this;
        }

        public Builder variable(VariableInfo variable) {
            this.variables.put(variable.getName(), variable);
            return this;
        }

        @JsonProperty("global_logs")
        public Builder globalLogs(List<StepLog> globalLogs) {
            this.globalLogs = globalLogs != null ? new ArrayList<>(globalLogs) : new ArrayList<>();
            return this;
        }

        @JsonProperty("success")
        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        @JsonProperty("error")
        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public FlowModel build() {
            return new FlowModel(this);
        }
    }
}
