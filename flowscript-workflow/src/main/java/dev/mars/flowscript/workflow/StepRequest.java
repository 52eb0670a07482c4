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

import dev.mars.flowscript.core.ExecutionOptions;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.ParameterInfo;
import dev.mars.flowscript.core.StepDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link StepHandler} receives for one attempt of a function-call statement.
 *
 * <p>{@link #getInput()} is keyed by the step's formal input parameter names, never by the
 * call-site argument text. Static steps receive an empty input map and are identified by
 * {@link StepDefinition#getCaseId()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class StepRequest {

    private final String flowId;
    private final StepDefinition step;
    private final int lineNumber;
    private final String description;
    private final Map<String, FlowValue> input;
    private final ExecutionOptions options;
    private final int attempt;

    public StepRequest(String flowId, StepDefinition step, int lineNumber, String description,
                       Map<String, FlowValue> input, ExecutionOptions options, int attempt) {
        this.flowId = Objects.requireNonNull(flowId, "Flow ID cannot be null");
        this.step = Objects.requireNonNull(step, "Step definition cannot be null");
        this.lineNumber = lineNumber;
        this.description = description != null ? description : "";
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input != null ? input : Map.of()));
        this.options = options != null ? options : ExecutionOptions.DEFAULTS;
        this.attempt = attempt;
    }

    public String getFlowId() {
        return flowId;
    }

    public StepDefinition getStep() {
        return step;
    }

    public String getStepName() {
        return step.getName();
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * The statement's {@code //desc:} text, or the step's own description when the statement has none.
     */
    public String getDescription() {
        return description.isEmpty() ? step.getDesc() : description;
    }

    public Map<String, FlowValue> getInput() {
        return input;
    }

    public FlowValue getInput(String name) {
        return input.getOrDefault(name, FlowValue.NULL);
    }

    /**
     * Input values as plain Java objects, for handlers that do not work with {@link FlowValue}.
     */
    public Map<String, Object> getInputAsJava() {
        Map<String, Object> values = new LinkedHashMap<>();
        input.forEach((key, value) -> values.put(key, value.toJava()));
        return values;
    }

    public List<ParameterInfo> getExpectedOutputs() {
        return step.getOutputParams();
    }

    public ExecutionOptions getOptions() {
        return options;
    }

    /**
     * Zero-based attempt index; 0 is the first call, higher values are retries.
     */
    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "StepRequest{" +
                "flowId='" + flowId + '\'' +
                ", step='" + step.getName() + '\'' +
                ", line=" + lineNumber +
                ", attempt=" + attempt +
                ", input=" + input.keySet() +
                '}';
    }
}
