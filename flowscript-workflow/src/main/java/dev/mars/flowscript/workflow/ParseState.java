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

import dev.mars.flowscript.core.StepDefinition;
import dev.mars.flowscript.core.StepLog;
import dev.mars.flowscript.core.VariableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for a single parse: declared steps, the pre-registered variable table
 * and the warnings that end up in the model's global logs.
 */
final class ParseState {

    private static final Logger logger = LoggerFactory.getLogger(ParseState.class);

    static final String PARSER_SOURCE = "parser";

    private final String flowId;
    private final Map<String, StepDefinition> steps = new LinkedHashMap<>();
    private final Map<String, VariableInfo> variables = new LinkedHashMap<>();
    private final List<StepLog> logs = new ArrayList<>();

    ParseState(String flowId) {
        this.flowId = flowId;
    }

    String getFlowId() {
        return flowId;
    }

    void addStep(StepDefinition step, int lineNumber) {
        if (steps.containsKey(step.getName())) {
            warn(lineNumber, "duplicate declaration of step " + step.getName() + " replaces the earlier one");
        }
        steps.put(step.getName(), step);
    }

    StepDefinition getStep(String name) {
        return steps.get(name);
    }

    List<StepDefinition> getSteps() {
        return new ArrayList<>(steps.values());
    }

    void registerVariable(VariableInfo variable) {
        variables.put(variable.getName(), variable);
    }

    Map<String, VariableInfo> getVariables() {
        return variables;
    }

    void warn(int lineNumber, String message) {
        String text = lineNumber > 0 ? "line " + lineNumber + ": " + message : message;
        logger.debug("Flow {} parse warning: {}", flowId, text);
        logs.add(StepLog.of(StepLog.WARN, text, PARSER_SOURCE));
    }

    List<StepLog> getLogs() {
        return logs;
    }
}
