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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a flow model, handed to listeners while the flow executes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface FlowView {

    String getFlowId();

    Map<String, FlowValue> getInputVars();

    List<StepDefinition> getSteps();

    Optional<StepDefinition> findStep(String name);

    List<Statement> getMainStatements();

    Map<String, VariableInfo> getVariables();

    Optional<VariableInfo> getVariable(String name);

    List<StepLog> getGlobalLogs();

    boolean isSuccess();

    String getError();
}
