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

package dev.mars.flowscript.core.exceptions;

/**
 * A flow with the same ID is already executing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowAlreadyRunningException extends FlowScriptException {

    private final String flowId;

    public FlowAlreadyRunningException(String flowId) {
        super("flow " + flowId + " is already running");
        this.flowId = flowId;
    }

    public String getFlowId() {
        return flowId;
    }
}
