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
 * Thrown when flow source cannot be read or is structurally invalid,
 * or when a flow model that failed parsing is handed to the executor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FlowParseException extends FlowScriptException {

    private final String flowId;
    private final int lineNumber;

    public FlowParseException(String message) {
        this(null, -1, message, null);
    }

    public FlowParseException(String message, Throwable cause) {
        this(null, -1, message, cause);
    }

    public FlowParseException(String flowId, String message) {
        this(flowId, -1, message, null);
    }

    public FlowParseException(String flowId, int lineNumber, String message) {
        this(flowId, lineNumber, message, null);
    }

    public FlowParseException(String flowId, int lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.flowId = flowId;
        this.lineNumber = lineNumber;
    }

    public String getFlowId() {
        return flowId;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (flowId != null) {
            sb.append("Flow '").append(flowId).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
