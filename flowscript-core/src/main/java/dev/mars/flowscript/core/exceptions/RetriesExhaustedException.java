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
 * A step kept failing until its retry budget ran out. The cause is the last failure observed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class RetriesExhaustedException extends FlowExecutionException {

    private final String stepName;
    private final int attempts;

    public RetriesExhaustedException(String flowId, int lineNumber, String stepName, int attempts, Throwable cause) {
        super(flowId, lineNumber, String.format("step %s failed after %d attempt(s): %s",
                stepName, attempts, cause != null ? cause.getMessage() : "unknown error"), cause);
        this.stepName = stepName;
        this.attempts = attempts;
    }

    public String getStepName() {
        return stepName;
    }

    public int getAttempts() {
        return attempts;
    }
}
