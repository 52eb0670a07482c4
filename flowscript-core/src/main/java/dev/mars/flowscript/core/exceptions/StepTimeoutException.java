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

import java.time.Duration;

/**
 * A single handler attempt exceeded the statement's timeout. Treated like any other
 * handler failure, so it is retried or continued according to the statement's options.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class StepTimeoutException extends FlowExecutionException {

    private final String stepName;
    private final Duration timeout;

    public StepTimeoutException(String flowId, int lineNumber, String stepName, Duration timeout) {
        super(flowId, lineNumber, String.format("step %s timed out after %d ms", stepName, timeout.toMillis()));
        this.stepName = stepName;
        this.timeout = timeout;
    }

    public String getStepName() {
        return stepName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
