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

import dev.mars.flowscript.core.FlowValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@link StepHandler} call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class StepResult {

    private final boolean success;
    private final Map<String, FlowValue> outputs;
    private final String error;
    private final List<String> logs;

    private StepResult(Builder builder) {
        this.success = builder.success;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.error = builder.error;
        this.logs = Collections.unmodifiableList(new ArrayList<>(builder.logs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StepResult success(Map<String, ?> outputs) {
        return builder().success(true).outputs(outputs).build();
    }

    public static StepResult failure(String error) {
        return builder().success(false).error(error).build();
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, FlowValue> getOutputs() {
        return outputs;
    }

    public String getError() {
        return error;
    }

    public List<String> getLogs() {
        return logs;
    }

    @Override
    public String toString() {
        return "StepResult{" +
                "success=" + success +
                ", outputs=" + outputs.keySet() +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }

    public static class Builder {
        private boolean success = true;
        private final Map<String, FlowValue> outputs = new LinkedHashMap<>();
        private String error;
        private final List<String> logs = new ArrayList<>();

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        /**
         * Adds an output; the value is converted with {@link FlowValue#of(Object)}.
         */
        public Builder output(String name, Object value) {
            outputs.put(Objects.requireNonNull(name, "Output name cannot be null"), FlowValue.of(value));
            return this;
        }

        public Builder outputs(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::output);
            }
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder log(String message) {
            if (message != null) {
                logs.add(message);
            }
            return this;
        }

        public StepResult build() {
            return new StepResult(this);
        }
    }
}
