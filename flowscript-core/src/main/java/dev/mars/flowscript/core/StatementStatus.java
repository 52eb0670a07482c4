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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution state of a single statement.
 *
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED | FAILED_CONTINUE | CANCELLED}
 *    ↓
 * CANCELLED
 * </pre>
 *
 * <p>{@code FAILED_CONTINUE} records a step failure that was logged and skipped
 * because the step allows error continuation; it does not abort the flow.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum StatementStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    FAILED_CONTINUE("failed_continue"),
    CANCELLED("cancelled");

    private final String code;

    StatementStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StatementStatus fromCode(String code) {
        for (StatementStatus status : values()) {
            if (status.code.equals(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown statement status: " + code);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == FAILED_CONTINUE || this == CANCELLED;
    }

    public boolean isFailure() {
        return this == FAILED || this == FAILED_CONTINUE;
    }
}
