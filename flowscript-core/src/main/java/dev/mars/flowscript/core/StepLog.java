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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A log line recorded on the flow itself: parser warnings, handler logs and
 * continued step failures.
 */
public final class StepLog {

    public static final String INFO = "info";
    public static final String WARN = "warn";
    public static final String ERROR = "error";

    private final Instant timestamp;
    private final String level;
    private final String message;
    private final String source;

    @JsonCreator
    public StepLog(@JsonProperty("timestamp") Instant timestamp,
                   @JsonProperty("level") String level,
                   @JsonProperty("message") String message,
                   @JsonProperty("source") String source) {
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.level = level != null ? level : INFO;
        this.message = message != null ? message : "";
        this.source = source != null ? source : "";
    }

    public static StepLog of(String level, String message, String source) {
        return new StepLog(Instant.now(), level, message, source);
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("level")
    public String getLevel() {
        return level;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepLog stepLog = (StepLog) o;
        return timestamp.equals(stepLog.timestamp) &&
                level.equals(stepLog.level) &&
                message.equals(stepLog.message) &&
                source.equals(stepLog.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, message, source);
    }

    @Override
    public String toString() {
        return "[" + level + "] " + source + ": " + message;
    }
}
