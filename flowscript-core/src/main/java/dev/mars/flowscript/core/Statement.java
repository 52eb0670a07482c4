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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One executable unit of a flow's {@code main} body.
 *
 * <p>The statement shape is fixed at parse time. Only the execution state
 * ({@link #getStatus()}, start/end timestamps and attempt count) changes afterwards,
 * and only from the flow's own driver thread.</p>
 *
 * <ul>
 *   <li>{@link StatementType#FUNCTION_CALL}: {@code function}, {@code args}, {@code returns},
 *       raw {@code metadata} and typed {@code options}</li>
 *   <li>{@link StatementType#IF}: {@code condition} and nested {@code children}</li>
 *   <li>{@link StatementType#VAR}: the assignment text in {@code content}</li>
 *   <li>{@link StatementType#RETURN}: no payload</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonDeserialize(builder = Statement.Builder.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Statement {

    private final StatementType type;
    private final int lineNumber;
    private final String content;
    private final String desc;
    private final String function;
    private final List<Argument> args;
    private final List<String> returns;
    private final Map<String, FlowValue> metadata;
    private final ExecutionOptions options;
    private final String condition;
    private final List<Statement> children;

    private StatementStatus status;
    private Instant startTime;
    private Instant endTime;
    private int attempts;

    private Statement(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Statement type cannot be null");
        this.lineNumber = builder.lineNumber;
        this.content = builder.content != null ? builder.content : "";
        this.desc = builder.desc != null ? builder.desc : "";
        this.function = builder.function;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.returns = Collections.unmodifiableList(new ArrayList<>(builder.returns));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.options = builder.options != null ? builder.options : ExecutionOptions.DEFAULTS;
        this.condition = builder.condition;
        this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
        this.status = builder.status != null ? builder.status : StatementStatus.PENDING;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.attempts = builder.attempts;

        if (type == StatementType.FUNCTION_CALL) {
            Objects.requireNonNull(function, "Function call statement requires a function");
        }
        if (type == StatementType.IF) {
            Objects.requireNonNull(condition, "If statement requires a condition");
        }
    }

    public static Builder builder(StatementType type) {
        return new Builder().type(type);
    }

    public static Statement returnStatement(int lineNumber, String content) {
        return builder(StatementType.RETURN).lineNumber(lineNumber).content(content).build();
    }

    public static Statement varStatement(int lineNumber, String content) {
        return builder(StatementType.VAR).lineNumber(lineNumber).content(content).build();
    }

    // Execution state transitions

    public void markRunning(Instant now) {
        this.status = StatementStatus.RUNNING;
        this.startTime = now;
        this.endTime = null;
    }

    public void markFinished(StatementStatus finalStatus, Instant now) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + finalStatus);
        }
        this.status = finalStatus;
        this.endTime = now;
    }

    /**
     * Cancels a statement that never started. The start time is left unset.
     */
    public void markCancelled(Instant now) {
        this.status = StatementStatus.CANCELLED;
        this.endTime = now;
    }

    public void recordAttempt() {
        this.attempts++;
    }

    @JsonProperty("type")
    public StatementType getType() {
        return type;
    }

    @JsonProperty("line_number")
    public int getLineNumber() {
        return lineNumber;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("desc")
    public String getDesc() {
        return desc;
    }

    @JsonProperty("function")
    public String getFunction() {
        return function;
    }

    @JsonProperty("args")
    public List<Argument> getArgs() {
        return args;
    }

    @JsonProperty("returns")
    public List<String> getReturns() {
        return returns;
    }

    @JsonProperty("metadata")
    public Map<String, FlowValue> getMetadata() {
        return metadata;
    }

    @JsonProperty("options")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public ExecutionOptions getOptions() {
        return options;
    }

    @JsonProperty("condition")
    public String getCondition() {
        return condition;
    }

    @JsonProperty("children")
    public List<Statement> getChildren() {
        return children;
    }

    @JsonProperty("status")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public StatementStatus getStatus() {
        return status;
    }

    @JsonProperty("start_time")
    public Instant getStartTime() {
        return startTime;
    }

    @JsonProperty("end_time")
    public Instant getEndTime() {
        return endTime;
    }

    @JsonProperty("attempts")
    public int getAttempts() {
        return attempts;
    }

    /**
     * Structural equality plus status; timestamps and attempt counts are ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Statement that = (Statement) o;
        return lineNumber == that.lineNumber &&
                type == that.type &&
                content.equals(that.content) &&
                desc.equals(that.desc) &&
                Objects.equals(function, that.function) &&
                args.equals(that.args) &&
                returns.equals(that.returns) &&
                metadata.equals(that.metadata) &&
                options.equals(that.options) &&
                Objects.equals(condition, that.condition) &&
                children.equals(that.children) &&
                status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lineNumber, content, function, args, returns, condition, children);
    }

    @Override
    public String toString() {
        return "Statement{" +
                "type=" + type.getCode() +
                ", line=" + lineNumber +
                ", status=" + status.getCode() +
                ", content='" + content + '\'' +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private StatementType type;
        private int lineNumber;
        private String content;
        private String desc;
        private String function;
        private List<Argument> args = new ArrayList<>();
        private List<String> returns = new ArrayList<>();
        private Map<String, FlowValue> metadata = new LinkedHashMap<>();
        private ExecutionOptions options;
        private String condition;
        private List<Statement> children = new ArrayList<>();
        private StatementStatus status;
        private Instant startTime;
        private Instant endTime;
        private int attempts;

        @JsonProperty("type")
        public Builder type(StatementType type) {
            this.type = type;
            return this;
        }

        @JsonProperty("line_number")
        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        @JsonProperty("content")
        public Builder content(String content) {
            this.content = content;
            return this;
        }

        @JsonProperty("desc")
        public Builder desc(String desc) {
            this.desc = desc;
            return this;
        }

        @JsonProperty("function")
        public Builder function(String function) {
            this.function = function;
            return this;
        }

        @JsonProperty("args")
        public Builder args(List<Argument> args) {
            this.args = args != null ? new ArrayList<>(args) : new ArrayList<>();
            return this;
        }

        @JsonProperty("returns")
        public Builder returns(List<String> returns) {
            this.returns = returns != null ? new ArrayList<>(returns) : new ArrayList<>();
            return this;
        }

        @JsonProperty("metadata")
        public Builder metadata(Map<String, FlowValue> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        @JsonProperty("options")
        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        @JsonProperty("condition")
        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        @JsonProperty("children")
        public Builder children(List<Statement> children) {
            this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
            return this;
        }

        @JsonProperty("status")
        public Builder status(StatementStatus status) {
            this.status = status;
            return this;
        }

        @JsonProperty("start_time")
        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        @JsonProperty("end_time")
        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        @JsonProperty("attempts")
        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Statement build() {
            return new Statement(this);
        }
    }
}
