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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed per-call options taken from the {@code {key:val}} block that trails a function call.
 *
 * <p>Recognised keys: {@code retry} (or {@code retry_count}), {@code timeout} (milliseconds,
 * or a number with an {@code ms}, {@code s} or {@code m} suffix), {@code async}, {@code priority}
 * ({@code high}, {@code medium}, {@code low} or an integer), {@code debug}, {@code log_level},
 * {@code ai_model} and {@code err_continue}. Unknown keys are ignored here and stay in the
 * statement's raw metadata.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonDeserialize(builder = ExecutionOptions.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionOptions {

    public static final ExecutionOptions DEFAULTS = builder().build();

    private static final Pattern DURATION = Pattern.compile("^(\\d+)\\s*(ms|s|m)?$");

    private final int retry;
    private final Long timeoutMs;
    private final boolean async;
    private final int priority;
    private final boolean debug;
    private final String logLevel;
    private final String aiModel;
    private final Boolean errContinue;

    private ExecutionOptions(Builder builder) {
        this.retry = builder.retry;
        this.timeoutMs = builder.timeoutMs;
        this.async = builder.async;
        this.priority = builder.priority;
        this.debug = builder.debug;
        this.logLevel = builder.logLevel != null ? builder.logLevel : "info";
        this.aiModel = builder.aiModel != null ? builder.aiModel : "";
        this.errContinue = builder.errContinue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Types a raw metadata map. Values that cannot be interpreted keep their defaults and are
     * reported through {@code warnings}.
     */
    public static ExecutionOptions fromMetadata(Map<String, FlowValue> metadata, Consumer<String> warnings) {
        Objects.requireNonNull(warnings, "Warnings consumer cannot be null");
        Builder builder = builder();
        if (metadata == null || metadata.isEmpty()) {
            return builder.build();
        }

        FlowValue retryValue = metadata.containsKey("retry") ? metadata.get("retry") : metadata.get("retry_count");
        if (retryValue != null) {
            Long retry = toLong(retryValue);
            if (retry == null || retry < 0 || retry >= Integer.MAX_VALUE) {
                warnings.accept("invalid retry value '" + retryValue.asText() + "', using 0");
            } else {
                builder.retry(retry.intValue());
            }
        }

        FlowValue timeoutValue = metadata.get("timeout");
        if (timeoutValue != null) {
            Long timeout = toMillis(timeoutValue);
            if (timeout == null || timeout <= 0) {
                warnings.accept("invalid timeout value '" + timeoutValue.asText() + "', ignoring");
            } else {
                builder.timeoutMs(timeout);
            }
        }

        Boolean async = toBoolean(metadata.get("async"), "async", warnings);
        if (async != null) {
            builder.async(async);
        }

        FlowValue priorityValue = metadata.get("priority");
        if (priorityValue != null) {
            Integer priority = toPriority(priorityValue);
            if (priority == null) {
                warnings.accept("invalid priority value '" + priorityValue.asText() + "', using 0");
            } else {
                builder.priority(priority);
            }
        }

        Boolean debug = toBoolean(metadata.get("debug"), "debug", warnings);
        if (debug != null) {
            builder.debug(debug);
        }

        FlowValue logLevel = metadata.get("log_level");
        if (logLevel != null && !logLevel.isNull()) {
            builder.logLevel(logLevel.asText().toLowerCase(Locale.ROOT));
        }

        FlowValue aiModel = metadata.get("ai_model");
        if (aiModel != null && !aiModel.isNull()) {
            builder.aiModel(aiModel.asText());
        }

        Boolean errContinue = toBoolean(metadata.get(StepDefinition.ERR_CONTINUE), StepDefinition.ERR_CONTINUE, warnings);
        if (errContinue != null) {
            builder.errContinue(errContinue);
        }

        return builder.build();
    }

    private static Long toLong(FlowValue value) {
        if (value instanceof FlowValue.IntegerValue) {
            return ((FlowValue.IntegerValue) value).value();
        }
        if (value instanceof FlowValue.StringValue) {
            try {
                return Long.parseLong(((FlowValue.StringValue) value).value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Long toMillis(FlowValue value) {
        if (value instanceof FlowValue.IntegerValue) {
            return ((FlowValue.IntegerValue) value).value();
        }
        if (value instanceof FlowValue.StringValue) {
            Matcher matcher = DURATION.matcher(((FlowValue.StringValue) value).value().trim().toLowerCase(Locale.ROOT));
            if (!matcher.matches()) {
                return null;
            }
            try {
                long amount = Long.parseLong(matcher.group(1));
                String unit = matcher.group(2);
                if ("s".equals(unit)) {
                    return Duration.ofSeconds(amount).toMillis();
                }
                if ("m".equals(unit)) {
                    return Duration.ofMinutes(amount).toMillis();
                }
                return amount;
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer toPriority(FlowValue value) {
        if (value instanceof FlowValue.StringValue) {
            String text = ((FlowValue.StringValue) value).value().trim().toLowerCase(Locale.ROOT);
            switch (text) {
                case "high":
                    return 1;
                case "medium":
                    return 0;
                case "low":
                    return -1;
                default:
                    break;
            }
        }
        Long number = toLong(value);
        if (number == null || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            return null;
        }
        return number.intValue();
    }

    private static Boolean toBoolean(FlowValue value, String key, Consumer<String> warnings) {
        if (value == null) {
            return null;
        }
        if (value instanceof FlowValue.BooleanValue) {
            return ((FlowValue.BooleanValue) value).value();
        }
        if (value instanceof FlowValue.StringValue) {
            String text = ((FlowValue.StringValue) value).value().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        warnings.accept("invalid " + key + " value '" + value.asText() + "', ignoring");
        return null;
    }

    @JsonProperty("retry")
    public int getRetry() {
        return retry;
    }

    /**
     * Total handler invocations allowed for one statement.
     */
    @JsonIgnore
    public int getMaxAttempts() {
        return retry + 1;
    }

    @JsonProperty("timeout_ms")
    public Long getTimeoutMs() {
        return timeoutMs;
    }

    @JsonIgnore
    public Optional<Duration> getTimeout() {
        return timeoutMs != null ? Optional.of(Duration.ofMillis(timeoutMs)) : Optional.empty();
    }

    @JsonProperty("async")
    public boolean isAsync() {
        return async;
    }

    @JsonProperty("priority")
    public int getPriority() {
        return priority;
    }

    @JsonProperty("debug")
    public boolean isDebug() {
        return debug;
    }

    @JsonProperty("log_level")
    public String getLogLevel() {
        return logLevel;
    }

    @JsonProperty("ai_model")
    public String getAiModel() {
        return aiModel;
    }

    @JsonProperty("err_continue")
    public Boolean getErrContinue() {
        return errContinue;
    }

    /**
     * Resolves error continuation: an explicit call-site setting wins over the step's own flag.
     */
    public boolean isErrContinue(StepDefinition step) {
        if (errContinue != null) {
            return errContinue;
        }
        return step != null && step.isErrContinue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionOptions that = (ExecutionOptions) o;
        return retry == that.retry &&
                async == that.async &&
                priority == that.priority &&
                debug == that.debug &&
                Objects.equals(timeoutMs, that.timeoutMs) &&
                logLevel.equals(that.logLevel) &&
                aiModel.equals(that.aiModel) &&
                Objects.equals(errContinue, that.errContinue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retry, timeoutMs, async, priority, debug, logLevel, aiModel, errContinue);
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
                "retry=" + retry +
                ", timeoutMs=" + timeoutMs +
                ", async=" + async +
                ", priority=" + priority +
                ", debug=" + debug +
                ", logLevel='" + logLevel + '\'' +
                ", aiModel='" + aiModel + '\'' +
                ", errContinue=" + errContinue +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private int retry;
        private Long timeoutMs;
        private boolean async;
        private int priority;
        private boolean debug;
        private String logLevel = "info";
        private String aiModel = "";
        private Boolean errContinue;

        @JsonProperty("retry")
        public Builder retry(int retry) {
            if (retry < 0) {
                throw new IllegalArgumentException("Retry count cannot be negative: " + retry);
            }
            // retry + 1 attempts must fit in an int
            if (retry == Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Retry count too large: " + retry);
            }
            this.retry = retry;
            return this;
        }

        @JsonProperty("timeout_ms")
        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeoutMs = timeout != null ? timeout.toMillis() : null;
            return this;
        }

        @JsonProperty("async")
        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        @JsonProperty("priority")
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        @JsonProperty("debug")
        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        @JsonProperty("log_level")
        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        @JsonProperty("ai_model")
        public Builder aiModel(String aiModel) {
            this.aiModel = aiModel;
            return this;
        }

        @JsonProperty("err_continue")
        public Builder errContinue(Boolean errContinue) {
            this.errContinue = errContinue;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
