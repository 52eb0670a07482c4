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

import dev.mars.flowscript.config.FlowScriptConfiguration;
import dev.mars.flowscript.core.Argument;
import dev.mars.flowscript.core.ExecutionOptions;
import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.ParameterInfo;
import dev.mars.flowscript.core.Statement;
import dev.mars.flowscript.core.StatementStatus;
import dev.mars.flowscript.core.StepDefinition;
import dev.mars.flowscript.core.StepLog;
import dev.mars.flowscript.core.VariableInfo;
import dev.mars.flowscript.core.exceptions.FlowCancelledException;
import dev.mars.flowscript.core.exceptions.FlowExecutionException;
import dev.mars.flowscript.core.exceptions.FlowNotRunningException;
import dev.mars.flowscript.core.exceptions.FlowParseException;
import dev.mars.flowscript.core.exceptions.FlowScriptException;
import dev.mars.flowscript.core.exceptions.RetriesExhaustedException;
import dev.mars.flowscript.core.exceptions.StepNotFoundException;
import dev.mars.flowscript.core.exceptions.StepTimeoutException;
import dev.mars.flowscript.workflow.observability.FlowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Interpreter for parsed flows.
 *
 * <p>Statements of one flow run strictly in order on the thread that called
 * {@link #start(FlowContext, FlowModel)}. Every statement moves from {@code pending} through
 * {@code running} to a terminal status and the listener's progress callback fires after each one,
 * so callers can checkpoint the model. Function calls are dispatched to the {@link StepHandler}
 * with positional arguments remapped to the step's formal parameter names, retried with a linear
 * backoff, and either continued past or escalated when they keep failing.</p>
 *
 * <p>Cancellation is cooperative. It is checked before every statement, after every handler
 * attempt and during backoff waits; a handler that is already running is never interrupted
 * unless a statement timeout is enforced.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class SimpleFlowEngine implements FlowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleFlowEngine.class);

    private final StepHandler handler;
    private final FlowListener listener;
    private final Duration retryBackoff;
    private final boolean timeoutEnforced;
    private final FlowMetrics metrics;
    private final ExecutorService executorService;
    private final ExecutorService stepExecutor;
    private final FlowRegistry registry = new FlowRegistry();
    private final Map<String, FlowModel> flows = new ConcurrentHashMap<>();
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    private final TemplateResolver templateResolver = new TemplateResolver();
    private volatile boolean shutdown = false;

    public SimpleFlowEngine(StepHandler handler) {
        this(handler, FlowListener.NONE);
    }

    public SimpleFlowEngine(StepHandler handler, FlowListener listener) {
        this(handler, listener, new FlowScriptConfiguration());
    }

    public SimpleFlowEngine(StepHandler handler, FlowListener listener, FlowScriptConfiguration configuration) {
        this(handler, listener, configuration,
                configuration.isMetricsEnabled() ? FlowMetrics.getInstance() : FlowMetrics.disabled());
    }

    public SimpleFlowEngine(StepHandler handler, FlowListener listener, FlowScriptConfiguration configuration,
                            FlowMetrics metrics) {
        this.handler = Objects.requireNonNull(handler, "Step handler cannot be null");
        this.listener = listener != null ? listener : FlowListener.NONE;
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.retryBackoff = configuration.getRetryBackoff();
        this.timeoutEnforced = configuration.isTimeoutEnforced();
        int workerThreads = configuration.getWorkerThreads();
        this.executorService = workerThreads > 0
                ? Executors.newFixedThreadPool(workerThreads)
                : Executors.newCachedThreadPool();
        this.stepExecutor = Executors.newCachedThreadPool();
        logger.debug("SimpleFlowEngine created with {}", configuration);
    }

    @Override
    public void start(FlowContext context, FlowModel flow) throws FlowScriptException {
        Objects.requireNonNull(context, "Flow context cannot be null");
        admit(context, flow);
        run(context, flow);
    }

    @Override
    public CompletableFuture<FlowModel> startAsync(FlowModel flow) {
        Objects.requireNonNull(flow, "Flow cannot be null");
        return startAsync(FlowContext.root(flow.getFlowId()), flow);
    }

    @Override
    public CompletableFuture<FlowModel> startAsync(FlowContext context, FlowModel flow) {
        Objects.requireNonNull(context, "Flow context cannot be null");
        try {
            admit(context, flow);
        } catch (FlowScriptException | RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    run(context, flow);
                    return flow;
                } catch (FlowScriptException e) {
                    throw new CompletionException(e);
                }
            }, executorService);
        } catch (RejectedExecutionException e) {
            registry.unregister(flow.getFlowId(), context);
            return CompletableFuture.failedFuture(new IllegalStateException("Flow engine is shutdown", e));
        }
    }

    @Override
    public void stop(String flowId) throws FlowNotRunningException {
        logger.info("Stopping flow: {}", flowId);
        registry.cancel(flowId);
    }

    @Override
    public boolean isRunning(String flowId) {
        return registry.isRunning(flowId);
    }

    @Override
    public Optional<FlowModel> get(String flowId) {
        return Optional.ofNullable(flows.get(flowId));
    }

    @Override
    public boolean evict(String flowId) {
        if (registry.isRunning(flowId)) {
            return false;
        }
        return flows.remove(flowId) != null;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        Set<String> running = registry.getRunningFlowIds();
        int cancelled = registry.cancelAll();
        executorService.shutdown();
        stepExecutor.shutdown();
        logger.info("SimpleFlowEngine shutdown initiated, {} running flow(s) cancelled {}", cancelled, running);
    }

    private void admit(FlowContext context, FlowModel flow) throws FlowScriptException {
        Objects.requireNonNull(flow, "Flow cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Flow engine is shutdown");
        }
        if (!flow.isSuccess()) {
            throw new FlowParseException(flow.getFlowId(), "cannot start a flow that failed to parse: " + flow.getError());
        }
        registry.register(flow.getFlowId(), context);
        flows.put(flow.getFlowId(), flow);
        logger.debug("Admitted flow {}, {} flow(s) running", flow.getFlowId(), registry.size());
    }

    private void run(FlowContext context, FlowModel flow) throws FlowScriptException {
        String flowId = flow.getFlowId();
        Instant started = Instant.now();
        metrics.recordFlowStarted();
        logger.info("Starting flow {} with {} statement(s)", flowId, flow.getMainStatements().size());

        try {
            boolean returned = executeStatements(context, flow, flow.getMainStatements());
            if (returned) {
                listener.onReturned(flow);
                metrics.recordFlowReturned(secondsSince(started));
                logger.info("Flow {} returned early", flowId);
            } else {
                listener.onCompleted(flow);
                metrics.recordFlowCompleted(secondsSince(started));
                logger.info("Flow {} completed", flowId);
            }
        } catch (FlowCancelledException e) {
            metrics.recordFlowCancelled(secondsSince(started));
            logger.info("Flow {} cancelled at line {}", flowId, e.getLineNumber());
            throw e;
        } catch (FlowExecutionException | RuntimeException e) {
            metrics.recordFlowFailed(secondsSince(started), e.getClass().getSimpleName());
            // Log without stack trace; details only at debug
            logger.error("Flow {} failed: {}", flowId, e.getMessage());
            if (logger.isDebugEnabled()) {
                logger.debug("Flow failure details for: {}", flowId, e);
            }
            throw e;
        } finally {
            registry.unregister(flowId, context);
        }
    }

    /**
     * @return true if a {@code return} statement ended the flow
     */
    private boolean executeStatements(FlowContext context, FlowModel flow, List<Statement> statements)
            throws FlowExecutionException {
        for (Statement statement : statements) {
            if (context.isCancelled()) {
                statement.markCancelled(Instant.now());
                listener.onProgress(flow);
                throw new FlowCancelledException(flow.getFlowId(), statement.getLineNumber());
            }

            statement.markRunning(Instant.now());
            Outcome outcome;
            try {
                outcome = dispatch(context, flow, statement);
            } catch (FlowCancelledException e) {
                statement.markFinished(StatementStatus.CANCELLED, Instant.now());
                listener.onProgress(flow);
                throw e;
            } catch (FlowExecutionException | RuntimeException e) {
                statement.markFinished(StatementStatus.FAILED, Instant.now());
                listener.onProgress(flow);
                throw e;
            }

            statement.markFinished(outcome.status(), Instant.now());
            metrics.recordStatementExecuted(statement.getType().getCode());
            listener.onProgress(flow);
            if (outcome.returned()) {
                return true;
            }
        }
        return false;
    }

    private Outcome dispatch(FlowContext context, FlowModel flow, Statement statement) throws FlowExecutionException {
        switch (statement.getType()) {
            case FUNCTION_CALL:
                return new Outcome(executeFunctionCall(context, flow, statement), false);
            case IF:
                return executeIf(context, flow, statement);
            case VAR:
                executeAssignment(flow, statement);
                return new Outcome(StatementStatus.COMPLETED, false);
            case RETURN:
                logger.debug("Flow {} reached return at line {}", flow.getFlowId(), statement.getLineNumber());
                return new Outcome(StatementStatus.COMPLETED, true);
            default:
                throw new FlowExecutionException(flow.getFlowId(), statement.getLineNumber(),
                        "unsupported statement type " + statement.getType());
        }
    }

    private StatementStatus executeFunctionCall(FlowContext context, FlowModel flow, Statement statement)
            throws FlowExecutionException {
        String flowId = flow.getFlowId();
        int line = statement.getLineNumber();
        String alias = statement.getFunction();
        StepDefinition step = flow.findStep(alias)
                .orElseThrow(() -> new StepNotFoundException(flowId, line, alias));

        Map<String, FlowValue> input = resolveInput(flow, step, statement);
        ExecutionOptions options = statement.getOptions();
        boolean errContinue = options.isErrContinue(step);
        int maxAttempts = options.getMaxAttempts();

        Exception lastFailure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            statement.recordAttempt();
            metrics.recordStepAttempt(alias, attempt);
            if (options.isDebug()) {
                logger.info("Flow {} line {}: invoking {} ({}), attempt {}/{}, input {}",
                        flowId, line, alias, step.getFunction(), attempt + 1, maxAttempts, input);
            } else {
                logger.debug("Flow {} line {}: invoking {} ({}), attempt {}/{}",
                        flowId, line, alias, step.getFunction(), attempt + 1, maxAttempts);
            }

            StepRequest request = new StepRequest(flowId, step, line, statement.getDesc(), input, options, attempt);
            StepResult result = null;
            Exception failure = null;
            String reason;
            try {
                result = invoke(context, request);
            } catch (FlowCancelledException e) {
                throw e;
            } catch (Exception e) {
                failure = e;
            }

            if (context.isCancelled()) {
                throw new FlowCancelledException(flowId, line);
            }

            if (failure != null) {
                reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
            } else if (result == null) {
                reason = "step " + alias + " returned no result";
                failure = new FlowExecutionException(flowId, line, reason);
            } else {
                appendHandlerLogs(flow, alias, result);
                if (result.isSuccess()) {
                    bindOutputs(flow, step, statement, result);
                    return StatementStatus.COMPLETED;
                }
                reason = result.getError() != null && !result.getError().isEmpty()
                        ? result.getError() : "step " + alias + " reported failure";
                failure = new FlowExecutionException(flowId, line, reason);
            }

            lastFailure = failure;
            metrics.recordStepFailed(alias, failure.getClass().getSimpleName());

            if (errContinue) {
                logger.warn("Flow {} line {}: step {} failed, continuing: {}", flowId, line, alias, reason);
                flow.addGlobalLog(StepLog.of(StepLog.ERROR, reason, alias + ".Error"));
                return StatementStatus.FAILED_CONTINUE;
            }

            if (attempt + 1 < maxAttempts) {
                Duration backoff = retryBackoff.multipliedBy(attempt + 1L);
                logger.warn("Flow {} line {}: step {} attempt {}/{} failed: {}. Retrying in {} ms",
                        flowId, line, alias, attempt + 1, maxAttempts, reason, backoff.toMillis());
                try {
                    if (context.await(backoff)) {
                        throw new FlowCancelledException(flowId, line);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FlowCancelledException(flowId, line);
                }
            }
        }

        throw new RetriesExhaustedException(flowId, line, alias, maxAttempts, lastFailure);
    }

    private StepResult invoke(FlowContext context, StepRequest request) throws Exception {
        Optional<Duration> timeout = request.getOptions().getTimeout();
        if (!timeoutEnforced || timeout.isEmpty()) {
            return handler.executeStep(context, request);
        }

        FlowContext attemptContext = context.child();
        Future<StepResult> future = stepExecutor.submit(() -> handler.executeStep(attemptContext, request));
        try {
            return future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attemptContext.cancel("timeout");
            future.cancel(true);
            throw new StepTimeoutException(request.getFlowId(), request.getLineNumber(),
                    request.getStepName(), timeout.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attemptContext.cancel("interrupted");
            future.cancel(true);
            throw new FlowCancelledException(request.getFlowId(), request.getLineNumber());
        } finally {
            attemptContext.detach();
        }
    }

    /**
     * Binds call-site arguments to formal parameter names. Static steps take no arguments.
     */
    private Map<String, FlowValue> resolveInput(FlowModel flow, StepDefinition step, Statement statement) {
        Map<String, FlowValue> input = new LinkedHashMap<>();
        if (step.isStatic()) {
            return input;
        }

        List<Argument> args = statement.getArgs();
        List<ParameterInfo> params = step.getInputParams();
        int count = Math.min(args.size(), params.size());
        for (int i = 0; i < count; i++) {
            Argument arg = args.get(i);
            FlowValue value;
            if (arg.isInput()) {
                String key = arg.inputKey();
                value = flow.getInputVars().containsKey(key)
                        ? flow.getInputVars().get(key)
                        : FlowValue.ofString(arg.getValue());
            } else {
                value = flow.getVariable(arg.getValue())
                        .map(VariableInfo::getValue)
                        .orElseGet(arg::literalValue);
            }
            input.put(params.get(i).getName(), value);
        }
        return input;
    }

    private void bindOutputs(FlowModel flow, StepDefinition step, Statement statement, StepResult result) {
        List<String> returns = statement.getReturns();
        List<ParameterInfo> outputs = step.getOutputParams();
        for (int i = 0; i < returns.size() && i < outputs.size(); i++) {
            String name = returns.get(i);
            if ("_".equals(name)) {
                continue;
            }
            ParameterInfo formal = outputs.get(i);
            if (!result.getOutputs().containsKey(formal.getName())) {
                logger.debug("Flow {} line {}: step {} produced no '{}' output for {}",
                        flow.getFlowId(), statement.getLineNumber(), step.getName(), formal.getName(), name);
                continue;
            }
            flow.bindVariable(VariableInfo.stepOutput(name, formal.getType(),
                    result.getOutputs().get(formal.getName()), step.getName(), statement.getLineNumber()));
        }
    }

    private static void appendHandlerLogs(FlowModel flow, String alias, StepResult result) {
        for (String message : result.getLogs()) {
            flow.addGlobalLog(StepLog.of(StepLog.INFO, message, alias));
        }
    }

    private Outcome executeIf(FlowContext context, FlowModel flow, Statement statement) throws FlowExecutionException {
        boolean matched = conditionEvaluator.evaluate(statement.getCondition(), flow.getVariables());
        logger.debug("Flow {} line {}: condition '{}' is {}",
                flow.getFlowId(), statement.getLineNumber(), statement.getCondition(), matched);
        if (!matched) {
            return new Outcome(StatementStatus.COMPLETED, false);
        }
        boolean returned = executeStatements(context, flow, statement.getChildren());
        return new Outcome(StatementStatus.COMPLETED, returned);
    }

    private void executeAssignment(FlowModel flow, Statement statement) throws FlowExecutionException {
        TemplateResolver.Assignment assignment = templateResolver.parseAssignment(statement.getContent())
                .orElseThrow(() -> new FlowExecutionException(flow.getFlowId(), statement.getLineNumber(),
                        "malformed assignment: " + statement.getContent()));
        String value = templateResolver.resolve(assignment.value(), flow.getVariables());
        if (templateResolver.hasPlaceholders(value)) {
            logger.debug("Flow {} line {}: unresolved placeholders {} kept verbatim in {}",
                    flow.getFlowId(), statement.getLineNumber(), templateResolver.getPlaceholderNames(value),
                    assignment.name());
        }
        flow.bindVariable(VariableInfo.assignment(assignment.name(), value, statement.getLineNumber()));
    }

    private static double secondsSince(Instant started) {
        return Duration.between(started, Instant.now()).toMillis() / 1000.0;
    }

    private record Outcome(StatementStatus status, boolean returned) {
    }
}
