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
import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.FlowView;
import dev.mars.flowscript.core.Statement;
import dev.mars.flowscript.core.StatementStatus;
import dev.mars.flowscript.core.StepLog;
import dev.mars.flowscript.core.exceptions.FlowAlreadyRunningException;
import dev.mars.flowscript.core.exceptions.FlowCancelledException;
import dev.mars.flowscript.core.exceptions.FlowNotRunningException;
import dev.mars.flowscript.core.exceptions.FlowParseException;
import dev.mars.flowscript.core.exceptions.RetriesExhaustedException;
import dev.mars.flowscript.core.exceptions.StepNotFoundException;
import dev.mars.flowscript.core.exceptions.StepTimeoutException;
import dev.mars.flowscript.workflow.observability.FlowMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SimpleFlowEngine}.
 * Flows are parsed from source so each test reads like the flow it runs.
 */
class SimpleFlowEngineTest {

    private static final String CREATE_STEP =
            "create = users.Create(name: string \"Name\") -> (id: string \"ID\", err: error \"Error\");";

    @Mock
    private StepHandler handler;

    @Mock
    private FlowListener listener;

    private AutoCloseable mocks;
    private SimpleFlowEngine engine;
    private final SimpleFlowSourceParser parser = new SimpleFlowSourceParser();

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        engine = newEngine(10, false);
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown();
        mocks.close();
    }

    private SimpleFlowEngine newEngine(long backoffMs, boolean timeoutEnforced) {
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, String.valueOf(backoffMs));
        properties.setProperty(FlowScriptConfiguration.TIMEOUT_ENFORCED, String.valueOf(timeoutEnforced));
        properties.setProperty(FlowScriptConfiguration.METRICS_ENABLED, "false");
        return new SimpleFlowEngine(handler, listener, new FlowScriptConfiguration(properties), FlowMetrics.disabled());
    }

    private FlowModel parse(String flowId, String... lines) {
        FlowModel flow = parser.parse(flowId, String.join("\n", lines));
        assertTrue(flow.isSuccess(), flow.getError());
        return flow;
    }

    private FlowModel createFlow(String flowId, String callSuffix) {
        return parse(flowId,
                "var input = {\"N\": \"Ann\"}",
                CREATE_STEP,
                "func main() {",
                "    id, err := create(input[\"N\"])" + callSuffix,
                "    done := \"created {{id}}\"",
                "}");
    }

    // ========== Function calls ==========

    @Test
    void testSuccessfulCallBindsOutputs() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("id", "u-1")));
        FlowModel flow = createFlow("flow-ok", "");

        engine.start(FlowContext.root(), flow);

        ArgumentCaptor<StepRequest> request = ArgumentCaptor.forClass(StepRequest.class);
        verify(handler, times(1)).executeStep(any(), request.capture());
        assertEquals(Map.of("name", FlowValue.ofString("Ann")), request.getValue().getInput());
        assertEquals("flow-ok", request.getValue().getFlowId());
        assertEquals(0, request.getValue().getAttempt());
        assertEquals("Name", request.getValue().getStep().getInputParams().get(0).getDesc());

        assertEquals(FlowValue.ofString("u-1"), flow.getVariable("id").orElseThrow().getValue());
        assertTrue(flow.getVariable("err").orElseThrow().getValue().isNull());
        assertEquals(FlowValue.ofString("created u-1"), flow.getVariable("done").orElseThrow().getValue());

        Statement call = flow.getMainStatements().get(0);
        assertEquals(StatementStatus.COMPLETED, call.getStatus());
        assertEquals(1, call.getAttempts());
        assertNotNull(call.getStartTime());
        assertNotNull(call.getEndTime());

        verify(listener, times(2)).onProgress(flow);
        verify(listener).onCompleted(flow);
        verify(listener, never()).onReturned(any());
        assertFalse(engine.isRunning("flow-ok"));
    }

    @Test
    void testRetriesAreExhaustedAfterRetryPlusOneAttempts() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.failure("database unavailable"));
        FlowModel flow = createFlow("flow-retry", "{retry: 2}");

        RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class,
                () -> engine.start(FlowContext.root(), flow));

        verify(handler, times(3)).executeStep(any(), any());
        assertEquals(3, exception.getAttempts());
        assertEquals("create", exception.getStepName());
        assertEquals(4, exception.getLineNumber());

        Statement call = flow.getMainStatements().get(0);
        assertEquals(StatementStatus.FAILED, call.getStatus());
        assertEquals(3, call.getAttempts());
        assertEquals(StatementStatus.PENDING, flow.getMainStatements().get(1).getStatus());
        verify(listener, never()).onCompleted(any());
        assertFalse(engine.isRunning("flow-retry"));
    }

    @Test
    void testRetryThenSuccess() throws Exception {
        when(handler.executeStep(any(), any()))
                .thenReturn(StepResult.failure("transient"))
                .thenReturn(StepResult.success(Map.of("id", "u-2")));
        FlowModel flow = createFlow("flow-flaky", "{retry: 3}");

        engine.start(FlowContext.root(), flow);

        ArgumentCaptor<StepRequest> requests = ArgumentCaptor.forClass(StepRequest.class);
        verify(handler, times(2)).executeStep(any(), requests.capture());
        assertEquals(List.of(0, 1), List.of(requests.getAllValues().get(0).getAttempt(),
                requests.getAllValues().get(1).getAttempt()));
        assertEquals(2, flow.getMainStatements().get(0).getAttempts());
        assertEquals(FlowValue.ofString("u-2"), flow.getVariable("id").orElseThrow().getValue());
    }

    @Test
    void testHandlerExceptionIsAFailedAttempt() throws Exception {
        when(handler.executeStep(any(), any())).thenThrow(new IllegalStateException("connection reset"));
        FlowModel flow = createFlow("flow-throw", "");

        RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class,
                () -> engine.start(FlowContext.root(), flow));

        assertEquals(1, exception.getAttempts());
        assertTrue(exception.getCause() instanceof IllegalStateException);
        verify(handler, times(1)).executeStep(any(), any());
    }

    @Test
    void testErrContinueAtCallSite() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.failure("quota exceeded"));
        FlowModel flow = createFlow("flow-continue", "{retry: 3, err_continue: true}");

        engine.start(FlowContext.root(), flow);

        verify(handler, times(1)).executeStep(any(), any());
        assertEquals(StatementStatus.FAILED_CONTINUE, flow.getMainStatements().get(0).getStatus());
        assertEquals(StatementStatus.COMPLETED, flow.getMainStatements().get(1).getStatus());
        assertTrue(flow.getVariable("id").orElseThrow().getValue().isNull());

        StepLog log = flow.getGlobalLogs().stream()
                .filter(entry -> StepLog.ERROR.equals(entry.getLevel()))
                .findFirst()
                .orElseThrow();
        assertEquals("create.Error", log.getSource());
        assertEquals("quota exceeded", log.getMessage());
        verify(listener).onCompleted(flow);
    }

    @Test
    void testErrContinueFromDeclaration() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.failure("smtp down"));
        FlowModel flow = parse("flow-declared",
                "notify = mail.Send(to: string) -> (id: string) {err_continue: true};",
                "func main() {",
                "    id := notify(\"ann@example.com\")",
                "    after := \"still running\"",
                "}");

        engine.start(FlowContext.root(), flow);

        assertEquals(StatementStatus.FAILED_CONTINUE, flow.getMainStatements().get(0).getStatus());
        assertEquals(FlowValue.ofString("still running"), flow.getVariable("after").orElseThrow().getValue());
    }

    @Test
    void testCallSiteOverridesDeclaredErrContinue() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.failure("smtp down"));
        FlowModel flow = parse("flow-override",
                "notify = mail.Send(to: string) -> (id: string) {err_continue: true};",
                "func main() {",
                "    id := notify(\"ann@example.com\"){err_continue: false}",
                "}");

        assertThrows(RetriesExhaustedException.class, () -> engine.start(FlowContext.root(), flow));
    }

    @Test
    void testStaticStepReceivesNoInputAndHandlerLogsAreKept() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.builder()
                .success(true)
                .output("auditId", "a-1")
                .log("audit written")
                .build());
        FlowModel flow = parse("flow-static",
                "audit = audit.Record[case-9] -> (auditId: string);",
                "func main() {",
                "    auditId := audit()",
                "}");

        engine.start(FlowContext.root(), flow);

        ArgumentCaptor<StepRequest> request = ArgumentCaptor.forClass(StepRequest.class);
        verify(handler).executeStep(any(), request.capture());
        assertTrue(request.getValue().getInput().isEmpty());
        assertEquals("case-9", request.getValue().getStep().getCaseId());
        assertEquals(FlowValue.ofString("a-1"), flow.getVariable("auditId").orElseThrow().getValue());
        assertTrue(flow.getGlobalLogs().stream()
                .anyMatch(log -> "audit written".equals(log.getMessage()) && "audit".equals(log.getSource())));
    }

    @Test
    void testOutputsFlowIntoLaterCalls() throws Exception {
        when(handler.executeStep(any(), any()))
                .thenReturn(StepResult.success(Map.of("id", "u-7")))
                .thenReturn(StepResult.success(Map.of("sent", true)));
        FlowModel flow = parse("flow-chain",
                CREATE_STEP,
                "welcome = mail.Welcome(userId: string) -> (sent: bool);",
                "func main() {",
                "    id, _ := create(\"Ann\")",
                "    sent := welcome(id)",
                "}");

        engine.start(FlowContext.root(), flow);

        ArgumentCaptor<StepRequest> requests = ArgumentCaptor.forClass(StepRequest.class);
        verify(handler, times(2)).executeStep(any(), requests.capture());
        assertEquals(FlowValue.ofString("u-7"), requests.getAllValues().get(1).getInput("userId"));
        assertEquals(FlowValue.ofBoolean(true), flow.getVariable("sent").orElseThrow().getValue());
    }

    @Test
    void testRetryAtIntLimitRunsTheHandlerOnce() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("id", "u-1")));
        FlowModel flow = createFlow("flow-huge-retry", "{retry: 2147483647}");

        engine.start(FlowContext.root(), flow);

        verify(handler, times(1)).executeStep(any(), any());
        Statement call = flow.getMainStatements().get(0);
        assertEquals(0, call.getOptions().getRetry());
        assertEquals(StatementStatus.COMPLETED, call.getStatus());
        assertEquals(FlowValue.ofString("u-1"), flow.getVariable("id").orElseThrow().getValue());
        assertTrue(flow.getGlobalLogs().stream()
                .anyMatch(log -> log.getMessage().contains("invalid retry value")));
    }

    @Test
    void testUndeclaredStepFailsTheFlow() {
        FlowModel flow = parse("flow-ghost",
                "func main() {",
                "    x := ghost(1)",
                "}");

        StepNotFoundException exception = assertThrows(StepNotFoundException.class,
                () -> engine.start(FlowContext.root(), flow));

        assertEquals("ghost", exception.getStepName());
        assertEquals(StatementStatus.FAILED, flow.getMainStatements().get(0).getStatus());
        verifyNoInteractions(handler);
    }

    // ========== Control flow ==========

    @Test
    void testEarlyReturnSkipsRemainingStatements() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("ok", false)));
        FlowModel flow = parse("flow-return",
                "validate = users.Validate(email: string) -> (ok: bool);",
                "func main() {",
                "    ok := validate(\"bad\")",
                "    if ok != true {",
                "        return",
                "    }",
                "    after := \"unreachable\"",
                "}");

        engine.start(FlowContext.root(), flow);

        List<Statement> statements = flow.getMainStatements();
        assertEquals(StatementStatus.COMPLETED, statements.get(1).getStatus());
        assertEquals(StatementStatus.COMPLETED, statements.get(1).getChildren().get(0).getStatus());
        assertEquals(StatementStatus.PENDING, statements.get(2).getStatus());
        assertTrue(flow.getVariable("after").orElseThrow().getValue().isNull());
        verify(listener).onReturned(flow);
        verify(listener, never()).onCompleted(any());
        verify(listener, times(3)).onProgress(flow);
    }

    @Test
    void testFalseConditionSkipsChildren() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("ok", true)));
        FlowModel flow = parse("flow-skip",
                "validate = users.Validate(email: string) -> (ok: bool);",
                "func main() {",
                "    ok := validate(\"good\")",
                "    if ok != true {",
                "        return",
                "    }",
                "    after := \"reached\"",
                "}");

        engine.start(FlowContext.root(), flow);

        assertEquals(StatementStatus.PENDING, flow.getMainStatements().get(1).getChildren().get(0).getStatus());
        assertEquals(FlowValue.ofString("reached"), flow.getVariable("after").orElseThrow().getValue());
        verify(listener).onCompleted(flow);
    }

    @Test
    void testUnresolvedPlaceholdersAreKept() throws Exception {
        FlowModel flow = parse("flow-template",
                "var input = {\"name\": \"Ann\"}",
                "func main() {",
                "    greeting := \"Hello {{name}}, {{missing}}\"",
                "}");

        engine.start(FlowContext.root(), flow);

        assertEquals(FlowValue.ofString("Hello Ann, {{missing}}"),
                flow.getVariable("greeting").orElseThrow().getValue());
        verifyNoInteractions(handler);
    }

    // ========== Cancellation and lifecycle ==========

    @Test
    void testCancelledContextRunsNothing() {
        FlowModel flow = createFlow("flow-cancelled", "");
        FlowContext context = FlowContext.root();
        context.cancel();

        FlowCancelledException exception = assertThrows(FlowCancelledException.class,
                () -> engine.start(context, flow));

        assertEquals(4, exception.getLineNumber());
        verifyNoInteractions(handler);
        assertEquals(StatementStatus.CANCELLED, flow.getMainStatements().get(0).getStatus());
        assertEquals(StatementStatus.PENDING, flow.getMainStatements().get(1).getStatus());
        verify(listener, times(1)).onProgress(flow);
        assertFalse(engine.isRunning("flow-cancelled"));
    }

    @Test
    void testStopInterruptsBackoff() throws Exception {
        engine.shutdown();
        engine = newEngine(10_000, false);
        CountDownLatch invoked = new CountDownLatch(1);
        when(handler.executeStep(any(), any())).thenAnswer(invocation -> {
            invoked.countDown();
            return StepResult.failure("busy");
        });
        FlowModel flow = createFlow("flow-stop", "{retry: 5}");

        CompletableFuture<FlowModel> future = engine.startAsync(flow);
        assertTrue(invoked.await(5, TimeUnit.SECONDS));
        assertTrue(engine.isRunning("flow-stop"));
        engine.stop("flow-stop");

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(exception.getCause() instanceof FlowCancelledException);
        verify(handler, times(1)).executeStep(any(), any());
        assertEquals(StatementStatus.CANCELLED, flow.getMainStatements().get(0).getStatus());
        assertFalse(engine.isRunning("flow-stop"));
    }

    @Test
    void testCancelDuringSuccessfulCallSkipsOutputBinding() throws Exception {
        when(handler.executeStep(any(), any())).thenAnswer(invocation -> {
            FlowContext context = invocation.getArgument(0);
            context.cancel();
            return StepResult.success(Map.of("id", "u-1"));
        });
        FlowModel flow = createFlow("flow-cancel-after-call", "");

        assertThrows(FlowCancelledException.class, () -> engine.start(FlowContext.root(), flow));

        verify(handler, times(1)).executeStep(any(), any());
        assertEquals(StatementStatus.CANCELLED, flow.getMainStatements().get(0).getStatus());
        assertTrue(flow.getVariable("id").orElseThrow().getValue().isNull());
        assertEquals(StatementStatus.PENDING, flow.getMainStatements().get(1).getStatus());
        verify(listener, never()).onCompleted(any());
        assertFalse(engine.isRunning("flow-cancel-after-call"));
    }

    @Test
    void testStopUnknownFlow() {
        assertThrows(FlowNotRunningException.class, () -> engine.stop("no-such-flow"));
    }

    @Test
    void testDuplicateFlowIdRejectedWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(handler.executeStep(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return StepResult.success(Map.of("id", "u-1"));
        });
        FlowModel flow = createFlow("flow-dup", "");

        CompletableFuture<FlowModel> future = engine.startAsync(flow);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThrows(FlowAlreadyRunningException.class, () -> engine.start(FlowContext.root(), flow));

        release.countDown();
        assertSame(flow, future.get(5, TimeUnit.SECONDS));
        assertFalse(engine.isRunning("flow-dup"));
    }

    @Test
    void testUnparsedFlowIsRejected() {
        FlowModel failed = parser.parse("broken", "func main() {");

        assertThrows(FlowParseException.class, () -> engine.start(FlowContext.root(), failed));
        assertTrue(engine.get("broken").isEmpty());
    }

    @Test
    void testEnforcedTimeout() throws Exception {
        engine.shutdown();
        engine = newEngine(10, true);
        when(handler.executeStep(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return StepResult.success(Map.of());
        });
        FlowModel flow = createFlow("flow-timeout", "{timeout: 50}");

        RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class,
                () -> engine.start(FlowContext.root(), flow));

        assertTrue(exception.getCause() instanceof StepTimeoutException);
        assertEquals(50, ((StepTimeoutException) exception.getCause()).getTimeout().toMillis());
    }

    @Test
    void testGetAndEvict() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("id", "u-1")));
        FlowModel flow = createFlow("flow-kept", "");

        engine.startAsync(flow).get(5, TimeUnit.SECONDS);

        assertSame(flow, engine.get("flow-kept").orElseThrow());
        assertTrue(engine.evict("flow-kept"));
        assertTrue(engine.get("flow-kept").isEmpty());
        assertFalse(engine.evict("flow-kept"));
    }

    @Test
    void testShutdownRejectsNewFlows() {
        engine.shutdown();
        FlowModel flow = createFlow("flow-late", "");

        assertThrows(IllegalStateException.class, () -> engine.start(FlowContext.root(), flow));
        CompletableFuture<FlowModel> future = engine.startAsync(flow);
        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void testShutdownCancelsRunningFlows() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(handler.executeStep(any(), any())).thenAnswer(invocation -> {
            FlowContext context = invocation.getArgument(0);
            started.countDown();
            context.await(Duration.ofSeconds(5));
            return StepResult.success(Map.of("id", "u-1"));
        });
        FlowModel flow = createFlow("flow-shutdown", "");

        CompletableFuture<FlowModel> future = engine.startAsync(flow);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        engine.shutdown();

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(exception.getCause() instanceof FlowCancelledException);
        assertFalse(engine.isRunning("flow-shutdown"));
        assertTrue(flow.getVariable("id").orElseThrow().getValue().isNull());
    }

    @Test
    void testListenerSeesProgressAsFlowView() throws Exception {
        when(handler.executeStep(any(), any())).thenReturn(StepResult.success(Map.of("id", "u-1")));
        FlowModel flow = createFlow("flow-view", "");

        engine.start(FlowContext.root(), flow);

        ArgumentCaptor<FlowView> views = ArgumentCaptor.forClass(FlowView.class);
        verify(listener, atLeastOnce()).onProgress(views.capture());
        assertEquals("flow-view", views.getValue().getFlowId());
        assertTrue(views.getValue().isSuccess());
    }
}
