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


package dev.mars.leadflow.workflow;

import dev.mars.leadflow.workflow.config.EngineConfiguration;
import dev.mars.leadflow.workflow.exceptions.GraphException;
import dev.mars.leadflow.workflow.exceptions.RegistryException;
import dev.mars.leadflow.workflow.handler.HandlerFactory;
import dev.mars.leadflow.workflow.handler.HandlerRegistry;
import dev.mars.leadflow.workflow.handler.ResolvedInput;
import dev.mars.leadflow.workflow.handler.StepExecutionException;
import dev.mars.leadflow.workflow.observability.WorkflowMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for DagWorkflowEngine: traversal order, failure isolation, fan-in,
 * pre-flight rejection, cancellation and bounded concurrency.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-01
 */
class DagWorkflowEngineTest {

    @Mock
    private HandlerFactory mockFactory;

    @Mock
    private WorkflowEventListener mockListener;

    private AutoCloseable mocks;
    private DagWorkflowEngine engine;
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final Map<String, ResolvedInput> receivedInputs = new ConcurrentHashMap<>();
    private final List<String> completionOrder = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        engine = newEngine(registry(), 4, false);
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown();
        mocks.close();
    }

    private DagWorkflowEngine newEngine(HandlerRegistry registry, int maxConcurrentSteps, boolean metrics) {
        Properties properties = new Properties();
        properties.setProperty(EngineConfiguration.MAX_CONCURRENT_STEPS, String.valueOf(maxConcurrentSteps));
        properties.setProperty(EngineConfiguration.METRICS_ENABLED, String.valueOf(metrics));
        DagWorkflowEngine created = new DagWorkflowEngine(registry, new EngineConfiguration(properties));
        created.addListener(new WorkflowEventListener() {
            @Override
            public void onStepCompleted(String executionId, StepResult result) {
                completionOrder.add(result.getStepId());
            }
        });
        return created;
    }

    private void track(String stepId, ResolvedInput input) {
        invocations.computeIfAbsent(stepId, id -> new AtomicInteger()).incrementAndGet();
        receivedInputs.put(stepId, input);
    }

    private int invocationCount(String stepId) {
        AtomicInteger count = invocations.get(stepId);
        return count != null ? count.get() : 0;
    }

    private HandlerRegistry registry() {
        return HandlerRegistry.builder()
                .register("Value", config -> (input, workflowConfig) -> {
                    track(config.getStepId(), input);
                    return Map.of("value", config.getStepId() + "-out");
                })
                .register("Fail", config -> (input, workflowConfig) -> {
                    track(config.getStepId(), input);
                    throw new StepExecutionException("boom in " + config.getStepId());
                })
                .register("Runtime", config -> (input, workflowConfig) -> {
                    track(config.getStepId(), input);
                    throw new IllegalArgumentException("bad argument");
                })
                .register("Null", config -> (input, workflowConfig) -> {
                    track(config.getStepId(), input);
                    return null;
                })
                .register("Config", config -> (input, workflowConfig) -> {
                    track(config.getStepId(), input);
                    return Map.of("persona", workflowConfig.get("persona"));
                })
                .register("Mocked", mockFactory)
                .build();
    }

    private static StepSpec step(String id, String type, String... next) {
        return StepSpec.builder(id, type).next(next).build();
    }

    private static StepSpec stepReading(String id, String type, String targetKey, String sourceStep, String... next) {
        return StepSpec.builder(id, type)
                .input(InputBinding.stepOutput(targetKey, sourceStep, "value"))
                .next(next)
                .build();
    }

    private static WorkflowSpec workflow(StepSpec... steps) {
        return WorkflowSpec.builder("test-workflow").steps(List.of(steps)).build();
    }

    private static ExecutionContext context(String executionId) {
        return ExecutionContext.builder().executionId(executionId).userId("test-user").build();
    }

    // e -> a, e -> b, a -> c, b -> c
    private static WorkflowSpec fanIn(String typeOfB) {
        return workflow(
                step("e", "Value", "a", "b"),
                step("a", "Value", "c"),
                step("b", typeOfB, "c"),
                StepSpec.builder("c", "Value")
                        .input(InputBinding.stepOutput("fromA", "a", "value"))
                        .input(InputBinding.stepOutput("fromB", "b", "value"))
                        .build());
    }

    @Test
    void testLinearWorkflowSucceeds() throws Exception {
        WorkflowSpec spec = workflow(
                step("a", "Value", "b"),
                stepReading("b", "Value", "prev", "a", "c"),
                stepReading("c", "Value", "prev", "b"));

        WorkflowResult result = engine.execute(spec, context("exec-linear"));

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertTrue(result.isSuccessful());
        assertEquals("exec-linear", result.getExecutionId());
        assertEquals("test-workflow", result.getWorkflowName());
        assertEquals(List.of("a", "b", "c"), completionOrder);
        assertEquals("b-out", receivedInputs.get("c").get("prev").orElseThrow());
        assertEquals(Map.of("value", "b-out"), result.getStepResult("b").orElseThrow().getOutput());
        assertEquals(3, result.getSucceededCount());
        assertFalse(result.getEndTime().isBefore(result.getStartTime()));
    }

    @Test
    void testMiddleStepFailureIsIsolated() throws Exception {
        WorkflowSpec spec = workflow(
                step("a", "Value", "b"),
                stepReading("b", "Fail", "prev", "a", "c"),
                stepReading("c", "Value", "prev", "b"));

        WorkflowResult result = engine.execute(spec, context("exec-partial"));

        assertEquals(WorkflowStatus.PARTIAL, result.getStatus());
        assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("a"));
        assertEquals(StepStatus.FAILED, result.getStepStatus("b"));
        assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("c"));
        assertEquals("StepExecutionException: boom in b",
                result.getStepResult("b").orElseThrow().getError().orElseThrow());
        assertTrue(result.getStepResult("b").orElseThrow().getOutput().isEmpty());
        assertTrue(receivedInputs.get("c").isAbsent("prev"));
    }

    @Test
    void testEntryFailureFailsWorkflowButSuccessorsStillRun() throws Exception {
        WorkflowSpec spec = workflow(step("a", "Fail", "b"), step("b", "Value"));

        WorkflowResult result = engine.execute(spec, context("exec-entry-failed"));

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("b"));
        assertEquals(1, invocationCount("b"));
    }

    @Test
    void testFanInRunsOnceAfterAllPredecessors() throws Exception {
        WorkflowResult result = engine.execute(fanIn("Fail"), context("exec-fan-in"));

        assertEquals(WorkflowStatus.PARTIAL, result.getStatus());
        assertEquals(1, invocationCount("c"));
        assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("c"));
        assertTrue(completionOrder.indexOf("c") > completionOrder.indexOf("a"));
        assertTrue(completionOrder.indexOf("c") > completionOrder.indexOf("b"));

        ResolvedInput input = receivedInputs.get("c");
        assertEquals("a-out", input.get("fromA").orElseThrow());
        assertTrue(input.isAbsent("fromB"));
    }

    @Test
    void testEveryStepRecordedExactlyOnceInDeclarationOrder() throws Exception {
        WorkflowResult result = engine.execute(fanIn("Value"), context("exec-once"));

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(List.of("e", "a", "b", "c"), result.getStepResults().stream()
                .map(StepResult::getStepId)
                .collect(Collectors.toList()));
        assertEquals(4, completionOrder.size());
        for (String stepId : List.of("e", "a", "b", "c")) {
            assertEquals(1, invocationCount(stepId), stepId);
        }
    }

    @Test
    void testSingleWorkerOrderIsDeterministic() throws Exception {
        engine.shutdown();
        engine = newEngine(registry(), 1, false);

        engine.execute(fanIn("Value"), context("exec-order-1"));
        assertEquals(List.of("e", "a", "b", "c"), completionOrder);

        completionOrder.clear();
        WorkflowSpec reversed = workflow(
                step("e", "Value", "b", "a"),
                step("a", "Value", "c"),
                step("b", "Value", "c"),
                step("c", "Value"));
        engine.execute(reversed, context("exec-order-2"));
        assertEquals(List.of("e", "a", "b", "c"), completionOrder);
    }

    @Test
    void testStepsReleasedTogetherRunInDeclarationOrder() throws Exception {
        engine.shutdown();
        engine = newEngine(registry(), 1, false);

        WorkflowSpec spec = workflow(
                step("e", "Value", "z", "b", "a"),
                step("a", "Value"),
                step("b", "Value"),
                step("z", "Value"));
        engine.execute(spec, context("exec-order-3"));

        assertEquals(List.of("e", "a", "b", "z"), completionOrder);
    }

    @Test
    void testRecordedOutputCannotBeChangedByLaterSteps() throws Exception {
        List<Object> returned = new ArrayList<>(List.of("acme"));
        List<String> mutationErrors = new CopyOnWriteArrayList<>();
        HandlerRegistry registry = HandlerRegistry.builder()
                .register("Producer", config -> (input, workflowConfig) -> Map.of("leads", returned))
                .register("Appender", config -> (input, workflowConfig) -> {
                    @SuppressWarnings("unchecked")
                    List<Object> leads = input.get("leads", List.class).orElseThrow();
                    try {
                        leads.add("injected-by-" + config.getStepId());
                    } catch (UnsupportedOperationException e) {
                        mutationErrors.add(config.getStepId());
                    }
                    return Map.of("count", leads.size());
                })
                .build();
        engine.shutdown();
        engine = newEngine(registry, 2, false);

        WorkflowSpec spec = workflow(
                StepSpec.builder("a", "Producer").next("b", "c").build(),
                StepSpec.builder("b", "Appender").input(InputBinding.stepOutput("leads", "a", "leads")).build(),
                StepSpec.builder("c", "Appender").input(InputBinding.stepOutput("leads", "a", "leads")).build());
        returned.add("globex");

        WorkflowResult result = engine.execute(spec, context("exec-immutable"));
        returned.add("added-after-return");

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(List.of("b", "c"), mutationErrors.stream().sorted().collect(Collectors.toList()));
        assertEquals(Map.of("leads", List.of("acme", "globex")), result.getStepResult("a").orElseThrow().getOutput());
        assertEquals(Map.of("count", 2), result.getStepResult("b").orElseThrow().getOutput());
    }

    @Test
    void testContextInputsReachSteps() throws Exception {
        WorkflowSpec spec = workflow(StepSpec.builder("a", "Value")
                .input(InputBinding.context("industry", "search.industry"))
                .input(InputBinding.context("requestedBy", ExecutionContext.USER_ID_KEY))
                .input(InputBinding.context("limit", "search.limit", 10))
                .build());
        ExecutionContext context = ExecutionContext.builder()
                .executionId("exec-context")
                .userId("alice")
                .input("search", Map.of("industry", "SaaS"))
                .build();

        engine.execute(spec, context);

        ResolvedInput input = receivedInputs.get("a");
        assertEquals("SaaS", input.get("industry").orElseThrow());
        assertEquals("alice", input.get("requestedBy").orElseThrow());
        assertEquals(10, input.get("limit").orElseThrow());
    }

    @Test
    void testRepeatedRunsAreIdempotent() throws Exception {
        WorkflowResult first = engine.execute(fanIn("Fail"), context("exec-run-1"));
        WorkflowResult second = engine.execute(fanIn("Fail"), context("exec-run-2"));

        assertEquals(first.getStatus(), second.getStatus());
        Function<WorkflowResult, Map<String, List<Object>>> summary = result -> result.getStepResults().stream()
                .collect(Collectors.toMap(StepResult::getStepId,
                        step -> List.<Object>of(step.getStatus(), step.getOutput(), step.getError().orElse(""))));
        assertEquals(summary.apply(first), summary.apply(second));
    }

    @Test
    void testRuntimeExceptionIsRecordedAsFailure() throws Exception {
        WorkflowResult result = engine.execute(workflow(step("a", "Value", "b"), step("b", "Runtime")),
                context("exec-runtime"));

        assertEquals(WorkflowStatus.PARTIAL, result.getStatus());
        assertEquals("IllegalArgumentException: bad argument",
                result.getStepResult("b").orElseThrow().getError().orElseThrow());
    }

    @Test
    void testNullOutputIsFailure() throws Exception {
        WorkflowResult result = engine.execute(workflow(step("a", "Null")), context("exec-null"));

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("IllegalStateException: Handler returned no output",
                result.getStepResult("a").orElseThrow().getError().orElseThrow());
    }

    @Test
    void testMissingRequiredOutputIsFailure() throws Exception {
        WorkflowSpec spec = workflow(StepSpec.builder("a", "Value").requiredOutputs("value", "score").build());

        WorkflowResult result = engine.execute(spec, context("exec-required"));

        assertEquals(StepStatus.FAILED, result.getStepStatus("a"));
        assertTrue(result.getStepResult("a").orElseThrow().getError().orElseThrow()
                .contains("Missing required output field: score"));
    }

    @Test
    void testWorkflowConfigIsPassedToHandlers() throws Exception {
        WorkflowSpec spec = WorkflowSpec.builder("configured")
                .config("persona", "SDR")
                .step(StepSpec.builder("a", "Config")
                        .input(InputBinding.workflowConfig("persona", "persona"))
                        .build())
                .build();

        WorkflowResult result = engine.execute(spec, context("exec-config"));

        assertEquals(Map.of("persona", "SDR"), result.getStepResult("a").orElseThrow().getOutput());
        assertEquals("SDR", receivedInputs.get("a").get("persona").orElseThrow());
    }

    @Test
    void testExecuteWithPrebuiltGraph() throws Exception {
        ExecutionGraph graph = ExecutionGraph.build(workflow(step("a", "Value", "b"), step("b", "Value")));

        WorkflowResult result = engine.execute(graph, ExecutionContext.create());

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertNotNull(result.getExecutionId());
    }

    @Nested
    class PreFlight {

        @Test
        void testCycleIsRejectedWithoutInvokingHandlers() {
            WorkflowSpec spec = workflow(step("a", "Mocked", "b"), step("b", "Mocked", "c"), step("c", "Mocked", "b"));

            GraphException exception = assertThrows(GraphException.class,
                    () -> engine.execute(spec, context("exec-cycle")));

            assertTrue(exception.hasError(GraphError.Type.CYCLE_DETECTED));
            verifyNoInteractions(mockFactory);
            assertNull(engine.getStatus("exec-cycle"));
        }

        @Test
        void testUnknownSuccessorIsRejected() {
            WorkflowSpec spec = workflow(step("a", "Mocked", "ghost"));

            ValidationResult validation = engine.validate(spec);
            assertTrue(validation.hasError(GraphError.Type.UNKNOWN_STEP));

            assertThrows(GraphException.class, () -> engine.execute(spec, context("exec-unknown")));
            verifyNoInteractions(mockFactory);
        }

        @Test
        void testTwoEntryStepsAreRejected() {
            WorkflowSpec spec = workflow(step("a", "Mocked", "c"), step("b", "Mocked", "c"), step("c", "Mocked"));

            assertTrue(engine.validate(spec).hasError(GraphError.Type.AMBIGUOUS_ENTRY));
            assertThrows(GraphException.class, () -> engine.execute(spec, context("exec-ambiguous")));
            verifyNoInteractions(mockFactory);
        }

        @Test
        void testUnregisteredHandlerTypeIsRejectedBeforeAnyStepRuns() {
            WorkflowSpec spec = workflow(step("a", "Mocked", "b"), step("b", "Unregistered"));

            assertTrue(engine.validate(spec).hasError(GraphError.Type.UNKNOWN_HANDLER_TYPE));

            RegistryException exception = assertThrows(RegistryException.class,
                    () -> engine.execute(spec, context("exec-registry")));
            assertEquals("Unregistered", exception.getTypeName());
            assertEquals("b", exception.getStepId());
            verifyNoInteractions(mockFactory);
        }

        @Test
        void testSubmitCompletesExceptionallyForInvalidGraph() {
            WorkflowSpec spec = workflow(step("a", "Mocked", "a"));

            CompletableFuture<WorkflowResult> future = engine.submit(spec, context("exec-async-cycle"));

            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(GraphException.class, exception.getCause());
        }
    }

    @Nested
    class Listeners {

        @Test
        void testLifecycleCallbacks() throws Exception {
            engine.addListener(mockListener);

            engine.execute(workflow(step("a", "Value", "b"), step("b", "Fail")), context("exec-events"));

            verify(mockListener).onWorkflowStarted(eq("exec-events"), any(WorkflowSpec.class));
            verify(mockListener).onStepStarted("exec-events", "a");
            verify(mockListener).onStepStarted("exec-events", "b");
            verify(mockListener, times(2)).onStepCompleted(eq("exec-events"), any(StepResult.class));
            verify(mockListener).onWorkflowCompleted(argThat(result -> result.getStatus() == WorkflowStatus.PARTIAL));
        }

        @Test
        void testFailingListenerDoesNotAffectRun() throws Exception {
            doThrow(new RuntimeException("sink unavailable"))
                    .when(mockListener).onStepCompleted(anyString(), any(StepResult.class));
            engine.addListener(mockListener);

            WorkflowResult result = engine.execute(workflow(step("a", "Value", "b"), step("b", "Value")),
                    context("exec-listener-failure"));

            assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
            verify(mockListener).onWorkflowCompleted(any(WorkflowResult.class));
        }

        @Test
        void testRemovedListenerIsNotCalled() throws Exception {
            engine.addListener(mockListener);
            engine.removeListener(mockListener);

            engine.execute(workflow(step("a", "Value")), context("exec-removed"));

            verifyNoInteractions(mockListener);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void testConcurrencyIsBounded() throws Exception {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            HandlerRegistry registry = HandlerRegistry.builder()
                    .register("Value", config -> (input, workflowConfig) -> Map.of("value", 1))
                    .register("Slow", config -> (input, workflowConfig) -> {
                        int now = running.incrementAndGet();
                        maxRunning.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new StepExecutionException("interrupted", e);
                        } finally {
                            running.decrementAndGet();
                        }
                        return Map.of("done", true);
                    })
                    .build();
            engine.shutdown();
            engine = newEngine(registry, 2, false);

            WorkflowSpec spec = workflow(
                    step("e", "Value", "s1", "s2", "s3", "s4", "s5"),
                    step("s1", "Slow"), step("s2", "Slow"), step("s3", "Slow"),
                    step("s4", "Slow"), step("s5", "Slow"));

            WorkflowResult result = engine.execute(spec, context("exec-bounded"));

            assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
            assertEquals(6, result.getSucceededCount());
            assertTrue(maxRunning.get() <= 2, "at most two steps should run at once but saw " + maxRunning.get());
        }

        @Test
        void testCancellationSkipsUndispatchedSteps() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            HandlerRegistry registry = HandlerRegistry.builder()
                    .register("Value", config -> (input, workflowConfig) -> {
                        track(config.getStepId(), input);
                        return Map.of("value", config.getStepId());
                    })
                    .register("Block", config -> (input, workflowConfig) -> {
                        started.countDown();
                        try {
                            if (!release.await(5, TimeUnit.SECONDS)) {
                                throw new StepExecutionException("never released");
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new StepExecutionException("interrupted", e);
                        }
                        return Map.of("value", "blocked");
                    })
                    .build();
            engine.shutdown();
            engine = newEngine(registry, 2, false);

            WorkflowSpec spec = workflow(step("e", "Value", "a"), step("a", "Block", "b"), step("b", "Value"));
            CompletableFuture<WorkflowResult> future = engine.submit(spec, context("exec-cancel"));

            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertEquals(WorkflowStatus.RUNNING, engine.getStatus("exec-cancel"));
            assertTrue(engine.getActiveExecutionIds().contains("exec-cancel"));
            assertTrue(engine.cancel("exec-cancel"));
            release.countDown();

            WorkflowResult result = future.get(5, TimeUnit.SECONDS);
            assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
            assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("e"));
            assertEquals(StepStatus.SUCCEEDED, result.getStepStatus("a"));
            assertEquals(StepStatus.SKIPPED, result.getStepStatus("b"));
            assertEquals("cancelled", result.getStepResult("b").orElseThrow().getSkipReason().orElseThrow());
            assertEquals(0, invocationCount("b"));
            assertNull(engine.getStatus("exec-cancel"));
        }

        @Test
        void testCancelAfterLastDispatchKeepsOutcome() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            HandlerRegistry registry = HandlerRegistry.builder()
                    .register("Value", config -> (input, workflowConfig) -> Map.of("value", config.getStepId()))
                    .register("Block", config -> (input, workflowConfig) -> {
                        started.countDown();
                        try {
                            if (!release.await(5, TimeUnit.SECONDS)) {
                                throw new StepExecutionException("never released");
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new StepExecutionException("interrupted", e);
                        }
                        return Map.of("value", "done");
                    })
                    .build();
            engine.shutdown();
            engine = newEngine(registry, 2, false);

            WorkflowSpec spec = workflow(step("e", "Value", "last"), step("last", "Block"));
            CompletableFuture<WorkflowResult> future = engine.submit(spec, context("exec-late-cancel"));

            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(engine.cancel("exec-late-cancel"));
            release.countDown();

            WorkflowResult result = future.get(5, TimeUnit.SECONDS);
            assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
            assertEquals(2, result.getSucceededCount());
            assertEquals(0, result.getSkippedCount());
        }

        @Test
        void testCancelUnknownExecution() {
            assertFalse(engine.cancel("no-such-execution"));
            assertNull(engine.getStatus("no-such-execution"));
        }

        @Test
        void testSubmitRunsAsynchronously() throws Exception {
            WorkflowResult result = engine.submit(fanIn("Value"), context("exec-async"))
                    .get(5, TimeUnit.SECONDS);

            assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        }

        @Test
        void testShutdownRejectsNewWork() {
            engine.shutdown();

            assertTrue(engine.isShutdown());
            CompletableFuture<WorkflowResult> future = engine.submit(fanIn("Value"), context("exec-after-shutdown"));
            ExecutionException exception = assertThrows(ExecutionException.class, future::get);
            assertInstanceOf(IllegalStateException.class, exception.getCause());
            assertThrows(IllegalStateException.class, () -> engine.execute(fanIn("Value"), context("exec-sync")));
        }
    }

    @Test
    void testMetricsRecordedWhenEnabled() throws Exception {
        engine.shutdown();
        engine = newEngine(registry(), 2, true);
        long activeBefore = WorkflowMetrics.getInstance().getActiveWorkflows();

        WorkflowResult result = engine.execute(fanIn("Fail"), context("exec-metrics"));

        assertEquals(WorkflowStatus.PARTIAL, result.getStatus());
        assertEquals(activeBefore, WorkflowMetrics.getInstance().getActiveWorkflows());
    }
}
