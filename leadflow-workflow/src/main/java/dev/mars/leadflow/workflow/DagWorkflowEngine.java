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
import dev.mars.leadflow.workflow.exceptions.WorkflowException;
import dev.mars.leadflow.workflow.handler.Handler;
import dev.mars.leadflow.workflow.handler.HandlerConfig;
import dev.mars.leadflow.workflow.handler.HandlerRegistry;
import dev.mars.leadflow.workflow.handler.ResolvedInput;
import dev.mars.leadflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Workflow engine that walks the step graph in dependency order.
 * <p>
 * One coordinating thread per run owns the {@link ExecutionState}: it resolves
 * inputs, dispatches eligible steps to a bounded worker pool, records each result
 * as it comes back and releases successors whose predecessors have all terminated.
 * Ready steps are dispatched in FIFO order. Successors released by the same
 * completion join the queue in the order their steps are declared in the workflow,
 * so with a single worker the run is deterministic.
 * <p>
 * A failing step never stops the run. Its successors still execute, with the
 * failed step's bindings resolved to {@link ResolvedInput#ABSENT}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public class DagWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DagWorkflowEngine.class);

    static final String CANCELLED_REASON = "cancelled";

    private final HandlerRegistry registry;
    private final int maxConcurrentSteps;
    private final long shutdownTimeoutMs;
    private final WorkflowMetrics metrics;
    private final InputResolver inputResolver;
    private final ExecutorService stepExecutor;
    private final ExecutorService workflowExecutor;
    private final Map<String, ActiveRun> activeExecutions;
    private final List<WorkflowEventListener> listeners;
    private volatile boolean shutdown = false;

    public DagWorkflowEngine(HandlerRegistry registry) {
        this(registry, new EngineConfiguration());
    }

    public DagWorkflowEngine(HandlerRegistry registry, EngineConfiguration configuration) {
        this.registry = Objects.requireNonNull(registry, "Handler registry cannot be null");
        Objects.requireNonNull(configuration, "Engine configuration cannot be null");
        this.maxConcurrentSteps = configuration.getMaxConcurrentSteps();
        this.shutdownTimeoutMs = configuration.getShutdownTimeoutMs();
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.inputResolver = new InputResolver();
        this.stepExecutor = Executors.newFixedThreadPool(maxConcurrentSteps, namedThreads("leadflow-step"));
        this.workflowExecutor = Executors.newCachedThreadPool(namedThreads("leadflow-workflow"));
        this.activeExecutions = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
        logger.info("DagWorkflowEngine started with maxConcurrentSteps={}", maxConcurrentSteps);
    }

    public void addListener(WorkflowEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public WorkflowResult execute(WorkflowSpec spec, ExecutionContext context) throws GraphException, RegistryException {
        return execute(ExecutionGraph.build(spec), context);
    }

    @Override
    public WorkflowResult execute(ExecutionGraph graph, ExecutionContext context) throws RegistryException {
        Objects.requireNonNull(graph, "Execution graph cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }

        for (StepSpec step : graph.getSteps()) {
            if (!registry.isRegistered(step.getHandlerType())) {
                throw new RegistryException(step.getHandlerType(), step.getId());
            }
        }
        for (GraphError warning : graph.getWarnings()) {
            logger.warn("Workflow '{}': {}", graph.getWorkflowName(), warning.getMessage());
        }

        String executionId = context.getExecutionId();
        ActiveRun run = new ActiveRun(new ExecutionState(executionId, graph.getWorkflowName()));
        if (activeExecutions.putIfAbsent(executionId, run) != null) {
            throw new IllegalStateException("Execution already active: " + executionId);
        }

        try {
            logger.info("Starting workflow '{}' execution: {} ({} steps, user: {})",
                    graph.getWorkflowName(), executionId, graph.size(), context.getUserId());
            if (metrics != null) {
                metrics.recordWorkflowStarted(graph.getWorkflowName());
            }
            notifyListeners(listener -> listener.onWorkflowStarted(executionId, graph.getSpec()));

            boolean cancelledBeforeDispatch = walk(graph, run, context);

            WorkflowResult result = complete(graph, run, cancelledBeforeDispatch);
            notifyListeners(listener -> listener.onWorkflowCompleted(result));
            return result;
        } finally {
            activeExecutions.remove(executionId);
        }
    }

    @Override
    public CompletableFuture<WorkflowResult> submit(WorkflowSpec spec, ExecutionContext context) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return execute(spec, context);
                } catch (WorkflowException e) {
                    logger.error("Workflow '{}' rejected before execution: {}", spec.getName(), e.getMessage());
                    throw new CompletionException(e);
                }
            }, workflowExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown", e));
        }
    }

    @Override
    public ValidationResult validate(WorkflowSpec spec) {
        ValidationResult result = ExecutionGraph.validate(spec);
        result.merge(registry.validate(spec));
        return result;
    }

    @Override
    public boolean cancel(String executionId) {
        ActiveRun run = activeExecutions.get(executionId);
        if (run != null && !run.isCancelled()) {
            logger.info("Cancelling workflow execution: {}", executionId);
            run.cancel();
            return true;
        }
        return false;
    }

    @Override
    public WorkflowStatus getStatus(String executionId) {
        ActiveRun run = activeExecutions.get(executionId);
        return run != null ? run.state.getStatus() : null;
    }

    /**
     * @return ids of the runs currently in progress
     */
    public List<String> getActiveExecutionIds() {
        return List.copyOf(activeExecutions.keySet());
    }

    @Override
    public void shutdown() {
        shutdown = true;
        activeExecutions.values().forEach(ActiveRun::cancel);
        workflowExecutor.shutdown();
        stepExecutor.shutdown();
        try {
            if (!workflowExecutor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                workflowExecutor.shutdownNow();
            }
            if (!stepExecutor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Step workers did not finish within {} ms, interrupting", shutdownTimeoutMs);
                stepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workflowExecutor.shutdownNow();
            stepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("DagWorkflowEngine shutdown completed");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Runs the graph to completion or cancellation.
     *
     * @return true if cancellation left at least one step undispatched
     */
    private boolean walk(ExecutionGraph graph, ActiveRun run, ExecutionContext context) {
        ExecutionState state = run.state;
        Map<String, Object> workflowConfig = graph.getSpec().getConfig();
        Map<String, Integer> remaining = new HashMap<>();
        for (String stepId : graph.getStepIds()) {
            remaining.put(stepId, graph.getPredecessors(stepId).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        ready.add(graph.getEntryStepId());
        BlockingQueue<StepResult> completions = new LinkedBlockingQueue<>();
        int inFlight = 0;
        boolean interrupted = false;

        while (!ready.isEmpty() || inFlight > 0) {
            while (!run.isCancelled() && !ready.isEmpty() && inFlight < maxConcurrentSteps) {
                StepSpec step = graph.getStep(ready.poll());
                ResolvedInput input = inputResolver.resolve(step, state, workflowConfig, context);
                notifyListeners(listener -> listener.onStepStarted(state.getExecutionId(), step.getId()));
                dispatch(step, input, workflowConfig, completions);
                inFlight++;
            }
            if (inFlight == 0) {
                break;
            }

            StepResult result;
            try {
                result = completions.take();
            } catch (InterruptedException e) {
                logger.warn("Execution {} interrupted, cancelling remaining steps", state.getExecutionId());
                interrupted = true;
                run.cancel();
                continue;
            }
            inFlight--;
            record(graph, state, result);

            List<String> released = new ArrayList<>();
            for (String next : graph.getSuccessors(result.getStepId())) {
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    released.add(next);
                }
            }
            released.sort(graph.declarationOrder());
            ready.addAll(released);
        }

        boolean skippedAny = false;
        if (run.isCancelled()) {
            for (StepSpec step : graph.getSteps()) {
                if (!state.hasResult(step.getId())) {
                    record(graph, state, StepResult.skipped(step.getId(), step.getHandlerType(), CANCELLED_REASON));
                    skippedAny = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return skippedAny;
    }

    private void dispatch(StepSpec step, ResolvedInput input, Map<String, Object> workflowConfig,
                          BlockingQueue<StepResult> completions) {
        logger.debug("Dispatching step '{}' ({}) with inputs {}", step.getId(), step.getHandlerType(), input.keys());
        try {
            stepExecutor.execute(() -> {
                try {
                    completions.add(runStep(step, input, workflowConfig));
                } catch (Error e) {
                    completions.add(StepResult.failed(step.getId(), step.getHandlerType(), describe(e),
                            Instant.now(), Duration.ZERO));
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            completions.add(StepResult.failed(step.getId(), step.getHandlerType(), describe(e),
                    Instant.now(), Duration.ZERO));
        }
    }

    private StepResult runStep(StepSpec step, ResolvedInput input, Map<String, Object> workflowConfig) {
        Instant startTime = Instant.now();
        long startNanos = System.nanoTime();
        try {
            Handler handler = registry.create(step.getHandlerType(), HandlerConfig.from(step));
            Map<String, Object> output = handler.execute(input, workflowConfig);
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

            if (output == null) {
                return StepResult.failed(step.getId(), step.getHandlerType(),
                        "IllegalStateException: Handler returned no output", startTime, duration);
            }
            List<String> missing = step.getRequiredOutputs().stream()
                    .filter(key -> !output.containsKey(key))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                return StepResult.failed(step.getId(), step.getHandlerType(),
                        "StepExecutionException: Missing required output field: " + String.join(", ", missing),
                        startTime, duration);
            }
            return StepResult.succeeded(step.getId(), step.getHandlerType(), output, startTime, duration);
        } catch (Exception e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            if (logger.isDebugEnabled()) {
                logger.debug("Step '{}' exception details", step.getId(), e);
            }
            return StepResult.failed(step.getId(), step.getHandlerType(), describe(e), startTime, duration);
        }
    }

    private void record(ExecutionGraph graph, ExecutionState state, StepResult result) {
        state.record(result);

        if (result.getStatus() == StepStatus.FAILED) {
            logger.warn("Step '{}' failed in {} ms: {}", result.getStepId(),
                    result.getDuration().toMillis(), result.getError().orElse(""));
        } else if (result.getStatus() == StepStatus.SKIPPED) {
            logger.info("Step '{}' skipped: {}", result.getStepId(), result.getSkipReason().orElse(""));
        } else {
            logger.info("Step '{}' succeeded in {} ms", result.getStepId(), result.getDuration().toMillis());
        }

        if (metrics != null && result.getStatus() != StepStatus.SKIPPED) {
            metrics.recordStepExecuted(graph.getWorkflowName(), result.getHandlerType(),
                    result.getStatus().name(), result.getDuration().toNanos() / 1_000_000_000.0);
        }
        notifyListeners(listener -> listener.onStepCompleted(state.getExecutionId(), result));
    }

    private WorkflowResult complete(ExecutionGraph graph, ActiveRun run, boolean cancelledBeforeDispatch) {
        ExecutionState state = run.state;
        WorkflowStatus status = overallStatus(graph, state, cancelledBeforeDispatch);
        state.complete(status);

        List<StepResult> results = new ArrayList<>();
        for (String stepId : graph.getStepIds()) {
            state.getResult(stepId).ifPresent(results::add);
        }
        WorkflowResult result = new WorkflowResult(graph.getWorkflowName(), state.getExecutionId(), status,
                results, state.getStartTime(), state.getEndTime().orElseGet(Instant::now));

        logger.info("Workflow '{}' execution {} completed with status {} in {} ms",
                graph.getWorkflowName(), state.getExecutionId(), status, result.getDuration().toMillis());
        if (metrics != null) {
            metrics.recordWorkflowFinished(graph.getWorkflowName(), status.name(),
                    result.getDuration().toNanos() / 1_000_000_000.0);
        }
        return result;
    }

    /**
     * CANCELLED only when cancellation stopped at least one step from being dispatched;
     * a cancel that arrives after the last dispatch leaves the outcome to the step results.
     */
    static WorkflowStatus overallStatus(ExecutionGraph graph, ExecutionState state, boolean cancelledBeforeDispatch) {
        if (cancelledBeforeDispatch) {
            return WorkflowStatus.CANCELLED;
        }
        boolean entryFailed = state.getResult(graph.getEntryStepId())
                .map(result -> result.getStatus() == StepStatus.FAILED)
                .orElse(true);
        if (entryFailed) {
            return WorkflowStatus.FAILED;
        }
        boolean anyFailed = state.getResults().values().stream()
                .anyMatch(result -> result.getStatus() != StepStatus.SUCCEEDED);
        return anyFailed ? WorkflowStatus.PARTIAL : WorkflowStatus.SUCCEEDED;
    }

    /**
     * "SimpleName: message", falling back to the deepest cause's message.
     */
    static String describe(Throwable error) {
        String message = error.getMessage();
        Throwable cause = error.getCause();
        while (message == null && cause != null) {
            message = cause.getMessage();
            cause = cause.getCause();
        }
        String name = error.getClass().getSimpleName();
        if (name.isEmpty()) {
            name = error.getClass().getName();
        }
        return message != null ? name + ": " + message : name;
    }

    private void notifyListeners(Consumer<WorkflowEventListener> event) {
        for (WorkflowEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Workflow event listener {} failed: {}", listener.getClass().getName(), e.getMessage());
                if (logger.isDebugEnabled()) {
                    logger.debug("Listener exception details", e);
                }
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ActiveRun {
        private final ExecutionState state;
        private volatile boolean cancelled;

        private ActiveRun(ExecutionState state) {
            this.state = state;
        }

        private void cancel() {
            cancelled = true;
        }

        private boolean isCancelled() {
            return cancelled;
        }
    }
}
