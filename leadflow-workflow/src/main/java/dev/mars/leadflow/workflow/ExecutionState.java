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

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable record of one workflow run. Step results are append-only: each step id
 * can be written once. Readers on other threads see either no entry or a complete
 * {@link StepResult}.
 */
public class ExecutionState {

    private final String executionId;
    private final String workflowName;
    private final Instant startTime;
    private final Map<String, StepResult> results = new ConcurrentHashMap<>();
    private final List<String> completionOrder = new CopyOnWriteArrayList<>();
    private volatile WorkflowStatus status = WorkflowStatus.RUNNING;
    private volatile Instant endTime;

    public ExecutionState(String executionId, String workflowName) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.startTime = Instant.now();
    }

    /**
     * @throws IllegalStateException if a result for the same step was already recorded
     */
    public void record(StepResult result) {
        Objects.requireNonNull(result, "Step result cannot be null");
        StepResult previous = results.putIfAbsent(result.getStepId(), result);
        if (previous != null) {
            throw new IllegalStateException("Result already recorded for step '" + result.getStepId()
                    + "' in execution " + executionId);
        }
        completionOrder.add(result.getStepId());
    }

    public Optional<StepResult> getResult(String stepId) {
        return Optional.ofNullable(results.get(stepId));
    }

    public boolean hasResult(String stepId) {
        return results.containsKey(stepId);
    }

    public Map<String, StepResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    /**
     * @return step ids in the order their results were recorded
     */
    public List<String> getCompletionOrder() {
        return List.copyOf(completionOrder);
    }

    public int getRecordedCount() {
        return results.size();
    }

    void complete(WorkflowStatus finalStatus) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Final status must be terminal: " + finalStatus);
        }
        this.endTime = Instant.now();
        this.status = finalStatus;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "ExecutionState{" +
               "executionId='" + executionId + '\'' +
               ", status=" + status +
               ", recorded=" + completionOrder +
               '}';
    }
}
