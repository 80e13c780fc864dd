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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a finished workflow run. Step results are listed in
 * declaration order.
 */
public final class WorkflowResult {

    private final String workflowName;
    private final String executionId;
    private final WorkflowStatus status;
    private final List<StepResult> stepResults;
    private final Map<String, StepResult> resultsById;
    private final Instant startTime;
    private final Instant endTime;

    public WorkflowResult(String workflowName, String executionId, WorkflowStatus status,
                          List<StepResult> stepResults, Instant startTime, Instant endTime) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
        this.resultsById = this.stepResults.stream()
                .collect(Collectors.toUnmodifiableMap(StepResult::getStepId, Function.identity()));
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.SUCCEEDED;
    }

    public List<StepResult> getStepResults() {
        return stepResults;
    }

    public Optional<StepResult> getStepResult(String stepId) {
        return Optional.ofNullable(resultsById.get(stepId));
    }

    /**
     * @throws IllegalArgumentException if the step has no result in this run
     */
    public StepStatus getStepStatus(String stepId) {
        return getStepResult(stepId)
                .map(StepResult::getStatus)
                .orElseThrow(() -> new IllegalArgumentException("No result for step: " + stepId));
    }

    public long count(StepStatus stepStatus) {
        return stepResults.stream().filter(result -> result.getStatus() == stepStatus).count();
    }

    public long getSucceededCount() {
        return count(StepStatus.SUCCEEDED);
    }

    public long getFailedCount() {
        return count(StepStatus.FAILED);
    }

    public long getSkippedCount() {
        return count(StepStatus.SKIPPED);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
               "workflowName='" + workflowName + '\'' +
               ", executionId='" + executionId + '\'' +
               ", status=" + status +
               ", succeeded=" + getSucceededCount() +
               ", failed=" + getFailedCount() +
               ", skipped=" + getSkippedCount() +
               ", duration=" + getDuration().toMillis() + "ms" +
               '}';
    }
}
