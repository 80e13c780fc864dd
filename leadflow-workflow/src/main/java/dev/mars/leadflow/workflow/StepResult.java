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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one step in one run. The output is a deep, unmodifiable
 * copy of what the handler returned and is non-empty only for
 * {@link StepStatus#SUCCEEDED}, the error only for {@link StepStatus#FAILED} and the
 * skip reason only for {@link StepStatus#SKIPPED}.
 */
public final class StepResult {

    private final String stepId;
    private final String handlerType;
    private final StepStatus status;
    private final Map<String, Object> output;
    private final String error;
    private final String skipReason;
    private final Instant startTime;
    private final Duration duration;

    private StepResult(String stepId, String handlerType, StepStatus status, Map<String, Object> output,
                       String error, String skipReason, Instant startTime, Duration duration) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.handlerType = handlerType;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = ImmutableValues.copyOf(output);
        this.error = error;
        this.skipReason = skipReason;
        this.startTime = startTime != null ? startTime : Instant.now();
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    public static StepResult succeeded(String stepId, String handlerType, Map<String, Object> output,
                                       Instant startTime, Duration duration) {
        return new StepResult(stepId, handlerType, StepStatus.SUCCEEDED, output, null, null, startTime, duration);
    }

    public static StepResult failed(String stepId, String handlerType, String error,
                                    Instant startTime, Duration duration) {
        return new StepResult(stepId, handlerType, StepStatus.FAILED, null,
                Objects.requireNonNull(error, "Error cannot be null"), null, startTime, duration);
    }

    public static StepResult skipped(String stepId, String handlerType, String reason) {
        return new StepResult(stepId, handlerType, StepStatus.SKIPPED, null, null,
                Objects.requireNonNull(reason, "Skip reason cannot be null"), Instant.now(), Duration.ZERO);
    }

    public String getStepId() {
        return stepId;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public StepStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status == StepStatus.SUCCEEDED;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResult that = (StepResult) o;
        return Objects.equals(stepId, that.stepId) &&
               Objects.equals(handlerType, that.handlerType) &&
               status == that.status &&
               Objects.equals(output, that.output) &&
               Objects.equals(error, that.error) &&
               Objects.equals(skipReason, that.skipReason) &&
               Objects.equals(startTime, that.startTime) &&
               Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, handlerType, status, output, error, skipReason, startTime, duration);
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "stepId='" + stepId + '\'' +
               ", status=" + status +
               (error != null ? ", error='" + error + '\'' : "") +
               (skipReason != null ? ", skipReason='" + skipReason + '\'' : "") +
               ", duration=" + duration.toMillis() + "ms" +
               '}';
    }
}
