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

import java.util.List;
import java.util.Objects;

/**
 * A single structural or configuration problem found in a workflow before it runs.
 * The {@link #getSteps()} list names the steps involved; for a cycle it is the
 * cycle path, starting and ending on the same step.
 */
public final class GraphError {

    public enum Type {
        UNKNOWN_STEP,
        DUPLICATE_STEP,
        CYCLE_DETECTED,
        AMBIGUOUS_ENTRY,
        NO_ENTRY,
        UNREACHABLE_STEP,
        UNKNOWN_HANDLER_TYPE,
        UNORDERED_BINDING
    }

    private final Type type;
    private final List<String> steps;
    private final String message;

    private GraphError(Type type, List<String> steps, String message) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public static GraphError unknownStep(String referencedId, String referencingStepId, String field) {
        return new GraphError(Type.UNKNOWN_STEP, List.of(referencedId),
                "Step '" + referencingStepId + "' references unknown step '" + referencedId + "' in " + field);
    }

    public static GraphError duplicateStep(String stepId) {
        return new GraphError(Type.DUPLICATE_STEP, List.of(stepId), "Duplicate step id: " + stepId);
    }

    public static GraphError cycleDetected(List<String> path) {
        return new GraphError(Type.CYCLE_DETECTED, path, "Cycle detected: " + String.join(" -> ", path));
    }

    public static GraphError ambiguousEntry(List<String> candidates) {
        return new GraphError(Type.AMBIGUOUS_ENTRY, candidates,
                "Expected exactly one entry step but found " + candidates.size() + ": " + candidates);
    }

    public static GraphError noEntry() {
        return new GraphError(Type.NO_ENTRY, List.of(), "No entry step: every step has a predecessor");
    }

    public static GraphError unreachableStep(String stepId, String entryStepId) {
        return new GraphError(Type.UNREACHABLE_STEP, List.of(stepId),
                "Step '" + stepId + "' is not reachable from entry step '" + entryStepId + "'");
    }

    public static GraphError unknownHandlerType(String stepId, String handlerType) {
        return new GraphError(Type.UNKNOWN_HANDLER_TYPE, List.of(stepId),
                "Step '" + stepId + "' uses unregistered handler type '" + handlerType + "'");
    }

    public static GraphError unorderedBinding(String stepId, String targetKey, String referencedId) {
        return new GraphError(Type.UNORDERED_BINDING, List.of(stepId, referencedId),
                "Input '" + targetKey + "' of step '" + stepId + "' reads from '" + referencedId
                        + "', which is not upstream of it; the value may not be available when the step runs");
    }

    public Type getType() {
        return type;
    }

    public List<String> getSteps() {
        return steps;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphError that = (GraphError) o;
        return type == that.type &&
               Objects.equals(steps, that.steps) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, steps, message);
    }

    @Override
    public String toString() {
        return type.name() + ": " + message;
    }
}
