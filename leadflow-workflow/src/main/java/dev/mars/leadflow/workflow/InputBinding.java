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

import java.util.Objects;

/**
 * Declares where a single step input comes from. A binding has a target key and
 * exactly one source: a literal value, another step's output, a path into the
 * workflow-level configuration, or a path into the run inputs supplied by the
 * caller through {@link ExecutionContext}.
 */
public final class InputBinding {

    public enum SourceKind {
        LITERAL,
        STEP_OUTPUT,
        WORKFLOW_CONFIG,
        CONTEXT
    }

    private final String targetKey;
    private final SourceKind kind;
    private final Object literalValue;
    private final String sourceStepId;
    private final String sourceKey;
    private final String path;
    private final Object defaultValue;

    private InputBinding(String targetKey, SourceKind kind, Object literalValue, String sourceStepId,
                         String sourceKey, String path, Object defaultValue) {
        this.targetKey = requireNonBlank(targetKey, "Target key");
        this.kind = Objects.requireNonNull(kind, "Source kind cannot be null");
        this.literalValue = literalValue;
        this.sourceStepId = sourceStepId;
        this.sourceKey = sourceKey;
        this.path = path;
        this.defaultValue = defaultValue;
    }

    public static InputBinding literal(String targetKey, Object value) {
        return new InputBinding(targetKey, SourceKind.LITERAL, value, null, null, null, null);
    }

    /**
     * Binds one key of another step's output.
     */
    public static InputBinding stepOutput(String targetKey, String stepId, String outputKey) {
        return new InputBinding(targetKey, SourceKind.STEP_OUTPUT, null,
                requireNonBlank(stepId, "Source step id"), outputKey, null, null);
    }

    /**
     * Binds the complete output map of another step.
     */
    public static InputBinding stepOutput(String targetKey, String stepId) {
        return stepOutput(targetKey, stepId, null);
    }

    public static InputBinding workflowConfig(String targetKey, String path) {
        return workflowConfig(targetKey, path, null);
    }

    public static InputBinding workflowConfig(String targetKey, String path, Object defaultValue) {
        return new InputBinding(targetKey, SourceKind.WORKFLOW_CONFIG, null, null, null,
                requireNonBlank(path, "Config path"), defaultValue);
    }

    /**
     * Binds a dotted path into the run inputs of the {@link ExecutionContext}.
     * {@code execution_id} and {@code user_id} resolve to the context's own fields.
     */
    public static InputBinding context(String targetKey, String path) {
        return context(targetKey, path, null);
    }

    public static InputBinding context(String targetKey, String path, Object defaultValue) {
        return new InputBinding(targetKey, SourceKind.CONTEXT, null, null, null,
                requireNonBlank(path, "Context path"), defaultValue);
    }

    public String getTargetKey() {
        return targetKey;
    }

    public SourceKind getKind() {
        return kind;
    }

    public Object getLiteralValue() {
        return literalValue;
    }

    public String getSourceStepId() {
        return sourceStepId;
    }

    /**
     * @return the output key read from the source step, or null when the whole output is bound
     */
    public String getSourceKey() {
        return sourceKey;
    }

    public String getConfigPath() {
        return kind == SourceKind.WORKFLOW_CONFIG ? path : null;
    }

    public String getContextPath() {
        return kind == SourceKind.CONTEXT ? path : null;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isStepOutput() {
        return kind == SourceKind.STEP_OUTPUT;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InputBinding that = (InputBinding) o;
        return Objects.equals(targetKey, that.targetKey) &&
               kind == that.kind &&
               Objects.equals(literalValue, that.literalValue) &&
               Objects.equals(sourceStepId, that.sourceStepId) &&
               Objects.equals(sourceKey, that.sourceKey) &&
               Objects.equals(path, that.path) &&
               Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetKey, kind, literalValue, sourceStepId, sourceKey, path, defaultValue);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STEP_OUTPUT:
                return targetKey + " <- " + sourceStepId + (sourceKey != null ? "." + sourceKey : "");
            case WORKFLOW_CONFIG:
                return targetKey + " <- config." + path;
            case CONTEXT:
                return targetKey + " <- input." + path;
            default:
                return targetKey + " = " + literalValue;
        }
    }
}
