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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Caller-supplied parameters of a single run: the execution id, the requesting
 * user and the run inputs that seed the workflow. Steps read the inputs through
 * {@link InputBinding#context(String, String)} bindings.
 */
public class ExecutionContext {

    public static final String EXECUTION_ID_KEY = "execution_id";
    public static final String USER_ID_KEY = "user_id";

    private final String executionId;
    private final String userId;
    private final Map<String, Object> inputs;

    public ExecutionContext(String executionId, String userId, Map<String, ?> inputs) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.userId = userId;
        this.inputs = ImmutableValues.copyOf(inputs);
    }

    public static ExecutionContext create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * @return deep, unmodifiable copy of the run inputs
     */
    public Map<String, Object> getInputs() {
        return inputs;
    }

    /**
     * Looks up a dotted path in the run inputs. {@code execution_id} and
     * {@code user_id} name the context's own fields unless an input of that name exists.
     */
    public Optional<Object> lookup(String path) {
        Optional<Object> value = InputResolver.lookupPath(inputs, path);
        if (value.isPresent()) {
            return value;
        }
        if (EXECUTION_ID_KEY.equals(path)) {
            return Optional.of(executionId);
        }
        if (USER_ID_KEY.equals(path)) {
            return Optional.ofNullable(userId);
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionContext that = (ExecutionContext) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "executionId='" + executionId + '\'' +
               ", userId='" + userId + '\'' +
               ", inputs=" + inputs.keySet() +
               '}';
    }

    public static class Builder {
        private String executionId;
        private String userId;
        private final Map<String, Object> inputs = new LinkedHashMap<>();

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder input(String key, Object value) {
            inputs.put(Objects.requireNonNull(key, "Input key cannot be null"), value);
            return this;
        }

        public Builder inputs(Map<String, ?> inputs) {
            if (inputs != null) {
                inputs.forEach(this::input);
            }
            return this;
        }

        public ExecutionContext build() {
            if (executionId == null) {
                executionId = UUID.randomUUID().toString();
            }
            return new ExecutionContext(executionId, userId, inputs);
        }
    }
}
