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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one step in a workflow.
 */
public final class StepSpec {

    private final String id;
    private final String handlerType;
    private final String instructions;
    private final List<InputBinding> inputs;
    private final List<String> nextSteps;
    private final Map<String, Object> config;
    private final List<String> requiredOutputs;

    public StepSpec(String id, String handlerType, String instructions, List<InputBinding> inputs,
                    List<String> nextSteps, Map<String, Object> config, List<String> requiredOutputs) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Step id cannot be null or blank");
        }
        if (handlerType == null || handlerType.trim().isEmpty()) {
            throw new IllegalArgumentException("Handler type cannot be null or blank for step: " + id);
        }
        this.id = id;
        this.handlerType = handlerType;
        this.instructions = instructions != null ? instructions : "";
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.requiredOutputs = requiredOutputs != null ? List.copyOf(requiredOutputs) : List.of();
    }

    public static Builder builder(String id, String handlerType) {
        return new Builder(id, handlerType);
    }

    public String getId() {
        return id;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public String getInstructions() {
        return instructions;
    }

    public List<InputBinding> getInputs() {
        return inputs;
    }

    public List<String> getNextSteps() {
        return nextSteps;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public List<String> getRequiredOutputs() {
        return requiredOutputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepSpec stepSpec = (StepSpec) o;
        return Objects.equals(id, stepSpec.id) &&
               Objects.equals(handlerType, stepSpec.handlerType) &&
               Objects.equals(instructions, stepSpec.instructions) &&
               Objects.equals(inputs, stepSpec.inputs) &&
               Objects.equals(nextSteps, stepSpec.nextSteps) &&
               Objects.equals(config, stepSpec.config) &&
               Objects.equals(requiredOutputs, stepSpec.requiredOutputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, handlerType, instructions, inputs, nextSteps, config, requiredOutputs);
    }

    @Override
    public String toString() {
        return "StepSpec{" +
               "id='" + id + '\'' +
               ", handlerType='" + handlerType + '\'' +
               ", inputs=" + inputs.size() +
               ", nextSteps=" + nextSteps +
               '}';
    }

    public static class Builder {
        private final String id;
        private final String handlerType;
        private String instructions;
        private final List<InputBinding> inputs = new ArrayList<>();
        private final List<String> nextSteps = new ArrayList<>();
        private final Map<String, Object> config = new LinkedHashMap<>();
        private final List<String> requiredOutputs = new ArrayList<>();

        private Builder(String id, String handlerType) {
            this.id = id;
            this.handlerType = handlerType;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder input(InputBinding binding) {
            this.inputs.add(binding);
            return this;
        }

        public Builder inputs(List<InputBinding> bindings) {
            this.inputs.addAll(bindings);
            return this;
        }

        public Builder next(String... stepIds) {
            Collections.addAll(this.nextSteps, stepIds);
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config.putAll(config);
            return this;
        }

        public Builder requiredOutputs(String... keys) {
            Collections.addAll(this.requiredOutputs, keys);
            return this;
        }

        public StepSpec build() {
            return new StepSpec(id, handlerType, instructions, inputs, nextSteps, config, requiredOutputs);
        }
    }
}
