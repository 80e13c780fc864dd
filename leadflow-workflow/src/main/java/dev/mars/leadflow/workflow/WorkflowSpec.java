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
import java.util.Optional;

/**
 * Immutable, fully resolved workflow: metadata, steps in declaration order and the
 * workflow-level configuration handed to every handler.
 * <p>
 * Structural rules (unique ids, resolvable references, acyclic, single entry) are
 * checked by {@link ExecutionGraph}, not here, so that every problem can be
 * reported at once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public final class WorkflowSpec {

    private final String name;
    private final String version;
    private final String description;
    private final List<StepSpec> steps;
    private final Map<String, Object> config;

    public WorkflowSpec(String name, String version, String description, List<StepSpec> steps,
                        Map<String, Object> config) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.version = version != null ? version : "1.0";
        this.description = description;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public List<StepSpec> getSteps() {
        return steps;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * First step declared with the given id.
     */
    public Optional<StepSpec> getStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowSpec that = (WorkflowSpec) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(version, that.version) &&
               Objects.equals(description, that.description) &&
               Objects.equals(steps, that.steps) &&
               Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, description, steps, config);
    }

    @Override
    public String toString() {
        return "WorkflowSpec{" +
               "name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               '}';
    }

    public static class Builder {
        private final String name;
        private String version;
        private String description;
        private final List<StepSpec> steps = new ArrayList<>();
        private final Map<String, Object> config = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(StepSpec step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<StepSpec> steps) {
            this.steps.addAll(steps);
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

        public WorkflowSpec build() {
            return new WorkflowSpec(name, version, description, steps, config);
        }
    }
}
