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


package dev.mars.leadflow.workflow.handler;

import dev.mars.leadflow.workflow.StepSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Construction parameters passed to a {@link HandlerFactory}.
 */
public final class HandlerConfig {

    private final String stepId;
    private final String instructions;
    private final Map<String, Object> config;
    private final List<String> requiredOutputs;

    public HandlerConfig(String stepId, String instructions, Map<String, Object> config,
                         List<String> requiredOutputs) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.instructions = instructions != null ? instructions : "";
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.requiredOutputs = requiredOutputs != null ? List.copyOf(requiredOutputs) : List.of();
    }

    public static HandlerConfig from(StepSpec step) {
        return new HandlerConfig(step.getId(), step.getInstructions(), step.getConfig(), step.getRequiredOutputs());
    }

    public String getStepId() {
        return stepId;
    }

    public String getInstructions() {
        return instructions;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public List<String> getRequiredOutputs() {
        return requiredOutputs;
    }

    @Override
    public String toString() {
        return "HandlerConfig{" +
               "stepId='" + stepId + '\'' +
               ", config=" + config.keySet() +
               ", requiredOutputs=" + requiredOutputs +
               '}';
    }
}
