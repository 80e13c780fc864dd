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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Input bindings of a step after resolution. Every declared key is either present
 * with a value or carries the {@link #ABSENT} marker, which means the source step
 * failed, was skipped, has not run, or did not produce the key.
 */
public final class ResolvedInput {

    /**
     * Marker stored for a binding that could not be resolved.
     */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private final String stepId;
    private final String instructions;
    private final Map<String, Object> values;

    public ResolvedInput(String stepId, String instructions, Map<String, Object> values) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.instructions = instructions != null ? instructions : "";
        this.values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }

    public String getStepId() {
        return stepId;
    }

    public String getInstructions() {
        return instructions;
    }

    /**
     * @return the value, or empty when the key is absent, undeclared or bound to null
     */
    public Optional<Object> get(String key) {
        Object value = values.get(key);
        return value == ABSENT ? Optional.empty() : Optional.ofNullable(value);
    }

    /**
     * Typed read. A value of another type is treated like a missing one.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public boolean isDeclared(String key) {
        return values.containsKey(key);
    }

    public boolean isAbsent(String key) {
        return values.get(key) == ABSENT;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    /**
     * @return the present bindings only
     */
    public Map<String, Object> asMap() {
        Map<String, Object> present = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != ABSENT) {
                present.put(key, value);
            }
        });
        return present;
    }

    @Override
    public String toString() {
        return "ResolvedInput{" +
               "stepId='" + stepId + '\'' +
               ", values=" + values +
               '}';
    }
}
