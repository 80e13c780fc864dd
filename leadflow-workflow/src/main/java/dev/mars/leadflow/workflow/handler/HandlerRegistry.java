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

import dev.mars.leadflow.workflow.GraphError;
import dev.mars.leadflow.workflow.StepSpec;
import dev.mars.leadflow.workflow.ValidationResult;
import dev.mars.leadflow.workflow.WorkflowSpec;
import dev.mars.leadflow.workflow.exceptions.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps handler type names to factories. Type names are case-sensitive.
 * <p>
 * A registry is assembled once through {@link #builder()} and cannot change
 * afterwards, so it can be shared by concurrent workflow runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public final class HandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, HandlerFactory> factories;

    private HandlerRegistry(Map<String, HandlerFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a fresh handler for a step.
     *
     * @param typeName registered type name
     * @param config   construction parameters of the step
     * @return a new handler instance
     * @throws RegistryException if no factory is registered under {@code typeName}
     */
    public Handler create(String typeName, HandlerConfig config) throws RegistryException {
        Objects.requireNonNull(config, "Handler config cannot be null");
        HandlerFactory factory = typeName != null ? factories.get(typeName) : null;
        if (factory == null) {
            throw new RegistryException(typeName, config.getStepId());
        }
        Handler handler = factory.create(config);
        if (handler == null) {
            throw new IllegalStateException("Factory for handler type '" + typeName + "' returned null");
        }
        return handler;
    }

    public boolean isRegistered(String typeName) {
        return typeName != null && factories.containsKey(typeName);
    }

    public Set<String> getRegisteredTypes() {
        return factories.keySet();
    }

    /**
     * Reports every step whose handler type is not registered.
     */
    public ValidationResult validate(WorkflowSpec spec) {
        ValidationResult result = new ValidationResult();
        for (StepSpec step : spec.getSteps()) {
            if (!isRegistered(step.getHandlerType())) {
                result.addError(GraphError.unknownHandlerType(step.getId(), step.getHandlerType()));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "HandlerRegistry{types=" + factories.keySet() + '}';
    }

    public static class Builder {
        private final Map<String, HandlerFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the name is blank or already registered
         */
        public Builder register(String typeName, HandlerFactory factory) {
            if (typeName == null || typeName.trim().isEmpty()) {
                throw new IllegalArgumentException("Handler type name cannot be null or blank");
            }
            Objects.requireNonNull(factory, "Handler factory cannot be null");
            if (factories.containsKey(typeName)) {
                throw new IllegalArgumentException("Handler type already registered: " + typeName);
            }
            factories.put(typeName, factory);
            logger.debug("Registered handler type: {}", typeName);
            return this;
        }

        public HandlerRegistry build() {
            logger.info("Built handler registry with {} type(s): {}", factories.size(), factories.keySet());
            return new HandlerRegistry(factories);
        }
    }
}
