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

import dev.mars.leadflow.workflow.handler.ResolvedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a step's input bindings against the results recorded so far, the
 * workflow configuration and the run inputs of the execution context. Resolution never fails: anything that cannot be bound
 * becomes {@link ResolvedInput#ABSENT}.
 */
public class InputResolver {

    private static final Logger logger = LoggerFactory.getLogger(InputResolver.class);

    public ResolvedInput resolve(StepSpec step, ExecutionState state, Map<String, Object> workflowConfig,
                                 ExecutionContext context) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (InputBinding binding : step.getInputs()) {
            Object value;
            switch (binding.getKind()) {
                case STEP_OUTPUT:
                    value = resolveStepOutput(binding, state);
                    break;
                case WORKFLOW_CONFIG:
                    value = lookupPath(workflowConfig, binding.getConfigPath())
                            .orElseGet(() -> binding.getDefaultValue() != null
                                    ? binding.getDefaultValue() : ResolvedInput.ABSENT);
                    break;
                case CONTEXT:
                    value = context.lookup(binding.getContextPath())
                            .orElseGet(() -> binding.getDefaultValue() != null
                                    ? binding.getDefaultValue() : ResolvedInput.ABSENT);
                    break;
                default:
                    value = binding.getLiteralValue();
                    break;
            }
            if (value == ResolvedInput.ABSENT) {
                logger.debug("Step '{}': input '{}' is absent ({})", step.getId(), binding.getTargetKey(), binding);
            }
            values.put(binding.getTargetKey(), value);
        }
        return new ResolvedInput(step.getId(), step.getInstructions(), values);
    }

    private Object resolveStepOutput(InputBinding binding, ExecutionState state) {
        Optional<StepResult> source = state.getResult(binding.getSourceStepId());
        if (source.isEmpty() || !source.get().isSuccessful()) {
            return ResolvedInput.ABSENT;
        }
        Map<String, Object> output = source.get().getOutput();
        if (binding.getSourceKey() == null) {
            return output;
        }
        return output.containsKey(binding.getSourceKey()) ? output.get(binding.getSourceKey()) : ResolvedInput.ABSENT;
    }

    /**
     * Follows a dotted path through nested maps.
     */
    static Optional<Object> lookupPath(Map<String, Object> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }
}
