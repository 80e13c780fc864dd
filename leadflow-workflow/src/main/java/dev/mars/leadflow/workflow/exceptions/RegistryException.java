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

package dev.mars.leadflow.workflow.exceptions;

/**
 * Thrown when a step names a handler type that has no registered factory.
 */
public class RegistryException extends WorkflowException {

    private final String typeName;
    private final String stepId;

    public RegistryException(String typeName) {
        this(typeName, null);
    }

    public RegistryException(String typeName, String stepId) {
        super(stepId != null
                ? "Unknown handler type '" + typeName + "' for step '" + stepId + "'"
                : "Unknown handler type '" + typeName + "'");
        this.typeName = typeName;
        this.stepId = stepId;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getStepId() {
        return stepId;
    }
}
