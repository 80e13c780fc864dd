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

import dev.mars.leadflow.workflow.GraphError;

import java.util.List;

/**
 * Thrown when a workflow's step graph is structurally invalid.
 */
public class GraphException extends WorkflowException {

    private final String workflowName;
    private final List<GraphError> errors;

    public GraphException(String workflowName, List<GraphError> errors) {
        super(buildMessage(workflowName, errors));
        this.workflowName = workflowName;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<GraphError> getErrors() {
        return errors;
    }

    public boolean hasError(GraphError.Type type) {
        return errors.stream().anyMatch(error -> error.getType() == type);
    }

    private static String buildMessage(String workflowName, List<GraphError> errors) {
        StringBuilder sb = new StringBuilder("Workflow '").append(workflowName).append("' has an invalid step graph:");
        if (errors != null) {
            for (GraphError error : errors) {
                sb.append("\n  - ").append(error);
            }
        }
        return sb.toString();
    }
}
