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
import java.util.List;

/**
 * Outcome of pre-flight validation. Errors block execution, warnings do not.
 */
public class ValidationResult {

    private final List<GraphError> errors;
    private final List<GraphError> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<GraphError> errors, List<GraphError> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public void addError(GraphError error) {
        errors.add(error);
    }

    public void addWarning(GraphError warning) {
        warnings.add(warning);
    }

    /**
     * Appends every error and warning of another result to this one.
     */
    public void merge(ValidationResult other) {
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
    }

    public List<GraphError> getErrors() {
        return List.copyOf(errors);
    }

    public List<GraphError> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasError(GraphError.Type type) {
        return errors.stream().anyMatch(error -> error.getType() == type);
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }
}
