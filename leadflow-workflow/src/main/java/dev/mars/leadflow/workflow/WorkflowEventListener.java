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

/**
 * Receives lifecycle callbacks from a running workflow. All callbacks happen on
 * the engine's coordinating thread; an exception thrown here is logged and
 * otherwise ignored.
 */
public interface WorkflowEventListener {

    default void onWorkflowStarted(String executionId, WorkflowSpec spec) {
    }

    default void onStepStarted(String executionId, String stepId) {
    }

    default void onStepCompleted(String executionId, StepResult result) {
    }

    default void onWorkflowCompleted(WorkflowResult result) {
    }
}
