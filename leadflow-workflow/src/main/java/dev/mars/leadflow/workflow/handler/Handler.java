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

import java.util.Map;

/**
 * A unit of work bound to one workflow step. Instances are created fresh for every
 * step of every run, so implementations may keep per-run state in fields.
 * <p>
 * Handlers report failure by throwing. The engine records the failure against the
 * step and carries on with the rest of the graph.
 */
@FunctionalInterface
public interface Handler {

    /**
     * @param input          resolved input bindings of the step
     * @param workflowConfig workflow-level configuration, read-only
     * @return the step output; a null return is treated as a failure
     * @throws StepExecutionException if the step cannot produce its output
     */
    Map<String, Object> execute(ResolvedInput input, Map<String, Object> workflowConfig)
            throws StepExecutionException;
}
