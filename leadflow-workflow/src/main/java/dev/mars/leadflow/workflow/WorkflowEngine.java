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

import dev.mars.leadflow.workflow.exceptions.GraphException;
import dev.mars.leadflow.workflow.exceptions.RegistryException;

import java.util.concurrent.CompletableFuture;

/**
 * Runs workflows built from registered handlers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public interface WorkflowEngine {

    /**
     * Runs a validated graph to completion on the calling thread. Step failures are
     * recorded in the result; they are never thrown.
     *
     * @param graph   the validated step graph
     * @param context execution id, requesting user and run inputs
     * @return the terminal result
     * @throws RegistryException if any step names an unregistered handler type; no step runs
     */
    WorkflowResult execute(ExecutionGraph graph, ExecutionContext context) throws RegistryException;

    /**
     * Builds the graph and runs it.
     *
     * @throws GraphException    if the step graph is invalid; no step runs
     * @throws RegistryException if any step names an unregistered handler type; no step runs
     */
    WorkflowResult execute(WorkflowSpec spec, ExecutionContext context) throws GraphException, RegistryException;

    /**
     * Runs a workflow asynchronously. The future completes exceptionally with the
     * structural or registry error when the workflow cannot start.
     */
    CompletableFuture<WorkflowResult> submit(WorkflowSpec spec, ExecutionContext context);

    /**
     * Graph and registry checks without running anything.
     */
    ValidationResult validate(WorkflowSpec spec);

    /**
     * Requests cancellation of an active run. Running steps finish; nothing new is dispatched.
     *
     * @return true if the run was active and is now flagged
     */
    boolean cancel(String executionId);

    /**
     * @return the status of an active run, or null if no run with this id is active
     */
    WorkflowStatus getStatus(String executionId);

    void shutdown();
}
