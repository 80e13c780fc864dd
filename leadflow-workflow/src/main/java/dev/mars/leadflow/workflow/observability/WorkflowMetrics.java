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


package dev.mars.leadflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the workflow engine. Without an SDK registered on
 * {@link GlobalOpenTelemetry} every instrument is a no-op.
 * <ul>
 *   <li>leadflow.workflow.active (gauge) - runs in progress</li>
 *   <li>leadflow.workflow.total (counter) - runs started</li>
 *   <li>leadflow.workflow.succeeded / .partial / .failed / .cancelled (counters) - runs by outcome</li>
 *   <li>leadflow.workflow.steps.total / .steps.failed (counters) - steps executed and failed</li>
 *   <li>leadflow.workflow.duration.seconds (histogram) - run duration</li>
 *   <li>leadflow.workflow.step.duration.seconds (histogram) - step duration</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "leadflow-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsSucceeded;
    private final LongCounter workflowsPartial;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;

    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stepDuration;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> HANDLER_TYPE_KEY = AttributeKey.stringKey("handler.type");
    private static final AttributeKey<String> STEP_STATUS_KEY = AttributeKey.stringKey("step.status");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = counter(meter, "leadflow.workflow.total", "Total number of workflow runs started");
        workflowsSucceeded = counter(meter, "leadflow.workflow.succeeded", "Runs in which every step succeeded");
        workflowsPartial = counter(meter, "leadflow.workflow.partial", "Runs with at least one failed step");
        workflowsFailed = counter(meter, "leadflow.workflow.failed", "Runs whose entry step failed");
        workflowsCancelled = counter(meter, "leadflow.workflow.cancelled", "Runs cancelled before completion");
        stepsTotal = counter(meter, "leadflow.workflow.steps.total", "Total number of steps executed");
        stepsFailed = counter(meter, "leadflow.workflow.steps.failed", "Number of failed steps");

        workflowDuration = meter.histogramBuilder("leadflow.workflow.duration.seconds")
                .setDescription("Workflow run duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("leadflow.workflow.step.duration.seconds")
                .setDescription("Step handler duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("leadflow.workflow.active")
                .setDescription("Number of workflow runs in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Records the end of a run under the counter matching its outcome.
     *
     * @param outcome one of SUCCEEDED, PARTIAL, FAILED or CANCELLED
     */
    public void recordWorkflowFinished(String workflowName, String outcome, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);

        switch (outcome) {
            case "SUCCEEDED":
                workflowsSucceeded.add(1, attrs);
                break;
            case "PARTIAL":
                workflowsPartial.add(1, attrs);
                break;
            case "CANCELLED":
                workflowsCancelled.add(1, attrs);
                break;
            default:
                workflowsFailed.add(1, attrs);
                break;
        }
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordStepExecuted(String workflowName, String handlerType, String status, double durationSeconds) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(HANDLER_TYPE_KEY, handlerType)
                .put(STEP_STATUS_KEY, status)
                .build();

        stepsTotal.add(1, attrs);
        stepDuration.record(durationSeconds, attrs);
        if ("FAILED".equals(status)) {
            stepsFailed.add(1, attrs);
        }
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
