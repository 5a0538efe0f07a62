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

package dev.mars.runbook.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Runbook workflow engine.
 *
 * Provides these workflow metrics:
 * - runbook.workflow.active (gauge) - Currently active workflow runs
 * - runbook.workflow.total (counter) - Total workflows started
 * - runbook.workflow.completed (counter) - Successfully completed workflows
 * - runbook.workflow.failed (counter) - Failed workflows
 * - runbook.workflow.cancelled (counter) - Cancelled workflows
 * - runbook.workflow.steps.total (counter) - Steps executed
 * - runbook.workflow.steps.failed (counter) - Failed steps
 * - runbook.workflow.steps.skipped (counter) - Steps skipped by their condition
 * - runbook.workflow.duration.seconds (histogram) - Workflow duration distribution
 *
 * <p>Instances are created by the engine owner and passed in. When disabled,
 * nothing is recorded but the active count is still tracked.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "runbook-workflow";

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsSkipped;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private final boolean enabled;

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> RUN_MODE_KEY = AttributeKey.stringKey("run.mode");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.get(), true);
    }

    public WorkflowMetrics(OpenTelemetry openTelemetry, boolean enabled) {
        this.enabled = enabled;
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("runbook.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("runbook.workflow.completed")
                .setDescription("Number of successfully completed workflows")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("runbook.workflow.failed")
                .setDescription("Number of failed workflows")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("runbook.workflow.cancelled")
                .setDescription("Number of cancelled workflows")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("runbook.workflow.steps.total")
                .setDescription("Total number of workflow steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("runbook.workflow.steps.failed")
                .setDescription("Number of failed workflow steps")
                .setUnit("1")
                .build();

        stepsSkipped = meter.counterBuilder("runbook.workflow.steps.skipped")
                .setDescription("Number of steps skipped by their condition")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("runbook.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("runbook.workflow.active")
                .setDescription("Number of currently active workflow runs")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.debug("WorkflowMetrics initialized (enabled={})", enabled);
    }

    /**
     * Metrics that record nothing.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop(), false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void recordWorkflowStarted(String workflowName, String runMode) {
        activeWorkflows.incrementAndGet();
        if (enabled) {
            workflowsTotal.add(1, workflowAttributes(workflowName, runMode));
        }
    }

    public void recordWorkflowCompleted(String workflowName, String runMode, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        if (enabled) {
            Attributes attrs = workflowAttributes(workflowName, runMode);
            workflowsCompleted.add(1, attrs);
            workflowDuration.record(durationSeconds, attrs);
        }
    }

    public void recordWorkflowFailed(String workflowName, String runMode, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        if (enabled) {
            Attributes attrs = workflowAttributes(workflowName, runMode);
            workflowsFailed.add(1, attrs);
            workflowDuration.record(durationSeconds, attrs);
        }
    }

    public void recordWorkflowCancelled(String workflowName, String runMode) {
        activeWorkflows.decrementAndGet();
        if (enabled) {
            workflowsCancelled.add(1, workflowAttributes(workflowName, runMode));
        }
    }

    public void recordStepExecuted(String workflowName, String stepType) {
        if (enabled) {
            stepsTotal.add(1, stepAttributes(workflowName, stepType));
        }
    }

    public void recordStepFailed(String workflowName, String stepType) {
        if (enabled) {
            stepsFailed.add(1, stepAttributes(workflowName, stepType));
        }
    }

    public void recordStepSkipped(String workflowName, String stepType) {
        if (enabled) {
            stepsSkipped.add(1, stepAttributes(workflowName, stepType));
        }
    }

    /**
     * Get the current number of active workflows.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName, String runMode) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(RUN_MODE_KEY, runMode)
                .build();
    }

    private static Attributes stepAttributes(String workflowName, String stepType) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_TYPE_KEY, stepType)
                .build();
    }
}
