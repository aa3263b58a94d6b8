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

package dev.mars.taskflow.workflow.observability;

import dev.mars.taskflow.workflow.TaskEvent;
import dev.mars.taskflow.workflow.TaskEventListener;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Taskflow workflow engine.
 *
 * Workflow-level metrics are recorded by the engine:
 * - taskflow.workflow.active (gauge) - Currently running workflows
 * - taskflow.workflow.total (counter) - Total workflows started
 * - taskflow.workflow.completed (counter) - Workflows with no failed task
 * - taskflow.workflow.failed (counter) - Workflows with at least one failed task
 * - taskflow.workflow.duration.seconds (histogram) - Workflow duration distribution
 *
 * Task-level metrics are recorded from the event stream, with this class subscribed as
 * a {@link TaskEventListener}:
 * - taskflow.task.started / completed / failed / retried / skipped (counters)
 * - taskflow.task.attempts (histogram) - Attempts used by each finished task
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics implements TaskEventListener {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "taskflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter tasksStarted;
    private final LongCounter tasksCompleted;
    private final LongCounter tasksFailed;
    private final LongCounter tasksRetried;
    private final LongCounter tasksSkipped;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final LongHistogram taskAttempts;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> EXECUTION_MODE_KEY = AttributeKey.stringKey("execution.mode");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("task.outcome");

    /**
     * Creates the instruments on the given meter. Most callers should use
     * {@link #getInstance()}.
     */
    public WorkflowMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        // Initialize counters
        workflowsTotal = meter.counterBuilder("taskflow.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("taskflow.workflow.completed")
                .setDescription("Number of workflows finished with no failed task")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("taskflow.workflow.failed")
                .setDescription("Number of workflows finished with at least one failed task")
                .setUnit("1")
                .build();

        tasksStarted = meter.counterBuilder("taskflow.task.started")
                .setDescription("Number of task attempts started")
                .setUnit("1")
                .build();

        tasksCompleted = meter.counterBuilder("taskflow.task.completed")
                .setDescription("Number of tasks completed")
                .setUnit("1")
                .build();

        tasksFailed = meter.counterBuilder("taskflow.task.failed")
                .setDescription("Number of tasks failed after exhausting their retries")
                .setUnit("1")
                .build();

        tasksRetried = meter.counterBuilder("taskflow.task.retried")
                .setDescription("Number of task retries scheduled")
                .setUnit("1")
                .build();

        tasksSkipped = meter.counterBuilder("taskflow.task.skipped")
                .setDescription("Number of tasks skipped because a dependency did not complete")
                .setUnit("1")
                .build();

        // Initialize histograms
        workflowDuration = meter.histogramBuilder("taskflow.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        taskAttempts = meter.histogramBuilder("taskflow.task.attempts")
                .setDescription("Attempts used by each finished task")
                .setUnit("1")
                .ofLongs()
                .build();

        // Initialize gauges
        meter.gaugeBuilder("taskflow.workflow.active")
                .setDescription("Number of currently running workflows")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Record a workflow started.
     */
    public void recordWorkflowStarted(String executionMode) {
        workflowsTotal.add(1, modeAttributes(executionMode));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Record a workflow finished with no failed task.
     */
    public void recordWorkflowCompleted(String executionMode, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = modeAttributes(executionMode);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a workflow finished with at least one failed task.
     */
    public void recordWorkflowFailed(String executionMode, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = modeAttributes(executionMode);
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    @Override
    public void onEvent(TaskEvent event) {
        switch (event.getType()) {
            case STARTED:
                tasksStarted.add(1);
                break;
            case RETRY:
                tasksRetried.add(1);
                break;
            case COMPLETED:
                tasksCompleted.add(1);
                taskAttempts.record(event.getAttempt(), Attributes.of(OUTCOME_KEY, "completed"));
                break;
            case FAILED:
                if (event.isSkip()) {
                    tasksSkipped.add(1);
                } else {
                    tasksFailed.add(1);
                    taskAttempts.record(event.getAttempt(), Attributes.of(OUTCOME_KEY, "failed"));
                }
                break;
            default:
                logger.fine("Ignoring event type " + event.getType());
        }
    }

    /**
     * Get the current number of active workflows.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes modeAttributes(String executionMode) {
        return Attributes.of(EXECUTION_MODE_KEY, executionMode);
    }
}
