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


package dev.mars.weave.workflow.observability;

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
 * OpenTelemetry metrics for the Weave workflow engine.
 *
 * Provides:
 * - weave.workflow.active (gauge) - Currently running workflow instances
 * - weave.workflow.total (counter) - Workflow instances started
 * - weave.workflow.completed (counter) - Successfully completed instances
 * - weave.workflow.failed (counter) - Failed instances
 * - weave.workflow.cancelled (counter) - Cancelled instances
 * - weave.workflow.duration.seconds (histogram) - Instance duration distribution
 * - weave.task.total (counter) - Task executions started
 * - weave.task.failed (counter) - Tasks that exhausted their retries
 * - weave.task.retries (counter) - Retry attempts scheduled
 * - weave.instance.swept (counter) - Terminal instances evicted by the sweeper
 *
 * Recording is a no-op unless an OpenTelemetry SDK is registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "weave-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter tasksTotal;
    private final LongCounter tasksFailed;
    private final LongCounter taskRetries;
    private final LongCounter instancesSwept;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> TEMPLATE_ID_KEY = AttributeKey.stringKey("template.id");
    private static final AttributeKey<String> TASK_TYPE_KEY = AttributeKey.stringKey("task.type");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        // Initialize counters
        workflowsTotal = meter.counterBuilder("weave.workflow.total")
                .setDescription("Total number of workflow instances started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("weave.workflow.completed")
                .setDescription("Number of successfully completed workflow instances")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("weave.workflow.failed")
                .setDescription("Number of failed workflow instances")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("weave.workflow.cancelled")
                .setDescription("Number of cancelled workflow instances")
                .setUnit("1")
                .build();

        tasksTotal = meter.counterBuilder("weave.task.total")
                .setDescription("Total number of task executions started")
                .setUnit("1")
                .build();

        tasksFailed = meter.counterBuilder("weave.task.failed")
                .setDescription("Number of tasks that failed after exhausting retries")
                .setUnit("1")
                .build();

        taskRetries = meter.counterBuilder("weave.task.retries")
                .setDescription("Number of task retry attempts scheduled")
                .setUnit("1")
                .build();

        instancesSwept = meter.counterBuilder("weave.instance.swept")
                .setDescription("Number of terminal workflow instances evicted")
                .setUnit("1")
                .build();

        // Initialize histograms
        workflowDuration = meter.histogramBuilder("weave.workflow.duration.seconds")
                .setDescription("Workflow instance duration in seconds")
                .setUnit("s")
                .build();

        // Initialize gauges
        meter.gaugeBuilder("weave.workflow.active")
                .setDescription("Number of currently running workflow instances")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String templateId) {
        workflowsTotal.add(1, templateAttributes(templateId));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String templateId, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = templateAttributes(templateId);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String templateId, String failureReason, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(TEMPLATE_ID_KEY, templateId)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, templateAttributes(templateId));
    }

    public void recordWorkflowCancelled(String templateId) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, templateAttributes(templateId));
    }

    public void recordTaskStarted(String taskType) {
        tasksTotal.add(1, taskAttributes(taskType));
    }

    public void recordTaskFailed(String taskType) {
        tasksFailed.add(1, taskAttributes(taskType));
    }

    public void recordTaskRetry(String taskType) {
        taskRetries.add(1, taskAttributes(taskType));
    }

    public void recordInstancesSwept(long count) {
        if (count > 0) {
            instancesSwept.add(count);
        }
    }

    /**
     * Get the current number of running workflow instances.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes templateAttributes(String templateId) {
        return Attributes.of(TEMPLATE_ID_KEY, templateId != null ? templateId : "unknown");
    }

    private static Attributes taskAttributes(String taskType) {
        return Attributes.of(TASK_TYPE_KEY, taskType != null ? taskType : "unknown");
    }
}
