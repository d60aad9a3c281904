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


package dev.mars.weave.workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a workflow instance for status queries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowStatusReport {

    private final String id;
    private final String templateId;
    private final String name;
    private final WorkflowStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;
    private final List<TaskReport> tasks;
    private final int progressPercent;
    private final List<WorkflowError> errors;

    private WorkflowStatusReport(WorkflowInstance instance) {
        this.id = instance.getId();
        this.templateId = instance.getTemplateId();
        this.name = instance.getName();
        this.status = instance.getStatus();
        this.startTime = instance.getStartTime();
        this.endTime = instance.getEndTime();
        this.duration = instance.getDuration();
        List<TaskReport> taskReports = new ArrayList<>();
        for (TaskState state : instance.getTaskStates().values()) {
            taskReports.add(new TaskReport(state));
        }
        this.tasks = List.copyOf(taskReports);
        this.progressPercent = instance.getProgressPercent();
        this.errors = instance.getErrors();
    }

    public static WorkflowStatusReport from(WorkflowInstance instance) {
        return new WorkflowStatusReport(instance);
    }

    public String getId() {
        return id;
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getName() {
        return name;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public List<TaskReport> getTasks() {
        return tasks;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public List<WorkflowError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "WorkflowStatusReport{" +
               "id='" + id + '\'' +
               ", status=" + status +
               ", progressPercent=" + progressPercent +
               ", errors=" + errors.size() +
               '}';
    }

    /**
     * Status of a single task at the time the report was taken.
     */
    public static class TaskReport {

        private final String id;
        private final String type;
        private final TaskStatus status;
        private final int attempts;
        private final String error;
        private final Instant startTime;
        private final Instant endTime;

        TaskReport(TaskState state) {
            this.id = state.getTaskId();
            this.type = state.getSpec().getType();
            this.status = state.getStatus();
            this.attempts = state.getAttempts();
            this.error = state.getError();
            this.startTime = state.getStartTime();
            this.endTime = state.getEndTime();
        }

        public String getId() {
            return id;
        }

        public String getType() {
            return type;
        }

        public TaskStatus getStatus() {
            return status;
        }

        public int getAttempts() {
            return attempts;
        }

        public String getError() {
            return error;
        }

        public Instant getStartTime() {
            return startTime;
        }

        public Instant getEndTime() {
            return endTime;
        }
    }
}
