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
import java.util.Objects;

/**
 * Mutable runtime state of one task within a workflow instance.
 * Created once with its instance and updated in place as attempts run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskState {

    private final TaskSpec spec;
    private TaskStatus status = TaskStatus.PENDING;
    private Object result;
    private String error;
    private Throwable failure;
    private int attempts;
    private Object resolvedInput;
    private Instant startTime;
    private Instant endTime;

    public TaskState(TaskSpec spec) {
        this.spec = Objects.requireNonNull(spec, "Task spec cannot be null");
    }

    public TaskSpec getSpec() {
        return spec;
    }

    public String getTaskId() {
        return spec.getId();
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized Object getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    /**
     * @return the exception behind the last failed attempt, or null
     */
    public synchronized Throwable getFailure() {
        return failure;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized Object getResolvedInput() {
        return resolvedInput;
    }

    public synchronized Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized Duration getDuration() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime != null ? endTime : Instant.now());
    }

    synchronized void markRunning(Instant at) {
        this.status = TaskStatus.RUNNING;
        this.startTime = at;
    }

    synchronized void setResolvedInput(Object resolvedInput) {
        this.resolvedInput = resolvedInput;
    }

    synchronized int recordAttempt() {
        return ++attempts;
    }

    synchronized void recordAttemptFailure(Throwable cause) {
        this.failure = cause;
        this.error = cause != null ? cause.getMessage() : null;
    }

    synchronized void markCompleted(Object result, Instant at) {
        this.status = TaskStatus.COMPLETED;
        this.result = result;
        this.error = null;
        this.endTime = at;
    }

    synchronized void markFailed(Throwable cause, Instant at) {
        this.status = TaskStatus.FAILED;
        this.failure = cause;
        this.error = cause != null ? cause.getMessage() : "unknown error";
        this.endTime = at;
    }

    @Override
    public synchronized String toString() {
        return "TaskState{" +
               "taskId='" + spec.getId() + '\'' +
               ", status=" + status +
               ", attempts=" + attempts +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }
}
