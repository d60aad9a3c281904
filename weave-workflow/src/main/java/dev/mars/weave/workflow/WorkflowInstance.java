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

import dev.mars.weave.core.exceptions.InvalidStateTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One execution of a workflow template: its status, context, per-task state,
 * checkpoints and recorded errors.
 *
 * <p>Status changes go through {@link #transitionTo(WorkflowStatus, Instant)} so that the first
 * terminal transition wins when completion and cancellation race.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowInstance {

    private final String id;
    private final String templateId;
    private final String name;
    private final String userId;
    private final String workspace;
    private final Instant startTime;
    private final ContextStore context;
    private final Map<String, TaskState> taskStates;
    private final int maxCheckpoints;
    private final Deque<Checkpoint> checkpoints = new ArrayDeque<>();
    private final List<WorkflowError> errors = new CopyOnWriteArrayList<>();

    private volatile WorkflowStatus status = WorkflowStatus.RUNNING;
    private volatile Instant endTime;

    public WorkflowInstance(String id, WorkflowTemplate template, Map<String, ?> input,
                            String userId, String workspace, int maxCheckpoints, Instant startTime) {
        this.id = Objects.requireNonNull(id, "Instance ID cannot be null");
        Objects.requireNonNull(template, "Template cannot be null");
        this.templateId = template.getId();
        this.name = template.getName();
        this.userId = userId;
        this.workspace = workspace;
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.context = new ContextStore(input);
        this.maxCheckpoints = Math.max(0, maxCheckpoints);

        Map<String, TaskState> states = new LinkedHashMap<>();
        for (TaskSpec task : template.getTasks()) {
            states.put(task.getId(), new TaskState(task));
        }
        this.taskStates = Collections.unmodifiableMap(states);
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

    public String getUserId() {
        return userId;
    }

    public String getWorkspace() {
        return workspace;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public boolean isRunning() {
        return status == WorkflowStatus.RUNNING;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        Instant end = endTime;
        return Duration.between(startTime, end != null ? end : Instant.now());
    }

    public ContextStore getContext() {
        return context;
    }

    /**
     * @return task states keyed by task id, in template order
     */
    public Map<String, TaskState> getTaskStates() {
        return taskStates;
    }

    public TaskState getTaskState(String taskId) {
        return taskStates.get(taskId);
    }

    public List<String> getCompletedTaskIds() {
        List<String> completed = new ArrayList<>();
        for (TaskState state : taskStates.values()) {
            if (state.getStatus() == TaskStatus.COMPLETED) {
                completed.add(state.getTaskId());
            }
        }
        return completed;
    }

    /**
     * Percentage of tasks that have completed, rounded down.
     */
    public int getProgressPercent() {
        if (taskStates.isEmpty()) {
            return 100;
        }
        return getCompletedTaskIds().size() * 100 / taskStates.size();
    }

    /**
     * Attempts a status transition. Terminal transitions also set the end time.
     *
     * @return false if the current status does not allow the transition
     */
    public synchronized boolean transitionTo(WorkflowStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        if (target.isTerminal()) {
            endTime = at;
        }
        return true;
    }

    /**
     * Like {@link #transitionTo(WorkflowStatus, Instant)} but reports a rejected transition.
     */
    public synchronized void transitionOrThrow(WorkflowStatus target, Instant at)
            throws InvalidStateTransitionException {
        WorkflowStatus current = status;
        if (!transitionTo(target, at)) {
            throw new InvalidStateTransitionException(id, current, target, current.getValidTransitions());
        }
    }

    /**
     * Appends a checkpoint, discarding the oldest once the configured bound is reached.
     */
    public void addCheckpoint(Checkpoint checkpoint) {
        if (maxCheckpoints == 0) {
            return;
        }
        synchronized (checkpoints) {
            checkpoints.addLast(checkpoint);
            while (checkpoints.size() > maxCheckpoints) {
                checkpoints.removeFirst();
            }
        }
    }

    public List<Checkpoint> getCheckpoints() {
        synchronized (checkpoints) {
            return List.copyOf(checkpoints);
        }
    }

    public void recordError(String message, Instant at) {
        errors.add(new WorkflowError(message != null ? message : "unknown error", at));
    }

    public List<WorkflowError> getErrors() {
        return List.copyOf(errors);
    }

    @Override
    public String toString() {
        return "WorkflowInstance{" +
               "id='" + id + '\'' +
               ", templateId='" + templateId + '\'' +
               ", status=" + status +
               ", startTime=" + startTime +
               '}';
    }
}
