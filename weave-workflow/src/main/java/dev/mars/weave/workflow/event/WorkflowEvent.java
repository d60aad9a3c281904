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


package dev.mars.weave.workflow.event;

import java.time.Instant;

/**
 * Lifecycle event published by the engine.
 *
 * @param type       what happened
 * @param instanceId the workflow instance concerned
 * @param taskId     the task concerned, or null for instance events
 * @param message    error text for failure events, otherwise null
 * @param timestamp  when the event was raised
 */
public record WorkflowEvent(
        Type type,
        String instanceId,
        String taskId,
        String message,
        Instant timestamp
) {

    public enum Type {
        INSTANCE_STARTED("instance-started"),
        TASK_STARTED("task-started"),
        TASK_COMPLETED("task-completed"),
        TASK_FAILED("task-failed"),
        INSTANCE_COMPLETED("instance-completed"),
        INSTANCE_FAILED("instance-failed"),
        INSTANCE_CANCELLED("instance-cancelled");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    public static WorkflowEvent instanceStarted(String instanceId) {
        return new WorkflowEvent(Type.INSTANCE_STARTED, instanceId, null, null, Instant.now());
    }

    public static WorkflowEvent instanceCompleted(String instanceId) {
        return new WorkflowEvent(Type.INSTANCE_COMPLETED, instanceId, null, null, Instant.now());
    }

    public static WorkflowEvent instanceFailed(String instanceId, String error) {
        return new WorkflowEvent(Type.INSTANCE_FAILED, instanceId, null, error, Instant.now());
    }

    public static WorkflowEvent instanceCancelled(String instanceId) {
        return new WorkflowEvent(Type.INSTANCE_CANCELLED, instanceId, null, null, Instant.now());
    }

    public static WorkflowEvent taskStarted(String instanceId, String taskId) {
        return new WorkflowEvent(Type.TASK_STARTED, instanceId, taskId, null, Instant.now());
    }

    public static WorkflowEvent taskCompleted(String instanceId, String taskId) {
        return new WorkflowEvent(Type.TASK_COMPLETED, instanceId, taskId, null, Instant.now());
    }

    public static WorkflowEvent taskFailed(String instanceId, String taskId, String error) {
        return new WorkflowEvent(Type.TASK_FAILED, instanceId, taskId, error, Instant.now());
    }
}
