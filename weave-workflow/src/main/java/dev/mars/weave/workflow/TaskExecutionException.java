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

import dev.mars.weave.core.exceptions.WeaveException;

/**
 * Raised when a task cannot produce a result: the capability provider failed, timed out,
 * or is not configured. When attached to a failed task it carries the number of
 * attempts that were consumed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskExecutionException extends WeaveException {

    private final String taskId;
    private final int attempts;

    public TaskExecutionException(String taskId, String message) {
        this(taskId, 0, message, null);
    }

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        this(taskId, 0, message, cause);
    }

    public TaskExecutionException(String taskId, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.attempts = attempts;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return attempts consumed before giving up, or 0 when the failure is attempt-local
     */
    public int getAttempts() {
        return attempts;
    }
}
