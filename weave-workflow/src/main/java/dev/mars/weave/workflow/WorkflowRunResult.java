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
import java.util.Map;
import java.util.Objects;

/**
 * Outcome delivered by the future returned from {@link WorkflowEngine#start}.
 * Produced for completed and cancelled instances; failed instances complete the future
 * exceptionally instead.
 */
public class WorkflowRunResult {

    private final boolean success;
    private final String workflowId;
    private final WorkflowStatus status;
    private final Map<String, Object> output;
    private final Duration duration;

    public WorkflowRunResult(boolean success, String workflowId, WorkflowStatus status,
                             Map<String, Object> output, Duration duration) {
        this.success = success;
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output != null ? output : Map.of();
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    static WorkflowRunResult of(WorkflowInstance instance) {
        return new WorkflowRunResult(
                instance.getStatus().isSuccessful(),
                instance.getId(),
                instance.getStatus(),
                instance.getContext().snapshot(),
                instance.getDuration());
    }

    public boolean isSuccess() {
        return success;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * @return the final context of the instance
     */
    public Map<String, Object> getOutput() {
        return output;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "WorkflowRunResult{" +
               "success=" + success +
               ", workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", duration=" + duration +
               '}';
    }
}
