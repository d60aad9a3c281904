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

/**
 * Lifecycle status of a workflow instance.
 *
 * An instance is created RUNNING and ends in exactly one of
 * COMPLETED, FAILED or CANCELLED. Terminal states never change.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum WorkflowStatus {

    /**
     * Levels are being executed.
     */
    RUNNING("Workflow is running", false, false),

    /**
     * Every level finished successfully.
     */
    COMPLETED("Workflow completed successfully", true, true),

    /**
     * A task exhausted its retries or the maximum duration elapsed.
     */
    FAILED("Workflow execution failed", true, false),

    /**
     * Cancelled by a caller or by engine shutdown.
     */
    CANCELLED("Workflow cancelled", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    WorkflowStatus(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        if (this.isTerminal()) {
            return false;
        }
        return target == COMPLETED || target == FAILED || target == CANCELLED;
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public WorkflowStatus[] getValidTransitions() {
        if (this == RUNNING) {
            return new WorkflowStatus[]{COMPLETED, FAILED, CANCELLED};
        }
        return new WorkflowStatus[0];
    }
}
