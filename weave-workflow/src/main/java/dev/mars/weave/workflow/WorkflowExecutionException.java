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
 * Instance-level failure that is not attributable to a single task, such as
 * exceeding the maximum workflow duration.
 */
public class WorkflowExecutionException extends WeaveException {

    private final String workflowId;

    public WorkflowExecutionException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
    }

    public WorkflowExecutionException(String workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
