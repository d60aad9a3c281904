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
 * Raised at dispatch time for a task whose type is not one of the known {@link TaskType}s.
 * Every attempt of such a task fails identically.
 */
public class UnknownTaskTypeException extends TaskExecutionException {

    private final String type;

    public UnknownTaskTypeException(String taskId, String type) {
        super(taskId, "Unknown task type '" + type + "' for task " + taskId);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
