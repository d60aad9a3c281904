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

import java.util.Optional;

/**
 * The kinds of task a template may declare. Each type is backed by a different
 * capability provider, except {@link #DECISION} which is evaluated by the engine itself.
 */
public enum TaskType {

    /**
     * Delegates to an {@code AgentExecutor} for the task's agent kind.
     */
    AGENT("agent"),

    /**
     * Sends a prompt to an {@code AICompletionProvider}.
     */
    AI_COMPLETION("ai-completion"),

    /**
     * Invokes a named function from a {@code CustomFunctionRegistry}.
     */
    CUSTOM("custom"),

    /**
     * Evaluates a condition and runs one of two nested branches.
     */
    DECISION("decision");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    /**
     * The identifier used for this type in templates and YAML documents.
     */
    public String getValue() {
        return value;
    }

    /**
     * Looks up a type by its template identifier. The enum constant name is accepted too,
     * so {@code "AI_COMPLETION"} and {@code "ai-completion"} resolve to the same type.
     */
    public static Optional<TaskType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (TaskType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
