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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, named task graph from which workflow instances are started.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowTemplate {

    private final String id;
    private final String name;
    private final String description;
    private final List<TaskSpec> tasks;

    public WorkflowTemplate(String id, String name, String description, List<TaskSpec> tasks) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.tasks = List.copyOf(tasks != null ? tasks : List.of());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return top-level tasks in declaration order
     */
    public List<TaskSpec> getTasks() {
        return tasks;
    }

    public Optional<TaskSpec> findTask(String taskId) {
        return tasks.stream()
                .filter(task -> Objects.equals(task.getId(), taskId))
                .findFirst();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowTemplate that = (WorkflowTemplate) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(tasks, that.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, tasks);
    }

    @Override
    public String toString() {
        return "WorkflowTemplate{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", tasks=" + tasks.size() +
               '}';
    }

    /**
     * Builder for WorkflowTemplate.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private final List<TaskSpec> tasks = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder task(TaskSpec task) {
            this.tasks.add(task);
            return this;
        }

        public Builder tasks(List<TaskSpec> tasks) {
            this.tasks.clear();
            if (tasks != null) {
                this.tasks.addAll(tasks);
            }
            return this;
        }

        public WorkflowTemplate build() {
            return new WorkflowTemplate(id, name, description, tasks);
        }
    }
}
