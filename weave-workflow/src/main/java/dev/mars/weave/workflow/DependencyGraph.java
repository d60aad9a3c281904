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

import java.util.*;

/**
 * Dependency graph over the top-level tasks of a template.
 * Groups tasks into execution levels and detects cycles and dangling references.
 */
public class DependencyGraph {

    private final Map<String, List<String>> dependencies;
    private final Map<String, TaskSpec> tasks;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
        this.tasks = new LinkedHashMap<>();
    }

    /**
     * Builds a graph from tasks in template order.
     */
    public static DependencyGraph of(List<TaskSpec> tasks) {
        DependencyGraph graph = new DependencyGraph();
        for (TaskSpec task : tasks) {
            graph.addTask(task);
        }
        return graph;
    }

    /**
     * Adds a task to the dependency graph. Insertion order is the template order.
     *
     * @param task the task to add
     */
    public void addTask(TaskSpec task) {
        Objects.requireNonNull(task, "Task cannot be null");

        tasks.put(task.getId(), task);
        dependencies.put(task.getId(), task.getDependsOn());
    }

    public Map<String, TaskSpec> getTasks() {
        return Collections.unmodifiableMap(tasks);
    }

    /**
     * Gets the dependencies for a specific task.
     *
     * @param taskId the id of the task
     * @return declared dependency ids, in declaration order
     */
    public List<String> getDependencies(String taskId) {
        return dependencies.getOrDefault(taskId, List.of());
    }

    /**
     * Finds the tasks that declare a dependency on the given task.
     */
    public List<String> findDependents(String taskId) {
        List<String> dependents = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(taskId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Groups tasks into execution levels. Level 0 holds the tasks with no dependencies; each
     * following level holds the remaining tasks whose dependencies all lie in earlier levels.
     * Tasks keep template order within a level.
     *
     * @return the levels as lists of task ids
     * @throws InvalidTemplateException naming the stalled tasks if a cycle or dangling reference
     *         leaves some tasks unschedulable
     */
    public List<List<String>> computeLevels() throws InvalidTemplateException {
        List<List<String>> levels = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        while (visited.size() < tasks.size()) {
            List<String> level = new ArrayList<>();

            for (String taskId : tasks.keySet()) {
                if (!visited.contains(taskId) && visited.containsAll(getDependencies(taskId))) {
                    level.add(taskId);
                }
            }

            if (level.isEmpty()) {
                break;
            }

            visited.addAll(level);
            levels.add(level);
        }

        if (visited.size() < tasks.size()) {
            List<String> stalled = new ArrayList<>();
            for (String taskId : tasks.keySet()) {
                if (!visited.contains(taskId)) {
                    stalled.add(taskId);
                }
            }
            throw new InvalidTemplateException(
                    "Circular or unresolved dependency detected among tasks: " + stalled);
        }

        return levels;
    }

    /**
     * Detects circular dependencies in the graph.
     *
     * @return true if some task can never be scheduled
     */
    public boolean hasCycles() {
        try {
            computeLevels();
            return false;
        } catch (InvalidTemplateException e) {
            return true;
        }
    }

    /**
     * Validates the dependency graph for consistency.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult(null);

        // Check for missing dependencies and self-dependencies
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            String taskId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (taskId.equals(dependency)) {
                    result.taskError(taskId, "tasks." + taskId + ".dependsOn", "Task cannot depend on itself");
                } else if (!tasks.containsKey(dependency)) {
                    result.taskError(taskId, "tasks." + taskId + ".dependsOn",
                            "Dependency '" + dependency + "' not found");
                }
            }
        }

        // A dangling reference also stalls scheduling; report the cycle only when the references resolve
        if (result.isValid()) {
            try {
                computeLevels();
            } catch (InvalidTemplateException e) {
                result.error("tasks", e.getMessage());
            }
        }

        return result;
    }
}
