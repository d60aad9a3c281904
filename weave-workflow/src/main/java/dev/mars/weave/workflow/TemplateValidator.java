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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registration-time checks for workflow templates.
 *
 * <p>Checks required fields, task id uniqueness, dependency references, cycles, decision
 * conditions, retry settings, and that no two tasks of the same execution level write the same
 * output variable. Unknown task types are reported as warnings only; they fail when dispatched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TemplateValidator {

    /**
     * Validates a template and collects every problem found.
     */
    public ValidationResult validate(WorkflowTemplate template) {
        if (template == null) {
            return new ValidationResult(null).error(null, "Template cannot be null");
        }
        ValidationResult result = new ValidationResult(template.getId());

        if (isBlank(template.getId())) {
            result.error("id", "Template id is required");
        }
        if (isBlank(template.getName())) {
            result.error("name", "Template name is required");
        }
        if (template.getTasks().isEmpty()) {
            result.error("tasks", "Template must declare at least one task");
            return result;
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < template.getTasks().size(); i++) {
            TaskSpec task = template.getTasks().get(i);
            String path = "tasks[" + i + "]";
            validateTask(task, path, result);
            if (task != null && !isBlank(task.getId()) && !seenIds.add(task.getId())) {
                result.taskError(task.getId(), path + ".id", "Duplicate task id '" + task.getId() + "'");
            }
        }

        // Graph checks need well-formed, unique ids
        if (result.isValid()) {
            DependencyGraph graph = DependencyGraph.of(template.getTasks());
            ValidationResult graphResult = graph.validate();
            result.mergeErrors(graphResult);
            if (graphResult.isValid()) {
                validateLevelOutputs(graph, result);
            }
        }

        return result;
    }

    /**
     * Validates a template, throwing if it is not valid.
     *
     * @throws InvalidTemplateException carrying every error message found
     */
    public void validateOrThrow(WorkflowTemplate template) throws InvalidTemplateException {
        ValidationResult result = validate(template);
        if (!result.isValid()) {
            throw result.toException();
        }
    }

    private void validateTask(TaskSpec task, String path, ValidationResult result) {
        if (task == null) {
            result.error(path, "Task cannot be null");
            return;
        }
        String id = isBlank(task.getId()) ? null : task.getId();
        if (isBlank(task.getId())) {
            result.taskError(id, path + ".id", "Task id is required");
        }
        if (isBlank(task.getType())) {
            result.taskError(id, path + ".type", "Task type is required");
            return;
        }

        Optional<TaskType> type = task.getTaskType();
        if (type.isEmpty()) {
            result.taskWarning(id, path + ".type", "Unknown task type '" + task.getType() + "'");
        } else if (type.get() == TaskType.CUSTOM && isBlank(task.getFunction())) {
            result.taskError(id, path + ".function", "Custom task requires a function name");
        } else if (type.get() == TaskType.DECISION) {
            validateDecision(task, path, result);
        }

        if (task.getMaxRetries() != null && task.getMaxRetries() < 0) {
            result.taskError(id, path + ".maxRetries", "maxRetries cannot be negative");
        }
        if (isNegative(task.getRetryDelay())) {
            result.taskError(id, path + ".retryDelay", "retryDelay cannot be negative");
        }
        if (isNegative(task.getTimeout())) {
            result.taskError(id, path + ".timeout", "timeout cannot be negative");
        }
        if (task.getMaxTokens() != null && task.getMaxTokens() <= 0) {
            result.taskError(id, path + ".maxTokens", "maxTokens must be positive");
        }
    }

    private void validateDecision(TaskSpec task, String path, ValidationResult result) {
        if (isBlank(task.getCondition())) {
            result.taskError(task.getId(), path + ".condition", "Decision task requires a condition");
        }
        validateBranch(task.getTrueBranch(), path + ".trueBranch", result);
        validateBranch(task.getFalseBranch(), path + ".falseBranch", result);
    }

    private void validateBranch(List<TaskSpec> branch, String path, ValidationResult result) {
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < branch.size(); i++) {
            TaskSpec task = branch.get(i);
            String taskPath = path + "[" + i + "]";
            validateTask(task, taskPath, result);
            if (task == null) {
                continue;
            }
            if (!isBlank(task.getId()) && !seenIds.add(task.getId())) {
                result.taskError(task.getId(), taskPath + ".id",
                        "Duplicate task id '" + task.getId() + "' in branch");
            }
            if (!task.getDependsOn().isEmpty()) {
                result.taskWarning(task.getId(), taskPath + ".dependsOn",
                        "dependsOn is ignored for branch tasks");
            }
        }
    }

    private void validateLevelOutputs(DependencyGraph graph, ValidationResult result) {
        List<List<String>> levels;
        try {
            levels = graph.computeLevels();
        } catch (InvalidTemplateException e) {
            result.error("tasks", e.getMessage());
            return;
        }

        for (int level = 0; level < levels.size(); level++) {
            Map<String, String> writers = new HashMap<>();
            for (String taskId : levels.get(level)) {
                for (String output : collectOutputs(graph.getTasks().get(taskId))) {
                    String previous = writers.putIfAbsent(output, taskId);
                    if (previous != null) {
                        result.taskError(taskId, "tasks." + taskId + ".output",
                                "Output '" + output + "' is also written by task '" + previous
                                        + "' in the same execution level " + level);
                    }
                }
            }
        }
    }

    // A decision writes its own output and those of either branch; only one branch runs
    private Set<String> collectOutputs(TaskSpec task) {
        Set<String> outputs = new LinkedHashSet<>();
        if (task.hasOutput()) {
            outputs.add(task.getOutput());
        }
        for (TaskSpec branchTask : task.getTrueBranch()) {
            if (branchTask != null) {
                outputs.addAll(collectOutputs(branchTask));
            }
        }
        for (TaskSpec branchTask : task.getFalseBranch()) {
            if (branchTask != null) {
                outputs.addAll(collectOutputs(branchTask));
            }
        }
        return outputs;
    }

    private static boolean isNegative(Duration duration) {
        return duration != null && duration.isNegative();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
