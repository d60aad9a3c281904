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
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Problems found in one workflow template. Each issue points at the offending field and, when it
 * belongs to a task, at that task's id, so callers can report per task as well as per template.
 *
 * <p>Errors block registration; warnings (an unknown task type, a branch task declaring
 * {@code dependsOn}) are informational.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.1
 */
public class ValidationResult {

    private final String templateId;
    private final List<TemplateIssue> errors = new ArrayList<>();
    private final List<TemplateIssue> warnings = new ArrayList<>();

    public ValidationResult(String templateId) {
        this.templateId = templateId;
    }

    /**
     * Records a template-level error, such as a missing name.
     */
    public ValidationResult error(String fieldPath, String message) {
        return taskError(null, fieldPath, message);
    }

    public ValidationResult taskError(String taskId, String fieldPath, String message) {
        errors.add(new TemplateIssue(taskId, fieldPath, message));
        return this;
    }

    public ValidationResult taskWarning(String taskId, String fieldPath, String message) {
        warnings.add(new TemplateIssue(taskId, fieldPath, message));
        return this;
    }

    /**
     * Folds the errors of a narrower check, e.g. the dependency graph, into this result.
     */
    public ValidationResult mergeErrors(ValidationResult other) {
        errors.addAll(other.errors);
        return this;
    }

    public String getTemplateId() {
        return templateId;
    }

    public List<TemplateIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<TemplateIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Errors and warnings raised against one task, errors first.
     */
    public List<TemplateIssue> issuesFor(String taskId) {
        return Stream.concat(errors.stream(), warnings.stream())
                .filter(issue -> taskId.equals(issue.getTaskId()))
                .collect(Collectors.toList());
    }

    public String getErrorSummary() {
        return errors.stream()
                .map(TemplateIssue::toString)
                .collect(Collectors.joining("; "));
    }

    /**
     * A single error keeps its field path on the exception; several are summarised on one line.
     */
    public InvalidTemplateException toException() {
        if (errors.size() == 1) {
            TemplateIssue only = errors.get(0);
            return new InvalidTemplateException(templateId, only.getFieldPath(), only.getMessage());
        }
        return new InvalidTemplateException(templateId, null,
                "Template validation failed: " + getErrorSummary());
    }

    @Override
    public String toString() {
        return "ValidationResult{templateId='" + templateId + "', errors=" + errors.size()
                + ", warnings=" + warnings.size() + '}';
    }

    /**
     * One problem in a template.
     */
    public static final class TemplateIssue {

        private final String taskId;
        private final String fieldPath;
        private final String message;

        TemplateIssue(String taskId, String fieldPath, String message) {
            this.taskId = taskId;
            this.fieldPath = fieldPath;
            this.message = message;
        }

        /**
         * @return the owning task's id, or null for template-level issues and tasks without an id
         */
        public String getTaskId() {
            return taskId;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return fieldPath != null ? fieldPath + ": " + message : message;
        }
    }
}
