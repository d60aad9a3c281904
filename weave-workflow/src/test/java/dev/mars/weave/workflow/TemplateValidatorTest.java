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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TemplateValidator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class TemplateValidatorTest {

    private TemplateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TemplateValidator();
    }

    @Test
    void testValidTemplate() {
        WorkflowTemplate template = template(
                agent("fetch").output("profile").build(),
                TaskSpec.builder().id("summarise").type(TaskType.AI_COMPLETION)
                        .prompt("Summarise ${profile}").dependsOn("fetch").output("summary").build());

        ValidationResult result = validator.validate(template);

        assertTrue(result.isValid(), result.getErrorSummary());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testMissingIdentity() {
        WorkflowTemplate template = new WorkflowTemplate(null, " ", null, List.of(agent("a").build()));

        ValidationResult result = validator.validate(template);

        assertEquals(2, result.getErrors().size());
        assertEquals("id", result.getErrors().get(0).getFieldPath());
        assertEquals("name", result.getErrors().get(1).getFieldPath());
    }

    @Test
    void testEmptyTaskList() {
        WorkflowTemplate template = new WorkflowTemplate("t", "T", null, List.of());

        ValidationResult result = validator.validate(template);

        assertFalse(result.isValid());
        assertEquals("tasks", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testDuplicateTaskIds() {
        ValidationResult result = validator.validate(template(agent("a").build(), agent("a").build()));

        assertFalse(result.isValid());
        assertEquals("tasks[1].id", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testMissingDependencyAndCycle() {
        ValidationResult missing = validator.validate(template(agent("a").dependsOn("nope").build()));
        assertFalse(missing.isValid());
        assertTrue(missing.getErrorSummary().contains("nope"));

        ValidationResult cycle = validator.validate(template(
                agent("a").dependsOn("b").build(),
                agent("b").dependsOn("a").build()));
        assertFalse(cycle.isValid());
        assertTrue(cycle.getErrorSummary().contains("Circular"));
    }

    @Test
    void testCustomTaskRequiresFunction() {
        TaskSpec custom = TaskSpec.builder().id("calc").type(TaskType.CUSTOM).build();

        ValidationResult result = validator.validate(template(custom));

        assertFalse(result.isValid());
        assertEquals("tasks[0].function", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testDecisionRequiresConditionAndValidBranches() {
        TaskSpec decision = TaskSpec.builder()
                .id("route")
                .type(TaskType.DECISION)
                .trueBranch(List.of(TaskSpec.builder().id("inner").build()))
                .build();

        ValidationResult result = validator.validate(template(decision));

        assertFalse(result.isValid());
        assertEquals("tasks[0].condition", result.getErrors().get(0).getFieldPath());
        assertEquals("tasks[0].trueBranch[0].type", result.getErrors().get(1).getFieldPath());
    }

    @Test
    void testBranchDependsOnIsAWarning() {
        TaskSpec decision = TaskSpec.builder()
                .id("route")
                .type(TaskType.DECISION)
                .condition("true")
                .trueBranch(List.of(agent("inner").dependsOn("elsewhere").build()))
                .build();

        ValidationResult result = validator.validate(template(decision));

        assertTrue(result.isValid());
        assertEquals(1, result.getWarningCount());
        assertEquals("tasks[0].trueBranch[0].dependsOn", result.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testUnknownTypeIsAWarning() {
        TaskSpec task = TaskSpec.builder().id("x").type("quantum").build();

        ValidationResult result = validator.validate(template(task));

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
        assertTrue(result.getWarnings().get(0).getMessage().contains("quantum"));
    }

    @Test
    void testNegativeRetrySettings() {
        TaskSpec task = agent("a")
                .maxRetries(-1)
                .retryDelay(Duration.ofMillis(-5))
                .timeout(Duration.ofSeconds(-1))
                .maxTokens(0)
                .build();

        ValidationResult result = validator.validate(template(task));

        assertEquals(4, result.getErrors().size());
    }

    @Test
    void testDuplicateOutputInSameLevel() {
        ValidationResult result = validator.validate(template(
                agent("a").output("shared").build(),
                agent("b").output("shared").build()));

        assertFalse(result.isValid());
        assertEquals("tasks.b.output", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testSameOutputInDifferentLevelsIsAllowed() {
        ValidationResult result = validator.validate(template(
                agent("a").output("shared").build(),
                agent("b").output("shared").dependsOn("a").build()));

        assertTrue(result.isValid(), result.getErrorSummary());
    }

    @Test
    void testBranchOutputsCountTowardDecisionLevel() {
        TaskSpec decision = TaskSpec.builder()
                .id("route")
                .type(TaskType.DECISION)
                .condition("true")
                .trueBranch(List.of(agent("yes").output("answer").build()))
                .falseBranch(List.of(agent("no").output("answer").build()))
                .build();

        assertTrue(validator.validate(template(decision)).isValid());

        ValidationResult clash = validator.validate(template(decision, agent("other").output("answer").build()));
        assertFalse(clash.isValid());
        assertEquals("tasks.other.output", clash.getErrors().get(0).getFieldPath());
    }

    @Test
    void testValidateOrThrowSingleError() {
        InvalidTemplateException e = assertThrows(InvalidTemplateException.class,
                () -> validator.validateOrThrow(template(agent("a").dependsOn("b").build())));

        assertEquals("flow", e.getTemplateId());
        assertEquals("tasks.a.dependsOn", e.getFieldPath());
    }

    @Test
    void testValidateOrThrowSummarisesMultipleErrors() {
        InvalidTemplateException e = assertThrows(InvalidTemplateException.class,
                () -> validator.validateOrThrow(new WorkflowTemplate(null, null, null, List.of())));

        assertTrue(e.getMessage().contains("Template validation failed"));
        assertNull(e.getFieldPath());
    }

    @Test
    void testIssuesAreKeyedToOwningTask() {
        TaskSpec decision = TaskSpec.builder()
                .id("route")
                .type(TaskType.DECISION)
                .condition("true")
                .trueBranch(List.of(agent("yes").dependsOn("route").build()))
                .build();

        ValidationResult result = validator.validate(template(
                agent("a").maxRetries(-1).build(),
                decision));

        assertEquals("flow", result.getTemplateId());
        assertEquals(1, result.issuesFor("a").size());
        assertEquals("tasks[0].maxRetries", result.issuesFor("a").get(0).getFieldPath());
        assertEquals(1, result.issuesFor("yes").size());
        assertEquals("tasks[1].trueBranch[0].dependsOn", result.issuesFor("yes").get(0).getFieldPath());
        assertTrue(result.issuesFor("route").isEmpty());
    }

    @Test
    void testTemplateLevelErrorsHaveNoTask() {
        ValidationResult result = validator.validate(new WorkflowTemplate("flow", null, null, List.of()));

        assertEquals(2, result.getErrors().size());
        assertNull(result.getErrors().get(0).getTaskId());
        assertEquals("name: Template name is required", result.getErrors().get(0).toString());
    }

    @Test
    void testNullTemplate() {
        assertFalse(validator.validate(null).isValid());
    }

    private static TaskSpec.Builder agent(String id) {
        return TaskSpec.builder().id(id).type(TaskType.AGENT);
    }

    private static WorkflowTemplate template(TaskSpec... tasks) {
        return WorkflowTemplate.builder()
                .id("flow")
                .name("Flow")
                .tasks(List.of(tasks))
                .build();
    }
}
