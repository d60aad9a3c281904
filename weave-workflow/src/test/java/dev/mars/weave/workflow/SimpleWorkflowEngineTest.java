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

import dev.mars.weave.config.WeaveConfiguration;
import dev.mars.weave.core.exceptions.InvalidStateTransitionException;
import dev.mars.weave.workflow.event.WorkflowEvent;
import dev.mars.weave.workflow.provider.AICompletionProvider;
import dev.mars.weave.workflow.provider.AgentExecutor;
import dev.mars.weave.workflow.provider.CompletionOptions;
import dev.mars.weave.workflow.provider.CompletionResult;
import dev.mars.weave.workflow.provider.SimpleCustomFunctionRegistry;
import dev.mars.weave.workflow.store.InMemoryInstanceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for SimpleWorkflowEngine functionality.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class SimpleWorkflowEngineTest {

    @Mock
    private AgentExecutor mockAgentExecutor;

    @Mock
    private AICompletionProvider mockCompletionProvider;

    private SimpleCustomFunctionRegistry functions;
    private InMemoryInstanceStore instanceStore;
    private List<WorkflowEvent> events;
    private SimpleWorkflowEngine workflowEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        functions = new SimpleCustomFunctionRegistry();
        instanceStore = new InMemoryInstanceStore();
        events = new CopyOnWriteArrayList<>();
        workflowEngine = createEngine(new Properties());
    }

    @AfterEach
    void tearDown() {
        workflowEngine.shutdown();
    }

    @Test
    void testOutputsFlowBetweenLevels() throws Exception {
        when(mockAgentExecutor.execute(eq("lookup"), any()))
                .thenReturn(CompletableFuture.completedFuture("gold"));
        functions.register("greet", input -> "Welcome, " + input + " member");
        workflowEngine.register(template("greeting",
                agent("a").agent("lookup").input("${customerId}").output("tier").build(),
                TaskSpec.builder().id("b").type(TaskType.CUSTOM).function("greet")
                        .input("${tier}").output("greeting").dependsOn("a").build()));

        WorkflowRunResult result = workflowEngine.start("greeting", Map.of("customerId", "c-7"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals("Welcome, gold member", result.getOutput().get("greeting"));
        assertEquals("c-7", result.getOutput().get("customerId"));
        verify(mockAgentExecutor).execute("lookup", "c-7");
        WorkflowInstance instance = instanceStore.find(result.getWorkflowId()).orElseThrow();
        assertEquals("gold", instance.getTaskState("b").getResolvedInput());

        WorkflowStatusReport report = workflowEngine.getStatus(result.getWorkflowId()).orElseThrow();
        assertEquals(100, report.getProgressPercent());
        assertNotNull(report.getEndTime());
        assertTrue(report.getTasks().stream().allMatch(task -> task.getStatus() == TaskStatus.COMPLETED));
    }

    @Test
    void testTasksInSameLevelRunConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(mockAgentExecutor.execute(anyString(), any())).thenAnswer(invocation -> {
            bothStarted.countDown();
            boolean together = bothStarted.await(2, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(together);
        });
        workflowEngine.register(template("fan-out",
                agent("left").output("left").build(),
                agent("right").output("right").build()));

        WorkflowRunResult result = workflowEngine.start("fan-out", Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals(Boolean.TRUE, result.getOutput().get("left"));
        assertEquals(Boolean.TRUE, result.getOutput().get("right"));
    }

    @Test
    void testFailedTaskStopsLaterLevels() throws Exception {
        when(mockAgentExecutor.execute(eq("first"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("service unavailable")));
        workflowEngine.register(template("fail-fast",
                agent("first").build(),
                agent("second").dependsOn("first").build()));

        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("fail-fast", Map.of(),
                StartOptions.builder().instanceId("wf-fail").build());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        TaskExecutionException failure = assertInstanceOf(TaskExecutionException.class, e.getCause());
        assertEquals("first", failure.getTaskId());

        WorkflowStatusReport report = workflowEngine.getStatus("wf-fail").orElseThrow();
        assertEquals(WorkflowStatus.FAILED, report.getStatus());
        assertEquals(TaskStatus.FAILED, report.getTasks().get(0).getStatus());
        assertEquals(TaskStatus.PENDING, report.getTasks().get(1).getStatus());
        assertEquals(1, report.getErrors().size());
        assertTrue(report.getErrors().get(0).getMessage().contains("service unavailable"));
        verify(mockAgentExecutor, never()).execute(eq("second"), any());
    }

    @Test
    void testFailedSiblingStopsDependentsOfSucceededSibling() throws Exception {
        when(mockAgentExecutor.execute(eq("a"), any()))
                .thenReturn(CompletableFuture.completedFuture("ok"));
        when(mockAgentExecutor.execute(eq("b"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));
        workflowEngine.register(template("siblings",
                agent("a").output("fromA").build(),
                agent("b").build(),
                agent("c").input("${fromA}").dependsOn("a").build()));

        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("siblings", Map.of(),
                StartOptions.builder().instanceId("wf-siblings").build());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals("b", assertInstanceOf(TaskExecutionException.class, e.getCause()).getTaskId());

        WorkflowInstance instance = instanceStore.find("wf-siblings").orElseThrow();
        assertEquals(WorkflowStatus.FAILED, instance.getStatus());
        assertEquals(TaskStatus.COMPLETED, instance.getTaskState("a").getStatus());
        assertEquals(TaskStatus.FAILED, instance.getTaskState("b").getStatus());
        assertEquals(TaskStatus.PENDING, instance.getTaskState("c").getStatus());
        verify(mockAgentExecutor, never()).execute(eq("c"), any());
    }

    @Test
    void testTaskRetriesBeforeFailingInstance() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any()))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(new IllegalStateException("nope")));
        workflowEngine.register(template("retrying",
                agent("flaky").maxRetries(2).retryDelay(Duration.ofMillis(5)).build()));

        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("retrying", Map.of());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(3, ((TaskExecutionException) e.getCause()).getAttempts());
        verify(mockAgentExecutor, times(3)).execute(anyString(), any());
    }

    @Test
    void testCancelRunningInstance() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenAnswer(invocation -> new CompletableFuture<>());
        workflowEngine.register(template("stuck", agent("wait").output("never").build()));

        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("stuck", Map.of(),
                StartOptions.builder().instanceId("wf-cancel").build());
        await().atMost(Duration.ofSeconds(5)).untilAsserted(
                () -> verify(mockAgentExecutor).execute(anyString(), any()));

        assertTrue(workflowEngine.cancel("wf-cancel"));

        WorkflowRunResult result = future.get(5, TimeUnit.SECONDS);
        assertFalse(result.isSuccess());
        assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
        assertEquals(WorkflowStatus.CANCELLED, workflowEngine.getStatus("wf-cancel").orElseThrow().getStatus());
        assertThrows(InvalidStateTransitionException.class, () -> workflowEngine.cancel("wf-cancel"));
    }

    @Test
    void testCancelFinishedInstanceIsRejected() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(CompletableFuture.completedFuture("ok"));
        workflowEngine.register(template("quick", agent("a").build()));
        WorkflowRunResult result = workflowEngine.start("quick", Map.of()).get(5, TimeUnit.SECONDS);

        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
                () -> workflowEngine.cancel(result.getWorkflowId()));

        assertEquals(WorkflowStatus.COMPLETED, e.getCurrentState());
        assertEquals(WorkflowStatus.COMPLETED, workflowEngine.getStatus(result.getWorkflowId()).orElseThrow().getStatus());
    }

    @Test
    void testCancelUnknownInstance() {
        WorkflowNotFoundException e = assertThrows(WorkflowNotFoundException.class,
                () -> workflowEngine.cancel("missing"));
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    void testStartUnknownTemplate() {
        assertThrows(TemplateNotFoundException.class, () -> workflowEngine.start("ghost", Map.of()));
        assertEquals(0, workflowEngine.getStats().getTotalInstances());
    }

    @Test
    void testDuplicateInstanceIdIsRejected() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(CompletableFuture.completedFuture("ok"));
        workflowEngine.register(template("quick", agent("a").build()));
        StartOptions options = StartOptions.builder().instanceId("wf-dup").userId("ada").workspace("risk").build();
        workflowEngine.start("quick", Map.of(), options).get(5, TimeUnit.SECONDS);

        CompletableFuture<WorkflowRunResult> second = workflowEngine.start("quick", Map.of(), options);

        ExecutionException e = assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());

        WorkflowInstance instance = instanceStore.find("wf-dup").orElseThrow();
        assertEquals("ada", instance.getUserId());
        assertEquals("risk", instance.getWorkspace());
    }

    @Test
    void testInvalidTemplateIsRejectedAtRegistration() {
        WorkflowTemplate cyclic = template("cyclic",
                agent("a").dependsOn("b").build(),
                agent("b").dependsOn("a").build());

        assertThrows(InvalidTemplateException.class, () -> workflowEngine.register(cyclic));
        assertTrue(workflowEngine.listTemplates().isEmpty());
    }

    @Test
    void testCheckpointsAreTakenPerLevelAndBounded() throws Exception {
        workflowEngine.shutdown();
        Properties properties = new Properties();
        properties.setProperty(WeaveConfiguration.CHECKPOINT_MAX, "2");
        workflowEngine = createEngine(properties);

        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(CompletableFuture.completedFuture(1));
        workflowEngine.register(template("chain",
                agent("s1").output("o1").build(),
                agent("s2").output("o2").dependsOn("s1").build(),
                agent("s3").output("o3").dependsOn("s2").build(),
                agent("s4").output("o4").dependsOn("s3").build()));

        WorkflowRunResult result = workflowEngine.start("chain", Map.of()).get(5, TimeUnit.SECONDS);

        List<Checkpoint> checkpoints = instanceStore.find(result.getWorkflowId()).orElseThrow().getCheckpoints();
        assertEquals(2, checkpoints.size());
        assertEquals(List.of("s1", "s2", "s3"), checkpoints.get(0).getCompletedTaskIds());
        assertEquals(List.of("s1", "s2", "s3", "s4"), checkpoints.get(1).getCompletedTaskIds());
        assertTrue(checkpoints.get(1).getContext().containsKey("o4"));
        assertFalse(checkpoints.get(0).getContext().containsKey("o4"));
    }

    @Test
    void testCheckpointingCanBeDisabled() throws Exception {
        workflowEngine.shutdown();
        Properties properties = new Properties();
        properties.setProperty(WeaveConfiguration.CHECKPOINT_ENABLED, "false");
        workflowEngine = createEngine(properties);

        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(CompletableFuture.completedFuture(1));
        workflowEngine.register(template("single", agent("a").build()));

        WorkflowRunResult result = workflowEngine.start("single", Map.of()).get(5, TimeUnit.SECONDS);

        assertTrue(instanceStore.find(result.getWorkflowId()).orElseThrow().getCheckpoints().isEmpty());
    }

    @Test
    void testMaximumDurationFailsInstance() throws Exception {
        workflowEngine.shutdown();
        Properties properties = new Properties();
        properties.setProperty(WeaveConfiguration.WORKFLOW_MAX_DURATION_MS, "200");
        workflowEngine = createEngine(properties);

        when(mockAgentExecutor.execute(anyString(), any())).thenAnswer(invocation -> new CompletableFuture<>());
        workflowEngine.register(template("slow", agent("forever").build()));

        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("slow", Map.of(),
                StartOptions.builder().instanceId("wf-slow").build());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(WorkflowExecutionException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("maximum duration"));
        assertEquals(WorkflowStatus.FAILED, workflowEngine.getStatus("wf-slow").orElseThrow().getStatus());
    }

    @Test
    void testListenerSeesLifecycleInOrder() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(CompletableFuture.completedFuture("ok"));
        workflowEngine.register(template("ordered",
                agent("a").build(),
                agent("b").dependsOn("a").build()));

        WorkflowRunResult result = workflowEngine.start("ordered", Map.of()).get(5, TimeUnit.SECONDS);

        List<String> seen = events.stream()
                .filter(event -> event.instanceId().equals(result.getWorkflowId()))
                .map(event -> event.type() + (event.taskId() != null ? ":" + event.taskId() : ""))
                .collect(Collectors.toList());
        assertEquals(List.of(
                "instance-started",
                "task-started:a", "task-completed:a",
                "task-started:b", "task-completed:b",
                "instance-completed"), seen);
    }

    @Test
    void testDecisionTemplateFromYaml() throws Exception {
        when(mockAgentExecutor.execute(eq("customer-profiler"), any()))
                .thenReturn(CompletableFuture.completedFuture("Ada, 12 years no claims"));
        functions.register("risk-score", input -> 720);
        when(mockCompletionProvider.complete(anyString(), any(CompletionOptions.class)))
                .thenReturn(CompletableFuture.completedFuture(CompletionResult.of("Premium: 310 GBP")));

        WorkflowTemplate template = new YamlTemplateParser().parse(Paths.get(
                getClass().getClassLoader().getResource("templates/quote-flow.yaml").toURI()));
        workflowEngine.register(template);

        WorkflowRunResult result = workflowEngine.start("quote-flow", Map.of("customer", Map.of("id", "c-1")))
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(720, result.getOutput().get("score"));
        assertEquals("Premium: 310 GBP", result.getOutput().get("quote"));
        verify(mockAgentExecutor).execute("customer-profiler", "c-1");
        verify(mockCompletionProvider).complete(eq("Draft a premium quote for Ada, 12 years no claims"),
                any(CompletionOptions.class));
        verify(mockAgentExecutor, never()).execute(eq("underwriter"), any());
    }

    @Test
    void testStatsAndTemplates() throws Exception {
        when(mockAgentExecutor.execute(eq("ok"), any())).thenReturn(CompletableFuture.completedFuture("ok"));
        when(mockAgentExecutor.execute(eq("bad"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bad")));
        workflowEngine.register(template("good", agent("ok").build()));
        workflowEngine.register(template("broken", agent("bad").build()));

        workflowEngine.start("good", Map.of()).get(5, TimeUnit.SECONDS);
        CompletableFuture<WorkflowRunResult> failing = workflowEngine.start("broken", Map.of());
        assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));

        EngineStats stats = workflowEngine.getStats();
        assertEquals(2, stats.getRegisteredTemplates());
        assertEquals(2, stats.getTotalInstances());
        assertEquals(1, stats.getCompleted());
        assertEquals(1, stats.getFailed());
        assertEquals(0, stats.getRunning());
        assertEquals(List.of("broken", "good"),
                workflowEngine.listTemplates().stream().map(WorkflowTemplate::getId).collect(Collectors.toList()));
        assertTrue(workflowEngine.getStatus("unknown").isEmpty());
    }

    @Test
    void testShutdownCancelsRunningInstances() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenAnswer(invocation -> new CompletableFuture<>());
        workflowEngine.register(template("stuck", agent("wait").build()));
        CompletableFuture<WorkflowRunResult> future = workflowEngine.start("stuck", Map.of());

        workflowEngine.shutdown();

        assertTrue(workflowEngine.isShutdown());
        assertEquals(WorkflowStatus.CANCELLED, future.get(5, TimeUnit.SECONDS).getStatus());

        CompletableFuture<WorkflowRunResult> afterShutdown = workflowEngine.start("stuck", Map.of());
        ExecutionException e = assertThrows(ExecutionException.class, () -> afterShutdown.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testConcurrentStartsWithSameInstanceIdAdmitOne() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any())).thenReturn(new CompletableFuture<>());
        workflowEngine.register(template("held", agent("a").build()));
        StartOptions options = StartOptions.builder().instanceId("wf-race").build();
        int contenders = 6;
        ExecutorService callers = Executors.newFixedThreadPool(contenders);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<CompletableFuture<WorkflowRunResult>>> starts = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                starts.add(callers.submit(() -> {
                    gate.await();
                    return workflowEngine.start("held", Map.of(), options);
                }));
            }
            gate.countDown();

            int rejected = 0;
            for (Future<CompletableFuture<WorkflowRunResult>> start : starts) {
                CompletableFuture<WorkflowRunResult> run = start.get(5, TimeUnit.SECONDS);
                if (run.isCompletedExceptionally()) {
                    ExecutionException e = assertThrows(ExecutionException.class, run::get);
                    assertInstanceOf(IllegalArgumentException.class, e.getCause());
                    rejected++;
                }
            }
            assertEquals(contenders - 1, rejected);
            assertEquals(1, instanceStore.size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void testShutdownDoesNotWaitForScheduledRetries() throws Exception {
        when(mockAgentExecutor.execute(anyString(), any()))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(new IllegalStateException("busy")));
        workflowEngine.register(template("slow-retry",
                agent("a").maxRetries(1).retryDelay(Duration.ofSeconds(4)).build()));
        CompletableFuture<WorkflowRunResult> run = workflowEngine.start("slow-retry", Map.of(),
                StartOptions.builder().instanceId("wf-slow").build());
        verify(mockAgentExecutor, timeout(2000)).execute(eq("a"), any());
        await().pollDelay(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .until(() -> instanceStore.find("wf-slow").orElseThrow().isRunning());

        long started = System.nanoTime();
        workflowEngine.shutdown();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMillis < 2000, "shutdown took " + elapsedMillis + " ms");
        assertEquals(WorkflowStatus.CANCELLED, run.get(1, TimeUnit.SECONDS).getStatus());
        verify(mockAgentExecutor, times(1)).execute(eq("a"), any());
    }

    private SimpleWorkflowEngine createEngine(Properties overrides) {
        Properties properties = new Properties();
        properties.setProperty(WeaveConfiguration.TASK_MAX_RETRIES, "0");
        properties.setProperty(WeaveConfiguration.TASK_RETRY_DELAY_MS, "10");
        properties.setProperty(WeaveConfiguration.SWEEPER_ENABLED, "false");
        properties.setProperty(WeaveConfiguration.ENGINE_WORKER_THREADS, "4");
        properties.putAll(overrides);

        return SimpleWorkflowEngine.builder()
                .configuration(new WeaveConfiguration(properties))
                .instanceStore(instanceStore)
                .agentExecutor(mockAgentExecutor)
                .completionProvider(mockCompletionProvider)
                .functionRegistry(functions)
                .listener(events::add)
                .build();
    }

    private static TaskSpec.Builder agent(String id) {
        return TaskSpec.builder().id(id).type(TaskType.AGENT);
    }

    private static WorkflowTemplate template(String id, TaskSpec... tasks) {
        return WorkflowTemplate.builder()
                .id(id)
                .name("Template " + id)
                .tasks(List.of(tasks))
                .build();
    }
}
