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
import dev.mars.weave.workflow.event.WorkflowEventListener;
import dev.mars.weave.workflow.event.WorkflowEventPublisher;
import dev.mars.weave.workflow.observability.WorkflowMetrics;
import dev.mars.weave.workflow.provider.AICompletionProvider;
import dev.mars.weave.workflow.provider.AgentExecutor;
import dev.mars.weave.workflow.provider.CustomFunctionRegistry;
import dev.mars.weave.workflow.store.InMemoryInstanceStore;
import dev.mars.weave.workflow.store.InMemoryTemplateRegistry;
import dev.mars.weave.workflow.store.InstanceStore;
import dev.mars.weave.workflow.store.TemplateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-process implementation of WorkflowEngine.
 *
 * <p>Each instance runs its template's execution levels in order. All tasks of a level start
 * together and the next level starts only after every one of them has finished. The first level
 * with a failed task fails the instance and no later level runs. A checkpoint is taken after each
 * successful level when checkpointing is enabled, and the configured maximum duration is enforced
 * between and during levels.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    private final WeaveConfiguration configuration;
    private final TemplateRegistry templateRegistry;
    private final InstanceStore instanceStore;
    private final WorkflowEventPublisher eventPublisher;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService scheduler;
    private final TaskRunner taskRunner;
    private final InstanceSweeper sweeper;
    private final WorkflowMetrics metrics;
    private final Map<String, CompletableFuture<WorkflowRunResult>> pendingResults;
    private volatile boolean shutdown = false;

    private SimpleWorkflowEngine(Builder builder) {
        this.configuration = builder.configuration != null ? builder.configuration : new WeaveConfiguration();
        this.templateRegistry = builder.templateRegistry != null ? builder.templateRegistry : new InMemoryTemplateRegistry();
        this.instanceStore = builder.instanceStore != null ? builder.instanceStore : new InMemoryInstanceStore();
        this.eventPublisher = new WorkflowEventPublisher();
        builder.listeners.forEach(eventPublisher::addListener);
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, configuration.getWorkerThreads()),
                daemonThreadFactory("weave-worker"));
        this.scheduler = createScheduler();
        this.pendingResults = new ConcurrentHashMap<>();

        this.taskRunner = TaskRunner.builder()
                .configuration(configuration)
                .agentExecutor(builder.agentExecutor)
                .completionProvider(builder.completionProvider)
                .functionRegistry(builder.functionRegistry)
                .eventPublisher(eventPublisher)
                .workerPool(workerPool)
                .scheduler(scheduler)
                .metrics(metrics)
                .build();

        this.sweeper = new InstanceSweeper(instanceStore, configuration.getRetention(),
                configuration.isSweepCancelled(), metrics);
        if (configuration.isSweeperEnabled()) {
            sweeper.start(scheduler, configuration.getSweepInterval());
        }

        logger.info("SimpleWorkflowEngine initialized: {}", configuration);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String register(WorkflowTemplate template) throws InvalidTemplateException {
        return templateRegistry.register(template);
    }

    @Override
    public CompletableFuture<WorkflowRunResult> start(String templateId, Map<String, ?> input, StartOptions options)
            throws TemplateNotFoundException {
        if (shutdown) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Workflow engine is shutdown"));
        }

        WorkflowTemplate template = templateRegistry.lookup(templateId);
        StartOptions startOptions = options != null ? options : StartOptions.defaults();

        List<List<String>> levels;
        try {
            levels = DependencyGraph.of(template.getTasks()).computeLevels();
        } catch (InvalidTemplateException e) {
            return CompletableFuture.failedFuture(e);
        }

        String instanceId = startOptions.getInstanceId() != null
                ? startOptions.getInstanceId() : UUID.randomUUID().toString();
        WorkflowInstance instance = new WorkflowInstance(instanceId, template, input,
                startOptions.getUserId(), startOptions.getWorkspace(),
                configuration.getMaxCheckpoints(), Instant.now());
        if (!instanceStore.saveIfAbsent(instance)) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Workflow instance already exists: " + instanceId));
        }
        CompletableFuture<WorkflowRunResult> result = new CompletableFuture<>();
        pendingResults.put(instanceId, result);

        Instant deadline = instance.getStartTime().plus(configuration.getMaxWorkflowDuration());
        logger.info("Starting workflow instance {} of template {}: {} task(s) in {} level(s)",
                instanceId, templateId, template.getTasks().size(), levels.size());
        if (metrics != null) {
            metrics.recordWorkflowStarted(templateId);
        }
        eventPublisher.publish(WorkflowEvent.instanceStarted(instanceId));

        executeLevel(instance, levels, 0, deadline);
        return result;
    }

    @Override
    public boolean cancel(String workflowId) throws WorkflowNotFoundException, InvalidStateTransitionException {
        WorkflowInstance instance = instanceStore.find(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));

        instance.transitionOrThrow(WorkflowStatus.CANCELLED, Instant.now());

        logger.info("Cancelled workflow instance {}", workflowId);
        if (metrics != null) {
            metrics.recordWorkflowCancelled(instance.getTemplateId());
        }
        eventPublisher.publish(WorkflowEvent.instanceCancelled(workflowId));

        CompletableFuture<WorkflowRunResult> result = pendingResults.remove(workflowId);
        if (result != null) {
            result.complete(WorkflowRunResult.of(instance));
        }
        return true;
    }

    @Override
    public Optional<WorkflowStatusReport> getStatus(String workflowId) {
        return instanceStore.find(workflowId).map(WorkflowStatusReport::from);
    }

    @Override
    public List<WorkflowTemplate> listTemplates() {
        return templateRegistry.list();
    }

    @Override
    public EngineStats getStats() {
        List<WorkflowInstance> instances = instanceStore.list();
        Map<WorkflowStatus, Long> byStatus = instances.stream()
                .collect(Collectors.groupingBy(WorkflowInstance::getStatus, Collectors.counting()));
        return new EngineStats(
                templateRegistry.size(),
                instances.size(),
                byStatus.getOrDefault(WorkflowStatus.RUNNING, 0L).intValue(),
                byStatus.getOrDefault(WorkflowStatus.COMPLETED, 0L).intValue(),
                byStatus.getOrDefault(WorkflowStatus.FAILED, 0L).intValue(),
                byStatus.getOrDefault(WorkflowStatus.CANCELLED, 0L).intValue());
    }

    @Override
    public void addListener(WorkflowEventListener listener) {
        eventPublisher.addListener(listener);
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("SimpleWorkflowEngine shutdown initiated");

        for (WorkflowInstance instance : instanceStore.list()) {
            if (instance.isRunning()) {
                try {
                    cancel(instance.getId());
                } catch (WorkflowNotFoundException | InvalidStateTransitionException e) {
                    logger.debug("Instance {} finished before shutdown could cancel it: {}",
                            instance.getId(), e.getMessage());
                }
            }
        }

        sweeper.stop();
        terminate(scheduler);
        terminate(workerPool);
        logger.info("SimpleWorkflowEngine shutdown complete");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    InstanceSweeper getSweeper() {
        return sweeper;
    }

    private void executeLevel(WorkflowInstance instance, List<List<String>> levels, int index, Instant deadline) {
        if (!instance.isRunning()) {
            return;
        }
        if (index >= levels.size()) {
            completeInstance(instance);
            return;
        }

        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
            failInstance(instance, deadlineExceeded(instance));
            return;
        }

        List<String> level = levels.get(index);
        logger.debug("Instance {}: starting level {} with tasks {}", instance.getId(), index, level);

        try {
            List<CompletableFuture<TaskState>> running = new ArrayList<>();
            for (String taskId : level) {
                running.add(taskRunner.runTask(instance, instance.getTaskState(taskId)));
            }

            CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                    .orTimeout(remaining.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            failInstance(instance, deadlineExceeded(instance));
                        } else {
                            onLevelFinished(instance, levels, index, deadline);
                        }
                    });
        } catch (RuntimeException e) {
            logger.error("Unexpected error scheduling level {} of instance {}", index, instance.getId(), e);
            failInstance(instance, new WorkflowExecutionException(instance.getId(),
                    "Unexpected error running level " + index + ": " + e.getMessage(), e));
        }
    }

    private void onLevelFinished(WorkflowInstance instance, List<List<String>> levels, int index, Instant deadline) {
        if (!instance.isRunning()) {
            logger.debug("Instance {} is {}; not continuing after level {}", instance.getId(),
                    instance.getStatus(), index);
            return;
        }

        List<TaskState> failed = levels.get(index).stream()
                .map(instance::getTaskState)
                .filter(state -> state.getStatus() == TaskStatus.FAILED)
                .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            List<String> siblingErrors = failed.subList(1, failed.size()).stream()
                    .map(TaskState::getError)
                    .collect(Collectors.toList());
            failInstance(instance, failed.get(0).getFailure(), siblingErrors);
            return;
        }

        if (configuration.isCheckpointingEnabled()) {
            instance.addCheckpoint(new Checkpoint(Instant.now(),
                    instance.getContext().deepSnapshot(), instance.getCompletedTaskIds()));
            logger.debug("Instance {}: checkpoint after level {}", instance.getId(), index);
        }

        executeLevel(instance, levels, index + 1, deadline);
    }

    private void completeInstance(WorkflowInstance instance) {
        if (!instance.transitionTo(WorkflowStatus.COMPLETED, Instant.now())) {
            return;
        }
        Duration duration = instance.getDuration();
        logger.info("Workflow instance {} completed in {} ms", instance.getId(), duration.toMillis());
        if (metrics != null) {
            metrics.recordWorkflowCompleted(instance.getTemplateId(), duration.toMillis() / 1000.0);
        }
        eventPublisher.publish(WorkflowEvent.instanceCompleted(instance.getId()));

        CompletableFuture<WorkflowRunResult> result = pendingResults.remove(instance.getId());
        if (result != null) {
            result.complete(WorkflowRunResult.of(instance));
        }
    }

    private void failInstance(WorkflowInstance instance, Throwable cause) {
        failInstance(instance, cause, List.of());
    }

    private void failInstance(WorkflowInstance instance, Throwable cause, List<String> siblingErrors) {
        Instant now = Instant.now();
        if (!instance.transitionTo(WorkflowStatus.FAILED, now)) {
            return;
        }
        Throwable failure = cause != null ? cause
                : new WorkflowExecutionException(instance.getId(), "Workflow failed without a recorded cause");
        instance.recordError(failure.getMessage(), now);
        // other tasks of the same level that failed
        siblingErrors.forEach(error -> instance.recordError(error, now));

        logger.error("Workflow instance {} failed: {}", instance.getId(), failure.getMessage());
        if (metrics != null) {
            metrics.recordWorkflowFailed(instance.getTemplateId(), failure.getClass().getSimpleName(),
                    instance.getDuration().toMillis() / 1000.0);
        }
        eventPublisher.publish(WorkflowEvent.instanceFailed(instance.getId(), failure.getMessage()));

        CompletableFuture<WorkflowRunResult> result = pendingResults.remove(instance.getId());
        if (result != null) {
            result.completeExceptionally(failure);
        }
    }

    private WorkflowExecutionException deadlineExceeded(WorkflowInstance instance) {
        return new WorkflowExecutionException(instance.getId(),
                "Workflow exceeded maximum duration of " + configuration.getMaxWorkflowDuration().toMillis() + " ms");
    }

    // Retries still waiting on the scheduler belong to instances already cancelled by shutdown()
    private static ScheduledExecutorService createScheduler() {
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(2, daemonThreadFactory("weave-scheduler"));
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private static void terminate(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for SimpleWorkflowEngine. Every collaborator is optional; capability providers that
     * are left unset make tasks of the matching type fail.
     */
    public static class Builder {
        private WeaveConfiguration configuration;
        private TemplateRegistry templateRegistry;
        private InstanceStore instanceStore;
        private AgentExecutor agentExecutor;
        private AICompletionProvider completionProvider;
        private CustomFunctionRegistry functionRegistry;
        private final List<WorkflowEventListener> listeners = new ArrayList<>();

        public Builder configuration(WeaveConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder templateRegistry(TemplateRegistry templateRegistry) {
            this.templateRegistry = templateRegistry;
            return this;
        }

        public Builder instanceStore(InstanceStore instanceStore) {
            this.instanceStore = instanceStore;
            return this;
        }

        public Builder agentExecutor(AgentExecutor agentExecutor) {
            this.agentExecutor = agentExecutor;
            return this;
        }

        public Builder completionProvider(AICompletionProvider completionProvider) {
            this.completionProvider = completionProvider;
            return this;
        }

        public Builder functionRegistry(CustomFunctionRegistry functionRegistry) {
            this.functionRegistry = functionRegistry;
            return this;
        }

        public Builder listener(WorkflowEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public SimpleWorkflowEngine build() {
            return new SimpleWorkflowEngine(this);
        }
    }
}
