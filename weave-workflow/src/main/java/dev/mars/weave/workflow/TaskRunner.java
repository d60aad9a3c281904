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
import dev.mars.weave.workflow.event.WorkflowEvent;
import dev.mars.weave.workflow.event.WorkflowEventPublisher;
import dev.mars.weave.workflow.expression.ConditionEvaluator;
import dev.mars.weave.workflow.observability.WorkflowMetrics;
import dev.mars.weave.workflow.provider.AICompletionProvider;
import dev.mars.weave.workflow.provider.AgentExecutor;
import dev.mars.weave.workflow.provider.CompletionOptions;
import dev.mars.weave.workflow.provider.CustomFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Executes a single task of a workflow instance: resolves its input, dispatches it to the
 * capability provider for its type, retries failed attempts with linear backoff, and records
 * the outcome on the task state and in the instance context.
 *
 * <p>The future returned by {@link #runTask} always completes normally. A task that exhausts
 * its attempts is left in {@link TaskStatus#FAILED} with its failure recorded on the state.
 * Retry delays are timers on the scheduler; no thread waits them out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);

    private final WeaveConfiguration configuration;
    private final AgentExecutor agentExecutor;
    private final AICompletionProvider completionProvider;
    private final CustomFunctionRegistry functionRegistry;
    private final VariableResolver variableResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowEventPublisher eventPublisher;
    private final Executor workerPool;
    private final ScheduledExecutorService scheduler;
    private final WorkflowMetrics metrics;

    private TaskRunner(Builder builder) {
        this.configuration = Objects.requireNonNull(builder.configuration, "Configuration cannot be null");
        this.agentExecutor = builder.agentExecutor;
        this.completionProvider = builder.completionProvider;
        this.functionRegistry = builder.functionRegistry;
        this.variableResolver = builder.variableResolver != null ? builder.variableResolver : new VariableResolver();
        this.conditionEvaluator = builder.conditionEvaluator != null
                ? builder.conditionEvaluator : new ConditionEvaluator(this.variableResolver);
        this.eventPublisher = builder.eventPublisher != null ? builder.eventPublisher : new WorkflowEventPublisher();
        this.workerPool = Objects.requireNonNull(builder.workerPool, "Worker pool cannot be null");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "Scheduler cannot be null");
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a task to a terminal state.
     *
     * @param instance the owning instance, whose context supplies inputs and receives the output
     * @param state    the task's state, updated in place
     * @return a future completing with {@code state} once it is COMPLETED or FAILED
     */
    public CompletableFuture<TaskState> runTask(WorkflowInstance instance, TaskState state) {
        TaskSpec spec = state.getSpec();
        state.markRunning(Instant.now());
        eventPublisher.publish(WorkflowEvent.taskStarted(instance.getId(), spec.getId()));
        if (metrics != null) {
            metrics.recordTaskStarted(spec.getType());
        }

        Object resolvedInput = variableResolver.resolveValue(spec.getInput(), instance.getContext().snapshot());
        state.setResolvedInput(resolvedInput);

        RetryPolicy policy = RetryPolicy.forTask(spec, configuration);
        logger.debug("Starting task {} ({}) of instance {} with {}", spec.getId(), spec.getType(),
                instance.getId(), policy);

        CompletableFuture<TaskState> outcome = new CompletableFuture<>();
        runAttempt(instance, state, resolvedInput, policy, outcome);
        return outcome;
    }

    private void runAttempt(WorkflowInstance instance, TaskState state, Object resolvedInput,
                            RetryPolicy policy, CompletableFuture<TaskState> outcome) {
        TaskSpec spec = state.getSpec();
        int attempt = state.recordAttempt();
        logger.debug("Task {} of instance {}: attempt {}/{}", spec.getId(), instance.getId(),
                attempt, policy.getMaxAttempts());

        CompletableFuture<Object> call;
        try {
            call = CompletableFuture
                    .supplyAsync(() -> dispatch(instance, spec, resolvedInput), workerPool)
                    .thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (policy.hasTimeout()) {
            call = call.orTimeout(policy.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        call.whenComplete((result, error) -> {
            if (error == null) {
                complete(instance, state, result);
                outcome.complete(state);
                return;
            }

            Throwable cause = describeFailure(spec, policy, error);
            state.recordAttemptFailure(cause);

            if (!instance.isRunning()) {
                logger.info("Task {} attempt {} failed after instance {} became {}; not retrying",
                        spec.getId(), attempt, instance.getId(), instance.getStatus());
                fail(instance, state, attempt, cause);
                outcome.complete(state);
                return;
            }

            if (policy.hasAttemptsRemaining(attempt)) {
                Duration delay = policy.delayBeforeRetry(attempt - 1);
                logger.warn("Task {} of instance {} failed on attempt {}/{}: {}. Retrying in {} ms",
                        spec.getId(), instance.getId(), attempt, policy.getMaxAttempts(),
                        cause.getMessage(), delay.toMillis());
                if (metrics != null) {
                    metrics.recordTaskRetry(spec.getType());
                }
                try {
                    scheduler.schedule(() -> runAttempt(instance, state, resolvedInput, policy, outcome),
                            delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    logger.warn("Retry of task {} rejected, scheduler is shut down", spec.getId());
                    fail(instance, state, attempt, cause);
                    outcome.complete(state);
                }
                return;
            }

            fail(instance, state, attempt, cause);
            outcome.complete(state);
        });
    }

    private void complete(WorkflowInstance instance, TaskState state, Object result) {
        TaskSpec spec = state.getSpec();
        state.markCompleted(result, Instant.now());

        if (spec.hasOutput()) {
            if (instance.isRunning()) {
                instance.getContext().put(spec.getOutput(), result);
            } else {
                logger.debug("Instance {} is {}; result of task {} not written to context",
                        instance.getId(), instance.getStatus(), spec.getId());
            }
        }

        logger.debug("Task {} of instance {} completed after {} attempt(s)", spec.getId(),
                instance.getId(), state.getAttempts());
        eventPublisher.publish(WorkflowEvent.taskCompleted(instance.getId(), spec.getId()));
    }

    private void fail(WorkflowInstance instance, TaskState state, int attempts, Throwable cause) {
        TaskSpec spec = state.getSpec();
        TaskExecutionException failure = new TaskExecutionException(spec.getId(), attempts,
                "Task '" + spec.getId() + "' failed after " + attempts + " attempt(s): " + cause.getMessage(),
                cause);
        state.markFailed(failure, Instant.now());

        logger.warn("Task {} of instance {} failed: {}", spec.getId(), instance.getId(), cause.getMessage());
        if (metrics != null) {
            metrics.recordTaskFailed(spec.getType());
        }
        eventPublisher.publish(WorkflowEvent.taskFailed(instance.getId(), spec.getId(), failure.getMessage()));
    }

    /**
     * Dispatches one attempt of a task to its capability provider. Never throws; problems are
     * returned as a failed future.
     */
    CompletableFuture<Object> dispatch(WorkflowInstance instance, TaskSpec spec, Object resolvedInput) {
        Optional<TaskType> type = spec.getTaskType();
        if (type.isEmpty()) {
            return CompletableFuture.failedFuture(new UnknownTaskTypeException(spec.getId(), spec.getType()));
        }

        try {
            switch (type.get()) {
                case AGENT:
                    return executeAgent(spec, resolvedInput);
                case AI_COMPLETION:
                    return executeCompletion(instance, spec, resolvedInput);
                case CUSTOM:
                    return executeCustom(spec, resolvedInput);
                case DECISION:
                    return executeDecision(instance, spec);
                default:
                    return CompletableFuture.failedFuture(new UnknownTaskTypeException(spec.getId(), spec.getType()));
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Object> executeAgent(TaskSpec spec, Object resolvedInput) {
        if (agentExecutor == null) {
            return missingProvider(spec, "AgentExecutor");
        }
        String kind = spec.getAgent() != null && !spec.getAgent().isBlank() ? spec.getAgent() : spec.getId();
        return nonNull(agentExecutor.execute(kind, resolvedInput), spec, "AgentExecutor");
    }

    private CompletableFuture<Object> executeCompletion(WorkflowInstance instance, TaskSpec spec,
                                                        Object resolvedInput) {
        if (completionProvider == null) {
            return missingProvider(spec, "AICompletionProvider");
        }

        String prompt;
        if (spec.getPrompt() != null) {
            prompt = variableResolver.resolve(spec.getPrompt(), instance.getContext().snapshot());
        } else {
            prompt = resolvedInput != null ? resolvedInput.toString() : "";
        }

        CompletionOptions options = CompletionOptions.builder()
                .provider(spec.getProvider())
                .model(spec.getModel())
                .temperature(spec.getTemperature() != null ? spec.getTemperature() : configuration.getDefaultTemperature())
                .maxTokens(spec.getMaxTokens() != null ? spec.getMaxTokens() : configuration.getDefaultMaxTokens())
                .build();

        return nonNull(completionProvider.complete(prompt, options), spec, "AICompletionProvider")
                .thenCompose(completion -> {
                    if (completion == null) {
                        return CompletableFuture.<Object>failedFuture(new TaskExecutionException(spec.getId(),
                                "AICompletionProvider returned no completion"));
                    }
                    return CompletableFuture.<Object>completedFuture(completion.getText());
                });
    }

    private CompletableFuture<Object> executeCustom(TaskSpec spec, Object resolvedInput) {
        if (functionRegistry == null) {
            return missingProvider(spec, "CustomFunctionRegistry");
        }
        if (spec.getFunction() == null || spec.getFunction().isBlank()) {
            return CompletableFuture.failedFuture(new TaskExecutionException(spec.getId(),
                    "Custom task '" + spec.getId() + "' does not name a function"));
        }
        return nonNull(functionRegistry.invoke(spec.getFunction(), resolvedInput), spec, "CustomFunctionRegistry");
    }

    /**
     * Evaluates the condition, then runs the chosen branch one task at a time. Each branch task
     * sees the outputs written by the branch tasks before it.
     */
    private CompletableFuture<Object> executeDecision(WorkflowInstance instance, TaskSpec spec) {
        String condition = variableResolver.resolve(spec.getCondition(), instance.getContext().snapshot());
        boolean outcome = conditionEvaluator.evaluate(condition);
        List<TaskSpec> branch = outcome ? spec.getTrueBranch() : spec.getFalseBranch();

        logger.info("Decision {} of instance {} evaluated '{}' to {}, running {} branch task(s)",
                spec.getId(), instance.getId(), condition, outcome, branch.size());

        CompletableFuture<Object> chain = CompletableFuture.completedFuture(null);
        for (TaskSpec branchTask : branch) {
            chain = chain.thenComposeAsync(previous -> runBranchTask(instance, branchTask), workerPool);
        }

        return chain.<Object>thenApply(ignored -> {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("branch", String.valueOf(outcome));
            result.put("condition", outcome);
            return result;
        });
    }

    private CompletableFuture<Object> runBranchTask(WorkflowInstance instance, TaskSpec task) {
        Object input = variableResolver.resolveValue(task.getInput(), instance.getContext().snapshot());
        return dispatch(instance, task, input).thenApply(result -> {
            if (task.hasOutput() && instance.isRunning()) {
                instance.getContext().put(task.getOutput(), result);
            }
            return result;
        });
    }

    private CompletableFuture<Object> missingProvider(TaskSpec spec, String provider) {
        return CompletableFuture.failedFuture(new TaskExecutionException(spec.getId(),
                "No " + provider + " configured for " + spec.getType() + " task '" + spec.getId() + "'"));
    }

    private static <T> CompletableFuture<T> nonNull(CompletableFuture<T> future, TaskSpec spec, String provider) {
        if (future == null) {
            return CompletableFuture.failedFuture(new TaskExecutionException(spec.getId(),
                    provider + " returned no result future"));
        }
        return future;
    }

    private static Throwable describeFailure(TaskSpec spec, RetryPolicy policy, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new TaskExecutionException(spec.getId(),
                    "Attempt timed out after " + policy.getTimeout().toMillis() + " ms", cause);
        }
        if (cause.getMessage() == null) {
            return new TaskExecutionException(spec.getId(), cause.getClass().getSimpleName(), cause);
        }
        return cause;
    }

    /**
     * Builder for TaskRunner.
     */
    public static class Builder {
        private WeaveConfiguration configuration;
        private AgentExecutor agentExecutor;
        private AICompletionProvider completionProvider;
        private CustomFunctionRegistry functionRegistry;
        private VariableResolver variableResolver;
        private ConditionEvaluator conditionEvaluator;
        private WorkflowEventPublisher eventPublisher;
        private Executor workerPool;
        private ScheduledExecutorService scheduler;
        private WorkflowMetrics metrics;

        public Builder configuration(WeaveConfiguration configuration) {
            this.configuration = configuration;
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

        public Builder variableResolver(VariableResolver variableResolver) {
            this.variableResolver = variableResolver;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        public Builder eventPublisher(WorkflowEventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public Builder workerPool(Executor workerPool) {
            this.workerPool = workerPool;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * @param metrics metrics sink, or null to record nothing
         */
        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public TaskRunner build() {
            return new TaskRunner(this);
        }
    }
}
