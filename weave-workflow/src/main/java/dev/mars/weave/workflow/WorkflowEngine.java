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

import dev.mars.weave.core.exceptions.InvalidStateTransitionException;
import dev.mars.weave.workflow.event.WorkflowEventListener;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Core interface for workflow execution engines.
 * Templates are registered once and started any number of times; each start creates a
 * workflow instance that runs its tasks level by level.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface WorkflowEngine {

    /**
     * Validates and registers a template, replacing any template with the same id.
     *
     * @return the template id
     * @throws InvalidTemplateException if the template is malformed
     */
    String register(WorkflowTemplate template) throws InvalidTemplateException;

    /**
     * Starts an instance with default options.
     *
     * @see #start(String, Map, StartOptions)
     */
    default CompletableFuture<WorkflowRunResult> start(String templateId, Map<String, ?> input)
            throws TemplateNotFoundException {
        return start(templateId, input, StartOptions.defaults());
    }

    /**
     * Starts a new instance of a registered template. The input becomes the initial context.
     *
     * @return a future completing with the run result when the instance completes or is cancelled,
     *         or completing exceptionally with the failing task's {@link TaskExecutionException}
     *         (or a {@link WorkflowExecutionException}) when it fails
     * @throws TemplateNotFoundException if the template is not registered
     */
    CompletableFuture<WorkflowRunResult> start(String templateId, Map<String, ?> input, StartOptions options)
            throws TemplateNotFoundException;

    /**
     * Cancels a running instance. Tasks already in flight run to completion but their results
     * are discarded.
     *
     * @return true once the instance is cancelled
     * @throws WorkflowNotFoundException       if the instance is unknown
     * @throws InvalidStateTransitionException if the instance has already finished
     */
    boolean cancel(String workflowId) throws WorkflowNotFoundException, InvalidStateTransitionException;

    Optional<WorkflowStatusReport> getStatus(String workflowId);

    List<WorkflowTemplate> listTemplates();

    EngineStats getStats();

    void addListener(WorkflowEventListener listener);

    /**
     * Cancels all running instances and releases the engine's threads.
     */
    void shutdown();
}
