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


package dev.mars.weave.workflow.store;

import dev.mars.weave.workflow.InvalidTemplateException;
import dev.mars.weave.workflow.TemplateNotFoundException;
import dev.mars.weave.workflow.WorkflowTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of registered workflow templates.
 */
public interface TemplateRegistry {

    /**
     * Validates and stores a template, replacing any template with the same id.
     *
     * @return the template id
     * @throws InvalidTemplateException if the template is malformed
     */
    String register(WorkflowTemplate template) throws InvalidTemplateException;

    /**
     * @throws TemplateNotFoundException if no template has the given id
     */
    WorkflowTemplate lookup(String templateId) throws TemplateNotFoundException;

    Optional<WorkflowTemplate> find(String templateId);

    /**
     * @return all templates ordered by id
     */
    List<WorkflowTemplate> list();

    boolean delete(String templateId);

    int size();
}
