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
import dev.mars.weave.workflow.TemplateValidator;
import dev.mars.weave.workflow.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Template registry backed by a concurrent map. Templates are validated on registration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class InMemoryTemplateRegistry implements TemplateRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTemplateRegistry.class);

    private final Map<String, WorkflowTemplate> templates = new ConcurrentHashMap<>();
    private final TemplateValidator validator;

    public InMemoryTemplateRegistry() {
        this(new TemplateValidator());
    }

    public InMemoryTemplateRegistry(TemplateValidator validator) {
        this.validator = validator;
    }

    @Override
    public String register(WorkflowTemplate template) throws InvalidTemplateException {
        validator.validateOrThrow(template);

        WorkflowTemplate previous = templates.put(template.getId(), template);
        if (previous != null) {
            logger.info("Replaced workflow template: {} ({} tasks)", template.getId(), template.getTasks().size());
        } else {
            logger.info("Registered workflow template: {} ({} tasks)", template.getId(), template.getTasks().size());
        }
        return template.getId();
    }

    @Override
    public WorkflowTemplate lookup(String templateId) throws TemplateNotFoundException {
        return find(templateId).orElseThrow(() -> new TemplateNotFoundException(templateId));
    }

    @Override
    public Optional<WorkflowTemplate> find(String templateId) {
        if (templateId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(templateId));
    }

    @Override
    public List<WorkflowTemplate> list() {
        return templates.values().stream()
                .sorted(Comparator.comparing(WorkflowTemplate::getId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String templateId) {
        if (templateId == null) {
            return false;
        }
        boolean removed = templates.remove(templateId) != null;
        if (removed) {
            logger.info("Deleted workflow template: {}", templateId);
        }
        return removed;
    }

    @Override
    public int size() {
        return templates.size();
    }
}
