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

import dev.mars.weave.workflow.WorkflowInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instance store backed by a concurrent map.
 */
public class InMemoryInstanceStore implements InstanceStore {

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowInstance instance) {
        instances.put(instance.getId(), instance);
    }

    @Override
    public boolean saveIfAbsent(WorkflowInstance instance) {
        return instances.putIfAbsent(instance.getId(), instance) == null;
    }

    @Override
    public Optional<WorkflowInstance> find(String instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<WorkflowInstance> list() {
        return new ArrayList<>(instances.values());
    }

    @Override
    public boolean delete(String instanceId) {
        return instanceId != null && instances.remove(instanceId) != null;
    }

    @Override
    public int size() {
        return instances.size();
    }
}
