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

import java.util.List;
import java.util.Optional;

/**
 * Holds workflow instances from start until they are swept.
 */
public interface InstanceStore {

    void save(WorkflowInstance instance);

    /**
     * Stores the instance unless one with the same id is already held.
     *
     * @return true if the instance was stored
     */
    boolean saveIfAbsent(WorkflowInstance instance);

    Optional<WorkflowInstance> find(String instanceId);

    List<WorkflowInstance> list();

    boolean delete(String instanceId);

    int size();
}
