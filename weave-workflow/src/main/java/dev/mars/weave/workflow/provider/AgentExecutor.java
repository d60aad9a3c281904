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


package dev.mars.weave.workflow.provider;

import java.util.concurrent.CompletableFuture;

/**
 * Executes agent tasks. Implementations route to the agent identified by {@code kind}.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * @param kind  the agent kind declared on the task, or the task id when none is declared
     * @param input the resolved task input
     * @return a future completing with the agent's result
     */
    CompletableFuture<Object> execute(String kind, Object input);
}
