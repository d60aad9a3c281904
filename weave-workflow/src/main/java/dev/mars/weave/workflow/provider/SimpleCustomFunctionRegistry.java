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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory name to function registry. Functions run on the calling thread, which for the
 * engine is a worker pool thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class SimpleCustomFunctionRegistry implements CustomFunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SimpleCustomFunctionRegistry.class);

    private final Map<String, CustomFunction> functions = new ConcurrentHashMap<>();

    public SimpleCustomFunctionRegistry register(String name, CustomFunction function) {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(function, "Function cannot be null");
        CustomFunction previous = functions.put(name, function);
        if (previous != null) {
            logger.info("Replaced custom function: {}", name);
        } else {
            logger.debug("Registered custom function: {}", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return functions.remove(name) != null;
    }

    @Override
    public boolean contains(String name) {
        return name != null && functions.containsKey(name);
    }

    public Set<String> getFunctionNames() {
        return new TreeSet<>(functions.keySet());
    }

    @Override
    public CompletableFuture<Object> invoke(String name, Object input) {
        CustomFunction function = name != null ? functions.get(name) : null;
        if (function == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Unknown custom function: " + name));
        }
        try {
            return CompletableFuture.completedFuture(function.apply(input));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
