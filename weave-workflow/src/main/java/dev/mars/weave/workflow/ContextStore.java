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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Instance-scoped key/value store that carries the workflow input and task outputs.
 * All access is synchronized; readers that traverse values should work on a {@link #snapshot()}.
 */
public class ContextStore {

    private static final Logger logger = LoggerFactory.getLogger(ContextStore.class);

    private static final ObjectMapper SNAPSHOT_MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Object> values = Collections.synchronizedMap(new LinkedHashMap<>());

    public ContextStore() {
    }

    /**
     * Creates a store holding a shallow copy of the given values.
     */
    public ContextStore(Map<String, ?> initial) {
        if (initial != null) {
            values.putAll(initial);
        }
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<Object> find(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public void putAll(Map<String, ?> entries) {
        if (entries != null) {
            values.putAll(entries);
        }
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    public int size() {
        return values.size();
    }

    public Set<String> keys() {
        synchronized (values) {
            return Set.copyOf(values.keySet());
        }
    }

    /**
     * Shallow copy of the current entries. Nested values are shared with the store.
     */
    public Map<String, Object> snapshot() {
        synchronized (values) {
            return new LinkedHashMap<>(values);
        }
    }

    /**
     * Deep copy of the current entries, detached from later mutation of nested maps and lists.
     * Values are converted to plain maps, lists and scalars. If a value cannot be converted the
     * shallow copy is returned instead.
     */
    public Map<String, Object> deepSnapshot() {
        Map<String, Object> shallow = snapshot();
        try {
            return SNAPSHOT_MAPPER.convertValue(shallow, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            logger.debug("Context is not convertible for a deep snapshot, keeping a shallow copy: {}",
                    e.getMessage());
            return shallow;
        }
    }

    @Override
    public String toString() {
        return "ContextStore{keys=" + keys() + '}';
    }
}
