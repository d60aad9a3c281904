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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time snapshot of an instance's context and the tasks completed at that moment.
 */
public class Checkpoint {

    private final Instant timestamp;
    private final Map<String, Object> context;
    private final List<String> completedTaskIds;

    public Checkpoint(Instant timestamp, Map<String, Object> context, List<String> completedTaskIds) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context != null ? context : Map.of()));
        this.completedTaskIds = List.copyOf(completedTaskIds != null ? completedTaskIds : List.of());
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public List<String> getCompletedTaskIds() {
        return completedTaskIds;
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
               "timestamp=" + timestamp +
               ", completedTaskIds=" + completedTaskIds +
               '}';
    }
}
