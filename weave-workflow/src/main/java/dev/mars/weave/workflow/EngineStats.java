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

/**
 * Point-in-time counters for an engine.
 */
public class EngineStats {

    private final int registeredTemplates;
    private final int totalInstances;
    private final int running;
    private final int completed;
    private final int failed;
    private final int cancelled;

    public EngineStats(int registeredTemplates, int totalInstances, int running,
                       int completed, int failed, int cancelled) {
        this.registeredTemplates = registeredTemplates;
        this.totalInstances = totalInstances;
        this.running = running;
        this.completed = completed;
        this.failed = failed;
        this.cancelled = cancelled;
    }

    public int getRegisteredTemplates() {
        return registeredTemplates;
    }

    public int getTotalInstances() {
        return totalInstances;
    }

    public int getRunning() {
        return running;
    }

    public int getCompleted() {
        return completed;
    }

    public int getFailed() {
        return failed;
    }

    public int getCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "EngineStats{" +
               "templates=" + registeredTemplates +
               ", instances=" + totalInstances +
               ", running=" + running +
               ", completed=" + completed +
               ", failed=" + failed +
               ", cancelled=" + cancelled +
               '}';
    }
}
