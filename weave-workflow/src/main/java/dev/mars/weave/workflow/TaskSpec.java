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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static definition of one task within a workflow template.
 *
 * <p>The declared type is kept as written so that an unrecognised type is reported when the
 * task is dispatched rather than when the template is loaded. Optional per-task settings
 * ({@code maxRetries}, {@code retryDelay}, {@code timeout}, completion options) are {@code null}
 * when the engine-wide configuration applies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskSpec {

    private final String id;
    private final String type;
    private final String description;
    private final Object input;
    private final String output;
    private final List<String> dependsOn;
    private final String agent;
    private final String function;
    private final String prompt;
    private final String provider;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final String condition;
    private final List<TaskSpec> trueBranch;
    private final List<TaskSpec> falseBranch;
    private final Integer maxRetries;
    private final Duration retryDelay;
    private final Duration timeout;
    private final boolean parallel;

    private TaskSpec(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.description = builder.description;
        this.input = builder.input;
        this.output = builder.output;
        this.dependsOn = List.copyOf(new LinkedHashSet<>(builder.dependsOn));
        this.agent = builder.agent;
        this.function = builder.function;
        this.prompt = builder.prompt;
        this.provider = builder.provider;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.condition = builder.condition;
        this.trueBranch = List.copyOf(builder.trueBranch);
        this.falseBranch = List.copyOf(builder.falseBranch);
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.timeout = builder.timeout;
        this.parallel = builder.parallel;
    }

    public String getId() {
        return id;
    }

    /**
     * @return the type exactly as declared in the template
     */
    public String getType() {
        return type;
    }

    public Optional<TaskType> getTaskType() {
        return TaskType.fromValue(type);
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the input template, either a string with {@code ${...}} references or a structured value
     */
    public Object getInput() {
        return input;
    }

    public String getOutput() {
        return output;
    }

    public boolean hasOutput() {
        return output != null && !output.isBlank();
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public String getAgent() {
        return agent;
    }

    public String getFunction() {
        return function;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public String getCondition() {
        return condition;
    }

    public List<TaskSpec> getTrueBranch() {
        return trueBranch;
    }

    public List<TaskSpec> getFalseBranch() {
        return falseBranch;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Informational only. Tasks in the same level always start together regardless of this flag.
     */
    public boolean isParallel() {
        return parallel;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskSpec taskSpec = (TaskSpec) o;
        return parallel == taskSpec.parallel &&
               Objects.equals(id, taskSpec.id) &&
               Objects.equals(type, taskSpec.type) &&
               Objects.equals(input, taskSpec.input) &&
               Objects.equals(output, taskSpec.output) &&
               Objects.equals(dependsOn, taskSpec.dependsOn) &&
               Objects.equals(condition, taskSpec.condition) &&
               Objects.equals(trueBranch, taskSpec.trueBranch) &&
               Objects.equals(falseBranch, taskSpec.falseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, output, dependsOn);
    }

    @Override
    public String toString() {
        return "TaskSpec{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", output='" + output + '\'' +
               ", dependsOn=" + dependsOn +
               '}';
    }

    /**
     * Builder for TaskSpec.
     */
    public static class Builder {
        private String id;
        private String type;
        private String description;
        private Object input;
        private String output;
        private List<String> dependsOn = new ArrayList<>();
        private String agent;
        private String function;
        private String prompt;
        private String provider;
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private String condition;
        private List<TaskSpec> trueBranch = new ArrayList<>();
        private List<TaskSpec> falseBranch = new ArrayList<>();
        private Integer maxRetries;
        private Duration retryDelay;
        private Duration timeout;
        private boolean parallel;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type != null ? type.getValue() : null;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(Object input) {
            this.input = input;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = new ArrayList<>(dependsOn != null ? dependsOn : List.of());
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            return dependsOn(List.of(dependsOn));
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder trueBranch(List<TaskSpec> trueBranch) {
            this.trueBranch = new ArrayList<>(trueBranch != null ? trueBranch : List.of());
            return this;
        }

        public Builder falseBranch(List<TaskSpec> falseBranch) {
            this.falseBranch = new ArrayList<>(falseBranch != null ? falseBranch : List.of());
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(this);
        }
    }
}
