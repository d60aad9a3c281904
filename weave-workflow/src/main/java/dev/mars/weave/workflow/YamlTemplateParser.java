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

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses workflow templates from YAML documents using SnakeYAML's safe constructor.
 *
 * <pre>
 * id: quote-flow
 * name: Quote flow
 * tasks:
 *   - id: profile
 *     type: agent
 *     input: "${customer.id}"
 *     output: profile
 *     retryDelay: 500ms
 * </pre>
 *
 * Problems are reported as {@link InvalidTemplateException}s carrying the path of the offending
 * field, for example {@code tasks[1].trueBranch[0].type}. The parser checks structure only;
 * graph checks happen when the template is registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlTemplateParser {

    private final Yaml yaml;

    public YamlTemplateParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    public WorkflowTemplate parse(Path yamlFile) throws InvalidTemplateException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new InvalidTemplateException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    public WorkflowTemplate parseFromString(String yamlContent) throws InvalidTemplateException {
        Object document;
        try {
            document = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new InvalidTemplateException("YAML parsing failed: " + e.getMessage(), e);
        }

        if (document == null) {
            throw new InvalidTemplateException("Empty or invalid YAML content");
        }
        if (!(document instanceof Map)) {
            throw new InvalidTemplateException("Template document must be a mapping");
        }

        return parseTemplate(asMap(document));
    }

    private WorkflowTemplate parseTemplate(Map<String, Object> data) throws InvalidTemplateException {
        String id = requireString(data, "id", null, "id", "Template id is required");
        String name = requireString(data, "name", id, "name", "Template name is required");
        String description = getStringValue(data, "description");

        Object tasksValue = data.get("tasks");
        if (!(tasksValue instanceof List)) {
            throw new InvalidTemplateException(id, "tasks", "Template must declare a list of tasks");
        }

        List<TaskSpec> tasks = parseTasks(id, (List<?>) tasksValue, "tasks");
        return WorkflowTemplate.builder()
                .id(id)
                .name(name)
                .description(description)
                .tasks(tasks)
                .build();
    }

    private List<TaskSpec> parseTasks(String templateId, List<?> items, String path) throws InvalidTemplateException {
        List<TaskSpec> tasks = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String taskPath = path + "[" + i + "]";
            Object item = items.get(i);
            if (!(item instanceof Map)) {
                throw new InvalidTemplateException(templateId, taskPath, "Task must be a mapping");
            }
            tasks.add(parseTask(templateId, asMap(item), taskPath));
        }
        return tasks;
    }

    private TaskSpec parseTask(String templateId, Map<String, Object> data, String path) throws InvalidTemplateException {
        String id = requireString(data, "id", templateId, path + ".id", "Task id is required");
        String type = requireString(data, "type", templateId, path + ".type", "Task type is required");

        return TaskSpec.builder()
                .id(id)
                .type(type)
                .description(getStringValue(data, "description"))
                .input(data.get("input"))
                .output(getStringValue(data, "output"))
                .dependsOn(parseStringList(data.get("dependsOn")))
                .agent(getStringValue(data, "agent"))
                .function(getStringValue(data, "function"))
                .prompt(getStringValue(data, "prompt"))
                .provider(getStringValue(data, "provider"))
                .model(getStringValue(data, "model"))
                .temperature(getDoubleValue(data, "temperature", templateId, path))
                .maxTokens(getIntValue(data, "maxTokens", templateId, path))
                .condition(getStringValue(data, "condition"))
                .trueBranch(parseBranch(templateId, data.get("trueBranch"), path + ".trueBranch"))
                .falseBranch(parseBranch(templateId, data.get("falseBranch"), path + ".falseBranch"))
                .maxRetries(getIntValue(data, "maxRetries", templateId, path))
                .retryDelay(getDurationValue(data, "retryDelay", templateId, path))
                .timeout(getDurationValue(data, "timeout", templateId, path))
                .parallel(getBooleanValue(data, "parallel", false))
                .build();
    }

    private List<TaskSpec> parseBranch(String templateId, Object value, String path) throws InvalidTemplateException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new InvalidTemplateException(templateId, path, "Branch must be a list of tasks");
        }
        return parseTasks(templateId, (List<?>) value, path);
    }

    /**
     * Parses durations such as {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}; a bare number
     * is taken as seconds.
     */
    static Duration parseDuration(String durationStr) {
        String trimmed = durationStr.trim().toLowerCase(Locale.ROOT);
        if (trimmed.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim()));
        } else if (trimmed.endsWith("s")) {
            return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else if (trimmed.endsWith("m")) {
            return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else if (trimmed.endsWith("h")) {
            return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
    }

    // Utility methods for safe type conversion
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static String requireString(Map<String, Object> data, String key, String templateId,
                                        String fieldPath, String message) throws InvalidTemplateException {
        String value = getStringValue(data, key);
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidTemplateException(templateId, fieldPath, message);
        }
        return value;
    }

    private static String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private static Integer getIntValue(Map<String, Object> data, String key, String templateId, String path)
            throws InvalidTemplateException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidTemplateException(templateId, path + "." + key, "Expected an integer but found '" + value + "'");
        }
    }

    private static Double getDoubleValue(Map<String, Object> data, String key, String templateId, String path)
            throws InvalidTemplateException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidTemplateException(templateId, path + "." + key, "Expected a number but found '" + value + "'");
        }
    }

    private static Duration getDurationValue(Map<String, Object> data, String key, String templateId, String path)
            throws InvalidTemplateException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        try {
            return parseDuration(value.toString());
        } catch (NumberFormatException e) {
            throw new InvalidTemplateException(templateId, path + "." + key, "Invalid duration '" + value + "'");
        }
    }

    private static List<String> parseStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            return List.of(value.toString());
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
