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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variable references in task inputs, prompts and conditions.
 * Supports references in the format {@code ${path.to.value}}, traversing nested maps by key
 * and lists by index. A reference that cannot be resolved is left in place unchanged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\{([^}]+)\\}");

    private final ObjectMapper objectMapper;

    public VariableResolver() {
        this(new ObjectMapper());
    }

    public VariableResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Resolves a task input. Strings are interpolated; any other value is returned as is.
     */
    public Object resolveValue(Object template, Map<String, ?> context) {
        if (template instanceof String) {
            return resolve((String) template, context);
        }
        return template;
    }

    /**
     * Resolves variables in a string template.
     *
     * @param template the template string containing variable references
     * @param context  the values references are looked up in
     * @return the resolved string, with unresolvable references kept verbatim
     */
    public String resolve(String template, Map<String, ?> context) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String path = matcher.group(1).trim();
            Optional<Object> value = lookup(path, context);
            String replacement = value.map(this::stringify).orElse(matcher.group(0));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Looks up a dot-separated path. Empty if any segment is missing or null.
     */
    public Optional<Object> lookup(String path, Map<String, ?> context) {
        if (path == null || path.isBlank() || context == null) {
            return Optional.empty();
        }

        Object current = context;
        for (String segment : path.split("\\.", -1)) {
            current = step(current, segment.trim());
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Checks if a template contains any variable references.
     */
    public boolean hasVariables(String template) {
        if (template == null) {
            return false;
        }
        return VARIABLE_PATTERN.matcher(template).find();
    }

    /**
     * Gets all variable paths referenced in a template, in order of first appearance.
     */
    public Set<String> getVariableNames(String template) {
        if (template == null) {
            return Set.of();
        }

        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            variables.add(matcher.group(1).trim());
        }
        return variables;
    }

    private Object step(Object current, String segment) {
        if (segment.isEmpty()) {
            return null;
        }
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(segment);
        }
        if (current instanceof List) {
            List<?> list = (List<?>) current;
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // Maps and collections are rendered as JSON, everything else via toString
    private String stringify(Object value) {
        if (value instanceof Map || value instanceof Collection) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
