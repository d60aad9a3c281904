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

import dev.mars.weave.core.exceptions.WeaveException;

/**
 * Exception thrown when a workflow template is malformed: missing fields, dangling
 * or cyclic dependencies, conflicting outputs, or unreadable YAML.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class InvalidTemplateException extends WeaveException {

    private final String templateId;
    private final String fieldPath;

    public InvalidTemplateException(String message) {
        this(null, null, message, null);
    }

    public InvalidTemplateException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public InvalidTemplateException(String templateId, String fieldPath, String message) {
        this(templateId, fieldPath, message, null);
    }

    public InvalidTemplateException(String templateId, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.templateId = templateId;
        this.fieldPath = fieldPath;
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (templateId != null) {
            sb.append("Template '").append(templateId).append("': ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
