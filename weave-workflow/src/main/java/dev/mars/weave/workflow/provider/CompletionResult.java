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

/**
 * Text returned by an {@link AICompletionProvider}.
 */
public class CompletionResult {

    private final String text;
    private final String model;

    public CompletionResult(String text, String model) {
        this.text = text;
        this.model = model;
    }

    public static CompletionResult of(String text) {
        return new CompletionResult(text, null);
    }

    public String getText() {
        return text;
    }

    /**
     * @return the model that produced the text, when the provider reports it
     */
    public String getModel() {
        return model;
    }

    @Override
    public String toString() {
        return "CompletionResult{model='" + model + "', length=" + (text != null ? text.length() : 0) + '}';
    }
}
