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


package dev.mars.weave.workflow.expression;

import dev.mars.weave.workflow.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates decision conditions to a boolean.
 * Malformed or empty conditions evaluate to {@code false} and are logged; evaluation never throws.
 */
public class ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ConditionParser parser;
    private final VariableResolver variableResolver;

    public ConditionEvaluator() {
        this(new VariableResolver());
    }

    public ConditionEvaluator(VariableResolver variableResolver) {
        this.parser = new ConditionParser();
        this.variableResolver = variableResolver;
    }

    /**
     * Evaluates an expression whose variables have already been substituted.
     */
    public boolean evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            logger.warn("Empty condition evaluates to false");
            return false;
        }
        try {
            boolean outcome = ConditionParser.isTruthy(parser.parse(expression));
            logger.debug("Condition '{}' evaluated to {}", expression, outcome);
            return outcome;
        } catch (ConditionParseException e) {
            logger.warn("Condition could not be evaluated, treating as false: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.warn("Unexpected error evaluating condition '{}', treating as false", expression, e);
            return false;
        }
    }

    /**
     * Substitutes {@code ${...}} references from the context, then evaluates.
     */
    public boolean evaluate(String condition, Map<String, ?> context) {
        return evaluate(variableResolver.resolve(condition, context));
    }
}
