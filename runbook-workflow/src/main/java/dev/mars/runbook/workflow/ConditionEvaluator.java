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

package dev.mars.runbook.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.runbook.core.exceptions.RunbookException;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;

/**
 * Evaluates step conditions.
 *
 * <p>The condition text is placeholder-resolved first and then evaluated as a
 * Spring Expression Language expression. Every context variable is visible as
 * {@code #name}. The evaluation context is read-only and exposes no type
 * references or bean access.</p>
 *
 * <pre>
 *   condition: "#networks"
 *   condition: "#count &gt; 3 and #mode == 'fast'"
 *   condition: "{{enabled}}"
 * </pre>
 */
public class ConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final VariableResolver variableResolver;

    public ConditionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    /**
     * @return whether the step guarded by this condition should run
     * @throws ConditionEvaluationException if the condition cannot be resolved,
     *         parsed or evaluated, or does not produce a boolean
     */
    public boolean evaluate(String condition, ExecutionContext context) throws ConditionEvaluationException {
        String resolved;
        try {
            resolved = variableResolver.resolveText(condition, context);
        } catch (VariableResolver.VariableResolutionException e) {
            throw new ConditionEvaluationException(condition, e.getMessage(), e);
        }

        SimpleEvaluationContext evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        for (Map.Entry<String, JsonNode> entry : context.snapshot().entrySet()) {
            evaluationContext.setVariable(entry.getKey(), toJava(entry.getValue()));
        }

        Object value;
        try {
            value = parser.parseExpression(resolved).getValue(evaluationContext);
        } catch (ParseException | EvaluationException e) {
            throw new ConditionEvaluationException(condition, "Cannot evaluate condition: " + e.getMessage(), e);
        }

        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        throw new ConditionEvaluationException(condition, "Condition did not evaluate to a boolean: " + value);
    }

    private Object toJava(JsonNode node) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    /**
     * Raised when a condition cannot be turned into a boolean.
     */
    public static class ConditionEvaluationException extends RunbookException {

        private final String condition;

        public ConditionEvaluationException(String condition, String message) {
            super(message);
            this.condition = condition;
        }

        public ConditionEvaluationException(String condition, String message, Throwable cause) {
            super(message, cause);
            this.condition = condition;
        }

        public String getCondition() {
            return condition;
        }
    }
}
