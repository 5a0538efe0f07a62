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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves placeholders in step fields using template substitution.
 * Supports placeholder references in the format {{variableName}}, where the
 * name consists of letters, digits and underscores.
 *
 * <p>Only strings, numbers and booleans can be substituted into text. Any
 * other value kind, or a name with no binding, raises
 * {@link VariableResolutionException}.</p>
 */
public class VariableResolver {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)\\}\\}");

    /**
     * Resolves placeholders in a text template.
     *
     * @param template the template string containing placeholder references
     * @param context  the bindings to substitute from
     * @return the resolved string, or null if the template is null
     * @throws VariableResolutionException if a placeholder cannot be resolved
     */
    public String resolveText(String template, ExecutionContext context) {
        if (template == null) {
            return null;
        }
        Objects.requireNonNull(context, "Execution context cannot be null");

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        if (!matcher.find()) {
            return template;
        }
        matcher.reset();

        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = render(name, context.get(name).orElse(null));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves every string leaf of a structured value. Containers keep their
     * shape and non-string leaves are copied as they are. The input is not
     * modified.
     *
     * @throws VariableResolutionException if any string leaf fails to resolve
     */
    public JsonNode resolveStructured(JsonNode value, ExecutionContext context) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return TextNode.valueOf(resolveText(value.textValue(), context));
        }
        if (value.isArray()) {
            ArrayNode resolved = JsonNodeFactory.instance.arrayNode(value.size());
            for (JsonNode element : value) {
                resolved.add(resolveStructured(element, context));
            }
            return resolved;
        }
        if (value.isObject()) {
            ObjectNode resolved = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                resolved.set(field.getKey(), resolveStructured(field.getValue(), context));
            }
            return resolved;
        }
        return value.deepCopy();
    }

    /**
     * Checks if a template contains any placeholder references.
     */
    public static boolean hasPlaceholders(String template) {
        if (template == null) {
            return false;
        }
        return PLACEHOLDER_PATTERN.matcher(template).find();
    }

    /**
     * Gets all placeholder names referenced in a template, in order of first appearance.
     */
    public static Set<String> placeholderNames(String template) {
        if (template == null) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static String render(String name, JsonNode value) {
        if (value == null || value.isMissingNode()) {
            throw new VariableResolutionException(name,
                    "Missing context variable for placeholder: {{" + name + "}}");
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return renderNumber(value);
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? "true" : "false";
        }
        throw new VariableResolutionException(name,
                "Unsupported value type for placeholder {{" + name + "}}: " + value.getNodeType());
    }

    /**
     * Plain decimal text, never exponent notation.
     */
    private static String renderNumber(JsonNode value) {
        if (value.isBigDecimal()) {
            return value.decimalValue().toPlainString();
        }
        if (value.isFloatingPointNumber()) {
            String text = value.numberValue().toString();
            if (text.indexOf('E') < 0) {
                return text;
            }
            return BigDecimal.valueOf(value.doubleValue()).stripTrailingZeros().toPlainString();
        }
        return value.numberValue().toString();
    }

    /**
     * Exception thrown when placeholder resolution fails.
     */
    public static class VariableResolutionException extends RuntimeException {

        private final String variableName;

        public VariableResolutionException(String variableName, String message) {
            super(message);
            this.variableName = variableName;
        }

        public String getVariableName() {
            return variableName;
        }
    }
}
