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
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable variable bindings of one workflow run.
 *
 * <p>A context belongs to exactly one run (or debug session) and is not
 * thread-safe. Other threads see it only through {@link #snapshot()}, which
 * returns a deep copy.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionContext {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, JsonNode> variables;

    public ExecutionContext() {
        this.variables = new LinkedHashMap<>();
    }

    public ExecutionContext(Map<String, JsonNode> variables) {
        this();
        if (variables != null) {
            variables.forEach((name, value) -> set(name, value));
        }
    }

    /**
     * Builds the starting context for a run: every declared argument bound to
     * the caller's value when given, otherwise to its typed default. Caller
     * values for undeclared names are bound as well.
     */
    public static ExecutionContext initial(Workflow workflow, Map<String, ?> arguments) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        Map<String, ?> supplied = arguments != null ? arguments : Map.of();
        ExecutionContext context = new ExecutionContext();

        for (WorkflowArgument argument : workflow.getArguments()) {
            if (supplied.containsKey(argument.getName()) && supplied.get(argument.getName()) != null) {
                context.set(argument.getName(), toTypedNode(argument.getType(), supplied.get(argument.getName())));
            } else if (argument.getDefaultValue().isPresent()) {
                context.set(argument.getName(), toTypedNode(argument.getType(), argument.getDefaultValue().get()));
            }
        }
        for (Map.Entry<String, ?> entry : supplied.entrySet()) {
            if (workflow.getArgument(entry.getKey()).isEmpty() && entry.getValue() != null) {
                context.set(entry.getKey(), toNode(entry.getValue()));
            }
        }
        return context;
    }

    public Optional<JsonNode> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public void set(String name, JsonNode value) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(value, "Variable value cannot be null");
        variables.put(name, value);
    }

    public void set(String name, String value) {
        set(name, TextNode.valueOf(value));
    }

    public JsonNode remove(String name) {
        return variables.remove(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public int size() {
        return variables.size();
    }

    /**
     * Deep, unmodifiable copy of the current bindings.
     */
    public Map<String, JsonNode> snapshot() {
        return deepCopy(variables);
    }

    /**
     * Unmodifiable map whose values are deep copies of {@code values}.
     */
    public static Map<String, JsonNode> deepCopy(Map<String, JsonNode> values) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, v.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    public ExecutionContext copy() {
        return new ExecutionContext(snapshot());
    }

    /**
     * Converts an arbitrary Java value to a JSON value.
     */
    public static JsonNode toNode(Object value) {
        if (value instanceof JsonNode) {
            return ((JsonNode) value).deepCopy();
        }
        return MAPPER.valueToTree(value);
    }

    /**
     * Converts a value for an argument of the given type. Text for NUMBER and
     * BOOLEAN arguments is parsed; text that does not parse is kept as text.
     */
    static JsonNode toTypedNode(ArgumentType type, Object value) {
        if (!(value instanceof String)) {
            return toNode(value);
        }
        String text = (String) value;
        if (type == ArgumentType.NUMBER) {
            try {
                BigDecimal number = new BigDecimal(text.trim());
                if (number.scale() <= 0 && number.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
                    return LongNode.valueOf(number.longValueExact());
                }
                return DecimalNode.valueOf(number);
            } catch (NumberFormatException | ArithmeticException e) {
                return TextNode.valueOf(text);
            }
        }
        if (type == ArgumentType.BOOLEAN) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
                return BooleanNode.valueOf(Boolean.parseBoolean(trimmed));
            }
        }
        return TextNode.valueOf(text);
    }

    @Override
    public String toString() {
        return "ExecutionContext{variables=" + variables.keySet() + '}';
    }
}
