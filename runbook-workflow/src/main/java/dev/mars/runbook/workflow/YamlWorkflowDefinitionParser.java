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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow definitions with snake_case keys using SnakeYAML.
 *
 * <p>A step's {@code type} selects its action. When {@code type} is absent and
 * a {@code command} key is present the step runs a command; any other missing
 * or unrecognised type is rejected here, never at execution time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    private final Yaml yaml;
    private final ObjectMapper objectMapper;
    private final WorkflowValidator validator;

    public YamlWorkflowDefinitionParser() {
        this(new WorkflowValidator());
    }

    public YamlWorkflowDefinitionParser(WorkflowValidator validator) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.objectMapper = new ObjectMapper();
        this.validator = validator;
    }

    @Override
    public Workflow parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public Workflow parseFromString(String content) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) loaded;
        Workflow workflow = parseWorkflow(data);

        ValidationResult result = validator.validate(workflow);
        if (!result.isValid()) {
            throw new WorkflowParseException(workflow.getName(), null,
                    "Validation failed: " + result.summarizeErrors());
        }
        result.getWarnings().forEach(w -> logger.warn("Workflow '{}': {}", workflow.getName(), w));
        return workflow;
    }

    @Override
    public List<Workflow> parseDirectory(Path directory) throws WorkflowParseException {
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to list workflow directory: " + directory, e);
        }

        List<Workflow> workflows = new ArrayList<>();
        for (Path file : files) {
            try {
                workflows.add(parse(file));
            } catch (WorkflowParseException e) {
                throw new WorkflowParseException(e.getWorkflowName(), file.getFileName().toString(),
                        e.getMessage(), e);
            }
        }
        logger.info("Loaded {} workflows from {}", workflows.size(), directory);
        return workflows;
    }

    @Override
    public ValidationResult validate(Workflow workflow) {
        return validator.validate(workflow);
    }

    private Workflow parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name", "");
        Workflow.Builder builder = Workflow.builder()
                .id(getStringValue(data, "id", name))
                .name(name)
                .description(getStringValue(data, "description"))
                .tags(getStringList(data, "tags", name))
                .sourceUrl(getStringValue(data, "source_url"))
                .author(getStringValue(data, "author"))
                .authorUrl(getStringValue(data, "author_url"))
                .environment(getStringMap(data, "environment"));

        if (data.containsKey("shells")) {
            List<Shell> shells = new ArrayList<>();
            for (String shellName : getStringList(data, "shells", name)) {
                shells.add(Shell.fromName(shellName).orElseThrow(() ->
                        new WorkflowParseException(name, "shells", "Unknown shell: " + shellName)));
            }
            builder.shells(shells);
        }
        if (data.get("timeout") != null) {
            builder.timeout(parseDuration(data.get("timeout"), name, "timeout"));
        }

        List<Map<String, Object>> arguments = getListValue(data, "arguments", name);
        for (int i = 0; i < arguments.size(); i++) {
            builder.argument(parseArgument(arguments.get(i), name, "arguments[" + i + "]"));
        }

        List<Map<String, Object>> steps = getListValue(data, "steps", name);
        for (int i = 0; i < steps.size(); i++) {
            builder.step(parseStep(steps.get(i), name, "steps[" + i + "]"));
        }
        return builder.build();
    }

    private WorkflowArgument parseArgument(Map<String, Object> data, String workflowName, String path)
            throws WorkflowParseException {
        String typeName = getStringValue(data, "arg_type", getStringValue(data, "type"));
        ArgumentType type = ArgumentType.STRING;
        if (typeName != null) {
            type = ArgumentType.fromName(typeName).orElseThrow(() ->
                    new WorkflowParseException(workflowName, path + ".arg_type", "Unknown argument type: " + typeName));
        }
        return WorkflowArgument.builder(getStringValue(data, "name", ""))
                .description(getStringValue(data, "description"))
                .defaultValue(getStringValue(data, "default_value"))
                .type(type)
                .required(getBooleanValue(data, "required", false))
                .options(getStringList(data, "options", workflowName))
                .build();
    }

    private WorkflowStep parseStep(Map<String, Object> data, String workflowName, String path)
            throws WorkflowParseException {
        WorkflowStep.Builder builder = WorkflowStep.builder()
                .id(getStringValue(data, "id"))
                .name(getStringValue(data, "name", ""))
                .description(getStringValue(data, "description"))
                .action(parseAction(data, workflowName, path))
                .environment(getStringMap(data, "environment"))
                .retryCount(getIntValue(data, "retry_count", 0))
                .condition(getStringValue(data, "condition"))
                .outputFormat(parseOutputFormat(data, workflowName, path))
                .outputVariable(getStringValue(data, "output_variable"));

        if (data.get("timeout") != null) {
            builder.timeout(parseDuration(data.get("timeout"), workflowName, path + ".timeout"));
        }
        return builder.build();
    }

    private StepAction parseAction(Map<String, Object> data, String workflowName, String path)
            throws WorkflowParseException {
        String type = getStringValue(data, "type");
        if (type == null) {
            if (!data.containsKey("command")) {
                throw new WorkflowParseException(workflowName, path + ".type", "Step type is required");
            }
            type = "command";
        }

        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "command":
                return new StepAction.Command(
                        getStringValue(data, "command", ""),
                        getStringList(data, "args", workflowName),
                        getStringValue(data, "working_directory"));
            case "agent_prompt":
                return new StepAction.AgentPrompt(
                        getStringValue(data, "message", ""),
                        getStringValue(data, "input_variable"));
            case "tool_call":
                return new StepAction.ToolCall(
                        getStringValue(data, "tool_name", ""),
                        getJsonValue(data, "arguments"));
            case "sub_workflow":
                return new StepAction.SubWorkflow(
                        getStringValue(data, "workflow_name", ""),
                        getStringList(data, "args", workflowName));
            case "plugin_action":
                return new StepAction.PluginAction(
                        getStringValue(data, "plugin_name", ""),
                        getStringValue(data, "action_name", ""),
                        getJsonValue(data, "arguments"));
            default:
                throw new WorkflowParseException(workflowName, path + ".type", "Unknown step type: " + type);
        }
    }

    private OutputFormat parseOutputFormat(Map<String, Object> data, String workflowName, String path)
            throws WorkflowParseException {
        String format = getStringValue(data, "output_format");
        if (format == null) {
            return OutputFormat.plainText();
        }
        switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "plaintext":
            case "plain_text":
            case "text":
                return OutputFormat.plainText();
            case "json":
                return OutputFormat.json();
            case "regex":
                String pattern = getStringValue(data, "output_pattern");
                if (pattern == null) {
                    throw new WorkflowParseException(workflowName, path + ".output_pattern",
                            "Regex output format requires output_pattern");
                }
                return OutputFormat.regex(pattern);
            default:
                throw new WorkflowParseException(workflowName, path + ".output_format",
                        "Unknown output format: " + format);
        }
    }

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key, String workflowName)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(workflowName, key, "Expected a list");
        }
        for (Object element : (List<Object>) value) {
            if (!(element instanceof Map)) {
                throw new WorkflowParseException(workflowName, key, "Expected a list of mappings");
            }
        }
        return (List<Map<String, Object>>) value;
    }

    @SuppressWarnings("unchecked")
    private List<String> getStringList(Map<String, Object> data, String key, String workflowName)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(workflowName, key, "Expected a list");
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<Object>) value) {
            strings.add(element != null ? element.toString() : "");
        }
        return strings;
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> getStringMap(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Map)) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue() != null ? entry.getValue().toString() : "");
        }
        return result;
    }

    private JsonNode getJsonValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        return objectMapper.valueToTree(value);
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Accepts plain seconds ({@code 30}) or a suffixed amount ({@code 30s}, {@code 5m}, {@code 2h}).
     */
    static Duration parseDuration(Object value, String workflowName, String path) throws WorkflowParseException {
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        String trimmed = value.toString().trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2)));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(workflowName, path, "Invalid duration: " + value);
        }
    }
}
