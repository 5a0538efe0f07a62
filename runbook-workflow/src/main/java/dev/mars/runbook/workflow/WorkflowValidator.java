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

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks workflow structure and argument values before a run. Every problem
 * is collected; nothing is thrown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowValidator {

    public ValidationResult validate(Workflow workflow) {
        ValidationResult result = new ValidationResult();

        if (isBlank(workflow.getName())) {
            result.addError("name", "Name is required");
        }
        if (isBlank(workflow.getId())) {
            result.addError("id", "ID is required");
        }
        if (workflow.getShells().isPresent() && workflow.getShells().get().isEmpty()) {
            result.addError("shells", "Shells array cannot be empty");
        }

        validateArgumentDeclarations(workflow, result);

        if (workflow.getSteps().isEmpty()) {
            result.addWarning("steps", "Workflow has no steps");
        }

        Set<String> stepIds = new HashSet<>();
        for (int i = 0; i < workflow.getSteps().size(); i++) {
            WorkflowStep step = workflow.getSteps().get(i);
            String path = "steps[" + i + "]";

            if (isBlank(step.getId())) {
                result.addError(path + ".id", "Step '" + step.getName() + "' is missing an ID");
            } else if (!stepIds.add(step.getId())) {
                result.addError(path + ".id", "Duplicate step ID: " + step.getId());
            }
            if (isBlank(step.getName())) {
                result.addError(path + ".name", "Step with ID '" + step.getId() + "' is missing a name");
            }
            if (step.getRetryCount() < 0) {
                result.addError(path + ".retry_count", "Retry count cannot be negative");
            }

            validateAction(step, path, result);
            validateOutputFormat(step, path, result);
        }
        return result;
    }

    /**
     * Checks caller-supplied values against the declared arguments. A value
     * counts as present when supplied or defaulted.
     */
    public ValidationResult validateArguments(Workflow workflow, Map<String, ?> arguments) {
        ValidationResult result = new ValidationResult();
        Map<String, ?> supplied = arguments != null ? arguments : Map.of();

        for (WorkflowArgument argument : workflow.getArguments()) {
            String path = "arguments." + argument.getName();
            Object value = supplied.get(argument.getName());
            if (value == null) {
                value = argument.getDefaultValue().orElse(null);
            }
            if (value == null) {
                if (argument.isRequired()) {
                    result.addError(path, "Required argument '" + argument.getName() + "' has no value");
                }
                continue;
            }
            if (!(value instanceof String)) {
                continue;
            }
            String text = (String) value;
            switch (argument.getType()) {
                case ENUM:
                    if (!argument.getOptions().contains(text)) {
                        result.addError(path, "Value '" + text + "' is not one of " + argument.getOptions());
                    }
                    break;
                case NUMBER:
                    if (!isNumber(text)) {
                        result.addError(path, "Value '" + text + "' is not a number");
                    }
                    break;
                case BOOLEAN:
                    if (!"true".equalsIgnoreCase(text.trim()) && !"false".equalsIgnoreCase(text.trim())) {
                        result.addError(path, "Value '" + text + "' is not a boolean");
                    }
                    break;
                default:
                    break;
            }
        }
        return result;
    }

    private void validateArgumentDeclarations(Workflow workflow, ValidationResult result) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < workflow.getArguments().size(); i++) {
            WorkflowArgument argument = workflow.getArguments().get(i);
            String path = "arguments[" + i + "]";
            if (isBlank(argument.getName())) {
                result.addError(path + ".name", "Argument name is required");
                continue;
            }
            if (!names.add(argument.getName())) {
                result.addError(path + ".name", "Duplicate argument name: " + argument.getName());
            }
            if (argument.getType() == ArgumentType.ENUM && argument.getOptions().isEmpty()) {
                result.addError(path + ".options", "Enum argument '" + argument.getName() + "' must have options");
            }
        }
    }

    private void validateAction(WorkflowStep step, String path, ValidationResult result) {
        StepAction action = step.getAction();
        if (action instanceof StepAction.Command) {
            if (isBlank(((StepAction.Command) action).command())) {
                result.addError(path + ".command", "Command step '" + step.getName() + "' has an empty command");
            }
        } else if (action instanceof StepAction.AgentPrompt) {
            if (isBlank(((StepAction.AgentPrompt) action).message())) {
                result.addError(path + ".message", "AgentPrompt step '" + step.getName() + "' has an empty message");
            }
        } else if (action instanceof StepAction.ToolCall) {
            StepAction.ToolCall toolCall = (StepAction.ToolCall) action;
            if (isBlank(toolCall.toolName())) {
                result.addError(path + ".tool_name", "ToolCall step '" + step.getName() + "' has an empty tool_name");
            }
            requireObject(toolCall.arguments(), path, "ToolCall", step, result);
        } else if (action instanceof StepAction.SubWorkflow) {
            if (isBlank(((StepAction.SubWorkflow) action).workflowName())) {
                result.addError(path + ".workflow_name",
                        "SubWorkflow step '" + step.getName() + "' has an empty workflow_name");
            }
        } else if (action instanceof StepAction.PluginAction) {
            StepAction.PluginAction plugin = (StepAction.PluginAction) action;
            if (isBlank(plugin.pluginName())) {
                result.addError(path + ".plugin_name",
                        "PluginAction step '" + step.getName() + "' has an empty plugin_name");
            }
            if (isBlank(plugin.actionName())) {
                result.addError(path + ".action_name",
                        "PluginAction step '" + step.getName() + "' has an empty action_name");
            }
            requireObject(plugin.arguments(), path, "PluginAction", step, result);
        }
    }

    private void validateOutputFormat(WorkflowStep step, String path, ValidationResult result) {
        OutputFormat format = step.getOutputFormat();
        if (format.getKind() != OutputFormat.Kind.REGEX) {
            return;
        }
        String pattern = format.getPattern().orElse("");
        try {
            int groups = Pattern.compile(pattern).matcher("").groupCount();
            if (groups != 1) {
                result.addError(path + ".output_pattern",
                        "Output pattern must have exactly one capture group, found " + groups);
            }
        } catch (PatternSyntaxException e) {
            result.addError(path + ".output_pattern", "Invalid output pattern: " + e.getDescription());
        }
    }

    private static void requireObject(JsonNode arguments, String path, String kind, WorkflowStep step,
                                      ValidationResult result) {
        if (arguments == null || !arguments.isObject()) {
            result.addError(path + ".arguments",
                    kind + " step '" + step.getName() + "' arguments must be a JSON object");
        }
    }

    private static boolean isNumber(String text) {
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
