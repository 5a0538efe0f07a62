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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

/**
 * What a step does. The set of actions is closed; each variant carries only
 * the fields its kind needs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public sealed interface StepAction {

    /**
     * Tag used for this action in workflow definitions.
     */
    String type();

    /**
     * Runs an external command. Without arguments the command text is passed
     * to the configured shell; with arguments it names the executable.
     */
    record Command(String command, List<String> args, String workingDirectory) implements StepAction {
        public Command {
            args = args != null ? List.copyOf(args) : List.of();
        }

        public Command(String command) {
            this(command, List.of(), null);
        }

        @Override
        public String type() {
            return "command";
        }
    }

    /**
     * Asks a person for input and optionally stores the reply.
     */
    record AgentPrompt(String message, String inputVariable) implements StepAction {
        @Override
        public String type() {
            return "agent_prompt";
        }
    }

    record ToolCall(String toolName, JsonNode arguments) implements StepAction {
        public ToolCall {
            arguments = arguments != null ? arguments.deepCopy() : JsonNodeFactory.instance.objectNode();
        }

        @Override
        public JsonNode arguments() {
            return arguments.deepCopy();
        }

        @Override
        public String type() {
            return "tool_call";
        }
    }

    /**
     * Runs another catalogued workflow. Arguments bind positionally to the
     * nested workflow's declared arguments.
     */
    record SubWorkflow(String workflowName, List<String> args) implements StepAction {
        public SubWorkflow {
            args = args != null ? List.copyOf(args) : List.of();
        }

        @Override
        public String type() {
            return "sub_workflow";
        }
    }

    record PluginAction(String pluginName, String actionName, JsonNode arguments) implements StepAction {
        public PluginAction {
            arguments = arguments != null ? arguments.deepCopy() : JsonNodeFactory.instance.objectNode();
        }

        @Override
        public JsonNode arguments() {
            return arguments.deepCopy();
        }

        @Override
        public String type() {
            return "plugin_action";
        }
    }
}
