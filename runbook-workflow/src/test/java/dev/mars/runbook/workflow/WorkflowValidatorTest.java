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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowValidatorTest {

    private WorkflowValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowValidator();
    }

    private static WorkflowStep commandStep(String id, String command) {
        return WorkflowStep.builder().id(id).name(id).command(command).build();
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("A well-formed workflow has no errors")
        void validWorkflow() {
            Workflow workflow = Workflow.builder()
                    .name("ok")
                    .step(commandStep("a", "echo a"))
                    .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.isValid()).isTrue();
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("Blank name and empty shell list are errors")
        void blankNameAndEmptyShells() {
            Workflow workflow = Workflow.builder()
                    .name(" ")
                    .id("x")
                    .shells(List.of())
                    .step(commandStep("a", "echo a"))
                    .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::getMessage)
                    .contains("Name is required", "Shells array cannot be empty");
        }

        @Test
        @DisplayName("No steps is only a warning")
        void noSteps() {
            ValidationResult result = validator.validate(Workflow.builder().name("empty").build());

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).hasSize(1);
        }

        @Test
        @DisplayName("Duplicate step ids and empty commands are reported together")
        void duplicateIdsAndEmptyCommand() {
            Workflow workflow = Workflow.builder()
                    .name("dup")
                    .step(commandStep("a", "echo a"))
                    .step(commandStep("a", ""))
                    .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.getErrorCount()).isEqualTo(2);
            assertThat(result.summarizeErrors())
                    .contains("Duplicate step ID: a")
                    .contains("Command step 'a' has an empty command");
        }

        @Test
        @DisplayName("Tool and plugin steps need names and object arguments")
        void toolAndPluginSteps() {
            Workflow workflow = Workflow.builder()
                    .name("calls")
                    .step(WorkflowStep.builder().id("t").name("t")
                            .action(new StepAction.ToolCall("", JsonNodeFactory.instance.arrayNode())).build())
                    .step(WorkflowStep.builder().id("p").name("p")
                            .action(new StepAction.PluginAction("git", " ", null)).build())
                    .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::getFieldPath)
                    .containsExactlyInAnyOrder("steps[0].tool_name", "steps[0].arguments", "steps[1].action_name");
        }

        @Test
        @DisplayName("Regex output needs exactly one capture group")
        void regexGroupCount() {
            Workflow workflow = Workflow.builder()
                    .name("regex")
                    .step(WorkflowStep.builder().id("none").name("none").command("echo")
                            .outputFormat(OutputFormat.regex("\\d+")).build())
                    .step(WorkflowStep.builder().id("two").name("two").command("echo")
                            .outputFormat(OutputFormat.regex("(a)(b)")).build())
                    .step(WorkflowStep.builder().id("bad").name("bad").command("echo")
                            .outputFormat(OutputFormat.regex("(unclosed")).build())
                    .step(WorkflowStep.builder().id("good").name("good").command("echo")
                            .outputFormat(OutputFormat.regex("v=(\\d+)")).build())
                    .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::getFieldPath)
                    .containsExactly("steps[0].output_pattern", "steps[1].output_pattern", "steps[2].output_pattern");
        }

        @Test
        @DisplayName("Enum arguments must declare options")
        void enumWithoutOptions() {
            Workflow workflow = Workflow.builder()
                    .name("enum")
                    .argument(WorkflowArgument.builder("mode").type(ArgumentType.ENUM).build())
                    .step(commandStep("a", "echo {{mode}}"))
                    .build();

            assertThat(validator.validate(workflow).summarizeErrors())
                    .contains("Enum argument 'mode' must have options");
        }
    }

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        private final Workflow workflow = Workflow.builder()
                .name("args")
                .argument(WorkflowArgument.builder("target").required(true).build())
                .argument(WorkflowArgument.builder("mode").type(ArgumentType.ENUM)
                        .options(List.of("fast", "safe")).defaultValue("safe").build())
                .argument(WorkflowArgument.builder("count").type(ArgumentType.NUMBER).build())
                .argument(WorkflowArgument.builder("force").type(ArgumentType.BOOLEAN).build())
                .step(commandStep("a", "echo {{target}}"))
                .build();

        @Test
        @DisplayName("Required argument without value or default is an error")
        void missingRequired() {
            ValidationResult result = validator.validateArguments(workflow, Map.of());

            assertThat(result.getErrors()).singleElement()
                    .extracting(ValidationResult.ValidationIssue::getFieldPath)
                    .isEqualTo("arguments.target");
        }

        @Test
        @DisplayName("Typed values are checked")
        void typedValues() {
            ValidationResult result = validator.validateArguments(workflow,
                    Map.of("target", "db", "mode", "reckless", "count", "many", "force", "yes"));

            assertThat(result.getErrorCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Correct values pass")
        void correctValues() {
            ValidationResult result = validator.validateArguments(workflow,
                    Map.of("target", "db", "mode", "fast", "count", "2.5", "force", "TRUE"));

            assertThat(result.isValid()).isTrue();
        }
    }
}
