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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.runbook.config.RunbookConfiguration;
import dev.mars.runbook.plugin.InMemoryPluginHost;
import dev.mars.runbook.process.ProcessRequest;
import dev.mars.runbook.process.ProcessResult;
import dev.mars.runbook.tool.InMemoryToolRegistry;
import dev.mars.runbook.tool.ToolInvocationException;
import dev.mars.runbook.tool.WorkflowTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkflowExecutorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ScriptedProcessRunner processRunner;
    private InMemoryToolRegistry toolRegistry;
    private InMemoryPluginHost pluginHost;
    private InMemoryWorkflowCatalog catalog;
    private WorkflowExecutor executor;
    private List<WorkflowEvent> events;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(RunbookConfiguration.STEP_RETRY_DELAY_MS, "0");
        properties.setProperty(RunbookConfiguration.SUBWORKFLOW_MAX_DEPTH, "3");
        properties.setProperty(RunbookConfiguration.METRICS_ENABLED, "false");

        processRunner = new ScriptedProcessRunner();
        toolRegistry = new InMemoryToolRegistry();
        pluginHost = new InMemoryPluginHost();
        catalog = new InMemoryWorkflowCatalog();
        executor = WorkflowExecutor.builder()
                .configuration(new RunbookConfiguration(properties))
                .processRunner(processRunner)
                .toolRegistry(toolRegistry)
                .pluginHost(pluginHost)
                .catalog(catalog)
                .build();
        events = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static WorkflowStep commandStep(String id, String command) {
        return WorkflowStep.builder().id(id).name(id).command(command).build();
    }

    private static Workflow workflowOf(String name, WorkflowStep... steps) {
        return Workflow.builder().name(name).steps(List.of(steps)).build();
    }

    private List<Class<?>> eventTypes() {
        return events.stream().map(Object::getClass).collect(Collectors.toList());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testEchoThroughRealShell() throws Exception {
        WorkflowExecutor realExecutor = WorkflowExecutor.builder()
                .configuration(new RunbookConfiguration(new Properties()))
                .build();
        try {
            Workflow workflow = Workflow.builder()
                    .name("greet")
                    .argument(WorkflowArgument.builder("name").defaultValue("nobody").build())
                    .step(WorkflowStep.builder().id("say").name("say").command("echo {{name}}")
                            .outputVariable("greeting").build())
                    .build();

            WorkflowRun run = realExecutor.run(workflow, Map.of("name", "world"), events::add);

            assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
            assertEquals(1, run.getStepRecords().size());
            assertEquals("world\n", run.getStepRecords().get(0).getOutput().orElseThrow());
            assertEquals("world\n", run.getVariable("greeting").orElseThrow().asText());
            assertEquals(List.of(WorkflowEvent.Started.class, WorkflowEvent.StepStarted.class,
                    WorkflowEvent.StepCompleted.class, WorkflowEvent.Completed.class), eventTypes());
            assertTrue(((WorkflowEvent.Completed) events.get(3)).success());
        } finally {
            realExecutor.shutdown();
        }
    }

    @Test
    void testCommandLineAndEnvironment() throws Exception {
        Workflow workflow = Workflow.builder()
                .name("env")
                .environment(Map.of("A", "1", "B", "2"))
                .argument(WorkflowArgument.builder("dir").defaultValue("/tmp").build())
                .step(WorkflowStep.builder().id("shell").name("shell").command("ls {{dir}}")
                        .environment(Map.of("B", "3", "DIR", "{{dir}}")).build())
                .step(WorkflowStep.builder().id("direct").name("direct")
                        .action(new StepAction.Command("docker", List.of("ps", "{{dir}}"), "{{dir}}")).build())
                .build();

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertTrue(run.isSuccessful());
        ProcessRequest shell = processRunner.getRequests().get(0);
        assertEquals(List.of("/bin/sh", "-c", "ls /tmp"), shell.getCommandLine());
        assertEquals(Map.of("A", "1", "B", "3", "DIR", "/tmp"), shell.getEnvironment());

        ProcessRequest direct = processRunner.getRequests().get(1);
        assertEquals(List.of("docker", "ps", "/tmp"), direct.getCommandLine());
        assertEquals("/tmp", direct.getWorkingDirectory().orElseThrow().toString());
    }

    @Test
    void testFirstFailureStopsRun() throws Exception {
        processRunner.respondWith(request -> ScriptedProcessRunner.lastElement(request).contains("fail")
                ? new ProcessResult(2, "no such thing\n")
                : new ProcessResult(0, "ok\n"));
        Workflow workflow = workflowOf("stops",
                commandStep("one", "echo one"),
                commandStep("two", "fail now"),
                commandStep("three", "echo three"));

        WorkflowRun run = executor.run(workflow, Map.of(), events::add);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals(2, run.getStepRecords().size());
        assertEquals(StepStatus.COMPLETED, run.getStepRecords().get(0).getStatus());
        StepExecutionRecord failed = run.getStepRecords().get(1);
        assertEquals(StepStatus.FAILED, failed.getStatus());
        assertTrue(failed.getError().orElseThrow().contains("Command exited with status 2"));
        assertEquals(2, processRunner.getRequestCount());
        assertTrue(run.getErrorMessage().orElseThrow().startsWith("Step 'two' failed"));

        WorkflowEvent last = events.get(events.size() - 1);
        assertFalse(((WorkflowEvent.Completed) last).success());
        assertTrue(events.get(events.size() - 2) instanceof WorkflowEvent.StepFailed);
    }

    @Test
    void testEveryStepGetsOneRecordWithSnapshotBeforeIt() throws Exception {
        Workflow workflow = workflowOf("records",
                WorkflowStep.builder().id("a").name("a").command("echo 1").outputVariable("first").build(),
                WorkflowStep.builder().id("b").name("b").command("echo {{first}}").outputVariable("second").build(),
                commandStep("c", "echo done"));

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(3, run.getStepRecords().size());
        assertFalse(run.getStepRecords().get(0).getVariablesBefore().containsKey("first"));
        assertEquals("1\n", run.getStepRecords().get(1).getVariablesBefore().get("first").asText());
        assertFalse(run.getStepRecords().get(1).getVariablesBefore().containsKey("second"));
        assertEquals("1\n\n", run.getVariable("second").orElseThrow().asText());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, run.getStepRecords().get(i).getStepIndex());
        }
    }

    @Test
    void testRerunsAreDeterministic() throws Exception {
        Workflow workflow = Workflow.builder()
                .name("again")
                .argument(WorkflowArgument.builder("who").defaultValue("me").build())
                .step(WorkflowStep.builder().id("a").name("a").command("echo {{who}}").outputVariable("out").build())
                .build();

        WorkflowRun first = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);
        WorkflowRun second = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertNotEquals(first.getRunId(), second.getRunId());
        assertEquals(first.getStatus(), second.getStatus());
        assertEquals(first.getVariables(), second.getVariables());
        assertEquals(first.getStepRecords().get(0).getOutput(), second.getStepRecords().get(0).getOutput());
    }

    @Test
    void testRetriesUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        processRunner.respondWith(request -> attempts.incrementAndGet() < 3
                ? new ProcessResult(1, "flaky\n")
                : new ProcessResult(0, "stable\n"));
        Workflow workflow = workflowOf("retry",
                WorkflowStep.builder().id("flaky").name("flaky").command("probe").retryCount(2).build());

        WorkflowRun run = executor.run(workflow, Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals(3, processRunner.getRequestCount());
        assertEquals(1, run.getStepRecords().size());
        assertEquals(1, events.stream().filter(e -> e instanceof WorkflowEvent.StepStarted).count());
        assertEquals(0, events.stream().filter(e -> e instanceof WorkflowEvent.StepFailed).count());
    }

    @Test
    void testRetriesExhausted() throws Exception {
        processRunner.respondWith(request -> new ProcessResult(1, "down\n"));
        Workflow workflow = workflowOf("retry",
                WorkflowStep.builder().id("flaky").name("flaky").command("probe").retryCount(1).build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals(2, processRunner.getRequestCount());
    }

    @Test
    void testJsonOutputIsParsedAndStored() throws Exception {
        processRunner.respondWithOutput("{\"replicas\": 3, \"name\": \"api\"}");
        Workflow workflow = workflowOf("json",
                WorkflowStep.builder().id("get").name("get").command("kubectl get")
                        .outputFormat(OutputFormat.json()).outputVariable("deployment").build(),
                WorkflowStep.builder().id("check").name("check").command("echo scaled")
                        .condition("#deployment['replicas'] == 3").build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        JsonNode stored = run.getVariable("deployment").orElseThrow();
        assertTrue(stored.isObject());
        assertEquals(3, stored.get("replicas").intValue());
        assertEquals("{\"replicas\": 3, \"name\": \"api\"}", run.getStepRecords().get(0).getOutput().orElseThrow());
    }

    @Test
    void testInvalidJsonOutputFailsStep() throws Exception {
        processRunner.respondWithOutput("not json at all {");
        Workflow workflow = workflowOf("json",
                WorkflowStep.builder().id("get").name("get").command("probe")
                        .outputFormat(OutputFormat.json()).outputVariable("data").build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("not valid JSON"));
        assertTrue(run.getVariable("data").isEmpty());
    }

    @Test
    void testRegexCapturesGroup() throws Exception {
        processRunner.respondWithOutput("name=api\nversion=1.4.2\n");
        Workflow workflow = workflowOf("regex",
                WorkflowStep.builder().id("v").name("v").command("cat VERSION")
                        .outputFormat(OutputFormat.regex("version=([0-9.]+)")).outputVariable("version").build());

        WorkflowRun run = executor.run(workflow, Map.of(), events::add);

        assertEquals("1.4.2", run.getVariable("version").orElseThrow().asText());
        assertEquals("1.4.2", run.getStepRecords().get(0).getOutput().orElseThrow());
        WorkflowEvent.StepCompleted completed = (WorkflowEvent.StepCompleted) events.get(2);
        assertEquals("1.4.2", completed.output());
    }

    @Test
    void testRegexWithoutMatchFailsStep() throws Exception {
        processRunner.respondWithOutput("nothing here\n");
        Workflow workflow = workflowOf("regex",
                WorkflowStep.builder().id("v").name("v").command("cat VERSION")
                        .outputFormat(OutputFormat.regex("version=(\\d+)")).build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("did not match"));
    }

    @Test
    void testRegexGroupOutsideMatchFailsStep() throws Exception {
        processRunner.respondWithOutput("y\n");
        Workflow workflow = workflowOf("regex",
                WorkflowStep.builder().id("v").name("v").command("cat FLAG")
                        .outputFormat(OutputFormat.regex("(x)?y")).outputVariable("flag").build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals(StepStatus.FAILED, run.getStepRecords().get(0).getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("did not participate"));
        assertTrue(run.getVariable("flag").isEmpty());
    }

    @Test
    void testJsonWithTrailingTextFailsStep() throws Exception {
        processRunner.respondWithOutput("{\"a\":1} this is not json");
        Workflow workflow = workflowOf("json",
                WorkflowStep.builder().id("j").name("j").command("cat data")
                        .outputFormat(OutputFormat.json()).outputVariable("v").build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("not valid JSON"));
        assertTrue(run.getVariable("v").isEmpty());
    }

    @Test
    void testTwoJsonDocumentsFailStep() throws Exception {
        processRunner.respondWithOutput("{\"a\":1}\n{\"b\":2}\n");
        Workflow workflow = workflowOf("json",
                WorkflowStep.builder().id("j").name("j").command("cat data")
                        .outputFormat(OutputFormat.json()).build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
    }

    @Test
    void testNumberArgumentsReachCommandAsPlainDecimals() throws Exception {
        Workflow workflow = Workflow.builder()
                .name("numbers")
                .argument(WorkflowArgument.builder("small").type(ArgumentType.NUMBER).defaultValue("0.0000001").build())
                .argument(WorkflowArgument.builder("large").type(ArgumentType.NUMBER).build())
                .step(commandStep("print", "echo {{small}} {{large}}"))
                .build();

        WorkflowRun run = executor.run(workflow, Map.of("large", "1e25"), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals("echo 0.0000001 10000000000000000000000000",
                ScriptedProcessRunner.lastElement(processRunner.getRequests().get(0)));
    }

    @Test
    void testRecordedSnapshotsCannotBeChangedByCallers() throws Exception {
        processRunner.respondWithOutput("{\"replicas\":2}");
        Workflow workflow = workflowOf("history",
                WorkflowStep.builder().id("read").name("read").command("cat spec.json")
                        .outputFormat(OutputFormat.json()).outputVariable("deployment").build(),
                commandStep("after", "echo done"));

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);
        StepExecutionRecord after = run.getStepRecords().get(1);

        ((ObjectNode) after.getVariablesBefore().get("deployment"))
                .put("replicas", 9);
        ((ObjectNode) run.getVariable("deployment").orElseThrow())
                .put("replicas", 9);

        assertEquals(2, after.getVariablesBefore().get("deployment").get("replicas").asInt());
        assertEquals(2, run.getVariables().get("deployment").get("replicas").asInt());
    }

    @Test
    void testFalseConditionSkipsStep() throws Exception {
        Workflow workflow = Workflow.builder()
                .name("cond")
                .argument(WorkflowArgument.builder("env").defaultValue("dev").build())
                .step(WorkflowStep.builder().id("deploy").name("deploy").command("echo deploying")
                        .condition("#env == 'prod'").build())
                .step(commandStep("report", "echo {{env}}"))
                .build();

        WorkflowRun run = executor.run(workflow, Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals(StepStatus.SKIPPED, run.getStepRecords().get(0).getStatus());
        assertEquals(StepStatus.COMPLETED, run.getStepRecords().get(1).getStatus());
        assertEquals(1, processRunner.getRequestCount());
        assertTrue(events.get(2) instanceof WorkflowEvent.StepSkipped);
    }

    @Test
    void testBrokenConditionFailsStep() throws Exception {
        Workflow workflow = workflowOf("cond",
                WorkflowStep.builder().id("a").name("a").command("echo a").condition("#missing.size(").build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals(0, processRunner.getRequestCount());
    }

    @Test
    void testMissingPlaceholderFailsStep() throws Exception {
        Workflow workflow = workflowOf("missing", commandStep("a", "echo {{nowhere}}"));

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals("Missing context variable for placeholder: {{nowhere}}",
                run.getStepRecords().get(0).getError().orElseThrow());
        assertEquals(0, processRunner.getRequestCount());
    }

    @Test
    void testPromptResponseIsStored() throws Exception {
        Workflow workflow = workflowOf("ask",
                WorkflowStep.builder().id("ask").name("ask")
                        .action(new StepAction.AgentPrompt("Proceed with {{target}}?", "answer")).build(),
                commandStep("use", "echo {{answer}}"));

        WorkflowRun run = executor.run(workflow, Map.of("target", "prod"), event -> {
            events.add(event);
            if (event instanceof WorkflowEvent.PromptRequested) {
                WorkflowEvent.PromptRequested prompt = (WorkflowEvent.PromptRequested) event;
                assertEquals("Proceed with prod?", prompt.message());
                executor.getInputBridge().respond(prompt.promptId(), "yes");
            }
        });

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals("yes", run.getVariable("answer").orElseThrow().asText());
        assertEquals("yes\n", run.getStepRecords().get(1).getOutput().orElseThrow());
        assertTrue(executor.getInputBridge().getPendingPromptIds().isEmpty());
    }

    @Test
    void testPromptTimesOut() throws Exception {
        Workflow workflow = workflowOf("ask",
                WorkflowStep.builder().id("ask").name("ask").timeout(Duration.ofMillis(100))
                        .action(new StepAction.AgentPrompt("Anyone?", "answer")).build());

        WorkflowRun run = executor.run(workflow, Map.of(), events::add);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("No response to prompt"));
        assertTrue(executor.getInputBridge().getPendingPromptIds().isEmpty());
        String promptId = events.stream()
                .filter(e -> e instanceof WorkflowEvent.PromptRequested)
                .map(e -> ((WorkflowEvent.PromptRequested) e).promptId())
                .findFirst().orElseThrow();
        assertFalse(executor.getInputBridge().respond(promptId, "too late"));
    }

    @Test
    void testToolCall() throws Exception {
        toolRegistry.register(new WorkflowTool() {
            @Override
            public String name() {
                return "upper";
            }

            @Override
            public String execute(JsonNode arguments) {
                return arguments.get("text").asText().toUpperCase();
            }
        });
        Workflow workflow = workflowOf("tools",
                WorkflowStep.builder().id("t").name("t").outputVariable("shout")
                        .action(new StepAction.ToolCall("upper", mapper.createObjectNode().put("text", "{{word}}")))
                        .build());

        WorkflowRun run = executor.run(workflow, Map.of("word", "quiet"), WorkflowEventListener.NONE);

        assertEquals("QUIET", run.getVariable("shout").orElseThrow().asText());
    }

    @Test
    void testUnknownToolFailsStep() throws Exception {
        Workflow workflow = workflowOf("tools",
                WorkflowStep.builder().id("t").name("t").action(new StepAction.ToolCall("nope", null)).build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals("Unknown tool: nope", run.getStepRecords().get(0).getError().orElseThrow());
    }

    @Test
    void testToolFailureFailsStep() throws Exception {
        WorkflowTool flaky = mock(WorkflowTool.class);
        when(flaky.name()).thenReturn("flaky");
        when(flaky.execute(any())).thenThrow(new ToolInvocationException("flaky", "backend unavailable"));
        toolRegistry.register(flaky);
        Workflow workflow = workflowOf("tools",
                WorkflowStep.builder().id("t").name("t").action(new StepAction.ToolCall("flaky", null)).build());

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertTrue(run.getStepRecords().get(0).getError().orElseThrow().contains("backend unavailable"));
    }

    @Test
    void testPluginAction() throws Exception {
        pluginHost.register("git", "status", arguments -> "clean on " + arguments.get("branch").asText());
        Workflow workflow = workflowOf("plugins",
                WorkflowStep.builder().id("p").name("p").outputVariable("status")
                        .action(new StepAction.PluginAction("git", "status",
                                mapper.createObjectNode().put("branch", "{{branch}}"))).build(),
                WorkflowStep.builder().id("q").name("q")
                        .action(new StepAction.PluginAction("git", "push", null)).build());

        WorkflowRun run = executor.run(workflow, Map.of("branch", "main"), WorkflowEventListener.NONE);

        assertEquals("clean on main", run.getVariable("status").orElseThrow().asText());
        assertEquals(StepStatus.FAILED, run.getStepRecords().get(1).getStatus());
        assertTrue(run.getStepRecords().get(1).getError().orElseThrow().contains("push"));
    }

    @Test
    void testSubWorkflowBindsArgumentsPositionally() throws Exception {
        catalog.register(Workflow.builder()
                .name("child")
                .argument(WorkflowArgument.builder("who").required(true).build())
                .argument(WorkflowArgument.builder("punct").defaultValue("!").build())
                .step(commandStep("first", "echo ignored"))
                .step(commandStep("last", "echo hello {{who}}{{punct}}"))
                .build());
        Workflow parent = workflowOf("parent",
                WorkflowStep.builder().id("call").name("call").outputVariable("reply")
                        .action(new StepAction.SubWorkflow("child", List.of("{{name}}"))).build());

        WorkflowRun run = executor.run(parent, Map.of("name", "ada"), events::add);

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals("hello ada!\n", run.getVariable("reply").orElseThrow().asText());
        assertEquals(1, run.getStepRecords().size());
        assertEquals(2, events.stream().filter(e -> e instanceof WorkflowEvent.Started).count());
        assertEquals(2, events.stream().filter(e -> e instanceof WorkflowEvent.Completed).count());
    }

    @Test
    void testSubWorkflowFailures() throws Exception {
        catalog.register(Workflow.builder()
                .name("child")
                .argument(WorkflowArgument.builder("only").build())
                .step(commandStep("a", "echo {{only}}"))
                .build());
        catalog.register(workflowOf("loop",
                WorkflowStep.builder().id("again").name("again")
                        .action(new StepAction.SubWorkflow("loop", List.of())).build()));

        Workflow tooMany = workflowOf("p1", WorkflowStep.builder().id("s").name("s")
                .action(new StepAction.SubWorkflow("child", List.of("x", "y"))).build());
        Workflow unknown = workflowOf("p2", WorkflowStep.builder().id("s").name("s")
                .action(new StepAction.SubWorkflow("ghost", List.of())).build());

        assertTrue(executor.run(tooMany, Map.of(), WorkflowEventListener.NONE).getStepRecords().get(0)
                .getError().orElseThrow().contains("Too many arguments"));
        assertEquals("Unknown workflow: ghost", executor.run(unknown, Map.of(), WorkflowEventListener.NONE)
                .getStepRecords().get(0).getError().orElseThrow());

        WorkflowRun recursive = executor.run(catalog.find("loop").orElseThrow(), Map.of(), WorkflowEventListener.NONE);
        assertEquals(WorkflowStatus.FAILED, recursive.getStatus());
        assertTrue(recursive.getErrorMessage().orElseThrow().contains("maximum depth of 3"));
    }

    @Test
    void testValidationFailureEmitsNoEvents() {
        Workflow workflow = Workflow.builder()
                .name("needs-args")
                .argument(WorkflowArgument.builder("target").required(true).build())
                .step(commandStep("a", "echo {{target}}"))
                .build();

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                () -> executor.run(workflow, Map.of(), events::add));

        assertTrue(e.getMessage().contains("target"));
        assertFalse(e.getValidationResult().isValid());
        assertTrue(events.isEmpty());

        CompletableFuture<WorkflowRun> future = executor.execute(workflow, Map.of(), events::add);
        ExecutionException failure = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertTrue(failure.getCause() instanceof WorkflowValidationException);
        assertTrue(events.isEmpty());
    }

    @Test
    void testCancelBetweenSteps() throws Exception {
        CountDownLatch stepEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        processRunner.respondWith(request -> {
            stepEntered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ProcessResult(0, "done\n");
        });
        CompletableFuture<String> runId = new CompletableFuture<>();
        Workflow workflow = workflowOf("long", commandStep("a", "sleep"), commandStep("b", "sleep"));

        CompletableFuture<WorkflowRun> future = executor.execute(workflow, Map.of(), event -> {
            if (event instanceof WorkflowEvent.Started) {
                runId.complete(event.runId());
            }
        });

        assertTrue(stepEntered.await(5, TimeUnit.SECONDS));
        String id = runId.get(1, TimeUnit.SECONDS);
        assertEquals(WorkflowStatus.RUNNING, executor.getStatus(id).orElseThrow());
        assertTrue(executor.cancel(id));
        release.countDown();

        WorkflowRun run = future.get(5, TimeUnit.SECONDS);
        assertEquals(WorkflowStatus.CANCELLED, run.getStatus());
        assertEquals(1, run.getStepRecords().size());
        assertEquals(1, processRunner.getRequestCount());
        await().atMost(Duration.ofSeconds(1)).until(() -> executor.getStatus(id).isEmpty());
        assertFalse(executor.cancel(id));
    }

    @Test
    void testOverallTimeoutCheckedBetweenSteps() throws Exception {
        processRunner.respondWith(request -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ProcessResult(0, "slow\n");
        });
        Workflow workflow = Workflow.builder()
                .name("bounded")
                .timeout(Duration.ofMillis(50))
                .step(commandStep("a", "slow"))
                .step(commandStep("b", "slow"))
                .build();

        WorkflowRun run = executor.run(workflow, Map.of(), WorkflowEventListener.NONE);

        assertEquals(WorkflowStatus.FAILED, run.getStatus());
        assertEquals(1, run.getStepRecords().size());
        assertTrue(run.getErrorMessage().orElseThrow().startsWith("Workflow timed out"));
    }

    @Test
    void testListenerFailureDoesNotStopRun() throws Exception {
        Workflow workflow = workflowOf("noisy", commandStep("a", "echo a"), commandStep("b", "echo b"));

        WorkflowRun run = executor.run(workflow, Map.of(), event -> {
            throw new IllegalStateException("listener broke");
        });

        assertEquals(WorkflowStatus.COMPLETED, run.getStatus());
        assertEquals(2, run.getCompletedStepCount());
    }

    @Test
    void testExecuteAfterShutdownFails() {
        executor.shutdown();

        CompletableFuture<WorkflowRun> future = executor.execute(workflowOf("late", commandStep("a", "echo")),
                Map.of(), WorkflowEventListener.NONE);

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertTrue(e.getCause() instanceof IllegalStateException);
    }
}
