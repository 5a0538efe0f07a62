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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.runbook.config.RunbookConfiguration;
import dev.mars.runbook.core.exceptions.StepExecutionException;
import dev.mars.runbook.input.CorrelatedInputBridge;
import dev.mars.runbook.input.HumanInputBridge;
import dev.mars.runbook.plugin.InMemoryPluginHost;
import dev.mars.runbook.plugin.PluginException;
import dev.mars.runbook.plugin.PluginHost;
import dev.mars.runbook.process.LocalProcessRunner;
import dev.mars.runbook.process.ProcessRequest;
import dev.mars.runbook.process.ProcessResult;
import dev.mars.runbook.process.ProcessRunner;
import dev.mars.runbook.process.ProcessTimeoutException;
import dev.mars.runbook.tool.InMemoryToolRegistry;
import dev.mars.runbook.tool.ToolInvocationException;
import dev.mars.runbook.tool.ToolRegistry;
import dev.mars.runbook.tool.WorkflowTool;
import dev.mars.runbook.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs workflows step by step, stopping at the first failed step.
 *
 * <p>Each run owns its {@link ExecutionContext}. Steps execute strictly in
 * declaration order on the run's thread; external work (processes, tools,
 * plugins, human input) is delegated to the collaborators supplied at
 * construction. Failed steps are retried up to their retry count before the
 * run stops. Nothing is rolled back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowExecutor implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowExecutor.class);

    static final String RUN_MODE_NORMAL = "normal";
    static final String RUN_MODE_NESTED = "sub_workflow";

    private final RunbookConfiguration configuration;
    private final ProcessRunner processRunner;
    private final ToolRegistry toolRegistry;
    private final HumanInputBridge inputBridge;
    private final PluginHost pluginHost;
    private final WorkflowCatalog catalog;
    private final WorkflowMetrics metrics;
    private final boolean ownsProcessRunner;

    private final WorkflowValidator validator = new WorkflowValidator();
    private final VariableResolver variableResolver = new VariableResolver();
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator(variableResolver);
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final ExecutorService executorService;
    private final Map<String, RunControl> activeRuns = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    private WorkflowExecutor(Builder builder) {
        this.configuration = builder.configuration != null ? builder.configuration : new RunbookConfiguration();
        this.ownsProcessRunner = builder.processRunner == null;
        this.processRunner = builder.processRunner != null ? builder.processRunner : new LocalProcessRunner();
        this.toolRegistry = builder.toolRegistry != null ? builder.toolRegistry : new InMemoryToolRegistry();
        this.inputBridge = builder.inputBridge != null ? builder.inputBridge : new CorrelatedInputBridge();
        this.pluginHost = builder.pluginHost != null ? builder.pluginHost : new InMemoryPluginHost();
        this.catalog = builder.catalog != null ? builder.catalog : new InMemoryWorkflowCatalog();
        this.metrics = builder.metrics != null ? builder.metrics
                : (configuration.isMetricsEnabled() ? new WorkflowMetrics() : WorkflowMetrics.noop());
        this.executorService = Executors.newCachedThreadPool();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public WorkflowRun run(Workflow workflow, Map<String, ?> arguments, WorkflowEventListener listener)
            throws WorkflowValidationException {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }
        validate(workflow, arguments);
        String runId = UUID.randomUUID().toString();
        return runTopLevel(runId, workflow, arguments, listener);
    }

    @Override
    public CompletableFuture<WorkflowRun> execute(Workflow workflow, Map<String, ?> arguments,
                                                  WorkflowEventListener listener) {
        if (shutdown) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Workflow engine is shutdown"));
        }
        try {
            validate(workflow, arguments);
        } catch (WorkflowValidationException e) {
            return CompletableFuture.failedFuture(e);
        }

        String runId = UUID.randomUUID().toString();
        activeRuns.put(runId, new RunControl(runId));
        return CompletableFuture.supplyAsync(() -> runTopLevel(runId, workflow, arguments, listener),
                executorService);
    }

    @Override
    public Optional<WorkflowStatus> getStatus(String runId) {
        RunControl control = activeRuns.get(runId);
        return control != null ? Optional.of(control.status) : Optional.empty();
    }

    @Override
    public boolean cancel(String runId) {
        RunControl control = activeRuns.get(runId);
        if (control != null && !control.status.isTerminal()) {
            logger.info("Cancelling workflow run: {}", runId);
            control.cancelRequested = true;
            return true;
        }
        return false;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        if (ownsProcessRunner) {
            processRunner.shutdown();
        }
        logger.info("WorkflowExecutor shutdown initiated");
    }

    /**
     * Checks workflow structure and argument values together.
     *
     * @throws WorkflowValidationException if either check reports an error
     */
    public void validate(Workflow workflow, Map<String, ?> arguments) throws WorkflowValidationException {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        ValidationResult result = validator.validate(workflow)
                .merge(validator.validateArguments(workflow, arguments));
        if (!result.isValid()) {
            throw new WorkflowValidationException(workflow.getId(), result);
        }
    }

    public WorkflowMetrics getMetrics() {
        return metrics;
    }

    public RunbookConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Bridge on which prompt steps wait; answer a {@link WorkflowEvent.PromptRequested}
     * through {@link HumanInputBridge#respond(String, String)}.
     */
    public HumanInputBridge getInputBridge() {
        return inputBridge;
    }

    /**
     * Executes a single step against a context the caller owns: emits
     * {@link WorkflowEvent.StepStarted}, evaluates the condition, dispatches the
     * action with retries, applies output handling and emits the step's final
     * event. Never throws for step-level problems.
     *
     * @return the history record for the step
     */
    public StepExecutionRecord executeStep(String runId, Workflow workflow, int stepIndex,
                                           ExecutionContext context, WorkflowEventListener listener) {
        return executeStep(new RunControl(runId), runId, workflow, stepIndex, context, listener, 0);
    }

    private WorkflowRun runTopLevel(String runId, Workflow workflow, Map<String, ?> arguments,
                                    WorkflowEventListener listener) {
        RunControl control = activeRuns.computeIfAbsent(runId, RunControl::new);
        try {
            ExecutionContext context = ExecutionContext.initial(workflow, arguments);
            return runWorkflow(control, runId, workflow, context, listener, 0, RUN_MODE_NORMAL);
        } catch (RuntimeException e) {
            logger.error("Workflow run {} aborted: {}", runId, e.getMessage());
            logger.debug("Workflow run abort details for: {}", runId, e);
            emit(listener, new WorkflowEvent.Error(runId, "Workflow run aborted: " + e.getMessage()));
            control.status = WorkflowStatus.FAILED;
            return new WorkflowRun(runId, workflow, WorkflowStatus.FAILED, Instant.now(), Instant.now(),
                    List.of(), Map.of(), e.getMessage());
        } finally {
            activeRuns.remove(runId);
        }
    }

    private WorkflowRun runWorkflow(RunControl control, String runId, Workflow workflow, ExecutionContext context,
                                    WorkflowEventListener listener, int depth, String runMode) {
        Instant startTime = Instant.now();
        control.status = WorkflowStatus.RUNNING;
        logger.info("Starting workflow '{}' (run {}, {} steps)", workflow.getName(), runId, workflow.getStepCount());
        metrics.recordWorkflowStarted(workflow.getName(), runMode);
        emit(listener, new WorkflowEvent.Started(runId, workflow.getId(), workflow.getName(), workflow.getStepCount()));

        List<StepExecutionRecord> records = new ArrayList<>();
        WorkflowStatus status = WorkflowStatus.COMPLETED;
        String errorMessage = null;

        for (int i = 0; i < workflow.getStepCount(); i++) {
            if (control.cancelRequested) {
                status = WorkflowStatus.CANCELLED;
                errorMessage = "Workflow run was cancelled";
                break;
            }
            Optional<Duration> timeout = workflow.getTimeout();
            if (timeout.isPresent() && Duration.between(startTime, Instant.now()).compareTo(timeout.get()) > 0) {
                status = WorkflowStatus.FAILED;
                errorMessage = "Workflow timed out after " + timeout.get().toSeconds() + "s";
                break;
            }

            StepExecutionRecord record = executeStep(control, runId, workflow, i, context, listener, depth);
            records.add(record);
            if (record.getStatus() == StepStatus.FAILED) {
                status = WorkflowStatus.FAILED;
                errorMessage = "Step '" + record.getStepId() + "' failed: " + record.getError().orElse("unknown error");
                break;
            }
        }

        Instant endTime = Instant.now();
        double seconds = Duration.between(startTime, endTime).toMillis() / 1000.0;
        switch (status) {
            case COMPLETED -> metrics.recordWorkflowCompleted(workflow.getName(), runMode, seconds);
            case CANCELLED -> metrics.recordWorkflowCancelled(workflow.getName(), runMode);
            default -> metrics.recordWorkflowFailed(workflow.getName(), runMode, seconds);
        }
        if (depth == 0) {
            control.status = status;
        }

        if (status == WorkflowStatus.COMPLETED) {
            logger.info("Workflow '{}' completed (run {})", workflow.getName(), runId);
        } else {
            logger.info("Workflow '{}' finished with status {} (run {}): {}",
                    workflow.getName(), status, runId, errorMessage);
        }
        emit(listener, new WorkflowEvent.Completed(runId, status == WorkflowStatus.COMPLETED));
        return new WorkflowRun(runId, workflow, status, startTime, endTime, records, context.snapshot(), errorMessage);
    }

    private StepExecutionRecord executeStep(RunControl control, String runId, Workflow workflow, int index,
                                            ExecutionContext context, WorkflowEventListener listener, int depth) {
        WorkflowStep step = workflow.getStep(index);
        String stepType = step.getAction().type();
        Instant start = Instant.now();
        Map<String, JsonNode> before = context.snapshot();

        emit(listener, new WorkflowEvent.StepStarted(runId, index, step.getId(), step.getName()));

        if (step.getCondition().isPresent()) {
            try {
                if (!conditionEvaluator.evaluate(step.getCondition().get(), context)) {
                    logger.debug("Skipping step '{}': condition is false", step.getId());
                    metrics.recordStepSkipped(workflow.getName(), stepType);
                    emit(listener, new WorkflowEvent.StepSkipped(runId, index, step.getId()));
                    return StepExecutionRecord.skipped(index, step, start, before);
                }
            } catch (ConditionEvaluator.ConditionEvaluationException e) {
                return failStep(runId, workflow, index, step, start, before, e.getMessage(), listener);
            }
        }

        int attempts = step.getRetryCount() + 1;
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String raw = performAction(control, runId, workflow, index, step, context, listener, depth);
                String reported = applyOutputHandling(step, raw, context);
                metrics.recordStepExecuted(workflow.getName(), stepType);
                logger.debug("Step '{}' completed", step.getId());
                emit(listener, new WorkflowEvent.StepCompleted(runId, index, step.getId(), reported));
                return StepExecutionRecord.completed(index, step, start, reported, before);
            } catch (StepExecutionException e) {
                lastError = e.getMessage();
                logger.debug("Step '{}' attempt {}/{} failed: {}", step.getId(), attempt, attempts, lastError);
                if (attempt < attempts) {
                    logger.warn("Retrying step '{}' after failure: {}", step.getId(), lastError);
                    if (!pause(configuration.getStepRetryDelay())) {
                        lastError = lastError + " (retry interrupted)";
                        break;
                    }
                }
            }
        }
        return failStep(runId, workflow, index, step, start, before, lastError, listener);
    }

    private StepExecutionRecord failStep(String runId, Workflow workflow, int index, WorkflowStep step, Instant start,
                                         Map<String, JsonNode> before, String error,
                                         WorkflowEventListener listener) {
        logger.info("Step '{}' failed: {}", step.getId(), error);
        metrics.recordStepFailed(workflow.getName(), step.getAction().type());
        emit(listener, new WorkflowEvent.StepFailed(runId, index, step.getId(), error));
        return StepExecutionRecord.failed(index, step, start, error, before);
    }

    private String performAction(RunControl control, String runId, Workflow workflow, int index, WorkflowStep step,
                                 ExecutionContext context, WorkflowEventListener listener, int depth)
            throws StepExecutionException {
        StepAction action = step.getAction();
        try {
            if (action instanceof StepAction.Command command) {
                return runCommand(workflow, step, command, context);
            } else if (action instanceof StepAction.AgentPrompt prompt) {
                return awaitHumanInput(runId, index, step, prompt, context, listener);
            } else if (action instanceof StepAction.ToolCall toolCall) {
                return invokeTool(step, toolCall, context);
            } else if (action instanceof StepAction.SubWorkflow subWorkflow) {
                return runSubWorkflow(control, step, subWorkflow, context, listener, depth);
            } else if (action instanceof StepAction.PluginAction pluginAction) {
                return invokePlugin(step, pluginAction, context);
            }
            throw new StepExecutionException(step.getId(), "Unsupported step type: " + action.type());
        } catch (VariableResolver.VariableResolutionException e) {
            throw new StepExecutionException(step.getId(), e.getMessage(), e);
        }
    }

    private String runCommand(Workflow workflow, WorkflowStep step, StepAction.Command command,
                              ExecutionContext context) throws StepExecutionException {
        String commandText = variableResolver.resolveText(command.command(), context);
        List<String> args = new ArrayList<>();
        for (String arg : command.args()) {
            args.add(variableResolver.resolveText(arg, context));
        }
        String workingDirectory = variableResolver.resolveText(command.workingDirectory(), context);

        Map<String, String> environment = new LinkedHashMap<>();
        workflow.getEnvironment().forEach((k, v) -> environment.put(k, variableResolver.resolveText(v, context)));
        step.getEnvironment().forEach((k, v) -> environment.put(k, variableResolver.resolveText(v, context)));

        List<String> commandLine = new ArrayList<>();
        if (args.isEmpty()) {
            commandLine.add(configuration.getProcessShell());
            commandLine.add("-c");
            commandLine.add(commandText);
        } else {
            commandLine.add(commandText);
            commandLine.addAll(args);
        }

        ProcessRequest request = ProcessRequest.builder()
                .commandLine(commandLine)
                .workingDirectory(workingDirectory != null && !workingDirectory.isBlank()
                        ? Path.of(workingDirectory) : null)
                .environment(environment)
                .timeout(step.getTimeout().orElse(null))
                .build();

        ProcessResult result;
        try {
            result = processRunner.submit(request, chunk -> logger.trace("[{}] {}", step.getId(), chunk)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.getId(), "Interrupted while waiting for command", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProcessTimeoutException) {
                throw new StepExecutionException(step.getId(), "Step timed out: " + cause.getMessage(), cause);
            }
            throw new StepExecutionException(step.getId(), "Command could not be run: " + cause.getMessage(), cause);
        }

        if (!result.isSuccessful()) {
            throw new StepExecutionException(step.getId(),
                    "Command exited with status " + result.getExitCode() + ": " + result.getOutput().trim());
        }
        return result.getOutput();
    }

    private String awaitHumanInput(String runId, int index, WorkflowStep step, StepAction.AgentPrompt prompt,
                                   ExecutionContext context, WorkflowEventListener listener)
            throws StepExecutionException {
        String message = variableResolver.resolveText(prompt.message(), context);
        String promptId = UUID.randomUUID().toString();
        CompletableFuture<String> reply = inputBridge.open(promptId);
        emit(listener, new WorkflowEvent.PromptRequested(runId, index, promptId, message));

        Duration timeout = step.getTimeout().orElse(configuration.getPromptTimeout());
        String response;
        try {
            response = timeout.isZero() ? reply.get() : reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            inputBridge.cancel(promptId);
            throw new StepExecutionException(step.getId(),
                    "No response to prompt within " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new StepExecutionException(step.getId(), "Prompt was cancelled", e);
        } catch (InterruptedException e) {
            inputBridge.cancel(promptId);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.getId(), "Interrupted while waiting for prompt response", e);
        } catch (ExecutionException e) {
            throw new StepExecutionException(step.getId(), "Prompt failed: " + e.getCause().getMessage(), e);
        }

        if (prompt.inputVariable() != null && !prompt.inputVariable().isBlank()) {
            context.set(prompt.inputVariable(), response);
        }
        return response;
    }

    private String invokeTool(WorkflowStep step, StepAction.ToolCall toolCall, ExecutionContext context)
            throws StepExecutionException {
        JsonNode arguments = variableResolver.resolveStructured(toolCall.arguments(), context);
        WorkflowTool tool = toolRegistry.find(toolCall.toolName()).orElseThrow(() ->
                new StepExecutionException(step.getId(), "Unknown tool: " + toolCall.toolName()));
        try {
            String result = tool.execute(arguments);
            return result != null ? result : "";
        } catch (ToolInvocationException e) {
            throw new StepExecutionException(step.getId(),
                    "Tool '" + toolCall.toolName() + "' failed: " + e.getMessage(), e);
        }
    }

    private String invokePlugin(WorkflowStep step, StepAction.PluginAction pluginAction, ExecutionContext context)
            throws StepExecutionException {
        JsonNode arguments = variableResolver.resolveStructured(pluginAction.arguments(), context);
        try {
            String result = pluginHost.invoke(pluginAction.pluginName(), pluginAction.actionName(), arguments);
            return result != null ? result : "";
        } catch (PluginException e) {
            throw new StepExecutionException(step.getId(), e.getMessage(), e);
        }
    }

    private String runSubWorkflow(RunControl control, WorkflowStep step, StepAction.SubWorkflow subWorkflow,
                                  ExecutionContext context, WorkflowEventListener listener, int depth)
            throws StepExecutionException {
        int maxDepth = configuration.getSubWorkflowMaxDepth();
        if (depth + 1 > maxDepth) {
            throw new StepExecutionException(step.getId(),
                    "Sub-workflow nesting exceeds maximum depth of " + maxDepth);
        }
        Workflow nested = catalog.find(subWorkflow.workflowName()).orElseThrow(() ->
                new StepExecutionException(step.getId(), "Unknown workflow: " + subWorkflow.workflowName()));

        List<WorkflowArgument> declared = nested.getArguments();
        if (subWorkflow.args().size() > declared.size()) {
            throw new StepExecutionException(step.getId(), "Too many arguments for workflow '" + nested.getName()
                    + "': expected at most " + declared.size() + ", got " + subWorkflow.args().size());
        }
        Map<String, Object> bound = new LinkedHashMap<>();
        for (int i = 0; i < subWorkflow.args().size(); i++) {
            bound.put(declared.get(i).getName(), variableResolver.resolveText(subWorkflow.args().get(i), context));
        }

        try {
            validate(nested, bound);
        } catch (WorkflowValidationException e) {
            throw new StepExecutionException(step.getId(), e.getMessage(), e);
        }

        String nestedRunId = UUID.randomUUID().toString();
        logger.debug("Step '{}' starting sub-workflow '{}' (run {})", step.getId(), nested.getName(), nestedRunId);
        WorkflowRun nestedRun = runWorkflow(control, nestedRunId, nested, ExecutionContext.initial(nested, bound),
                listener, depth + 1, RUN_MODE_NESTED);
        if (!nestedRun.isSuccessful()) {
            throw new StepExecutionException(step.getId(), "Sub-workflow '" + nested.getName() + "' "
                    + nestedRun.getStatus().name().toLowerCase() + ": " + nestedRun.getErrorMessage().orElse(""));
        }

        String output = "";
        for (StepExecutionRecord record : nestedRun.getStepRecords()) {
            if (record.getStatus() == StepStatus.COMPLETED) {
                output = record.getOutput().orElse("");
            }
        }
        return output;
    }

    /**
     * Stores the step's output if an output variable is named.
     *
     * @return the text reported as the step's output
     */
    private String applyOutputHandling(WorkflowStep step, String raw, ExecutionContext context)
            throws StepExecutionException {
        OutputFormat format = step.getOutputFormat();
        Optional<String> variable = step.getOutputVariable();

        switch (format.getKind()) {
            case JSON: {
                JsonNode parsed;
                try {
                    parsed = objectMapper.readTree(raw);
                } catch (JsonProcessingException e) {
                    throw new StepExecutionException(step.getId(),
                            "Output is not valid JSON: " + e.getOriginalMessage(), e);
                }
                if (parsed == null || parsed.isMissingNode()) {
                    throw new StepExecutionException(step.getId(), "Output is not valid JSON: empty output");
                }
                variable.ifPresent(name -> context.set(name, parsed));
                return raw;
            }
            case REGEX: {
                Pattern pattern = Pattern.compile(format.getPattern().orElse(""));
                Matcher matcher = pattern.matcher(raw);
                if (matcher.groupCount() != 1) {
                    throw new StepExecutionException(step.getId(),
                            "Output pattern must have exactly one capture group");
                }
                if (!matcher.find()) {
                    throw new StepExecutionException(step.getId(), "Output did not match pattern: " + pattern);
                }
                String captured = matcher.group(1);
                if (captured == null) {
                    throw new StepExecutionException(step.getId(), "Capture group did not participate in the match");
                }
                variable.ifPresent(name -> context.set(name, TextNode.valueOf(captured)));
                return captured;
            }
            default:
                variable.ifPresent(name -> context.set(name, TextNode.valueOf(raw)));
                return raw;
        }
    }

    private void emit(WorkflowEventListener listener, WorkflowEvent event) {
        if (listener == null) {
            return;
        }
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Mutable control block shared by a run and its nested sub-workflows.
     */
    private static final class RunControl {
        private final String runId;
        private volatile WorkflowStatus status = WorkflowStatus.PENDING;
        private volatile boolean cancelRequested;

        private RunControl(String runId) {
            this.runId = runId;
        }

        @Override
        public String toString() {
            return "RunControl{runId='" + runId + "', status=" + status + '}';
        }
    }

    public static class Builder {
        private RunbookConfiguration configuration;
        private ProcessRunner processRunner;
        private ToolRegistry toolRegistry;
        private HumanInputBridge inputBridge;
        private PluginHost pluginHost;
        private WorkflowCatalog catalog;
        private WorkflowMetrics metrics;

        public Builder configuration(RunbookConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder processRunner(ProcessRunner processRunner) {
            this.processRunner = processRunner;
            return this;
        }

        public Builder toolRegistry(ToolRegistry toolRegistry) {
            this.toolRegistry = toolRegistry;
            return this;
        }

        public Builder inputBridge(HumanInputBridge inputBridge) {
            this.inputBridge = inputBridge;
            return this;
        }

        public Builder pluginHost(PluginHost pluginHost) {
            this.pluginHost = pluginHost;
            return this;
        }

        public Builder catalog(WorkflowCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public WorkflowExecutor build() {
            return new WorkflowExecutor(this);
        }
    }
}
