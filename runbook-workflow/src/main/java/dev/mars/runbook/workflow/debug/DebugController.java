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

package dev.mars.runbook.workflow.debug;

import dev.mars.runbook.workflow.ExecutionContext;
import dev.mars.runbook.workflow.Workflow;
import dev.mars.runbook.workflow.WorkflowExecutor;
import dev.mars.runbook.workflow.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs workflows under operator control: breakpoints, pausing, single
 * stepping, live variable edits and restart.
 *
 * <p>Each session is driven by its own loop task. Commands are queued with
 * {@link #sendCommand(String, DebugCommand)} and take effect in order; events
 * are read from a stream obtained with {@link #subscribe(String)}. Problems
 * that cannot be tied to a live session (an unknown session id, for example)
 * are published on {@link #subscribeErrors()}.</p>
 *
 * <p>Prompt steps inside a session wait on the executor's input bridge; answer
 * them through {@link WorkflowExecutor#getInputBridge()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DebugController {

    private static final Logger logger = LoggerFactory.getLogger(DebugController.class);

    private final WorkflowExecutor executor;
    private final Duration pollInterval;
    private final DebugSessionRegistry registry = new DebugSessionRegistry();
    private final DebugEventBus errors = new DebugEventBus();
    private final ExecutorService executorService;
    private volatile boolean shutdown = false;

    public DebugController(WorkflowExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "Workflow executor cannot be null");
        this.pollInterval = executor.getConfiguration().getDebugCommandPollInterval();
        this.executorService = Executors.newCachedThreadPool();
    }

    /**
     * Validates the workflow and arguments and creates a session in
     * {@link ExecutionState#NOT_STARTED}. Breakpoints may be set before Start.
     * The session is discarded once its loop ends, after {@code SessionEnded}
     * has been published.
     *
     * @return the new session's id
     * @throws WorkflowValidationException if the workflow or arguments are invalid
     */
    public String createSession(Workflow workflow, Map<String, ?> arguments) throws WorkflowValidationException {
        if (shutdown) {
            throw new IllegalStateException("Debug controller is shutdown");
        }
        executor.validate(workflow, arguments);

        String sessionId = UUID.randomUUID().toString();
        DebugSession session = new DebugSession(sessionId, workflow, ExecutionContext.initial(workflow, arguments));
        DebugSessionHandle handle = new DebugSessionHandle(session.snapshot());
        registry.register(handle);
        DebugSessionLoop loop = new DebugSessionLoop(session, handle, executor, pollInterval);
        handle.attachLoop(executorService.submit(() -> {
            try {
                loop.run();
            } finally {
                if (registry.remove(sessionId).isPresent()) {
                    logger.debug("Debug session {} ended and was discarded", sessionId);
                }
            }
        }));

        logger.info("Created debug session {} for workflow '{}'", sessionId, workflow.getName());
        return sessionId;
    }

    /**
     * Queues a command for a session.
     *
     * @return false if the session is unknown or has ended
     */
    public boolean sendCommand(String sessionId, DebugCommand command) {
        Objects.requireNonNull(command, "Command cannot be null");
        Optional<DebugSessionHandle> handle = registry.find(sessionId);
        if (handle.isEmpty()) {
            logger.warn("Command {} for unknown debug session {}", command.getClass().getSimpleName(), sessionId);
            errors.publish(new DebugEvent.Error(sessionId, "Debug session not found: " + sessionId));
            return false;
        }
        if (handle.get().getSnapshot().getState().isTerminal() || handle.get().isLoopDone()) {
            logger.debug("Ignoring {} for ended debug session {}", command.getClass().getSimpleName(), sessionId);
            return false;
        }
        return handle.get().getCommands().offer(command);
    }

    /**
     * Opens a stream of the session's events from this point on.
     */
    public Optional<DebugEventStream> subscribe(String sessionId) {
        return registry.find(sessionId).map(h -> h.getEvents().subscribe());
    }

    public DebugEventStream subscribeErrors() {
        return errors.subscribe();
    }

    public Optional<DebugSessionSnapshot> getSnapshot(String sessionId) {
        return registry.find(sessionId).map(DebugSessionHandle::getSnapshot);
    }

    /**
     * e.g. {@code Workflow: deploy | Steps: 2/5 | Failed: 0 | State: PAUSED}
     */
    public Optional<String> getExecutionSummary(String sessionId) {
        return getSnapshot(sessionId).map(DebugSessionSnapshot::summarize);
    }

    public List<String> getSessionIds() {
        return registry.list().stream().map(DebugSessionHandle::getSessionId).collect(Collectors.toList());
    }

    /**
     * Stops a session and forgets it.
     *
     * @return false if the session was unknown
     */
    public boolean dropSession(String sessionId) {
        Optional<DebugSessionHandle> removed = registry.remove(sessionId);
        removed.ifPresent(h -> h.getCommands().offer(new DebugCommand.Stop()));
        if (removed.isPresent()) {
            logger.info("Dropped debug session {}", sessionId);
        }
        return removed.isPresent();
    }

    public void shutdown() {
        shutdown = true;
        for (DebugSessionHandle handle : registry.list()) {
            handle.getCommands().offer(new DebugCommand.Stop());
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Debug sessions did not stop in time, interrupting");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        logger.info("DebugController shutdown complete");
    }
}
