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

import dev.mars.runbook.core.exceptions.InvalidTransitionException;
import dev.mars.runbook.workflow.StepExecutionRecord;
import dev.mars.runbook.workflow.StepStatus;
import dev.mars.runbook.workflow.WorkflowExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The single task that owns a {@link DebugSession}.
 *
 * <p>While running, queued commands are drained between steps, so Pause,
 * Stop and Restart take effect at the next step boundary. While parked, the
 * loop blocks on the command queue. Every state change refreshes the
 * session's published snapshot before the matching event goes out.</p>
 */
final class DebugSessionLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DebugSessionLoop.class);

    private final DebugSession session;
    private final DebugSessionHandle handle;
    private final WorkflowExecutor executor;
    private final Duration pollInterval;

    DebugSessionLoop(DebugSession session, DebugSessionHandle handle, WorkflowExecutor executor,
                     Duration pollInterval) {
        this.session = session;
        this.handle = handle;
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        String sessionId = session.getSessionId();
        logger.debug("Debug session {} waiting for commands", sessionId);
        try {
            while (!session.getState().isTerminal()) {
                if (session.getState() == ExecutionState.RUNNING) {
                    DebugCommand command;
                    while (session.getState() == ExecutionState.RUNNING
                            && (command = handle.getCommands().poll()) != null) {
                        handleCommand(command);
                    }
                    if (session.getState() == ExecutionState.RUNNING) {
                        advance();
                    }
                } else {
                    DebugCommand command = handle.getCommands().poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    if (command != null) {
                        handleCommand(command);
                    }
                }
            }
            logger.debug("Debug session {} loop finished", sessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Debug session {} interrupted", sessionId);
            terminateAbnormally(null);
        } catch (InvalidTransitionException | RuntimeException e) {
            logger.error("Debug session {} failed: {}", sessionId, e.getMessage());
            logger.debug("Debug session failure details for: {}", sessionId, e);
            terminateAbnormally("Debug session loop failed: " + e.getMessage());
        }
    }

    private void handleCommand(DebugCommand command) throws InvalidTransitionException {
        logger.debug("Debug session {} received {} in state {}", session.getSessionId(),
                command.getClass().getSimpleName(), session.getState());

        if (command instanceof DebugCommand.Start) {
            start(command);
        } else if (command instanceof DebugCommand.Pause) {
            pause(command);
        } else if (command instanceof DebugCommand.Resume) {
            resume(command);
        } else if (command instanceof DebugCommand.StepOver
                || command instanceof DebugCommand.StepInto
                || command instanceof DebugCommand.StepOut) {
            stepOver(command);
        } else if (command instanceof DebugCommand.Stop) {
            stop();
        } else if (command instanceof DebugCommand.SetBreakpoint setBreakpoint) {
            setBreakpoint(setBreakpoint.stepIndex());
        } else if (command instanceof DebugCommand.RemoveBreakpoint removeBreakpoint) {
            if (!session.removeBreakpoint(removeBreakpoint.stepIndex())) {
                logger.debug("No breakpoint at step {} in session {}", removeBreakpoint.stepIndex(),
                        session.getSessionId());
            }
            refreshSnapshot();
        } else if (command instanceof DebugCommand.SetVariable setVariable) {
            session.getContext().set(setVariable.name(), setVariable.value());
            emit(new DebugEvent.VariableUpdated(session.getSessionId(), setVariable.name(), setVariable.value()));
        } else if (command instanceof DebugCommand.Restart) {
            session.reset();
            logger.info("Debug session {} restarted", session.getSessionId());
            emit(new DebugEvent.SessionRestarted(session.getSessionId()));
        }
    }

    private void start(DebugCommand command) throws InvalidTransitionException {
        if (session.getState() != ExecutionState.NOT_STARTED) {
            reject(command);
            return;
        }
        session.transitionTo(ExecutionState.RUNNING);
        logger.info("Debug session {} started workflow '{}'", session.getSessionId(),
                session.getWorkflow().getName());
        emit(new DebugEvent.SessionStarted(session.getSessionId()));
    }

    private void pause(DebugCommand command) throws InvalidTransitionException {
        if (session.getState() != ExecutionState.RUNNING) {
            reject(command);
            return;
        }
        session.transitionTo(ExecutionState.PAUSED);
        emit(new DebugEvent.ExecutionPaused(session.getSessionId(), session.getCurrentStepIndex()));
    }

    private void resume(DebugCommand command) throws InvalidTransitionException {
        ExecutionState state = session.getState();
        if (state == ExecutionState.STEP_BREAKPOINT) {
            session.releaseBreakpoint();
        } else if (state != ExecutionState.PAUSED) {
            reject(command);
            return;
        }
        session.transitionTo(ExecutionState.RUNNING);
        emit(new DebugEvent.ExecutionResumed(session.getSessionId()));
    }

    private void stepOver(DebugCommand command) throws InvalidTransitionException {
        ExecutionState state = session.getState();
        if (state != ExecutionState.STEP_BREAKPOINT && state != ExecutionState.PAUSED) {
            reject(command);
            return;
        }
        session.transitionTo(ExecutionState.RUNNING);
        if (session.hasMoreSteps()) {
            runCurrentStep();
        } else {
            complete();
        }
        if (session.getState() == ExecutionState.RUNNING) {
            if (session.shouldBreakBeforeCurrentStep()) {
                breakAtCurrentStep();
            } else {
                session.transitionTo(ExecutionState.PAUSED);
                emit(new DebugEvent.StepPaused(session.getSessionId(), session.getCurrentStepIndex()));
            }
        }
    }

    private void stop() throws InvalidTransitionException {
        session.transitionTo(ExecutionState.TERMINATED);
        logger.info("Debug session {} stopped after {} steps", session.getSessionId(), session.getHistory().size());
        emit(new DebugEvent.SessionEnded(session.getSessionId()));
    }

    private void setBreakpoint(int stepIndex) {
        int stepCount = session.getWorkflow().getStepCount();
        if (stepIndex < 0 || stepIndex >= stepCount) {
            emit(new DebugEvent.Error(session.getSessionId(),
                    "Breakpoint index " + stepIndex + " is out of range (0.." + (stepCount - 1) + ")"));
            return;
        }
        session.addBreakpoint(stepIndex);
        refreshSnapshot();
    }

    private void advance() throws InvalidTransitionException {
        if (!session.hasMoreSteps()) {
            complete();
        } else if (session.shouldBreakBeforeCurrentStep()) {
            breakAtCurrentStep();
        } else {
            runCurrentStep();
        }
    }

    private void breakAtCurrentStep() throws InvalidTransitionException {
        int stepIndex = session.getCurrentStepIndex();
        session.transitionTo(ExecutionState.STEP_BREAKPOINT);
        logger.debug("Debug session {} hit breakpoint at step {}", session.getSessionId(), stepIndex);
        emit(new DebugEvent.BreakpointHit(session.getSessionId(), stepIndex, session.getContext().snapshot()));
    }

    private void runCurrentStep() throws InvalidTransitionException {
        int stepIndex = session.getCurrentStepIndex();
        session.clearReleasedBreakpoint();
        StepExecutionRecord record = executor.executeStep(session.getRunId(), session.getWorkflow(), stepIndex,
                session.getContext(), event -> emit(new DebugEvent.StepEvent(session.getSessionId(), event)));
        session.recordStep(record);

        if (record.getStatus() == StepStatus.FAILED) {
            String reason = "Step '" + record.getStepId() + "' failed: " + record.getError().orElse("unknown error");
            session.fail(reason);
            logger.info("Debug session {} failed: {}", session.getSessionId(), reason);
            emit(new DebugEvent.ExecutionFailed(session.getSessionId(), reason));
        } else if (!session.hasMoreSteps()) {
            complete();
        } else {
            refreshSnapshot();
        }
    }

    private void complete() throws InvalidTransitionException {
        session.transitionTo(ExecutionState.COMPLETED);
        logger.info("Debug session {} completed workflow '{}'", session.getSessionId(),
                session.getWorkflow().getName());
        emit(new DebugEvent.ExecutionCompleted(session.getSessionId()));
    }

    private void reject(DebugCommand command) {
        String message = "Command " + command.getClass().getSimpleName()
                + " is not valid in state " + session.getState();
        logger.warn("Debug session {}: {}", session.getSessionId(), message);
        emit(new DebugEvent.Error(session.getSessionId(), message));
    }

    private void terminateAbnormally(String error) {
        if (error != null) {
            emit(new DebugEvent.Error(session.getSessionId(), error));
        }
        if (!session.getState().isTerminal()) {
            try {
                session.transitionTo(ExecutionState.TERMINATED);
            } catch (InvalidTransitionException e) {
                logger.warn("Could not terminate debug session {}: {}", session.getSessionId(), e.getMessage());
            }
        }
        emit(new DebugEvent.SessionEnded(session.getSessionId()));
    }

    private void refreshSnapshot() {
        handle.publishSnapshot(session.snapshot());
    }

    private void emit(DebugEvent event) {
        refreshSnapshot();
        handle.getEvents().publish(event);
    }
}
