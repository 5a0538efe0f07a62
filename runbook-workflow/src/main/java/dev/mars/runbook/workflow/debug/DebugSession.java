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
import dev.mars.runbook.workflow.ExecutionContext;
import dev.mars.runbook.workflow.StepExecutionRecord;
import dev.mars.runbook.workflow.StepStatus;
import dev.mars.runbook.workflow.Workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Mutable state of one debug session.
 *
 * <p>Not thread-safe. A session is owned by exactly one session loop; other
 * threads observe it only through {@link DebugSessionSnapshot}s.</p>
 */
public class DebugSession {

    private final String sessionId;
    private final Workflow workflow;
    private final ExecutionContext initialContext;
    private final SortedSet<Integer> breakpoints = new TreeSet<>();
    private final List<StepExecutionRecord> history = new ArrayList<>();

    private ExecutionContext context;
    private ExecutionState state = ExecutionState.NOT_STARTED;
    private String failureReason;
    private int currentStepIndex;
    private String runId;
    private boolean breakpointReleased;

    public DebugSession(String sessionId, Workflow workflow, ExecutionContext initialContext) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.initialContext = Objects.requireNonNull(initialContext, "Initial context cannot be null").copy();
        this.context = this.initialContext.copy();
        this.runId = UUID.randomUUID().toString();
    }

    /**
     * Moves to {@code target} if the transition table allows it.
     *
     * @throws InvalidTransitionException if it does not
     */
    public void transitionTo(ExecutionState target) throws InvalidTransitionException {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException(sessionId, state, target, state.getValidTransitions());
        }
        state = target;
        if (target != ExecutionState.FAILED) {
            failureReason = null;
        }
    }

    public void fail(String reason) throws InvalidTransitionException {
        transitionTo(ExecutionState.FAILED);
        this.failureReason = reason;
    }

    /**
     * Back to step 0 with the initial variables and an empty history.
     * Breakpoints are kept.
     */
    public void reset() throws InvalidTransitionException {
        if (state != ExecutionState.NOT_STARTED) {
            transitionTo(ExecutionState.NOT_STARTED);
        }
        context = initialContext.copy();
        history.clear();
        currentStepIndex = 0;
        breakpointReleased = false;
        runId = UUID.randomUUID().toString();
    }

    void recordStep(StepExecutionRecord record) {
        history.add(record);
        currentStepIndex++;
    }

    public boolean hasMoreSteps() {
        return currentStepIndex < workflow.getStepCount();
    }

    /**
     * True when the step about to run carries a breakpoint that has not just
     * been resumed from.
     */
    boolean shouldBreakBeforeCurrentStep() {
        return !breakpointReleased && breakpoints.contains(currentStepIndex);
    }

    void releaseBreakpoint() {
        breakpointReleased = true;
    }

    void clearReleasedBreakpoint() {
        breakpointReleased = false;
    }

    public boolean addBreakpoint(int stepIndex) {
        return breakpoints.add(stepIndex);
    }

    public boolean removeBreakpoint(int stepIndex) {
        return breakpoints.remove(stepIndex);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public ExecutionState getState() {
        return state;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public String getRunId() {
        return runId;
    }

    public SortedSet<Integer> getBreakpoints() {
        return breakpoints;
    }

    public List<StepExecutionRecord> getHistory() {
        return history;
    }

    public long getFailedStepCount() {
        return history.stream().filter(r -> r.getStatus() == StepStatus.FAILED).count();
    }

    public DebugSessionSnapshot snapshot() {
        return new DebugSessionSnapshot(sessionId, workflow.getId(), workflow.getName(), state, failureReason,
                currentStepIndex, workflow.getStepCount(), breakpoints, context.snapshot(), history);
    }

    @Override
    public String toString() {
        return "DebugSession{" +
               "sessionId='" + sessionId + '\'' +
               ", workflow='" + workflow.getName() + '\'' +
               ", state=" + state +
               ", currentStepIndex=" + currentStepIndex +
               ", breakpoints=" + breakpoints +
               '}';
    }
}
