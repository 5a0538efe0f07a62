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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.runbook.workflow.ExecutionContext;
import dev.mars.runbook.workflow.StepExecutionRecord;
import dev.mars.runbook.workflow.StepStatus;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable view of a debug session at one point in time.
 */
public final class DebugSessionSnapshot {

    private final String sessionId;
    private final String workflowId;
    private final String workflowName;
    private final ExecutionState state;
    private final String failureReason;
    private final int currentStepIndex;
    private final int totalSteps;
    private final SortedSet<Integer> breakpoints;
    private final Map<String, JsonNode> variables;
    private final List<StepExecutionRecord> history;

    public DebugSessionSnapshot(String sessionId, String workflowId, String workflowName, ExecutionState state,
                                String failureReason, int currentStepIndex, int totalSteps,
                                SortedSet<Integer> breakpoints, Map<String, JsonNode> variables,
                                List<StepExecutionRecord> history) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.failureReason = failureReason;
        this.currentStepIndex = currentStepIndex;
        this.totalSteps = totalSteps;
        this.breakpoints = Collections.unmodifiableSortedSet(new TreeSet<>(breakpoints));
        this.variables = variables;
        this.history = List.copyOf(history);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
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

    public int getTotalSteps() {
        return totalSteps;
    }

    public SortedSet<Integer> getBreakpoints() {
        return breakpoints;
    }

    /**
     * Deep copy of the session's variables.
     */
    public Map<String, JsonNode> getVariables() {
        return ExecutionContext.deepCopy(variables);
    }

    public List<StepExecutionRecord> getHistory() {
        return history;
    }

    public long getCompletedStepCount() {
        return history.stream().filter(r -> r.getStatus() == StepStatus.COMPLETED).count();
    }

    public long getFailedStepCount() {
        return history.stream().filter(r -> r.getStatus() == StepStatus.FAILED).count();
    }

    /**
     * One-line summary, e.g. {@code Workflow: deploy | Steps: 2/5 | Failed: 0 | State: PAUSED}.
     */
    public String summarize() {
        return String.format("Workflow: %s | Steps: %d/%d | Failed: %d | State: %s",
                workflowName, getCompletedStepCount(), totalSteps, getFailedStepCount(), state);
    }

    @Override
    public String toString() {
        return "DebugSessionSnapshot{" +
               "sessionId='" + sessionId + '\'' +
               ", state=" + state +
               ", currentStepIndex=" + currentStepIndex +
               ", history=" + history.size() +
               '}';
    }
}
