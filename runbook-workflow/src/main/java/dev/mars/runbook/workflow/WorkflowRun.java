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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one finished workflow run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowRun {

    private final String runId;
    private final String workflowId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final List<StepExecutionRecord> stepRecords;
    private final Map<String, JsonNode> variables;
    private final String errorMessage;

    public WorkflowRun(String runId, Workflow workflow, WorkflowStatus status, Instant startTime, Instant endTime,
                       List<StepExecutionRecord> stepRecords, Map<String, JsonNode> variables,
                       String errorMessage) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.workflowId = workflow.getId();
        this.workflowName = workflow.getName();
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.stepRecords = stepRecords != null ? List.copyOf(stepRecords) : List.of();
        this.variables = variables != null ? ExecutionContext.deepCopy(variables) : Map.of();
        this.errorMessage = errorMessage;
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    public List<StepExecutionRecord> getStepRecords() {
        return stepRecords;
    }

    /**
     * Variables as they stood when the run finished.
     */
    public Map<String, JsonNode> getVariables() {
        return ExecutionContext.deepCopy(variables);
    }

    public Optional<JsonNode> getVariable(String name) {
        return Optional.ofNullable(variables.get(name)).map(JsonNode::deepCopy);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public long getCompletedStepCount() {
        return stepRecords.stream().filter(r -> r.getStatus() == StepStatus.COMPLETED).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return runId.equals(((WorkflowRun) o).runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "WorkflowRun{" +
               "runId='" + runId + '\'' +
               ", workflow='" + workflowName + '\'' +
               ", status=" + status +
               ", steps=" + stepRecords.size() +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
               '}';
    }
}
