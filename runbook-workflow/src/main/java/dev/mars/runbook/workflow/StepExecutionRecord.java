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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * History entry for one processed step.
 *
 * <p>{@link #getVariablesBefore()} is a deep copy of the execution context
 * taken immediately before the step ran, so any earlier point of a run can be
 * inspected without re-executing it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StepExecutionRecord {

    private final int stepIndex;
    private final String stepId;
    private final String stepName;
    private final Instant startTime;
    private final Instant endTime;
    private final StepStatus status;
    private final String output;
    private final String error;
    private final Map<String, JsonNode> variablesBefore;

    public StepExecutionRecord(int stepIndex, String stepId, String stepName, Instant startTime, Instant endTime,
                               StepStatus status, String output, String error,
                               Map<String, JsonNode> variablesBefore) {
        this.stepIndex = stepIndex;
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.stepName = Objects.requireNonNull(stepName, "Step name cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output;
        this.error = error;
        this.variablesBefore = variablesBefore != null ? ExecutionContext.deepCopy(variablesBefore) : Map.of();
    }

    public static StepExecutionRecord completed(int index, WorkflowStep step, Instant start,
                                                String output, Map<String, JsonNode> before) {
        return new StepExecutionRecord(index, step.getId(), step.getName(), start, Instant.now(),
                StepStatus.COMPLETED, output, null, before);
    }

    public static StepExecutionRecord failed(int index, WorkflowStep step, Instant start,
                                             String error, Map<String, JsonNode> before) {
        return new StepExecutionRecord(index, step.getId(), step.getName(), start, Instant.now(),
                StepStatus.FAILED, null, error, before);
    }

    public static StepExecutionRecord skipped(int index, WorkflowStep step, Instant start,
                                              Map<String, JsonNode> before) {
        return new StepExecutionRecord(index, step.getId(), step.getName(), start, Instant.now(),
                StepStatus.SKIPPED, null, null, before);
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public StepStatus getStatus() {
        return status;
    }

    public Optional<String> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * A fresh deep copy on every call; the recorded values cannot be changed
     * through it.
     */
    public Map<String, JsonNode> getVariablesBefore() {
        return ExecutionContext.deepCopy(variablesBefore);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepExecutionRecord that = (StepExecutionRecord) o;
        return stepIndex == that.stepIndex &&
               stepId.equals(that.stepId) &&
               startTime.equals(that.startTime) &&
               status == that.status &&
               Objects.equals(output, that.output) &&
               Objects.equals(error, that.error) &&
               variablesBefore.equals(that.variablesBefore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepIndex, stepId, startTime, status);
    }

    @Override
    public String toString() {
        return "StepExecutionRecord{" +
               "stepIndex=" + stepIndex +
               ", stepId='" + stepId + '\'' +
               ", status=" + status +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }
}
