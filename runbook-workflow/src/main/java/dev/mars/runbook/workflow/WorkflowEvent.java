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

/**
 * Lifecycle notifications emitted by a workflow run, in the order the run
 * produces them. A step's {@link StepStarted} always precedes its
 * {@link StepCompleted}, {@link StepFailed} or {@link StepSkipped}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public sealed interface WorkflowEvent {

    String runId();

    record Started(String runId, String workflowId, String workflowName, int stepCount) implements WorkflowEvent {
    }

    record StepStarted(String runId, int stepIndex, String stepId, String stepName) implements WorkflowEvent {
    }

    record StepSkipped(String runId, int stepIndex, String stepId) implements WorkflowEvent {
    }

    record StepCompleted(String runId, int stepIndex, String stepId, String output) implements WorkflowEvent {
    }

    record StepFailed(String runId, int stepIndex, String stepId, String error) implements WorkflowEvent {
    }

    /**
     * A human-input step is waiting. Answer it through the input bridge using
     * {@code promptId}.
     */
    record PromptRequested(String runId, int stepIndex, String promptId, String message) implements WorkflowEvent {
    }

    record Completed(String runId, boolean success) implements WorkflowEvent {
    }

    /**
     * Engine-level problem, distinct from a step failure.
     */
    record Error(String runId, String message) implements WorkflowEvent {
    }
}
