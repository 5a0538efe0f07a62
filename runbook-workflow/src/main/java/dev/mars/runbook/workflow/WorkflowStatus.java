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
 * Enumeration of workflow run statuses.
 */
public enum WorkflowStatus {

    /**
     * Run has been accepted but its first step has not started.
     */
    PENDING,

    /**
     * Run is processing steps.
     */
    RUNNING,

    /**
     * Every step completed or was skipped.
     */
    COMPLETED,

    /**
     * A step failed or the run timed out.
     */
    FAILED,

    /**
     * Run was cancelled between steps.
     */
    CANCELLED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
