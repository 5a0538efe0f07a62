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

import dev.mars.runbook.core.exceptions.RunbookException;

/**
 * Raised before a run starts when the workflow or its arguments are invalid.
 * No events are emitted and no step runs.
 */
public class WorkflowValidationException extends RunbookException {

    private final String workflowId;
    private final transient ValidationResult validationResult;

    public WorkflowValidationException(String workflowId, ValidationResult validationResult) {
        super("Workflow '" + workflowId + "' is invalid: " + validationResult.summarizeErrors());
        this.workflowId = workflowId;
        this.validationResult = validationResult;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
