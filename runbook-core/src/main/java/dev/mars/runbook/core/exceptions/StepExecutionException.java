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

package dev.mars.runbook.core.exceptions;

/**
 * Exception raised when a single workflow step cannot complete.
 * These are always caught by the executor and reported as a step failure;
 * they never terminate the engine itself.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StepExecutionException extends RunbookException {

    private final String stepId;

    public StepExecutionException(String stepId, String message) {
        super(message);
        this.stepId = stepId;
    }

    public StepExecutionException(String stepId, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
