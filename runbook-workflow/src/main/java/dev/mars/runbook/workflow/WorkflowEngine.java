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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing workflows.
 */
public interface WorkflowEngine {

    /**
     * Runs a workflow on the calling thread.
     *
     * @param workflow  the workflow to run
     * @param arguments caller argument values; these override declared defaults
     * @param listener  receives the run's events in order
     * @return the finished run, successful or not
     * @throws WorkflowValidationException if the workflow or arguments are
     *         invalid; no event is emitted in that case
     */
    WorkflowRun run(Workflow workflow, Map<String, ?> arguments, WorkflowEventListener listener)
            throws WorkflowValidationException;

    /**
     * Runs a workflow on the engine's executor. Validation failures complete
     * the future exceptionally with {@link WorkflowValidationException}.
     *
     * @return future containing the finished run
     */
    CompletableFuture<WorkflowRun> execute(Workflow workflow, Map<String, ?> arguments,
                                           WorkflowEventListener listener);

    /**
     * Gets the status of an active run.
     *
     * @param runId the run ID
     * @return the current status, empty if the run is unknown or has finished
     */
    Optional<WorkflowStatus> getStatus(String runId);

    /**
     * Requests cancellation of an active run. The step in progress finishes;
     * no further step starts.
     *
     * @param runId the run ID
     * @return true if the run was active and will be cancelled
     */
    boolean cancel(String runId);

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
