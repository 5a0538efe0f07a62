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

package dev.mars.runbook.process;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Spawns external processes on behalf of command steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ProcessRunner {

    /**
     * Starts the process described by the request.
     *
     * @param request       what to run
     * @param chunkListener receives output chunks as they arrive; may be null
     * @return a future completed with the exit status and merged output, or
     *         completed exceptionally if the process could not be started or
     *         exceeded its timeout
     */
    CompletableFuture<ProcessResult> submit(ProcessRequest request, Consumer<String> chunkListener);

    /**
     * Releases runner resources. Processes already running are left to finish.
     */
    void shutdown();
}
