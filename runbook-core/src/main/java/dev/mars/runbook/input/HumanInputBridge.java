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

package dev.mars.runbook.input;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Pairs outgoing human-input requests with their single response.
 *
 * <p>The engine opens a prompt under a fresh correlation id and waits on the
 * returned future. Whoever presents the prompt to a person calls
 * {@link #respond(String, String)} with the same id. Each id accepts exactly
 * one response.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface HumanInputBridge {

    /**
     * Registers a pending prompt.
     *
     * @param promptId correlation id, unique among pending prompts
     * @return a future completed with the response text
     * @throws IllegalStateException if the id is already pending
     */
    CompletableFuture<String> open(String promptId);

    /**
     * Delivers the response for a pending prompt.
     *
     * @return true if the response was accepted; false if the id is unknown or
     *         already answered
     */
    boolean respond(String promptId, String text);

    /**
     * Abandons a pending prompt. The waiting future is cancelled.
     *
     * @return true if a pending prompt was removed
     */
    boolean cancel(String promptId);

    Set<String> getPendingPromptIds();
}
