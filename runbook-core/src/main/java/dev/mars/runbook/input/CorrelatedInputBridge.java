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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link HumanInputBridge}. A prompt is removed the moment its
 * response arrives, so a second response for the same id is treated like an
 * unknown id: it is rejected and logged.
 */
public class CorrelatedInputBridge implements HumanInputBridge {

    private static final Logger logger = LoggerFactory.getLogger(CorrelatedInputBridge.class);

    private final Map<String, CompletableFuture<String>> pending = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<String> open(String promptId) {
        Objects.requireNonNull(promptId, "Prompt ID cannot be null");
        CompletableFuture<String> future = new CompletableFuture<>();
        if (pending.putIfAbsent(promptId, future) != null) {
            throw new IllegalStateException("Prompt already pending: " + promptId);
        }
        logger.debug("Opened prompt {}", promptId);
        return future;
    }

    @Override
    public boolean respond(String promptId, String text) {
        if (promptId == null) {
            return false;
        }
        CompletableFuture<String> future = pending.remove(promptId);
        if (future == null) {
            logger.warn("Ignoring response for unknown or already answered prompt: {}", promptId);
            return false;
        }
        boolean accepted = future.complete(text != null ? text : "");
        logger.debug("Response delivered for prompt {}", promptId);
        return accepted;
    }

    @Override
    public boolean cancel(String promptId) {
        if (promptId == null) {
            return false;
        }
        CompletableFuture<String> future = pending.remove(promptId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        logger.debug("Cancelled prompt {}", promptId);
        return true;
    }

    @Override
    public Set<String> getPendingPromptIds() {
        return Set.copyOf(pending.keySet());
    }
}
