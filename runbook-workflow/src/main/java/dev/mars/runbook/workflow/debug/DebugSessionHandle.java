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

package dev.mars.runbook.workflow.debug;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Everything other threads hold for a session: its command queue, its event
 * bus and the last snapshot its loop published.
 */
final class DebugSessionHandle {

    private final String sessionId;
    private final BlockingQueue<DebugCommand> commands = new LinkedBlockingQueue<>();
    private final DebugEventBus events = new DebugEventBus();
    private volatile DebugSessionSnapshot snapshot;
    private volatile Future<?> loop;

    DebugSessionHandle(DebugSessionSnapshot initial) {
        this.snapshot = Objects.requireNonNull(initial, "Snapshot cannot be null");
        this.sessionId = initial.getSessionId();
    }

    String getSessionId() {
        return sessionId;
    }

    BlockingQueue<DebugCommand> getCommands() {
        return commands;
    }

    DebugEventBus getEvents() {
        return events;
    }

    DebugSessionSnapshot getSnapshot() {
        return snapshot;
    }

    void publishSnapshot(DebugSessionSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    void attachLoop(Future<?> loop) {
        this.loop = loop;
    }

    boolean isLoopDone() {
        Future<?> current = loop;
        return current != null && current.isDone();
    }
}
