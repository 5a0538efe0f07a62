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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Session id to session handle. The lock guards only structural operations;
 * a session's own loop never takes it.
 */
class DebugSessionRegistry {

    private final Map<String, DebugSessionHandle> sessions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    void register(DebugSessionHandle handle) {
        Objects.requireNonNull(handle, "Session handle cannot be null");
        lock.writeLock().lock();
        try {
            if (sessions.containsKey(handle.getSessionId())) {
                throw new IllegalStateException("Debug session already registered: " + handle.getSessionId());
            }
            sessions.put(handle.getSessionId(), handle);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Optional<DebugSessionHandle> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    Optional<DebugSessionHandle> remove(String sessionId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(sessions.remove(sessionId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<DebugSessionHandle> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
