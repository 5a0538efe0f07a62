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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One subscriber's ordered view of a session's events.
 *
 * <p>Events published before the stream was subscribed are not replayed.</p>
 */
public class DebugEventStream implements AutoCloseable {

    private final BlockingQueue<DebugEvent> queue = new LinkedBlockingQueue<>();
    private final DebugEventBus bus;

    DebugEventStream(DebugEventBus bus) {
        this.bus = bus;
    }

    void offer(DebugEvent event) {
        queue.offer(event);
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<DebugEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public DebugEvent take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Removes and returns every buffered event without waiting.
     */
    public List<DebugEvent> drain() {
        List<DebugEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void close() {
        bus.unsubscribe(this);
    }
}
