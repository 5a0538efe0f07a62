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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to every subscribed stream. Each stream buffers on its own
 * unbounded queue, so publishing never blocks.
 */
class DebugEventBus {

    private final List<DebugEventStream> subscribers = new CopyOnWriteArrayList<>();

    DebugEventStream subscribe() {
        DebugEventStream stream = new DebugEventStream(this);
        subscribers.add(stream);
        return stream;
    }

    void unsubscribe(DebugEventStream stream) {
        subscribers.remove(stream);
    }

    void publish(DebugEvent event) {
        for (DebugEventStream stream : subscribers) {
            stream.offer(event);
        }
    }

    int getSubscriberCount() {
        return subscribers.size();
    }
}
