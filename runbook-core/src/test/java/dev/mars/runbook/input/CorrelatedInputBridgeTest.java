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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelatedInputBridgeTest {

    private CorrelatedInputBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new CorrelatedInputBridge();
    }

    @Test
    void responseCompletesPendingPrompt() throws Exception {
        CompletableFuture<String> reply = bridge.open("p1");
        assertThat(bridge.getPendingPromptIds()).containsExactly("p1");

        assertThat(bridge.respond("p1", "yes")).isTrue();

        assertThat(reply.get(1, TimeUnit.SECONDS)).isEqualTo("yes");
        assertThat(bridge.getPendingPromptIds()).isEmpty();
    }

    @Test
    void duplicateResponseIsRejected() throws Exception {
        CompletableFuture<String> reply = bridge.open("p1");

        assertThat(bridge.respond("p1", "first")).isTrue();
        assertThat(bridge.respond("p1", "second")).isFalse();

        assertThat(reply.get(1, TimeUnit.SECONDS)).isEqualTo("first");
    }

    @Test
    void unknownPromptIsRejected() {
        assertThat(bridge.respond("nope", "text")).isFalse();
        assertThat(bridge.respond(null, "text")).isFalse();
    }

    @Test
    void openingSameIdTwiceFails() {
        bridge.open("p1");
        assertThatThrownBy(() -> bridge.open("p1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelAbandonsPrompt() {
        CompletableFuture<String> reply = bridge.open("p1");

        assertThat(bridge.cancel("p1")).isTrue();
        assertThat(reply).isCancelled();
        assertThat(bridge.cancel("p1")).isFalse();
        assertThat(bridge.respond("p1", "late")).isFalse();
    }
}
