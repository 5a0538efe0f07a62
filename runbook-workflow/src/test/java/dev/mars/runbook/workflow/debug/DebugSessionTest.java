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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.runbook.core.exceptions.InvalidTransitionException;
import dev.mars.runbook.workflow.ExecutionContext;
import dev.mars.runbook.workflow.Workflow;
import dev.mars.runbook.workflow.WorkflowStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebugSessionTest {

    private Workflow workflow;

    @BeforeEach
    void setUp() {
        workflow = Workflow.builder()
                .name("two")
                .step(WorkflowStep.builder().id("a").name("a").command("echo a").build())
                .step(WorkflowStep.builder().id("b").name("b").command("echo b").build())
                .build();
    }

    private DebugSession newSession(String id) {
        ExecutionContext context = new ExecutionContext();
        context.set("env", "dev");
        return new DebugSession(id, workflow, context);
    }

    @Nested
    @DisplayName("Session state")
    class State {

        @Test
        @DisplayName("Illegal transitions are rejected and leave the state alone")
        void illegalTransition() {
            DebugSession session = newSession("s1");

            assertThatThrownBy(() -> session.transitionTo(ExecutionState.PAUSED))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(session.getState()).isEqualTo(ExecutionState.NOT_STARTED);
        }

        @Test
        @DisplayName("Failure keeps its reason until the next transition")
        void failureReason() throws Exception {
            DebugSession session = newSession("s1");
            session.transitionTo(ExecutionState.RUNNING);
            session.fail("Step 'a' failed: boom");

            assertThat(session.getFailureReason()).contains("Step 'a' failed: boom");
            assertThat(session.snapshot().getFailureReason()).contains("Step 'a' failed: boom");

            session.reset();
            assertThat(session.getFailureReason()).isEmpty();
        }

        @Test
        @DisplayName("Reset restores the initial variables and keeps breakpoints")
        void reset() throws Exception {
            DebugSession session = newSession("s1");
            String firstRun = session.getRunId();
            session.addBreakpoint(1);
            session.transitionTo(ExecutionState.RUNNING);
            session.getContext().set("env", "prod");
            session.getContext().set("extra", "x");

            session.reset();

            assertThat(session.getState()).isEqualTo(ExecutionState.NOT_STARTED);
            assertThat(session.getCurrentStepIndex()).isZero();
            assertThat(session.getHistory()).isEmpty();
            assertThat(session.getContext().getNames()).containsExactly("env");
            assertThat(session.getContext().get("env").orElseThrow().asText()).isEqualTo("dev");
            assertThat(session.getBreakpoints()).containsExactly(1);
            assertThat(session.getRunId()).isNotEqualTo(firstRun);
        }

        @Test
        @DisplayName("A released breakpoint does not fire again until cleared")
        void releasedBreakpoint() {
            DebugSession session = newSession("s1");
            session.addBreakpoint(0);

            assertThat(session.shouldBreakBeforeCurrentStep()).isTrue();
            session.releaseBreakpoint();
            assertThat(session.shouldBreakBeforeCurrentStep()).isFalse();
            session.clearReleasedBreakpoint();
            assertThat(session.shouldBreakBeforeCurrentStep()).isTrue();
        }
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        private DebugSessionRegistry registry;

        @BeforeEach
        void setUp() {
            registry = new DebugSessionRegistry();
        }

        private DebugSessionHandle handle(String id) {
            return new DebugSessionHandle(newSession(id).snapshot());
        }

        @Test
        @DisplayName("Registered sessions are found by id")
        void registerAndFind() {
            DebugSessionHandle handle = handle("s1");
            registry.register(handle);

            assertThat(registry.find("s1")).containsSame(handle);
            assertThat(registry.find("missing")).isEmpty();
            assertThat(registry.find(null)).isEmpty();
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Duplicate ids are rejected")
        void duplicate() {
            registry.register(handle("s1"));

            assertThatThrownBy(() -> registry.register(handle("s1")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("s1");
        }

        @Test
        @DisplayName("Removal returns the handle once")
        void remove() {
            registry.register(handle("s1"));
            registry.register(handle("s2"));

            assertThat(registry.remove("s1")).isPresent();
            assertThat(registry.remove("s1")).isEmpty();
            assertThat(registry.list()).extracting(DebugSessionHandle::getSessionId).containsExactly("s2");
        }
    }

    @Test
    void publishedVariablesAreCopies() {
        DebugSession session = newSession("s1");
        ObjectNode spec = JsonNodeFactory.instance.objectNode().put("replicas", 2);
        session.getContext().set("spec", spec);

        DebugEvent.BreakpointHit hit = new DebugEvent.BreakpointHit("s1", 0, session.getContext().snapshot());
        DebugSessionSnapshot snapshot = session.snapshot();
        spec.put("replicas", 3);
        ((ObjectNode) hit.variables().get("spec")).put("replicas", 4);
        ((ObjectNode) snapshot.getVariables().get("spec")).put("replicas", 5);

        assertThat(hit.variables().get("spec").get("replicas").asInt()).isEqualTo(2);
        assertThat(snapshot.getVariables().get("spec").get("replicas").asInt()).isEqualTo(2);
    }

    @Test
    void snapshotSummary() {
        DebugSession session = newSession("s1");

        assertThat(session.snapshot().summarize())
                .isEqualTo("Workflow: two | Steps: 0/2 | Failed: 0 | State: NOT_STARTED");
        assertThat(session.snapshot().getVariables()).isEqualTo(Map.of("env", session.getContext().get("env").orElseThrow()));
    }
}
