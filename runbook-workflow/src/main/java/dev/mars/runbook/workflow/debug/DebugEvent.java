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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.runbook.workflow.ExecutionContext;
import dev.mars.runbook.workflow.WorkflowEvent;

import java.util.Map;

/**
 * Events published by a debug session, in the order its state changes.
 * {@link SessionEnded} is always the last event of a session.
 */
public sealed interface DebugEvent {

    String sessionId();

    record SessionStarted(String sessionId) implements DebugEvent {
    }

    /**
     * Parked before {@code stepIndex}. The variables equal the snapshot later
     * recorded as the step's context before execution.
     */
    record BreakpointHit(String sessionId, int stepIndex, Map<String, JsonNode> variables) implements DebugEvent {
        public BreakpointHit {
            variables = ExecutionContext.deepCopy(variables);
        }

        @Override
        public Map<String, JsonNode> variables() {
            return ExecutionContext.deepCopy(variables);
        }
    }

    /**
     * Parked after a single step, before {@code stepIndex}.
     */
    record StepPaused(String sessionId, int stepIndex) implements DebugEvent {
    }

    record ExecutionPaused(String sessionId, int stepIndex) implements DebugEvent {
    }

    record ExecutionResumed(String sessionId) implements DebugEvent {
    }

    record VariableUpdated(String sessionId, String name, JsonNode value) implements DebugEvent {
    }

    /**
     * An executor event produced while running a step of the session.
     */
    record StepEvent(String sessionId, WorkflowEvent event) implements DebugEvent {
    }

    record ExecutionCompleted(String sessionId) implements DebugEvent {
    }

    record ExecutionFailed(String sessionId, String reason) implements DebugEvent {
    }

    record SessionRestarted(String sessionId) implements DebugEvent {
    }

    record SessionEnded(String sessionId) implements DebugEvent {
    }

    record Error(String sessionId, String message) implements DebugEvent {
    }
}
