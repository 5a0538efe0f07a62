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

import java.util.Objects;

/**
 * Operator commands accepted by a debug session.
 *
 * <p>Step-Into and Step-Out are reserved for sub-workflow depth control and
 * currently behave exactly like Step-Over.</p>
 */
public sealed interface DebugCommand {

    record Start() implements DebugCommand {
    }

    record Pause() implements DebugCommand {
    }

    record Resume() implements DebugCommand {
    }

    record StepOver() implements DebugCommand {
    }

    record StepInto() implements DebugCommand {
    }

    record StepOut() implements DebugCommand {
    }

    record Stop() implements DebugCommand {
    }

    record SetBreakpoint(int stepIndex) implements DebugCommand {
    }

    record RemoveBreakpoint(int stepIndex) implements DebugCommand {
    }

    record SetVariable(String name, JsonNode value) implements DebugCommand {
        public SetVariable {
            Objects.requireNonNull(name, "Variable name cannot be null");
            Objects.requireNonNull(value, "Variable value cannot be null");
            value = value.deepCopy();
        }
    }

    record Restart() implements DebugCommand {
    }
}
