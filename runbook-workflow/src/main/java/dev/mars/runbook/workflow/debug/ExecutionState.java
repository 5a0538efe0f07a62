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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a debug session.
 *
 * <p>The transition table below is the single source of truth for which
 * state changes a session may make. {@link #TERMINATED} is the only state
 * with no way out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ExecutionState {

    /**
     * Session created, waiting for Start. Also the state after Restart.
     */
    NOT_STARTED("not_started"),

    /**
     * Steps are being executed.
     */
    RUNNING("running"),

    /**
     * Parked between steps after Pause or a single step.
     */
    PAUSED("paused"),

    /**
     * Parked before a step whose index carries a breakpoint.
     */
    STEP_BREAKPOINT("step_breakpoint"),

    /**
     * All steps finished without failure. Restart is still possible.
     */
    COMPLETED("completed"),

    /**
     * A step failed after its retries. Restart is still possible.
     */
    FAILED("failed"),

    /**
     * Session stopped. No further commands are accepted.
     */
    TERMINATED("terminated");

    private static final Map<ExecutionState, Set<ExecutionState>> TRANSITIONS;

    static {
        var map = new EnumMap<ExecutionState, Set<ExecutionState>>(ExecutionState.class);
        map.put(NOT_STARTED, EnumSet.of(RUNNING, TERMINATED));
        map.put(RUNNING, EnumSet.of(PAUSED, STEP_BREAKPOINT, COMPLETED, FAILED, NOT_STARTED, TERMINATED));
        map.put(PAUSED, EnumSet.of(RUNNING, NOT_STARTED, TERMINATED));
        map.put(STEP_BREAKPOINT, EnumSet.of(RUNNING, NOT_STARTED, TERMINATED));
        map.put(COMPLETED, EnumSet.of(NOT_STARTED, TERMINATED));
        map.put(FAILED, EnumSet.of(NOT_STARTED, TERMINATED));
        map.put(TERMINATED, EnumSet.noneOf(ExecutionState.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    ExecutionState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * True while the session waits on its command queue rather than executing.
     */
    public boolean isParked() {
        return this == NOT_STARTED || this == PAUSED || this == STEP_BREAKPOINT
                || this == COMPLETED || this == FAILED;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    public boolean canTransitionTo(ExecutionState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<ExecutionState> getValidTransitions() {
        return TRANSITIONS.get(this);
    }
}
