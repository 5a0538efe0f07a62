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

package dev.mars.runbook.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry keyed by {@link WorkflowTool#name()}. Registering a
 * tool under an existing name replaces the previous one.
 */
public class InMemoryToolRegistry implements ToolRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryToolRegistry.class);

    private final Map<String, WorkflowTool> tools = new ConcurrentHashMap<>();

    public InMemoryToolRegistry register(WorkflowTool tool) {
        Objects.requireNonNull(tool, "Tool cannot be null");
        String name = Objects.requireNonNull(tool.name(), "Tool name cannot be null");
        if (tools.put(name, tool) != null) {
            logger.warn("Replaced existing tool registration: {}", name);
        } else {
            logger.debug("Registered tool: {}", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    @Override
    public Optional<WorkflowTool> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public Set<String> getToolNames() {
        return Set.copyOf(tools.keySet());
    }
}
