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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named capability that tool-call steps can invoke with structured arguments.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface WorkflowTool {

    String name();

    /**
     * Invokes the tool.
     *
     * @param arguments the fully resolved argument object
     * @return the textual result
     * @throws ToolInvocationException if the tool reports a failure
     */
    String execute(JsonNode arguments) throws ToolInvocationException;
}
