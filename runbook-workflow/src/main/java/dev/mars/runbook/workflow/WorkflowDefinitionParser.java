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

package dev.mars.runbook.workflow;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads workflow definitions from text or files. Implementations validate what
 * they load; an invalid definition is reported as a parse error.
 */
public interface WorkflowDefinitionParser {

    Workflow parse(Path file) throws WorkflowParseException;

    Workflow parseFromString(String content) throws WorkflowParseException;

    /**
     * Parses every definition file directly inside a directory, in file name order.
     */
    List<Workflow> parseDirectory(Path directory) throws WorkflowParseException;

    ValidationResult validate(Workflow workflow);
}
