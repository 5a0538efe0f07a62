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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe catalog keyed by workflow name.
 */
public class InMemoryWorkflowCatalog implements WorkflowCatalog {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowCatalog.class);

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    public InMemoryWorkflowCatalog register(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        if (workflows.put(workflow.getName(), workflow) != null) {
            logger.debug("Replaced workflow '{}'", workflow.getName());
        }
        return this;
    }

    public InMemoryWorkflowCatalog registerAll(List<Workflow> toRegister) {
        toRegister.forEach(this::register);
        return this;
    }

    public boolean remove(String name) {
        return workflows.remove(name) != null;
    }

    @Override
    public Optional<Workflow> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Workflow byName = workflows.get(name);
        if (byName != null) {
            return Optional.of(byName);
        }
        return workflows.values().stream().filter(w -> w.getId().equals(name)).findFirst();
    }

    /**
     * All workflows ordered by name.
     */
    public List<Workflow> list() {
        return workflows.values().stream()
                .sorted(Comparator.comparing(Workflow::getName))
                .collect(Collectors.toList());
    }

    public List<Workflow> listByCategory(WorkflowCategory category) {
        return list().stream().filter(w -> w.getCategory() == category).collect(Collectors.toList());
    }

    /**
     * Workflows with a positive score for the query, best match first. Ties
     * are ordered by name.
     */
    public List<Workflow> search(String query) {
        List<Workflow> matches = new ArrayList<>();
        for (Workflow workflow : list()) {
            if (workflow.searchScore(query) > 0) {
                matches.add(workflow);
            }
        }
        matches.sort(Comparator.comparingDouble((Workflow w) -> w.searchScore(query)).reversed()
                .thenComparing(Workflow::getName));
        return matches;
    }

    public int size() {
        return workflows.size();
    }
}
