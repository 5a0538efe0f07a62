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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named, ordered sequence of steps with declared arguments.
 *
 * <p>Workflows are immutable once built. Structural rules (unique step ids,
 * unique argument names and so on) are checked by {@link WorkflowValidator}
 * rather than here, so that a loader can report every problem at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class Workflow {

    private final String id;
    private final String name;
    private final String description;
    private final List<String> tags;
    private final String sourceUrl;
    private final String author;
    private final String authorUrl;
    private final List<Shell> shells;
    private final List<WorkflowArgument> arguments;
    private final List<WorkflowStep> steps;
    private final Map<String, String> environment;
    private final Duration timeout;

    private Workflow(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.id = builder.id != null ? builder.id : builder.name;
        this.description = builder.description;
        this.tags = List.copyOf(builder.tags);
        this.sourceUrl = builder.sourceUrl;
        this.author = builder.author;
        this.authorUrl = builder.authorUrl;
        this.shells = builder.shells != null ? List.copyOf(builder.shells) : null;
        this.arguments = List.copyOf(builder.arguments);
        this.steps = List.copyOf(builder.steps);
        this.environment = Map.copyOf(builder.environment);
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public Optional<String> getSourceUrl() {
        return Optional.ofNullable(sourceUrl);
    }

    public Optional<String> getAuthor() {
        return Optional.ofNullable(author);
    }

    public Optional<String> getAuthorUrl() {
        return Optional.ofNullable(authorUrl);
    }

    /**
     * Declared shells, empty when the workflow does not restrict them.
     */
    public Optional<List<Shell>> getShells() {
        return Optional.ofNullable(shells);
    }

    public List<WorkflowArgument> getArguments() {
        return arguments;
    }

    public Optional<WorkflowArgument> getArgument(String name) {
        return arguments.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public WorkflowStep getStep(int index) {
        return steps.get(index);
    }

    public int getStepCount() {
        return steps.size();
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean isCompatibleWith(Shell shell) {
        return shells == null || shells.contains(shell);
    }

    /**
     * Category of the first tag that names one, otherwise {@link WorkflowCategory#OTHER}.
     */
    public WorkflowCategory getCategory() {
        for (String tag : tags) {
            Optional<WorkflowCategory> category = WorkflowCategory.fromTag(tag);
            if (category.isPresent()) {
                return category.get();
            }
        }
        return WorkflowCategory.OTHER;
    }

    /**
     * Relevance of this workflow to a free-text query. Zero means no match.
     */
    public double searchScore(String query) {
        if (query == null || query.isBlank()) {
            return 0.0;
        }
        String q = query.toLowerCase(Locale.ROOT);
        double score = 0.0;

        String lowerName = name.toLowerCase(Locale.ROOT);
        if (lowerName.contains(q)) {
            score += 10.0;
            if (lowerName.equals(q)) {
                score += 20.0;
            }
        }

        for (String tag : tags) {
            String lowerTag = tag.toLowerCase(Locale.ROOT);
            if (lowerTag.contains(q)) {
                score += 8.0;
                if (lowerTag.equals(q)) {
                    score += 12.0;
                }
            }
        }

        if (description != null && description.toLowerCase(Locale.ROOT).contains(q)) {
            score += 5.0;
        }

        for (WorkflowStep step : steps) {
            if (step.getAction() instanceof StepAction.Command) {
                String command = ((StepAction.Command) step.getAction()).command();
                if (command != null && command.toLowerCase(Locale.ROOT).contains(q)) {
                    score += 3.0;
                }
            }
        }

        if (author != null && author.toLowerCase(Locale.ROOT).contains(q)) {
            score += 2.0;
        }
        return score;
    }

    /**
     * Placeholder names referenced by argument defaults and command text, in
     * first-seen order.
     */
    public List<String> placeholderNames() {
        Set<String> names = new LinkedHashSet<>();
        for (WorkflowArgument argument : arguments) {
            argument.getDefaultValue().ifPresent(v -> names.addAll(VariableResolver.placeholderNames(v)));
        }
        for (WorkflowStep step : steps) {
            if (step.getAction() instanceof StepAction.Command) {
                StepAction.Command command = (StepAction.Command) step.getAction();
                names.addAll(VariableResolver.placeholderNames(command.command()));
                for (String arg : command.args()) {
                    names.addAll(VariableResolver.placeholderNames(arg));
                }
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return id.equals(workflow.id) &&
               name.equals(workflow.name) &&
               Objects.equals(description, workflow.description) &&
               tags.equals(workflow.tags) &&
               Objects.equals(shells, workflow.shells) &&
               arguments.equals(workflow.arguments) &&
               steps.equals(workflow.steps) &&
               environment.equals(workflow.environment) &&
               Objects.equals(timeout, workflow.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, steps);
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", steps=" + steps.size() +
               ", arguments=" + arguments.size() +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private List<String> tags = new ArrayList<>();
        private String sourceUrl;
        private String author;
        private String authorUrl;
        private List<Shell> shells;
        private List<WorkflowArgument> arguments = new ArrayList<>();
        private List<WorkflowStep> steps = new ArrayList<>();
        private Map<String, String> environment = Map.of();
        private Duration timeout;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags != null ? tags : List.of());
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder authorUrl(String authorUrl) {
            this.authorUrl = authorUrl;
            return this;
        }

        public Builder shells(List<Shell> shells) {
            this.shells = shells;
            return this;
        }

        public Builder arguments(List<WorkflowArgument> arguments) {
            this.arguments = new ArrayList<>(arguments != null ? arguments : List.of());
            return this;
        }

        public Builder argument(WorkflowArgument argument) {
            this.arguments.add(argument);
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = new ArrayList<>(steps != null ? steps : List.of());
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Workflow build() {
            return new Workflow(this);
        }
    }
}
