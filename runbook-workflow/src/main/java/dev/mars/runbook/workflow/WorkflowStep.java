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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One unit of work in a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowStep {

    private final String id;
    private final String name;
    private final String description;
    private final StepAction action;
    private final Map<String, String> environment;
    private final Duration timeout;
    private final int retryCount;
    private final String condition;
    private final OutputFormat outputFormat;
    private final String outputVariable;

    private WorkflowStep(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(builder.name, "Step name cannot be null");
        this.description = builder.description;
        this.action = Objects.requireNonNull(builder.action, "Step action cannot be null");
        this.environment = builder.environment != null ? Map.copyOf(builder.environment) : Map.of();
        this.timeout = builder.timeout;
        this.retryCount = builder.retryCount;
        this.condition = builder.condition;
        this.outputFormat = builder.outputFormat != null ? builder.outputFormat : OutputFormat.plainText();
        this.outputVariable = builder.outputVariable;
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

    public StepAction getAction() {
        return action;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * The condition text, empty when absent or blank.
     */
    public Optional<String> getCondition() {
        return condition == null || condition.isBlank() ? Optional.empty() : Optional.of(condition);
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public Optional<String> getOutputVariable() {
        return outputVariable == null || outputVariable.isBlank() ? Optional.empty() : Optional.of(outputVariable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return retryCount == that.retryCount &&
               id.equals(that.id) &&
               name.equals(that.name) &&
               Objects.equals(description, that.description) &&
               action.equals(that.action) &&
               environment.equals(that.environment) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(condition, that.condition) &&
               outputFormat.equals(that.outputFormat) &&
               Objects.equals(outputVariable, that.outputVariable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, action);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", type=" + action.type() +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private StepAction action;
        private Map<String, String> environment = Map.of();
        private Duration timeout;
        private int retryCount;
        private String condition;
        private OutputFormat outputFormat = OutputFormat.plainText();
        private String outputVariable;

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

        public Builder action(StepAction action) {
            this.action = action;
            return this;
        }

        public Builder command(String command) {
            return action(new StepAction.Command(command));
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder outputVariable(String outputVariable) {
            this.outputVariable = outputVariable;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(this);
        }
    }
}
