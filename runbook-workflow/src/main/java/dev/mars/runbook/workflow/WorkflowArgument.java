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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named parameter declared by a workflow.
 */
public class WorkflowArgument {

    private final String name;
    private final String description;
    private final String defaultValue;
    private final ArgumentType type;
    private final boolean required;
    private final List<String> options;

    private WorkflowArgument(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Argument name cannot be null");
        this.description = builder.description;
        this.defaultValue = builder.defaultValue;
        this.type = builder.type != null ? builder.type : ArgumentType.STRING;
        this.required = builder.required;
        this.options = builder.options != null ? List.copyOf(builder.options) : List.of();
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public ArgumentType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Allowed values for {@link ArgumentType#ENUM} arguments.
     */
    public List<String> getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowArgument that = (WorkflowArgument) o;
        return required == that.required &&
               name.equals(that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(defaultValue, that.defaultValue) &&
               type == that.type &&
               options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, defaultValue, type, required, options);
    }

    @Override
    public String toString() {
        return "WorkflowArgument{" +
               "name='" + name + '\'' +
               ", type=" + type +
               ", required=" + required +
               ", defaultValue='" + defaultValue + '\'' +
               '}';
    }

    public static class Builder {
        private String name;
        private String description;
        private String defaultValue;
        private ArgumentType type = ArgumentType.STRING;
        private boolean required;
        private List<String> options = List.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder type(ArgumentType type) {
            this.type = type;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder options(List<String> options) {
            this.options = options;
            return this;
        }

        public WorkflowArgument build() {
            return new WorkflowArgument(this);
        }
    }
}
