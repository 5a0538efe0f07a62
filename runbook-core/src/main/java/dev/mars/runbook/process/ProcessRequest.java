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

package dev.mars.runbook.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one external process invocation.
 *
 * <p>The first element of {@link #getCommandLine()} is the executable; the
 * rest are its arguments. No shell interpretation is applied by the runner.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ProcessRequest {

    private final List<String> commandLine;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final Duration timeout;

    private ProcessRequest(Builder builder) {
        this.commandLine = List.copyOf(builder.commandLine);
        this.workingDirectory = builder.workingDirectory;
        this.environment = Map.copyOf(builder.environment);
        this.timeout = builder.timeout;
        if (commandLine.isEmpty()) {
            throw new IllegalArgumentException("Command line cannot be empty");
        }
    }

    public List<String> getCommandLine() {
        return commandLine;
    }

    public String getExecutable() {
        return commandLine.get(0);
    }

    public Optional<Path> getWorkingDirectory() {
        return Optional.ofNullable(workingDirectory);
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    /**
     * Upper bound on the process lifetime, empty for no bound.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ProcessRequest{" +
                "commandLine=" + commandLine +
                ", workingDirectory=" + workingDirectory +
                ", environment=" + environment.keySet() +
                ", timeout=" + timeout +
                '}';
    }

    public static class Builder {
        private List<String> commandLine = List.of();
        private Path workingDirectory;
        private Map<String, String> environment = Map.of();
        private Duration timeout;

        public Builder commandLine(List<String> commandLine) {
            this.commandLine = Objects.requireNonNull(commandLine, "Command line cannot be null");
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
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

        public ProcessRequest build() {
            return new ProcessRequest(this);
        }
    }
}
