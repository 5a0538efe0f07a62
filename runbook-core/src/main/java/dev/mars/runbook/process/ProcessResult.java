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

import java.util.Objects;

/**
 * Completion status and merged output of a finished process.
 */
public class ProcessResult {

    private final int exitCode;
    private final String output;

    public ProcessResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output = Objects.requireNonNull(output, "Output cannot be null");
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Standard output and standard error interleaved in arrival order.
     */
    public String getOutput() {
        return output;
    }

    public boolean isSuccessful() {
        return exitCode == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessResult that = (ProcessResult) o;
        return exitCode == that.exitCode && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exitCode, output);
    }

    @Override
    public String toString() {
        return "ProcessResult{exitCode=" + exitCode + ", outputLength=" + output.length() + '}';
    }
}
