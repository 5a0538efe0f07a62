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

import dev.mars.runbook.core.exceptions.RunbookException;

import java.time.Duration;

/**
 * Raised when a process outlives the timeout on its request. The process is
 * destroyed before this is thrown.
 */
public class ProcessTimeoutException extends RunbookException {

    private final Duration timeout;

    public ProcessTimeoutException(String executable, Duration timeout) {
        super("Process '" + executable + "' timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
