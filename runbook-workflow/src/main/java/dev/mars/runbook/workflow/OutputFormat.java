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

import java.util.Objects;
import java.util.Optional;

/**
 * How a step's raw text output is turned into the value stored in the
 * execution context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class OutputFormat {

    public enum Kind {
        /** Stored verbatim. */
        PLAIN_TEXT,
        /** Parsed as JSON; invalid JSON fails the step. */
        JSON,
        /** The single capture group of a pattern is extracted. */
        REGEX
    }

    private static final OutputFormat PLAIN_TEXT = new OutputFormat(Kind.PLAIN_TEXT, null);
    private static final OutputFormat JSON = new OutputFormat(Kind.JSON, null);

    private final Kind kind;
    private final String pattern;

    private OutputFormat(Kind kind, String pattern) {
        this.kind = kind;
        this.pattern = pattern;
    }

    public static OutputFormat plainText() {
        return PLAIN_TEXT;
    }

    public static OutputFormat json() {
        return JSON;
    }

    public static OutputFormat regex(String pattern) {
        return new OutputFormat(Kind.REGEX, Objects.requireNonNull(pattern, "Pattern cannot be null"));
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getPattern() {
        return Optional.ofNullable(pattern);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputFormat that = (OutputFormat) o;
        return kind == that.kind && Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, pattern);
    }

    @Override
    public String toString() {
        return pattern == null ? kind.name() : kind.name() + "(" + pattern + ")";
    }
}
