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

import java.util.Locale;
import java.util.Optional;

/**
 * Interactive shells a workflow can declare compatibility with.
 */
public enum Shell {
    ZSH,
    BASH,
    FISH;

    public static Optional<Shell> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "zsh":
                return Optional.of(ZSH);
            case "bash":
                return Optional.of(BASH);
            case "fish":
                return Optional.of(FISH);
            default:
                return Optional.empty();
        }
    }
}
