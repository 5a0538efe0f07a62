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
 * Coarse grouping of workflows derived from their tags.
 */
public enum WorkflowCategory {
    GIT("Git"),
    DOCKER("Docker"),
    KUBERNETES("Kubernetes"),
    AWS("AWS"),
    DATABASE("Database"),
    NETWORK("Network"),
    FILE_SYSTEM("File System"),
    SYSTEM("System"),
    OTHER("Other");

    private final String displayName;

    WorkflowCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps a single tag to a category, if it names one.
     */
    public static Optional<WorkflowCategory> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "git":
                return Optional.of(GIT);
            case "docker":
                return Optional.of(DOCKER);
            case "kubernetes":
            case "k8s":
                return Optional.of(KUBERNETES);
            case "aws":
                return Optional.of(AWS);
            case "database":
            case "db":
                return Optional.of(DATABASE);
            case "network":
                return Optional.of(NETWORK);
            case "file":
            case "filesystem":
                return Optional.of(FILE_SYSTEM);
            case "system":
                return Optional.of(SYSTEM);
            default:
                return Optional.empty();
        }
    }
}
