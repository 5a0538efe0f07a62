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

package dev.mars.runbook.plugin;

import dev.mars.runbook.core.exceptions.RunbookException;

/**
 * Failure raised by a plugin host, either because the plugin or action is
 * unknown or because the action itself failed.
 */
public class PluginException extends RunbookException {

    private final String pluginName;
    private final String actionName;

    public PluginException(String pluginName, String actionName, String message) {
        super(message);
        this.pluginName = pluginName;
        this.actionName = actionName;
    }

    public PluginException(String pluginName, String actionName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
        this.actionName = actionName;
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getActionName() {
        return actionName;
    }
}
