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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Hosts plugin actions invoked by plugin-action steps. Hosting is separate from
 * the tool registry but the call shape is the same: structured arguments in,
 * text out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface PluginHost {

    /**
     * @param pluginName the plugin to address
     * @param actionName the action exposed by that plugin
     * @param arguments  fully resolved argument object
     * @return the action's textual result
     * @throws PluginException if the plugin or action is unknown, or the action fails
     */
    String invoke(String pluginName, String actionName, JsonNode arguments) throws PluginException;
}
