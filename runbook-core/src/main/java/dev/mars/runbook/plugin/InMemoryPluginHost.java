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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link PluginHost}. Handlers are registered per plugin and action;
 * any exception a handler throws is reported as a {@link PluginException}.
 */
public class InMemoryPluginHost implements PluginHost {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPluginHost.class);

    private final Map<String, Map<String, PluginActionHandler>> plugins = new ConcurrentHashMap<>();

    public InMemoryPluginHost register(String pluginName, String actionName, PluginActionHandler handler) {
        Objects.requireNonNull(pluginName, "Plugin name cannot be null");
        Objects.requireNonNull(actionName, "Action name cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        plugins.computeIfAbsent(pluginName, k -> new ConcurrentHashMap<>()).put(actionName, handler);
        logger.debug("Registered plugin action {}.{}", pluginName, actionName);
        return this;
    }

    public boolean hasAction(String pluginName, String actionName) {
        Map<String, PluginActionHandler> actions = plugins.get(pluginName);
        return actions != null && actions.containsKey(actionName);
    }

    @Override
    public String invoke(String pluginName, String actionName, JsonNode arguments) throws PluginException {
        Map<String, PluginActionHandler> actions = plugins.get(pluginName);
        if (actions == null) {
            throw new PluginException(pluginName, actionName, "Unknown plugin: " + pluginName);
        }
        PluginActionHandler handler = actions.get(actionName);
        if (handler == null) {
            throw new PluginException(pluginName, actionName,
                    "Unknown action '" + actionName + "' for plugin " + pluginName);
        }

        try {
            String result = handler.handle(arguments);
            return result != null ? result : "";
        } catch (PluginException e) {
            throw e;
        } catch (Exception e) {
            throw new PluginException(pluginName, actionName,
                    "Plugin action " + pluginName + "." + actionName + " failed: " + e.getMessage(), e);
        }
    }
}
