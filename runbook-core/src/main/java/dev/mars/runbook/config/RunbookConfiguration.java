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

package dev.mars.runbook.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the Runbook engine.
 *
 * <p>Instances are created once at startup and handed to the components that
 * need them; nothing in the engine reads configuration through static state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RunbookConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RunbookConfiguration.class);

    public static final String PROCESS_SHELL = "runbook.process.shell";
    public static final String STEP_RETRY_DELAY_MS = "runbook.step.retry.delay.ms";
    public static final String PROMPT_TIMEOUT_MS = "runbook.prompt.timeout.ms";
    public static final String SUBWORKFLOW_MAX_DEPTH = "runbook.subworkflow.max.depth";
    public static final String METRICS_ENABLED = "runbook.metrics.enabled";
    public static final String DEBUG_COMMAND_POLL_MS = "runbook.debug.command.poll.ms";

    // Default configuration values
    private static final String DEFAULT_PROCESS_SHELL = "/bin/sh";
    private static final long DEFAULT_STEP_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_PROMPT_TIMEOUT_MS = 0; // wait indefinitely
    private static final int DEFAULT_SUBWORKFLOW_MAX_DEPTH = 8;
    private static final long DEFAULT_DEBUG_COMMAND_POLL_MS = 250;

    private final Properties properties;

    /**
     * Loads defaults, then the first readable runbook.properties file, then
     * {@code runbook.*} system properties.
     */
    public RunbookConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Defaults overlaid with the given properties only. No files or system
     * properties are consulted.
     */
    public RunbookConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Process execution
    public String getProcessShell() {
        return getStringProperty(PROCESS_SHELL, DEFAULT_PROCESS_SHELL);
    }

    // Step execution
    public Duration getStepRetryDelay() {
        return Duration.ofMillis(Math.max(0, getLongProperty(STEP_RETRY_DELAY_MS, DEFAULT_STEP_RETRY_DELAY_MS)));
    }

    /**
     * Default wait for a human-input response. {@link Duration#ZERO} means the
     * wait is unbounded.
     */
    public Duration getPromptTimeout() {
        return Duration.ofMillis(Math.max(0, getLongProperty(PROMPT_TIMEOUT_MS, DEFAULT_PROMPT_TIMEOUT_MS)));
    }

    public int getSubWorkflowMaxDepth() {
        return getIntProperty(SUBWORKFLOW_MAX_DEPTH, DEFAULT_SUBWORKFLOW_MAX_DEPTH);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Debugger
    public Duration getDebugCommandPollInterval() {
        return Duration.ofMillis(Math.max(1, getLongProperty(DEBUG_COMMAND_POLL_MS, DEFAULT_DEBUG_COMMAND_POLL_MS)));
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PROCESS_SHELL, DEFAULT_PROCESS_SHELL);
        properties.setProperty(STEP_RETRY_DELAY_MS, String.valueOf(DEFAULT_STEP_RETRY_DELAY_MS));
        properties.setProperty(PROMPT_TIMEOUT_MS, String.valueOf(DEFAULT_PROMPT_TIMEOUT_MS));
        properties.setProperty(SUBWORKFLOW_MAX_DEPTH, String.valueOf(DEFAULT_SUBWORKFLOW_MAX_DEPTH));
        properties.setProperty(METRICS_ENABLED, "true");
        properties.setProperty(DEBUG_COMMAND_POLL_MS, String.valueOf(DEFAULT_DEBUG_COMMAND_POLL_MS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "runbook.properties",
                "config/runbook.properties",
                System.getProperty("user.home") + "/.runbook/runbook.properties",
                "/etc/runbook/runbook.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("runbook.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("runbook."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "RunbookConfiguration{" +
                "processShell='" + getProcessShell() + '\'' +
                ", stepRetryDelay=" + getStepRetryDelay() +
                ", promptTimeout=" + getPromptTimeout() +
                ", subWorkflowMaxDepth=" + getSubWorkflowMaxDepth() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
