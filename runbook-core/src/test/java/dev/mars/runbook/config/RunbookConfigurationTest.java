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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RunbookConfigurationTest {

    @Test
    void testDefaults() {
        RunbookConfiguration config = new RunbookConfiguration(new Properties());

        assertEquals("/bin/sh", config.getProcessShell());
        assertEquals(Duration.ofSeconds(1), config.getStepRetryDelay());
        assertEquals(Duration.ZERO, config.getPromptTimeout());
        assertEquals(8, config.getSubWorkflowMaxDepth());
        assertTrue(config.isMetricsEnabled());
        assertEquals(Duration.ofMillis(250), config.getDebugCommandPollInterval());
    }

    @Test
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty(RunbookConfiguration.PROCESS_SHELL, "/bin/bash");
        props.setProperty(RunbookConfiguration.STEP_RETRY_DELAY_MS, "10");
        props.setProperty(RunbookConfiguration.PROMPT_TIMEOUT_MS, "5000");
        props.setProperty(RunbookConfiguration.SUBWORKFLOW_MAX_DEPTH, "2");
        props.setProperty(RunbookConfiguration.METRICS_ENABLED, "false");

        RunbookConfiguration config = new RunbookConfiguration(props);

        assertEquals("/bin/bash", config.getProcessShell());
        assertEquals(Duration.ofMillis(10), config.getStepRetryDelay());
        assertEquals(Duration.ofSeconds(5), config.getPromptTimeout());
        assertEquals(2, config.getSubWorkflowMaxDepth());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(RunbookConfiguration.SUBWORKFLOW_MAX_DEPTH, "deep");
        props.setProperty(RunbookConfiguration.STEP_RETRY_DELAY_MS, "soon");

        RunbookConfiguration config = new RunbookConfiguration(props);

        assertEquals(8, config.getSubWorkflowMaxDepth());
        assertEquals(Duration.ofSeconds(1), config.getStepRetryDelay());
    }

    @Test
    void testNegativeDurationsClampToZero() {
        Properties props = new Properties();
        props.setProperty(RunbookConfiguration.PROMPT_TIMEOUT_MS, "-5");

        assertEquals(Duration.ZERO, new RunbookConfiguration(props).getPromptTimeout());
    }

    @Test
    void testSetProperty() {
        RunbookConfiguration config = new RunbookConfiguration(new Properties());
        config.setProperty("runbook.custom", "value");

        assertEquals("value", config.getProperty("runbook.custom"));
        assertEquals("fallback", config.getProperty("runbook.missing", "fallback"));
    }
}
