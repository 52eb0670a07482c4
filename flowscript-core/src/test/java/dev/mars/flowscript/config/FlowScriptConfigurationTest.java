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


package dev.mars.flowscript.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FlowScriptConfiguration.
 * Validates defaults, overrides, type conversion and fallback on invalid values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class FlowScriptConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS);
        System.clearProperty(FlowScriptConfiguration.TIMEOUT_ENFORCED);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        FlowScriptConfiguration config = new FlowScriptConfiguration(new Properties());
        assertEquals(1000, config.getRetryBackoffMs());
        assertEquals(Duration.ofSeconds(1), config.getRetryBackoff());
        assertFalse(config.isTimeoutEnforced());
        assertEquals(0, config.getWorkerThreads());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testNullPropertiesUseDefaults() {
        FlowScriptConfiguration config = new FlowScriptConfiguration(null);
        assertEquals(1000, config.getRetryBackoffMs());
    }

    // ========== Override Tests ==========

    @Test
    void testExplicitProperties() {
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "25");
        properties.setProperty(FlowScriptConfiguration.TIMEOUT_ENFORCED, "true");
        properties.setProperty(FlowScriptConfiguration.WORKER_THREADS, "4");
        properties.setProperty(FlowScriptConfiguration.METRICS_ENABLED, "false");

        FlowScriptConfiguration config = new FlowScriptConfiguration(properties);

        assertEquals(25, config.getRetryBackoffMs());
        assertTrue(config.isTimeoutEnforced());
        assertEquals(4, config.getWorkerThreads());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "10");
        System.setProperty(FlowScriptConfiguration.TIMEOUT_ENFORCED, "true");

        FlowScriptConfiguration config = new FlowScriptConfiguration();

        assertEquals(10, config.getRetryBackoffMs());
        assertTrue(config.isTimeoutEnforced());
    }

    @Test
    void testSetProperty() {
        FlowScriptConfiguration config = new FlowScriptConfiguration(new Properties());
        config.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "5");
        assertEquals(5, config.getRetryBackoffMs());
        assertEquals("5", config.getProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS));
        assertEquals("fallback", config.getProperty("flowscript.unknown", "fallback"));
    }

    // ========== Invalid Value Tests ==========

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "fast");
        properties.setProperty(FlowScriptConfiguration.WORKER_THREADS, "many");

        FlowScriptConfiguration config = new FlowScriptConfiguration(properties);

        assertEquals(1000, config.getRetryBackoffMs());
        assertEquals(0, config.getWorkerThreads());
    }

    @Test
    void testNegativeValuesAreRejected() {
        Properties properties = new Properties();
        properties.setProperty(FlowScriptConfiguration.RETRY_BACKOFF_MS, "-5");
        properties.setProperty(FlowScriptConfiguration.WORKER_THREADS, "-2");

        FlowScriptConfiguration config = new FlowScriptConfiguration(properties);

        assertEquals(1000, config.getRetryBackoffMs());
        assertEquals(0, config.getWorkerThreads());
    }
}
