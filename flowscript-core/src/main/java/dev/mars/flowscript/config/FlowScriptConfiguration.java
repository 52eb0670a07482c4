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
 * Configuration for the FlowScript executor.
 * Values are layered: built-in defaults, then the first readable {@code flowscript.properties}
 * (file system locations before the classpath), then {@code flowscript.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FlowScriptConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowScriptConfiguration.class);

    public static final String PREFIX = "flowscript.";
    public static final String RETRY_BACKOFF_MS = "flowscript.executor.retry.backoff.ms";
    public static final String TIMEOUT_ENFORCED = "flowscript.executor.timeout.enforced";
    public static final String WORKER_THREADS = "flowscript.executor.worker.threads";
    public static final String METRICS_ENABLED = "flowscript.monitoring.metrics.enabled";

    private static final long DEFAULT_RETRY_BACKOFF_MS = 1000;
    private static final boolean DEFAULT_TIMEOUT_ENFORCED = false;
    private static final int DEFAULT_WORKER_THREADS = 0;
    private static final boolean DEFAULT_METRICS_ENABLED = true;

    private final Properties properties;

    public FlowScriptConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowScriptConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Executor
    public long getRetryBackoffMs() {
        long value = getLongProperty(RETRY_BACKOFF_MS, DEFAULT_RETRY_BACKOFF_MS);
        if (value < 0) {
            logger.warn("Negative value for property {}: {}. Using default: {}",
                    RETRY_BACKOFF_MS, value, DEFAULT_RETRY_BACKOFF_MS);
            return DEFAULT_RETRY_BACKOFF_MS;
        }
        return value;
    }

    public Duration getRetryBackoff() {
        return Duration.ofMillis(getRetryBackoffMs());
    }

    public boolean isTimeoutEnforced() {
        return getBooleanProperty(TIMEOUT_ENFORCED, DEFAULT_TIMEOUT_ENFORCED);
    }

    /**
     * @return fixed worker pool size for asynchronous flows, or 0 for a cached pool
     */
    public int getWorkerThreads() {
        return Math.max(0, getIntProperty(WORKER_THREADS, DEFAULT_WORKER_THREADS));
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, DEFAULT_METRICS_ENABLED);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
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
        properties.setProperty(RETRY_BACKOFF_MS, String.valueOf(DEFAULT_RETRY_BACKOFF_MS));
        properties.setProperty(TIMEOUT_ENFORCED, String.valueOf(DEFAULT_TIMEOUT_ENFORCED));
        properties.setProperty(WORKER_THREADS, String.valueOf(DEFAULT_WORKER_THREADS));
        properties.setProperty(METRICS_ENABLED, String.valueOf(DEFAULT_METRICS_ENABLED));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowscript.properties",
                "config/flowscript.properties",
                System.getProperty("user.home") + "/.flowscript/flowscript.properties",
                "/etc/flowscript/flowscript.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("flowscript.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowScriptConfiguration{" +
                "retryBackoffMs=" + getRetryBackoffMs() +
                ", timeoutEnforced=" + isTimeoutEnforced() +
                ", workerThreads=" + getWorkerThreads() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
