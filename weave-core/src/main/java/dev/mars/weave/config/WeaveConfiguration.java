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

package dev.mars.weave.config;

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
 * Configuration management for the Weave engine.
 * Values are resolved from built-in defaults, then the first readable
 * {@code weave.properties} file (or classpath resource), then {@code weave.*}
 * system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WeaveConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(WeaveConfiguration.class);

    public static final String TASK_MAX_RETRIES = "weave.task.max.retries";
    public static final String TASK_RETRY_DELAY_MS = "weave.task.retry.delay.ms";
    public static final String TASK_TIMEOUT_MS = "weave.task.timeout.ms";
    public static final String AI_DEFAULT_TEMPERATURE = "weave.ai.default.temperature";
    public static final String AI_DEFAULT_MAX_TOKENS = "weave.ai.default.max.tokens";
    public static final String CHECKPOINT_ENABLED = "weave.workflow.checkpoint.enabled";
    public static final String CHECKPOINT_MAX = "weave.workflow.checkpoint.max";
    public static final String WORKFLOW_MAX_DURATION_MS = "weave.workflow.max.duration.ms";
    public static final String ENGINE_WORKER_THREADS = "weave.engine.worker.threads";
    public static final String SWEEPER_ENABLED = "weave.sweeper.enabled";
    public static final String SWEEPER_INTERVAL_MS = "weave.sweeper.interval.ms";
    public static final String SWEEPER_RETENTION_MS = "weave.sweeper.retention.ms";
    public static final String SWEEPER_INCLUDE_CANCELLED = "weave.sweeper.include.cancelled";
    public static final String METRICS_ENABLED = "weave.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_TASK_TIMEOUT_MS = 0; // no timeout
    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_TOKENS = 1000;
    private static final int DEFAULT_MAX_CHECKPOINTS = 50;
    private static final long DEFAULT_MAX_DURATION_MS = 3600000; // 1 hour
    private static final int DEFAULT_WORKER_THREADS = 8;
    private static final long DEFAULT_SWEEP_INTERVAL_MS = 60000;
    private static final long DEFAULT_RETENTION_MS = 3600000;

    private final Properties properties;

    public WeaveConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public WeaveConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Task execution
    public int getMaxRetries() {
        return getIntProperty(TASK_MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public Duration getRetryDelay() {
        return Duration.ofMillis(getLongProperty(TASK_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS));
    }

    /**
     * Per-attempt timeout applied to tasks that do not declare their own.
     * {@link Duration#ZERO} means attempts are not timed out.
     */
    public Duration getTaskTimeout() {
        return Duration.ofMillis(getLongProperty(TASK_TIMEOUT_MS, DEFAULT_TASK_TIMEOUT_MS));
    }

    public double getDefaultTemperature() {
        return getDoubleProperty(AI_DEFAULT_TEMPERATURE, DEFAULT_TEMPERATURE);
    }

    public int getDefaultMaxTokens() {
        return getIntProperty(AI_DEFAULT_MAX_TOKENS, DEFAULT_MAX_TOKENS);
    }

    // Workflow execution
    public boolean isCheckpointingEnabled() {
        return getBooleanProperty(CHECKPOINT_ENABLED, true);
    }

    public int getMaxCheckpoints() {
        return getIntProperty(CHECKPOINT_MAX, DEFAULT_MAX_CHECKPOINTS);
    }

    public Duration getMaxWorkflowDuration() {
        return Duration.ofMillis(getLongProperty(WORKFLOW_MAX_DURATION_MS, DEFAULT_MAX_DURATION_MS));
    }

    public int getWorkerThreads() {
        return getIntProperty(ENGINE_WORKER_THREADS, DEFAULT_WORKER_THREADS);
    }

    // Sweeper
    public boolean isSweeperEnabled() {
        return getBooleanProperty(SWEEPER_ENABLED, true);
    }

    public Duration getSweepInterval() {
        return Duration.ofMillis(getLongProperty(SWEEPER_INTERVAL_MS, DEFAULT_SWEEP_INTERVAL_MS));
    }

    public Duration getRetention() {
        return Duration.ofMillis(getLongProperty(SWEEPER_RETENTION_MS, DEFAULT_RETENTION_MS));
    }

    public boolean isSweepCancelled() {
        return getBooleanProperty(SWEEPER_INCLUDE_CANCELLED, true);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
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

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
        properties.setProperty(TASK_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(TASK_RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(TASK_TIMEOUT_MS, String.valueOf(DEFAULT_TASK_TIMEOUT_MS));
        properties.setProperty(AI_DEFAULT_TEMPERATURE, String.valueOf(DEFAULT_TEMPERATURE));
        properties.setProperty(AI_DEFAULT_MAX_TOKENS, String.valueOf(DEFAULT_MAX_TOKENS));
        properties.setProperty(CHECKPOINT_ENABLED, "true");
        properties.setProperty(CHECKPOINT_MAX, String.valueOf(DEFAULT_MAX_CHECKPOINTS));
        properties.setProperty(WORKFLOW_MAX_DURATION_MS, String.valueOf(DEFAULT_MAX_DURATION_MS));
        properties.setProperty(ENGINE_WORKER_THREADS, String.valueOf(DEFAULT_WORKER_THREADS));
        properties.setProperty(SWEEPER_ENABLED, "true");
        properties.setProperty(SWEEPER_INTERVAL_MS, String.valueOf(DEFAULT_SWEEP_INTERVAL_MS));
        properties.setProperty(SWEEPER_RETENTION_MS, String.valueOf(DEFAULT_RETENTION_MS));
        properties.setProperty(SWEEPER_INCLUDE_CANCELLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "weave.properties",
                "config/weave.properties",
                System.getProperty("user.home") + "/.weave/weave.properties",
                "/etc/weave/weave.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("weave.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("weave."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "WeaveConfiguration{" +
                "maxRetries=" + getMaxRetries() +
                ", retryDelay=" + getRetryDelay() +
                ", checkpointing=" + isCheckpointingEnabled() +
                ", maxWorkflowDuration=" + getMaxWorkflowDuration() +
                ", sweepInterval=" + getSweepInterval() +
                '}';
    }
}
