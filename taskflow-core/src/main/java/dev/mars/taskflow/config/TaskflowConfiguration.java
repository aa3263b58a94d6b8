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

package dev.mars.taskflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for Taskflow.
 * Loads engine defaults, then {@code taskflow.properties} from the file system or
 * classpath, then {@code taskflow.*} system properties, each layer overriding the last.
 *
 * <p>The workflow engine never reads this class directly; it is adapted into the
 * engine's own immutable config by the workflow module.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskflowConfiguration {
    private static final Logger logger = Logger.getLogger(TaskflowConfiguration.class.getName());

    public static final String DEFAULT_TIMEOUT_MS_KEY = "taskflow.task.timeout.default.ms";
    public static final String DEFAULT_RETRIES_KEY = "taskflow.task.retries.default";
    public static final String MAX_CONCURRENT_TASKS_KEY = "taskflow.engine.max.concurrent";
    public static final String RETRY_DELAY_MS_KEY = "taskflow.task.retry.delay.ms";
    public static final String EXECUTION_MODE_KEY = "taskflow.engine.execution.mode";
    public static final String MAX_TIMEOUT_MS_KEY = "taskflow.validation.timeout.max.ms";
    public static final String MAX_RETRIES_KEY = "taskflow.validation.retries.max";
    public static final String MAX_TASK_ID_LENGTH_KEY = "taskflow.validation.task.id.max.length";
    public static final String MAX_DEPENDENCIES_KEY = "taskflow.validation.dependencies.max";
    public static final String MAX_TASKS_KEY = "taskflow.validation.tasks.max";
    public static final String METRICS_ENABLED_KEY = "taskflow.monitoring.metrics.enabled";

    // Default configuration values
    private static final long DEFAULT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_RETRIES = 3;
    private static final int DEFAULT_MAX_CONCURRENT_TASKS = 10;
    private static final long DEFAULT_RETRY_DELAY_MS = 100;
    private static final String DEFAULT_EXECUTION_MODE = "SEQUENTIAL";
    private static final long DEFAULT_MAX_TIMEOUT_MS = 300000; // 5 minutes
    private static final int DEFAULT_MAX_RETRIES = 10;
    private static final int DEFAULT_MAX_TASK_ID_LENGTH = 100;
    private static final int DEFAULT_MAX_DEPENDENCIES = 10;
    private static final int DEFAULT_MAX_TASKS = 100;

    private final Properties properties;

    public TaskflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public TaskflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Loads configuration from an explicit properties file on top of the defaults.
     * System properties are not consulted.
     *
     * @param configFile the properties file to read
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static TaskflowConfiguration fromFile(Path configFile) throws IOException {
        Properties loaded = new Properties();
        try (InputStream input = Files.newInputStream(configFile)) {
            loaded.load(input);
        }
        logger.info("Loaded configuration from: " + configFile);
        return new TaskflowConfiguration(loaded);
    }

    // Task defaults
    public long getDefaultTimeoutMs() {
        return getLongProperty(DEFAULT_TIMEOUT_MS_KEY, DEFAULT_TIMEOUT_MS);
    }

    public int getDefaultRetries() {
        return getIntProperty(DEFAULT_RETRIES_KEY, DEFAULT_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS_KEY, DEFAULT_RETRY_DELAY_MS);
    }

    // Engine configuration
    public int getMaxConcurrentTasks() {
        return getIntProperty(MAX_CONCURRENT_TASKS_KEY, DEFAULT_MAX_CONCURRENT_TASKS);
    }

    public String getExecutionMode() {
        return getStringProperty(EXECUTION_MODE_KEY, DEFAULT_EXECUTION_MODE).trim().toUpperCase();
    }

    // Validation bounds
    public long getMaxTimeoutMs() {
        return getLongProperty(MAX_TIMEOUT_MS_KEY, DEFAULT_MAX_TIMEOUT_MS);
    }

    public int getMaxRetries() {
        return getIntProperty(MAX_RETRIES_KEY, DEFAULT_MAX_RETRIES);
    }

    public int getMaxTaskIdLength() {
        return getIntProperty(MAX_TASK_ID_LENGTH_KEY, DEFAULT_MAX_TASK_ID_LENGTH);
    }

    public int getMaxDependenciesPerTask() {
        return getIntProperty(MAX_DEPENDENCIES_KEY, DEFAULT_MAX_DEPENDENCIES);
    }

    public int getMaxTasks() {
        return getIntProperty(MAX_TASKS_KEY, DEFAULT_MAX_TASKS);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, true);
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
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
        properties.setProperty(DEFAULT_TIMEOUT_MS_KEY, String.valueOf(DEFAULT_TIMEOUT_MS));
        properties.setProperty(DEFAULT_RETRIES_KEY, String.valueOf(DEFAULT_RETRIES));
        properties.setProperty(MAX_CONCURRENT_TASKS_KEY, String.valueOf(DEFAULT_MAX_CONCURRENT_TASKS));
        properties.setProperty(RETRY_DELAY_MS_KEY, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(EXECUTION_MODE_KEY, DEFAULT_EXECUTION_MODE);
        properties.setProperty(MAX_TIMEOUT_MS_KEY, String.valueOf(DEFAULT_MAX_TIMEOUT_MS));
        properties.setProperty(MAX_RETRIES_KEY, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(MAX_TASK_ID_LENGTH_KEY, String.valueOf(DEFAULT_MAX_TASK_ID_LENGTH));
        properties.setProperty(MAX_DEPENDENCIES_KEY, String.valueOf(DEFAULT_MAX_DEPENDENCIES));
        properties.setProperty(MAX_TASKS_KEY, String.valueOf(DEFAULT_MAX_TASKS));
        properties.setProperty(METRICS_ENABLED_KEY, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "taskflow.properties",
                "config/taskflow.properties",
                System.getProperty("user.home") + "/.taskflow/taskflow.properties",
                "/etc/taskflow/taskflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("taskflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("taskflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TaskflowConfiguration{" +
                "defaultTimeoutMs=" + getDefaultTimeoutMs() +
                ", defaultRetries=" + getDefaultRetries() +
                ", maxConcurrentTasks=" + getMaxConcurrentTasks() +
                ", retryDelayMs=" + getRetryDelayMs() +
                ", executionMode=" + getExecutionMode() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
