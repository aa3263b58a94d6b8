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

package dev.mars.taskflow.workflow;

import dev.mars.taskflow.config.TaskflowConfiguration;

import java.util.Objects;

/**
 * Immutable settings of a workflow engine: task defaults, concurrency, execution mode
 * and validation bounds. The engine reads nothing from the environment; use
 * {@link #from(TaskflowConfiguration)} to build one from the configuration layer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowEngineConfig {

    private final long defaultTimeoutMs;
    private final int defaultRetries;
    private final int maxConcurrentTasks;
    private final long retryDelayMs;
    private final ExecutionMode executionMode;
    private final long maxTimeoutMs;
    private final int maxRetries;
    private final int maxTaskIdLength;
    private final int maxDependenciesPerTask;
    private final int maxTasks;
    private final boolean metricsEnabled;

    private WorkflowEngineConfig(Builder builder) {
        this.defaultTimeoutMs = builder.defaultTimeoutMs;
        this.defaultRetries = builder.defaultRetries;
        this.maxConcurrentTasks = builder.maxConcurrentTasks;
        this.retryDelayMs = builder.retryDelayMs;
        this.executionMode = builder.executionMode;
        this.maxTimeoutMs = builder.maxTimeoutMs;
        this.maxRetries = builder.maxRetries;
        this.maxTaskIdLength = builder.maxTaskIdLength;
        this.maxDependenciesPerTask = builder.maxDependenciesPerTask;
        this.maxTasks = builder.maxTasks;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkflowEngineConfig defaults() {
        return builder().build();
    }

    /**
     * Adapts the properties-based configuration.
     *
     * @throws IllegalArgumentException if a configured value is out of range or the
     *         execution mode is unknown
     */
    public static WorkflowEngineConfig from(TaskflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return builder()
                .defaultTimeoutMs(configuration.getDefaultTimeoutMs())
                .defaultRetries(configuration.getDefaultRetries())
                .maxConcurrentTasks(configuration.getMaxConcurrentTasks())
                .retryDelayMs(configuration.getRetryDelayMs())
                .executionMode(ExecutionMode.fromString(configuration.getExecutionMode()))
                .maxTimeoutMs(configuration.getMaxTimeoutMs())
                .maxRetries(configuration.getMaxRetries())
                .maxTaskIdLength(configuration.getMaxTaskIdLength())
                .maxDependenciesPerTask(configuration.getMaxDependenciesPerTask())
                .maxTasks(configuration.getMaxTasks())
                .metricsEnabled(configuration.isMetricsEnabled())
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .defaultTimeoutMs(defaultTimeoutMs)
                .defaultRetries(defaultRetries)
                .maxConcurrentTasks(maxConcurrentTasks)
                .retryDelayMs(retryDelayMs)
                .executionMode(executionMode)
                .maxTimeoutMs(maxTimeoutMs)
                .maxRetries(maxRetries)
                .maxTaskIdLength(maxTaskIdLength)
                .maxDependenciesPerTask(maxDependenciesPerTask)
                .maxTasks(maxTasks)
                .metricsEnabled(metricsEnabled);
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public int getDefaultRetries() {
        return defaultRetries;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    public long getMaxTimeoutMs() {
        return maxTimeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxTaskIdLength() {
        return maxTaskIdLength;
    }

    public int getMaxDependenciesPerTask() {
        return maxDependenciesPerTask;
    }

    public int getMaxTasks() {
        return maxTasks;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public String toString() {
        return "WorkflowEngineConfig{" +
               "defaultTimeoutMs=" + defaultTimeoutMs +
               ", defaultRetries=" + defaultRetries +
               ", maxConcurrentTasks=" + maxConcurrentTasks +
               ", retryDelayMs=" + retryDelayMs +
               ", executionMode=" + executionMode +
               ", maxTimeoutMs=" + maxTimeoutMs +
               ", maxRetries=" + maxRetries +
               ", metricsEnabled=" + metricsEnabled +
               '}';
    }

    public static class Builder {
        private long defaultTimeoutMs = 30000;
        private int defaultRetries = 3;
        private int maxConcurrentTasks = 10;
        private long retryDelayMs = 100;
        private ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;
        private long maxTimeoutMs = 300000;
        private int maxRetries = 10;
        private int maxTaskIdLength = 100;
        private int maxDependenciesPerTask = 10;
        private int maxTasks = 100;
        private boolean metricsEnabled = true;

        public Builder defaultTimeoutMs(long defaultTimeoutMs) {
            this.defaultTimeoutMs = defaultTimeoutMs;
            return this;
        }

        public Builder defaultRetries(int defaultRetries) {
            this.defaultRetries = defaultRetries;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder executionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public Builder maxTimeoutMs(long maxTimeoutMs) {
            this.maxTimeoutMs = maxTimeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxTaskIdLength(int maxTaskIdLength) {
            this.maxTaskIdLength = maxTaskIdLength;
            return this;
        }

        public Builder maxDependenciesPerTask(int maxDependenciesPerTask) {
            this.maxDependenciesPerTask = maxDependenciesPerTask;
            return this;
        }

        public Builder maxTasks(int maxTasks) {
            this.maxTasks = maxTasks;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public WorkflowEngineConfig build() {
            Objects.requireNonNull(executionMode, "Execution mode cannot be null");
            requireAtLeast("maxTimeoutMs", maxTimeoutMs, 1);
            requireAtLeast("maxRetries", maxRetries, 0);
            requireAtLeast("maxTaskIdLength", maxTaskIdLength, 1);
            requireAtLeast("maxDependenciesPerTask", maxDependenciesPerTask, 0);
            requireAtLeast("maxTasks", maxTasks, 1);
            requireAtLeast("maxConcurrentTasks", maxConcurrentTasks, 1);
            requireAtLeast("retryDelayMs", retryDelayMs, 0);
            if (defaultTimeoutMs < 1 || defaultTimeoutMs > maxTimeoutMs) {
                throw new IllegalArgumentException("defaultTimeoutMs must be between 1 and " + maxTimeoutMs +
                        ", got " + defaultTimeoutMs);
            }
            if (defaultRetries < 0 || defaultRetries > maxRetries) {
                throw new IllegalArgumentException("defaultRetries must be between 0 and " + maxRetries +
                        ", got " + defaultRetries);
            }
            return new WorkflowEngineConfig(this);
        }

        private static void requireAtLeast(String name, long value, long minimum) {
            if (value < minimum) {
                throw new IllegalArgumentException(name + " must be at least " + minimum + ", got " + value);
            }
        }
    }
}
