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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one node of a workflow: its id, its work and the ids of the
 * tasks it depends on. Retries and timeout are optional; when absent the engine applies
 * its configured defaults.
 *
 * <p>The builder performs no validation. Bounds are checked by the engine's
 * {@link TaskValidator} so that every problem in a workflow is reported at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class Task {

    private final String id;
    private final TaskWork<?> work;
    private final List<String> dependencies;
    private final Integer retries;
    private final Long timeoutMs;

    private Task(Builder builder) {
        this.id = builder.id;
        this.work = builder.work;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(builder.dependencies));
        this.retries = builder.retries;
        this.timeoutMs = builder.timeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public String getId() {
        return id;
    }

    public TaskWork<?> getWork() {
        return work;
    }

    /**
     * @return dependency ids in declaration order, without duplicates
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public Optional<Integer> getRetries() {
        return Optional.ofNullable(retries);
    }

    public Optional<Long> getTimeoutMs() {
        return Optional.ofNullable(timeoutMs);
    }

    @Override
    public String toString() {
        return "Task{" +
               "id='" + id + '\'' +
               ", dependencies=" + dependencies +
               ", retries=" + retries +
               ", timeoutMs=" + timeoutMs +
               '}';
    }

    public static class Builder {
        private String id;
        private TaskWork<?> work;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private Integer retries;
        private Long timeoutMs;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public <T> Builder work(TaskWork<T> work) {
            this.work = work;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            if (taskIds != null) {
                dependencies.addAll(Arrays.asList(taskIds));
            }
            return this;
        }

        public Builder dependencies(Collection<String> taskIds) {
            if (taskIds != null) {
                dependencies.addAll(taskIds);
            }
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
