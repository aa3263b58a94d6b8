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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Aggregated outcome of one workflow run, created when every task has reached a
 * terminal state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowResult {

    private final WorkflowStatus status;
    private final Map<String, TaskState> tasks;
    private final Instant startTime;
    private final Instant endTime;
    private final int completedTasks;
    private final int failedTasks;
    private final int skippedTasks;

    public WorkflowResult(Map<String, TaskState> tasks, Instant startTime, Instant endTime) {
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tasks, "Tasks cannot be null")));
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
        this.completedTasks = count(TaskStatus.COMPLETED);
        this.failedTasks = count(TaskStatus.FAILED);
        this.skippedTasks = count(TaskStatus.SKIPPED);
        this.status = failedTasks > 0 ? WorkflowStatus.FAILED : WorkflowStatus.COMPLETED;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    /**
     * @return task states keyed by id, in input order
     */
    public Map<String, TaskState> getTasks() {
        return tasks;
    }

    public Optional<TaskState> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * @return ids of the tasks that ended in the given status, in input order
     */
    public List<String> getTaskIds(TaskStatus taskStatus) {
        return tasks.values().stream()
                .filter(state -> state.getStatus() == taskStatus)
                .map(TaskState::getId)
                .collect(Collectors.toList());
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public long getDurationMs() {
        return getDuration().toMillis();
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    public int getFailedTasks() {
        return failedTasks;
    }

    public int getSkippedTasks() {
        return skippedTasks;
    }

    public int getTotalTasks() {
        return tasks.size();
    }

    private int count(TaskStatus taskStatus) {
        return (int) tasks.values().stream().filter(state -> state.getStatus() == taskStatus).count();
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
               "status=" + status +
               ", total=" + getTotalTasks() +
               ", completed=" + completedTasks +
               ", failed=" + failedTasks +
               ", skipped=" + skippedTasks +
               ", durationMs=" + getDurationMs() +
               '}';
    }
}
