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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lifecycle notification for a single task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskEvent {

    private final TaskEventType type;
    private final String taskId;
    private final Instant timestamp;
    private final int attempt;
    private final String error;
    private final Object result;

    public TaskEvent(TaskEventType type, String taskId, int attempt, String error, Object result) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.taskId = Objects.requireNonNull(taskId, "Task ID cannot be null");
        this.timestamp = Instant.now();
        this.attempt = attempt;
        this.error = error;
        this.result = result;
    }

    public static TaskEvent started(String taskId, int attempt) {
        return new TaskEvent(TaskEventType.STARTED, taskId, attempt, null, null);
    }

    public static TaskEvent completed(String taskId, int attempt, Object result) {
        return new TaskEvent(TaskEventType.COMPLETED, taskId, attempt, null, result);
    }

    public static TaskEvent failed(String taskId, int attempt, String error) {
        return new TaskEvent(TaskEventType.FAILED, taskId, attempt, error, null);
    }

    public static TaskEvent retry(String taskId, int attempt, String error) {
        return new TaskEvent(TaskEventType.RETRY, taskId, attempt, error, null);
    }

    public TaskEventType getType() {
        return type;
    }

    public String getTaskId() {
        return taskId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the attempt number the event belongs to; 0 for a skipped task
     */
    public int getAttempt() {
        return attempt;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Object> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * @return true if this is the FAILED event of a task that never started
     */
    public boolean isSkip() {
        return type == TaskEventType.FAILED && attempt == 0;
    }

    @Override
    public String toString() {
        return type + "(" + taskId + (attempt > 0 ? ", attempt " + attempt : "") +
               (error != null ? ", error=" + error : "") + ")";
    }
}
