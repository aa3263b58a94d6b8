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

import dev.mars.taskflow.core.exceptions.TaskflowException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Base exception for workflow validation and task execution failures.
 * Carries a {@link WorkflowErrorCode}, the id of the task involved where there is one,
 * and the time the failure was raised.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowException extends TaskflowException {

    private final WorkflowErrorCode errorCode;
    private final String taskId;
    private final Instant timestamp;

    public WorkflowException(WorkflowErrorCode errorCode, String message) {
        this(errorCode, null, message, null);
    }

    public WorkflowException(WorkflowErrorCode errorCode, String taskId, String message) {
        this(errorCode, taskId, message, null);
    }

    public WorkflowException(WorkflowErrorCode errorCode, String taskId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
        this.taskId = taskId;
        this.timestamp = Instant.now();
    }

    public WorkflowErrorCode getErrorCode() {
        return errorCode;
    }

    public Optional<String> getTaskId() {
        return Optional.ofNullable(taskId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
