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

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single task attempt: either a payload or the cause of the failure.
 */
public final class TaskOutcome {

    private final boolean success;
    private final Object result;
    private final Throwable cause;

    private TaskOutcome(boolean success, Object result, Throwable cause) {
        this.success = success;
        this.result = result;
        this.cause = cause;
    }

    public static TaskOutcome success(Object result) {
        return new TaskOutcome(true, result, null);
    }

    public static TaskOutcome failure(Throwable cause) {
        return new TaskOutcome(false, null, Objects.requireNonNull(cause, "Failure cause cannot be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<Object> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * @return the failure code; {@link WorkflowErrorCode#TASK_EXECUTION} for any cause that
     *         is not a {@link WorkflowException}
     */
    public Optional<WorkflowErrorCode> getErrorCode() {
        if (success) {
            return Optional.empty();
        }
        if (cause instanceof WorkflowException) {
            return Optional.of(((WorkflowException) cause).getErrorCode());
        }
        return Optional.of(WorkflowErrorCode.TASK_EXECUTION);
    }

    /**
     * @return the cause's message, or its class name when it has none
     */
    public Optional<String> getErrorMessage() {
        if (success) {
            return Optional.empty();
        }
        String message = cause.getMessage();
        return Optional.of(message != null && !message.isBlank() ? message : cause.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return success ? "TaskOutcome{success, result=" + result + '}'
                       : "TaskOutcome{failure, error=" + getErrorMessage().orElse("") + '}';
    }
}
