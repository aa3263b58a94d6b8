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

/**
 * Classifies workflow failures. Validation codes abort a run before any task
 * executes; the execution codes are recovered by the retry loop and only surface
 * in a task's state once its retries are exhausted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum WorkflowErrorCode {

    WORKFLOW_VALIDATION("Workflow validation failed"),

    INVALID_TASK_CONFIGURATION("Invalid task configuration"),

    TASK_TIMEOUT("Task timed out"),

    CONCURRENT_EXECUTION("Concurrent execution limit reached"),

    TASK_EXECUTION("Task execution failed");

    private final String description;

    WorkflowErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true if this code describes a problem detected before execution
     */
    public boolean isValidationError() {
        return this == WORKFLOW_VALIDATION || this == INVALID_TASK_CONFIGURATION;
    }
}
