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
 * Raised for a task whose own fields are out of bounds (blank id, too many retries,
 * a non-positive timeout and so on). The engine reports it as the cause of the
 * {@link WorkflowValidationException} that rejects the run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class InvalidTaskConfigurationException extends WorkflowException {

    private final String field;

    public InvalidTaskConfigurationException(String taskId, String field, String message) {
        super(WorkflowErrorCode.INVALID_TASK_CONFIGURATION, taskId, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
