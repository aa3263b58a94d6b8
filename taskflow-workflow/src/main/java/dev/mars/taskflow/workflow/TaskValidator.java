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

import java.util.List;
import java.util.Objects;

/**
 * Field-level checks on the tasks of a workflow, run before the dependency graph is
 * built. Bounds come from the engine configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskValidator {

    private final WorkflowEngineConfig config;

    public TaskValidator(WorkflowEngineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * Validates the workflow size and every task's fields.
     *
     * @param tasks the workflow
     * @return every violation found
     */
    public ValidationResult validate(List<Task> tasks) {
        ValidationResult result = new ValidationResult();

        if (tasks == null || tasks.isEmpty()) {
            result.addError("tasks", "Workflow must contain at least one task");
            return result;
        }
        if (tasks.size() > config.getMaxTasks()) {
            result.addError("tasks", "Workflow cannot contain more than " + config.getMaxTasks() +
                    " tasks, got " + tasks.size());
        }

        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task == null) {
                result.addError("tasks[" + i + "]", "Task at position " + i + " is null");
            } else {
                result.merge(validateFields(task, i));
            }
        }
        return result;
    }

    /**
     * Validates a single task.
     *
     * @throws InvalidTaskConfigurationException for the first violated field
     */
    public void validateTask(Task task) throws InvalidTaskConfigurationException {
        Objects.requireNonNull(task, "Task cannot be null");
        ValidationResult result = validateFields(task, 0);
        if (!result.isValid()) {
            throw toException(result.getErrors().get(0));
        }
    }

    /**
     * Validates the workflow and rejects it on any error.
     *
     * @throws WorkflowValidationException carrying every violation; its cause is the first
     *         task-level violation, if any
     */
    public void requireValid(List<Task> tasks) throws WorkflowValidationException {
        ValidationResult result = validate(tasks);
        if (result.isValid()) {
            return;
        }
        InvalidTaskConfigurationException cause = result.getErrors().stream()
                .filter(issue -> issue.getTaskId().isPresent())
                .findFirst()
                .map(TaskValidator::toException)
                .orElse(null);
        throw new WorkflowValidationException(result.getErrors(), cause);
    }

    private ValidationResult validateFields(Task task, int position) {
        ValidationResult result = new ValidationResult();
        String id = task.getId();

        if (id == null || id.isBlank()) {
            result.addError("tasks[" + position + "].id", "Task id is required");
            // nothing else can be attributed to a task without an id
            return result;
        }

        String path = "tasks." + id;
        if (id.length() > config.getMaxTaskIdLength()) {
            result.addTaskError(id, path + ".id",
                    "Task id cannot exceed " + config.getMaxTaskIdLength() + " characters");
        }

        if (task.getWork() == null) {
            result.addTaskError(id, path + ".work", "Task " + id + " has no work to execute");
        }

        task.getRetries().ifPresent(retries -> {
            if (retries < 0 || retries > config.getMaxRetries()) {
                result.addTaskError(id, path + ".retries",
                        "Retries must be between 0 and " + config.getMaxRetries() + ", got " + retries);
            }
        });

        task.getTimeoutMs().ifPresent(timeout -> {
            if (timeout <= 0 || timeout > config.getMaxTimeoutMs()) {
                result.addTaskError(id, path + ".timeoutMs",
                        "Timeout must be between 1 and " + config.getMaxTimeoutMs() + " ms, got " + timeout);
            }
        });

        List<String> dependencies = task.getDependencies();
        if (dependencies.size() > config.getMaxDependenciesPerTask()) {
            result.addTaskError(id, path + ".dependencies",
                    "Task " + id + " cannot have more than " + config.getMaxDependenciesPerTask() + " dependencies");
        }
        for (String dependency : dependencies) {
            if (dependency == null || dependency.isBlank()) {
                result.addTaskError(id, path + ".dependencies", "Dependency ids cannot be blank");
            }
        }

        return result;
    }

    private static InvalidTaskConfigurationException toException(ValidationResult.ValidationIssue issue) {
        return new InvalidTaskConfigurationException(issue.getTaskId().orElse(null), issue.getFieldName(),
                issue.getMessage());
    }
}
