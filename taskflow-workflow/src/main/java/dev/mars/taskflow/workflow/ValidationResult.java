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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Collected outcome of a validation pass over a workflow. Any error rejects the workflow.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;

    public ValidationResult() {
        this.errors = new ArrayList<>();
    }

    public void addError(String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, null, null, message));
    }

    public void addError(String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, null, fieldPath, message));
    }

    public void addTaskError(String taskId, String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, taskId, fieldPath, message));
    }

    /**
     * Appends every issue of another result to this one.
     */
    public void merge(ValidationResult other) {
        errors.addAll(other.errors);
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String taskId;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String taskId, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.taskId = taskId;
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        /**
         * @return the task the issue belongs to; empty for workflow-level issues
         */
        public Optional<String> getTaskId() {
            return Optional.ofNullable(taskId);
        }

        public String getFieldPath() {
            return fieldPath;
        }

        /**
         * @return the last segment of the field path, e.g. {@code retries} for
         *         {@code tasks.fetch.retries}
         */
        public String getFieldName() {
            if (fieldPath == null) {
                return null;
            }
            int lastDot = fieldPath.lastIndexOf('.');
            return lastDot >= 0 ? fieldPath.substring(lastDot + 1) : fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(taskId, that.taskId) &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, taskId, fieldPath, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name());

            if (fieldPath != null) {
                sb.append(" [").append(fieldPath).append("]");
            }

            sb.append(": ").append(message);

            return sb.toString();
        }
    }
}
