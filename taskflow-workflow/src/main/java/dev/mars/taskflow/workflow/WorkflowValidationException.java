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
import java.util.stream.Collectors;

/**
 * Thrown when a workflow is rejected before any of its tasks run.
 * Holds every validation error that was found and, when the rejection was caused by
 * a dependency cycle, the cycle path (e.g. {@code a -> b -> a}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowValidationException extends WorkflowException {

    private final List<ValidationResult.ValidationIssue> issues;
    private final List<String> cyclePath;

    public WorkflowValidationException(String message) {
        this(message, List.of(), List.of(), null);
    }

    public WorkflowValidationException(List<ValidationResult.ValidationIssue> issues) {
        this(buildMessage(issues), issues, List.of(), null);
    }

    public WorkflowValidationException(List<ValidationResult.ValidationIssue> issues, Throwable cause) {
        this(buildMessage(issues), issues, List.of(), cause);
    }

    public WorkflowValidationException(List<ValidationResult.ValidationIssue> issues, List<String> cyclePath) {
        this(buildMessage(issues), issues, cyclePath, null);
    }

    private WorkflowValidationException(String message, List<ValidationResult.ValidationIssue> issues,
                                        List<String> cyclePath, Throwable cause) {
        super(WorkflowErrorCode.WORKFLOW_VALIDATION, null, message, cause);
        this.issues = List.copyOf(issues != null ? issues : List.of());
        this.cyclePath = List.copyOf(cyclePath != null ? cyclePath : List.of());
    }

    public List<ValidationResult.ValidationIssue> getIssues() {
        return issues;
    }

    /**
     * @return the ids along the detected cycle, first id repeated at the end; empty if
     *         the workflow was rejected for another reason
     */
    public List<String> getCyclePath() {
        return cyclePath;
    }

    public boolean hasCycle() {
        return !cyclePath.isEmpty();
    }

    private static String buildMessage(List<ValidationResult.ValidationIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return "Workflow validation failed";
        }
        return "Workflow validation failed: " + issues.stream()
                .map(ValidationResult.ValidationIssue::getMessage)
                .collect(Collectors.joining("; "));
    }
}
