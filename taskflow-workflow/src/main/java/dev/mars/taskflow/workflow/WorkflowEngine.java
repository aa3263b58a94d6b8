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
import java.util.concurrent.CompletableFuture;

/**
 * Interface for running workflows of dependent tasks.
 * Validation problems are reported by exception before any task runs; task failures
 * never throw and are reported through the returned {@link WorkflowResult}.
 */
public interface WorkflowEngine {

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param tasks the tasks of the workflow
     * @return the result once every task is terminal
     * @throws WorkflowValidationException if the workflow is rejected; no task has run
     */
    WorkflowResult run(List<Task> tasks) throws WorkflowValidationException;

    /**
     * Runs a workflow, publishing lifecycle events to the given publisher.
     *
     * @param tasks the tasks of the workflow
     * @param publisher the publisher for this run's events
     * @return the result once every task is terminal
     * @throws WorkflowValidationException if the workflow is rejected; no task has run
     */
    WorkflowResult run(List<Task> tasks, TaskEventPublisher publisher) throws WorkflowValidationException;

    /**
     * Runs a workflow on the engine's worker pool.
     *
     * @param tasks the tasks of the workflow
     * @return future of the result; completes exceptionally with a
     *         {@link WorkflowValidationException} if the workflow is rejected
     */
    CompletableFuture<WorkflowResult> runAsync(List<Task> tasks);

    CompletableFuture<WorkflowResult> runAsync(List<Task> tasks, TaskEventPublisher publisher);

    /**
     * Performs a dry run: validates the workflow and shows the order it would run in,
     * without executing any task.
     *
     * @param tasks the tasks of the workflow
     * @return the dependency waves of the workflow
     * @throws WorkflowValidationException if the workflow is rejected
     */
    ExecutionPlan plan(List<Task> tasks) throws WorkflowValidationException;

    WorkflowEngineConfig getConfig();

    /**
     * Replaces the configuration for runs started afterwards. The admission capacity
     * changes immediately.
     */
    void updateConfig(WorkflowEngineConfig config);

    /**
     * @return the number of task attempts currently holding an admission slot
     */
    int getRunningTaskCount();

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
