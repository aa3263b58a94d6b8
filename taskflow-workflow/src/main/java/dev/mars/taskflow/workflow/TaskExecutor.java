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
 * Runs one task to a terminal state, applying its retry and timeout policy.
 */
public interface TaskExecutor {

    /**
     * Executes the task, updating its state and publishing lifecycle events.
     * Failures of the work never escape; they end in the FAILED state.
     *
     * @param task the task to run
     * @param state the task's state; must not be terminal
     * @param publisher receives STARTED, RETRY, COMPLETED and FAILED events
     * @return true if the task completed
     * @throws IllegalStateException if the state is already terminal
     */
    boolean execute(Task task, TaskState state, TaskEventPublisher publisher);

    /**
     * Releases any threads held by the executor.
     */
    default void shutdown() {
    }
}
