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

import java.util.Set;

/**
 * Bounds how many task attempts may run at the same time.
 * Implementations must be thread-safe; one controller is shared by every run of an engine.
 *
 * <p>Slots are held per run: the same task id may run once in each concurrent run, while
 * all runs draw on one capacity. The single-argument methods act on {@link #DEFAULT_RUN_ID}.</p>
 */
public interface AdmissionController {

    String DEFAULT_RUN_ID = "default";

    /**
     * Requests a slot for a task attempt within a run.
     *
     * @param runId the run the attempt belongs to
     * @param taskId the task about to run
     * @return true if the task may run; false if it is already running in that run or no slot is free
     */
    boolean tryAcquire(String runId, String taskId);

    /**
     * Frees the slot a task holds within a run. Does nothing if it holds none.
     */
    void release(String runId, String taskId);

    default boolean tryAcquire(String taskId) {
        return tryAcquire(DEFAULT_RUN_ID, taskId);
    }

    default void release(String taskId) {
        release(DEFAULT_RUN_ID, taskId);
    }

    /**
     * @return slots in use across all runs
     */
    int getRunningCount();

    int getCapacity();

    /**
     * @return a snapshot of the task ids currently holding a slot, across all runs
     */
    Set<String> getRunningTasks();

    /**
     * Changes the capacity. Tasks already running keep their slots; a lowered capacity
     * takes effect as they release.
     *
     * @throws IllegalArgumentException if capacity is less than 1
     */
    void setCapacity(int capacity);
}
