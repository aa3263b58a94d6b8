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
 * Lifecycle states of a single task within one workflow run.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED}
 *    ↓         ↺ (retry)
 * SKIPPED
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>Every task starts PENDING</li>
 *   <li>PENDING moves to RUNNING when an attempt starts, or to SKIPPED when a
 *       dependency did not complete</li>
 *   <li>RUNNING stays RUNNING across retries and ends COMPLETED or FAILED</li>
 *   <li>COMPLETED, FAILED and SKIPPED are terminal</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @see TaskState
 */
public enum TaskStatus {
    /**
     * Not yet visited by the orchestrator. Attempts is zero.
     */
    PENDING,

    /**
     * An attempt is in flight, or the task is between a failed attempt and its retry.
     */
    RUNNING,

    /**
     * The work settled successfully; the result is recorded on the state.
     */
    COMPLETED,

    /**
     * Every allowed attempt failed; the last attempt's error is recorded on the state.
     */
    FAILED,

    /**
     * Never started because a dependency did not complete. The reason is recorded as
     * the state's error.
     */
    SKIPPED;

    /**
     * @return true for COMPLETED, FAILED and SKIPPED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Checks whether a task in this state may move to the given state.
     *
     * @param target the requested next state
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(TaskStatus target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == SKIPPED;
            case RUNNING:
                return target == RUNNING || target == COMPLETED || target == FAILED;
            default:
                return false;
        }
    }
}
