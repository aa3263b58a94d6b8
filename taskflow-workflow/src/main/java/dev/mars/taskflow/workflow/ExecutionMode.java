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
 * How the orchestrator schedules ready tasks.
 */
public enum ExecutionMode {
    /**
     * Visit tasks one at a time in input order. A task whose dependencies have not all
     * completed when it is visited is skipped.
     */
    SEQUENTIAL,

    /**
     * Release every task whose dependencies have completed, running up to the
     * configured number of tasks at once.
     */
    PARALLEL;

    /**
     * Parses a mode name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ExecutionMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution mode cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution mode: " + value, e);
        }
    }
}
