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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable execution record of one task for the duration of a run.
 *
 * <p>Only the engine and its task executor change a state, through the package-private
 * mutators below. A state is written by one thread at a time: the executor call that
 * owns the task, or the orchestrator when it skips a task that never started. Fields are
 * volatile so that listeners and callers on other threads read current values.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskState {

    private final String runId;
    private final String id;
    private final int maxRetries;
    private final long timeoutMs;
    private final List<String> dependencies;
    private final List<String> dependents;

    private volatile TaskStatus status;
    private volatile int attempts;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile String error;
    private volatile WorkflowErrorCode errorCode;
    private volatile Object result;

    public TaskState(String id, List<String> dependencies, int maxRetries, long timeoutMs) {
        this(AdmissionController.DEFAULT_RUN_ID, id, dependencies, maxRetries, timeoutMs);
    }

    /**
     * @param runId the run this state belongs to; admission slots are held per run
     */
    public TaskState(String runId, String id, List<String> dependencies, int maxRetries, long timeoutMs) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.id = id;
        this.dependencies = List.copyOf(dependencies);
        this.dependents = new ArrayList<>();
        this.maxRetries = maxRetries;
        this.timeoutMs = timeoutMs;
        this.status = TaskStatus.PENDING;
        this.attempts = 0;
    }

    public String getId() {
        return id;
    }

    public String getRunId() {
        return runId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    /**
     * @return the number of attempts started so far
     */
    public int getAttempts() {
        return attempts;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    /**
     * @return ids of the tasks that depend directly on this one
     */
    public List<String> getDependents() {
        return Collections.unmodifiableList(dependents);
    }

    /**
     * @return start of the latest attempt; empty if the task never ran
     */
    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        if (startTime == null || endTime == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startTime, endTime));
    }

    public Optional<Long> getDurationMs() {
        return getDuration().map(Duration::toMillis);
    }

    /**
     * @return the failure message when FAILED, the skip reason when SKIPPED, or the
     *         previous attempt's error while a retry is pending
     */
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<WorkflowErrorCode> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<Object> getResult() {
        return Optional.ofNullable(result);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    void addDependent(String dependentId) {
        dependents.add(dependentId);
    }

    void markRunning() {
        transitionTo(TaskStatus.RUNNING);
        attempts++;
        startTime = Instant.now();
        endTime = null;
    }

    void markCompleted(Object value) {
        transitionTo(TaskStatus.COMPLETED);
        endTime = Instant.now();
        result = value;
        error = null;
        errorCode = null;
    }

    void recordAttemptFailure(String message, WorkflowErrorCode code) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + id + " has no running attempt (status " + status + ")");
        }
        error = message;
        errorCode = code;
    }

    void markFailed(String message, WorkflowErrorCode code) {
        transitionTo(TaskStatus.FAILED);
        endTime = Instant.now();
        error = message;
        errorCode = code;
    }

    void markSkipped(String reason) {
        transitionTo(TaskStatus.SKIPPED);
        error = reason;
    }

    private void transitionTo(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid transition for task " + id + ": " + status + " -> " + target);
        }
        status = target;
    }

    @Override
    public String toString() {
        return "TaskState{" +
               "id='" + id + '\'' +
               ", status=" + status +
               ", attempts=" + attempts +
               ", maxRetries=" + maxRetries +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }
}
