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

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Task executor with a bounded retry loop and a per-attempt timeout.
 *
 * <p>Each attempt increments the attempt count, publishes STARTED, asks the admission
 * controller for a slot and then races the work against the task's timeout. A task
 * that always fails is tried {@code maxRetries + 1} times. Between attempts a RETRY
 * event is published and the executor sleeps for the configured retry delay.</p>
 *
 * <p>The work is started on a dedicated daemon pool, so work that blocks while starting
 * is still bounded by the timeout. When an attempt times out its future is abandoned:
 * a late result or failure never reaches the task state.</p>
 *
 * <p>If the calling thread is interrupted the task fails at once without further
 * retries and the interrupt flag is restored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RetryingTaskExecutor implements TaskExecutor {

    private static final Logger logger = Logger.getLogger(RetryingTaskExecutor.class.getName());
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final AdmissionController admissionController;
    private final LongSupplier retryDelayMs;
    private final ExecutorService workPool;

    public RetryingTaskExecutor(AdmissionController admissionController, long retryDelayMs) {
        this(admissionController, () -> retryDelayMs);
    }

    /**
     * @param retryDelayMs read before every retry, so a running engine can change it
     */
    public RetryingTaskExecutor(AdmissionController admissionController, LongSupplier retryDelayMs) {
        this.admissionController = Objects.requireNonNull(admissionController, "Admission controller cannot be null");
        this.retryDelayMs = Objects.requireNonNull(retryDelayMs, "Retry delay cannot be null");
        this.workPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskflow-work-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean execute(Task task, TaskState state, TaskEventPublisher publisher) {
        Objects.requireNonNull(task, "Task cannot be null");
        Objects.requireNonNull(publisher, "Publisher cannot be null");
        if (state.isTerminal()) {
            throw new IllegalStateException("Task " + state.getId() + " is already " + state.getStatus());
        }

        String taskId = state.getId();
        while (true) {
            state.markRunning();
            int attempt = state.getAttempts();
            publisher.publish(TaskEvent.started(taskId, attempt));
            logger.fine("Starting task " + taskId + " (attempt " + attempt + " of " + (state.getMaxRetries() + 1) + ")");

            TaskOutcome outcome;
            try {
                outcome = runAttempt(task, state);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(state, publisher, "Task " + taskId + " was interrupted", WorkflowErrorCode.TASK_EXECUTION);
            }

            if (outcome.isSuccess()) {
                Object result = outcome.getResult().orElse(null);
                state.markCompleted(result);
                publisher.publish(TaskEvent.completed(taskId, attempt, result));
                logger.info("Task " + taskId + " completed after " + attempt + " attempt(s)");
                return true;
            }

            String error = outcome.getErrorMessage().orElse("Unknown error");
            WorkflowErrorCode code = outcome.getErrorCode().orElse(WorkflowErrorCode.TASK_EXECUTION);
            if (state.getAttempts() > state.getMaxRetries()) {
                return fail(state, publisher, error, code);
            }

            state.recordAttemptFailure(error, code);
            logger.warning("Task " + taskId + " attempt " + attempt + " failed, retrying: " + error);
            outcome.getCause().ifPresent(cause -> {
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Attempt failure details for task " + taskId, cause);
                }
            });
            publisher.publish(TaskEvent.retry(taskId, attempt, error));

            if (!pauseBeforeRetry()) {
                return fail(state, publisher, "Task " + taskId + " was interrupted while waiting to retry",
                        WorkflowErrorCode.TASK_EXECUTION);
            }
        }
    }

    @Override
    public void shutdown() {
        workPool.shutdownNow();
    }

    private TaskOutcome runAttempt(Task task, TaskState state) throws InterruptedException {
        String taskId = state.getId();
        String runId = state.getRunId();
        if (!admissionController.tryAcquire(runId, taskId)) {
            return TaskOutcome.failure(new ConcurrentExecutionException(taskId, admissionController.getCapacity()));
        }
        try {
            CompletableFuture<Object> pending = new CompletableFuture<>();
            Future<?> starter;
            try {
                starter = workPool.submit(() -> start(task, pending));
            } catch (RejectedExecutionException e) {
                return TaskOutcome.failure(e);
            }

            try {
                return TaskOutcome.success(pending.get(state.getTimeoutMs(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                pending.cancel(false);
                starter.cancel(true);
                return TaskOutcome.failure(new TaskTimeoutException(taskId, state.getTimeoutMs()));
            } catch (ExecutionException e) {
                return TaskOutcome.failure(unwrap(e.getCause()));
            } catch (CancellationException e) {
                return TaskOutcome.failure(e);
            } catch (InterruptedException e) {
                pending.cancel(false);
                starter.cancel(true);
                throw e;
            }
        } finally {
            admissionController.release(runId, taskId);
        }
    }

    private static void start(Task task, CompletableFuture<Object> pending) {
        try {
            CompletionStage<?> stage = task.getWork().execute();
            if (stage == null) {
                pending.completeExceptionally(
                        new IllegalStateException("Task " + task.getId() + " returned no completion stage"));
                return;
            }
            stage.whenComplete((value, error) -> {
                if (error != null) {
                    pending.completeExceptionally(error);
                } else {
                    pending.complete(value);
                }
            });
        } catch (Exception e) {
            pending.completeExceptionally(e);
        }
    }

    private boolean pauseBeforeRetry() {
        long delay = retryDelayMs.getAsLong();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean fail(TaskState state, TaskEventPublisher publisher, String error, WorkflowErrorCode code) {
        state.markFailed(error, code);
        publisher.publish(TaskEvent.failed(state.getId(), state.getAttempts(), error));
        logger.warning("Task " + state.getId() + " failed after " + state.getAttempts() + " attempt(s): " + error);
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
