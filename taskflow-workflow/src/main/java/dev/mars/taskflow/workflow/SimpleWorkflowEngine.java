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

import dev.mars.taskflow.workflow.observability.WorkflowMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default workflow engine.
 *
 * <p>A run validates the task fields and the dependency graph, creates one
 * {@link TaskState} per task and then drives the tasks through the {@link TaskExecutor}
 * according to the configured {@link ExecutionMode}:</p>
 * <ul>
 *   <li>SEQUENTIAL visits tasks in input order; a task whose dependencies have not all
 *       completed at that point is skipped with reason "Dependency not completed".</li>
 *   <li>PARALLEL releases tasks as their dependencies complete, in input order, with
 *       at most the admission capacity running at once.</li>
 * </ul>
 * <p>When a task fails, its pending direct dependents are skipped with reason
 * "Dependency &lt;id&gt; failed". Skipped tasks are announced with a FAILED event whose
 * attempt is 0.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(SimpleWorkflowEngine.class.getName());
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    static final String DEPENDENCY_NOT_COMPLETED = "Dependency not completed";

    private final AdmissionController admissionController;
    private final TaskExecutor taskExecutor;
    private final WorkflowMetrics metrics;
    private final ExecutorService workerPool;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile WorkflowEngineConfig config;

    public SimpleWorkflowEngine() {
        this(WorkflowEngineConfig.defaults());
    }

    public SimpleWorkflowEngine(WorkflowEngineConfig config) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.config = config;
        this.admissionController = new BoundedAdmissionController(config.getMaxConcurrentTasks());
        this.taskExecutor = new RetryingTaskExecutor(admissionController, () -> this.config.getRetryDelayMs());
        this.metrics = config.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.workerPool = createWorkerPool();
        logger.info("SimpleWorkflowEngine initialized: " + config);
    }

    /**
     * Composes an engine from explicit collaborators.
     *
     * @param metrics may be null to disable metrics
     */
    public SimpleWorkflowEngine(WorkflowEngineConfig config, AdmissionController admissionController,
                                TaskExecutor taskExecutor, WorkflowMetrics metrics) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.admissionController = Objects.requireNonNull(admissionController, "Admission controller cannot be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "Task executor cannot be null");
        this.metrics = metrics;
        this.workerPool = createWorkerPool();
    }

    @Override
    public WorkflowResult run(List<Task> tasks) throws WorkflowValidationException {
        return run(tasks, new TaskEventPublisher());
    }

    @Override
    public WorkflowResult run(List<Task> tasks, TaskEventPublisher publisher) throws WorkflowValidationException {
        Objects.requireNonNull(publisher, "Publisher cannot be null");
        if (shutdown.get()) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }

        WorkflowEngineConfig runConfig = this.config;
        List<Task> workflow = tasks != null ? new ArrayList<>(tasks) : List.of();
        DependencyGraph graph = validate(workflow, runConfig);
        String runId = UUID.randomUUID().toString();
        Map<String, TaskState> states = initializeStates(runId, workflow, graph, runConfig);

        String mode = runConfig.getExecutionMode().name();
        Instant startTime = Instant.now();
        logger.info("Starting workflow run " + runId + " with " + workflow.size() + " tasks in " + mode + " mode");

        TaskEventPublisher runPublisher = publisher;
        if (metrics != null) {
            runPublisher = new TaskEventPublisher();
            runPublisher.subscribe(metrics);
            runPublisher.subscribe(publisher::publish);
            metrics.recordWorkflowStarted(mode);
        }

        WorkflowResult result = null;
        try {
            if (runConfig.getExecutionMode() == ExecutionMode.PARALLEL) {
                executeParallel(workflow, states, runPublisher);
            } else {
                executeSequential(workflow, states, runPublisher);
            }
            result = new WorkflowResult(states, startTime, Instant.now());
        } finally {
            if (metrics != null) {
                double seconds = Duration.between(startTime, Instant.now()).toMillis() / 1000.0;
                if (result != null && result.isSuccessful()) {
                    metrics.recordWorkflowCompleted(mode, seconds);
                } else {
                    metrics.recordWorkflowFailed(mode, seconds);
                }
            }
        }

        logger.info("Workflow run " + runId + " finished with status " + result.getStatus() + ": " +
                result.getCompletedTasks() + " completed, " + result.getFailedTasks() + " failed, " +
                result.getSkippedTasks() + " skipped in " + result.getDurationMs() + "ms");
        return result;
    }

    @Override
    public CompletableFuture<WorkflowResult> runAsync(List<Task> tasks) {
        return runAsync(tasks, new TaskEventPublisher());
    }

    @Override
    public CompletableFuture<WorkflowResult> runAsync(List<Task> tasks, TaskEventPublisher publisher) {
        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return run(tasks, publisher);
            } catch (WorkflowValidationException e) {
                throw new CompletionException(e);
            }
        }, workerPool);
    }

    @Override
    public ExecutionPlan plan(List<Task> tasks) throws WorkflowValidationException {
        WorkflowEngineConfig runConfig = this.config;
        List<Task> workflow = tasks != null ? new ArrayList<>(tasks) : List.of();
        DependencyGraph graph = validate(workflow, runConfig);
        ExecutionPlan plan = new ExecutionPlan(graph.getExecutionBatches(), runConfig.getExecutionMode());
        logger.fine("Planned workflow: " + plan);
        return plan;
    }

    @Override
    public WorkflowEngineConfig getConfig() {
        return config;
    }

    @Override
    public void updateConfig(WorkflowEngineConfig newConfig) {
        Objects.requireNonNull(newConfig, "Config cannot be null");
        admissionController.setCapacity(newConfig.getMaxConcurrentTasks());
        this.config = newConfig;
        logger.info("Workflow engine configuration updated: " + newConfig);
    }

    @Override
    public int getRunningTaskCount() {
        return admissionController.getRunningCount();
    }

    @Override
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        workerPool.shutdown();
        taskExecutor.shutdown();
        logger.info("SimpleWorkflowEngine shutdown initiated");
    }

    private DependencyGraph validate(List<Task> workflow, WorkflowEngineConfig runConfig)
            throws WorkflowValidationException {
        try {
            new TaskValidator(runConfig).requireValid(workflow);
            DependencyGraph graph = new DependencyGraph(workflow);
            graph.requireValid();
            return graph;
        } catch (WorkflowValidationException e) {
            logger.log(Level.WARNING, e.getMessage());
            throw e;
        }
    }

    private Map<String, TaskState> initializeStates(String runId, List<Task> workflow, DependencyGraph graph,
                                                    WorkflowEngineConfig runConfig) {
        Map<String, TaskState> states = new LinkedHashMap<>();
        for (Task task : workflow) {
            TaskState state = new TaskState(
                    runId,
                    task.getId(),
                    task.getDependencies(),
                    task.getRetries().orElse(runConfig.getDefaultRetries()),
                    task.getTimeoutMs().orElse(runConfig.getDefaultTimeoutMs()));
            graph.getDependents(task.getId()).forEach(state::addDependent);
            states.put(task.getId(), state);
        }
        return states;
    }

    private void executeSequential(List<Task> workflow, Map<String, TaskState> states, TaskEventPublisher publisher) {
        for (Task task : workflow) {
            TaskState state = states.get(task.getId());
            if (state.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            if (!allDependenciesCompleted(state, states)) {
                skip(state, DEPENDENCY_NOT_COMPLETED, publisher);
                continue;
            }
            if (!taskExecutor.execute(task, state, publisher)) {
                skipDependents(state, states, publisher);
            }
        }
    }

    /**
     * Releases ready tasks onto the worker pool and collects them as they finish.
     * If the orchestrating thread is interrupted, tasks not yet started are skipped,
     * running attempts are interrupted and the interrupt flag is restored.
     */
    private void executeParallel(List<Task> workflow, Map<String, TaskState> states, TaskEventPublisher publisher) {
        ExecutorCompletionService<String> completions = new ExecutorCompletionService<>(workerPool);
        Map<Future<String>, String> inFlight = new HashMap<>();

        while (true) {
            releaseReadyTasks(workflow, states, publisher, completions, inFlight);
            if (inFlight.isEmpty()) {
                return;
            }

            Future<String> done;
            try {
                done = completions.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandonRun(states, inFlight, publisher);
                return;
            }

            String taskId = inFlight.remove(done);
            TaskState state = states.get(taskId);
            try {
                done.get();
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Task executor failed unexpectedly for " + taskId + ": " + e.getCause());
                if (!state.isTerminal()) {
                    state.markFailed("Task executor failed: " + e.getCause(), WorkflowErrorCode.TASK_EXECUTION);
                    publisher.publish(TaskEvent.failed(taskId, state.getAttempts(), state.getError().orElse("")));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            if (state.getStatus() == TaskStatus.FAILED) {
                skipDependents(state, states, publisher);
            }
        }
    }

    private void releaseReadyTasks(List<Task> workflow, Map<String, TaskState> states, TaskEventPublisher publisher,
                                   ExecutorCompletionService<String> completions, Map<Future<String>, String> inFlight) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : workflow) {
                TaskState state = states.get(task.getId());
                if (state.getStatus() != TaskStatus.PENDING || inFlight.containsValue(task.getId())) {
                    continue;
                }
                if (anyDependencyUnsuccessful(state, states)) {
                    skip(state, DEPENDENCY_NOT_COMPLETED, publisher);
                    changed = true;
                } else if (allDependenciesCompleted(state, states)
                        && inFlight.size() < admissionController.getCapacity()) {
                    Future<String> future = completions.submit(() -> {
                        taskExecutor.execute(task, state, publisher);
                        return task.getId();
                    });
                    inFlight.put(future, task.getId());
                }
            }
        }
    }

    private void abandonRun(Map<String, TaskState> states, Map<Future<String>, String> inFlight,
                            TaskEventPublisher publisher) {
        logger.warning("Workflow interrupted with " + inFlight.size() + " tasks in flight");
        inFlight.keySet().forEach(future -> future.cancel(true));
        for (TaskState state : states.values()) {
            if (state.getStatus() == TaskStatus.PENDING && !inFlight.containsValue(state.getId())) {
                skip(state, "Workflow interrupted", publisher);
            }
        }
    }

    private void skipDependents(TaskState failed, Map<String, TaskState> states, TaskEventPublisher publisher) {
        for (String dependentId : failed.getDependents()) {
            TaskState dependent = states.get(dependentId);
            if (dependent.getStatus() == TaskStatus.PENDING) {
                skip(dependent, "Dependency " + failed.getId() + " failed", publisher);
            }
        }
    }

    private void skip(TaskState state, String reason, TaskEventPublisher publisher) {
        state.markSkipped(reason);
        publisher.publish(TaskEvent.failed(state.getId(), 0, reason));
        logger.info("Task " + state.getId() + " skipped: " + reason);
    }

    private static boolean allDependenciesCompleted(TaskState state, Map<String, TaskState> states) {
        return state.getDependencies().stream()
                .allMatch(dependency -> states.get(dependency).getStatus() == TaskStatus.COMPLETED);
    }

    private static boolean anyDependencyUnsuccessful(TaskState state, Map<String, TaskState> states) {
        return state.getDependencies().stream()
                .map(states::get)
                .anyMatch(dependency -> dependency.getStatus() == TaskStatus.FAILED
                        || dependency.getStatus() == TaskStatus.SKIPPED);
    }

    private static ExecutorService createWorkerPool() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskflow-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Waits for the worker pool to finish after {@link #shutdown()}.
     *
     * @return true if the pool terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
