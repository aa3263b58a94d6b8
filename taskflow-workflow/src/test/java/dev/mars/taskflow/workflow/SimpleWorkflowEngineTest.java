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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.taskflow.workflow.TaskFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Tests for SimpleWorkflowEngine orchestration in both execution modes.
 */
class SimpleWorkflowEngineTest {

    @Mock
    private TaskExecutor mockExecutor;

    private SimpleWorkflowEngine engine;
    private TaskEventPublisher publisher;
    private EventRecorder recorder;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        engine = new SimpleWorkflowEngine(testConfig().build());
        publisher = new TaskEventPublisher();
        recorder = new EventRecorder();
        publisher.subscribe(recorder);
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown();
        mocks.close();
    }

    private SimpleWorkflowEngine parallelEngine(int maxConcurrent) {
        engine.shutdown();
        engine = new SimpleWorkflowEngine(testConfig()
                .executionMode(ExecutionMode.PARALLEL)
                .maxConcurrentTasks(maxConcurrent)
                .build());
        return engine;
    }

    // ========== Validation ==========

    @Test
    void testCyclicWorkflowRunsNothing() {
        AtomicInteger calls = new AtomicInteger();
        List<Task> tasks = List.of(
                Task.builder("a").work(succeed("a", calls)).dependsOn("b").build(),
                Task.builder("b").work(succeed("b", calls)).dependsOn("a").build());

        WorkflowValidationException e =
                assertThrows(WorkflowValidationException.class, () -> engine.run(tasks, publisher));

        assertEquals(List.of("a", "b", "a"), e.getCyclePath());
        assertEquals(0, calls.get());
        assertTrue(recorder.getEvents().isEmpty());
    }

    @Test
    void testMissingDependencyRejected() {
        List<Task> tasks = List.of(Task.builder("a").work(succeed("a")).dependsOn("nope").build());

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class, () -> engine.run(tasks));

        assertTrue(e.getMessage().contains("Task a depends on non-existent task nope"));
        assertFalse(e.hasCycle());
    }

    @Test
    void testFieldValidationRunsBeforeGraphValidation() {
        List<Task> tasks = List.of(
                Task.builder("a").work(succeed("a")).retries(11).dependsOn("b").build(),
                Task.builder("b").work(succeed("b")).dependsOn("a").build());

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class, () -> engine.run(tasks));

        assertInstanceOf(InvalidTaskConfigurationException.class, e.getCause());
        assertFalse(e.hasCycle());
    }

    @Test
    void testEmptyAndNullWorkflowsRejected() {
        assertThrows(WorkflowValidationException.class, () -> engine.run(List.of()));
        assertThrows(WorkflowValidationException.class, () -> engine.run(null));
    }

    @Test
    void testValidatorNeverReachesExecutor() {
        SimpleWorkflowEngine composed = new SimpleWorkflowEngine(testConfig().build(),
                new BoundedAdmissionController(2), mockExecutor, null);
        try {
            List<Task> tasks = List.of(
                    Task.builder("a").work(succeed("a")).build(),
                    Task.builder("a").work(succeed("a")).build());

            assertThrows(WorkflowValidationException.class, () -> composed.run(tasks));
            verifyNoInteractions(mockExecutor);
        } finally {
            composed.shutdown();
        }
    }

    // ========== Sequential Execution ==========

    @Test
    void testChainEmitsEventsInDependencyOrder() throws Exception {
        List<Task> tasks = List.of(
                Task.builder("A").work(succeed("a")).build(),
                Task.builder("B").work(succeed("b")).dependsOn("A").build(),
                Task.builder("C").work(succeed("c")).dependsOn("B").build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(
                "STARTED:A", "COMPLETED:A",
                "STARTED:B", "COMPLETED:B",
                "STARTED:C", "COMPLETED:C"), recorder.names());
        assertEquals(3, result.getCompletedTasks());
    }

    @Test
    void testFailedTaskSkipsDependent() throws Exception {
        List<Task> tasks = List.of(
                Task.builder("t1").work(failWith("rejected")).retries(0).build(),
                Task.builder("t2").work(succeed("t2")).dependsOn("t1").build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(TaskStatus.FAILED, result.getTask("t1").orElseThrow().getStatus());
        TaskState t2 = result.getTask("t2").orElseThrow();
        assertEquals(TaskStatus.SKIPPED, t2.getStatus());
        assertEquals(0, t2.getAttempts());
        assertEquals("Dependency t1 failed", t2.getError().orElseThrow());
        assertEquals(0, result.getCompletedTasks());
        assertEquals(1, result.getFailedTasks());
        assertEquals(1, result.getSkippedTasks());
        assertEquals(-1, recorder.indexOf(TaskEventType.STARTED, "t2"));
        assertTrue(recorder.getEvents().stream()
                .anyMatch(event -> event.getTaskId().equals("t2") && event.isSkip()));
    }

    @Test
    void testTransitiveDependentsSkipped() throws Exception {
        List<Task> tasks = List.of(
                Task.builder("a").work(failWith("down")).build(),
                Task.builder("b").work(succeed("b")).dependsOn("a").build(),
                Task.builder("c").work(succeed("c")).dependsOn("b").build(),
                Task.builder("d").work(succeed("d")).build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals("Dependency a failed", result.getTask("b").orElseThrow().getError().orElseThrow());
        assertEquals(SimpleWorkflowEngine.DEPENDENCY_NOT_COMPLETED,
                result.getTask("c").orElseThrow().getError().orElseThrow());
        assertEquals(List.of("b", "c"), result.getTaskIds(TaskStatus.SKIPPED));
        assertEquals(List.of("d"), result.getTaskIds(TaskStatus.COMPLETED));
    }

    @Test
    void testDependencyListedLaterIsNotCompletedWhenVisited() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Task> tasks = List.of(
                Task.builder("b").work(succeed("b", calls)).dependsOn("a").build(),
                Task.builder("a").work(succeed("a", calls)).build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(TaskStatus.SKIPPED, result.getTask("b").orElseThrow().getStatus());
        assertEquals("Dependency not completed", result.getTask("b").orElseThrow().getError().orElseThrow());
        assertEquals(TaskStatus.COMPLETED, result.getTask("a").orElseThrow().getStatus());
        assertEquals(1, calls.get());
    }

    @Test
    void testEveryTaskTerminalAndCountsAddUp() throws Exception {
        List<Task> tasks = List.of(
                Task.builder("a").work(succeed("a")).build(),
                Task.builder("b").work(failWith("b broke")).dependsOn("a").build(),
                Task.builder("c").work(succeed("c")).dependsOn("a").build(),
                Task.builder("d").work(succeed("d")).dependsOn("b", "c").build(),
                Task.builder("e").work(succeed("e")).dependsOn("c").build());

        WorkflowResult result = engine.run(tasks);

        assertTrue(result.getTasks().values().stream().allMatch(TaskState::isTerminal));
        assertEquals(result.getTotalTasks(),
                result.getCompletedTasks() + result.getFailedTasks() + result.getSkippedTasks());
        assertEquals(5, result.getTotalTasks());
        assertEquals(List.of("a", "c", "e"), result.getTaskIds(TaskStatus.COMPLETED));
        assertEquals(List.of("d"), result.getTaskIds(TaskStatus.SKIPPED));
    }

    @Test
    void testRetriesThenSuccessInsideWorkflow() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Task> tasks = List.of(Task.builder("flaky").work(failTimes(2, "ok", calls)).retries(2).build());

        WorkflowResult result = engine.run(tasks, publisher);

        TaskState flaky = result.getTask("flaky").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, flaky.getStatus());
        assertEquals(3, flaky.getAttempts());
        assertEquals(List.of("STARTED:1", "RETRY:1", "STARTED:2", "RETRY:2", "STARTED:3", "COMPLETED:3"),
                recorder.namesFor("flaky"));
    }

    @Test
    void testTimeoutInsideWorkflow() throws Exception {
        List<Task> tasks = List.of(Task.builder("hang").work(neverSettles()).timeoutMs(100).build());

        long start = System.nanoTime();
        WorkflowResult result = engine.run(tasks);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("Task hang timed out after 100ms", result.getTask("hang").orElseThrow().getError().orElseThrow());
        assertTrue(elapsedMs < 2000, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void testConfigDefaultsApplied() throws Exception {
        engine.updateConfig(testConfig().defaultRetries(2).defaultTimeoutMs(1234).build());

        WorkflowResult result = engine.run(List.of(Task.builder("a").work(succeed("a")).build()));

        TaskState state = result.getTask("a").orElseThrow();
        assertEquals(2, state.getMaxRetries());
        assertEquals(1234, state.getTimeoutMs());
    }

    @Test
    void testDependentsRecordedOnState() throws Exception {
        WorkflowResult result = engine.run(List.of(
                Task.builder("a").work(succeed("a")).build(),
                Task.builder("b").work(succeed("b")).dependsOn("a").build(),
                Task.builder("c").work(succeed("c")).dependsOn("a").build()));

        assertEquals(List.of("b", "c"), result.getTask("a").orElseThrow().getDependents());
    }

    @Test
    void testThrowingListenerDoesNotAffectRun() throws Exception {
        publisher.subscribe(event -> {
            throw new IllegalStateException("observer bug");
        });

        WorkflowResult result = engine.run(List.of(Task.builder("a").work(succeed("a")).build()), publisher);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
    }

    @Test
    void testExecutorInvokedInInputOrder() throws Exception {
        when(mockExecutor.execute(any(), any(), any())).thenReturn(true);
        SimpleWorkflowEngine composed = new SimpleWorkflowEngine(testConfig().build(),
                new BoundedAdmissionController(2), mockExecutor, null);
        try {
            composed.run(List.of(
                    Task.builder("x").work(succeed("x")).build(),
                    Task.builder("y").work(succeed("y")).build()));

            InOrder inOrder = inOrder(mockExecutor);
            inOrder.verify(mockExecutor).execute(argThat(task -> task.getId().equals("x")), any(), any());
            inOrder.verify(mockExecutor).execute(argThat(task -> task.getId().equals("y")), any(), any());
        } finally {
            composed.shutdown();
        }
    }

    // ========== Parallel Execution ==========

    @Test
    void testParallelIndependentTasksOverlap() throws Exception {
        parallelEngine(10);
        CountDownLatch allRunning = new CountDownLatch(3);
        List<Task> tasks = new ArrayList<>();
        for (String id : List.of("p1", "p2", "p3")) {
            tasks.add(Task.builder(id).work(TaskWork.fromCallable(() -> {
                allRunning.countDown();
                if (!allRunning.await(3, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("tasks did not overlap");
                }
                return id;
            })).build());
        }

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getCompletedTasks());
    }

    @Test
    void testParallelRespectsCapacity() throws Exception {
        parallelEngine(2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            tasks.add(Task.builder("t" + i).work(TaskWork.fromCallable(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return "ok";
            })).build());
        }

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(6, result.getCompletedTasks());
        assertTrue(maxRunning.get() <= 2, "max running was " + maxRunning.get());
        assertEquals(0, engine.getRunningTaskCount());
    }

    @Test
    void testParallelDependentStartsAfterDependencyCompletes() throws Exception {
        parallelEngine(4);
        List<Task> tasks = List.of(
                Task.builder("a").work(TaskWork.fromCallable(() -> {
                    Thread.sleep(50);
                    return "a";
                })).build(),
                Task.builder("b").work(succeed("b")).dependsOn("a").build(),
                Task.builder("c").work(succeed("c")).build(),
                Task.builder("d").work(succeed("d")).dependsOn("b", "c").build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(4, result.getCompletedTasks());
        assertTrue(recorder.indexOf(TaskEventType.COMPLETED, "a") < recorder.indexOf(TaskEventType.STARTED, "b"));
        assertTrue(recorder.indexOf(TaskEventType.COMPLETED, "b") < recorder.indexOf(TaskEventType.STARTED, "d"));
        assertTrue(recorder.indexOf(TaskEventType.COMPLETED, "c") < recorder.indexOf(TaskEventType.STARTED, "d"));
    }

    @Test
    void testParallelRunsDependencyListedLater() throws Exception {
        parallelEngine(4);
        List<Task> tasks = List.of(
                Task.builder("b").work(succeed("b")).dependsOn("a").build(),
                Task.builder("a").work(succeed("a")).build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(2, result.getCompletedTasks());
    }

    @Test
    void testParallelFailureSkipsDownstream() throws Exception {
        parallelEngine(4);
        List<Task> tasks = List.of(
                Task.builder("root").work(failWith("root down")).retries(1).build(),
                Task.builder("mid").work(succeed("mid")).dependsOn("root").build(),
                Task.builder("leaf").work(succeed("leaf")).dependsOn("mid").build(),
                Task.builder("other").work(succeed("other")).build());

        WorkflowResult result = engine.run(tasks, publisher);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(2, result.getTask("root").orElseThrow().getAttempts());
        assertEquals("Dependency root failed", result.getTask("mid").orElseThrow().getError().orElseThrow());
        assertEquals(TaskStatus.SKIPPED, result.getTask("leaf").orElseThrow().getStatus());
        assertEquals(TaskStatus.COMPLETED, result.getTask("other").orElseThrow().getStatus());
        assertEquals(-1, recorder.indexOf(TaskEventType.STARTED, "mid"));
        assertEquals(-1, recorder.indexOf(TaskEventType.STARTED, "leaf"));
    }

    // ========== Plan, Async and Configuration ==========

    @Test
    void testPlanDoesNotExecute() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Task> tasks = List.of(
                Task.builder("a").work(succeed("a", calls)).build(),
                Task.builder("b").work(succeed("b", calls)).dependsOn("a").build(),
                Task.builder("c").work(succeed("c", calls)).dependsOn("a").build(),
                Task.builder("d").work(succeed("d", calls)).dependsOn("b", "c").build());

        ExecutionPlan plan = engine.plan(tasks);

        assertEquals(List.of(List.of("a"), List.of("b", "c"), List.of("d")), plan.getBatches());
        assertEquals(3, plan.getBatchCount());
        assertEquals(4, plan.getTaskCount());
        assertEquals(2, plan.getMaxParallelism());
        assertEquals(ExecutionMode.SEQUENTIAL, plan.getExecutionMode());
        assertEquals(0, calls.get());
    }

    @Test
    void testRunAsync() throws Exception {
        CompletableFuture<WorkflowResult> future = engine.runAsync(List.of(
                Task.builder("a").work(succeed("a")).build()), publisher);

        WorkflowResult result = future.get(5, TimeUnit.SECONDS);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("STARTED:a", "COMPLETED:a"), recorder.names());
    }

    @Test
    void testOverlappingRunsOfSameWorkflowBothComplete() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch finish = new CountDownLatch(1);
        List<Task> tasks = List.of(Task.builder("a").retries(0).work(TaskWork.fromCallable(() -> {
            bothStarted.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return "a";
        })).build());

        CompletableFuture<WorkflowResult> first = engine.runAsync(tasks);
        CompletableFuture<WorkflowResult> second = engine.runAsync(tasks);
        try {
            assertTrue(bothStarted.await(5, TimeUnit.SECONDS), "task a should be running in both runs");
            assertEquals(2, engine.getRunningTaskCount());
        } finally {
            finish.countDown();
        }

        WorkflowResult firstResult = first.get(5, TimeUnit.SECONDS);
        WorkflowResult secondResult = second.get(5, TimeUnit.SECONDS);
        assertEquals(WorkflowStatus.COMPLETED, firstResult.getStatus());
        assertEquals(WorkflowStatus.COMPLETED, secondResult.getStatus());
        assertEquals(1, secondResult.getTask("a").orElseThrow().getAttempts());
        assertEquals(0, engine.getRunningTaskCount());
    }

    @Test
    void testRunAsyncValidationFailure() {
        CompletableFuture<WorkflowResult> future = engine.runAsync(List.of(
                Task.builder("a").work(succeed("a")).dependsOn("a").build()));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(WorkflowValidationException.class, e.getCause());
    }

    @Test
    void testUpdateConfig() {
        WorkflowEngineConfig updated = testConfig()
                .maxConcurrentTasks(3)
                .executionMode(ExecutionMode.PARALLEL)
                .build();

        engine.updateConfig(updated);

        assertSame(updated, engine.getConfig());
        assertEquals(0, engine.getRunningTaskCount());
    }

    @Test
    void testShutdownRejectsNewRuns() {
        engine.shutdown();

        List<Task> tasks = List.of(Task.builder("a").work(succeed("a")).build());
        assertThrows(IllegalStateException.class, () -> engine.run(tasks));
        assertTrue(engine.runAsync(tasks).isCompletedExceptionally());
    }
}
