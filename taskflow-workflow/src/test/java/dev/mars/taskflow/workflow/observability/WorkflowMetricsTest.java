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

package dev.mars.taskflow.workflow.observability;

import dev.mars.taskflow.workflow.BoundedAdmissionController;
import dev.mars.taskflow.workflow.RetryingTaskExecutor;
import dev.mars.taskflow.workflow.SimpleWorkflowEngine;
import dev.mars.taskflow.workflow.Task;
import dev.mars.taskflow.workflow.TaskEvent;
import dev.mars.taskflow.workflow.TaskEventPublisher;
import dev.mars.taskflow.workflow.TaskExecutor;
import dev.mars.taskflow.workflow.TaskWork;
import dev.mars.taskflow.workflow.WorkflowEngineConfig;
import dev.mars.taskflow.workflow.WorkflowResult;
import dev.mars.taskflow.workflow.WorkflowStatus;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the metrics recorded by WorkflowMetrics using an in-memory OpenTelemetry reader.
 */
class WorkflowMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private WorkflowMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new WorkflowMetrics(meterProvider.get("taskflow-workflow"));
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    private static Optional<MetricData> find(Collection<MetricData> collected, String name) {
        return collected.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    }

    private static long sum(Collection<MetricData> collected, String name) {
        return find(collected, name)
                .map(metric -> metric.getLongSumData().getPoints().stream().mapToLong(LongPointData::getValue).sum())
                .orElse(0L);
    }

    private static long histogramCount(Collection<MetricData> collected, String name) {
        return find(collected, name)
                .map(metric -> metric.getHistogramData().getPoints().stream().mapToLong(HistogramPointData::getCount).sum())
                .orElse(0L);
    }

    @Test
    void testTaskEventsAreCounted() {
        metrics.onEvent(TaskEvent.started("a", 1));
        metrics.onEvent(TaskEvent.retry("a", 1, "boom"));
        metrics.onEvent(TaskEvent.started("a", 2));
        metrics.onEvent(TaskEvent.completed("a", 2, "ok"));
        metrics.onEvent(TaskEvent.failed("b", 0, "Dependency not completed"));

        Collection<MetricData> collected = reader.collectAllMetrics();

        assertEquals(2, sum(collected, "taskflow.task.started"));
        assertEquals(1, sum(collected, "taskflow.task.retried"));
        assertEquals(1, sum(collected, "taskflow.task.completed"));
        assertEquals(1, sum(collected, "taskflow.task.skipped"));
        assertEquals(0, sum(collected, "taskflow.task.failed"));
        assertEquals(1, histogramCount(collected, "taskflow.task.attempts"));
    }

    @Test
    void testActiveWorkflowGauge() {
        metrics.recordWorkflowStarted("SEQUENTIAL");
        metrics.recordWorkflowStarted("PARALLEL");
        metrics.recordWorkflowCompleted("PARALLEL", 0.5);

        Collection<MetricData> collected = reader.collectAllMetrics();

        assertEquals(1, metrics.getActiveWorkflows());
        long gauge = find(collected, "taskflow.workflow.active")
                .map(metric -> metric.getLongGaugeData().getPoints().iterator().next().getValue())
                .orElseThrow();
        assertEquals(1, gauge);
        assertEquals(2, sum(collected, "taskflow.workflow.total"));
        assertEquals(1, histogramCount(collected, "taskflow.workflow.duration.seconds"));
    }

    @Test
    void testEngineRecordsWorkflowAndTaskMetrics() throws Exception {
        WorkflowEngineConfig config = WorkflowEngineConfig.builder().retryDelayMs(0).build();
        BoundedAdmissionController admission = new BoundedAdmissionController(4);
        SimpleWorkflowEngine engine = new SimpleWorkflowEngine(config, admission,
                new RetryingTaskExecutor(admission, 0), metrics);
        AtomicInteger calls = new AtomicInteger();
        TaskEventPublisher publisher = new TaskEventPublisher();

        try {
            WorkflowResult result = engine.run(List.of(
                    Task.builder("a").retries(1).work(() -> calls.incrementAndGet() == 1
                            ? CompletableFuture.failedFuture(new RuntimeException("first call fails"))
                            : CompletableFuture.completedFuture("ok")).build(),
                    Task.builder("b").retries(0)
                            .work(() -> CompletableFuture.failedFuture(new RuntimeException("down"))).build(),
                    Task.builder("c").dependsOn("b")
                            .work(() -> CompletableFuture.completedFuture("never")).build()), publisher);

            assertEquals(WorkflowStatus.FAILED, result.getStatus());
        } finally {
            engine.shutdown();
        }

        Collection<MetricData> collected = reader.collectAllMetrics();

        assertEquals(1, sum(collected, "taskflow.workflow.total"));
        assertEquals(1, sum(collected, "taskflow.workflow.failed"));
        assertEquals(0, sum(collected, "taskflow.workflow.completed"));
        assertEquals(3, sum(collected, "taskflow.task.started"));
        assertEquals(1, sum(collected, "taskflow.task.retried"));
        assertEquals(1, sum(collected, "taskflow.task.completed"));
        assertEquals(1, sum(collected, "taskflow.task.failed"));
        assertEquals(1, sum(collected, "taskflow.task.skipped"));
        assertEquals(2, histogramCount(collected, "taskflow.task.attempts"));
        assertEquals(0, metrics.getActiveWorkflows());
        assertEquals(0, publisher.getListenerCount());
    }

    @Test
    void testActiveGaugeReleasedWhenExecutionThrows() {
        WorkflowEngineConfig config = WorkflowEngineConfig.builder().retryDelayMs(0).build();
        BoundedAdmissionController admission = new BoundedAdmissionController(4);
        TaskExecutor broken = (task, state, publisher) -> {
            throw new IllegalStateException("executor broke");
        };
        SimpleWorkflowEngine engine = new SimpleWorkflowEngine(config, admission, broken, metrics);

        try {
            assertThrows(IllegalStateException.class, () -> engine.run(List.of(
                    Task.builder("a").work(() -> CompletableFuture.completedFuture("ok")).build())));
        } finally {
            engine.shutdown();
        }

        Collection<MetricData> collected = reader.collectAllMetrics();

        assertEquals(0, metrics.getActiveWorkflows());
        assertEquals(1, sum(collected, "taskflow.workflow.total"));
        assertEquals(1, sum(collected, "taskflow.workflow.failed"));
    }

    @Test
    void testSharedPublisherCountsEachRunOnce() throws Exception {
        WorkflowEngineConfig config = WorkflowEngineConfig.builder().retryDelayMs(0).build();
        BoundedAdmissionController admission = new BoundedAdmissionController(4);
        SimpleWorkflowEngine engine = new SimpleWorkflowEngine(config, admission,
                new RetryingTaskExecutor(admission, 0), metrics);
        TaskEventPublisher shared = new TaskEventPublisher();
        AtomicInteger delivered = new AtomicInteger();
        shared.subscribe(event -> delivered.incrementAndGet());
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch finish = new CountDownLatch(1);
        List<Task> tasks = List.of(Task.builder("a").retries(0).work(TaskWork.fromCallable(() -> {
            bothStarted.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return "a";
        })).build());

        try {
            CompletableFuture<WorkflowResult> first = engine.runAsync(tasks, shared);
            CompletableFuture<WorkflowResult> second = engine.runAsync(tasks, shared);
            try {
                assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
            } finally {
                finish.countDown();
            }
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            engine.shutdown();
        }

        Collection<MetricData> collected = reader.collectAllMetrics();

        assertEquals(2, sum(collected, "taskflow.task.started"));
        assertEquals(2, sum(collected, "taskflow.task.completed"));
        assertEquals(4, delivered.get());
        assertEquals(1, shared.getListenerCount());
    }
}
