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

package dev.mars.taskflow.examples;

import dev.mars.taskflow.config.TaskflowConfiguration;
import dev.mars.taskflow.examples.records.InMemoryRecordService;
import dev.mars.taskflow.examples.util.ExampleLogger;
import dev.mars.taskflow.workflow.SimpleWorkflowEngine;
import dev.mars.taskflow.workflow.TaskEvent;
import dev.mars.taskflow.workflow.TaskEventPublisher;
import dev.mars.taskflow.workflow.TaskStatus;
import dev.mars.taskflow.workflow.WorkflowEngine;
import dev.mars.taskflow.workflow.WorkflowEngineConfig;
import dev.mars.taskflow.workflow.WorkflowResult;
import dev.mars.taskflow.workflow.WorkflowValidationException;

import java.util.List;
import java.util.function.Function;

/**
 * Runs the record pipeline in three scenarios and prints what happened to every task:
 * <ol>
 *   <li>Working: all four tasks complete.</li>
 *   <li>Failed: transient failures and timeouts are retried, the last task fails for good.</li>
 *   <li>Skipped: the first task fails, its dependents never start.</li>
 * </ol>
 *
 * <p>Engine settings come from {@link TaskflowConfiguration}, so a {@code taskflow.properties}
 * file or {@code -Dtaskflow.*} system properties change retry delay and execution mode.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowScenariosExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(WorkflowScenariosExample.class);

    private final WorkflowEngine engine;

    public WorkflowScenariosExample(WorkflowEngine engine) {
        this.engine = engine;
    }

    public static void main(String[] args) {
        log.exampleStart("Workflow Scenarios", "Record pipeline run as a working, a failing and a skipping workflow");

        TaskflowConfiguration configuration = new TaskflowConfiguration();
        SimpleWorkflowEngine engine = new SimpleWorkflowEngine(WorkflowEngineConfig.from(configuration));
        try {
            new WorkflowScenariosExample(engine).runAll();
            log.exampleComplete("Workflow Scenarios Example");
        } catch (Exception e) {
            log.unexpectedError("Workflow Scenarios Example", e);
            System.exit(1);
        } finally {
            engine.shutdown();
        }
    }

    public void runAll() {
        runScenario("Scenario 1: Working Workflow (All tasks succeed)", "Working Workflow",
                RecordWorkflow::createWorkingWorkflow);
        runScenario("Scenario 2: Failed Workflow (Tasks fail with retries)", "Failed Workflow",
                RecordWorkflow::createFailedWorkflow);
        runScenario("Scenario 3: Skipped Workflow (Dependency failures)", "Skipped Workflow",
                RecordWorkflow::createSkippedWorkflow);
    }

    /**
     * Builds a fresh record service and workflow, runs it and prints the summary.
     *
     * @return the result, or {@code null} if the workflow was rejected before running
     */
    WorkflowResult runScenario(String title, String name, Function<InMemoryRecordService, RecordWorkflow> factory) {
        log.section(title);

        InMemoryRecordService service = new InMemoryRecordService();
        TaskEventPublisher publisher = new TaskEventPublisher();
        publisher.subscribe(WorkflowScenariosExample::printEvent);
        try {
            WorkflowResult result = engine.run(factory.apply(service).getTasks(), publisher);
            printSummary(name, result);
            return result;
        } catch (WorkflowValidationException e) {
            log.error(name + " was rejected", e);
            return null;
        } finally {
            service.shutdown();
        }
    }

    private static void printEvent(TaskEvent event) {
        String error = event.getError().orElse("unknown error");
        switch (event.getType()) {
            case STARTED:
                log.detail(event.getTaskId() + " started (attempt " + event.getAttempt() + ")");
                break;
            case COMPLETED:
                log.success(event.getTaskId() + " completed successfully");
                break;
            case RETRY:
                log.warning(event.getTaskId() + " retrying (attempt " + event.getAttempt() + "): " + error);
                break;
            case FAILED:
                if (event.isSkip()) {
                    log.failure(event.getTaskId() + " skipped: " + error);
                } else {
                    log.failure(event.getTaskId() + " failed: " + error);
                }
                break;
            default:
                break;
        }
    }

    private static void printSummary(String name, WorkflowResult result) {
        log.blank();
        log.separator();
        log.info(name + " Results:");
        log.keyValue("Status", result.getStatus());
        log.keyValue("Duration", result.getDurationMs() + "ms");
        log.keyValue("Completed", result.getCompletedTasks() + "/" + result.getTotalTasks());
        log.keyValue("Failed", result.getFailedTasks());
        log.keyValue("Skipped", result.getSkippedTasks());

        for (TaskStatus status : List.of(TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.SKIPPED)) {
            List<String> ids = result.getTaskIds(status);
            if (!ids.isEmpty()) {
                log.listItem(status + ": {" + String.join(", ", ids) + "}");
            }
        }
    }
}
