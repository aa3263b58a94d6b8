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

import dev.mars.taskflow.examples.records.InMemoryRecordService;
import dev.mars.taskflow.examples.records.InMemoryRecordService.Operation;
import dev.mars.taskflow.examples.records.StoredRecord;
import dev.mars.taskflow.examples.records.UserProfile;
import dev.mars.taskflow.workflow.Task;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * A four-step record pipeline against an {@link InMemoryRecordService}:
 * fetch user profiles, store them as records, fetch one record's details, update it.
 * Each step depends on the previous one and hands its output to the next through
 * state held by this instance, so every run needs a fresh workflow.
 *
 * <p>The factory methods build the three demonstration scenarios. The failing and
 * skipping variants inject their faults into the given service.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class RecordWorkflow {

    public static final String FETCH_DATA = "fetchRandomJSONData";
    public static final String STORE_DATA = "storeData";
    public static final String FETCH_DETAILS = "fetchRecordDetails";
    public static final String UPDATE_DETAILS = "updateRecordDetails";

    private final InMemoryRecordService service;
    private final TaskSettings settings;
    private final AtomicReference<List<UserProfile>> fetchedUsers = new AtomicReference<>();
    private final AtomicReference<List<String>> recordIds = new AtomicReference<>(List.of());

    private RecordWorkflow(InMemoryRecordService service, TaskSettings settings) {
        this.service = Objects.requireNonNull(service, "Record service cannot be null");
        this.settings = settings;
    }

    /**
     * Every step succeeds on its first attempt.
     */
    public static RecordWorkflow createWorkingWorkflow(InMemoryRecordService service) {
        return new RecordWorkflow(service, new TaskSettings(2, 1, 2, 3, 3000));
    }

    /**
     * Fetch and store fail once and recover on retry, the first two detail lookups
     * outlast their timeout, and the update fails permanently with no retries.
     */
    public static RecordWorkflow createFailedWorkflow(InMemoryRecordService service) {
        service.injectFailures(Operation.FETCH_USERS, 1, "Network timeout - retrying");
        service.injectFailures(Operation.STORE, 1, "connection failed - retrying");
        service.injectSlowResponses(Operation.FETCH_RECORD, 2, 2000);
        service.failPermanently(Operation.UPDATE_RECORD, "Update service permanently unavailable");
        return new RecordWorkflow(service, new TaskSettings(2, 1, 2, 0, 1500));
    }

    /**
     * The first step fails permanently, so everything downstream is skipped.
     */
    public static RecordWorkflow createSkippedWorkflow(InMemoryRecordService service) {
        service.failPermanently(Operation.FETCH_USERS, "Network permanently unavailable");
        return new RecordWorkflow(service, new TaskSettings(0, 1, 2, 3, 3000));
    }

    public List<Task> getTasks() {
        return List.of(
                Task.builder(FETCH_DATA)
                        .work(this::fetchData)
                        .retries(settings.fetchRetries)
                        .timeoutMs(5000)
                        .build(),
                Task.builder(STORE_DATA)
                        .work(this::storeData)
                        .dependsOn(FETCH_DATA)
                        .retries(settings.storeRetries)
                        .timeoutMs(2000)
                        .build(),
                Task.builder(FETCH_DETAILS)
                        .work(this::fetchDetails)
                        .dependsOn(STORE_DATA)
                        .retries(settings.detailsRetries)
                        .timeoutMs(settings.detailsTimeoutMs)
                        .build(),
                Task.builder(UPDATE_DETAILS)
                        .work(this::updateDetails)
                        .dependsOn(FETCH_DETAILS)
                        .retries(settings.updateRetries)
                        .timeoutMs(2000)
                        .build());
    }

    public List<String> getRecordIds() {
        return recordIds.get();
    }

    private CompletionStage<Integer> fetchData() {
        return service.fetchUsers().thenApply(users -> {
            fetchedUsers.set(users);
            return users.size();
        });
    }

    private CompletionStage<Integer> storeData() {
        List<UserProfile> users = fetchedUsers.get();
        if (users == null || users.isEmpty()) {
            throw new IllegalStateException("No valid data available to store");
        }
        return service.storeAll(users).thenApply(stored -> {
            List<String> ids = stored.stream()
                    .map(StoredRecord::getRecordId)
                    .collect(Collectors.toList());
            recordIds.set(ids);
            return ids.size();
        });
    }

    private CompletionStage<StoredRecord> fetchDetails() {
        return service.fetchRecord(requireRecordIds());
    }

    private CompletionStage<StoredRecord> updateDetails() {
        return service.updateRecord(requireRecordIds());
    }

    private List<String> requireRecordIds() {
        List<String> ids = recordIds.get();
        if (ids.isEmpty()) {
            throw new IllegalStateException("No record IDs available");
        }
        return ids;
    }

    private static final class TaskSettings {
        final int fetchRetries;
        final int storeRetries;
        final int detailsRetries;
        final int updateRetries;
        final long detailsTimeoutMs;

        TaskSettings(int fetchRetries, int storeRetries, int detailsRetries, int updateRetries,
                     long detailsTimeoutMs) {
            this.fetchRetries = fetchRetries;
            this.storeRetries = storeRetries;
            this.detailsRetries = detailsRetries;
            this.updateRetries = updateRetries;
            this.detailsTimeoutMs = detailsTimeoutMs;
        }
    }
}
