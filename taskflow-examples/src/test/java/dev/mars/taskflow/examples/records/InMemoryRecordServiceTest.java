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

package dev.mars.taskflow.examples.records;

import dev.mars.taskflow.examples.records.InMemoryRecordService.Operation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordServiceTest {

    private InMemoryRecordService service;

    @BeforeEach
    void setUp() {
        service = new InMemoryRecordService(1);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    // ========== Operation Tests ==========

    @Test
    void testFetchUsersReturnsDirectory() throws Exception {
        List<UserProfile> users = service.fetchUsers().get(1, TimeUnit.SECONDS);

        assertEquals(InMemoryRecordService.DIRECTORY_SIZE, users.size());
        assertEquals("user1@example.com", users.get(0).getEmail());
    }

    @Test
    void testStoreAssignsDistinctIdsAndActiveStatus() throws Exception {
        List<UserProfile> users = service.fetchUsers().get(1, TimeUnit.SECONDS);
        List<StoredRecord> stored = service.storeAll(users).get(1, TimeUnit.SECONDS);

        assertEquals(users.size(), stored.size());
        assertEquals(users.size(), stored.stream().map(StoredRecord::getRecordId).distinct().count());
        assertTrue(stored.stream().allMatch(r -> r.getStatus() == RecordStatus.ACTIVE));
        assertEquals(users.size(), service.getRecords().size());
    }

    @Test
    void testFetchAndUpdateTransitionFirstKnownRecord() throws Exception {
        List<StoredRecord> stored = service.storeAll(List.of(new UserProfile(1, "Ann", "ann@example.com")))
                .get(1, TimeUnit.SECONDS);
        String id = stored.get(0).getRecordId();

        StoredRecord fetched = service.fetchRecord(List.of("unknown", id)).get(1, TimeUnit.SECONDS);
        assertEquals(id, fetched.getRecordId());
        assertEquals(RecordStatus.FETCHED, fetched.getStatus());

        StoredRecord updated = service.updateRecord(List.of(id)).get(1, TimeUnit.SECONDS);
        assertEquals(RecordStatus.UPDATED, updated.getStatus());
        assertTrue(updated.getFetchedAt().isPresent());
        assertEquals(RecordStatus.UPDATED, service.getRecord(id).orElseThrow().getStatus());
    }

    @Test
    void testUnknownRecordFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> service.fetchRecord(List.of("missing")).get(1, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("No records found for IDs: missing", e.getCause().getMessage());
    }

    // ========== Fault Injection Tests ==========

    @Test
    void testTransientFailureAffectsOnlyGivenCalls() throws Exception {
        service.injectFailures(Operation.FETCH_USERS, 1, "Network timeout - retrying");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> service.fetchUsers().get(1, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("Network timeout - retrying", e.getCause().getMessage());

        assertFalse(service.fetchUsers().get(1, TimeUnit.SECONDS).isEmpty());
        assertEquals(2, service.getCallCount(Operation.FETCH_USERS));
    }

    @Test
    void testPermanentFailureNeverRecovers() {
        service.failPermanently(Operation.UPDATE_RECORD, "Update service permanently unavailable");

        for (int i = 0; i < 3; i++) {
            assertThrows(ExecutionException.class,
                    () -> service.updateRecord(List.of("any")).get(1, TimeUnit.SECONDS));
        }
        assertEquals(3, service.getCallCount(Operation.UPDATE_RECORD));
    }

    @Test
    void testSlowResponsesDelayOnlyGivenCalls() throws Exception {
        service.injectSlowResponses(Operation.FETCH_USERS, 1, 500);

        assertThrows(TimeoutException.class, () -> service.fetchUsers().get(100, TimeUnit.MILLISECONDS));
        assertNotNull(service.fetchUsers().get(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void testNegativeLatencyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryRecordService(-1));
    }
}
