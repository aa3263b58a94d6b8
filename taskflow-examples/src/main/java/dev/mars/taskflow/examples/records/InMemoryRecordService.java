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

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * In-memory stand-in for a remote user directory and record store.
 *
 * <p>Every call answers asynchronously after a simulated latency. Failures and slow
 * responses can be injected per operation, either for a number of calls (transient) or
 * for every call (permanent), which is enough to drive retries, timeouts and skips in
 * the example workflows without any network access.
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * InMemoryRecordService service = new InMemoryRecordService(50);
 * service.injectFailures(Operation.FETCH_USERS, 1, "Network timeout - retrying");
 * service.injectSlowResponses(Operation.FETCH_RECORD, 2, 2000);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class InMemoryRecordService {
    private static final Logger logger = Logger.getLogger(InMemoryRecordService.class.getName());

    static final int DIRECTORY_SIZE = 10;

    /**
     * Operations that accept injected failures and delays.
     */
    public enum Operation {
        FETCH_USERS,
        STORE,
        FETCH_RECORD,
        UPDATE_RECORD
    }

    private final long latencyMs;
    private final ScheduledExecutorService scheduler;
    private final Map<String, StoredRecord> records = new LinkedHashMap<>();
    private final Map<Operation, Injection> failures = new EnumMap<>(Operation.class);
    private final Map<Operation, Injection> slowResponses = new EnumMap<>(Operation.class);
    private final Map<Operation, AtomicInteger> callCounts = new EnumMap<>(Operation.class);

    public InMemoryRecordService() {
        this(50);
    }

    public InMemoryRecordService(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("Latency cannot be negative: " + latencyMs);
        }
        this.latencyMs = latencyMs;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "record-service-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (Operation operation : Operation.values()) {
            callCounts.put(operation, new AtomicInteger());
        }
    }

    // ==================== Operations ====================

    public CompletableFuture<List<UserProfile>> fetchUsers() {
        return respond(Operation.FETCH_USERS, () -> {
            List<UserProfile> users = new ArrayList<>();
            for (int i = 1; i <= DIRECTORY_SIZE; i++) {
                users.add(new UserProfile(i, "User " + i, "user" + i + "@example.com"));
            }
            return users;
        });
    }

    /**
     * Stores each profile under a freshly generated record id, status ACTIVE.
     */
    public CompletableFuture<List<StoredRecord>> storeAll(Collection<UserProfile> profiles) {
        List<UserProfile> batch = new ArrayList<>(profiles);
        return respond(Operation.STORE, () -> {
            Instant now = Instant.now();
            List<StoredRecord> stored = new ArrayList<>();
            synchronized (records) {
                for (UserProfile profile : batch) {
                    StoredRecord record = new StoredRecord(UUID.randomUUID().toString(), profile, now);
                    records.put(record.getRecordId(), record);
                    stored.add(record);
                }
            }
            return stored;
        });
    }

    /**
     * Looks up the first stored record among the given ids and marks it FETCHED.
     */
    public CompletableFuture<StoredRecord> fetchRecord(Collection<String> recordIds) {
        List<String> ids = new ArrayList<>(recordIds);
        return respond(Operation.FETCH_RECORD, () -> transition(ids, RecordStatus.FETCHED));
    }

    /**
     * Marks the first stored record among the given ids UPDATED.
     */
    public CompletableFuture<StoredRecord> updateRecord(Collection<String> recordIds) {
        List<String> ids = new ArrayList<>(recordIds);
        return respond(Operation.UPDATE_RECORD, () -> transition(ids, RecordStatus.UPDATED));
    }

    // ==================== Fault Injection ====================

    /**
     * Fails the next {@code times} calls of the operation with an {@link IOException}.
     */
    public void injectFailures(Operation operation, int times, String message) {
        synchronized (failures) {
            failures.put(operation, new Injection(times, message, 0));
        }
    }

    /**
     * Fails every call of the operation from now on.
     */
    public void failPermanently(Operation operation, String message) {
        synchronized (failures) {
            failures.put(operation, new Injection(Integer.MAX_VALUE, message, 0));
        }
    }

    /**
     * Delays the next {@code times} responses of the operation by an extra {@code delayMs}.
     */
    public void injectSlowResponses(Operation operation, int times, long delayMs) {
        synchronized (slowResponses) {
            slowResponses.put(operation, new Injection(times, null, delayMs));
        }
    }

    // ==================== Inspection ====================

    public List<StoredRecord> getRecords() {
        synchronized (records) {
            return List.copyOf(records.values());
        }
    }

    public Optional<StoredRecord> getRecord(String recordId) {
        synchronized (records) {
            return Optional.ofNullable(records.get(recordId));
        }
    }

    public int getCallCount(Operation operation) {
        return callCounts.get(operation).get();
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    // ==================== Internals ====================

    private StoredRecord transition(List<String> ids, RecordStatus status) {
        synchronized (records) {
            for (String id : ids) {
                StoredRecord current = records.get(id);
                if (current != null) {
                    StoredRecord changed = current.withStatus(status, Instant.now());
                    records.put(id, changed);
                    return changed;
                }
            }
        }
        throw new IllegalStateException("No records found for IDs: " + String.join(", ", ids));
    }

    private <T> CompletableFuture<T> respond(Operation operation, Supplier<T> action) {
        int call = callCounts.get(operation).incrementAndGet();
        Injection failure = consume(failures, operation);
        Injection slow = consume(slowResponses, operation);
        long delay = latencyMs + (slow != null ? slow.delayMs : 0);

        CompletableFuture<T> future = new CompletableFuture<>();
        scheduler.schedule(() -> {
            if (failure != null) {
                logger.fine(operation + " call " + call + " failing: " + failure.message);
                future.completeExceptionally(new IOException(failure.message));
                return;
            }
            try {
                future.complete(action.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, delay, TimeUnit.MILLISECONDS);
        return future;
    }

    private static Injection consume(Map<Operation, Injection> injections, Operation operation) {
        synchronized (injections) {
            Injection injection = injections.get(operation);
            return injection != null && injection.tryConsume() ? injection : null;
        }
    }

    private static final class Injection {
        private int remaining;
        private final String message;
        private final long delayMs;

        Injection(int times, String message, long delayMs) {
            this.remaining = times;
            this.message = message;
            this.delayMs = delayMs;
        }

        boolean tryConsume() {
            if (remaining <= 0) {
                return false;
            }
            if (remaining != Integer.MAX_VALUE) {
                remaining--;
            }
            return true;
        }
    }
}
