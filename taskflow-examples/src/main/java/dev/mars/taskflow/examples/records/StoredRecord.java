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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a record held by {@link InMemoryRecordService}.
 * Status changes produce a new snapshot via {@link #withStatus(RecordStatus, Instant)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class StoredRecord {

    private final String recordId;
    private final UserProfile profile;
    private final RecordStatus status;
    private final Instant createdAt;
    private final Instant fetchedAt;
    private final Instant updatedAt;

    public StoredRecord(String recordId, UserProfile profile, Instant createdAt) {
        this(recordId, profile, RecordStatus.ACTIVE, createdAt, null, null);
    }

    private StoredRecord(String recordId, UserProfile profile, RecordStatus status,
                         Instant createdAt, Instant fetchedAt, Instant updatedAt) {
        this.recordId = Objects.requireNonNull(recordId, "Record ID cannot be null");
        this.profile = Objects.requireNonNull(profile, "Profile cannot be null");
        this.status = status;
        this.createdAt = createdAt;
        this.fetchedAt = fetchedAt;
        this.updatedAt = updatedAt;
    }

    public StoredRecord withStatus(RecordStatus newStatus, Instant at) {
        switch (newStatus) {
            case FETCHED:
                return new StoredRecord(recordId, profile, newStatus, createdAt, at, updatedAt);
            case UPDATED:
                return new StoredRecord(recordId, profile, newStatus, createdAt, fetchedAt, at);
            default:
                return new StoredRecord(recordId, profile, newStatus, createdAt, fetchedAt, updatedAt);
        }
    }

    public String getRecordId() {
        return recordId;
    }

    public UserProfile getProfile() {
        return profile;
    }

    public RecordStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getFetchedAt() {
        return Optional.ofNullable(fetchedAt);
    }

    public Optional<Instant> getUpdatedAt() {
        return Optional.ofNullable(updatedAt);
    }

    @Override
    public String toString() {
        return "StoredRecord{recordId='" + recordId + "', user=" + profile.getUserId() +
               ", status=" + status + "}";
    }
}
