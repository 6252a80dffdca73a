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
package dev.mars.tidelog.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * The externally visible view of an event: its current payload (original or
 * most recent update) at its original timestamp. Only ever built at read time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class StoredEvent {

    private final String eventId;
    private final Instant timestamp;
    private final byte[] payload;
    private final Map<String, String> metadata;

    public StoredEvent(String eventId, Instant timestamp, byte[] payload, Map<String, String> metadata) {
        this.eventId = Objects.requireNonNull(eventId, "Event ID cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null").clone();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public StoredEvent(String eventId, Instant timestamp, byte[] payload) {
        this(eventId, timestamp, payload, Map.of());
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Optional content metadata supplied when the event was written.
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public EventKey key() {
        return new EventKey(timestamp, eventId);
    }

    /**
     * Same event with its payload replaced, keeping id, timestamp and metadata.
     */
    public StoredEvent withPayload(byte[] newPayload) {
        return new StoredEvent(eventId, timestamp, newPayload, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredEvent that = (StoredEvent) o;
        return eventId.equals(that.eventId)
                && timestamp.equals(that.timestamp)
                && Arrays.equals(payload, that.payload)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, timestamp, Arrays.hashCode(payload), metadata);
    }

    @Override
    public String toString() {
        return "StoredEvent{" +
                "eventId='" + eventId + '\'' +
                ", timestamp=" + timestamp +
                ", payloadSize=" + payload.length +
                ", metadata=" + metadata +
                '}';
    }
}
