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

import java.util.Objects;
import java.util.Optional;

/**
 * Result of looking up a single event by id.
 */
public final class EventLookup {

    public enum Status {
        /** The event exists and is not tombstoned. */
        FOUND,
        /** No loose object and no journal entry exists for the id. */
        NOT_FOUND,
        /** The event exists but a delete overlay tombstones it. */
        DELETED
    }

    private final String eventId;
    private final Status status;
    private final StoredEvent event;

    private EventLookup(String eventId, Status status, StoredEvent event) {
        this.eventId = Objects.requireNonNull(eventId, "Event ID cannot be null");
        this.status = status;
        this.event = event;
    }

    public static EventLookup found(StoredEvent event) {
        return new EventLookup(event.getEventId(), Status.FOUND, event);
    }

    public static EventLookup notFound(String eventId) {
        return new EventLookup(eventId, Status.NOT_FOUND, null);
    }

    public static EventLookup deleted(String eventId) {
        return new EventLookup(eventId, Status.DELETED, null);
    }

    public String getEventId() {
        return eventId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * @return the merged event view, present only when {@link Status#FOUND}
     */
    public Optional<StoredEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    @Override
    public String toString() {
        return "EventLookup{eventId='" + eventId + "', status=" + status + '}';
    }
}
