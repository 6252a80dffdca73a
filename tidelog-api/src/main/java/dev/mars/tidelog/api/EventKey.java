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
import java.util.Comparator;
import java.util.Objects;

/**
 * The ordering key of an event: timestamp first, event id as tie-break.
 * Replay output, journal content and loose listings all follow this order.
 *
 * @param timestamp creation timestamp of the event
 * @param eventId unique event id
 */
public record EventKey(Instant timestamp, String eventId) implements Comparable<EventKey> {

    public static final Comparator<EventKey> ORDER =
            Comparator.comparing(EventKey::timestamp).thenComparing(EventKey::eventId);

    public EventKey {
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(eventId, "Event ID cannot be null");
    }

    public static EventKey of(Instant timestamp, String eventId) {
        return new EventKey(timestamp, eventId);
    }

    @Override
    public int compareTo(EventKey other) {
        return ORDER.compare(this, other);
    }

    public boolean isAfter(EventKey other) {
        return compareTo(other) > 0;
    }
}
