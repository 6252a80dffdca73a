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
package dev.mars.tidelog.core.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.store.ByteRange;

import java.time.Instant;
import java.util.Map;

/**
 * Where an event's payload currently lives: either a loose object or a byte
 * range inside a journal. Also carries the event's metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventPointer(String eventId, Instant timestamp, String looseKey, String journalId,
                           long offset, long length, Map<String, String> metadata) {

    public EventPointer {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static EventPointer loose(String eventId, Instant timestamp, String looseKey, long length,
                                     Map<String, String> metadata) {
        return new EventPointer(eventId, timestamp, looseKey, null, 0, length, metadata);
    }

    public static EventPointer collated(String eventId, Instant timestamp, String journalId, ByteRange range,
                                        Map<String, String> metadata) {
        return new EventPointer(eventId, timestamp, null, journalId, range.offset(), range.length(), metadata);
    }

    public boolean inJournal() {
        return journalId != null;
    }

    public EventKey key() {
        return new EventKey(timestamp, eventId);
    }

    public ByteRange range() {
        return new ByteRange(offset, length);
    }
}
