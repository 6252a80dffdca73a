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
package dev.mars.tidelog.core.journal;

import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.store.ByteRange;

import java.time.Instant;
import java.util.Map;

/**
 * Position of one event inside a journal body.
 */
public record JournalEntry(String eventId, Instant timestamp, long offset, long length,
                           Map<String, String> metadata) {

    public JournalEntry {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public EventKey key() {
        return new EventKey(timestamp, eventId);
    }

    public ByteRange range() {
        return new ByteRange(offset, length);
    }
}
