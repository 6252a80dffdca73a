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
import dev.mars.tidelog.api.TemporalRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Index document stored next to each journal body, listing every event in
 * ascending key order with its byte range.
 */
public record JournalIndex(String journalId, long sequence, Instant minTimestamp, Instant maxTimestamp,
                           long size, List<JournalEntry> events) {

    public JournalIndex {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public EventKey firstKey() {
        return events.get(0).key();
    }

    public EventKey lastKey() {
        return events.get(events.size() - 1).key();
    }

    /**
     * Entries whose timestamp falls inside the range, in journal order.
     */
    public List<JournalEntry> select(TemporalRange range) {
        List<JournalEntry> selected = new ArrayList<>();
        for (JournalEntry entry : events) {
            if (range.isBeyond(entry.timestamp())) {
                break;
            }
            if (range.contains(entry.timestamp())) {
                selected.add(entry);
            }
        }
        return selected;
    }
}
