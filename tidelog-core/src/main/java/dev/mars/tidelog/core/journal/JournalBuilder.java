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
import dev.mars.tidelog.core.codec.KeyCodec;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Concatenates event payloads into a journal body and records each payload's
 * byte range. Events must be appended in strictly ascending key order.
 */
public class JournalBuilder {

    private final long sequence;
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final List<JournalEntry> entries = new ArrayList<>();
    private EventKey lastKey;

    public JournalBuilder(long sequence) {
        this.sequence = sequence;
    }

    public JournalBuilder append(EventKey key, byte[] payload, Map<String, String> metadata) {
        if (lastKey != null && !key.isAfter(lastKey)) {
            throw new IllegalArgumentException("Journal events must be strictly ascending: " + key + " after " + lastKey);
        }
        entries.add(new JournalEntry(key.eventId(), key.timestamp(), body.size(), payload.length, metadata));
        body.writeBytes(payload);
        lastKey = key;
        return this;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public String journalId() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Journal has no events");
        }
        return KeyCodec.journalId(entries.get(0).timestamp(), sequence);
    }

    public byte[] body() {
        return body.toByteArray();
    }

    public JournalIndex index() {
        String journalId = journalId();
        return new JournalIndex(journalId, sequence,
            entries.get(0).timestamp(),
            entries.get(entries.size() - 1).timestamp(),
            body.size(),
            entries);
    }
}
