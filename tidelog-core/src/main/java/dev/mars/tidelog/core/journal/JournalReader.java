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
import dev.mars.tidelog.api.StoredEvent;
import dev.mars.tidelog.api.error.CorruptJournalException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads journal indexes and payload ranges, validating everything it reads.
 *
 * <p>Any inconsistency between an index and its body raises
 * {@link CorruptJournalException}: overlapping or out-of-order entries,
 * entries running past the recorded size, a missing body or a short read.
 * Reads never return partial journals.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class JournalReader {
    private static final Logger logger = LoggerFactory.getLogger(JournalReader.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;

    public JournalReader(ObjectStore store, KeyCodec codec, DocumentCodec documents) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
    }

    public JournalIndex readIndex(String journalId) {
        byte[] raw = store.get(codec.journalIndexKey(journalId))
            .orElseThrow(() -> new CorruptJournalException(TideLogErrorCodes.JOURNAL_MISSING, journalId,
                "index document is missing"));
        JournalIndex index;
        try {
            index = documents.read(raw, JournalIndex.class);
        } catch (IllegalArgumentException e) {
            throw new CorruptJournalException(journalId, e.getMessage());
        }
        validate(journalId, index);
        return index;
    }

    /**
     * Fetches the payloads of {@code selected}, which must be a contiguous run
     * of entries from {@code index}, with a single ranged read.
     */
    public List<StoredEvent> readEvents(JournalIndex index, List<JournalEntry> selected) {
        if (selected.isEmpty()) {
            return List.of();
        }
        JournalEntry first = selected.get(0);
        JournalEntry last = selected.get(selected.size() - 1);
        ByteRange covering = ByteRange.of(first.offset(), last.offset() + last.length() - first.offset());
        byte[] block = readRange(index.journalId(), covering);

        List<StoredEvent> events = new ArrayList<>(selected.size());
        for (JournalEntry entry : selected) {
            byte[] payload = entry.range().relativeTo(covering).slice(block);
            events.add(new StoredEvent(entry.eventId(), entry.timestamp(), payload, entry.metadata()));
        }
        logger.debug("Read {} events from journal {} ({} bytes)", events.size(), index.journalId(), covering.length());
        return events;
    }

    /**
     * Reads exactly {@code range} from a journal body.
     */
    public byte[] readRange(String journalId, ByteRange range) {
        byte[] bytes = store.get(codec.journalKey(journalId), range)
            .orElseThrow(() -> new CorruptJournalException(TideLogErrorCodes.JOURNAL_MISSING, journalId,
                "journal body is missing"));
        if (bytes.length != range.length()) {
            throw new CorruptJournalException(journalId,
                "short read of " + range + ": got " + bytes.length + " bytes");
        }
        return bytes;
    }

    private static void validate(String journalId, JournalIndex index) {
        if (!journalId.equals(index.journalId())) {
            throw new CorruptJournalException(journalId, "index names journal " + index.journalId());
        }
        if (index.events().isEmpty() || index.minTimestamp() == null || index.maxTimestamp() == null) {
            throw new CorruptJournalException(journalId, "index lists no events");
        }
        long previousEnd = 0;
        EventKey previousKey = null;
        for (JournalEntry entry : index.events()) {
            if (entry.eventId() == null || entry.timestamp() == null || entry.length() < 0) {
                throw new CorruptJournalException(journalId, "index entry is incomplete");
            }
            if (entry.offset() < previousEnd) {
                throw new CorruptJournalException(journalId,
                    "entry " + entry.eventId() + " at offset " + entry.offset() + " overlaps or precedes previous entry");
            }
            if (entry.offset() + entry.length() > index.size()) {
                throw new CorruptJournalException(journalId,
                    "entry " + entry.eventId() + " at " + entry.range() + " runs past journal size " + index.size());
            }
            if (previousKey != null && !entry.key().isAfter(previousKey)) {
                throw new CorruptJournalException(journalId,
                    "entry " + entry.eventId() + " is out of key order");
            }
            previousEnd = entry.offset() + entry.length();
            previousKey = entry.key();
        }
        if (!index.minTimestamp().equals(index.firstKey().timestamp())
                || !index.maxTimestamp().equals(index.lastKey().timestamp())) {
            throw new CorruptJournalException(journalId, "timestamp bounds do not match entries");
        }
    }
}
