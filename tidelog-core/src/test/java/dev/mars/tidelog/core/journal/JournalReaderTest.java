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
import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.error.CorruptJournalException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.store.memory.InMemoryObjectStore;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JournalBuilder and JournalReader, including index validation.
 */
@Tag(TestCategories.CORE)
class JournalReaderTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryObjectStore store;
    private KeyCodec codec;
    private DocumentCodec documents;
    private JournalReader reader;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore("journals");
        codec = new KeyCodec("tidelog");
        documents = new DocumentCodec();
        reader = new JournalReader(store, codec, documents);
    }

    @Test
    @DisplayName("builder lays payloads back to back with matching index entries")
    void builder_laysPayloadsBackToBack() {
        JournalBuilder builder = new JournalBuilder(3)
            .append(EventKey.of(T0, "a"), bytes("xx"), Map.of("k", "v"))
            .append(EventKey.of(T0, "b"), bytes("yyy"), Map.of())
            .append(EventKey.of(T0.plusSeconds(1), "c"), bytes(""), Map.of());

        JournalIndex index = builder.index();

        assertEquals(KeyCodec.journalId(T0, 3), builder.journalId());
        assertEquals(5, index.size());
        assertEquals(T0, index.minTimestamp());
        assertEquals(T0.plusSeconds(1), index.maxTimestamp());
        assertEquals(ByteRange.of(2, 3), index.events().get(1).range());
        assertEquals(ByteRange.of(5, 0), index.events().get(2).range());
        assertArrayEquals(bytes("xxyyy"), builder.body());
    }

    @Test
    @DisplayName("builder rejects keys that are not strictly ascending")
    void builder_rejectsUnorderedKeys() {
        JournalBuilder builder = new JournalBuilder(1).append(EventKey.of(T0, "b"), bytes("1"), Map.of());

        assertThrows(IllegalArgumentException.class,
            () -> builder.append(EventKey.of(T0, "a"), bytes("2"), Map.of()));
        assertThrows(IllegalArgumentException.class,
            () -> builder.append(EventKey.of(T0, "b"), bytes("2"), Map.of()));
        assertThrows(IllegalStateException.class, () -> new JournalBuilder(1).journalId());
    }

    @Test
    @DisplayName("reader returns selected events from one ranged read")
    void reader_returnsSelectedEvents() {
        JournalIndex index = persist(new JournalBuilder(1)
            .append(EventKey.of(T0, "a"), bytes("first"), Map.of("type", "t1"))
            .append(EventKey.of(T0.plusSeconds(1), "b"), bytes("second"), Map.of())
            .append(EventKey.of(T0.plusSeconds(2), "c"), bytes("third"), Map.of()));
        store.resetCounters();

        JournalIndex read = reader.readIndex(index.journalId());
        List<StoredEvent> events = reader.readEvents(read,
            read.select(TemporalRange.between(T0.plusSeconds(1), T0.plusSeconds(2))));

        assertEquals(2, events.size());
        assertArrayEquals(bytes("second"), events.get(0).getPayload());
        assertArrayEquals(bytes("third"), events.get(1).getPayload());
        assertEquals(2, store.getGetCount());
        assertEquals("t1", read.events().get(0).metadata().get("type"));
    }

    @Test
    @DisplayName("missing index raises JOURNAL_MISSING")
    void missingIndex_raisesJournalMissing() {
        CorruptJournalException e = assertThrows(CorruptJournalException.class,
            () -> reader.readIndex(KeyCodec.journalId(T0, 9)));
        assertEquals(TideLogErrorCodes.JOURNAL_MISSING, e.getCode());
        assertEquals(KeyCodec.journalId(T0, 9), e.getJournalId());
    }

    @Test
    @DisplayName("unparseable index raises CorruptJournalException")
    void unparseableIndex_isCorrupt() {
        String id = KeyCodec.journalId(T0, 1);
        store.put(codec.journalIndexKey(id), bytes("{not json"));

        CorruptJournalException e = assertThrows(CorruptJournalException.class, () -> reader.readIndex(id));
        assertEquals(TideLogErrorCodes.JOURNAL_CORRUPT, e.getCode());
    }

    @Test
    @DisplayName("overlapping entries are rejected")
    void overlappingEntries_areRejected() {
        String id = KeyCodec.journalId(T0, 1);
        JournalIndex bad = new JournalIndex(id, 1, T0, T0.plusSeconds(1), 10, List.of(
            new JournalEntry("a", T0, 0, 6, Map.of()),
            new JournalEntry("b", T0.plusSeconds(1), 4, 6, Map.of())));
        store.put(codec.journalIndexKey(id), documents.write(bad));

        assertThrows(CorruptJournalException.class, () -> reader.readIndex(id));
    }

    @Test
    @DisplayName("entries past the journal size are rejected")
    void entriesPastSize_areRejected() {
        String id = KeyCodec.journalId(T0, 1);
        JournalIndex bad = new JournalIndex(id, 1, T0, T0, 4, List.of(
            new JournalEntry("a", T0, 0, 8, Map.of())));
        store.put(codec.journalIndexKey(id), documents.write(bad));

        assertThrows(CorruptJournalException.class, () -> reader.readIndex(id));
    }

    @Test
    @DisplayName("entries out of key order are rejected")
    void outOfOrderEntries_areRejected() {
        String id = KeyCodec.journalId(T0, 1);
        JournalIndex bad = new JournalIndex(id, 1, T0, T0.plusSeconds(1), 4, List.of(
            new JournalEntry("b", T0.plusSeconds(1), 0, 2, Map.of()),
            new JournalEntry("a", T0, 2, 2, Map.of())));
        store.put(codec.journalIndexKey(id), documents.write(bad));

        assertThrows(CorruptJournalException.class, () -> reader.readIndex(id));
    }

    @Test
    @DisplayName("index naming another journal is rejected")
    void mismatchedJournalId_isRejected() {
        JournalIndex index = persist(new JournalBuilder(1).append(EventKey.of(T0, "a"), bytes("x"), Map.of()));
        String other = KeyCodec.journalId(T0, 2);
        store.put(codec.journalIndexKey(other), store.get(codec.journalIndexKey(index.journalId())).orElseThrow());

        assertThrows(CorruptJournalException.class, () -> reader.readIndex(other));
    }

    @Test
    @DisplayName("truncated body raises CorruptJournalException")
    void truncatedBody_isCorrupt() {
        JournalIndex index = persist(new JournalBuilder(1)
            .append(EventKey.of(T0, "a"), bytes("abcdef"), Map.of()));
        store.put(codec.journalKey(index.journalId()), bytes("abc"));

        JournalIndex read = reader.readIndex(index.journalId());
        assertThrows(CorruptJournalException.class, () -> reader.readEvents(read, read.events()));
    }

    @Test
    @DisplayName("missing body raises JOURNAL_MISSING")
    void missingBody_raisesJournalMissing() {
        JournalIndex index = persist(new JournalBuilder(1).append(EventKey.of(T0, "a"), bytes("x"), Map.of()));
        store.delete(codec.journalKey(index.journalId()));

        CorruptJournalException e = assertThrows(CorruptJournalException.class,
            () -> reader.readRange(index.journalId(), ByteRange.of(0, 1)));
        assertEquals(TideLogErrorCodes.JOURNAL_MISSING, e.getCode());
    }

    private JournalIndex persist(JournalBuilder builder) {
        JournalIndex index = builder.index();
        store.put(codec.journalKey(index.journalId()), builder.body());
        store.put(codec.journalIndexKey(index.journalId()), documents.write(index));
        return index;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
