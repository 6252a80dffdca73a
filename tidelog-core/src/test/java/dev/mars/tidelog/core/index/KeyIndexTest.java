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

import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.error.CorruptJournalException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.testutil.FaultInjectingObjectStore;
import dev.mars.tidelog.store.memory.InMemoryObjectStore;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyIndex registration and range queries.
 */
@Tag(TestCategories.CORE)
class KeyIndexTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryObjectStore store;
    private KeyIndex keyIndex;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore("key-index");
        keyIndex = new KeyIndex(store, new KeyCodec("tidelog"), new DocumentCodec());
    }

    @Test
    @DisplayName("empty index answers every query with nothing")
    void emptyIndex_returnsNothing() {
        assertTrue(keyIndex.query(TemporalRange.all()).isEmpty());
        assertTrue(keyIndex.latest().isEmpty());
    }

    @Test
    @DisplayName("query returns exactly the journals overlapping the window")
    void query_returnsOverlappingJournals() {
        registerHourlyJournals(50);

        List<Long> sequences = keyIndex.query(TemporalRange.between(hour(10).plusSeconds(1000), hour(11).plusSeconds(10)))
            .stream().map(JournalRef::sequence).collect(Collectors.toList());

        assertEquals(List.of(11L, 12L), sequences);
    }

    @Test
    @DisplayName("window bounds touching a journal edge include it")
    void query_includesJournalsTouchingBounds() {
        registerHourlyJournals(5);

        assertEquals(List.of(2L), sequences(TemporalRange.at(hour(1).plusSeconds(1800))));
        assertEquals(List.of(3L), sequences(TemporalRange.at(hour(2))));
        assertTrue(sequences(TemporalRange.between(hour(1).plusSeconds(1801), hour(2).minusNanos(1))).isEmpty());
    }

    @Test
    @DisplayName("open-ended windows reach the first or last journal")
    void query_handlesOpenEndedWindows() {
        registerHourlyJournals(5);

        assertEquals(List.of(1L, 2L), sequences(TemporalRange.until(hour(1))));
        assertEquals(List.of(4L, 5L), sequences(TemporalRange.from(hour(3).plusSeconds(5))));
        assertEquals(5, sequences(TemporalRange.all()).size());
    }

    @Test
    @DisplayName("queries are answered from the listing without reading entry documents")
    void query_doesNotReadEntryDocuments() {
        registerHourlyJournals(200);
        store.resetCounters();

        keyIndex.query(TemporalRange.between(hour(150), hour(151)));

        assertEquals(0, store.getGetCount());
        assertEquals(1, store.getListCount());
    }

    @Test
    @DisplayName("latest() returns the most recently registered journal")
    void latest_returnsLastJournal() {
        registerHourlyJournals(3);

        JournalRef latest = keyIndex.latest().orElseThrow();
        assertEquals(3, latest.sequence());
        assertEquals(3, keyIndex.latest(hour(2)).orElseThrow().sequence());
        assertTrue(keyIndex.latest(hour(5)).isEmpty());
    }

    @Test
    @DisplayName("sequence going backwards is reported as corruption")
    void decreasingSequence_isCorruption() {
        keyIndex.register(entry(2, T0, T0.plusSeconds(1)));
        keyIndex.register(entry(1, T0.plusSeconds(2), T0.plusSeconds(3)));

        CorruptJournalException e = assertThrows(CorruptJournalException.class,
            () -> keyIndex.query(TemporalRange.all()));
        assertEquals(TideLogErrorCodes.KEY_INDEX_OUT_OF_ORDER, e.getCode());
    }

    @Test
    @DisplayName("overlapping journals are reported as corruption")
    void overlappingJournals_areCorruption() {
        keyIndex.register(entry(1, T0, T0.plusSeconds(10)));
        keyIndex.register(entry(2, T0.plusSeconds(5), T0.plusSeconds(20)));

        assertThrows(CorruptJournalException.class, () -> keyIndex.latest());
    }

    @Test
    @DisplayName("journals sharing a boundary timestamp are accepted")
    void sharedBoundaryTimestamp_isAccepted() {
        keyIndex.register(entry(1, T0, T0.plusSeconds(10)));
        keyIndex.register(entry(2, T0.plusSeconds(10), T0.plusSeconds(10)));
        keyIndex.register(entry(3, T0.plusSeconds(10), T0.plusSeconds(30)));

        assertEquals(List.of(1L, 2L, 3L), sequences(TemporalRange.at(T0.plusSeconds(10))));
    }

    @Test
    @DisplayName("malformed key index keys are reported as corruption")
    void malformedKeys_areCorruption() {
        store.put("tidelog/key-index/not-a-key", new byte[0]);

        assertThrows(CorruptJournalException.class, () -> keyIndex.query(TemporalRange.all()));
    }

    @Test
    @DisplayName("rejected registration surfaces as INDEX_WRITE_REJECTED")
    void rejectedRegistration_surfacesWriteException() {
        FaultInjectingObjectStore faulty = new FaultInjectingObjectStore(store);
        faulty.failPutsContaining("/key-index/");
        KeyIndex index = new KeyIndex(faulty, new KeyCodec("tidelog"), new DocumentCodec());

        WriteException e = assertThrows(WriteException.class, () -> index.register(entry(1, T0, T0)));
        assertEquals(TideLogErrorCodes.INDEX_WRITE_REJECTED, e.getCode());
    }

    private List<Long> sequences(TemporalRange range) {
        return keyIndex.query(range).stream().map(JournalRef::sequence).collect(Collectors.toList());
    }

    /**
     * Journal n (1-based) spans the first half of hour n-1.
     */
    private void registerHourlyJournals(int count) {
        for (int n = 1; n <= count; n++) {
            keyIndex.register(entry(n, hour(n - 1), hour(n - 1).plusSeconds(1800)));
        }
    }

    private static Instant hour(int h) {
        return T0.plus(Duration.ofHours(h));
    }

    private static KeyIndexEntry entry(long sequence, Instant min, Instant max) {
        return new KeyIndexEntry(KeyCodec.journalId(min, sequence), sequence, min, max,
            "e-first", "e-last", 10, 100);
    }
}
