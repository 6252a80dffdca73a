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

package dev.mars.tidelog.core.overlay;

import dev.mars.tidelog.api.OverlayDecision;
import dev.mars.tidelog.api.error.EventNotFoundException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.TideLogException;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.index.EventPointer;
import dev.mars.tidelog.core.testutil.FaultInjectingObjectStore;
import dev.mars.tidelog.core.testutil.TestClock;
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
 * Unit tests for OverlayManager.
 */
@Tag(TestCategories.CORE)
class OverlayManagerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryObjectStore memory;
    private FaultInjectingObjectStore store;
    private KeyCodec codec;
    private OverlayManager overlays;

    @BeforeEach
    void setUp() {
        memory = new InMemoryObjectStore("overlays");
        store = new FaultInjectingObjectStore(memory);
        codec = new KeyCodec("tidelog");
        DocumentCodec documents = new DocumentCodec();
        EventLocator locator = new EventLocator(store, codec, documents);
        for (String id : List.of("e1", "e2", "e3")) {
            locator.record(EventPointer.loose(id, T0, codec.looseKey(T0, id), 1, Map.of()));
        }
        // fixed clock: ids must still increase
        overlays = new OverlayManager(store, codec, documents, locator, null, new TestClock(T0.plusSeconds(60)));
    }

    @Test
    @DisplayName("events without overlays resolve to NONE")
    void noOverlay_resolvesNone() {
        assertEquals(OverlayDecision.none(), overlays.resolve("e1"));
        assertTrue(overlays.history("e1").isEmpty());
        assertTrue(overlays.snapshot().isEmpty());
    }

    @Test
    @DisplayName("update stores the replacement payload")
    void update_storesReplacementPayload() {
        OverlayRecord record = overlays.update("e1", bytes("new"));

        assertEquals(OverlayDecision.update(record.overlayId()), overlays.resolve("e1"));
        assertArrayEquals(bytes("new"), overlays.loadPayload(record.overlayId()));
        assertEquals(3, overlays.payloadSize(record));
        assertEquals(T0.plusSeconds(60), record.writeTime());
    }

    @Test
    @DisplayName("the latest overlay wins regardless of kind")
    void latestOverlay_wins() {
        overlays.update("e1", bytes("v2"));
        OverlayRecord delete = overlays.delete("e1");
        assertTrue(overlays.resolve("e1").isDelete());

        OverlayRecord revived = overlays.update("e1", bytes("v3"));
        assertEquals(OverlayDecision.update(revived.overlayId()), overlays.resolve("e1"));

        List<OverlayRecord> history = overlays.history("e1");
        assertEquals(3, history.size());
        assertEquals(delete, history.get(1));
        assertTrue(history.get(0).overlayId().compareTo(history.get(1).overlayId()) < 0);
        assertTrue(history.get(1).overlayId().compareTo(history.get(2).overlayId()) < 0);
    }

    @Test
    @DisplayName("snapshot holds the latest overlay per event")
    void snapshot_holdsLatestPerEvent() {
        overlays.update("e1", bytes("a"));
        OverlayRecord e1Delete = overlays.delete("e1");
        OverlayRecord e2Update = overlays.update("e2", bytes("b"));

        OverlaySnapshot snapshot = overlays.snapshot();

        assertEquals(2, snapshot.size());
        assertEquals(e1Delete.decision(), snapshot.decision("e1"));
        assertEquals(e2Update, snapshot.latest("e2").orElseThrow());
        assertEquals(OverlayDecision.none(), snapshot.decision("e3"));
    }

    @Test
    @DisplayName("overlays on unknown events are rejected")
    void unknownEvent_isRejected() {
        EventNotFoundException e = assertThrows(EventNotFoundException.class,
            () -> overlays.update("ghost", bytes("x")));
        assertEquals("ghost", e.getEventId());
        assertThrows(EventNotFoundException.class, () -> overlays.delete("ghost"));
        assertTrue(memory.keys(codec.overlayIndexPrefix()).isEmpty());
    }

    @Test
    @DisplayName("overlay without its marker has no effect")
    void overlayWithoutMarker_hasNoEffect() {
        store.failPutsContaining("/overlay-index/");

        WriteException e = assertThrows(WriteException.class, () -> overlays.delete("e1"));

        assertEquals(TideLogErrorCodes.OVERLAY_WRITE_REJECTED, e.getCode());
        assertEquals(OverlayDecision.none(), overlays.resolve("e1"));
    }

    @Test
    @DisplayName("missing overlay payload raises OVERLAY_NOT_FOUND")
    void missingPayload_raisesOverlayNotFound() {
        OverlayRecord record = overlays.update("e1", bytes("x"));
        memory.delete(codec.overlayKey(record.overlayId()));

        TideLogException e = assertThrows(TideLogException.class, () -> overlays.loadPayload(record.overlayId()));
        assertEquals(TideLogErrorCodes.OVERLAY_NOT_FOUND, e.getCode());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
