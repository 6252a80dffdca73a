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

import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ManifestEntry and OverlayDecision.
 */
@Tag(TestCategories.CORE)
class ManifestEntryTest {

    private static final Instant TS = Instant.parse("2025-03-01T10:00:00Z");
    private static final URI ORIGINAL = URI.create("memory://test/journal/a");
    private static final URI REPLACEMENT = URI.create("memory://test/overlay/b");

    @Test
    @DisplayName("original entry points at its own locator")
    void originalEntry_pointsAtOwnLocator() {
        ManifestEntry entry = ManifestEntry.original("e1", TS, Map.of("type", "order"),
            ORIGINAL, ByteRange.of(10, 5), OverlayDecision.none());

        assertEquals(ORIGINAL, entry.effectiveLocator());
        assertEquals(ByteRange.of(10, 5), entry.effectiveRange());
        assertEquals("order", entry.getMetadata().get("type"));
        assertNull(entry.getReplacementLocator());
    }

    @Test
    @DisplayName("update entry points at the replacement payload")
    void updateEntry_pointsAtReplacement() {
        ManifestEntry entry = new ManifestEntry("e1", TS, null, ORIGINAL, ByteRange.of(10, 5),
            OverlayDecision.update("ov1"), REPLACEMENT, ByteRange.whole(7));

        assertEquals(REPLACEMENT, entry.effectiveLocator());
        assertEquals(ByteRange.whole(7), entry.effectiveRange());
        assertEquals(ORIGINAL, entry.getLocator());
        assertTrue(entry.getMetadata().isEmpty());
    }

    @Test
    @DisplayName("update entry without replacement is rejected")
    void updateEntry_withoutReplacementIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ManifestEntry.original("e1", TS, null,
            ORIGINAL, ByteRange.of(0, 1), OverlayDecision.update("ov1")));
    }

    @Test
    @DisplayName("overlay decisions compare by kind and id")
    void overlayDecisions_compareByKindAndId() {
        assertEquals(OverlayDecision.delete("x"), OverlayDecision.delete("x"));
        assertNotEquals(OverlayDecision.delete("x"), OverlayDecision.update("x"));
        assertSame(OverlayDecision.none(), OverlayDecision.none());
        assertNull(OverlayDecision.none().getOverlayId());
        assertEquals("DELETE(x)", OverlayDecision.delete("x").toString());
    }
}
