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

import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.store.memory.InMemoryObjectStore;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventLocator.
 */
@Tag(TestCategories.CORE)
class EventLocatorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryObjectStore store;
    private KeyCodec codec;
    private EventLocator locator;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore("locators");
        codec = new KeyCodec("tidelog");
        locator = new EventLocator(store, codec, new DocumentCodec());
    }

    @Test
    @DisplayName("unknown events resolve to empty")
    void unknownEvent_resolvesEmpty() {
        assertTrue(locator.resolve("nobody").isEmpty());
    }

    @Test
    @DisplayName("loose pointer round trips with metadata")
    void loosePointer_roundTrips() {
        EventPointer pointer = EventPointer.loose("e1", T0, codec.looseKey(T0, "e1"), 12, Map.of("type", "order"));

        locator.record(pointer);
        EventPointer resolved = locator.resolve("e1").orElseThrow();

        assertEquals(pointer, resolved);
        assertFalse(resolved.inJournal());
        assertEquals(ByteRange.whole(12), resolved.range());
    }

    @Test
    @DisplayName("repointing keeps only the newest revision")
    void repointing_keepsNewestRevision() {
        locator.record(EventPointer.loose("e1", T0, codec.looseKey(T0, "e1"), 3, Map.of()));
        String journalId = KeyCodec.journalId(T0, 1);
        locator.record(EventPointer.collated("e1", T0, journalId, ByteRange.of(40, 3), Map.of()));

        EventPointer resolved = locator.resolve("e1").orElseThrow();

        assertTrue(resolved.inJournal());
        assertEquals(journalId, resolved.journalId());
        assertEquals(ByteRange.of(40, 3), resolved.range());
        assertNull(resolved.looseKey());
        assertEquals(List.of(codec.locatorKey("e1", 1)), store.keys(codec.locatorPrefix("e1")));
    }

    @Test
    @DisplayName("withdrawing a staged revision restores the previous one")
    void withdraw_restoresPreviousRevision() {
        locator.record(EventPointer.loose("e1", T0, codec.looseKey(T0, "e1"), 3, Map.of()));
        EventLocator.Staged staged = locator.stage(
            EventPointer.loose("e1", T0.plusSeconds(1), codec.looseKey(T0.plusSeconds(1), "e1"), 5, Map.of()));

        assertTrue(staged.supersedes());
        assertEquals(5, locator.resolve("e1").orElseThrow().length());

        locator.withdraw(staged);

        assertEquals(3, locator.resolve("e1").orElseThrow().length());
        assertEquals(List.of(codec.locatorKey("e1", 0)), store.keys(codec.locatorPrefix("e1")));
    }

    @Test
    @DisplayName("withdrawing the first revision leaves the event unknown")
    void withdrawFirstRevision_leavesEventUnknown() {
        EventLocator.Staged staged = locator.stage(EventPointer.loose("e1", T0, codec.looseKey(T0, "e1"), 1, Map.of()));

        assertFalse(staged.supersedes());
        locator.withdraw(staged);

        assertTrue(locator.resolve("e1").isEmpty());
        assertTrue(store.keys(codec.locatorPrefix("e1")).isEmpty());
    }

    @Test
    @DisplayName("locators of events sharing a prefix stay separate")
    void sharedPrefixIds_staySeparate() {
        locator.record(EventPointer.loose("e1", T0, codec.looseKey(T0, "e1"), 1, Map.of()));
        locator.record(EventPointer.loose("e1.1", T0, codec.looseKey(T0, "e1.1"), 2, Map.of()));

        assertEquals(1, locator.resolve("e1").orElseThrow().length());
        assertEquals(2, locator.resolve("e1.1").orElseThrow().length());
    }
}
