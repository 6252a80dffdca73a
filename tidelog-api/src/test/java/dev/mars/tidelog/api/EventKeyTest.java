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

import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventKey ordering.
 */
@Tag(TestCategories.CORE)
class EventKeyTest {

    private static final Instant T1 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2025-03-01T10:00:01Z");

    @Test
    @DisplayName("keys order by timestamp then event id")
    void keys_orderByTimestampThenEventId() {
        List<EventKey> keys = new ArrayList<>(List.of(
            EventKey.of(T2, "a"),
            EventKey.of(T1, "b"),
            EventKey.of(T1, "a")));

        Collections.sort(keys);

        assertEquals(List.of(EventKey.of(T1, "a"), EventKey.of(T1, "b"), EventKey.of(T2, "a")), keys);
    }

    @Test
    @DisplayName("isAfter() is strict")
    void isAfter_isStrict() {
        EventKey key = EventKey.of(T1, "a");

        assertFalse(key.isAfter(EventKey.of(T1, "a")));
        assertTrue(EventKey.of(T1, "b").isAfter(key));
        assertTrue(EventKey.of(T2, "0").isAfter(EventKey.of(T1, "z")));
    }

    @Test
    @DisplayName("constructor rejects null components")
    void constructor_rejectsNullComponents() {
        assertThrows(NullPointerException.class, () -> EventKey.of(null, "a"));
        assertThrows(NullPointerException.class, () -> EventKey.of(T1, null));
    }
}
