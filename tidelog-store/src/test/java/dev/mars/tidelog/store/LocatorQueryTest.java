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
package dev.mars.tidelog.store;

import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LocatorQuery.
 */
@Tag(TestCategories.CORE)
class LocatorQueryTest {

    private static final Instant EXPIRES = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    @DisplayName("encode() carries the expiry and the optional range")
    void encode_carriesExpiryAndRange() {
        assertEquals("expires=" + EXPIRES.toEpochMilli(), LocatorQuery.encode(EXPIRES, null));
        assertEquals("expires=" + EXPIRES.toEpochMilli() + "&offset=4&length=8",
            LocatorQuery.encode(EXPIRES, ByteRange.of(4, 8)));
    }

    @Test
    @DisplayName("expiry is enforced against the clock, inclusive of the expiry instant")
    void checkNotExpired_comparesAgainstClock() {
        URI locator = URI.create("memory://s/k?" + LocatorQuery.encode(EXPIRES, null));

        assertEquals(EXPIRES, LocatorQuery.expiry(locator));
        assertDoesNotThrow(() -> LocatorQuery.checkNotExpired(locator, Clock.fixed(EXPIRES, ZoneOffset.UTC)));
        ObjectStoreException e = assertThrows(ObjectStoreException.class,
            () -> LocatorQuery.checkNotExpired(locator, Clock.fixed(EXPIRES.plusMillis(1), ZoneOffset.UTC)));
        assertEquals(TideLogErrorCodes.LOCATOR_EXPIRED, e.getCode());
    }

    @Test
    @DisplayName("malformed expiry is reported as an unsupported locator")
    void expiry_rejectsMalformedValue() {
        ObjectStoreException e = assertThrows(ObjectStoreException.class,
            () -> LocatorQuery.expiry(URI.create("memory://s/k?expires=soon")));
        assertEquals(TideLogErrorCodes.LOCATOR_UNSUPPORTED, e.getCode());
        assertEquals(Instant.EPOCH, LocatorQuery.expiry(URI.create("memory://s/k")));
    }
}
