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

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Query string carried by locators that the bundled stores issue:
 * {@code expires=<epoch millis>} plus the presigned byte range, if any.
 */
public final class LocatorQuery {

    private static final String EXPIRES = "expires";
    private static final String OFFSET = "offset";
    private static final String LENGTH = "length";

    private LocatorQuery() {
        // Utility class - no instantiation
    }

    public static String encode(Instant expires, ByteRange range) {
        StringBuilder query = new StringBuilder(EXPIRES).append('=').append(expires.toEpochMilli());
        if (range != null) {
            query.append('&').append(OFFSET).append('=').append(range.offset())
                .append('&').append(LENGTH).append('=').append(range.length());
        }
        return query.toString();
    }

    /**
     * Fails with {@link TideLogErrorCodes#LOCATOR_EXPIRED} once the locator's
     * expiry has passed. A locator without an expiry counts as expired.
     */
    public static void checkNotExpired(URI locator, Clock clock) {
        Instant expires = expiry(locator);
        if (clock.instant().isAfter(expires)) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_EXPIRED,
                    "Locator expired at " + expires + ": " + locator, null);
        }
    }

    public static Instant expiry(URI locator) {
        String value = parse(locator.getQuery()).get(EXPIRES);
        if (value == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_UNSUPPORTED,
                    "Malformed expiry in locator " + locator, e);
        }
    }

    static Map<String, String> parse(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return params;
    }
}
