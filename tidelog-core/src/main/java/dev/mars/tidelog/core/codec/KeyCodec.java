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
package dev.mars.tidelog.core.codec;

import dev.mars.tidelog.api.EventKey;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * Builds and parses every object key the event log uses under its root prefix.
 *
 * <p>Key layout ({@code <root>} is the configured namespace, ending in {@code /}):
 * <pre>
 * &lt;root&gt;loose/&lt;ts&gt;~&lt;eventId&gt;                          loose event payload
 * &lt;root&gt;loose-meta/&lt;ts&gt;~&lt;eventId&gt;                     loose event metadata, when present
 * &lt;root&gt;journal/&lt;journalId&gt;                           journal body
 * &lt;root&gt;journal-index/&lt;journalId&gt;                     journal index document
 * &lt;root&gt;key-index/&lt;maxTs&gt;~&lt;journalId&gt;                 key index entry
 * &lt;root&gt;event-index/&lt;eventId&gt;/&lt;revision&gt;              event locator
 * &lt;root&gt;collation-marker/&lt;revision&gt;                  collation marker
 * &lt;root&gt;overlay/&lt;overlayId&gt;                           overlay payload
 * &lt;root&gt;overlay-index/&lt;eventId&gt;/&lt;overlayId&gt;~&lt;KIND&gt;    overlay marker
 * </pre>
 *
 * <p>Timestamps are encoded fixed width in UTC with nanosecond precision, so
 * lexicographic key order is chronological order. Journal ids are
 * {@code <minTs>~<10 digit sequence>}; overlay ids are {@code <writeTs>~<uniquifier>}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class KeyCodec {

    public static final String SEPARATOR = "~";

    static final String LOOSE = "loose/";
    static final String LOOSE_METADATA = "loose-meta/";
    static final String JOURNAL = "journal/";
    static final String JOURNAL_INDEX = "journal-index/";
    static final String KEY_INDEX = "key-index/";
    static final String EVENT_INDEX = "event-index/";
    static final String COLLATION_MARKER = "collation-marker/";
    static final String OVERLAY = "overlay/";
    static final String OVERLAY_INDEX = "overlay-index/";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
        .ofPattern("uuuu-MM-dd'T'HHmmss.SSSSSSSSS'Z'")
        .withZone(ZoneOffset.UTC)
        .withResolverStyle(ResolverStyle.STRICT);

    private static final int TIMESTAMP_LENGTH = 28;
    private static final Instant MIN_TIMESTAMP = Instant.parse("0000-01-01T00:00:00Z");
    private static final Instant MAX_TIMESTAMP = Instant.parse("9999-12-31T23:59:59.999999999Z");

    private final String root;

    public KeyCodec(String rootPrefix) {
        Objects.requireNonNull(rootPrefix, "Root prefix cannot be null");
        if (rootPrefix.isEmpty() || rootPrefix.endsWith("/")) {
            this.root = rootPrefix;
        } else {
            this.root = rootPrefix + "/";
        }
    }

    // ========================================================================
    // Timestamps
    // ========================================================================

    public static String encodeTimestamp(Instant timestamp) {
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (timestamp.isBefore(MIN_TIMESTAMP) || timestamp.isAfter(MAX_TIMESTAMP)) {
            throw new IllegalArgumentException("Timestamp outside encodable range (years 0000-9999): " + timestamp);
        }
        return TIMESTAMP_FORMAT.format(timestamp);
    }

    public static Instant decodeTimestamp(String encoded) {
        if (encoded == null || encoded.length() != TIMESTAMP_LENGTH) {
            throw new IllegalArgumentException("Malformed encoded timestamp: " + encoded);
        }
        try {
            return Instant.from(TIMESTAMP_FORMAT.parse(encoded));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed encoded timestamp: " + encoded, e);
        }
    }

    // ========================================================================
    // Loose events
    // ========================================================================

    public String looseKey(Instant timestamp, String eventId) {
        return root + LOOSE + encodeTimestamp(timestamp) + SEPARATOR + EventIdValidator.validate(eventId);
    }

    public String looseKey(EventKey key) {
        return looseKey(key.timestamp(), key.eventId());
    }

    public String loosePrefix() {
        return root + LOOSE;
    }

    /**
     * Lowest key strictly below every loose key with a timestamp at or after
     * {@code from}, for use as an exclusive listing cursor.
     */
    public String looseFloor(Instant from) {
        return root + LOOSE + encodeTimestamp(from);
    }

    public EventKey decodeLooseKey(String key) {
        return decodeEventKey(key, LOOSE);
    }

    public String looseMetadataKey(EventKey key) {
        return root + LOOSE_METADATA + encodeTimestamp(key.timestamp()) + SEPARATOR
            + EventIdValidator.validate(key.eventId());
    }

    public String looseMetadataPrefix() {
        return root + LOOSE_METADATA;
    }

    /**
     * Exclusive listing cursor for loose metadata at or after {@code from}.
     */
    public String looseMetadataFloor(Instant from) {
        return root + LOOSE_METADATA + encodeTimestamp(from);
    }

    public EventKey decodeLooseMetadataKey(String key) {
        return decodeEventKey(key, LOOSE_METADATA);
    }

    private EventKey decodeEventKey(String key, String section) {
        if (!key.startsWith(root + section)) {
            throw new IllegalArgumentException("Not a " + section + " key: " + key);
        }
        String tail = key.substring(root.length() + section.length());
        int sep = tail.indexOf(SEPARATOR);
        if (sep != TIMESTAMP_LENGTH) {
            throw new IllegalArgumentException("Malformed " + section + " key: " + key);
        }
        return new EventKey(decodeTimestamp(tail.substring(0, sep)),
            EventIdValidator.validate(tail.substring(sep + 1)));
    }

    // ========================================================================
    // Journals
    // ========================================================================

    public static String journalId(Instant minTimestamp, long sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("Journal sequence must be non-negative: " + sequence);
        }
        return encodeTimestamp(minTimestamp) + SEPARATOR + String.format("%010d", sequence);
    }

    public static long journalSequence(String journalId) {
        int sep = journalId.lastIndexOf(SEPARATOR);
        if (sep < 0) {
            throw new IllegalArgumentException("Malformed journal id: " + journalId);
        }
        try {
            return Long.parseLong(journalId.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed journal id: " + journalId, e);
        }
    }

    public String journalKey(String journalId) {
        return root + JOURNAL + journalId;
    }

    public String journalIndexKey(String journalId) {
        return root + JOURNAL_INDEX + journalId;
    }

    // ========================================================================
    // Key index
    // ========================================================================

    public String keyIndexKey(Instant maxTimestamp, String journalId) {
        return root + KEY_INDEX + encodeTimestamp(maxTimestamp) + SEPARATOR + journalId;
    }

    public String keyIndexPrefix() {
        return root + KEY_INDEX;
    }

    /**
     * Exclusive listing cursor placing every entry whose max timestamp is at or
     * after {@code from} in the listing.
     */
    public String keyIndexFloor(Instant from) {
        return root + KEY_INDEX + encodeTimestamp(from);
    }

    // ========================================================================
    // Event locators
    // ========================================================================

    public String locatorPrefix(String eventId) {
        return root + EVENT_INDEX + EventIdValidator.validate(eventId) + "/";
    }

    public String locatorKey(String eventId, long revision) {
        return locatorPrefix(eventId) + String.format("%010d", revision);
    }

    public static long locatorRevision(String locatorKey) {
        return Long.parseLong(locatorKey.substring(locatorKey.lastIndexOf('/') + 1));
    }

    // ========================================================================
    // Collation marker
    // ========================================================================

    public String collationMarkerPrefix() {
        return root + COLLATION_MARKER;
    }

    public String collationMarkerKey(long revision) {
        return root + COLLATION_MARKER + String.format("%019d", revision);
    }

    // ========================================================================
    // Overlays
    // ========================================================================

    public static String overlayId(Instant writeTime, String uniquifier) {
        return encodeTimestamp(writeTime) + SEPARATOR + uniquifier;
    }

    public static Instant overlayWriteTime(String overlayId) {
        return decodeTimestamp(overlayId.substring(0, TIMESTAMP_LENGTH));
    }

    public String overlayKey(String overlayId) {
        return root + OVERLAY + overlayId;
    }

    public String overlayIndexPrefix() {
        return root + OVERLAY_INDEX;
    }

    public String overlayIndexPrefix(String eventId) {
        return root + OVERLAY_INDEX + EventIdValidator.validate(eventId) + "/";
    }

    public String overlayIndexKey(String eventId, String overlayId, String kind) {
        return overlayIndexPrefix(eventId) + overlayId + SEPARATOR + kind;
    }

    /**
     * Splits an overlay index key into {@code [eventId, overlayId, kind]}.
     */
    public String[] decodeOverlayIndexKey(String key) {
        String prefix = root + OVERLAY_INDEX;
        if (!key.startsWith(prefix)) {
            throw new IllegalArgumentException("Not an overlay index key: " + key);
        }
        String tail = key.substring(prefix.length());
        int slash = tail.indexOf('/');
        int kindSep = tail.lastIndexOf(SEPARATOR);
        if (slash <= 0 || kindSep <= slash) {
            throw new IllegalArgumentException("Malformed overlay index key: " + key);
        }
        return new String[] {
            tail.substring(0, slash),
            tail.substring(slash + 1, kindSep),
            tail.substring(kindSep + 1)
        };
    }

    public String getRoot() {
        return root;
    }
}
