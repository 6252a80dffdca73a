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

import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One event of a replay manifest: where its bytes live and which overlay
 * decision applies, so a remote consumer can materialize the replay without
 * querying overlays itself.
 *
 * <p>For {@link OverlayDecision.Kind#UPDATE} the replacement payload is read
 * from {@code replacementLocator}/{@code replacementRange} instead of the
 * original location. {@link OverlayDecision.Kind#DELETE} entries must be
 * skipped by consumers.</p>
 */
public final class ManifestEntry {

    private final String eventId;
    private final Instant timestamp;
    private final Map<String, String> metadata;
    private final URI locator;
    private final ByteRange byteRange;
    private final OverlayDecision decision;
    private final URI replacementLocator;
    private final ByteRange replacementRange;

    public ManifestEntry(String eventId, Instant timestamp, Map<String, String> metadata,
                         URI locator, ByteRange byteRange, OverlayDecision decision,
                         URI replacementLocator, ByteRange replacementRange) {
        this.eventId = Objects.requireNonNull(eventId, "Event ID cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.locator = Objects.requireNonNull(locator, "Locator cannot be null");
        this.byteRange = Objects.requireNonNull(byteRange, "Byte range cannot be null");
        this.decision = Objects.requireNonNull(decision, "Overlay decision cannot be null");
        if (decision.isUpdate() && (replacementLocator == null || replacementRange == null)) {
            throw new IllegalArgumentException("Update decisions require a replacement locator and range");
        }
        this.replacementLocator = replacementLocator;
        this.replacementRange = replacementRange;
    }

    public static ManifestEntry original(String eventId, Instant timestamp, Map<String, String> metadata,
                                         URI locator, ByteRange byteRange, OverlayDecision decision) {
        return new ManifestEntry(eventId, timestamp, metadata, locator, byteRange, decision, null, null);
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public URI getLocator() {
        return locator;
    }

    public ByteRange getByteRange() {
        return byteRange;
    }

    public OverlayDecision getDecision() {
        return decision;
    }

    public URI getReplacementLocator() {
        return replacementLocator;
    }

    public ByteRange getReplacementRange() {
        return replacementRange;
    }

    /**
     * @return the locator holding the current payload
     */
    public URI effectiveLocator() {
        return decision.isUpdate() ? replacementLocator : locator;
    }

    /**
     * @return the range holding the current payload
     */
    public ByteRange effectiveRange() {
        return decision.isUpdate() ? replacementRange : byteRange;
    }

    @Override
    public String toString() {
        return "ManifestEntry{" +
                "eventId='" + eventId + '\'' +
                ", timestamp=" + timestamp +
                ", locator=" + locator +
                ", byteRange=" + byteRange +
                ", decision=" + decision +
                '}';
    }
}
