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
import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.TideLogException;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.EventIdValidator;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Records updates and deletions as overlays and answers which overlay, if
 * any, governs an event.
 *
 * <p>An overlay is two objects: the primary {@code overlay/<overlayId>} holding
 * the replacement payload (empty for a delete), then the marker
 * {@code overlay-index/<eventId>/<overlayId>~<KIND>}. The overlay takes effect
 * once the marker exists. Journals and loose objects are never modified.</p>
 *
 * <p>The latest overlay by id wins. Overlay ids start with the write time; ids
 * issued by one manager are strictly increasing even when the clock does not
 * advance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class OverlayManager {
    private static final Logger logger = LoggerFactory.getLogger(OverlayManager.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;
    private final EventLocator locator;
    private final TideLogMetrics metrics;
    private final Clock clock;
    private Instant lastIssued = Instant.MIN;

    public OverlayManager(ObjectStore store, KeyCodec codec, DocumentCodec documents, EventLocator locator,
                          TideLogMetrics metrics, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
        this.locator = locator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Replaces the payload of an existing event.
     *
     * @throws EventNotFoundException if the event was never written
     */
    public OverlayRecord update(String eventId, byte[] payload) {
        Objects.requireNonNull(payload, "Payload cannot be null");
        return write(eventId, OverlayDecision.Kind.UPDATE, payload);
    }

    /**
     * Hides an existing event from replay and lookups.
     *
     * @throws EventNotFoundException if the event was never written
     */
    public OverlayRecord delete(String eventId) {
        return write(eventId, OverlayDecision.Kind.DELETE, new byte[0]);
    }

    private OverlayRecord write(String eventId, OverlayDecision.Kind kind, byte[] payload) {
        EventIdValidator.validate(eventId);
        if (locator.resolve(eventId).isEmpty()) {
            throw new EventNotFoundException(eventId);
        }

        String overlayId = nextOverlayId();
        String overlayKey = codec.overlayKey(overlayId);
        String markerKey = codec.overlayIndexKey(eventId, overlayId, kind.name());
        try {
            store.put(overlayKey, payload);
        } catch (ObjectStoreException e) {
            throw new WriteException(TideLogErrorCodes.OVERLAY_WRITE_REJECTED, overlayKey, e);
        }
        try {
            store.put(markerKey, documents.write(
                new OverlayMarker(eventId, overlayId, kind, payload.length, KeyCodec.overlayWriteTime(overlayId))));
        } catch (ObjectStoreException e) {
            throw new WriteException(TideLogErrorCodes.OVERLAY_WRITE_REJECTED, markerKey, e);
        }

        if (metrics != null) {
            metrics.recordOverlayWritten(kind.name());
        }
        logger.debug("Wrote {} overlay {} for event {}", kind, overlayId, eventId);
        return new OverlayRecord(eventId, overlayId, kind);
    }

    /**
     * Decision for a single event from its latest overlay.
     */
    public OverlayDecision resolve(String eventId) {
        List<OverlayRecord> history = history(eventId);
        return history.isEmpty() ? OverlayDecision.none() : history.get(history.size() - 1).decision();
    }

    /**
     * All overlays written against an event, oldest first.
     */
    public List<OverlayRecord> history(String eventId) {
        List<OverlayRecord> records = new ArrayList<>();
        try (Stream<String> keys = store.listAll(codec.overlayIndexPrefix(eventId))) {
            keys.map(this::decode).forEach(records::add);
        }
        return records;
    }

    /**
     * Latest overlay for every event that has one, from one pass over the overlay index.
     */
    public OverlaySnapshot snapshot() {
        Map<String, OverlayRecord> latest = new HashMap<>();
        try (Stream<String> keys = store.listAll(codec.overlayIndexPrefix())) {
            Iterator<String> it = keys.iterator();
            while (it.hasNext()) {
                OverlayRecord record = decode(it.next());
                OverlayRecord current = latest.get(record.eventId());
                if (current == null || record.overlayId().compareTo(current.overlayId()) > 0) {
                    latest.put(record.eventId(), record);
                }
            }
        }
        logger.debug("Overlay snapshot holds {} events", latest.size());
        return new OverlaySnapshot(latest);
    }

    /**
     * Replacement payload written by an update overlay.
     */
    public byte[] loadPayload(String overlayId) {
        return store.get(codec.overlayKey(overlayId)).orElseThrow(() ->
            new TideLogException(TideLogErrorCodes.OVERLAY_NOT_FOUND, "Overlay payload missing: " + overlayId));
    }

    /**
     * Size of an overlay's replacement payload, from its marker document.
     */
    public long payloadSize(OverlayRecord record) {
        Optional<byte[]> raw = store.get(codec.overlayIndexKey(record.eventId(), record.overlayId(),
            record.kind().name()));
        if (raw.isEmpty()) {
            throw new TideLogException(TideLogErrorCodes.OVERLAY_NOT_FOUND,
                "Overlay marker missing: " + record.overlayId());
        }
        return documents.read(raw.get(), OverlayMarker.class).size();
    }

    private OverlayRecord decode(String key) {
        String[] parts = codec.decodeOverlayIndexKey(key);
        return new OverlayRecord(parts[0], parts[1], OverlayDecision.Kind.valueOf(parts[2]));
    }

    private synchronized String nextOverlayId() {
        Instant now = clock.instant();
        if (!now.isAfter(lastIssued)) {
            now = lastIssued.plusNanos(1);
        }
        lastIssued = now;
        return KeyCodec.overlayId(now, UUID.randomUUID().toString());
    }
}
