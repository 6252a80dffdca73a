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
package dev.mars.tidelog.core;

import dev.mars.tidelog.api.CollationResult;
import dev.mars.tidelog.api.EventLog;
import dev.mars.tidelog.api.EventLookup;
import dev.mars.tidelog.api.ManifestEntry;
import dev.mars.tidelog.api.OverlayDecision;
import dev.mars.tidelog.api.StoredEvent;
import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.error.EventNotFoundException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.EventIdValidator;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.collation.CollationMarkerStore;
import dev.mars.tidelog.core.collation.Collator;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.index.EventPointer;
import dev.mars.tidelog.core.index.KeyIndex;
import dev.mars.tidelog.core.journal.JournalReader;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import dev.mars.tidelog.core.overlay.OverlayManager;
import dev.mars.tidelog.core.replay.ReplayEngine;
import dev.mars.tidelog.core.writer.EventWriter;
import dev.mars.tidelog.core.writer.LooseMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link EventLog} over a single {@link ObjectStore} namespace.
 *
 * <p>This class only wires the components together and enforces the open/closed
 * lifecycle; the log's behaviour lives in {@link EventWriter}, {@link Collator},
 * {@link OverlayManager} and {@link ReplayEngine}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ObjectStoreEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreEventLog.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final EventLocator locator;
    private final JournalReader journals;
    private final KeyIndex keyIndex;
    private final EventWriter writer;
    private final Collator collator;
    private final OverlayManager overlays;
    private final ReplayEngine replayEngine;
    private final int defaultManifestJournals;
    private volatile boolean closed = false;

    private ObjectStoreEventLog(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Object store cannot be null");
        this.codec = new KeyCodec(builder.rootPrefix);
        DocumentCodec documents = new DocumentCodec();
        this.locator = new EventLocator(store, codec, documents);
        this.journals = new JournalReader(store, codec, documents);
        this.keyIndex = new KeyIndex(store, codec, documents);
        LooseMetadataStore looseMetadata = new LooseMetadataStore(store, codec, documents);
        this.writer = new EventWriter(store, codec, locator, looseMetadata, builder.metrics, builder.clock);
        this.collator = new Collator(store, codec, documents, keyIndex, locator, looseMetadata, journals,
            new CollationMarkerStore(store, codec, documents), builder.maxEventsPerJournal,
            builder.metrics, builder.clock);
        this.overlays = new OverlayManager(store, codec, documents, locator, builder.metrics, builder.clock);
        this.replayEngine = new ReplayEngine(store, codec, keyIndex, locator, looseMetadata, journals, overlays,
            builder.manifestTtl, builder.metrics);
        this.defaultManifestJournals = builder.manifestMaxJournals;
        logger.info("Event log opened at root '{}'", codec.getRoot());
    }

    public static Builder builder(ObjectStore store) {
        return new Builder(store);
    }

    @Override
    public StoredEvent put(String eventId, byte[] payload, Instant timestamp) {
        return put(eventId, payload, timestamp, Map.of());
    }

    @Override
    public StoredEvent put(String eventId, byte[] payload, Instant timestamp, Map<String, String> metadata) {
        ensureOpen();
        return writer.put(eventId, payload, timestamp, metadata);
    }

    @Override
    public StoredEvent put(byte[] payload) {
        ensureOpen();
        return writer.put(payload);
    }

    @Override
    public CollationResult collate(int minBatchSize) {
        ensureOpen();
        return collator.collate(minBatchSize);
    }

    @Override
    public String update(String eventId, byte[] payload) {
        ensureOpen();
        requireWritten(eventId);
        return overlays.update(eventId, payload).overlayId();
    }

    @Override
    public String delete(String eventId) {
        ensureOpen();
        requireWritten(eventId);
        return overlays.delete(eventId).overlayId();
    }

    @Override
    public Stream<StoredEvent> replay(TemporalRange range) {
        ensureOpen();
        return replayEngine.replay(Objects.requireNonNull(range, "Range cannot be null"));
    }

    @Override
    public List<ManifestEntry> replayManifest(TemporalRange range) {
        return replayManifest(range, defaultManifestJournals);
    }

    @Override
    public List<ManifestEntry> replayManifest(TemporalRange range, int maxJournals) {
        ensureOpen();
        if (maxJournals < 0) {
            throw new IllegalArgumentException("maxJournals must be non-negative");
        }
        return replayEngine.manifest(Objects.requireNonNull(range, "Range cannot be null"), maxJournals);
    }

    @Override
    public EventLookup getEvent(String eventId) {
        ensureOpen();
        EventIdValidator.validate(eventId);
        Optional<EventPointer> pointer = locator.resolve(eventId);
        if (pointer.isEmpty()) {
            return EventLookup.notFound(eventId);
        }
        OverlayDecision decision = overlays.resolve(eventId);
        if (decision.isDelete()) {
            return EventLookup.deleted(eventId);
        }

        EventPointer p = pointer.get();
        Optional<byte[]> payload = decision.isUpdate()
            ? Optional.of(overlays.loadPayload(decision.getOverlayId()))
            : readPayload(p);
        return payload
            .map(bytes -> EventLookup.found(new StoredEvent(eventId, p.timestamp(), bytes, p.metadata())))
            .orElseGet(() -> EventLookup.notFound(eventId));
    }

    @Override
    public boolean eventExists(String eventId) {
        ensureOpen();
        return getEvent(eventId).isFound();
    }

    /**
     * Overlays may target deleted events but not events whose payload was never stored.
     */
    private void requireWritten(String eventId) {
        if (getEvent(eventId).getStatus() == EventLookup.Status.NOT_FOUND) {
            throw new EventNotFoundException(eventId);
        }
    }

    private Optional<byte[]> readPayload(EventPointer pointer) {
        if (pointer.inJournal()) {
            return Optional.of(journals.readRange(pointer.journalId(), pointer.range()));
        }
        Optional<byte[]> loose = store.get(pointer.looseKey());
        if (loose.isPresent()) {
            return loose;
        }
        // collated between resolving the locator and reading the loose object
        Optional<EventPointer> current = locator.resolve(pointer.eventId());
        if (current.isPresent() && current.get().inJournal()) {
            return Optional.of(journals.readRange(current.get().journalId(), current.get().range()));
        }
        logger.warn("Event {} has a locator but no payload at {}", pointer.eventId(), pointer.looseKey());
        return Optional.empty();
    }

    /**
     * Removes every object under this log's root prefix.
     */
    @Override
    public void destroy() {
        ensureOpen();
        long deleted = 0;
        try (Stream<String> keys = store.listAll(codec.getRoot())) {
            Iterator<String> it = keys.iterator();
            while (it.hasNext()) {
                store.delete(it.next());
                deleted++;
            }
        }
        logger.info("Destroyed event log at root '{}' ({} objects removed)", codec.getRoot(), deleted);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.info("Event log at root '{}' closed", codec.getRoot());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public KeyIndex getKeyIndex() {
        return keyIndex;
    }

    public Collator getCollator() {
        return collator;
    }

    public OverlayManager getOverlayManager() {
        return overlays;
    }

    public KeyCodec getKeyCodec() {
        return codec;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Event log at root '" + codec.getRoot() + "' is closed");
        }
    }

    /**
     * Builder for {@link ObjectStoreEventLog}.
     */
    public static class Builder {
        private final ObjectStore store;
        private String rootPrefix = "tidelog";
        private Clock clock = Clock.systemUTC();
        private int maxEventsPerJournal = 10000;
        private Duration manifestTtl = Duration.ofMinutes(15);
        private int manifestMaxJournals = 0;
        private TideLogMetrics metrics;

        private Builder(ObjectStore store) {
            this.store = store;
        }

        public Builder rootPrefix(String rootPrefix) {
            this.rootPrefix = rootPrefix;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxEventsPerJournal(int maxEventsPerJournal) {
            this.maxEventsPerJournal = maxEventsPerJournal;
            return this;
        }

        public Builder manifestTtl(Duration manifestTtl) {
            this.manifestTtl = manifestTtl;
            return this;
        }

        public Builder manifestMaxJournals(int manifestMaxJournals) {
            this.manifestMaxJournals = manifestMaxJournals;
            return this;
        }

        public Builder metrics(TideLogMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ObjectStoreEventLog build() {
            return new ObjectStoreEventLog(this);
        }
    }
}
