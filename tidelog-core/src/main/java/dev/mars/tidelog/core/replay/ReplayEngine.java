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
package dev.mars.tidelog.core.replay;

import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.ManifestEntry;
import dev.mars.tidelog.api.OverlayDecision;
import dev.mars.tidelog.api.StoredEvent;
import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.error.CorruptJournalException;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.index.EventPointer;
import dev.mars.tidelog.core.index.JournalRef;
import dev.mars.tidelog.core.index.KeyIndex;
import dev.mars.tidelog.core.journal.JournalEntry;
import dev.mars.tidelog.core.journal.JournalIndex;
import dev.mars.tidelog.core.journal.JournalReader;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import dev.mars.tidelog.core.overlay.OverlayManager;
import dev.mars.tidelog.core.overlay.OverlayRecord;
import dev.mars.tidelog.core.overlay.OverlaySnapshot;
import dev.mars.tidelog.core.writer.LooseMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Produces the merged view of journals, loose events and overlays for a time
 * window, either as events or as a manifest of presigned locators.
 *
 * <p>Planning happens in this order:
 * <ol>
 *   <li>query the key index for overlapping journals</li>
 *   <li>list loose keys inside the window, starting at the window start</li>
 *   <li>list the loose metadata documents inside the window</li>
 *   <li>query the key index again and add journals registered meanwhile</li>
 *   <li>snapshot the overlay index</li>
 * </ol>
 * An event collated while planning therefore shows up in a journal, as a
 * loose key, or both; the merge keeps the journal copy when both appear.
 * A loose object deleted after listing is re-read through its locator; locators
 * are not consulted for loose objects that are still present.
 * Listing loose keys from the window start, rather than from the collation
 * position, keeps late-arriving events visible.</p>
 *
 * <p>Journal corruption is never skipped: a {@link CorruptJournalException}
 * ends the replay.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ReplayEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReplayEngine.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final KeyIndex keyIndex;
    private final EventLocator locator;
    private final LooseMetadataStore looseMetadata;
    private final JournalReader journals;
    private final OverlayManager overlays;
    private final Duration locatorTtl;
    private final TideLogMetrics metrics;

    public ReplayEngine(ObjectStore store, KeyCodec codec, KeyIndex keyIndex, EventLocator locator,
                        LooseMetadataStore looseMetadata, JournalReader journals, OverlayManager overlays, Duration locatorTtl,
                        TideLogMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.keyIndex = keyIndex;
        this.locator = locator;
        this.looseMetadata = looseMetadata;
        this.journals = journals;
        this.overlays = overlays;
        this.locatorTtl = locatorTtl;
        this.metrics = metrics;
    }

    /**
     * Events in the window in {@code (timestamp, eventId)} order with overlays
     * applied. Listing happens now; payloads are fetched as the stream is consumed.
     */
    public Stream<StoredEvent> replay(TemporalRange range) {
        ReplayPlan plan = plan(range);
        Iterator<Candidate> merged = new MergingIterator<>(
            journalCandidates(plan), looseCandidates(plan), Candidate::key);
        Iterator<StoredEvent> events = new OverlayingIterator(merged, plan.overlays());
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(events, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Locators for the events {@link #replay(TemporalRange)} would return,
     * including deleted events marked with their delete decision.
     *
     * @param maxJournals maximum number of journals to include, or zero for no limit;
     *                    when the limit applies, the manifest stops at the end of the last included journal
     */
    public List<ManifestEntry> manifest(TemporalRange range, int maxJournals) {
        ReplayPlan plan = plan(range);
        List<JournalRef> refs = plan.journals();
        boolean limited = maxJournals > 0 && refs.size() > maxJournals;
        if (limited) {
            refs = refs.subList(0, maxJournals);
        }

        List<ManifestEntry> journalEntries = new ArrayList<>();
        EventKey cutoff = null;
        for (JournalRef ref : refs) {
            JournalIndex index = readIndex(ref.journalId());
            for (JournalEntry entry : index.select(plan.range())) {
                URI uri = store.presign(codec.journalKey(ref.journalId()), entry.range(), locatorTtl);
                journalEntries.add(ManifestEntry.original(entry.eventId(), entry.timestamp(), entry.metadata(),
                    uri, entry.range(), OverlayDecision.none()));
            }
            cutoff = index.lastKey();
        }

        List<ManifestEntry> looseEntries = new ArrayList<>();
        for (EventKey key : plan.looseKeys()) {
            if (limited && key.isAfter(cutoff)) {
                break;
            }
            looseManifestEntry(key).ifPresent(looseEntries::add);
        }

        Iterator<ManifestEntry> merged = new MergingIterator<>(journalEntries.iterator(), looseEntries.iterator(),
            entry -> new EventKey(entry.getTimestamp(), entry.getEventId()));
        List<ManifestEntry> manifest = new ArrayList<>();
        while (merged.hasNext()) {
            manifest.add(applyDecision(merged.next(), plan.overlays()));
        }
        logger.debug("Built manifest of {} entries for {} ({} journals{})", manifest.size(), range,
            refs.size(), limited ? ", limited" : "");
        return manifest;
    }

    ReplayPlan plan(TemporalRange range) {
        long started = System.nanoTime();
        List<JournalRef> first = keyIndex.query(range);
        List<EventKey> looseKeys = listLoose(range);
        Set<EventKey> withMetadata = looseKeys.isEmpty() ? Set.of() : looseMetadata.keysWithin(range);
        List<JournalRef> second = keyIndex.query(range);

        Map<String, JournalRef> union = new LinkedHashMap<>();
        first.forEach(ref -> union.put(ref.journalId(), ref));
        second.forEach(ref -> union.putIfAbsent(ref.journalId(), ref));
        List<JournalRef> refs = new ArrayList<>(union.values());
        refs.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));

        OverlaySnapshot snapshot = overlays.snapshot();
        if (metrics != null) {
            metrics.recordReplayPlanned(Duration.ofNanos(System.nanoTime() - started));
        }
        logger.debug("Replay plan for {}: {} journals, {} loose events, {} overlays",
            range, refs.size(), looseKeys.size(), snapshot.size());
        return new ReplayPlan(range, Collections.unmodifiableList(refs), looseKeys, withMetadata, snapshot);
    }

    private List<EventKey> listLoose(TemporalRange range) {
        String startAfter = range.getStart() != null ? codec.looseFloor(range.getStart()) : null;
        List<EventKey> keys = new ArrayList<>();
        try (Stream<String> listing = store.listAll(codec.loosePrefix(), startAfter)) {
            Iterator<String> it = listing.iterator();
            while (it.hasNext()) {
                EventKey key = codec.decodeLooseKey(it.next());
                if (range.isBeyond(key.timestamp())) {
                    break;
                }
                if (range.contains(key.timestamp())) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    private JournalIndex readIndex(String journalId) {
        try {
            return journals.readIndex(journalId);
        } catch (CorruptJournalException e) {
            reportCorruption(e);
            throw e;
        }
    }

    private List<StoredEvent> readJournal(JournalRef ref, TemporalRange range) {
        try {
            JournalIndex index = journals.readIndex(ref.journalId());
            return journals.readEvents(index, index.select(range));
        } catch (CorruptJournalException e) {
            reportCorruption(e);
            throw e;
        }
    }

    private void reportCorruption(CorruptJournalException e) {
        if (metrics != null) {
            metrics.recordCorruptJournal();
        }
        logger.error("Journal {} failed validation [{}]: {}", e.getJournalId(), e.getCode(), e.getMessage());
    }

    /**
     * Reads a loose event, falling back to its locator when the loose object
     * was collated and deleted after listing.
     */
    private Optional<StoredEvent> fetchLoose(EventKey key, boolean hasMetadata) {
        Optional<byte[]> payload = store.get(codec.looseKey(key));
        if (payload.isPresent()) {
            Map<String, String> metadata = hasMetadata ? looseMetadataFor(key) : Map.of();
            return Optional.of(new StoredEvent(key.eventId(), key.timestamp(), payload.get(), metadata));
        }

        Optional<EventPointer> pointer = resolveExact(key);
        if (pointer.isPresent() && pointer.get().inJournal()) {
            EventPointer p = pointer.get();
            byte[] bytes = journals.readRange(p.journalId(), p.range());
            logger.debug("Loose event {} was collated into {} during replay", key, p.journalId());
            return Optional.of(new StoredEvent(key.eventId(), key.timestamp(), bytes, p.metadata()));
        }
        skipped(key);
        return Optional.empty();
    }

    private Map<String, String> looseMetadataFor(EventKey key) {
        return looseMetadata.read(key)
            .orElseGet(() -> resolveExact(key).map(EventPointer::metadata).orElse(Map.of()));
    }

    private Optional<EventPointer> resolveExact(EventKey key) {
        return locator.resolve(key.eventId()).filter(p -> p.key().equals(key));
    }

    private Optional<ManifestEntry> looseManifestEntry(EventKey key) {
        Optional<EventPointer> pointer = resolveExact(key);
        if (pointer.isPresent()) {
            EventPointer p = pointer.get();
            String objectKey = p.inJournal() ? codec.journalKey(p.journalId()) : codec.looseKey(key);
            ByteRange range = p.range();
            return Optional.of(ManifestEntry.original(key.eventId(), key.timestamp(), p.metadata(),
                store.presign(objectKey, range, locatorTtl), range, OverlayDecision.none()));
        }
        // no locator for this exact key, so size the loose object directly
        String looseKey = codec.looseKey(key);
        Optional<byte[]> payload = store.get(looseKey);
        if (payload.isEmpty()) {
            skipped(key);
            return Optional.empty();
        }
        ByteRange range = ByteRange.whole(payload.get().length);
        return Optional.of(ManifestEntry.original(key.eventId(), key.timestamp(), Map.of(),
            store.presign(looseKey, range, locatorTtl), range, OverlayDecision.none()));
    }

    private ManifestEntry applyDecision(ManifestEntry entry, OverlaySnapshot snapshot) {
        Optional<OverlayRecord> overlay = snapshot.latest(entry.getEventId());
        if (overlay.isEmpty()) {
            return entry;
        }
        OverlayRecord record = overlay.get();
        if (record.kind() == OverlayDecision.Kind.DELETE) {
            return ManifestEntry.original(entry.getEventId(), entry.getTimestamp(), entry.getMetadata(),
                entry.getLocator(), entry.getByteRange(), record.decision());
        }
        ByteRange replacementRange = ByteRange.whole(overlays.payloadSize(record));
        URI replacement = store.presign(codec.overlayKey(record.overlayId()), replacementRange, locatorTtl);
        return new ManifestEntry(entry.getEventId(), entry.getTimestamp(), entry.getMetadata(),
            entry.getLocator(), entry.getByteRange(), record.decision(), replacement, replacementRange);
    }

    private void skipped(EventKey key) {
        if (metrics != null) {
            metrics.recordEventSkipped();
        }
        logger.warn("Event {} at {} disappeared before it could be read, skipping", key.eventId(), key.timestamp());
    }

    private Iterator<Candidate> journalCandidates(ReplayPlan plan) {
        return new Iterator<>() {
            private final Iterator<JournalRef> refs = plan.journals().iterator();
            private Iterator<StoredEvent> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && refs.hasNext()) {
                    current = readJournal(refs.next(), plan.range()).iterator();
                }
                return current.hasNext();
            }

            @Override
            public Candidate next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                StoredEvent event = current.next();
                return new Candidate(event.key(), event, false);
            }
        };
    }

    private Iterator<Candidate> looseCandidates(ReplayPlan plan) {
        Iterator<EventKey> keys = plan.looseKeys().iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public Candidate next() {
                EventKey key = keys.next();
                return new Candidate(key, null, plan.looseMetadata().contains(key));
            }
        };
    }

    /**
     * An event position in the merge. Journal candidates arrive with their
     * payload; loose candidates are fetched only if they survive de-duplication.
     */
    private final class Candidate {
        private final EventKey key;
        private final StoredEvent loaded;
        private final boolean hasMetadata;

        Candidate(EventKey key, StoredEvent loaded, boolean hasMetadata) {
            this.key = key;
            this.loaded = loaded;
            this.hasMetadata = hasMetadata;
        }

        EventKey key() {
            return key;
        }

        Optional<StoredEvent> load() {
            return loaded != null ? Optional.of(loaded) : fetchLoose(key, hasMetadata);
        }
    }

    private final class OverlayingIterator implements Iterator<StoredEvent> {
        private final Iterator<Candidate> candidates;
        private final OverlaySnapshot snapshot;
        private StoredEvent next;

        OverlayingIterator(Iterator<Candidate> candidates, OverlaySnapshot snapshot) {
            this.candidates = candidates;
            this.snapshot = snapshot;
        }

        @Override
        public boolean hasNext() {
            while (next == null && candidates.hasNext()) {
                Candidate candidate = candidates.next();
                OverlayDecision decision = snapshot.decision(candidate.key().eventId());
                if (decision.isDelete()) {
                    continue;
                }
                Optional<StoredEvent> event = candidate.load();
                if (event.isEmpty()) {
                    continue;
                }
                next = decision.isUpdate()
                    ? event.get().withPayload(overlays.loadPayload(decision.getOverlayId()))
                    : event.get();
            }
            return next != null;
        }

        @Override
        public StoredEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StoredEvent value = next;
            next = null;
            if (metrics != null) {
                metrics.recordEventReplayed();
            }
            return value;
        }
    }
}
