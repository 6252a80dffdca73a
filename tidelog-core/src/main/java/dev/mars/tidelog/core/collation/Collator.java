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
package dev.mars.tidelog.core.collation;

import dev.mars.tidelog.api.CollationResult;
import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.error.CollationConflictException;
import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.index.EventPointer;
import dev.mars.tidelog.core.index.JournalRef;
import dev.mars.tidelog.core.index.KeyIndex;
import dev.mars.tidelog.core.index.KeyIndexEntry;
import dev.mars.tidelog.core.journal.JournalBuilder;
import dev.mars.tidelog.core.journal.JournalEntry;
import dev.mars.tidelog.core.journal.JournalIndex;
import dev.mars.tidelog.core.journal.JournalReader;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import dev.mars.tidelog.core.writer.LooseMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Folds loose events into immutable journals.
 *
 * <p>A run proceeds in a fixed order so that a crash at any point leaves the
 * log readable and the next run able to finish the job:
 * <ol>
 *   <li>reconcile the collation marker with the key index, completing a
 *       journal that was registered by an interrupted run</li>
 *   <li>list loose events after the marker position</li>
 *   <li>write the journal body, then its index document</li>
 *   <li>register the journal in the key index</li>
 *   <li>repoint the folded events' locators at the journal</li>
 *   <li>delete the folded loose objects</li>
 *   <li>advance the marker</li>
 * </ol>
 * Until step 4 the new journal is invisible and the loose objects still serve
 * reads. After step 4 replay de-duplicates the journal against any loose copy
 * that has not yet been deleted.</p>
 *
 * <p>The journal sequence is always the marker's sequence plus one, so a
 * journal orphaned before registration is overwritten by the next run.
 * Callers must ensure only one collator runs per namespace at a time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class Collator {
    private static final Logger logger = LoggerFactory.getLogger(Collator.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;
    private final KeyIndex keyIndex;
    private final EventLocator locator;
    private final LooseMetadataStore looseMetadata;
    private final JournalReader journals;
    private final CollationMarkerStore markers;
    private final int maxEventsPerJournal;
    private final TideLogMetrics metrics;
    private final Clock clock;

    public Collator(ObjectStore store, KeyCodec codec, DocumentCodec documents, KeyIndex keyIndex,
                    EventLocator locator, LooseMetadataStore looseMetadata, JournalReader journals,
                    CollationMarkerStore markers,
                    int maxEventsPerJournal, TideLogMetrics metrics, Clock clock) {
        if (maxEventsPerJournal < 1) {
            throw new IllegalArgumentException("maxEventsPerJournal must be positive");
        }
        this.store = store;
        this.codec = codec;
        this.documents = documents;
        this.keyIndex = keyIndex;
        this.locator = locator;
        this.looseMetadata = looseMetadata;
        this.journals = journals;
        this.markers = markers;
        this.maxEventsPerJournal = maxEventsPerJournal;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs one collation pass.
     *
     * @param minBatchSize minimum number of loose events needed to produce a journal
     * @throws CollationConflictException if the marker and key index disagree in a
     *         way a single interrupted run cannot explain, or the marker moved underneath this run
     * @throws WriteException if the object store rejects a write
     */
    public synchronized CollationResult collate(int minBatchSize) {
        if (minBatchSize < 1) {
            throw new IllegalArgumentException("minBatchSize must be positive: " + minBatchSize);
        }
        if (minBatchSize > maxEventsPerJournal) {
            throw new IllegalArgumentException("minBatchSize " + minBatchSize
                + " exceeds the journal capacity of " + maxEventsPerJournal + " events");
        }
        long started = System.nanoTime();

        CollationMarker marker = markers.read();
        String recovered = reconcile(marker);
        if (recovered != null) {
            marker = markers.read();
        }

        String startAfter = marker.hasPosition() ? codec.looseKey(marker.position()) : null;
        List<String> looseKeys;
        try (Stream<String> keys = store.listAll(codec.loosePrefix(), startAfter)) {
            looseKeys = keys.limit(maxEventsPerJournal).collect(Collectors.toList());
        }

        if (looseKeys.size() < minBatchSize) {
            logger.debug("Collation skipped: {} loose events available, {} required", looseKeys.size(), minBatchSize);
            if (metrics != null) {
                metrics.recordCollationSkipped(Duration.ofNanos(System.nanoTime() - started));
            }
            return CollationResult.nothingToDo(recovered);
        }

        long sequence = marker.sequence() + 1;
        EventKey lastKey = codec.decodeLooseKey(looseKeys.get(looseKeys.size() - 1));
        Set<EventKey> withMetadata = looseMetadata.keysBetween(marker.position(), lastKey);
        JournalBuilder builder = new JournalBuilder(sequence);
        for (String looseKey : looseKeys) {
            EventKey key = codec.decodeLooseKey(looseKey);
            byte[] payload = store.get(looseKey).orElseThrow(() -> new CollationConflictException(
                "Loose event " + looseKey + " disappeared during collation"));
            builder.append(key, payload, withMetadata.contains(key) ? metadataFor(key) : Map.of());
        }

        String journalId = builder.journalId();
        JournalIndex index = builder.index();
        put(codec.journalKey(journalId), builder.body());
        put(codec.journalIndexKey(journalId), documents.write(index));
        keyIndex.register(new KeyIndexEntry(journalId, sequence, index.minTimestamp(), index.maxTimestamp(),
            index.firstKey().eventId(), index.lastKey().eventId(), index.events().size(), index.size()));

        complete(index, marker);

        if (metrics != null) {
            metrics.recordCollation(index.events().size(), sequence, Duration.ofNanos(System.nanoTime() - started));
        }
        logger.info("Collated {} events into journal {} ({} bytes)", index.events().size(), journalId, index.size());
        return CollationResult.collated(index.events().size(), journalId, recovered);
    }

    /**
     * Checks the marker against the key index and completes a journal that an
     * interrupted run registered but did not finish.
     *
     * @return the id of the recovered journal, or {@code null} if nothing needed recovery
     */
    private String reconcile(CollationMarker marker) {
        Optional<JournalRef> latest = keyIndex.latest(marker.lastTimestamp());
        if (latest.isEmpty()) {
            if (marker.journalId() != null) {
                throw new CollationConflictException(TideLogErrorCodes.COLLATION_MARKER_INVALID,
                    "Collation marker references journal " + marker.journalId() + " unknown to the key index");
            }
            return null;
        }

        JournalRef ref = latest.get();
        if (ref.sequence() == marker.sequence()) {
            if (!ref.journalId().equals(marker.journalId())) {
                throw new CollationConflictException(TideLogErrorCodes.COLLATION_MARKER_INVALID,
                    "Collation marker references journal " + marker.journalId()
                        + " but the key index ends at " + ref.journalId());
            }
            return null;
        }
        if (ref.sequence() != marker.sequence() + 1) {
            throw new CollationConflictException("Key index ends at journal " + ref.journalId()
                + " which cannot follow collation marker sequence " + marker.sequence());
        }

        logger.warn("Completing interrupted collation of journal {}", ref.journalId());
        JournalIndex index = journals.readIndex(ref.journalId());
        complete(index, marker);
        if (metrics != null) {
            metrics.recordJournalRecovered(ref.sequence());
        }
        return ref.journalId();
    }

    /**
     * Steps after registration: repoint locators, drop loose copies, advance the marker.
     */
    private void complete(JournalIndex index, CollationMarker previous) {
        for (JournalEntry entry : index.events()) {
            locator.record(EventPointer.collated(entry.eventId(), entry.timestamp(), index.journalId(),
                entry.range(), entry.metadata()));
        }
        for (JournalEntry entry : index.events()) {
            store.delete(codec.looseKey(entry.key()));
            if (!entry.metadata().isEmpty()) {
                looseMetadata.delete(entry.key());
            }
        }

        CollationMarker current = markers.read();
        if (current.revision() != previous.revision()) {
            throw new CollationConflictException("Collation marker moved from revision " + previous.revision()
                + " to " + current.revision() + " while journal " + index.journalId() + " was being collated");
        }
        markers.write(previous.advance(index.journalId(), index.sequence(), index.lastKey(), clock.instant()));
    }

    private Map<String, String> metadataFor(EventKey key) {
        Optional<Map<String, String>> metadata = looseMetadata.read(key);
        if (metadata.isPresent()) {
            return metadata.get();
        }
        // listed but gone: fall back to the locator written with the event
        Optional<EventPointer> pointer = locator.resolve(key.eventId());
        if (pointer.isPresent() && pointer.get().key().equals(key)) {
            return pointer.get().metadata();
        }
        logger.debug("No metadata found for loose event {}, collating without it", key);
        return Map.of();
    }

    private void put(String key, byte[] data) {
        try {
            store.put(key, data);
        } catch (ObjectStoreException e) {
            throw new WriteException(key, e);
        }
    }
}
