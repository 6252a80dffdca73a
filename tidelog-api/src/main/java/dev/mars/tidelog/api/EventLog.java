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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Interface for the append-mostly event log.
 *
 * The EventLog provides:
 * - Append: independent, uncoordinated writes from any number of producers
 * - Collation: single-writer compaction of loose events into indexed journals
 * - Overlays: updates and deletes recorded beside history, merged at read time
 * - Replay: ordered, de-duplicated streaming over an optional time window
 * - Manifests: the same replay as fetchable locators and byte ranges
 *
 * Output order is always (timestamp, event id) ascending regardless of write
 * order, collation timing or overlay timing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public interface EventLog extends AutoCloseable {

    /**
     * Appends an event as a single loose object.
     *
     * @param eventId Unique event id; reusing an id is a caller error (last physical write wins)
     * @param payload The event payload
     * @param timestamp Logical creation time, the ordering key
     * @return The stored event
     * @throws dev.mars.tidelog.api.error.WriteException if the store rejects the write
     */
    StoredEvent put(String eventId, byte[] payload, Instant timestamp);

    /**
     * Appends an event with content metadata.
     *
     * @param eventId Unique event id
     * @param payload The event payload
     * @param timestamp Logical creation time
     * @param metadata Content metadata, carried unchanged through collation
     * @return The stored event
     */
    StoredEvent put(String eventId, byte[] payload, Instant timestamp, Map<String, String> metadata);

    /**
     * Appends an event with a generated id, timestamped now.
     *
     * @param payload The event payload
     * @return The stored event, carrying the generated id and timestamp
     */
    StoredEvent put(byte[] payload);

    /**
     * Folds loose events into a new journal. Must never run concurrently with
     * itself; callers provide the mutual exclusion.
     *
     * @param minBatchSize Minimum number of loose events required to produce a journal
     * @return The collation outcome
     * @throws dev.mars.tidelog.api.error.CollationConflictException on evidence of a concurrent collation
     */
    CollationResult collate(int minBatchSize);

    /**
     * Records a replacement payload for an event. History is not rewritten.
     *
     * @param eventId The event to update
     * @param payload The replacement payload
     * @return The id of the written overlay
     * @throws dev.mars.tidelog.api.error.EventNotFoundException if the event was never written
     */
    String update(String eventId, byte[] payload);

    /**
     * Records a tombstone for an event. History is not rewritten.
     *
     * @param eventId The event to delete
     * @return The id of the written overlay
     * @throws dev.mars.tidelog.api.error.EventNotFoundException if the event was never written
     */
    String delete(String eventId);

    /**
     * Replays events in the window, lazily.
     *
     * @param range Inclusive time window
     * @return Ordered stream of merged events; close it to stop early
     * @throws dev.mars.tidelog.api.error.CorruptJournalException when a journal is inconsistent
     */
    Stream<StoredEvent> replay(TemporalRange range);

    /**
     * Replays events between two optional bounds.
     *
     * @param from Inclusive lower bound, or null
     * @param to Inclusive upper bound, or null
     * @return Ordered stream of merged events
     */
    default Stream<StoredEvent> replay(Instant from, Instant to) {
        return replay(TemporalRange.between(from, to));
    }

    /**
     * Builds the manifest for a window: locators and byte ranges in replay
     * order, with the overlay decision for each event.
     *
     * @param range Inclusive time window
     * @return Manifest entries in (timestamp, event id) order
     */
    List<ManifestEntry> replayManifest(TemporalRange range);

    /**
     * Builds a manifest covering at most {@code maxJournals} journals. When
     * more journals overlap the window, the manifest stops at the last key of
     * the last included journal; loose events up to that key are still listed.
     *
     * @param range Inclusive time window
     * @param maxJournals Maximum number of journals to describe, zero for no limit
     * @return Manifest entries in (timestamp, event id) order
     */
    List<ManifestEntry> replayManifest(TemporalRange range, int maxJournals);

    default List<ManifestEntry> replayManifest(Instant from, Instant to) {
        return replayManifest(TemporalRange.between(from, to));
    }

    /**
     * Looks up one event by id, applying overlays.
     *
     * @param eventId The event id
     * @return FOUND with the merged event, NOT_FOUND or DELETED
     */
    EventLookup getEvent(String eventId);

    /**
     * @param eventId The event id
     * @return true if the event exists and is not tombstoned
     */
    boolean eventExists(String eventId);

    /**
     * Removes every object in this log's namespace. Intended for tests and
     * decommissioning; not safe to run alongside writers.
     */
    void destroy();

    @Override
    void close();
}
