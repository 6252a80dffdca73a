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
package dev.mars.tidelog.core.index;

import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.error.CorruptJournalException;
import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only registry of journals, ordered by the journals' maximum timestamp.
 *
 * <p>Every entry is its own immutable object named
 * {@code key-index/<maxTs>~<journalId>}, and the journal id embeds the
 * minimum timestamp and sequence, so a query is answered from the listing
 * alone:
 * <ul>
 *   <li>listing starts just below {@code key-index/<from>}, skipping every
 *       journal that ends before the window</li>
 *   <li>listing stops at the first journal starting after the window</li>
 * </ul>
 * The number of keys touched is the number of overlapping journals plus one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class KeyIndex {
    private static final Logger logger = LoggerFactory.getLogger(KeyIndex.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;

    public KeyIndex(ObjectStore store, KeyCodec codec, DocumentCodec documents) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
    }

    /**
     * Registers a journal. Registration is the point at which the journal
     * becomes visible to readers.
     */
    public void register(KeyIndexEntry entry) {
        String key = codec.keyIndexKey(entry.maxTimestamp(), entry.journalId());
        try {
            store.put(key, documents.write(entry));
        } catch (ObjectStoreException e) {
            throw new WriteException(TideLogErrorCodes.INDEX_WRITE_REJECTED, key, e);
        }
        logger.debug("Registered journal {} in key index", entry.journalId());
    }

    /**
     * Journals whose timestamp span intersects the range, ascending.
     *
     * @throws CorruptJournalException if the listing violates journal order
     */
    public List<JournalRef> query(TemporalRange range) {
        String startAfter = range.getStart() != null ? codec.keyIndexFloor(range.getStart()) : null;
        List<JournalRef> result = new ArrayList<>();
        try (Stream<String> keys = store.listAll(codec.keyIndexPrefix(), startAfter)) {
            Iterator<String> it = keys.iterator();
            JournalRef previous = null;
            while (it.hasNext()) {
                JournalRef ref = decode(it.next());
                checkOrder(previous, ref);
                previous = ref;
                if (range.isBeyond(ref.minTimestamp())) {
                    break;
                }
                if (ref.overlaps(range)) {
                    result.add(ref);
                }
            }
        }
        return result;
    }

    /**
     * The most recently registered journal.
     */
    public Optional<JournalRef> latest() {
        return latest(null);
    }

    /**
     * The most recently registered journal, listing only entries whose maximum
     * timestamp is at or after {@code notBefore}.
     */
    public Optional<JournalRef> latest(Instant notBefore) {
        String startAfter = notBefore != null ? codec.keyIndexFloor(notBefore) : null;
        JournalRef last = null;
        try (Stream<String> keys = store.listAll(codec.keyIndexPrefix(), startAfter)) {
            Iterator<String> it = keys.iterator();
            while (it.hasNext()) {
                JournalRef ref = decode(it.next());
                checkOrder(last, ref);
                last = ref;
            }
        }
        return Optional.ofNullable(last);
    }

    JournalRef decode(String key) {
        String tail = key.substring(codec.keyIndexPrefix().length());
        int sep = tail.indexOf(KeyCodec.SEPARATOR);
        if (sep < 0) {
            throw new CorruptJournalException(TideLogErrorCodes.KEY_INDEX_OUT_OF_ORDER, tail,
                "malformed key index entry " + key);
        }
        try {
            Instant maxTimestamp = KeyCodec.decodeTimestamp(tail.substring(0, sep));
            String journalId = tail.substring(sep + 1);
            int seqSep = journalId.lastIndexOf(KeyCodec.SEPARATOR);
            Instant minTimestamp = KeyCodec.decodeTimestamp(journalId.substring(0, seqSep));
            long sequence = KeyCodec.journalSequence(journalId);
            return new JournalRef(journalId, sequence, minTimestamp, maxTimestamp);
        } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
            throw new CorruptJournalException(TideLogErrorCodes.KEY_INDEX_OUT_OF_ORDER, tail,
                "malformed key index entry " + key);
        }
    }

    private static void checkOrder(JournalRef previous, JournalRef current) {
        if (current.minTimestamp().isAfter(current.maxTimestamp())) {
            throw new CorruptJournalException(TideLogErrorCodes.KEY_INDEX_OUT_OF_ORDER, current.journalId(),
                "minimum timestamp after maximum timestamp");
        }
        if (previous == null) {
            return;
        }
        if (current.sequence() <= previous.sequence()
                || current.minTimestamp().isBefore(previous.maxTimestamp())) {
            throw new CorruptJournalException(TideLogErrorCodes.KEY_INDEX_OUT_OF_ORDER, current.journalId(),
                "registered after journal " + previous.journalId() + " but does not follow it");
        }
    }
}
