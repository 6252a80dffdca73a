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

import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-event pointer from event id to the object holding the payload.
 *
 * <p>Pointers are revisioned ({@code event-index/<eventId>/<revision>}); the
 * highest revision is current. Each write lists the existing revisions, writes
 * the next one and then removes the older ones, so a reader that races with a
 * rewrite always finds at least one revision.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class EventLocator {
    private static final Logger logger = LoggerFactory.getLogger(EventLocator.class);

    private static final int RESOLVE_ATTEMPTS = 3;

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;

    public EventLocator(ObjectStore store, KeyCodec codec, DocumentCodec documents) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
    }

    /**
     * Writes a new current pointer for an event and prunes the older revisions.
     */
    public void record(EventPointer pointer) {
        commit(stage(pointer));
    }

    /**
     * Writes the next revision without touching older ones. The staged
     * revision is current as soon as it exists; follow with
     * {@link #commit(Staged)} once the payload is in place or
     * {@link #withdraw(Staged)} if it could not be written.
     */
    public Staged stage(EventPointer pointer) {
        List<String> existing = revisions(pointer.eventId());
        long next = existing.isEmpty() ? 0 : KeyCodec.locatorRevision(existing.get(existing.size() - 1)) + 1;
        String key = codec.locatorKey(pointer.eventId(), next);
        try {
            store.put(key, documents.write(pointer));
        } catch (ObjectStoreException e) {
            throw new WriteException(TideLogErrorCodes.INDEX_WRITE_REJECTED, key, e);
        }
        logger.trace("Staged locator revision {} for event {}", next, pointer.eventId());
        return new Staged(key, List.copyOf(existing));
    }

    public void commit(Staged staged) {
        for (String stale : staged.superseded()) {
            store.delete(stale);
        }
    }

    /**
     * Removes a staged revision, making the previous revision (if any) current again.
     */
    public void withdraw(Staged staged) {
        store.delete(staged.key());
        logger.debug("Withdrew locator revision {}", staged.key());
    }

    /**
     * Current pointer for an event, or empty if the event was never written.
     */
    public Optional<EventPointer> resolve(String eventId) {
        for (int attempt = 0; attempt < RESOLVE_ATTEMPTS; attempt++) {
            List<String> revisions = revisions(eventId);
            if (revisions.isEmpty()) {
                return Optional.empty();
            }
            Optional<byte[]> raw = store.get(revisions.get(revisions.size() - 1));
            if (raw.isPresent()) {
                return Optional.of(documents.read(raw.get(), EventPointer.class));
            }
            // superseded between list and get
            logger.debug("Locator for {} changed while resolving, retrying", eventId);
        }
        throw new ObjectStoreException("Locator for event " + eventId + " kept changing while resolving");
    }

    private List<String> revisions(String eventId) {
        try (Stream<String> keys = store.listAll(codec.locatorPrefix(eventId))) {
            return keys.collect(Collectors.toList());
        }
    }

    /**
     * A written but not yet committed locator revision.
     *
     * @param key the staged revision's object key
     * @param superseded older revisions that commit removes
     */
    public record Staged(String key, List<String> superseded) {

        public boolean supersedes() {
            return !superseded.isEmpty();
        }
    }
}
