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

import dev.mars.tidelog.api.error.CollationConflictException;
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
 * Reads and advances the collation marker. Each advance writes a new revision
 * and then removes the older ones.
 */
public class CollationMarkerStore {
    private static final Logger logger = LoggerFactory.getLogger(CollationMarkerStore.class);

    private static final int READ_ATTEMPTS = 3;

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;

    public CollationMarkerStore(ObjectStore store, KeyCodec codec, DocumentCodec documents) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
    }

    public CollationMarker read() {
        for (int attempt = 0; attempt < READ_ATTEMPTS; attempt++) {
            List<String> revisions = revisions();
            if (revisions.isEmpty()) {
                return CollationMarker.INITIAL;
            }
            String latest = revisions.get(revisions.size() - 1);
            Optional<byte[]> raw = store.get(latest);
            if (raw.isPresent()) {
                try {
                    return documents.read(raw.get(), CollationMarker.class);
                } catch (IllegalArgumentException e) {
                    throw new CollationConflictException(TideLogErrorCodes.COLLATION_MARKER_INVALID,
                        "Collation marker " + latest + " is unreadable: " + e.getMessage());
                }
            }
            logger.debug("Collation marker {} superseded while reading, retrying", latest);
        }
        throw new CollationConflictException("Collation marker kept changing while reading");
    }

    /**
     * Writes {@code next} as the current marker and prunes older revisions.
     */
    public void write(CollationMarker next) {
        String key = codec.collationMarkerKey(next.revision());
        try {
            store.put(key, documents.write(next));
        } catch (ObjectStoreException e) {
            throw new WriteException(TideLogErrorCodes.INDEX_WRITE_REJECTED, key, e);
        }
        for (String revision : revisions()) {
            if (revision.compareTo(key) < 0) {
                store.delete(revision);
            }
        }
        logger.debug("Collation marker advanced to revision {} (journal {})", next.revision(), next.journalId());
    }

    private List<String> revisions() {
        try (Stream<String> keys = store.listAll(codec.collationMarkerPrefix())) {
            return keys.collect(Collectors.toList());
        }
    }
}
