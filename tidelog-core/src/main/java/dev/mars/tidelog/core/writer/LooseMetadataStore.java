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
package dev.mars.tidelog.core.writer;

import dev.mars.tidelog.api.EventKey;
import dev.mars.tidelog.api.TemporalRange;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.DocumentCodec;
import dev.mars.tidelog.core.codec.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Metadata of loose events, kept in {@code loose-meta/} objects named like the
 * loose keys they belong to.
 *
 * <p>Only events written with metadata get a document, so readers list the
 * metadata keys of a window once and fetch documents just for the events that
 * have one. The collator removes a document together with its loose event.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class LooseMetadataStore {
    private static final Logger logger = LoggerFactory.getLogger(LooseMetadataStore.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final DocumentCodec documents;

    public LooseMetadataStore(ObjectStore store, KeyCodec codec, DocumentCodec documents) {
        this.store = store;
        this.codec = codec;
        this.documents = documents;
    }

    /**
     * @return the key of the written document
     */
    public String write(EventKey key, Map<String, String> metadata) {
        String metadataKey = codec.looseMetadataKey(key);
        store.put(metadataKey, documents.write(new LooseMetadata(key.eventId(), key.timestamp(), metadata)));
        return metadataKey;
    }

    public Optional<Map<String, String>> read(EventKey key) {
        return store.get(codec.looseMetadataKey(key))
            .map(raw -> documents.read(raw, LooseMetadata.class).metadata());
    }

    public void delete(EventKey key) {
        store.delete(codec.looseMetadataKey(key));
    }

    /**
     * Events inside {@code range} that carry a metadata document.
     */
    public Set<EventKey> keysWithin(TemporalRange range) {
        String startAfter = range.getStart() != null ? codec.looseMetadataFloor(range.getStart()) : null;
        Set<EventKey> keys = new HashSet<>();
        try (Stream<String> listing = store.listAll(codec.looseMetadataPrefix(), startAfter)) {
            Iterator<String> it = listing.iterator();
            while (it.hasNext()) {
                EventKey key = codec.decodeLooseMetadataKey(it.next());
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

    /**
     * Events after {@code after} (exclusive, or from the beginning when null)
     * up to {@code through} (inclusive) that carry a metadata document.
     */
    public Set<EventKey> keysBetween(EventKey after, EventKey through) {
        String startAfter = after != null ? codec.looseMetadataKey(after) : null;
        Set<EventKey> keys = new HashSet<>();
        try (Stream<String> listing = store.listAll(codec.looseMetadataPrefix(), startAfter)) {
            Iterator<String> it = listing.iterator();
            while (it.hasNext()) {
                EventKey key = codec.decodeLooseMetadataKey(it.next());
                if (key.isAfter(through)) {
                    break;
                }
                keys.add(key);
            }
        }
        logger.trace("Found {} loose metadata documents up to {}", keys.size(), through);
        return keys;
    }
}
