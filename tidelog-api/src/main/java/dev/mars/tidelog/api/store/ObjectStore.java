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
package dev.mars.tidelog.api.store;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Durable key/blob storage capability the event log is layered over.
 *
 * The event log assumes:
 * - Listings are strictly ascending in lexicographic key order and paginated
 * - A caller's writes are visible to its own subsequent reads and listings
 * - Other callers may observe writes later (eventual consistency)
 * - There are no transactions and no conditional writes
 *
 * Implementations own transport concerns such as retries, backoff and
 * credentials. Failures surface as
 * {@link dev.mars.tidelog.api.error.ObjectStoreException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public interface ObjectStore {

    /** Default page size for {@link #listAll(String, String)}. */
    int DEFAULT_PAGE_SIZE = 1000;

    /**
     * Stores an object, replacing any previous object under the same key.
     */
    void put(String key, byte[] data);

    /**
     * Reads a whole object.
     *
     * @return the object content, or empty if no object exists under the key
     */
    Optional<byte[]> get(String key);

    /**
     * Reads a byte range of an object. A range running past the end of the
     * object returns the available bytes only; callers that know the expected
     * length must check it.
     *
     * @return the bytes read, or empty if no object exists under the key
     */
    Optional<byte[]> get(String key, ByteRange range);

    /**
     * Deletes an object. Deleting a missing key is not an error.
     */
    void delete(String key);

    /**
     * Lists one page of keys starting with {@code prefix} and strictly greater
     * than {@code startAfter}.
     *
     * @param prefix key prefix to match
     * @param startAfter exclusive lower bound, or {@code null} to start at the prefix
     * @param maxKeys maximum number of keys in the page
     */
    ListPage list(String prefix, String startAfter, int maxKeys);

    /**
     * Issues a time-limited locator for reading {@code range} of {@code key}
     * without store credentials.
     *
     * @param range the range the locator is intended for, or {@code null} for the whole object
     * @param ttl how long the locator stays valid
     */
    URI presign(String key, ByteRange range, Duration ttl);

    /**
     * Lazily lists every key under {@code prefix} after {@code startAfter},
     * fetching pages on demand.
     */
    default Stream<String> listAll(String prefix, String startAfter) {
        Iterator<String> keys = new Iterator<>() {
            private Iterator<String> page = java.util.Collections.emptyIterator();
            private String cursor = startAfter;
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                while (!page.hasNext() && !exhausted) {
                    ListPage next = list(prefix, cursor, DEFAULT_PAGE_SIZE);
                    page = next.keys().iterator();
                    cursor = next.nextStartAfter();
                    exhausted = !next.hasMore();
                }
                return page.hasNext();
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return page.next();
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(keys, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Lazily lists every key under {@code prefix}.
     */
    default Stream<String> listAll(String prefix) {
        return listAll(prefix, null);
    }
}
