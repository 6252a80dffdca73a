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
package dev.mars.tidelog.store.memory;

import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.ListPage;
import dev.mars.tidelog.api.store.LocatorFetcher;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.store.LocatorQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Object store held in memory, for tests and single-process use.
 *
 * <p>Keys are kept in a {@link ConcurrentSkipListMap}, so listings are strictly
 * ascending and every write is immediately visible to every reader. Presigned
 * locators use the {@code memory} scheme and carry an expiry that
 * {@link #fetch(URI, ByteRange)} enforces against the store's clock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class InMemoryObjectStore implements ObjectStore, LocatorFetcher {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryObjectStore.class);

    public static final String SCHEME = "memory";

    private final String name;
    private final Clock clock;
    private final ConcurrentSkipListMap<String, byte[]> objects = new ConcurrentSkipListMap<>();

    private final LongAdder putCount = new LongAdder();
    private final LongAdder getCount = new LongAdder();
    private final LongAdder deleteCount = new LongAdder();
    private final LongAdder listCount = new LongAdder();

    public InMemoryObjectStore() {
        this("default", Clock.systemUTC());
    }

    public InMemoryObjectStore(String name) {
        this(name, Clock.systemUTC());
    }

    public InMemoryObjectStore(String name, Clock clock) {
        this.name = Objects.requireNonNull(name, "Store name cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        logger.debug("Created in-memory object store '{}'", name);
    }

    @Override
    public void put(String key, byte[] data) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        putCount.increment();
        objects.put(key, data.clone());
    }

    @Override
    public Optional<byte[]> get(String key) {
        getCount.increment();
        byte[] data = objects.get(key);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    @Override
    public Optional<byte[]> get(String key, ByteRange range) {
        getCount.increment();
        byte[] data = objects.get(key);
        return data == null ? Optional.empty() : Optional.of(range.slice(data));
    }

    @Override
    public void delete(String key) {
        deleteCount.increment();
        objects.remove(key);
    }

    @Override
    public ListPage list(String prefix, String startAfter, int maxKeys) {
        if (maxKeys < 1) {
            throw new IllegalArgumentException("maxKeys must be positive");
        }
        listCount.increment();
        NavigableSet<String> candidates = (startAfter != null && startAfter.compareTo(prefix) >= 0)
                ? objects.navigableKeySet().tailSet(startAfter, false)
                : objects.navigableKeySet().tailSet(prefix, true);

        List<String> keys = new ArrayList<>();
        Iterator<String> it = candidates.iterator();
        while (it.hasNext()) {
            String key = it.next();
            if (!key.startsWith(prefix)) {
                break;
            }
            if (keys.size() == maxKeys) {
                return new ListPage(keys, keys.get(keys.size() - 1));
            }
            keys.add(key);
        }
        return ListPage.last(keys);
    }

    @Override
    public URI presign(String key, ByteRange range, Duration ttl) {
        String query = LocatorQuery.encode(clock.instant().plus(ttl), range);
        try {
            return new URI(SCHEME, name, "/" + key, query, null);
        } catch (URISyntaxException e) {
            throw new ObjectStoreException("Cannot build locator for " + key, e);
        }
    }

    @Override
    public byte[] fetch(URI locator, ByteRange range) {
        if (!SCHEME.equals(locator.getScheme()) || !name.equals(locator.getAuthority())) {
            throw new ObjectStoreException(TideLogErrorCodes.LOCATOR_UNSUPPORTED,
                    "Locator not issued by memory store '" + name + "': " + locator, null);
        }
        LocatorQuery.checkNotExpired(locator, clock);
        String key = locator.getPath().substring(1);
        return get(key, range).orElseThrow(() ->
                new ObjectStoreException("No object behind locator " + locator));
    }

    /**
     * Snapshot of every key currently stored, in order.
     */
    public List<String> keys() {
        return new ArrayList<>(objects.keySet());
    }

    /**
     * Snapshot of the keys under a prefix, in order.
     */
    public List<String> keys(String prefix) {
        NavigableMap<String, byte[]> tail = objects.tailMap(prefix, true);
        List<String> keys = new ArrayList<>();
        for (String key : tail.keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    public int size() {
        return objects.size();
    }

    public String getName() {
        return name;
    }

    public long getPutCount() {
        return putCount.sum();
    }

    public long getGetCount() {
        return getCount.sum();
    }

    public long getDeleteCount() {
        return deleteCount.sum();
    }

    public long getListCount() {
        return listCount.sum();
    }

    /**
     * Resets the operation counters.
     */
    public void resetCounters() {
        putCount.reset();
        getCount.reset();
        deleteCount.reset();
        listCount.reset();
    }
}
