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

import dev.mars.tidelog.api.ManifestEntry;
import dev.mars.tidelog.api.StoredEvent;
import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.LocatorFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Turns a replay manifest back into events using only the locators it
 * carries. Deleted entries are skipped and updated entries read their
 * replacement payload, so the result matches a direct replay of the same
 * window.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ManifestReader {
    private static final Logger logger = LoggerFactory.getLogger(ManifestReader.class);

    private final LocatorFetcher fetcher;

    public ManifestReader(LocatorFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "Locator fetcher cannot be null");
    }

    /**
     * Lazily fetches each surviving entry in manifest order.
     */
    public Stream<StoredEvent> read(List<ManifestEntry> manifest) {
        return manifest.stream()
            .filter(entry -> !entry.getDecision().isDelete())
            .map(this::fetch);
    }

    private StoredEvent fetch(ManifestEntry entry) {
        ByteRange range = entry.effectiveRange();
        byte[] payload = fetcher.fetch(entry.effectiveLocator(), range);
        if (payload.length != range.length()) {
            throw new ObjectStoreException("Short read for event " + entry.getEventId() + " from "
                + entry.effectiveLocator() + ": expected " + range.length() + " bytes, got " + payload.length);
        }
        logger.trace("Fetched {} bytes for event {}", payload.length, entry.getEventId());
        return new StoredEvent(entry.getEventId(), entry.getTimestamp(), payload, entry.getMetadata());
    }
}
