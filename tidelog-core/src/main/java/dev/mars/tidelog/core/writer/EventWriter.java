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
import dev.mars.tidelog.api.StoredEvent;
import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.WriteException;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.codec.EventIdValidator;
import dev.mars.tidelog.core.codec.KeyCodec;
import dev.mars.tidelog.core.index.EventLocator;
import dev.mars.tidelog.core.index.EventPointer;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Accepts new events as loose objects.
 *
 * <p>Writers never coordinate with each other or with the collator. Each put
 * stages the event's locator, writes any metadata document and then the
 * payload under its loose key; the event is visible to replay as soon as the
 * loose object exists. When the payload write fails the staged locator is
 * withdrawn, so a rejected put leaves no trace of the event. Store failures
 * surface as {@link WriteException} without retry at this level.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class EventWriter {
    private static final Logger logger = LoggerFactory.getLogger(EventWriter.class);

    private final ObjectStore store;
    private final KeyCodec codec;
    private final EventLocator locator;
    private final LooseMetadataStore looseMetadata;
    private final TideLogMetrics metrics;
    private final Clock clock;

    public EventWriter(ObjectStore store, KeyCodec codec, EventLocator locator, LooseMetadataStore looseMetadata,
                       TideLogMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "Object store cannot be null");
        this.codec = Objects.requireNonNull(codec, "Key codec cannot be null");
        this.locator = Objects.requireNonNull(locator, "Event locator cannot be null");
        this.looseMetadata = Objects.requireNonNull(looseMetadata, "Loose metadata store cannot be null");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public StoredEvent put(String eventId, byte[] payload, Instant timestamp, Map<String, String> metadata) {
        EventIdValidator.validate(eventId);
        Objects.requireNonNull(payload, "Payload cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Map<String, String> safeMetadata = metadata != null ? metadata : Map.of();

        EventKey key = new EventKey(timestamp, eventId);
        String looseKey = codec.looseKey(key);
        EventLocator.Staged staged = locator.stage(
            EventPointer.loose(eventId, timestamp, looseKey, payload.length, safeMetadata));
        try {
            if (!safeMetadata.isEmpty()) {
                looseMetadata.write(key, safeMetadata);
            } else if (staged.supersedes()) {
                looseMetadata.delete(key);
            }
            store.put(looseKey, payload);
        } catch (ObjectStoreException e) {
            rollBack(key, staged, !safeMetadata.isEmpty(), e);
            if (metrics != null) {
                metrics.recordWriteFailure();
            }
            throw new WriteException(looseKey, e);
        }
        locator.commit(staged);
        if (metrics != null) {
            metrics.recordEventWritten(payload.length);
        }
        logger.debug("Wrote loose event {} at {}", eventId, timestamp);
        return new StoredEvent(eventId, timestamp, payload, safeMetadata);
    }

    private void rollBack(EventKey key, EventLocator.Staged staged, boolean wroteMetadata, ObjectStoreException cause) {
        try {
            locator.withdraw(staged);
            if (wroteMetadata && !staged.supersedes()) {
                looseMetadata.delete(key);
            }
        } catch (ObjectStoreException cleanup) {
            cause.addSuppressed(cleanup);
            logger.warn("Could not withdraw locator {} after a failed write of event {}", staged.key(), key.eventId());
        }
    }

    /**
     * Writes an event under a generated id, timestamped with the writer's clock.
     */
    public StoredEvent put(byte[] payload) {
        return put(UUID.randomUUID().toString(), payload, clock.instant(), Map.of());
    }
}
