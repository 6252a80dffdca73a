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

import dev.mars.tidelog.api.EventKey;

import java.time.Instant;

/**
 * Position up to which loose events have been folded into journals.
 *
 * <p>{@code revision} orders successive markers; {@code sequence} is the
 * sequence of the last journal produced. The initial marker (no journal yet)
 * has revision and sequence zero and no position.</p>
 */
public record CollationMarker(long revision, String journalId, long sequence, Instant lastTimestamp,
                              String lastEventId, Instant updatedAt) {

    public static final CollationMarker INITIAL = new CollationMarker(0, null, 0, null, null, null);

    public boolean hasPosition() {
        return lastTimestamp != null && lastEventId != null;
    }

    /**
     * Key of the last folded event, or {@code null} before the first journal.
     */
    public EventKey position() {
        return hasPosition() ? new EventKey(lastTimestamp, lastEventId) : null;
    }

    public CollationMarker advance(String newJournalId, long newSequence, EventKey newPosition, Instant now) {
        return new CollationMarker(revision + 1, newJournalId, newSequence,
            newPosition.timestamp(), newPosition.eventId(), now);
    }
}
