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

import java.time.Instant;

/**
 * Document stored under each key index key. The listing key alone carries
 * enough to plan a query (see {@link JournalRef}); this document adds the
 * summary an operator needs to inspect a journal without reading its index.
 */
public record KeyIndexEntry(String journalId, long sequence, Instant minTimestamp, Instant maxTimestamp,
                            String firstEventId, String lastEventId, int eventCount, long size) {

    public JournalRef ref() {
        return new JournalRef(journalId, sequence, minTimestamp, maxTimestamp);
    }
}
