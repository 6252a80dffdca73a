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

package dev.mars.tidelog.core.metrics;

import dev.mars.tidelog.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TideLogMetrics.
 */
@Tag(TestCategories.CORE)
class TideLogMetricsTest {

    private SimpleMeterRegistry registry;
    private TideLogMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TideLogMetrics("metrics-test");
    }

    @Test
    @DisplayName("unbound metrics ignore recordings")
    void unbound_ignoresRecordings() {
        metrics.recordEventWritten(10);
        metrics.recordOverlayWritten("DELETE");
        metrics.recordCorruptJournal();
        metrics.recordCollation(3, 7, Duration.ofMillis(5));

        assertTrue(metrics.getAllMetrics().isEmpty());
        assertEquals(7, metrics.getLastJournalSequence());
    }

    @Test
    @DisplayName("bound metrics count writes, collations and replays")
    void bound_countsEvents() {
        metrics.bindTo(registry);

        metrics.recordEventWritten(10);
        metrics.recordEventWritten(30);
        metrics.recordWriteFailure();
        metrics.recordCollation(2, 1, Duration.ofMillis(5));
        metrics.recordCollationSkipped(Duration.ofMillis(1));
        metrics.recordJournalRecovered(2);
        metrics.recordEventReplayed();
        metrics.recordEventSkipped();

        Map<String, Object> all = metrics.getAllMetrics();
        assertEquals(2.0, all.get("tidelog.events.written"));
        assertEquals(1.0, all.get("tidelog.events.write_failures"));
        assertEquals(1.0, all.get("tidelog.collations"));
        assertEquals(1.0, all.get("tidelog.collations.skipped"));
        assertEquals(2.0, all.get("tidelog.events.folded"));
        assertEquals(1.0, all.get("tidelog.journals.recovered"));
        assertEquals(1.0, all.get("tidelog.events.replayed"));
        assertEquals(1.0, all.get("tidelog.events.skipped"));
        assertEquals(2L, all.get("tidelog.journal.sequence.last"));

        assertEquals(40.0, registry.get("tidelog.events.payload.size").summary().totalAmount());
        assertEquals(2, registry.get("tidelog.collation.time").timer().count());
        assertEquals(2.0, registry.get("tidelog.journal.sequence.last").gauge().value());
    }

    @Test
    @DisplayName("overlay counters are tagged by kind")
    void overlays_taggedByKind() {
        metrics.bindTo(registry);

        metrics.recordOverlayWritten("UPDATE");
        metrics.recordOverlayWritten("UPDATE");
        metrics.recordOverlayWritten("DELETE");

        assertEquals(2.0, registry.get("tidelog.overlays.written").tag("kind", "UPDATE").counter().count());
        assertEquals(1.0, registry.get("tidelog.overlays.written").tag("kind", "DELETE").counter().count());
    }

    @Test
    @DisplayName("meters carry the instance tag")
    void meters_carryInstanceTag() {
        metrics.bindTo(registry);

        assertNotNull(registry.find("tidelog.events.written").tag("instance", "metrics-test").counter());
        assertEquals("metrics-test", metrics.getInstanceId());
    }
}
