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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collection for the TideLog event log.
 *
 * All meters carry an {@code instance} tag. Record methods are safe to call
 * before {@link #bindTo(MeterRegistry)}; they are no-ops until then.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TideLogMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(TideLogMetrics.class);

    private final String instanceId;
    private MeterRegistry registry;

    // Counters
    private Counter eventsWritten;
    private Counter writeFailures;
    private Counter collations;
    private Counter collationsSkipped;
    private Counter eventsFolded;
    private Counter journalsRecovered;
    private Counter eventsReplayed;
    private Counter eventsSkipped;
    private Counter corruptJournals;

    // Timers
    private Timer collationTime;
    private Timer replayPlanningTime;

    // Summaries
    private DistributionSummary payloadSize;

    // Gauges
    private final AtomicLong lastJournalSequence = new AtomicLong(0);

    public TideLogMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        eventsWritten = Counter.builder("tidelog.events.written")
            .description("Total number of events written as loose objects")
            .tag("instance", instanceId)
            .register(registry);

        writeFailures = Counter.builder("tidelog.events.write_failures")
            .description("Total number of event writes rejected by the object store")
            .tag("instance", instanceId)
            .register(registry);

        collations = Counter.builder("tidelog.collations")
            .description("Total number of journals produced by collation")
            .tag("instance", instanceId)
            .register(registry);

        collationsSkipped = Counter.builder("tidelog.collations.skipped")
            .description("Total number of collation runs with too few loose events")
            .tag("instance", instanceId)
            .register(registry);

        eventsFolded = Counter.builder("tidelog.events.folded")
            .description("Total number of loose events folded into journals")
            .tag("instance", instanceId)
            .register(registry);

        journalsRecovered = Counter.builder("tidelog.journals.recovered")
            .description("Total number of interrupted collations completed on a later run")
            .tag("instance", instanceId)
            .register(registry);

        eventsReplayed = Counter.builder("tidelog.events.replayed")
            .description("Total number of events emitted by replay")
            .tag("instance", instanceId)
            .register(registry);

        eventsSkipped = Counter.builder("tidelog.events.skipped")
            .description("Total number of listed events that disappeared before they could be read")
            .tag("instance", instanceId)
            .register(registry);

        corruptJournals = Counter.builder("tidelog.journals.corrupt")
            .description("Total number of journal reads that failed validation")
            .tag("instance", instanceId)
            .register(registry);

        collationTime = Timer.builder("tidelog.collation.time")
            .description("Time taken by collation runs")
            .tag("instance", instanceId)
            .register(registry);

        replayPlanningTime = Timer.builder("tidelog.replay.planning.time")
            .description("Time taken to list journals and loose events for a replay")
            .tag("instance", instanceId)
            .register(registry);

        payloadSize = DistributionSummary.builder("tidelog.events.payload.size")
            .description("Size of written event payloads")
            .baseUnit("bytes")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("tidelog.journal.sequence.last", lastJournalSequence::get)
            .description("Sequence number of the most recently collated journal")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("TideLog metrics registered for instance: {}", instanceId);
    }

    public void recordEventWritten(int bytes) {
        if (eventsWritten != null) {
            eventsWritten.increment();
            payloadSize.record(bytes);
        }
    }

    public void recordWriteFailure() {
        if (writeFailures != null) {
            writeFailures.increment();
        }
    }

    public void recordOverlayWritten(String kind) {
        if (registry != null) {
            Counter.builder("tidelog.overlays.written")
                .tag("instance", instanceId)
                .tag("kind", kind)
                .register(registry)
                .increment();
        }
    }

    public void recordCollation(int folded, long sequence, Duration duration) {
        lastJournalSequence.set(sequence);
        if (collations != null) {
            collations.increment();
            eventsFolded.increment(folded);
            collationTime.record(duration);
        }
    }

    public void recordCollationSkipped(Duration duration) {
        if (collationsSkipped != null) {
            collationsSkipped.increment();
            collationTime.record(duration);
        }
    }

    public void recordJournalRecovered(long sequence) {
        lastJournalSequence.set(sequence);
        if (journalsRecovered != null) {
            journalsRecovered.increment();
        }
    }

    public void recordReplayPlanned(Duration duration) {
        if (replayPlanningTime != null) {
            replayPlanningTime.record(duration);
        }
    }

    public void recordEventReplayed() {
        if (eventsReplayed != null) {
            eventsReplayed.increment();
        }
    }

    public void recordEventSkipped() {
        if (eventsSkipped != null) {
            eventsSkipped.increment();
        }
    }

    public void recordCorruptJournal() {
        if (corruptJournals != null) {
            corruptJournals.increment();
        }
    }

    public long getLastJournalSequence() {
        return lastJournalSequence.get();
    }

    /**
     * Snapshot of the main counters, keyed by meter name.
     */
    public Map<String, Object> getAllMetrics() {
        Map<String, Object> metrics = new HashMap<>();
        if (registry == null) {
            return metrics;
        }
        metrics.put("tidelog.events.written", eventsWritten.count());
        metrics.put("tidelog.events.write_failures", writeFailures.count());
        metrics.put("tidelog.collations", collations.count());
        metrics.put("tidelog.collations.skipped", collationsSkipped.count());
        metrics.put("tidelog.events.folded", eventsFolded.count());
        metrics.put("tidelog.journals.recovered", journalsRecovered.count());
        metrics.put("tidelog.events.replayed", eventsReplayed.count());
        metrics.put("tidelog.events.skipped", eventsSkipped.count());
        metrics.put("tidelog.journals.corrupt", corruptJournals.count());
        metrics.put("tidelog.journal.sequence.last", lastJournalSequence.get());
        return metrics;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
