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

import dev.mars.tidelog.api.CollationResult;
import dev.mars.tidelog.api.error.TideLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs collation periodically on a single dedicated thread, which is the
 * mutual exclusion the {@link Collator} requires within one process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class CollationScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CollationScheduler.class);

    private final Collator collator;
    private final int minBatchSize;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile boolean running = false;
    private volatile CollationResult lastResult;

    public CollationScheduler(Collator collator, int minBatchSize, Duration interval) {
        this.collator = collator;
        this.minBatchSize = minBatchSize;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tidelog-collator");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            logger.warn("Collation scheduler is already running");
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Collation scheduler cannot be restarted after stop");
        }
        running = true;
        scheduler.scheduleWithFixedDelay(this::runOnce,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Collation scheduler started (interval: {}, minBatchSize: {})", interval, minBatchSize);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Collation scheduler stopped after {} runs ({} failed)", runs.get(), failures.get());
    }

    void runOnce() {
        runs.incrementAndGet();
        try {
            lastResult = collator.collate(minBatchSize);
        } catch (TideLogException e) {
            // the next run starts from the marker, which is unchanged on failure
            failures.incrementAndGet();
            logger.error("Scheduled collation failed [{}]: {}", e.getCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            logger.error("Scheduled collation failed unexpectedly", e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getRunCount() {
        return runs.get();
    }

    public long getFailureCount() {
        return failures.get();
    }

    public CollationResult getLastResult() {
        return lastResult;
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
