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
package dev.mars.tidelog.core;

import dev.mars.tidelog.api.EventLog;
import dev.mars.tidelog.api.store.ObjectStore;
import dev.mars.tidelog.core.collation.CollationScheduler;
import dev.mars.tidelog.core.config.TideLogConfiguration;
import dev.mars.tidelog.core.metrics.TideLogMetrics;
import dev.mars.tidelog.store.filesystem.FileSystemObjectStore;
import dev.mars.tidelog.store.memory.InMemoryObjectStore;
import dev.mars.tidelog.store.resilience.ResilientObjectStore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds a complete TideLog instance from configuration and manages its
 * lifecycle.
 *
 * The manager:
 * - creates the configured object store, wrapped with retry and circuit breaker protection when enabled
 * - binds metrics to the meter registry
 * - exposes the {@link EventLog}
 * - runs scheduled collation between {@link #start()} and {@link #close()} when enabled
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TideLogManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TideLogManager.class);

    private final TideLogConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final ObjectStore baseStore;
    private final ObjectStore objectStore;
    private final TideLogMetrics metrics;
    private final ObjectStoreEventLog eventLog;
    private final CollationScheduler collationScheduler;
    private volatile boolean started = false;

    public TideLogManager() {
        this(new TideLogConfiguration());
    }

    public TideLogManager(String profile) {
        this(new TideLogConfiguration(profile));
    }

    public TideLogManager(TideLogConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry());
    }

    public TideLogManager(TideLogConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, Clock.systemUTC(), null);
    }

    /**
     * Constructor allowing an externally created base store, e.g. a shared
     * in-memory store in tests. The store is still wrapped with resilience
     * decorators according to configuration.
     */
    public TideLogManager(TideLogConfiguration configuration, MeterRegistry meterRegistry, Clock clock,
                          ObjectStore baseStore) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;

        logger.info("Initializing TideLog Manager with profile: {}", configuration.getProfile());

        TideLogConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        if (metricsConfig.isEnabled()) {
            this.metrics = new TideLogMetrics(metricsConfig.getInstanceId());
            metrics.bindTo(meterRegistry);
        } else {
            this.metrics = null;
            logger.info("TideLog metrics are disabled");
        }

        this.baseStore = baseStore != null ? baseStore : createStore(configuration.getStoreConfig(), clock);
        this.objectStore = decorate(this.baseStore);

        TideLogConfiguration.CollationConfig collationConfig = configuration.getCollationConfig();
        TideLogConfiguration.ManifestConfig manifestConfig = configuration.getManifestConfig();
        this.eventLog = ObjectStoreEventLog.builder(objectStore)
            .rootPrefix(configuration.getNamespaceConfig().getRootPrefix())
            .clock(clock)
            .maxEventsPerJournal(collationConfig.getMaxEventsPerJournal())
            .manifestTtl(manifestConfig.getUrlTtl())
            .manifestMaxJournals(manifestConfig.getMaxJournals())
            .metrics(metrics)
            .build();

        this.collationScheduler = collationConfig.isEnabled()
            ? new CollationScheduler(eventLog.getCollator(), collationConfig.getMinBatchSize(),
                collationConfig.getInterval())
            : null;
    }

    private static ObjectStore createStore(TideLogConfiguration.StoreConfig storeConfig, Clock clock) {
        if (storeConfig.isFilesystem()) {
            return new FileSystemObjectStore(Path.of(storeConfig.getFilesystemRoot()));
        }
        return new InMemoryObjectStore(storeConfig.getMemoryName(), clock);
    }

    private ObjectStore decorate(ObjectStore store) {
        TideLogConfiguration.RetryConfig retry = configuration.getRetryConfig();
        TideLogConfiguration.CircuitBreakerConfig breaker = configuration.getCircuitBreakerConfig();
        if (!retry.isEnabled() && !breaker.isEnabled()) {
            logger.info("Object store resilience is disabled");
            return store;
        }

        RetryConfig retryConfig = retry.isEnabled()
            ? ResilientObjectStore.retryConfig(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier())
            : ResilientObjectStore.noRetryConfig();
        CircuitBreakerConfig breakerConfig = breaker.isEnabled()
            ? ResilientObjectStore.circuitBreakerConfig((float) breaker.getFailureRateThreshold(),
                breaker.getSlidingWindowSize(), breaker.getMinimumNumberOfCalls(), breaker.getWaitDuration())
            : ResilientObjectStore.disabledCircuitBreakerConfig();
        return new ResilientObjectStore(store, retryConfig, breakerConfig, metrics != null ? meterRegistry : null);
    }

    /**
     * Starts background collation if it is enabled.
     */
    public synchronized void start() {
        if (started) {
            logger.warn("TideLog Manager is already started");
            return;
        }
        if (collationScheduler != null) {
            collationScheduler.start();
        }
        started = true;
        logger.info("TideLog Manager started");
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        if (collationScheduler != null) {
            collationScheduler.stop();
        }
        started = false;
        logger.info("TideLog Manager stopped");
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public ObjectStoreEventLog getObjectStoreEventLog() {
        return eventLog;
    }

    public ObjectStore getObjectStore() {
        return objectStore;
    }

    public ObjectStore getBaseStore() {
        return baseStore;
    }

    public TideLogMetrics getMetrics() {
        return metrics;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public TideLogConfiguration getConfiguration() {
        return configuration;
    }

    public CollationScheduler getCollationScheduler() {
        return collationScheduler;
    }

    public boolean isStarted() {
        return started;
    }

    @Override
    public void close() {
        stop();
        if (collationScheduler != null) {
            collationScheduler.close();
        }
        eventLog.close();
        logger.info("TideLog Manager closed");
    }
}
