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
package dev.mars.tidelog.store.resilience;

import dev.mars.tidelog.api.error.ObjectStoreException;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.store.ByteRange;
import dev.mars.tidelog.api.store.ListPage;
import dev.mars.tidelog.api.store.ObjectStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decorates an {@link ObjectStore} with retry and circuit breaker protection.
 *
 * <p>Only {@link ObjectStoreException} is treated as transient: it is retried
 * with exponential backoff and counted by the circuit breaker. Argument errors
 * and other runtime exceptions pass straight through. When the circuit is open
 * calls fail fast with {@link TideLogErrorCodes#STORE_UNAVAILABLE}.</p>
 *
 * <p>The layers above (writer, collator, replay) never retry on their own, so
 * this decorator is the single place where transient failures are absorbed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ResilientObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(ResilientObjectStore.class);

    public static final String INSTANCE_NAME = "object-store";

    private final ObjectStore delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientObjectStore(ObjectStore delegate, RetryConfig retryConfig,
                                CircuitBreakerConfig circuitBreakerConfig, MeterRegistry meterRegistry) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate store cannot be null");

        RetryRegistry retryRegistry = RetryRegistry.of(retryConfig);
        CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.of(circuitBreakerConfig);
        this.retry = retryRegistry.retry(INSTANCE_NAME);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE_NAME);

        if (meterRegistry != null) {
            TaggedRetryMetrics.ofRetryRegistry(retryRegistry).bindTo(meterRegistry);
            TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry).bindTo(meterRegistry);
        }

        retry.getEventPublisher()
            .onRetry(event -> logger.warn("Retrying object store call (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.info("Object store circuit breaker state transition: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
            .onCallNotPermitted(event ->
                logger.debug("Object store circuit breaker call not permitted"));

        logger.info("Resilient object store initialized (maxAttempts={}, failureRateThreshold={}%)",
            retryConfig.getMaxAttempts(), circuitBreakerConfig.getFailureRateThreshold());
    }

    /**
     * Builds the standard retry configuration: exponential backoff, retrying
     * only {@link ObjectStoreException}.
     */
    public static RetryConfig retryConfig(int maxAttempts, Duration initialBackoff, double multiplier) {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
            .retryExceptions(ObjectStoreException.class)
            .build();
    }

    /**
     * Builds the standard circuit breaker configuration, recording only
     * {@link ObjectStoreException} as a failure.
     */
    public static CircuitBreakerConfig circuitBreakerConfig(float failureRateThreshold, int slidingWindowSize,
                                                            int minimumNumberOfCalls, Duration waitInOpenState) {
        return CircuitBreakerConfig.custom()
            .failureRateThreshold(failureRateThreshold)
            .slidingWindowSize(slidingWindowSize)
            .minimumNumberOfCalls(minimumNumberOfCalls)
            .waitDurationInOpenState(waitInOpenState)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordExceptions(ObjectStoreException.class)
            .build();
    }

    /**
     * Circuit breaker configuration that never opens, for deployments that
     * want retries only.
     */
    public static CircuitBreakerConfig disabledCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .recordException(throwable -> false)
            .build();
    }

    /**
     * Retry configuration that makes a single attempt, for deployments that
     * want the circuit breaker only.
     */
    public static RetryConfig noRetryConfig() {
        return RetryConfig.custom()
            .maxAttempts(1)
            .build();
    }

    @Override
    public void put(String key, byte[] data) {
        execute(() -> {
            delegate.put(key, data);
            return null;
        });
    }

    @Override
    public Optional<byte[]> get(String key) {
        return execute(() -> delegate.get(key));
    }

    @Override
    public Optional<byte[]> get(String key, ByteRange range) {
        return execute(() -> delegate.get(key, range));
    }

    @Override
    public void delete(String key) {
        execute(() -> {
            delegate.delete(key);
            return null;
        });
    }

    @Override
    public ListPage list(String prefix, String startAfter, int maxKeys) {
        return execute(() -> delegate.list(prefix, startAfter, maxKeys));
    }

    @Override
    public URI presign(String key, ByteRange range, Duration ttl) {
        return execute(() -> delegate.presign(key, range, ttl));
    }

    private <T> T execute(Supplier<T> call) {
        Supplier<T> decorated = Retry.decorateSupplier(retry,
            CircuitBreaker.decorateSupplier(circuitBreaker, call));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new ObjectStoreException(TideLogErrorCodes.STORE_UNAVAILABLE,
                "Object store circuit breaker is open", e);
        }
    }

    public ObjectStore getDelegate() {
        return delegate;
    }

    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    /**
     * Resets the circuit breaker to closed state.
     */
    public void reset() {
        circuitBreaker.reset();
        logger.info("Reset object store circuit breaker");
    }
}
