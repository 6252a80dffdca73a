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
package dev.mars.tidelog.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration management for TideLog.
 *
 * Properties are layered, later sources winning:
 * - /tidelog-default.properties on the classpath
 * - /tidelog-&lt;profile&gt;.properties on the classpath
 * - TIDELOG_* environment variables
 * - tidelog.* system properties
 * - explicit overrides passed to the constructor
 *
 * The result is validated once at construction; every problem found is
 * reported together in a single {@link IllegalStateException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TideLogConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TideLogConfiguration.class);

    private static final String PROPERTY_PREFIX = "tidelog.";
    private static final String ENV_PREFIX = "TIDELOG_";

    private final Properties properties;
    private final String profile;

    public TideLogConfiguration() {
        this(getActiveProfile());
    }

    public TideLogConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. Overrides are applied last
     * without touching system properties, so concurrent instances in one JVM
     * do not interfere with each other.
     */
    public TideLogConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded TideLog configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("tidelog.profile",
               System.getenv("TIDELOG_PROFILE") != null ? System.getenv("TIDELOG_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/tidelog-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/tidelog-" + profile + ".properties");
        }

        // env first, then system properties so that -D wins
        applyEnvironment(props, System.getenv());

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PROPERTY_PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps TIDELOG_* variables onto property keys. A variable matches a known
     * key when the key, upper-cased with dots and hyphens turned into
     * underscores, equals the variable name; unknown variables map to
     * lower-case dotted keys.
     */
    static void applyEnvironment(Properties props, Map<String, String> environment) {
        environment.forEach((name, value) -> {
            if (!name.startsWith(ENV_PREFIX)) {
                return;
            }
            String propKey = null;
            for (String known : props.stringPropertyNames()) {
                if (toEnvName(known).equals(name)) {
                    propKey = known;
                    break;
                }
            }
            if (propKey == null) {
                propKey = name.toLowerCase(Locale.ROOT).replace('_', '.');
            }
            props.setProperty(propKey, value);
        });
    }

    static String toEnvName(String propertyKey) {
        return propertyKey.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateNamespaceConfig(errors);
        validateCollationConfig(errors);
        validateManifestConfig(errors);
        validateStoreConfig(errors);
        validateRetryConfig(errors);
        validateCircuitBreakerConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
    }

    private void validateNamespaceConfig(List<String> errors) {
        String root = getString("tidelog.namespace.root-prefix", "tidelog");
        if (root.isEmpty()) {
            errors.add("Namespace root prefix is required");
        } else if (root.startsWith("/") || root.contains("~") || root.contains("//")) {
            errors.add("Namespace root prefix must not start with '/' or contain '~' or '//'");
        }
    }

    private void validateCollationConfig(List<String> errors) {
        int minBatchSize = getInt("tidelog.collation.min-batch-size", 1);
        if (minBatchSize < 1) {
            errors.add("Collation minimum batch size must be at least 1");
        }

        int maxEvents = getInt("tidelog.collation.max-events-per-journal", 10000);
        if (maxEvents < 1) {
            errors.add("Collation max events per journal must be at least 1");
        }
        if (maxEvents < minBatchSize) {
            errors.add("Collation max events per journal must be at least the minimum batch size");
        }

        if (getBoolean("tidelog.collation.enabled", false)) {
            Duration interval = getDuration("tidelog.collation.interval", Duration.ofSeconds(30));
            if (interval.toMillis() < 100) {
                errors.add("Collation interval must be at least 100ms");
            }
        }
    }

    private void validateManifestConfig(List<String> errors) {
        Duration ttl = getDuration("tidelog.manifest.url-ttl", Duration.ofMinutes(15));
        if (ttl.isNegative() || ttl.isZero()) {
            errors.add("Manifest URL TTL must be positive");
        }
        if (getInt("tidelog.manifest.max-journals", 0) < 0) {
            errors.add("Manifest max journals must be non-negative");
        }
    }

    private void validateStoreConfig(List<String> errors) {
        String type = getString("tidelog.store.type", "memory");
        if ("filesystem".equals(type)) {
            if (getString("tidelog.store.filesystem.root", "").isEmpty()) {
                errors.add("File system store root is required when tidelog.store.type=filesystem");
            }
        } else if (!"memory".equals(type)) {
            errors.add("Store type must be 'memory' or 'filesystem'");
        }
    }

    private void validateRetryConfig(List<String> errors) {
        if (getBoolean("tidelog.retry.enabled", true)) {
            if (getInt("tidelog.retry.max-attempts", 3) < 1) {
                errors.add("Retry max attempts must be at least 1");
            }
            Duration backoff = getDuration("tidelog.retry.initial-backoff", Duration.ofMillis(100));
            if (backoff.isNegative() || backoff.isZero()) {
                errors.add("Retry initial backoff must be positive");
            }
            if (getDouble("tidelog.retry.multiplier", 2.0) < 1.0) {
                errors.add("Retry multiplier must be at least 1.0");
            }
        }
    }

    private void validateCircuitBreakerConfig(List<String> errors) {
        if (getBoolean("tidelog.circuit-breaker.enabled", true)) {
            double rate = getDouble("tidelog.circuit-breaker.failure-rate-threshold", 50.0);
            if (rate <= 0 || rate > 100) {
                errors.add("Circuit breaker failure rate threshold must be in (0, 100]");
            }
            if (getInt("tidelog.circuit-breaker.sliding-window-size", 100) < 1) {
                errors.add("Circuit breaker sliding window size must be at least 1");
            }
            if (getInt("tidelog.circuit-breaker.minimum-number-of-calls", 10) < 1) {
                errors.add("Circuit breaker minimum number of calls must be at least 1");
            }
            if (getDuration("tidelog.circuit-breaker.wait-duration", Duration.ofSeconds(30)).toMillis() < 100) {
                errors.add("Circuit breaker wait duration must be at least 100ms");
            }
        }
    }

    // Configuration getters with defaults and validation
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration sections
    public NamespaceConfig getNamespaceConfig() {
        return new NamespaceConfig(getString("tidelog.namespace.root-prefix", "tidelog"));
    }

    public CollationConfig getCollationConfig() {
        return new CollationConfig(
            getBoolean("tidelog.collation.enabled", false),
            getInt("tidelog.collation.min-batch-size", 1),
            getInt("tidelog.collation.max-events-per-journal", 10000),
            getDuration("tidelog.collation.interval", Duration.ofSeconds(30))
        );
    }

    public ManifestConfig getManifestConfig() {
        return new ManifestConfig(
            getDuration("tidelog.manifest.url-ttl", Duration.ofMinutes(15)),
            getInt("tidelog.manifest.max-journals", 0)
        );
    }

    public StoreConfig getStoreConfig() {
        return new StoreConfig(
            getString("tidelog.store.type", "memory"),
            getString("tidelog.store.filesystem.root", ""),
            getString("tidelog.store.memory.name", "default")
        );
    }

    public RetryConfig getRetryConfig() {
        return new RetryConfig(
            getBoolean("tidelog.retry.enabled", true),
            getInt("tidelog.retry.max-attempts", 3),
            getDuration("tidelog.retry.initial-backoff", Duration.ofMillis(100)),
            getDouble("tidelog.retry.multiplier", 2.0)
        );
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return new CircuitBreakerConfig(
            getBoolean("tidelog.circuit-breaker.enabled", true),
            getDouble("tidelog.circuit-breaker.failure-rate-threshold", 50.0),
            getInt("tidelog.circuit-breaker.sliding-window-size", 100),
            getInt("tidelog.circuit-breaker.minimum-number-of-calls", 10),
            getDuration("tidelog.circuit-breaker.wait-duration", Duration.ofSeconds(30))
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("tidelog.metrics.enabled", true),
            getString("tidelog.metrics.instance-id", "tidelog-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes
    public static class NamespaceConfig {
        private final String rootPrefix;

        public NamespaceConfig(String rootPrefix) {
            this.rootPrefix = rootPrefix;
        }

        public String getRootPrefix() { return rootPrefix; }
    }

    public static class CollationConfig {
        private final boolean enabled;
        private final int minBatchSize;
        private final int maxEventsPerJournal;
        private final Duration interval;

        public CollationConfig(boolean enabled, int minBatchSize, int maxEventsPerJournal, Duration interval) {
            this.enabled = enabled;
            this.minBatchSize = minBatchSize;
            this.maxEventsPerJournal = maxEventsPerJournal;
            this.interval = interval;
        }

        public boolean isEnabled() { return enabled; }
        public int getMinBatchSize() { return minBatchSize; }
        public int getMaxEventsPerJournal() { return maxEventsPerJournal; }
        public Duration getInterval() { return interval; }
    }

    public static class ManifestConfig {
        private final Duration urlTtl;
        private final int maxJournals;

        public ManifestConfig(Duration urlTtl, int maxJournals) {
            this.urlTtl = urlTtl;
            this.maxJournals = maxJournals;
        }

        public Duration getUrlTtl() { return urlTtl; }
        public int getMaxJournals() { return maxJournals; }
    }

    public static class StoreConfig {
        private final String type;
        private final String filesystemRoot;
        private final String memoryName;

        public StoreConfig(String type, String filesystemRoot, String memoryName) {
            this.type = type;
            this.filesystemRoot = filesystemRoot;
            this.memoryName = memoryName;
        }

        public String getType() { return type; }
        public String getFilesystemRoot() { return filesystemRoot; }
        public String getMemoryName() { return memoryName; }
        public boolean isFilesystem() { return "filesystem".equals(type); }
    }

    public static class RetryConfig {
        private final boolean enabled;
        private final int maxAttempts;
        private final Duration initialBackoff;
        private final double multiplier;

        public RetryConfig(boolean enabled, int maxAttempts, Duration initialBackoff, double multiplier) {
            this.enabled = enabled;
            this.maxAttempts = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.multiplier = multiplier;
        }

        public boolean isEnabled() { return enabled; }
        public int getMaxAttempts() { return maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public double getMultiplier() { return multiplier; }
    }

    public static class CircuitBreakerConfig {
        private final boolean enabled;
        private final double failureRateThreshold;
        private final int slidingWindowSize;
        private final int minimumNumberOfCalls;
        private final Duration waitDuration;

        public CircuitBreakerConfig(boolean enabled, double failureRateThreshold, int slidingWindowSize,
                                    int minimumNumberOfCalls, Duration waitDuration) {
            this.enabled = enabled;
            this.failureRateThreshold = failureRateThreshold;
            this.slidingWindowSize = slidingWindowSize;
            this.minimumNumberOfCalls = minimumNumberOfCalls;
            this.waitDuration = waitDuration;
        }

        public boolean isEnabled() { return enabled; }
        public double getFailureRateThreshold() { return failureRateThreshold; }
        public int getSlidingWindowSize() { return slidingWindowSize; }
        public int getMinimumNumberOfCalls() { return minimumNumberOfCalls; }
        public Duration getWaitDuration() { return waitDuration; }

        @Override
        public String toString() {
            return "CircuitBreakerConfig{enabled=" + enabled + ", failureRateThreshold=" + failureRateThreshold
                + ", slidingWindowSize=" + slidingWindowSize + ", waitDuration=" + waitDuration + '}';
        }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
