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
package dev.mars.tidelog.test.categories;

/**
 * Test categories for organizing TideLog tests by execution time and importance.
 *
 * Usage:
 * - @Tag(TestCategories.CORE) - Fast unit tests, critical functionality
 * - @Tag(TestCategories.INTEGRATION) - Tests against a real file system or several components together
 * - @Tag(TestCategories.PERFORMANCE) - Performance and load tests
 * - @Tag(TestCategories.SLOW) - Long-running tests
 * - @Tag(TestCategories.FLAKY) - Tests that may be unstable
 *
 * Maven execution examples:
 * - mvn test -Dgroups="core" (fast core tests only)
 * - mvn test -Dgroups="core,integration" (core + integration)
 * - mvn test -DexcludedGroups="slow,flaky" (exclude slow/flaky tests)
 */
public final class TestCategories {

    /**
     * CORE - Fast unit tests against the in-memory object store:
     * - Key encoding and validation
     * - Collation, overlays and replay semantics
     * - Configuration loading
     * - Error handling
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - Tests that touch the local file system or wire the full
     * manager together.
     */
    public static final String INTEGRATION = "integration";

    /**
     * PERFORMANCE - Throughput and listing-cost tests.
     */
    public static final String PERFORMANCE = "performance";

    /**
     * SLOW - Long-running tests.
     */
    public static final String SLOW = "slow";

    /**
     * FLAKY - Tests sensitive to timing or system load.
     */
    public static final String FLAKY = "flaky";

    /**
     * SMOKE - Minimal checks that an event log can be opened and used.
     */
    public static final String SMOKE = "smoke";

    private TestCategories() {
        // Utility class - no instantiation
    }
}
