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
import dev.mars.tidelog.api.error.CollationConflictException;
import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CollationScheduler.
 */
@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
class CollationSchedulerTest {

    @Mock
    private Collator collator;

    @Test
    @DisplayName("runOnce records the collation result")
    void runOnce_recordsResult() {
        CollationResult collated = CollationResult.collated(3, "j1", null);
        when(collator.collate(2)).thenReturn(collated);

        CollationScheduler scheduler = new CollationScheduler(collator, 2, Duration.ofSeconds(1));
        scheduler.runOnce();

        assertSame(collated, scheduler.getLastResult());
        assertEquals(1, scheduler.getRunCount());
        assertEquals(0, scheduler.getFailureCount());
    }

    @Test
    @DisplayName("failed runs are counted and do not stop the scheduler")
    void runOnce_countsFailures() {
        when(collator.collate(1))
            .thenThrow(new CollationConflictException("marker moved"))
            .thenThrow(new IllegalStateException("boom"))
            .thenReturn(CollationResult.nothingToDo(null));

        CollationScheduler scheduler = new CollationScheduler(collator, 1, Duration.ofSeconds(1));
        scheduler.runOnce();
        scheduler.runOnce();
        scheduler.runOnce();

        assertEquals(3, scheduler.getRunCount());
        assertEquals(2, scheduler.getFailureCount());
        assertTrue(scheduler.getLastResult().isNothingToDo());
    }

    @Test
    @Tag(TestCategories.SLOW)
    @DisplayName("started scheduler runs collation periodically until stopped")
    void start_runsPeriodically() throws InterruptedException {
        when(collator.collate(1)).thenReturn(CollationResult.nothingToDo(null));

        CollationScheduler scheduler = new CollationScheduler(collator, 1, Duration.ofMillis(50));
        scheduler.start();
        assertTrue(scheduler.isRunning());

        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.getRunCount() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.getRunCount() >= 2);
        verify(collator, atLeast(2)).collate(1);
    }

    @Test
    @DisplayName("scheduler cannot be restarted after stop")
    void start_afterStopIsRejected() {
        CollationScheduler scheduler = new CollationScheduler(collator, 1, Duration.ofSeconds(10));
        scheduler.start();
        scheduler.close();

        assertThrows(IllegalStateException.class, scheduler::start);
        verifyNoInteractions(collator);
    }
}
