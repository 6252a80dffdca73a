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

package dev.mars.tidelog.core.codec;

import dev.mars.tidelog.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventIdValidator.
 */
@Tag(TestCategories.CORE)
class EventIdValidatorTest {

    @Test
    void testValidIdentifiers() {
        assertDoesNotThrow(() -> EventIdValidator.validate("order-123"));
        assertDoesNotThrow(() -> EventIdValidator.validate("3f2b9c1e-8d4a-4b7e-9f3a-1c2d3e4f5a6b"));
        assertDoesNotThrow(() -> EventIdValidator.validate("tenant:42.event_7"));
        assertDoesNotThrow(() -> EventIdValidator.validate("user@example.com+tag=1"));
        assertDoesNotThrow(() -> EventIdValidator.validate("a".repeat(EventIdValidator.MAX_LENGTH)));
    }

    @Test
    void testInvalidIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> EventIdValidator.validate(null));
        assertThrows(IllegalArgumentException.class, () -> EventIdValidator.validate(""));
        assertThrows(IllegalArgumentException.class, () -> EventIdValidator.validate("a/b"));
        assertThrows(IllegalArgumentException.class, () -> EventIdValidator.validate("a~b"));
        assertThrows(IllegalArgumentException.class, () -> EventIdValidator.validate("has space"));
        assertThrows(IllegalArgumentException.class,
            () -> EventIdValidator.validate("a".repeat(EventIdValidator.MAX_LENGTH + 1)));
    }

    @Test
    void testIsValid() {
        assertTrue(EventIdValidator.isValid("evt-1"));
        assertFalse(EventIdValidator.isValid("evt/1"));
        assertFalse(EventIdValidator.isValid(null));
    }
}
