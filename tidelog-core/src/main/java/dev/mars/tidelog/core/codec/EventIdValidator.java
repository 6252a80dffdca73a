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

import java.util.regex.Pattern;

/**
 * Validates event identifiers before they are embedded in object keys.
 *
 * <p>Rules:
 * <ul>
 *   <li>Length between 1 and {@value #MAX_LENGTH} characters</li>
 *   <li>Only ASCII letters, digits and {@code . _ : @ + = -}</li>
 *   <li>No {@code /}, {@code ~} or {@code %}, which are key delimiters</li>
 * </ul>
 *
 * <p>With this alphabet the raw identifier sorts the same way as its encoded
 * form, so ordering by {@code (timestamp, eventId)} and ordering by loose key
 * always agree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class EventIdValidator {

    public static final int MAX_LENGTH = 256;

    private static final Pattern EVENT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._:@+=-]+$");

    private EventIdValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws IllegalArgumentException if the identifier cannot be used as an event id
     */
    public static String validate(String eventId) {
        if (eventId == null || eventId.isEmpty()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (eventId.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Event ID exceeds maximum length of %d characters (length: %d)",
                    MAX_LENGTH, eventId.length()));
        }
        if (!EVENT_ID_PATTERN.matcher(eventId).matches()) {
            throw new IllegalArgumentException(
                String.format("Invalid event ID: '%s'. Allowed characters are letters, digits and . _ : @ + = -",
                    eventId));
        }
        return eventId;
    }

    public static boolean isValid(String eventId) {
        return eventId != null
            && !eventId.isEmpty()
            && eventId.length() <= MAX_LENGTH
            && EVENT_ID_PATTERN.matcher(eventId).matches();
    }
}
