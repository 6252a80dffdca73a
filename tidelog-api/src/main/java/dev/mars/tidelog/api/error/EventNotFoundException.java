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
package dev.mars.tidelog.api.error;

/**
 * No loose object and no journal entry exists for an event id.
 * Distinct from a tombstoned event, which is reported as deleted.
 */
public class EventNotFoundException extends TideLogException {

    private final String eventId;

    public EventNotFoundException(String eventId) {
        super(TideLogErrorCodes.EVENT_NOT_FOUND, "Event not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
