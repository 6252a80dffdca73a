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
 * A journal's offset index does not match its content, or the key index is
 * out of order. Fatal for the journal concerned: replay fails rather than
 * returning a truncated stream.
 */
public class CorruptJournalException extends TideLogException {

    private final String journalId;

    public CorruptJournalException(String journalId, String message) {
        this(TideLogErrorCodes.JOURNAL_CORRUPT, journalId, message);
    }

    public CorruptJournalException(String code, String journalId, String message) {
        super(code, "Journal " + journalId + ": " + message);
        this.journalId = journalId;
    }

    /**
     * @return the id of the offending journal
     */
    public String getJournalId() {
        return journalId;
    }
}
