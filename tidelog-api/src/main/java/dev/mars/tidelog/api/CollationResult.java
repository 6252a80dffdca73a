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
package dev.mars.tidelog.api;

import java.util.Optional;

/**
 * Outcome of one collation run.
 *
 * @param status whether a journal was produced
 * @param eventsFolded number of loose events folded into the new journal
 * @param journalId id of the new journal, null when nothing was collated
 * @param recoveredJournalId id of a journal left unfinished by an earlier
 *                           interrupted run and completed by this one, or null
 */
public record CollationResult(Status status, int eventsFolded, String journalId, String recoveredJournalId) {

    public enum Status {
        COLLATED,
        NOTHING_TO_DO
    }

    public static CollationResult collated(int eventsFolded, String journalId, String recoveredJournalId) {
        return new CollationResult(Status.COLLATED, eventsFolded, journalId, recoveredJournalId);
    }

    public static CollationResult nothingToDo(String recoveredJournalId) {
        return new CollationResult(Status.NOTHING_TO_DO, 0, null, recoveredJournalId);
    }

    public Optional<String> journal() {
        return Optional.ofNullable(journalId);
    }

    public Optional<String> recoveredJournal() {
        return Optional.ofNullable(recoveredJournalId);
    }

    public boolean isNothingToDo() {
        return status == Status.NOTHING_TO_DO;
    }
}
