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
 * Evidence that two collations ran at the same time, or that the persisted
 * collation state no longer matches what this run read at its start.
 *
 * <p>Collation is single-writer by contract. This exception is surfaced and
 * never resolved automatically; an operator must make sure only one collator
 * is scheduled and re-run it.</p>
 */
public class CollationConflictException extends TideLogException {

    public CollationConflictException(String message) {
        super(TideLogErrorCodes.COLLATION_CONFLICT, message);
    }

    public CollationConflictException(String code, String message) {
        super(code, message);
    }
}
