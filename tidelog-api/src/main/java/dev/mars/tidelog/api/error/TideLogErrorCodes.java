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
 * Standard error codes for the TideLog event log.
 *
 * Error code ranges:
 * - TLGERR0001-0049: General/System errors
 * - TLGERR0050-0099: Write errors
 * - TLGERR0100-0149: Lookup errors
 * - TLGERR0150-0199: Collation errors
 * - TLGERR0200-0249: Journal errors
 * - TLGERR0250-0299: Object store errors
 */
public final class TideLogErrorCodes {

    private TideLogErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "TLGERR0001";
    public static final String INVALID_REQUEST = "TLGERR0002";
    public static final String CONFIGURATION_INVALID = "TLGERR0003";

    // ========================================================================
    // Write Errors (0050-0099)
    // ========================================================================
    public static final String WRITE_REJECTED = "TLGERR0050";
    public static final String OVERLAY_WRITE_REJECTED = "TLGERR0051";
    public static final String INDEX_WRITE_REJECTED = "TLGERR0052";

    // ========================================================================
    // Lookup Errors (0100-0149)
    // ========================================================================
    public static final String EVENT_NOT_FOUND = "TLGERR0100";
    public static final String OVERLAY_NOT_FOUND = "TLGERR0101";

    // ========================================================================
    // Collation Errors (0150-0199)
    // ========================================================================
    public static final String COLLATION_CONFLICT = "TLGERR0150";
    public static final String COLLATION_MARKER_INVALID = "TLGERR0151";

    // ========================================================================
    // Journal Errors (0200-0249)
    // ========================================================================
    public static final String JOURNAL_CORRUPT = "TLGERR0200";
    public static final String JOURNAL_MISSING = "TLGERR0201";
    public static final String KEY_INDEX_OUT_OF_ORDER = "TLGERR0202";

    // ========================================================================
    // Object Store Errors (0250-0299)
    // ========================================================================
    public static final String STORE_UNAVAILABLE = "TLGERR0250";
    public static final String STORE_IO_FAILURE = "TLGERR0251";
    public static final String LOCATOR_EXPIRED = "TLGERR0252";
    public static final String LOCATOR_UNSUPPORTED = "TLGERR0253";
}
