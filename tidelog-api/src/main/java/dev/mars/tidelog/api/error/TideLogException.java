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
 * Base type for every error the event log surfaces to callers.
 *
 * Each exception carries one of the {@link TideLogErrorCodes} so that callers
 * can branch on the code rather than on the message text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TideLogException extends RuntimeException {

    private final String code;

    public TideLogException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TideLogException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Gets the standard error code (e.g. TLGERR0200).
     *
     * @return the error code
     */
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
