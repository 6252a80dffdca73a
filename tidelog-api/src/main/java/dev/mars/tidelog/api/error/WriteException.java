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
 * The object store rejected a write. Propagated to the caller as-is; this layer
 * does not retry.
 */
public class WriteException extends TideLogException {

    private final String key;

    public WriteException(String key, Throwable cause) {
        this(TideLogErrorCodes.WRITE_REJECTED, key, cause);
    }

    public WriteException(String code, String key, Throwable cause) {
        super(code, "Object store rejected write of " + key
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.key = key;
    }

    /**
     * @return the object key whose write failed
     */
    public String getKey() {
        return key;
    }
}
