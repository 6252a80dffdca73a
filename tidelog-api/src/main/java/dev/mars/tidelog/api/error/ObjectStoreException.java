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
 * Failure raised by an object store implementation (I/O error, unavailable
 * backend, expired locator). These are the transient failures a resilient
 * store decorator may retry.
 */
public class ObjectStoreException extends TideLogException {

    public ObjectStoreException(String message) {
        super(TideLogErrorCodes.STORE_IO_FAILURE, message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(TideLogErrorCodes.STORE_IO_FAILURE, message, cause);
    }

    public ObjectStoreException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
