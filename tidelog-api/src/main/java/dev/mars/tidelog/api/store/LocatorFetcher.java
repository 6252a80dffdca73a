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
package dev.mars.tidelog.api.store;

import java.net.URI;

/**
 * Reads a byte range through a locator previously issued by
 * {@link ObjectStore#presign(String, ByteRange, java.time.Duration)}.
 * This is how a remote consumer materializes a replay manifest without
 * holding store credentials.
 */
@FunctionalInterface
public interface LocatorFetcher {

    /**
     * @param locator presigned locator
     * @param range bytes to read, relative to the start of the object
     * @return the bytes read; shorter than requested if the object is shorter
     * @throws dev.mars.tidelog.api.error.ObjectStoreException if the locator is
     *         expired, unsupported or unreadable
     */
    byte[] fetch(URI locator, ByteRange range);
}
