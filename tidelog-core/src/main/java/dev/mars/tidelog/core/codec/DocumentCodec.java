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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.tidelog.api.error.TideLogErrorCodes;
import dev.mars.tidelog.api.error.TideLogException;

import java.io.IOException;

/**
 * JSON encoding for the small metadata documents the log keeps next to its
 * payloads: journal indexes, key index entries, event locators, collation
 * markers and overlay markers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class DocumentCodec {

    private final ObjectMapper objectMapper;

    public DocumentCodec() {
        this(createDefaultObjectMapper());
    }

    public DocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] write(Object document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new TideLogException(TideLogErrorCodes.INTERNAL_ERROR,
                "Failed to encode " + document.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a valid document of the given type
     */
    public <T> T read(byte[] data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " document: " + e.getMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Creates the default ObjectMapper with JSR310 support, writing instants as
     * ISO-8601 strings.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
