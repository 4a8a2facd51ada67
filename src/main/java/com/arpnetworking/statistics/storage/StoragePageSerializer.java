/*
 * Copyright 2024 Inscope Metrics
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
package com.arpnetworking.statistics.storage;

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.statistics.page.StoragePage;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Converts pages to and from the payload stored in durable storage.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class StoragePageSerializer {

    /**
     * Serialize a page.
     *
     * @param page the page
     * @return the payload
     */
    public static byte[] serialize(final StoragePage page) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(page);
        } catch (final IOException e) {
            throw new UncheckedIOException(String.format("Unable to serialize page; page=%s", page.getUniqueId()), e);
        }
    }

    /**
     * Deserialize a page.
     *
     * @param payload the payload
     * @return the page
     */
    public static StoragePage deserialize(final byte[] payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, StoragePage.class);
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to deserialize page", e);
        }
    }

    private StoragePageSerializer() { }

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
}
