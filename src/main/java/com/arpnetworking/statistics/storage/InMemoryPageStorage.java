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

import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable storage held in memory. Used when no database is configured and in
 * tests. As with the database store, writing a page that already exists is
 * logged and ignored so that a flush may be retried.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class InMemoryPageStorage implements WritablePageStorage {

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(_pages.get(pageId)).map(StoragePage::copy));
    }

    @Override
    public CompletionStage<Void> writeNew(final StoragePage page) {
        if (!page.isFinal()) {
            throw new IllegalArgumentException(String.format("Only final pages can be persisted; page=%s", page.getUniqueId()));
        }
        if (_pages.putIfAbsent(page.getUniqueId(), page.copy()) != null) {
            LOGGER.error()
                    .setMessage("Page already persisted, ignoring duplicate")
                    .addData("pageId", page.getUniqueId())
                    .log();
        }
        return CompletableFuture.completedFuture(null);
    }

    public ImmutableSet<String> getPageIds() {
        return ImmutableSet.copyOf(_pages.keySet());
    }

    private final ConcurrentMap<String, StoragePage> _pages = new ConcurrentHashMap<>();

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryPageStorage.class);
}
