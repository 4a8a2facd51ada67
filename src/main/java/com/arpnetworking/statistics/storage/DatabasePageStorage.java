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

import com.arpnetworking.statistics.models.ebean.PersistedStoragePage;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.utility.Database;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import io.ebean.DuplicateKeyException;

import java.sql.Timestamp;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Durable storage of final pages in a relational database. Inserting a page
 * that already exists is logged and ignored so that a flush may be retried.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class DatabasePageStorage implements WritablePageStorage {

    /**
     * Public constructor.
     *
     * @param database the database to store pages in
     * @param executor executor for the blocking database calls
     */
    public DatabasePageStorage(final Database database, final Executor executor) {
        _database = database;
        _executor = executor;
    }

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        return CompletableFuture.supplyAsync(
                () -> PersistedStoragePage.findByUniqueKey(pageId, _database)
                        .map(persisted -> StoragePageSerializer.deserialize(persisted.getPayload())),
                _executor);
    }

    @Override
    public CompletionStage<Void> writeNew(final StoragePage page) {
        if (!page.isFinal()) {
            throw new IllegalArgumentException(String.format("Only final pages can be persisted; page=%s", page.getUniqueId()));
        }
        final PersistedStoragePage persisted = new PersistedStoragePage();
        persisted.setUniqueKey(page.getUniqueId());
        persisted.setResolutionName(page.getTimeline().getResolution().getName());
        persisted.setStartTime(Timestamp.from(page.getStartTime()));
        persisted.setEndTime(Timestamp.from(page.getEndTime()));
        persisted.setPayload(StoragePageSerializer.serialize(page));

        return CompletableFuture.runAsync(
                () -> {
                    try {
                        _database.getEbeanServer().insert(persisted);
                    } catch (final DuplicateKeyException e) {
                        LOGGER.error()
                                .setMessage("Page already persisted, ignoring duplicate")
                                .addData("pageId", page.getUniqueId())
                                .setThrowable(e)
                                .log();
                    }
                },
                _executor);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Database", _database)
                .toString();
    }

    private final Database _database;
    private final Executor _executor;

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabasePageStorage.class);
}
