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
import com.google.common.base.MoreObjects;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reads from a primary storage and falls back to a secondary storage when the
 * primary does not have the page.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TieredPageStorage extends ReadOnlyPageStorage {

    /**
     * Public constructor.
     *
     * @param primary the storage consulted first
     * @param secondary the storage consulted when the primary misses
     */
    public TieredPageStorage(final PageStorage primary, final PageStorage secondary) {
        _primary = primary;
        _secondary = secondary;
    }

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        return _primary.tryGet(pageId)
                .thenCompose(page -> {
                    if (page.isPresent()) {
                        return CompletableFuture.completedFuture(page);
                    }
                    return _secondary.tryGet(pageId);
                });
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Primary", _primary)
                .add("Secondary", _secondary)
                .toString();
    }

    private final PageStorage _primary;
    private final PageStorage _secondary;
}
