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

import java.util.concurrent.CompletionStage;

/**
 * Base for storage tiers that only serve reads. Writes must be sent to a
 * {@link WritablePageStorage} directly.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class ReadOnlyPageStorage implements PageStorage {

    @Override
    public final CompletionStage<Void> writeNew(final StoragePage page) {
        throw new UnsupportedOperationException(
                String.format("Storage is read only; storage=%s, page=%s", getClass().getSimpleName(), page.getUniqueId()));
    }
}
