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

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Asynchronous store of {@link StoragePage} instances keyed by their unique id.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface PageStorage {

    /**
     * Fetch a page. A page that does not exist completes with an empty
     * {@link Optional}; any other failure completes exceptionally.
     *
     * @param pageId the unique id of the page
     * @return the page if it exists
     */
    CompletionStage<Optional<StoragePage>> tryGet(String pageId);

    /**
     * Persist a page that has not been persisted before.
     *
     * @param page the page to persist
     * @return completes once the page is persisted
     */
    CompletionStage<Void> writeNew(StoragePage page);
}
