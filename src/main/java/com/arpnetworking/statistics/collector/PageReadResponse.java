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
package com.arpnetworking.statistics.collector;

import com.arpnetworking.statistics.page.StoragePage;
import com.google.common.base.MoreObjects;

import java.util.Optional;

/**
 * Reply to a {@link PageReadRequest}. Holds a copy of the page if the
 * collector had it buffered.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageReadResponse {

    /**
     * Public constructor.
     *
     * @param page the page, if buffered
     */
    public PageReadResponse(final Optional<StoragePage> page) {
        _page = page;
    }

    public Optional<StoragePage> getPage() {
        return _page;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Page", _page)
                .toString();
    }

    private final Optional<StoragePage> _page;
}
