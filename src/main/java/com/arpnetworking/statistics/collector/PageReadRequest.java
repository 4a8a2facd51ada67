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

import com.google.common.base.MoreObjects;

/**
 * Asks the {@link StatisticsCollector} for a page it has not persisted yet.
 * The reply is a {@link PageReadResponse}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageReadRequest {

    /**
     * Public constructor.
     *
     * @param pageId the unique id of the page
     */
    public PageReadRequest(final String pageId) {
        _pageId = pageId;
    }

    public String getPageId() {
        return _pageId;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("PageId", _pageId)
                .toString();
    }

    private final String _pageId;
}
