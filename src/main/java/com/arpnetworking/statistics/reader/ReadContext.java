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
package com.arpnetworking.statistics.reader;

import com.arpnetworking.statistics.storage.PageStorage;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;

import java.time.Clock;

/**
 * What a reader needs to read series: the timeline to read at, the storage
 * holding the pages and the clock defining which buckets are in the future.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ReadContext {

    /**
     * Public constructor.
     *
     * @param timeline the timeline to read at
     * @param storage the storage holding the pages
     * @param clock the current time
     */
    public ReadContext(final Timeline timeline, final PageStorage storage, final Clock clock) {
        _timeline = timeline;
        _storage = storage;
        _clock = clock;
    }

    public Timeline getTimeline() {
        return _timeline;
    }

    public PageStorage getStorage() {
        return _storage;
    }

    public Clock getClock() {
        return _clock;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timeline", _timeline)
                .add("Storage", _storage)
                .toString();
    }

    private final Timeline _timeline;
    private final PageStorage _storage;
    private final Clock _clock;
}
