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
package com.arpnetworking.statistics.events;

import com.google.common.base.MoreObjects;

import java.time.Instant;

/**
 * Base class for the events accumulated into statistics time series. Events
 * are routed to series by their exact class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class StatisticsEvent {

    /**
     * Protected constructor.
     *
     * @param timestamp when the event happened
     */
    protected StatisticsEvent(final Instant timestamp) {
        _timestamp = timestamp;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    /**
     * A key identifying the event, used to recognize duplicates.
     *
     * @return the unique key
     */
    public abstract String getUniqueKey();

    @Override
    public String toString() {
        return toStringHelper().toString();
    }

    /**
     * Create a {@link MoreObjects.ToStringHelper} holding the common fields.
     *
     * @return the helper
     */
    protected MoreObjects.ToStringHelper toStringHelper() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("UniqueKey", getUniqueKey());
    }

    private final Instant _timestamp;
}
