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
 * Periodic sample of the live state of the service.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class LiveMetrics extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the sample was taken
     * @param concurrentUsers the number of connected users
     */
    public LiveMetrics(final Instant timestamp, final long concurrentUsers) {
        super(timestamp);
        _concurrentUsers = concurrentUsers;
    }

    public long getConcurrentUsers() {
        return _concurrentUsers;
    }

    @Override
    public String getUniqueKey() {
        return "LiveMetrics/" + getTimestamp().toEpochMilli();
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("ConcurrentUsers", _concurrentUsers);
    }

    private final long _concurrentUsers;
}
