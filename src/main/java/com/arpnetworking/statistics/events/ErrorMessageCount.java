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
 * Number of error messages logged since the previous report.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ErrorMessageCount extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the count was taken
     * @param count the number of error messages
     */
    public ErrorMessageCount(final Instant timestamp, final long count) {
        super(timestamp);
        _count = count;
    }

    public long getCount() {
        return _count;
    }

    @Override
    public String getUniqueKey() {
        return "ErrorMessageCount/" + getTimestamp().toEpochMilli();
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("Count", _count);
    }

    private final long _count;
}
