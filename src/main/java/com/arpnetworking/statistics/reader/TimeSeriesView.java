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

import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.Optional;

/**
 * Consecutive buckets of a series read from a timeline. The start is the
 * start of the first bucket and the end is the end of the last bucket.
 *
 * @param <T> the type of the values
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TimeSeriesView<T> {

    /**
     * Public constructor.
     *
     * @param timeline the timeline the buckets belong to
     * @param startTime the start of the first bucket
     * @param endTime the end of the last bucket
     * @param buckets the value of each bucket
     */
    public TimeSeriesView(
            final Timeline timeline,
            final Instant startTime,
            final Instant endTime,
            final ImmutableList<Optional<T>> buckets) {
        _timeline = timeline;
        _startTime = startTime;
        _endTime = endTime;
        _buckets = buckets;
    }

    public Timeline getTimeline() {
        return _timeline;
    }

    public Instant getStartTime() {
        return _startTime;
    }

    public Instant getEndTime() {
        return _endTime;
    }

    public ImmutableList<Optional<T>> getBuckets() {
        return _buckets;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("StartTime", _startTime)
                .add("EndTime", _endTime)
                .add("Buckets", _buckets)
                .toString();
    }

    private final Timeline _timeline;
    private final Instant _startTime;
    private final Instant _endTime;
    private final ImmutableList<Optional<T>> _buckets;
}
