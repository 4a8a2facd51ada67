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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionStage;

/**
 * Reads a window shifted forward by a fixed offset and reports it under the
 * unshifted times. Reading {@code [s, e)} returns the buckets of
 * {@code [s + offset, e + offset)}.
 *
 * @param <T> the type of the values read
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class FutureLookingTimeSeriesReader<T> implements TimeSeriesReader<T> {

    /**
     * Public constructor.
     *
     * @param reader the reader of the shifted window
     * @param offset how far to shift the window forward
     */
    public FutureLookingTimeSeriesReader(final TimeSeriesReader<T> reader, final Duration offset) {
        if (offset.isNegative()) {
            throw new IllegalArgumentException(String.format("Offset must not be negative; offset=%s", offset));
        }
        _reader = reader;
        _offset = offset;
    }

    @Override
    public Timeline getTimeline() {
        return _reader.getTimeline();
    }

    @Override
    public CompletionStage<TimeSeriesView<T>> readTimeSpan(final Instant start, final Instant end) {
        return _reader.readTimeSpan(start.plus(_offset), end.plus(_offset))
                .thenApply(view -> new TimeSeriesView<>(
                        view.getTimeline(),
                        view.getStartTime().minus(_offset),
                        view.getEndTime().minus(_offset),
                        view.getBuckets()));
    }

    public Duration getOffset() {
        return _offset;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Reader", _reader)
                .add("Offset", _offset)
                .toString();
    }

    private final TimeSeriesReader<T> _reader;
    private final Duration _offset;
}
