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
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;

/**
 * Combines the buckets of two readers on the same timeline pairwise.
 *
 * @param <A> the type of the values of the first reader
 * @param <B> the type of the values of the second reader
 * @param <R> the type of the combined values
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CombinedTimeSeriesReader<A, B, R> implements TimeSeriesReader<R> {

    /**
     * Public constructor.
     *
     * @param first the first reader
     * @param second the second reader; must read the same timeline as {@code first}
     * @param combiner combines a bucket of each reader
     */
    public CombinedTimeSeriesReader(
            final TimeSeriesReader<A> first,
            final TimeSeriesReader<B> second,
            final BiFunction<Optional<A>, Optional<B>, Optional<R>> combiner) {
        if (!first.getTimeline().equals(second.getTimeline())) {
            throw new IllegalArgumentException(
                    String.format("Combined readers must share a timeline; first=%s, second=%s", first.getTimeline(), second.getTimeline()));
        }
        _first = first;
        _second = second;
        _combiner = combiner;
    }

    @Override
    public Timeline getTimeline() {
        return _first.getTimeline();
    }

    @Override
    public CompletionStage<TimeSeriesView<R>> readTimeSpan(final Instant start, final Instant end) {
        return _first.readTimeSpan(start, end)
                .thenCombine(_second.readTimeSpan(start, end), this::combine);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("First", _first)
                .add("Second", _second)
                .toString();
    }

    private TimeSeriesView<R> combine(final TimeSeriesView<A> first, final TimeSeriesView<B> second) {
        final ImmutableList<Optional<A>> firstBuckets = first.getBuckets();
        final ImmutableList<Optional<B>> secondBuckets = second.getBuckets();
        if (firstBuckets.size() != secondBuckets.size()) {
            throw new IllegalStateException(
                    String.format("Combined views differ in length; first=%d, second=%d", firstBuckets.size(), secondBuckets.size()));
        }
        final ImmutableList.Builder<Optional<R>> combined = ImmutableList.builder();
        for (int i = 0; i < firstBuckets.size(); ++i) {
            combined.add(_combiner.apply(firstBuckets.get(i), secondBuckets.get(i)));
        }
        return new TimeSeriesView<>(first.getTimeline(), first.getStartTime(), first.getEndTime(), combined.build());
    }

    private final TimeSeriesReader<A> _first;
    private final TimeSeriesReader<B> _second;
    private final BiFunction<Optional<A>, Optional<B>, Optional<R>> _combiner;
}
