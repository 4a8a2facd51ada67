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
package com.arpnetworking.statistics.series;

import com.arpnetworking.statistics.reader.CombinedTimeSeriesReader;
import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * A cohort series computed when read by combining the same cohort of two
 * cohort series. Both series must have identical cohorts.
 *
 * @param <A> the type of the values of the first series
 * @param <B> the type of the values of the second series
 * @param <R> the type of the combined values
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CohortCombinedSeries<A, B, R> implements CohortReadableTimeSeries<R> {

    /**
     * Public constructor.
     *
     * @param key the key of the combined series
     * @param first the first series
     * @param second the second series
     * @param combiner combines a bucket of each series
     */
    public CohortCombinedSeries(
            final String key,
            final CohortReadableTimeSeries<A> first,
            final CohortReadableTimeSeries<B> second,
            final BiFunction<Optional<A>, Optional<B>, Optional<R>> combiner) {
        if (!first.getCohorts().equals(second.getCohorts())) {
            throw new IllegalArgumentException(String.format(
                    "Combined cohort series must have the same cohorts; key=%s, first=%s, second=%s",
                    key,
                    first.getCohorts(),
                    second.getCohorts()));
        }
        _key = SeriesKeys.checkSeriesKey(key);
        _first = first;
        _second = second;
        _combiner = combiner;
    }

    @Override
    public String getKey() {
        return _key;
    }

    @Override
    public ImmutableList<String> getCohorts() {
        return _first.getCohorts();
    }

    @Override
    public TimeSeriesReader<R> getReader(final String cohort, final ReadContext context) {
        return new CombinedTimeSeriesReader<>(_first.getReader(cohort, context), _second.getReader(cohort, context), _combiner);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Key", _key)
                .add("First", _first.getKey())
                .add("Second", _second.getKey())
                .toString();
    }

    private final String _key;
    private final CohortReadableTimeSeries<A> _first;
    private final CohortReadableTimeSeries<B> _second;
    private final BiFunction<Optional<A>, Optional<B>, Optional<R>> _combiner;
}
