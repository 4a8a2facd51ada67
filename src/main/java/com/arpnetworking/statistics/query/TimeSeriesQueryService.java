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
package com.arpnetworking.statistics.query;

import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.arpnetworking.statistics.reader.TimeSeriesView;
import com.arpnetworking.statistics.registry.TimeSeriesRegistry;
import com.arpnetworking.statistics.series.CohortReadableTimeSeries;
import com.arpnetworking.statistics.series.SimpleReadableTimeSeries;
import com.arpnetworking.statistics.storage.PageStorage;
import com.arpnetworking.statistics.timeline.Resolution;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reads registered series by key over a time range at a resolution.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TimeSeriesQueryService {

    /**
     * Public constructor.
     *
     * @param registry the registered series
     * @param storage the storage to read pages from
     * @param clock the current time
     * @param epoch the epoch of every timeline
     */
    public TimeSeriesQueryService(
            final TimeSeriesRegistry registry,
            final PageStorage storage,
            final Clock clock,
            final Instant epoch) {
        _registry = registry;
        _storage = storage;
        _clock = clock;
        _epoch = epoch;
    }

    /**
     * Read a simple or combined series.
     *
     * @param key the key of the series
     * @param resolutionName the name of the resolution to read at
     * @param start the start of the range, inclusive
     * @param end the end of the range, exclusive
     * @return the values of the buckets covering the range
     */
    public CompletionStage<TimeSeriesView<?>> readSimple(
            final String key,
            final String resolutionName,
            final Instant start,
            final Instant end) {
        final SimpleReadableTimeSeries<?> series = _registry.getSimpleSeries(key)
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown simple series; key=%s", key)));
        return read(series.getReader(createContext(resolutionName)), start, end);
    }

    /**
     * Read every cohort of a cohort series.
     *
     * @param key the key of the series
     * @param resolutionName the name of the resolution to read at
     * @param start the start of the range, inclusive
     * @param end the end of the range, exclusive
     * @return the values of each cohort by cohort label, in display order
     */
    public CompletionStage<ImmutableMap<String, TimeSeriesView<?>>> readCohorts(
            final String key,
            final String resolutionName,
            final Instant start,
            final Instant end) {
        final CohortReadableTimeSeries<?> series = _registry.getCohortSeries(key)
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown cohort series; key=%s", key)));
        final ReadContext context = createContext(resolutionName);
        final List<String> cohorts = new ArrayList<>(series.getCohorts());
        final List<CompletableFuture<TimeSeriesView<?>>> views = new ArrayList<>();
        for (final String cohort : cohorts) {
            views.add(read(series.getReader(cohort, context), start, end).toCompletableFuture());
        }
        return CompletableFuture.allOf(views.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    final ImmutableMap.Builder<String, TimeSeriesView<?>> result = ImmutableMap.builder();
                    for (int i = 0; i < cohorts.size(); ++i) {
                        result.put(cohorts.get(i), views.get(i).join());
                    }
                    return result.build();
                });
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Registry", _registry)
                .add("Storage", _storage)
                .add("Epoch", _epoch)
                .toString();
    }

    private ReadContext createContext(final String resolutionName) {
        final Resolution resolution = _registry.getResolutions()
                .stream()
                .filter(candidate -> candidate.getName().equals(resolutionName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown resolution; resolution=%s", resolutionName)));
        return new ReadContext(new Timeline(_epoch, resolution), _storage, _clock);
    }

    private static <T> CompletionStage<TimeSeriesView<?>> read(
            final TimeSeriesReader<T> reader,
            final Instant start,
            final Instant end) {
        return reader.readTimeSpan(start, end).<TimeSeriesView<?>>thenApply(view -> view);
    }

    private final TimeSeriesRegistry _registry;
    private final PageStorage _storage;
    private final Clock _clock;
    private final Instant _epoch;
}
