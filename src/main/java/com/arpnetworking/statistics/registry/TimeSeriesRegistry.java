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
package com.arpnetworking.statistics.registry;

import com.arpnetworking.statistics.series.CohortReadableTimeSeries;
import com.arpnetworking.statistics.series.SimpleReadableTimeSeries;
import com.arpnetworking.statistics.series.WritableTimeSeries;
import com.arpnetworking.statistics.timeline.Resolution;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The readable series by key and the series written at each resolution.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TimeSeriesRegistry {

    /**
     * Find a simple series.
     *
     * @param key the key of the series
     * @return the series, if registered
     */
    public Optional<SimpleReadableTimeSeries<?>> getSimpleSeries(final String key) {
        return Optional.ofNullable(_simpleSeries.get(key));
    }

    /**
     * Find a cohort series.
     *
     * @param key the key of the series
     * @return the series, if registered
     */
    public Optional<CohortReadableTimeSeries<?>> getCohortSeries(final String key) {
        return Optional.ofNullable(_cohortSeries.get(key));
    }

    public ImmutableMap<String, SimpleReadableTimeSeries<?>> getSimpleSeries() {
        return _simpleSeries;
    }

    public ImmutableMap<String, CohortReadableTimeSeries<?>> getCohortSeries() {
        return _cohortSeries;
    }

    public ImmutableList<Resolution> getResolutions() {
        return _resolutions;
    }

    /**
     * The series written at a resolution.
     *
     * @param resolution the resolution
     * @return the series, empty if none are written at the resolution
     */
    public ImmutableList<WritableTimeSeries<?>> getWritableSeries(final Resolution resolution) {
        return _writableSeries.get(resolution);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Resolutions", _resolutions)
                .add("SimpleSeries", _simpleSeries.keySet())
                .add("CohortSeries", _cohortSeries.keySet())
                .toString();
    }

    private TimeSeriesRegistry(final Builder builder) {
        _resolutions = builder._resolutions;
        _simpleSeries = ImmutableMap.copyOf(builder._simpleSeries);
        _cohortSeries = ImmutableMap.copyOf(builder._cohortSeries);
        _writableSeries = builder._writableSeries.build();
    }

    private final ImmutableList<Resolution> _resolutions;
    private final ImmutableMap<String, SimpleReadableTimeSeries<?>> _simpleSeries;
    private final ImmutableMap<String, CohortReadableTimeSeries<?>> _cohortSeries;
    private final ImmutableListMultimap<Resolution, WritableTimeSeries<?>> _writableSeries;

    /**
     * Accumulates the series of a {@link TimeSeriesRegistry}. Keys are unique
     * across simple and cohort series.
     */
    public static final class Builder {

        /**
         * Public constructor.
         *
         * @param resolutions the resolutions series are written at
         */
        public Builder(final ImmutableList<Resolution> resolutions) {
            _resolutions = resolutions;
        }

        /**
         * Add a simple series that is only read.
         *
         * @param series the series
         * @return This {@link Builder} instance.
         */
        public Builder addSimpleSeries(final SimpleReadableTimeSeries<?> series) {
            claimKey(series.getKey());
            _simpleSeries.put(series.getKey(), series);
            return this;
        }

        /**
         * Add a simple series written at every resolution.
         *
         * @param series the series
         * @param <S> the type of the series
         * @return This {@link Builder} instance.
         */
        public <S extends SimpleReadableTimeSeries<?> & WritableTimeSeries<?>> Builder addWrittenSimpleSeries(final S series) {
            addSimpleSeries(series);
            addWritten(series, _resolutions);
            return this;
        }

        /**
         * Add a cohort series that is only read.
         *
         * @param series the series
         * @return This {@link Builder} instance.
         */
        public Builder addCohortSeries(final CohortReadableTimeSeries<?> series) {
            claimKey(series.getKey());
            _cohortSeries.put(series.getKey(), series);
            return this;
        }

        /**
         * Add a cohort series written at some resolutions.
         *
         * @param series the series
         * @param resolutions the resolutions it is written at
         * @param <S> the type of the series
         * @return This {@link Builder} instance.
         */
        public <S extends CohortReadableTimeSeries<?> & WritableTimeSeries<?>> Builder addWrittenCohortSeries(
                final S series,
                final ImmutableList<Resolution> resolutions) {
            addCohortSeries(series);
            addWritten(series, resolutions);
            return this;
        }

        /**
         * Create the registry.
         *
         * @return the new {@link TimeSeriesRegistry}
         */
        public TimeSeriesRegistry build() {
            return new TimeSeriesRegistry(this);
        }

        private void addWritten(final WritableTimeSeries<?> series, final ImmutableList<Resolution> resolutions) {
            for (final Resolution resolution : resolutions) {
                if (!_resolutions.contains(resolution)) {
                    throw new IllegalArgumentException(
                            String.format("Unknown resolution; series=%s, resolution=%s", series.getKey(), resolution));
                }
                _writableSeries.put(resolution, series);
            }
        }

        private void claimKey(final String key) {
            if (!_keys.add(key)) {
                throw new IllegalArgumentException(String.format("Series already registered; key=%s", key));
            }
        }

        private final ImmutableList<Resolution> _resolutions;
        private final Set<String> _keys = new HashSet<>();
        private final Map<String, SimpleReadableTimeSeries<?>> _simpleSeries = new LinkedHashMap<>();
        private final Map<String, CohortReadableTimeSeries<?>> _cohortSeries = new LinkedHashMap<>();
        private final ImmutableListMultimap.Builder<Resolution, WritableTimeSeries<?>> _writableSeries =
                ImmutableListMultimap.builder();
    }
}
