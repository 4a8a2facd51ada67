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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.page.PageId;
import com.arpnetworking.statistics.reader.FutureLookingTimeSeriesReader;
import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * A cohort series whose cohorts are ages in days since a reference event,
 * for example days since registration.
 *
 * Values are written in the bucket of the event. Reading cohort {@code k}
 * over {@code [s, e)} reads {@code [s + k days, e + k days)} and reports it
 * under {@code [s, e)}, aligning each day's cohort with the day its members
 * joined. Only timelines with daily buckets can be read.
 *
 * @param <T> the numeric type stored by the series
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class DailyCohortTimeSeries<T extends Number> implements WritableTimeSeries<T>, CohortReadableTimeSeries<T> {

    @Override
    public String getKey() {
        return _series.getKey();
    }

    @Override
    public ImmutableSet<Class<? extends StatisticsEvent>> getEventTypes() {
        return _series.getEventTypes();
    }

    @Override
    public String getStoragePageKey() {
        return _series.getStoragePageKey();
    }

    @Override
    public NumberKind<T> getNumberKind() {
        return _series.getNumberKind();
    }

    @Override
    public boolean isNullable() {
        return _series.isNullable();
    }

    @Override
    public ImmutableList<String> getCohorts() {
        return _series.getCohorts();
    }

    public ImmutableList<Integer> getDays() {
        return _days;
    }

    @Override
    public SeriesWriter createWriter() {
        return _series.createWriter();
    }

    @Override
    public TimeSeriesReader<T> getReader(final String cohort, final ReadContext context) {
        final int days;
        try {
            days = Integer.parseInt(cohort);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Daily cohort is not a day; series=%s, cohort=%s", getKey(), cohort), e);
        }
        if (!_days.contains(days)) {
            throw new IllegalArgumentException(String.format("Unknown daily cohort; series=%s, cohort=%s", getKey(), cohort));
        }
        final Duration bucketInterval = context.getTimeline().getResolution().getBucketInterval();
        if (!ONE_DAY.equals(bucketInterval)) {
            throw new IllegalArgumentException(String.format(
                    "Daily cohorts can only be read at a daily resolution; series=%s, resolution=%s",
                    getKey(),
                    context.getTimeline().getResolution()));
        }
        return new FutureLookingTimeSeriesReader<>(_series.getReader(cohort, context), Duration.ofDays(days));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Series", _series)
                .add("Days", _days)
                .toString();
    }

    private DailyCohortTimeSeries(final Builder<T> builder) {
        for (final Integer day : builder._days) {
            if (day < 0) {
                throw new IllegalArgumentException(String.format("Daily cohort cannot be negative; key=%s, day=%d", builder._key, day));
            }
        }
        _days = builder._days;
        _series = new CohortTimeSeries.Builder<T>()
                .setKey(builder._key)
                .setStoragePageKey(builder._storagePageKey)
                .setEventTypes(builder._eventTypes)
                .setNumberKind(builder._numberKind)
                .setCohorts(builder._days.stream().map(String::valueOf).collect(ImmutableList.toImmutableList()))
                .setParser(builder._parser)
                .build();
    }

    private final CohortTimeSeries<T> _series;
    private final ImmutableList<Integer> _days;

    private static final Duration ONE_DAY = Duration.ofDays(1);

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DailyCohortTimeSeries}.
     *
     * @param <T> the numeric type stored by the series
     */
    public static final class Builder<T extends Number> extends OvalBuilder<DailyCohortTimeSeries<T>> {

        /**
         * Public constructor.
         */
        public Builder() {
            super((Builder<T> builder) -> new DailyCohortTimeSeries<>(builder));
        }

        /**
         * Set the key. Required. Cannot be null or empty.
         *
         * @param value The key.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setKey(final String value) {
            _key = value;
            return this;
        }

        /**
         * Set the storage page key. Optional. Defaults to {@link PageId#DEFAULT_PAGE_KEY}.
         *
         * @param value The storage page key.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setStoragePageKey(final String value) {
            _storagePageKey = value;
            return this;
        }

        /**
         * Set the event types. Required. Cannot be null or empty.
         *
         * @param value The event types.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setEventTypes(final ImmutableSet<Class<? extends StatisticsEvent>> value) {
            _eventTypes = value;
            return this;
        }

        /**
         * Set the number kind. Required. Cannot be null.
         *
         * @param value The number kind.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setNumberKind(final NumberKind<T> value) {
            _numberKind = value;
            return this;
        }

        /**
         * Set the tracked days in display order. Required. Cannot be null or empty.
         *
         * @param value The days.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setDays(final ImmutableList<Integer> value) {
            _days = value;
            return this;
        }

        /**
         * Set the parser mapping an event to its age in days and a value.
         * The parser must only produce tracked days; any other day fails the
         * write as a configuration error. Required. Cannot be null.
         *
         * @param value The parser.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setParser(final Function<StatisticsEvent, Optional<CohortSample<T>>> value) {
            _parser = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _key;
        @NotNull
        private String _storagePageKey = PageId.DEFAULT_PAGE_KEY;
        @NotNull
        private ImmutableSet<Class<? extends StatisticsEvent>> _eventTypes;
        @NotNull
        private NumberKind<T> _numberKind;
        @NotNull
        private ImmutableList<Integer> _days;
        @NotNull
        private Function<StatisticsEvent, Optional<CohortSample<T>>> _parser;
    }
}
