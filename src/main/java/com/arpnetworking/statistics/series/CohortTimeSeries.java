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
import com.arpnetworking.statistics.reader.PagedTimeSeriesReader;
import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A series broken down by a fixed set of cohorts. Each matching event is
 * mapped to a cohort and a value which is added to the bucket of that cohort.
 *
 * @param <T> the numeric type stored by the series
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CohortTimeSeries<T extends Number> implements WritableTimeSeries<T>, CohortReadableTimeSeries<T> {

    @Override
    public String getKey() {
        return _key;
    }

    @Override
    public ImmutableSet<Class<? extends StatisticsEvent>> getEventTypes() {
        return _eventTypes;
    }

    @Override
    public String getStoragePageKey() {
        return _storagePageKey;
    }

    @Override
    public NumberKind<T> getNumberKind() {
        return _numberKind;
    }

    @Override
    public boolean isNullable() {
        return false;
    }

    @Override
    public ImmutableList<String> getCohorts() {
        return _cohorts;
    }

    @Override
    public SeriesWriter createWriter() {
        return new Writer();
    }

    @Override
    public TimeSeriesReader<T> getReader(final String cohort, final ReadContext context) {
        if (!_cohortSet.contains(cohort)) {
            throw new IllegalArgumentException(String.format("Unknown cohort; series=%s, cohort=%s", _key, cohort));
        }
        return new PagedTimeSeriesReader<>(
                context,
                _storagePageKey,
                (page, bucket) -> page.getSection(_key, cohort).flatMap(section -> section.getValue(_numberKind, bucket)));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Key", _key)
                .add("Cohorts", _cohorts)
                .add("NumberKind", _numberKind)
                .add("StoragePageKey", _storagePageKey)
                .add("EventTypes", _eventTypes)
                .toString();
    }

    private CohortTimeSeries(final Builder<T> builder) {
        _key = SeriesKeys.checkSeriesKey(builder._key);
        _storagePageKey = PageId.normalizePageKey(builder._storagePageKey);
        if (builder._eventTypes.isEmpty()) {
            throw new IllegalArgumentException(String.format("Series must subscribe to an event type; key=%s", builder._key));
        }
        _eventTypes = builder._eventTypes;
        _numberKind = builder._numberKind;
        _parser = builder._parser;

        if (builder._cohorts.isEmpty()) {
            throw new IllegalArgumentException(String.format("Cohort series must have cohorts; key=%s", builder._key));
        }
        final Set<String> cohorts = new HashSet<>();
        for (final String cohort : builder._cohorts) {
            SeriesKeys.checkCohort(cohort);
            if (!cohorts.add(cohort)) {
                throw new IllegalArgumentException(String.format("Duplicate cohort; key=%s, cohort=%s", builder._key, cohort));
            }
        }
        _cohorts = builder._cohorts;
        _cohortSet = ImmutableSet.copyOf(cohorts);
    }

    private final String _key;
    private final String _storagePageKey;
    private final ImmutableSet<Class<? extends StatisticsEvent>> _eventTypes;
    private final NumberKind<T> _numberKind;
    private final ImmutableList<String> _cohorts;
    private final ImmutableSet<String> _cohortSet;
    private final Function<StatisticsEvent, Optional<CohortSample<T>>> _parser;

    private final class Writer extends AbstractSeriesWriter<T> {

        Writer() {
            super(CohortTimeSeries.this);
        }

        @Override
        public void write(final StatisticsEvent event, final int bucket) {
            final Optional<CohortSample<T>> sample = _parser.apply(event);
            if (!sample.isPresent() || !sample.get().getValue().isPresent()) {
                return;
            }
            final String cohort = sample.get().getCohort();
            if (cohort.isBlank()) {
                return;
            }
            if (!_cohortSet.contains(cohort)) {
                throw new IllegalStateException(String.format(
                        "Event mapped to an unknown cohort; series=%s, cohort=%s, event=%s",
                        _key,
                        cohort,
                        event));
            }
            final T value = sample.get().getValue().get();
            setValue(cohort, bucket, _numberKind.add(getValue(cohort, bucket).orElse(_numberKind.zero()), value));
        }
    }

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CohortTimeSeries}.
     *
     * @param <T> the numeric type stored by the series
     */
    public static final class Builder<T extends Number> extends OvalBuilder<CohortTimeSeries<T>> {

        /**
         * Public constructor.
         */
        public Builder() {
            super((Builder<T> builder) -> new CohortTimeSeries<>(builder));
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
         * Set the cohorts in display order. Required. Cannot be null or empty.
         *
         * @param value The cohorts.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setCohorts(final ImmutableList<String> value) {
            _cohorts = value;
            return this;
        }

        /**
         * Set the parser mapping an event to a cohort and a value. Required. Cannot be null.
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
        private ImmutableList<String> _cohorts;
        @NotNull
        private Function<StatisticsEvent, Optional<CohortSample<T>>> _parser;
    }
}
