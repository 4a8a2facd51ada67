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
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.reader.PagedTimeSeriesReader;
import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A series holding one value per bucket accumulated from matching events
 * according to an {@link AccumulationMode}.
 *
 * An average is stored as a running sum in the section of the series and a
 * running count in a reserved cohort; it is computed when read.
 *
 * @param <T> the numeric type stored by the series
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SimpleTimeSeries<T extends Number> implements WritableTimeSeries<T>, SimpleReadableTimeSeries<T> {

    /**
     * The reserved cohort holding the event count of an average series.
     */
    public static final String AVG_COUNT_COHORT = SeriesKeys.RESERVED_COHORT_PREFIX + "count";

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
        return _mode.isNullable();
    }

    public AccumulationMode getMode() {
        return _mode;
    }

    @Override
    public SeriesWriter createWriter() {
        return new Writer();
    }

    @Override
    public TimeSeriesReader<T> getReader(final ReadContext context) {
        return new PagedTimeSeriesReader<>(context, _storagePageKey, this::readBucket);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Key", _key)
                .add("Mode", _mode)
                .add("NumberKind", _numberKind)
                .add("StoragePageKey", _storagePageKey)
                .add("EventTypes", _eventTypes)
                .toString();
    }

    private Optional<T> readBucket(final StoragePage page, final int bucket) {
        final Optional<T> value = page.getSection(_key, null).flatMap(section -> section.getValue(_numberKind, bucket));
        if (_mode != AccumulationMode.AVG) {
            return value;
        }
        final Optional<Long> count = page.getSection(_key, AVG_COUNT_COHORT)
                .flatMap(section -> section.getValue(NumberKind.LONG, bucket));
        if (value.isPresent() && count.isPresent() && count.get() > 0) {
            return Optional.of(_numberKind.divide(value.get(), count.get()));
        }
        return Optional.empty();
    }

    private SimpleTimeSeries(final Builder<T> builder) {
        _key = SeriesKeys.checkSeriesKey(builder._key);
        _storagePageKey = PageId.normalizePageKey(builder._storagePageKey);
        if (builder._eventTypes.isEmpty()) {
            throw new IllegalArgumentException(String.format("Series must subscribe to an event type; key=%s", builder._key));
        }
        _eventTypes = builder._eventTypes;
        _numberKind = builder._numberKind;
        _mode = builder._mode;
        _parser = builder._parser;
    }

    private final String _key;
    private final String _storagePageKey;
    private final ImmutableSet<Class<? extends StatisticsEvent>> _eventTypes;
    private final NumberKind<T> _numberKind;
    private final AccumulationMode _mode;
    @Nullable
    private final Function<StatisticsEvent, Optional<T>> _parser;

    private final class Writer extends AbstractSeriesWriter<T> {

        Writer() {
            super(SimpleTimeSeries.this);
        }

        @Override
        public void write(final StatisticsEvent event, final int bucket) {
            if (_mode == AccumulationMode.COUNT) {
                setValue(null, bucket, _numberKind.add(getValue(null, bucket).orElse(_numberKind.zero()), _numberKind.one()));
                return;
            }

            final Optional<T> parsed = _parser.apply(event);
            if (!parsed.isPresent()) {
                return;
            }
            final T value = parsed.get();
            final Optional<T> existing = getValue(null, bucket);
            switch (_mode) {
                case SUM:
                    setValue(null, bucket, _numberKind.add(existing.orElse(_numberKind.zero()), value));
                    break;
                case AVG:
                    setValue(null, bucket, _numberKind.add(existing.orElse(_numberKind.zero()), value));
                    final long count = getValue(NumberKind.LONG, AVG_COUNT_COHORT, bucket).orElse(0L);
                    setValue(NumberKind.LONG, false, AVG_COUNT_COHORT, bucket, count + 1);
                    break;
                case MIN:
                    setValue(null, bucket, existing.map(current -> _numberKind.min(current, value)).orElse(value));
                    break;
                case MAX:
                    setValue(null, bucket, existing.map(current -> _numberKind.max(current, value)).orElse(value));
                    break;
                default:
                    throw new IllegalStateException(String.format("Unsupported accumulation mode; mode=%s", _mode));
            }
        }
    }

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SimpleTimeSeries}.
     *
     * @param <T> the numeric type stored by the series
     */
    public static final class Builder<T extends Number> extends OvalBuilder<SimpleTimeSeries<T>> {

        /**
         * Public constructor.
         */
        public Builder() {
            super((Builder<T> builder) -> new SimpleTimeSeries<>(builder));
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
         * Set the accumulation mode. Required. Cannot be null.
         *
         * @param value The accumulation mode.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setMode(final AccumulationMode value) {
            _mode = value;
            return this;
        }

        /**
         * Set the parser extracting a value from an event. Required unless
         * the mode is {@link AccumulationMode#COUNT}.
         *
         * @param value The parser.
         * @return This {@link Builder} instance.
         */
        public Builder<T> setParser(@Nullable final Function<StatisticsEvent, Optional<T>> value) {
            _parser = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateMode(final AccumulationMode mode) {
            return mode == AccumulationMode.COUNT || _parser != null;
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
        @ValidateWithMethod(methodName = "validateMode", parameterType = AccumulationMode.class)
        private AccumulationMode _mode;
        @Nullable
        private Function<StatisticsEvent, Optional<T>> _parser;
    }
}
