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
package com.arpnetworking.statistics.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Representation of the statistics engine configuration.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@JsonDeserialize(builder = StatisticsConfiguration.Builder.class)
public final class StatisticsConfiguration {
    /**
     * Create an {@link ObjectMapper} for statistics engine configuration.
     *
     * @return An {@link ObjectMapper} for statistics engine configuration.
     */
    public static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = ObjectMapperFactory.createInstance();
        objectMapper.registerModule(new JavaTimeModule());
        return objectMapper;
    }

    public Instant getEpoch() {
        return _epoch;
    }

    public long getCacheMaximumWeight() {
        return _cacheMaximumWeight;
    }

    public boolean isCacheNonFinalPages() {
        return _cacheNonFinalPages;
    }

    public Duration getFlushInterval() {
        return _flushInterval;
    }

    public Duration getClockStaleReservationThreshold() {
        return _clockStaleReservationThreshold;
    }

    public int getClockReservationWarningThreshold() {
        return _clockReservationWarningThreshold;
    }

    public Duration getAskTimeout() {
        return _askTimeout;
    }

    public Optional<DatabaseConfiguration> getDatabaseConfiguration() {
        return _databaseConfiguration;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Epoch", _epoch)
                .add("CacheMaximumWeight", _cacheMaximumWeight)
                .add("CacheNonFinalPages", _cacheNonFinalPages)
                .add("FlushInterval", _flushInterval)
                .add("ClockStaleReservationThreshold", _clockStaleReservationThreshold)
                .add("ClockReservationWarningThreshold", _clockReservationWarningThreshold)
                .add("AskTimeout", _askTimeout)
                .add("DatabaseConfiguration", _databaseConfiguration)
                .toString();
    }

    private StatisticsConfiguration(final Builder builder) {
        _epoch = builder._epoch;
        _cacheMaximumWeight = builder._cacheMaximumWeight;
        _cacheNonFinalPages = builder._cacheNonFinalPages;
        _flushInterval = builder._flushInterval;
        _clockStaleReservationThreshold = builder._clockStaleReservationThreshold;
        _clockReservationWarningThreshold = builder._clockReservationWarningThreshold;
        _askTimeout = builder._askTimeout;
        _databaseConfiguration = Optional.ofNullable(builder._databaseConfiguration);
    }

    private final Instant _epoch;
    private final long _cacheMaximumWeight;
    private final boolean _cacheNonFinalPages;
    private final Duration _flushInterval;
    private final Duration _clockStaleReservationThreshold;
    private final int _clockReservationWarningThreshold;
    private final Duration _askTimeout;
    private final Optional<DatabaseConfiguration> _databaseConfiguration;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link StatisticsConfiguration}.
     *
     * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<StatisticsConfiguration> {
        /**
         * Public constructor.
         */
        public Builder() {
            super(StatisticsConfiguration::new);
        }

        /**
         * The epoch of every timeline. Optional. Cannot be null. Default is
         * 2000-01-01T00:00:00Z.
         *
         * @param value The epoch.
         * @return This instance of {@link Builder}.
         */
        public Builder setEpoch(final Instant value) {
            _epoch = value;
            return this;
        }

        /**
         * The maximum total weight in bytes of the page cache. Optional.
         * Cannot be null. Default is 64 MiB.
         *
         * @param value The maximum cache weight.
         * @return This instance of {@link Builder}.
         */
        public Builder setCacheMaximumWeight(final Long value) {
            _cacheMaximumWeight = value;
            return this;
        }

        /**
         * Whether pages that are still being written are cached for a few
         * seconds. Optional. Cannot be null. Default is false.
         *
         * @param value Whether to cache non-final pages.
         * @return This instance of {@link Builder}.
         */
        public Builder setCacheNonFinalPages(final Boolean value) {
            _cacheNonFinalPages = value;
            return this;
        }

        /**
         * The time between flushes of the collector. Optional. Cannot be
         * null. Default is five seconds.
         *
         * @param value The flush interval.
         * @return This instance of {@link Builder}.
         */
        public Builder setFlushInterval(final Duration value) {
            _flushInterval = value;
            return this;
        }

        /**
         * The age after which an unreleased event clock reservation is
         * purged. Optional. Cannot be null. Default is ten seconds.
         *
         * @param value The stale reservation threshold.
         * @return This instance of {@link Builder}.
         */
        public Builder setClockStaleReservationThreshold(final Duration value) {
            _clockStaleReservationThreshold = value;
            return this;
        }

        /**
         * The number of outstanding event clock reservations that triggers a
         * warning. Optional. Cannot be null. Default is 100.
         *
         * @param value The reservation warning threshold.
         * @return This instance of {@link Builder}.
         */
        public Builder setClockReservationWarningThreshold(final Integer value) {
            _clockReservationWarningThreshold = value;
            return this;
        }

        /**
         * The timeout of page reads from the collector. Optional. Cannot be
         * null. Default is five seconds.
         *
         * @param value The ask timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setAskTimeout(final Duration value) {
            _askTimeout = value;
            return this;
        }

        /**
         * The database persisting final pages. Optional. Pages are kept in
         * memory if not set.
         *
         * @param value The database configuration.
         * @return This instance of {@link Builder}.
         */
        public Builder setDatabaseConfiguration(@Nullable final DatabaseConfiguration value) {
            _databaseConfiguration = value;
            return this;
        }

        @NotNull
        private Instant _epoch = Instant.parse("2000-01-01T00:00:00Z");
        @NotNull
        @Min(1)
        private Long _cacheMaximumWeight = 64L * 1024 * 1024;
        @NotNull
        private Boolean _cacheNonFinalPages = false;
        @NotNull
        private Duration _flushInterval = Duration.ofSeconds(5);
        @NotNull
        private Duration _clockStaleReservationThreshold = Duration.ofSeconds(10);
        @NotNull
        @Min(1)
        private Integer _clockReservationWarningThreshold = 100;
        @NotNull
        private Duration _askTimeout = Duration.ofSeconds(5);
        @Nullable
        private DatabaseConfiguration _databaseConfiguration;
    }
}
