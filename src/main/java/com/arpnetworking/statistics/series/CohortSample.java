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

import com.google.common.base.MoreObjects;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A value parsed from an event for a cohort series.
 *
 * @param <T> the numeric type of the value
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CohortSample<T extends Number> {

    /**
     * Create a sample.
     *
     * @param cohort the cohort label
     * @param value the value, or null if the event carries none
     * @param <T> the numeric type of the value
     * @return a new {@link CohortSample}
     */
    public static <T extends Number> CohortSample<T> of(final String cohort, @Nullable final T value) {
        return new CohortSample<>(cohort, value);
    }

    /**
     * Create a sample for a daily cohort.
     *
     * @param days the number of days since the reference event
     * @param value the value, or null if the event carries none
     * @param <T> the numeric type of the value
     * @return a new {@link CohortSample}
     */
    public static <T extends Number> CohortSample<T> ofDay(final int days, @Nullable final T value) {
        return new CohortSample<>(Integer.toString(days), value);
    }

    public String getCohort() {
        return _cohort;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(_value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Cohort", _cohort)
                .add("Value", _value)
                .toString();
    }

    private CohortSample(final String cohort, @Nullable final T value) {
        _cohort = cohort;
        _value = value;
    }

    private final String _cohort;
    @Nullable
    private final T _value;
}
