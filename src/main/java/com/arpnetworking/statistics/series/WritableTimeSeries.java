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

import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.page.NumberKind;
import com.google.common.collect.ImmutableSet;

/**
 * A series with its own storage that accumulates events.
 *
 * @param <T> the numeric type stored by the series
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface WritableTimeSeries<T extends Number> extends TimeSeries {

    /**
     * The event classes this series consumes. Events are matched by exact class.
     *
     * @return the event classes
     */
    ImmutableSet<Class<? extends StatisticsEvent>> getEventTypes();

    /**
     * The key of the pages this series is stored in.
     *
     * @return the page key
     */
    String getStoragePageKey();

    NumberKind<T> getNumberKind();

    /**
     * Whether buckets without events have no value rather than zero.
     *
     * @return true if the sections of this series are nullable
     */
    boolean isNullable();

    /**
     * Create a writer accumulating events into this series.
     *
     * @return a new {@link SeriesWriter}
     */
    SeriesWriter createWriter();
}
