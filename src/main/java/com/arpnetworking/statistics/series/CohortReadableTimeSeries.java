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

import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.reader.TimeSeriesReader;
import com.google.common.collect.ImmutableList;

/**
 * A series read as one value per bucket for each of a fixed set of cohorts.
 *
 * @param <T> the type of the values read
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface CohortReadableTimeSeries<T> extends TimeSeries {

    /**
     * The cohorts of the series in display order.
     *
     * @return the cohort labels
     */
    ImmutableList<String> getCohorts();

    /**
     * Create a reader of one cohort of this series.
     *
     * @param cohort the cohort to read; must be one of {@link #getCohorts()}
     * @param context where and when to read
     * @return a new reader
     */
    TimeSeriesReader<T> getReader(String cohort, ReadContext context);
}
