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

/**
 * A series read as a single value per bucket.
 *
 * @param <T> the type of the values read
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface SimpleReadableTimeSeries<T> extends TimeSeries {

    /**
     * Create a reader of this series.
     *
     * @param context where and when to read
     * @return a new reader
     */
    TimeSeriesReader<T> getReader(ReadContext context);
}
