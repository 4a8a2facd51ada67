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
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.statistics.timeline.PageIndex;

/**
 * Accumulates events of one series into the current page of a write buffer.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface SeriesWriter {

    /**
     * The series written.
     *
     * @return the series
     */
    WritableTimeSeries<?> getSeries();

    /**
     * Point the writer at a page. Called whenever the current page of the
     * buffer changes and before any event is written.
     *
     * @param buffer the write buffer
     * @param pageIndex the current page
     */
    void resetPage(PageWriteBuffer buffer, PageIndex pageIndex);

    /**
     * Accumulate an event into a bucket of the current page.
     *
     * @param event the event
     * @param bucket the bucket within the current page
     */
    void write(StatisticsEvent event, int bucket);
}
