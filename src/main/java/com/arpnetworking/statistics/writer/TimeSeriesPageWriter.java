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
package com.arpnetworking.statistics.writer;

import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.series.SeriesKeys;
import com.arpnetworking.statistics.series.SeriesWriter;
import com.arpnetworking.statistics.series.WritableTimeSeries;
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dispatches events in time order to the writers of the series registered
 * for one timeline. Events are matched to series by their exact class.
 *
 * Events must arrive in non-decreasing time order; an event before the
 * watermark of the buffer is dropped. Not thread safe.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TimeSeriesPageWriter {

    /**
     * Public constructor.
     *
     * @param buffer the buffer holding the pages written
     */
    public TimeSeriesPageWriter(final PageWriteBuffer buffer) {
        _buffer = buffer;
    }

    /**
     * Register a series to be written.
     *
     * @param series the series
     */
    public void register(final WritableTimeSeries<?> series) {
        SeriesKeys.checkSeriesKey(series.getKey());
        if (!_keys.add(series.getKey())) {
            throw new IllegalArgumentException(String.format("Series already registered; key=%s", series.getKey()));
        }
        final SeriesWriter writer = series.createWriter();
        writer.resetPage(_buffer, _buffer.getCurrentPage());
        _writers.add(writer);
        for (final Class<? extends StatisticsEvent> eventType : series.getEventTypes()) {
            _writersByEventType.put(eventType, writer);
        }
    }

    /**
     * Write an event to every series registered for its class.
     *
     * @param event the event
     * @return true if the event was written, false if no series consumes it
     * or it arrived after its bucket was closed
     */
    public boolean write(final StatisticsEvent event) {
        final List<SeriesWriter> writers = _writersByEventType.get(event.getClass());
        if (writers.isEmpty()) {
            return false;
        }

        final Instant timestamp = event.getTimestamp();
        if (timestamp.isBefore(_buffer.getWatermark())) {
            LOGGER.warn()
                    .setMessage("Dropping late event")
                    .addData("event", event)
                    .addData("watermark", _buffer.getWatermark())
                    .addData("timeline", _buffer.getTimeline())
                    .log();
            return false;
        }

        moveToBucketOf(timestamp);
        final int bucket = _buffer.getCurrentBucket().getBucket();
        for (final SeriesWriter writer : writers) {
            writer.write(event, bucket);
        }
        _buffer.advanceWatermark(timestamp);
        return true;
    }

    /**
     * Advance the buffer to a time without writing. Moving past the end of
     * the current page finalizes it even when no events arrive.
     *
     * @param time the time; no event before it will be written afterwards
     */
    public void advanceTime(final Instant time) {
        if (time.isBefore(_buffer.getWatermark())) {
            return;
        }
        moveToBucketOf(time);
        _buffer.advanceWatermark(time);
    }

    public PageWriteBuffer getBuffer() {
        return _buffer;
    }

    public ImmutableList<WritableTimeSeries<?>> getSeries() {
        final List<WritableTimeSeries<?>> series = new ArrayList<>();
        for (final SeriesWriter writer : _writers) {
            series.add(writer.getSeries());
        }
        return ImmutableList.copyOf(series);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Buffer", _buffer)
                .add("Series", _keys)
                .toString();
    }

    private void moveToBucketOf(final Instant time) {
        if (!time.isBefore(_buffer.getCurrentBucket().getEndTime())) {
            if (_buffer.advanceBuckets(time)) {
                for (final SeriesWriter writer : _writers) {
                    writer.resetPage(_buffer, _buffer.getCurrentPage());
                }
            }
        }
    }

    private final PageWriteBuffer _buffer;
    private final List<SeriesWriter> _writers = new ArrayList<>();
    private final ListMultimap<Class<? extends StatisticsEvent>, SeriesWriter> _writersByEventType = ArrayListMultimap.create();
    private final Set<String> _keys = new HashSet<>();

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeSeriesPageWriter.class);
}
