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
package com.arpnetworking.statistics.collector;

import com.arpnetworking.statistics.clock.EventClock;
import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.registry.TimeSeriesRegistry;
import com.arpnetworking.statistics.series.WritableTimeSeries;
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.statistics.storage.WritablePageStorage;
import com.arpnetworking.statistics.timeline.Resolution;
import com.arpnetworking.statistics.timeline.Timeline;
import com.arpnetworking.statistics.writer.TimeSeriesPageWriter;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableMap;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.pekko.actor.AbstractActorWithTimers;
import org.apache.pekko.actor.Props;
import org.apache.pekko.pattern.Patterns;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;

/**
 * Owns the write side of the engine: a write buffer and a page writer for
 * every resolution, all on the same epoch.
 *
 * Events are queued as they arrive and their clock reservations released. On
 * every flush the events at or before the safe watermark of the event clock
 * are written in timestamp order to every resolution, every buffer is
 * advanced to the watermark and the final pages are persisted.
 *
 * Accepts the following messages:
 *     StatisticsEvent: Queues the event
 *     PageReadRequest: Replies with a {@link PageReadResponse} holding the buffered page, if any
 *     TimelineRequest: Replies with a {@link TimelineResponse}
 *     Flush: Writes the safe events and persists final pages
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class StatisticsCollector extends AbstractActorWithTimers {

    /**
     * Creates a {@link Props} for use in Pekko.
     *
     * @param eventClock the clock events are timestamped with
     * @param registry the series to write
     * @param durableStorage where final pages are persisted
     * @param epoch the epoch of every timeline
     * @param flushInterval time between flushes
     * @return A new {@link Props}.
     */
    public static Props props(
            final EventClock eventClock,
            final TimeSeriesRegistry registry,
            final WritablePageStorage durableStorage,
            final Instant epoch,
            final Duration flushInterval) {
        return Props.create(StatisticsCollector.class, eventClock, registry, durableStorage, epoch, flushInterval);
    }

    /**
     * Public constructor.
     *
     * @param eventClock the clock events are timestamped with
     * @param registry the series to write
     * @param durableStorage where final pages are persisted
     * @param epoch the epoch of every timeline
     * @param flushInterval time between flushes
     */
    @SuppressFBWarnings(value = "MC_OVERRIDABLE_METHOD_CALL_IN_CONSTRUCTOR", justification = "timers are safe to be used in constructors")
    public StatisticsCollector(
            final EventClock eventClock,
            final TimeSeriesRegistry registry,
            final WritablePageStorage durableStorage,
            final Instant epoch,
            final Duration flushInterval) {
        _eventClock = eventClock;
        final ImmutableMap.Builder<String, TimeSeriesPageWriter> writers = ImmutableMap.builder();
        for (final Resolution resolution : registry.getResolutions()) {
            final TimeSeriesPageWriter writer = new TimeSeriesPageWriter(
                    new PageWriteBuffer(new Timeline(epoch, resolution), durableStorage));
            for (final WritableTimeSeries<?> series : registry.getWritableSeries(resolution)) {
                writer.register(series);
            }
            writers.put(resolution.getName(), writer);
        }
        _writers = writers.build();

        timers().startTimerWithFixedDelay(FLUSH_TIMER_KEY, Flush.getInstance(), flushInterval);
    }

    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(StatisticsEvent.class, event -> {
                    _pendingEvents.add(event);
                    _eventClock.release(event.getTimestamp());
                })
                .match(Flush.class, message -> flush())
                .match(FlushComplete.class, this::flushComplete)
                .match(PageReadRequest.class, request -> {
                    for (final TimeSeriesPageWriter writer : _writers.values()) {
                        final PageWriteBuffer buffer = writer.getBuffer();
                        if (buffer.exists(request.getPageId())) {
                            getSender().tell(
                                    new PageReadResponse(buffer.tryGet(request.getPageId()).toCompletableFuture().join()),
                                    getSelf());
                            return;
                        }
                    }
                    LOGGER.debug()
                            .setMessage("Requested page is not buffered")
                            .addData("pageId", request.getPageId())
                            .addContext("actor", self())
                            .log();
                    getSender().tell(new PageReadResponse(Optional.empty()), getSelf());
                })
                .match(TimelineRequest.class, request -> {
                    final Optional<Timeline> timeline = Optional.ofNullable(_writers.get(request.getResolutionName()))
                            .map(writer -> writer.getBuffer().getTimeline());
                    getSender().tell(new TimelineResponse(timeline), getSelf());
                })
                .build();
    }

    @Override
    public void preRestart(final Throwable reason, final Optional<Object> message) throws Exception {
        LOGGER.error()
                .setMessage("Statistics collector crashing")
                .setThrowable(reason)
                .addData("triggeringMessage", message.orElse(null))
                .addContext("actor", self())
                .log();
        super.preRestart(reason, message);
    }

    private void flush() {
        if (_flushInProgress) {
            LOGGER.debug()
                    .setMessage("Skipping flush, previous flush still in progress")
                    .addContext("actor", self())
                    .log();
            return;
        }

        final Instant watermark = _eventClock.getSafeWatermark();
        while (!_pendingEvents.isEmpty() && !_pendingEvents.peek().getTimestamp().isAfter(watermark)) {
            final StatisticsEvent event = _pendingEvents.poll();
            for (final TimeSeriesPageWriter writer : _writers.values()) {
                try {
                    writer.write(event);
                } catch (final IllegalStateException e) {
                    LOGGER.error()
                            .setMessage("Event rejected by series configuration")
                            .addData("event", event)
                            .addData("timeline", writer.getBuffer().getTimeline())
                            .setThrowable(e)
                            .addContext("actor", self())
                            .log();
                }
            }
        }
        for (final TimeSeriesPageWriter writer : _writers.values()) {
            writer.advanceTime(watermark);
        }

        _flushInProgress = true;
        final CompletableFuture<?>[] flushes = _writers.values()
                .stream()
                .map(writer -> writer.getBuffer().flush().toCompletableFuture())
                .toArray(CompletableFuture<?>[]::new);
        final CompletableFuture<FlushComplete> completion = CompletableFuture.allOf(flushes)
                .handle((ignored, failure) -> new FlushComplete(failure));
        Patterns.pipe(completion, context().dispatcher()).to(self());
    }

    private void flushComplete(final FlushComplete message) {
        _flushInProgress = false;
        if (message._failure != null) {
            LOGGER.error()
                    .setMessage("Failed to persist final pages")
                    .setThrowable(message._failure)
                    .addContext("actor", self())
                    .log();
        }
    }

    private final EventClock _eventClock;
    private final ImmutableMap<String, TimeSeriesPageWriter> _writers;
    private final PriorityQueue<StatisticsEvent> _pendingEvents =
            new PriorityQueue<>(Comparator.comparing(StatisticsEvent::getTimestamp));
    private boolean _flushInProgress = false;

    private static final String FLUSH_TIMER_KEY = "flush";
    private static final Logger LOGGER = LoggerFactory.getLogger(StatisticsCollector.class);

    /**
     * Message to write the safe events and persist final pages.
     */
    public static final class Flush implements Serializable {
        /**
         * Gets the singleton instance.
         *
         * @return singleton instance
         */
        public static Flush getInstance() {
            return INSTANCE;
        }

        private Flush() { }

        private static final Flush INSTANCE = new Flush();
        private static final long serialVersionUID = 1L;
    }

    private static final class FlushComplete {
        FlushComplete(@Nullable final Throwable failure) {
            _failure = failure;
        }

        @Nullable
        private final Throwable _failure;
    }
}
