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
import com.google.common.base.MoreObjects;
import org.apache.pekko.actor.ActorRef;

import java.time.Instant;
import java.util.function.Function;

/**
 * Publishes events to the {@link StatisticsCollector}. Every event is
 * timestamped with a reservation from the {@link EventClock} which the
 * collector releases once the event is queued, so the collector never
 * flushes past an event still in flight.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class StatisticsEventPublisher {

    /**
     * Public constructor.
     *
     * @param eventClock the clock events are timestamped with
     * @param collector the collector actor
     */
    public StatisticsEventPublisher(final EventClock eventClock, final ActorRef collector) {
        _eventClock = eventClock;
        _collector = collector;
    }

    /**
     * Create an event at the next timestamp and publish it.
     *
     * @param factory creates the event for a timestamp; the event must carry that timestamp
     * @param <E> the type of the event
     * @return the published event
     */
    public <E extends StatisticsEvent> E publish(final Function<Instant, E> factory) {
        final Instant timestamp = _eventClock.acquire();
        final E event;
        try {
            event = factory.apply(timestamp);
        } catch (final RuntimeException e) {
            _eventClock.release(timestamp);
            throw e;
        }
        if (!timestamp.equals(event.getTimestamp())) {
            _eventClock.release(timestamp);
            throw new IllegalArgumentException(
                    String.format("Event must carry the reserved timestamp; reserved=%s, event=%s", timestamp, event));
        }
        _collector.tell(event, ActorRef.noSender());
        return event;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("EventClock", _eventClock)
                .add("Collector", _collector)
                .toString();
    }

    private final EventClock _eventClock;
    private final ActorRef _collector;
}
