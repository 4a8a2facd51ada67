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
package com.arpnetworking.statistics.clock;

import com.arpnetworking.statistics.test.ManualClock;
import org.junit.Assert;
import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Tests for the {@link EventClock}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class EventClockTest {

    @Test
    public void watermarkWithoutReservations() {
        Assert.assertEquals(START.minusMillis(1), _eventClock.getSafeWatermark());

        _clock.advance(Duration.ofSeconds(2));
        Assert.assertEquals(START.plusSeconds(2).minusMillis(1), _eventClock.getSafeWatermark());
    }

    @Test
    public void watermarkHeldByOldestReservation() {
        final Instant first = _eventClock.acquire();
        _clock.advance(Duration.ofSeconds(1));
        final Instant second = _eventClock.acquire();
        _clock.advance(Duration.ofSeconds(1));

        Assert.assertEquals(first.minusMillis(1), _eventClock.getSafeWatermark());
        Assert.assertEquals(2, _eventClock.getOutstandingReservations());

        _eventClock.release(first);
        Assert.assertEquals(second.minusMillis(1), _eventClock.getSafeWatermark());

        _eventClock.release(second);
        Assert.assertEquals(START.plusSeconds(2).minusMillis(1), _eventClock.getSafeWatermark());
        Assert.assertEquals(0, _eventClock.getOutstandingReservations());
    }

    @Test
    public void timestampsNeverDecrease() {
        _clock.advance(Duration.ofSeconds(5));
        final Instant first = _eventClock.acquire();
        _clock.setInstant(START);
        final Instant second = _eventClock.acquire();

        Assert.assertEquals(first, second);
        _eventClock.release(first);
        _eventClock.release(second);
        Assert.assertFalse(_eventClock.getSafeWatermark().isBefore(first.minusMillis(1)));
    }

    @Test
    public void duplicateTimestampsReleasedIndependently() {
        final Instant first = _eventClock.acquire();
        final Instant second = _eventClock.acquire();
        Assert.assertEquals(first, second);

        _eventClock.release(first);
        Assert.assertEquals(first.minusMillis(1), _eventClock.getSafeWatermark());
        _eventClock.release(second);
        Assert.assertEquals(0, _eventClock.getOutstandingReservations());
    }

    @Test
    public void staleReservationsPurged() {
        _eventClock.acquire();
        _clock.advance(Duration.ofSeconds(11));
        final Instant recent = _eventClock.acquire();

        Assert.assertEquals(recent.minusMillis(1), _eventClock.getSafeWatermark());
        Assert.assertEquals(1, _eventClock.getOutstandingReservations());
    }

    @Test
    public void watermarkBeforeEveryLaterTimestamp() {
        final Instant watermark = _eventClock.getSafeWatermark();
        Assert.assertTrue(_eventClock.acquire().isAfter(watermark));
    }

    @Test
    public void concurrentProducers() throws Exception {
        final EventClock eventClock = new EventClock(Clock.systemUTC(), Duration.ofMinutes(1), 1000);
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; ++i) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 1000; ++j) {
                        final Instant watermark = eventClock.getSafeWatermark();
                        final Instant timestamp = eventClock.acquire();
                        Assert.assertTrue(timestamp.isAfter(watermark));
                        eventClock.release(timestamp);
                    }
                }));
            }
            for (final Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(0, eventClock.getOutstandingReservations());
    }

    @Test
    public void watermarkBeforeEveryHeldReservation() throws Exception {
        final EventClock eventClock = new EventClock(Clock.systemUTC(), Duration.ofMinutes(1), 1000);
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; ++i) {
                final Random random = new Random(i);
                futures.add(executor.submit(() -> {
                    final List<Instant> held = new ArrayList<>();
                    for (int j = 0; j < 2000; ++j) {
                        if (held.isEmpty() || (held.size() < 16 && random.nextBoolean())) {
                            held.add(eventClock.acquire());
                        } else {
                            eventClock.release(held.remove(random.nextInt(held.size())));
                        }
                        final Instant watermark = eventClock.getSafeWatermark();
                        for (final Instant timestamp : held) {
                            Assert.assertTrue(
                                    String.format("watermark=%s, held=%s", watermark, timestamp),
                                    watermark.isBefore(timestamp));
                        }
                    }
                    for (final Instant timestamp : held) {
                        eventClock.release(timestamp);
                    }
                }));
            }
            for (final Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(0, eventClock.getOutstandingReservations());
    }

    private final ManualClock _clock = new ManualClock(START);
    private final EventClock _eventClock = new EventClock(_clock, Duration.ofSeconds(10), 100);

    private static final Instant START = Instant.parse("2020-01-01T00:00:00Z");
}
