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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.collect.BoundType;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Hands out non-decreasing event timestamps to concurrent producers and
 * computes a watermark that is strictly before every timestamp handed out but
 * not yet released. Everything at or before the watermark is safe to flush.
 *
 * Reservations that are not released within the stale threshold are assumed
 * abandoned and purged when the watermark is computed.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class EventClock {

    /**
     * Public constructor.
     *
     * @param clock the source of the current time
     * @param staleReservationThreshold age after which a reservation is purged
     * @param reservationWarningThreshold number of outstanding reservations that triggers a warning
     */
    public EventClock(final Clock clock, final Duration staleReservationThreshold, final int reservationWarningThreshold) {
        _clock = clock;
        _staleReservationThreshold = staleReservationThreshold;
        _reservationWarningThreshold = reservationWarningThreshold;
        _lastIssued = clock.instant();
    }

    /**
     * Reserve a timestamp for an event. The timestamp is never before a
     * previously issued timestamp or watermark.
     *
     * @return the reserved timestamp
     */
    public Instant acquire() {
        synchronized (_lock) {
            final Instant now = _clock.instant();
            if (now.isAfter(_lastIssued)) {
                _lastIssued = now;
            }
            _reservations.add(_lastIssued);
            return _lastIssued;
        }
    }

    /**
     * Release a reservation.
     *
     * @param timestamp the timestamp returned by {@link #acquire()}
     */
    public void release(final Instant timestamp) {
        synchronized (_lock) {
            _reservations.remove(timestamp);
        }
    }

    /**
     * Compute the watermark. The watermark is strictly before every
     * outstanding reservation and every timestamp issued later.
     *
     * @return the watermark
     */
    public Instant getSafeWatermark() {
        final Instant watermark;
        final int outstanding;
        final int purged;
        @Nullable Instant oldestPurged = null;
        synchronized (_lock) {
            final Instant now = _clock.instant();
            outstanding = _reservations.size();
            final Multiset<Instant> stale = _reservations.headMultiset(now.minus(_staleReservationThreshold), BoundType.OPEN);
            purged = stale.size();
            if (purged > 0) {
                oldestPurged = _reservations.firstEntry().getElement();
                stale.clear();
            }

            if (_reservations.isEmpty()) {
                if (now.isAfter(_lastIssued)) {
                    _lastIssued = now;
                }
                watermark = _lastIssued.minusMillis(1);
            } else {
                watermark = _reservations.firstEntry().getElement().minusMillis(1);
            }
        }

        if (outstanding >= _reservationWarningThreshold) {
            LOGGER.warn()
                    .setMessage("Too many outstanding event clock reservations")
                    .addData("outstanding", outstanding)
                    .addData("threshold", _reservationWarningThreshold)
                    .log();
        }
        if (purged > 0) {
            LOGGER.warn()
                    .setMessage("Purged stale event clock reservations")
                    .addData("purged", purged)
                    .addData("oldest", oldestPurged)
                    .addData("staleThreshold", _staleReservationThreshold)
                    .log();
        }
        return watermark;
    }

    /**
     * The number of reservations not yet released.
     *
     * @return the number of outstanding reservations
     */
    public int getOutstandingReservations() {
        synchronized (_lock) {
            return _reservations.size();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("StaleReservationThreshold", _staleReservationThreshold)
                .add("ReservationWarningThreshold", _reservationWarningThreshold)
                .toString();
    }

    private final Clock _clock;
    private final Duration _staleReservationThreshold;
    private final int _reservationWarningThreshold;
    private final Object _lock = new Object();
    private final TreeMultiset<Instant> _reservations = TreeMultiset.create();
    private Instant _lastIssued;

    private static final Logger LOGGER = LoggerFactory.getLogger(EventClock.class);
}
