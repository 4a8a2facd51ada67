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
package com.arpnetworking.statistics.events;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.time.Instant;

/**
 * A player session ended.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PlayerSession extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the session ended
     * @param sessionId the id of the session
     * @param length the length of the session
     * @param platform the platform the session ran on
     * @param daysSinceRegistered whole days since the player was created
     */
    public PlayerSession(
            final Instant timestamp,
            final String sessionId,
            final Duration length,
            final String platform,
            final int daysSinceRegistered) {
        super(timestamp);
        if (length.isNegative()) {
            throw new IllegalArgumentException(String.format("Session length must not be negative; length=%s", length));
        }
        _sessionId = sessionId;
        _length = length;
        _platform = platform;
        _daysSinceRegistered = daysSinceRegistered;
    }

    public String getSessionId() {
        return _sessionId;
    }

    public Duration getLength() {
        return _length;
    }

    public String getPlatform() {
        return _platform;
    }

    public int getDaysSinceRegistered() {
        return _daysSinceRegistered;
    }

    @Override
    public String getUniqueKey() {
        return "PlayerSession/" + _sessionId;
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("Length", _length)
                .add("Platform", _platform)
                .add("DaysSinceRegistered", _daysSinceRegistered);
    }

    private final String _sessionId;
    private final Duration _length;
    private final String _platform;
    private final int _daysSinceRegistered;
}
