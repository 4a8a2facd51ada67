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

import java.time.Instant;

/**
 * A player logged in.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PlayerLogin extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the player logged in
     * @param playerId the id of the player
     * @param daysSinceRegistered whole days since the player was created
     * @param bot whether the player is a bot
     */
    public PlayerLogin(final Instant timestamp, final String playerId, final int daysSinceRegistered, final boolean bot) {
        super(timestamp);
        if (daysSinceRegistered < 0) {
            throw new IllegalArgumentException(
                    String.format("Days since registered must not be negative; daysSinceRegistered=%d", daysSinceRegistered));
        }
        _playerId = playerId;
        _daysSinceRegistered = daysSinceRegistered;
        _bot = bot;
    }

    public String getPlayerId() {
        return _playerId;
    }

    public int getDaysSinceRegistered() {
        return _daysSinceRegistered;
    }

    public boolean isBot() {
        return _bot;
    }

    @Override
    public String getUniqueKey() {
        return "PlayerLogin/" + _playerId + "/" + getTimestamp().toEpochMilli();
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("PlayerId", _playerId)
                .add("DaysSinceRegistered", _daysSinceRegistered)
                .add("Bot", _bot);
    }

    private final String _playerId;
    private final int _daysSinceRegistered;
    private final boolean _bot;
}
