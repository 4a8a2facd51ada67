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
 * A new player account was created.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PlayerCreated extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the player was created
     * @param playerId the id of the player
     * @param bot whether the player is a bot
     */
    public PlayerCreated(final Instant timestamp, final String playerId, final boolean bot) {
        super(timestamp);
        _playerId = playerId;
        _bot = bot;
    }

    public String getPlayerId() {
        return _playerId;
    }

    public boolean isBot() {
        return _bot;
    }

    @Override
    public String getUniqueKey() {
        return "PlayerCreated/" + _playerId;
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("PlayerId", _playerId)
                .add("Bot", _bot);
    }

    private final String _playerId;
    private final boolean _bot;
}
