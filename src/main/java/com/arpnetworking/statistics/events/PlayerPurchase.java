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
 * A player made an in-app purchase.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PlayerPurchase extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the purchase completed
     * @param purchaseId the id of the purchase
     * @param dollarValue the value of the purchase in dollars; must be finite and not negative
     * @param daysSinceRegistered whole days since the player was created
     */
    public PlayerPurchase(final Instant timestamp, final String purchaseId, final double dollarValue, final int daysSinceRegistered) {
        super(timestamp);
        if (!Double.isFinite(dollarValue) || dollarValue < 0) {
            throw new IllegalArgumentException(
                    String.format("Purchase value must be a finite non-negative number; dollarValue=%s", dollarValue));
        }
        if (daysSinceRegistered < 0) {
            throw new IllegalArgumentException(
                    String.format("Days since registered must not be negative; daysSinceRegistered=%d", daysSinceRegistered));
        }
        _purchaseId = purchaseId;
        _dollarValue = dollarValue;
        _daysSinceRegistered = daysSinceRegistered;
    }

    public String getPurchaseId() {
        return _purchaseId;
    }

    public double getDollarValue() {
        return _dollarValue;
    }

    public int getDaysSinceRegistered() {
        return _daysSinceRegistered;
    }

    @Override
    public String getUniqueKey() {
        return "PlayerPurchase/" + _purchaseId;
    }

    @Override
    protected MoreObjects.ToStringHelper toStringHelper() {
        return super.toStringHelper()
                .add("DollarValue", _dollarValue)
                .add("DaysSinceRegistered", _daysSinceRegistered);
    }

    private final String _purchaseId;
    private final double _dollarValue;
    private final int _daysSinceRegistered;
}
