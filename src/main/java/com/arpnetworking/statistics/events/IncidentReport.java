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
 * A client submitted an incident report.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class IncidentReport extends StatisticsEvent {

    /**
     * Public constructor.
     *
     * @param timestamp when the report was received
     * @param incidentId the id of the incident
     */
    public IncidentReport(final Instant timestamp, final String incidentId) {
        super(timestamp);
        _incidentId = incidentId;
    }

    public String getIncidentId() {
        return _incidentId;
    }

    @Override
    public String getUniqueKey() {
        return "IncidentReport/" + _incidentId;
    }

    private final String _incidentId;
}
