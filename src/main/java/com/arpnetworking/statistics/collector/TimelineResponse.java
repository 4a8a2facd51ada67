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

import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;

import java.util.Optional;

/**
 * Reply to a {@link TimelineRequest}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TimelineResponse {

    /**
     * Public constructor.
     *
     * @param timeline the timeline, if the resolution is collected
     */
    public TimelineResponse(final Optional<Timeline> timeline) {
        _timeline = timeline;
    }

    public Optional<Timeline> getTimeline() {
        return _timeline;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timeline", _timeline)
                .toString();
    }

    private final Optional<Timeline> _timeline;
}
