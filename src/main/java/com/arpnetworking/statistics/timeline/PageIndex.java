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
package com.arpnetworking.statistics.timeline;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.Instant;

/**
 * Index of a page on a specific {@link Timeline}. Indices from different
 * timelines are never equal and cannot be compared.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageIndex implements Comparable<PageIndex> {

    public Timeline getTimeline() {
        return _timeline;
    }

    public long getIndex() {
        return _index;
    }

    public Instant getStartTime() {
        return _timeline.pageStartTime(this);
    }

    public Instant getEndTime() {
        return _timeline.pageEndTime(this);
    }

    @Override
    public int compareTo(final PageIndex other) {
        if (!_timeline.equals(other._timeline)) {
            throw new IllegalArgumentException(
                    String.format("Cannot compare page indices of different timelines; this=%s, other=%s", this, other));
        }
        return Long.compare(_index, other._index);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final PageIndex other = (PageIndex) object;

        return _index == other._index
                && Objects.equal(_timeline, other._timeline);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timeline, _index);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Index", _index)
                .add("Resolution", _timeline.getResolution().getName())
                .toString();
    }

    PageIndex(final Timeline timeline, final long index) {
        if (index < 0) {
            throw new IllegalArgumentException(String.format("Page index must not be negative; index=%d", index));
        }
        _timeline = timeline;
        _index = index;
    }

    private final Timeline _timeline;
    private final long _index;
}
