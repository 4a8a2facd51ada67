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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import java.time.Instant;

/**
 * Maps wall clock time onto page and bucket addresses for a {@link Resolution}
 * starting at a fixed epoch. All arithmetic is integer arithmetic on
 * milliseconds since the epoch.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Timeline {

    /**
     * Public constructor.
     *
     * @param epoch the first instant addressable by the timeline
     * @param resolution the resolution of the timeline
     */
    public Timeline(final Instant epoch, final Resolution resolution) {
        this(epoch.toEpochMilli(), resolution);
    }

    @JsonIgnore
    public Instant getEpoch() {
        return Instant.ofEpochMilli(_epochMillis);
    }

    @JsonProperty("epochMillis")
    public long getEpochMillis() {
        return _epochMillis;
    }

    @JsonProperty("resolution")
    public Resolution getResolution() {
        return _resolution;
    }

    /**
     * Compute the bucket containing an instant.
     *
     * @param time the instant; may not be before the epoch
     * @return the {@link BucketIndex} containing {@code time}
     */
    public BucketIndex bucketIndexOf(final Instant time) {
        return bucketFromOrdinal(bucketOrdinal(time));
    }

    /**
     * Compute the page containing an instant.
     *
     * @param time the instant; may not be before the epoch
     * @return the {@link PageIndex} containing {@code time}
     */
    public PageIndex pageIndexOf(final Instant time) {
        return new PageIndex(this, millisSinceEpoch(time) / _resolution.getPageIntervalMillis());
    }

    /**
     * Create a page index on this timeline.
     *
     * @param index the numeric page index
     * @return a new {@link PageIndex}
     */
    public PageIndex pageIndex(final long index) {
        return new PageIndex(this, index);
    }

    /**
     * Create a bucket index on this timeline.
     *
     * @param pageIndex the numeric page index
     * @param bucket the bucket within the page
     * @return a new {@link BucketIndex}
     */
    public BucketIndex bucketIndex(final long pageIndex, final int bucket) {
        return new BucketIndex(new PageIndex(this, pageIndex), bucket);
    }

    /**
     * The start of a bucket (inclusive).
     *
     * @param bucketIndex the bucket
     * @return the instant the bucket starts at
     */
    public Instant bucketStartTime(final BucketIndex bucketIndex) {
        assertSameTimeline(bucketIndex.getPage());
        final long ordinal = bucketIndex.getPage().getIndex() * _resolution.getNumBucketsPerPage() + bucketIndex.getBucket();
        return Instant.ofEpochMilli(_epochMillis + ordinal * _resolution.getBucketIntervalMillis());
    }

    /**
     * The end of a bucket (exclusive).
     *
     * @param bucketIndex the bucket
     * @return the instant the bucket ends at
     */
    public Instant bucketEndTime(final BucketIndex bucketIndex) {
        return bucketStartTime(bucketIndex).plusMillis(_resolution.getBucketIntervalMillis());
    }

    /**
     * The start of a page (inclusive).
     *
     * @param pageIndex the page
     * @return the instant the page starts at
     */
    public Instant pageStartTime(final PageIndex pageIndex) {
        assertSameTimeline(pageIndex);
        return Instant.ofEpochMilli(_epochMillis + pageIndex.getIndex() * _resolution.getPageIntervalMillis());
    }

    /**
     * The end of a page (exclusive).
     *
     * @param pageIndex the page
     * @return the instant the page ends at
     */
    public Instant pageEndTime(final PageIndex pageIndex) {
        return pageStartTime(pageIndex).plusMillis(_resolution.getPageIntervalMillis());
    }

    /**
     * Enumerate the buckets covering {@code [start, end)} in increasing
     * order. The last bucket is the one containing {@code end - 1ms}.
     *
     * @param start the start of the range (inclusive); may not be before the epoch
     * @param end the end of the range (exclusive); may not be before {@code start}
     * @return the buckets covering the range
     */
    public ImmutableList<BucketIndex> bucketsForRange(final Instant start, final Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(String.format("End must not be before start; start=%s, end=%s", start, end));
        }
        final long first = bucketOrdinal(start);
        if (end.equals(start)) {
            return ImmutableList.of();
        }
        final long interval = _resolution.getBucketIntervalMillis();
        final long last = (millisSinceEpoch(end) + interval - 1) / interval;

        final ImmutableList.Builder<BucketIndex> buckets = ImmutableList.builder();
        for (long ordinal = first; ordinal < last; ++ordinal) {
            buckets.add(bucketFromOrdinal(ordinal));
        }
        return buckets.build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Timeline other = (Timeline) object;

        return _epochMillis == other._epochMillis
                && Objects.equal(_resolution, other._resolution);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_epochMillis, _resolution);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Epoch", getEpoch())
                .add("Resolution", _resolution)
                .toString();
    }

    @JsonCreator
    Timeline(
            @JsonProperty("epochMillis") final long epochMillis,
            @JsonProperty("resolution") final Resolution resolution) {
        if (resolution == null) {
            throw new IllegalArgumentException("Resolution must not be null");
        }
        _epochMillis = epochMillis;
        _resolution = resolution;
    }

    private long millisSinceEpoch(final Instant time) {
        final long millis = time.toEpochMilli() - _epochMillis;
        if (millis < 0) {
            throw new IllegalArgumentException(
                    String.format("Time is before the timeline epoch; time=%s, epoch=%s", time, getEpoch()));
        }
        return millis;
    }

    private long bucketOrdinal(final Instant time) {
        return millisSinceEpoch(time) / _resolution.getBucketIntervalMillis();
    }

    private BucketIndex bucketFromOrdinal(final long ordinal) {
        final int numBuckets = _resolution.getNumBucketsPerPage();
        return new BucketIndex(new PageIndex(this, ordinal / numBuckets), (int) (ordinal % numBuckets));
    }

    private void assertSameTimeline(final PageIndex pageIndex) {
        if (!equals(pageIndex.getTimeline())) {
            throw new IllegalArgumentException(
                    String.format("Index belongs to a different timeline; timeline=%s, index=%s", this, pageIndex));
        }
    }

    private final long _epochMillis;
    private final Resolution _resolution;
}
