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
 * Index of a bucket within a page.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BucketIndex implements Comparable<BucketIndex> {

    public PageIndex getPage() {
        return _page;
    }

    public int getBucket() {
        return _bucket;
    }

    public Instant getStartTime() {
        return _page.getTimeline().bucketStartTime(this);
    }

    public Instant getEndTime() {
        return _page.getTimeline().bucketEndTime(this);
    }

    @Override
    public int compareTo(final BucketIndex other) {
        final int pageComparison = _page.compareTo(other._page);
        if (pageComparison != 0) {
            return pageComparison;
        }
        return Integer.compare(_bucket, other._bucket);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final BucketIndex other = (BucketIndex) object;

        return _bucket == other._bucket
                && Objects.equal(_page, other._page);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_page, _bucket);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Page", _page.getIndex())
                .add("Bucket", _bucket)
                .toString();
    }

    BucketIndex(final PageIndex page, final int bucket) {
        if (bucket < 0 || bucket >= page.getTimeline().getResolution().getNumBucketsPerPage()) {
            throw new IllegalArgumentException(String.format("Bucket out of range; bucket=%d", bucket));
        }
        _page = page;
        _bucket = bucket;
    }

    private final PageIndex _page;
    private final int _bucket;
}
