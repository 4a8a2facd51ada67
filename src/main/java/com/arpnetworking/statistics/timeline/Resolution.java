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

import java.time.Duration;

/**
 * The width of a bucket and the number of buckets grouped into a page. Two
 * resolutions are equal when their name, interval and page size are equal.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Resolution {

    /**
     * Create a new {@link Resolution}.
     *
     * @param name the name of the resolution; may not contain a '/'
     * @param bucketInterval the width of each bucket
     * @param numBucketsPerPage the number of buckets in each page
     * @return a new {@link Resolution}
     */
    public static Resolution of(final String name, final Duration bucketInterval, final int numBucketsPerPage) {
        return new Resolution(name, bucketInterval.toMillis(), numBucketsPerPage);
    }

    @JsonProperty("name")
    public String getName() {
        return _name;
    }

    @JsonIgnore
    public Duration getBucketInterval() {
        return Duration.ofMillis(_bucketIntervalMillis);
    }

    @JsonProperty("bucketIntervalMillis")
    public long getBucketIntervalMillis() {
        return _bucketIntervalMillis;
    }

    @JsonProperty("numBucketsPerPage")
    public int getNumBucketsPerPage() {
        return _numBucketsPerPage;
    }

    @JsonIgnore
    public long getPageIntervalMillis() {
        return _bucketIntervalMillis * _numBucketsPerPage;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Resolution other = (Resolution) object;

        return _bucketIntervalMillis == other._bucketIntervalMillis
                && _numBucketsPerPage == other._numBucketsPerPage
                && Objects.equal(_name, other._name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_name, _bucketIntervalMillis, _numBucketsPerPage);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("BucketInterval", getBucketInterval())
                .add("NumBucketsPerPage", _numBucketsPerPage)
                .toString();
    }

    @JsonCreator
    Resolution(
            @JsonProperty("name") final String name,
            @JsonProperty("bucketIntervalMillis") final long bucketIntervalMillis,
            @JsonProperty("numBucketsPerPage") final int numBucketsPerPage) {
        if (name == null || name.isEmpty() || name.contains("/")) {
            throw new IllegalArgumentException(String.format("Invalid resolution name; name=%s", name));
        }
        if (bucketIntervalMillis <= 0) {
            throw new IllegalArgumentException(
                    String.format("Bucket interval must be positive; bucketIntervalMillis=%d", bucketIntervalMillis));
        }
        if (numBucketsPerPage <= 0) {
            throw new IllegalArgumentException(
                    String.format("Number of buckets per page must be positive; numBucketsPerPage=%d", numBucketsPerPage));
        }
        _name = name;
        _bucketIntervalMillis = bucketIntervalMillis;
        _numBucketsPerPage = numBucketsPerPage;
    }

    private final String _name;
    private final long _bucketIntervalMillis;
    private final int _numBucketsPerPage;
}
