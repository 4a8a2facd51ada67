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
package com.arpnetworking.statistics.page;

import com.arpnetworking.statistics.timeline.PageIndex;
import com.arpnetworking.statistics.timeline.Resolution;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.Duration;
import java.time.Instant;

/**
 * Identity of a {@link StoragePage}. The string form is used both as the
 * cache key and as the durable storage key:
 *
 * <pre>
 * {resolutionName}/{bucketIntervalMillis:hex}/{epochMillis:hex}/{numBucketsPerPage:hex}/{pageKey}/{pageIndex}
 * </pre>
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageId {

    /**
     * Page key used when a series does not name one.
     */
    public static final String DEFAULT_PAGE_KEY = "Default";

    /**
     * Create a page id.
     *
     * @param pageKey the page key; blank selects {@link #DEFAULT_PAGE_KEY}
     * @param pageIndex the page
     * @return a new {@link PageId}
     */
    public static PageId of(final String pageKey, final PageIndex pageIndex) {
        return new PageId(pageIndex.getTimeline(), normalizePageKey(pageKey), pageIndex.getIndex());
    }

    /**
     * Parse the string form of a page id.
     *
     * @param uniqueId the string form
     * @return the parsed {@link PageId}
     */
    public static PageId parse(final String uniqueId) {
        final String[] parts = uniqueId.split("/", -1);
        if (parts.length != 6) {
            throw new IllegalArgumentException(String.format("Malformed page id; id=%s", uniqueId));
        }
        try {
            final Resolution resolution = Resolution.of(
                    parts[0],
                    Duration.ofMillis(Long.parseLong(parts[1], 16)),
                    Integer.parseInt(parts[3], 16));
            final Timeline timeline = new Timeline(Instant.ofEpochMilli(Long.parseUnsignedLong(parts[2], 16)), resolution);
            return of(parts[4], timeline.pageIndex(Long.parseLong(parts[5])));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Malformed page id; id=%s", uniqueId), e);
        }
    }

    /**
     * Normalize a page key.
     *
     * @param pageKey the page key
     * @return the page key or {@link #DEFAULT_PAGE_KEY} if it is blank
     */
    public static String normalizePageKey(final String pageKey) {
        if (pageKey.isBlank()) {
            return DEFAULT_PAGE_KEY;
        }
        if (pageKey.contains("/")) {
            throw new IllegalArgumentException(String.format("Page key must not contain '/'; pageKey=%s", pageKey));
        }
        return pageKey;
    }

    public Timeline getTimeline() {
        return _timeline;
    }

    public String getPageKey() {
        return _pageKey;
    }

    public PageIndex getPageIndex() {
        return _timeline.pageIndex(_pageIndex);
    }

    public String getUniqueId() {
        return _uniqueId;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final PageId other = (PageId) object;

        return Objects.equal(_uniqueId, other._uniqueId);
    }

    @Override
    public int hashCode() {
        return _uniqueId.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("UniqueId", _uniqueId)
                .toString();
    }

    private PageId(final Timeline timeline, final String pageKey, final long pageIndex) {
        _timeline = timeline;
        _pageKey = pageKey;
        _pageIndex = pageIndex;
        final Resolution resolution = timeline.getResolution();
        _uniqueId = String.format(
                "%s/%x/%x/%x/%s/%d",
                resolution.getName(),
                resolution.getBucketIntervalMillis(),
                timeline.getEpochMillis(),
                resolution.getNumBucketsPerPage(),
                pageKey,
                pageIndex);
    }

    private final Timeline _timeline;
    private final String _pageKey;
    private final long _pageIndex;
    private final String _uniqueId;
}
