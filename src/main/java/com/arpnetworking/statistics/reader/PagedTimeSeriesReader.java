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
package com.arpnetworking.statistics.reader;

import com.arpnetworking.statistics.page.PageId;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.timeline.BucketIndex;
import com.arpnetworking.statistics.timeline.PageIndex;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reads the buckets of a series stored in pages. Only the distinct pages
 * covering the requested range are fetched, concurrently, and buckets that
 * start in the future are not fetched at all.
 *
 * @param <T> the type of the values read
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PagedTimeSeriesReader<T> implements TimeSeriesReader<T> {

    /**
     * Public constructor.
     *
     * @param context where and when to read
     * @param pageKey the key of the pages holding the series
     * @param bucketReader extracts the value of a bucket from a page
     */
    public PagedTimeSeriesReader(final ReadContext context, final String pageKey, final BucketReader<T> bucketReader) {
        _context = context;
        _pageKey = pageKey;
        _bucketReader = bucketReader;
    }

    @Override
    public Timeline getTimeline() {
        return _context.getTimeline();
    }

    @Override
    public CompletionStage<TimeSeriesView<T>> readTimeSpan(final Instant start, final Instant end) {
        final Timeline timeline = _context.getTimeline();
        final ImmutableList<BucketIndex> buckets = timeline.bucketsForRange(start, end);
        if (buckets.isEmpty()) {
            return CompletableFuture.completedFuture(new TimeSeriesView<>(timeline, start, start, ImmutableList.of()));
        }

        final Instant now = _context.getClock().instant();
        final Map<PageIndex, CompletableFuture<Optional<StoragePage>>> pages = new LinkedHashMap<>();
        for (final BucketIndex bucket : buckets) {
            if (!bucket.getStartTime().isAfter(now)) {
                pages.computeIfAbsent(
                        bucket.getPage(),
                        page -> _context.getStorage().tryGet(PageId.of(_pageKey, page).getUniqueId()).toCompletableFuture());
            }
        }

        return CompletableFuture.allOf(pages.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    final ImmutableList.Builder<Optional<T>> values = ImmutableList.builder();
                    for (final BucketIndex bucket : buckets) {
                        final CompletableFuture<Optional<StoragePage>> page = pages.get(bucket.getPage());
                        if (page == null || bucket.getStartTime().isAfter(now)) {
                            values.add(Optional.empty());
                        } else {
                            values.add(page.join().flatMap(p -> _bucketReader.read(p, bucket.getBucket())));
                        }
                    }
                    return new TimeSeriesView<>(
                            timeline,
                            buckets.get(0).getStartTime(),
                            buckets.get(buckets.size() - 1).getEndTime(),
                            values.build());
                });
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Context", _context)
                .add("PageKey", _pageKey)
                .toString();
    }

    private final ReadContext _context;
    private final String _pageKey;
    private final BucketReader<T> _bucketReader;

    /**
     * Extracts the value of one bucket from a page.
     *
     * @param <T> the type of the value
     */
    @FunctionalInterface
    public interface BucketReader<T> {

        /**
         * Read a bucket.
         *
         * @param page the page holding the bucket
         * @param bucket the bucket within the page
         * @return the value, if any
         */
        Optional<T> read(StoragePage page, int bucket);
    }
}
