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
package com.arpnetworking.statistics.storage;

import com.arpnetworking.statistics.page.PageId;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.timeline.BucketIndex;
import com.arpnetworking.statistics.timeline.PageIndex;
import com.arpnetworking.statistics.timeline.Timeline;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds the pages of a timeline that have not been persisted yet. The buffer
 * tracks the bucket currently being written and a watermark before which no
 * more writes are accepted; both only move forward. Moving into a new page
 * finalizes every page up to and including the previous one and
 * {@link #flush()} persists the final pages to durable storage.
 *
 * Mutations are expected from a single writer. Reads and flush completions
 * may happen on other threads.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageWriteBuffer extends ReadOnlyPageStorage {

    /**
     * Public constructor.
     *
     * @param timeline the timeline of the pages in this buffer
     * @param durableStorage where final pages are persisted
     */
    public PageWriteBuffer(final Timeline timeline, final WritablePageStorage durableStorage) {
        _timeline = timeline;
        _durableStorage = durableStorage;
        _currentBucket = timeline.bucketIndexOf(timeline.getEpoch());
        _watermark = timeline.getEpoch();
    }

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(_pages.get(pageId)).map(StoragePage::copy));
    }

    /**
     * Whether the buffer holds a page.
     *
     * @param pageId the unique id of the page
     * @return true if the page is in the buffer
     */
    public boolean exists(final String pageId) {
        return _pages.containsKey(pageId);
    }

    /**
     * Move the current bucket to the bucket containing {@code time}. Moving
     * into a later page marks every buffered page up to the previous current
     * page final.
     *
     * @param time the new time
     * @return true if the current page changed
     */
    public boolean advanceBuckets(final Instant time) {
        final BucketIndex newBucket = _timeline.bucketIndexOf(time);
        final PageIndex currentPage = _currentBucket.getPage();
        final int pageComparison = newBucket.getPage().compareTo(currentPage);
        if (pageComparison < 0) {
            throw new IllegalArgumentException(
                    String.format("Cannot move to an earlier page; current=%s, requested=%s", currentPage, newBucket.getPage()));
        }
        if (pageComparison == 0 && newBucket.getBucket() < _currentBucket.getBucket()) {
            throw new IllegalArgumentException(
                    String.format("Cannot move to an earlier bucket; current=%s, requested=%s", _currentBucket, newBucket));
        }

        if (pageComparison > 0) {
            for (final StoragePage page : _pages.values()) {
                if (page.getIndex() <= currentPage.getIndex() && !page.isFinal()) {
                    page.setFinal();
                    LOGGER.debug()
                            .setMessage("Page finalized")
                            .addData("pageId", page.getUniqueId())
                            .log();
                }
            }
        }

        _currentBucket = newBucket;
        final Instant bucketStart = newBucket.getStartTime();
        if (bucketStart.isAfter(_watermark)) {
            _watermark = bucketStart;
        }
        return pageComparison > 0;
    }

    /**
     * Move the watermark. Writes before the watermark are no longer accepted.
     *
     * @param time the new watermark; must be within the current bucket
     */
    public void advanceWatermark(final Instant time) {
        if (time.isBefore(_watermark)) {
            throw new IllegalArgumentException(
                    String.format("Cannot move the watermark backwards; watermark=%s, requested=%s", _watermark, time));
        }
        if (!time.isBefore(_currentBucket.getEndTime())) {
            throw new IllegalArgumentException(
                    String.format("Cannot move the watermark past the current bucket; bucketEnd=%s, requested=%s",
                            _currentBucket.getEndTime(),
                            time));
        }
        _watermark = time;
    }

    /**
     * Find a page to write to or create it.
     *
     * @param pageKey the page key
     * @param pageIndex the page
     * @return the page
     */
    public StoragePage getOrCreateWritablePage(final String pageKey, final PageIndex pageIndex) {
        final PageId id = PageId.of(pageKey, pageIndex);
        return _pages.computeIfAbsent(id.getUniqueId(), ignored -> new StoragePage(pageKey, pageIndex));
    }

    /**
     * Find a page to write to.
     *
     * @param pageKey the page key
     * @param pageIndex the page
     * @return the page if it is buffered
     */
    public Optional<StoragePage> tryGetWritablePage(final String pageKey, final PageIndex pageIndex) {
        return Optional.ofNullable(_pages.get(PageId.of(pageKey, pageIndex).getUniqueId()));
    }

    /**
     * Persist all final pages in index order and remove them from the buffer
     * once persisted. Pages that are not final remain in the buffer.
     *
     * @return completes when every final page has been persisted
     */
    public CompletionStage<Void> flush() {
        final ImmutableList<StoragePage> finalPages = _pages.values()
                .stream()
                .filter(StoragePage::isFinal)
                .sorted(Comparator.comparingLong(StoragePage::getIndex))
                .collect(ImmutableList.toImmutableList());

        CompletionStage<Void> result = CompletableFuture.completedFuture(null);
        for (final StoragePage page : finalPages) {
            result = result
                    .thenCompose(ignored -> _durableStorage.writeNew(page))
                    .thenRun(() -> _pages.remove(page.getUniqueId()));
        }
        return result;
    }

    public Timeline getTimeline() {
        return _timeline;
    }

    public Instant getWatermark() {
        return _watermark;
    }

    public BucketIndex getCurrentBucket() {
        return _currentBucket;
    }

    public PageIndex getCurrentPage() {
        return _currentBucket.getPage();
    }

    public ImmutableList<StoragePage> getPages() {
        return ImmutableList.copyOf(_pages.values());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timeline", _timeline)
                .add("Watermark", _watermark)
                .add("CurrentBucket", _currentBucket)
                .add("Pages", _pages.size())
                .toString();
    }

    private final Timeline _timeline;
    private final WritablePageStorage _durableStorage;
    private final ConcurrentMap<String, StoragePage> _pages = new ConcurrentHashMap<>();
    private volatile BucketIndex _currentBucket;
    private volatile Instant _watermark;

    private static final Logger LOGGER = LoggerFactory.getLogger(PageWriteBuffer.class);
}
