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
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Read-through cache in front of another storage. Final pages are cached with
 * a sliding expiration and weighed by their approximate size. Missing pages
 * are cached as well: a page older than the newest final page read for its
 * resolution will never appear and is remembered for a long time, any other
 * missing page may simply not be flushed yet and is remembered briefly.
 *
 * Concurrent misses on the same page may both reach the backing storage; the
 * decoded pages are identical so the last one cached wins. Callers always
 * receive their own copy of a cached page.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CachedPageStorage extends ReadOnlyPageStorage {

    /**
     * Public constructor.
     *
     * @param backing the storage to read through to
     * @param maximumWeight the approximate number of bytes to cache
     * @param cacheNonFinalPages whether pages still being written may be cached briefly
     * @param clock the clock to expire entries with
     */
    public CachedPageStorage(
            final PageStorage backing,
            final long maximumWeight,
            final boolean cacheNonFinalPages,
            final Clock clock) {
        _backing = backing;
        _cacheNonFinalPages = cacheNonFinalPages;
        _clock = clock;
        _cache = CacheBuilder.newBuilder()
                .maximumWeight(maximumWeight)
                .weigher((String key, CacheEntry entry) -> entry.getWeight())
                .expireAfterAccess(FINAL_PAGE_EXPIRATION.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(new ClockTicker(clock))
                .build();
    }

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        final CacheEntry cached = _cache.getIfPresent(pageId);
        if (cached != null) {
            if (!cached.isExpired(_clock.instant())) {
                return CompletableFuture.completedFuture(cached.getPage().map(StoragePage::copy));
            }
            _cache.invalidate(pageId);
        }
        final PageId id = PageId.parse(pageId);
        return _backing.tryGet(pageId)
                .thenApply(page -> {
                    onFetched(id, page);
                    return page;
                });
    }

    /**
     * The highest page index read as a final page for a resolution.
     *
     * @param resolutionName the name of the resolution
     * @return the index, or -1 if no final page has been read
     */
    public long getSuccessfulReadIndex(final String resolutionName) {
        return _successfulReadIndex.getOrDefault(resolutionName, -1L);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Backing", _backing)
                .add("CacheNonFinalPages", _cacheNonFinalPages)
                .add("Size", _cache.size())
                .toString();
    }

    private void onFetched(final PageId id, final Optional<StoragePage> page) {
        final String resolutionName = id.getTimeline().getResolution().getName();
        if (page.isPresent()) {
            final StoragePage storagePage = page.get();
            if (storagePage.isFinal()) {
                _successfulReadIndex.merge(resolutionName, storagePage.getIndex(), Math::max);
                _cache.put(
                        id.getUniqueId(),
                        new CacheEntry(Optional.of(storagePage.copy()), null, saturatedWeight(storagePage.getApproximateSize())));
            } else if (_cacheNonFinalPages) {
                _cache.put(
                        id.getUniqueId(),
                        new CacheEntry(Optional.of(storagePage.copy()), _clock.instant().plus(SHORT_EXPIRATION), 0));
            }
        } else {
            final boolean confirmedMissing = id.getPageIndex().getIndex() < getSuccessfulReadIndex(resolutionName);
            LOGGER.debug()
                    .setMessage("Caching missing page")
                    .addData("pageId", id.getUniqueId())
                    .addData("confirmedMissing", confirmedMissing)
                    .log();
            final Duration expiration = confirmedMissing ? CONFIRMED_MISSING_EXPIRATION : SHORT_EXPIRATION;
            _cache.put(
                    id.getUniqueId(),
                    new CacheEntry(Optional.empty(), _clock.instant().plus(expiration), id.getUniqueId().length()));
        }
    }

    private static int saturatedWeight(final long size) {
        return (int) Math.min(size, Integer.MAX_VALUE);
    }

    private final PageStorage _backing;
    private final boolean _cacheNonFinalPages;
    private final Clock _clock;
    private final Cache<String, CacheEntry> _cache;
    private final ConcurrentMap<String, Long> _successfulReadIndex = new ConcurrentHashMap<>();

    private static final Duration FINAL_PAGE_EXPIRATION = Duration.ofDays(1);
    private static final Duration CONFIRMED_MISSING_EXPIRATION = Duration.ofHours(1);
    private static final Duration SHORT_EXPIRATION = Duration.ofSeconds(5);
    private static final Logger LOGGER = LoggerFactory.getLogger(CachedPageStorage.class);

    private static final class CacheEntry {

        CacheEntry(final Optional<StoragePage> page, @Nullable final Instant expiresAt, final int weight) {
            _page = page;
            _expiresAt = expiresAt;
            _weight = weight;
        }

        public Optional<StoragePage> getPage() {
            return _page;
        }

        public int getWeight() {
            return _weight;
        }

        public boolean isExpired(final Instant now) {
            return _expiresAt != null && !now.isBefore(_expiresAt);
        }

        private final Optional<StoragePage> _page;
        @Nullable
        private final Instant _expiresAt;
        private final int _weight;
    }

    private static final class ClockTicker extends Ticker {

        ClockTicker(final Clock clock) {
            _clock = clock;
        }

        @Override
        public long read() {
            return TimeUnit.MILLISECONDS.toNanos(_clock.millis());
        }

        private final Clock _clock;
    }
}
