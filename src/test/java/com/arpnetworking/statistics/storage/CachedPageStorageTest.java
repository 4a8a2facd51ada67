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

import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.page.PageId;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.test.ManualClock;
import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Timeline;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tests for the {@link CachedPageStorage}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class CachedPageStorageTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
        _clock = new ManualClock(TestBeanFactory.EPOCH.plus(Duration.ofDays(10)));
        Mockito.when(_backing.tryGet(Mockito.anyString()))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void finalPagesAreCached() {
        final StoragePage page = createPage(5, true);
        Mockito.when(_backing.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, false, _clock);

        Assert.assertEquals(Optional.of(page), storage.tryGet(page.getUniqueId()).toCompletableFuture().join());
        _clock.advance(Duration.ofHours(2));
        Assert.assertEquals(Optional.of(page), storage.tryGet(page.getUniqueId()).toCompletableFuture().join());

        Mockito.verify(_backing, Mockito.times(1)).tryGet(page.getUniqueId());
        Assert.assertEquals(5, storage.getSuccessfulReadIndex(TestBeanFactory.SMALL_MINUTE.getName()));
    }

    @Test
    public void cachedPageUnaffectedByReaderChanges() {
        final StoragePage page = createPage(5, true);
        Mockito.when(_backing.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, false, _clock);

        final StoragePage first = storage.tryGet(page.getUniqueId()).toCompletableFuture().join().get();
        first.getSection("series", null).get().setValue(NumberKind.LONG, 0, 99L);
        page.getSection("series", null).get().setValue(NumberKind.LONG, 0, 98L);
        final StoragePage second = storage.tryGet(page.getUniqueId()).toCompletableFuture().join().get();
        second.getSection("series", null).get().setValue(NumberKind.LONG, 0, 97L);

        final StoragePage third = storage.tryGet(page.getUniqueId()).toCompletableFuture().join().get();
        Assert.assertEquals(Optional.of(5L), third.getSection("series", null).get().getValue(NumberKind.LONG, 0));
        Mockito.verify(_backing, Mockito.times(1)).tryGet(page.getUniqueId());
    }

    @Test
    public void missingPagesBeforeLastFinalPageAreCachedLonger() {
        final StoragePage page = createPage(5, true);
        Mockito.when(_backing.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        final String before = PageId.of("Default", _timeline.pageIndex(3)).getUniqueId();
        final String after = PageId.of("Default", _timeline.pageIndex(7)).getUniqueId();
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, false, _clock);

        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();
        Assert.assertEquals(Optional.empty(), storage.tryGet(before).toCompletableFuture().join());
        Assert.assertEquals(Optional.empty(), storage.tryGet(after).toCompletableFuture().join());

        _clock.advance(Duration.ofSeconds(6));
        Assert.assertEquals(Optional.empty(), storage.tryGet(before).toCompletableFuture().join());
        Assert.assertEquals(Optional.empty(), storage.tryGet(after).toCompletableFuture().join());

        Mockito.verify(_backing, Mockito.times(1)).tryGet(before);
        Mockito.verify(_backing, Mockito.times(2)).tryGet(after);

        _clock.advance(Duration.ofHours(1));
        storage.tryGet(before).toCompletableFuture().join();
        Mockito.verify(_backing, Mockito.times(2)).tryGet(before);
    }

    @Test
    public void nonFinalPagesAreNotCachedByDefault() {
        final StoragePage page = createPage(2, false);
        Mockito.when(_backing.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, false, _clock);

        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();
        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();

        Mockito.verify(_backing, Mockito.times(2)).tryGet(page.getUniqueId());
        Assert.assertEquals(-1, storage.getSuccessfulReadIndex(TestBeanFactory.SMALL_MINUTE.getName()));
    }

    @Test
    public void nonFinalPagesAreCachedBrieflyWhenEnabled() {
        final StoragePage page = createPage(2, false);
        Mockito.when(_backing.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, true, _clock);

        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();
        _clock.advance(Duration.ofSeconds(1));
        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();
        Mockito.verify(_backing, Mockito.times(1)).tryGet(page.getUniqueId());

        _clock.advance(Duration.ofSeconds(5));
        storage.tryGet(page.getUniqueId()).toCompletableFuture().join();
        Mockito.verify(_backing, Mockito.times(2)).tryGet(page.getUniqueId());
    }

    @Test
    public void backingFailurePropagates() {
        final String pageId = PageId.of("Default", _timeline.pageIndex(1)).getUniqueId();
        Mockito.when(_backing.tryGet(pageId)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        final CachedPageStorage storage = new CachedPageStorage(_backing, 1024 * 1024, false, _clock);

        Assert.assertTrue(storage.tryGet(pageId).toCompletableFuture().isCompletedExceptionally());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void writesAreRejected() {
        new CachedPageStorage(_backing, 1024, false, _clock).writeNew(createPage(1, true));
    }

    private StoragePage createPage(final long index, final boolean isFinal) {
        final StoragePage page = new StoragePage("Default", _timeline.pageIndex(index));
        page.getOrCreateSection("series", null, NumberKind.LONG, false).setValue(NumberKind.LONG, 0, index);
        if (isFinal) {
            page.setFinal();
        }
        return page;
    }

    @Mock
    private PageStorage _backing;
    private ManualClock _clock;
    private AutoCloseable _openMocks;
    private final Timeline _timeline = TestBeanFactory.createTimeline();
}
