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

import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.page.PageId;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.storage.PageStorage;
import com.arpnetworking.statistics.test.ManualClock;
import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.collect.ImmutableList;
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
 * Tests for the {@link PagedTimeSeriesReader}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class PagedTimeSeriesReaderTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
        Mockito.when(_storage.tryGet(Mockito.anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        final StoragePage page = new StoragePage("Default", _timeline.pageIndex(1));
        page.getOrCreateSection("series", null, NumberKind.LONG, true).setValue(NumberKind.LONG, 2, 11L);
        page.setFinal();
        Mockito.when(_storage.tryGet(page.getUniqueId())).thenReturn(CompletableFuture.completedFuture(Optional.of(page)));
        _reader = new PagedTimeSeriesReader<>(
                new ReadContext(_timeline, _storage, _clock),
                "Default",
                (p, bucket) -> p.getSection("series", null).flatMap(section -> section.getValue(NumberKind.LONG, bucket)));
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void fetchesEachPageOnce() {
        final TimeSeriesView<Long> view = _reader.readTimeSpan(
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(2)),
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(8))).toCompletableFuture().join();

        Assert.assertEquals(
                ImmutableList.of(
                        Optional.empty(),
                        Optional.empty(),
                        Optional.empty(),
                        Optional.empty(),
                        Optional.of(11L),
                        Optional.empty()),
                view.getBuckets());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(2)), view.getStartTime());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(8)), view.getEndTime());
        Mockito.verify(_storage).tryGet(PageId.of("Default", _timeline.pageIndex(0)).getUniqueId());
        Mockito.verify(_storage).tryGet(PageId.of("Default", _timeline.pageIndex(1)).getUniqueId());
        Mockito.verifyNoMoreInteractions(_storage);
    }

    @Test
    public void futurePagesNotFetched() {
        _clock.setInstant(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(3)));

        final TimeSeriesView<Long> view = _reader.readTimeSpan(
                TestBeanFactory.EPOCH,
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(8))).toCompletableFuture().join();

        Assert.assertEquals(8, view.getBuckets().size());
        Assert.assertEquals(Optional.empty(), view.getBuckets().get(6));
        Mockito.verify(_storage).tryGet(PageId.of("Default", _timeline.pageIndex(0)).getUniqueId());
        Mockito.verifyNoMoreInteractions(_storage);
    }

    @Test
    public void unalignedRangeCoversPartialBuckets() {
        final TimeSeriesView<Long> view = _reader.readTimeSpan(
                TestBeanFactory.EPOCH.plus(Duration.ofSeconds(390)),
                TestBeanFactory.EPOCH.plus(Duration.ofSeconds(421))).toCompletableFuture().join();

        Assert.assertEquals(ImmutableList.of(Optional.of(11L), Optional.empty()), view.getBuckets());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(6)), view.getStartTime());
    }

    @Test
    public void emptyRange() {
        final TimeSeriesView<Long> view = _reader.readTimeSpan(TestBeanFactory.EPOCH, TestBeanFactory.EPOCH)
                .toCompletableFuture()
                .join();

        Assert.assertTrue(view.getBuckets().isEmpty());
        Mockito.verifyNoInteractions(_storage);
    }

    @Test
    public void readSingleInstant() {
        Assert.assertEquals(
                Optional.of(11L),
                _reader.read(TestBeanFactory.EPOCH.plus(Duration.ofSeconds(370))).toCompletableFuture().join());
    }

    @Mock
    private PageStorage _storage;
    private PagedTimeSeriesReader<Long> _reader;
    private AutoCloseable _openMocks;
    private final Timeline _timeline = TestBeanFactory.createTimeline();
    private final ManualClock _clock = new ManualClock(TestBeanFactory.EPOCH.plus(Duration.ofDays(1)));
}
