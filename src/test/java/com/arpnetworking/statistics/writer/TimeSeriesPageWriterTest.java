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
package com.arpnetworking.statistics.writer;

import com.arpnetworking.statistics.events.PlayerCreated;
import com.arpnetworking.statistics.events.PlayerLogin;
import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.series.AccumulationMode;
import com.arpnetworking.statistics.series.SimpleTimeSeries;
import com.arpnetworking.statistics.storage.InMemoryPageStorage;
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Resolutions;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tests for the {@link TimeSeriesPageWriter}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class TimeSeriesPageWriterTest {

    @Test
    public void dispatchesByExactEventClass() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));

        Assert.assertFalse(writer.write(new PlayerCreated(at(Duration.ofSeconds(1)), "a", false)));
        Assert.assertTrue(writer.write(new PlayerLogin(at(Duration.ofSeconds(2)), "a", 0, false)));
        Assert.assertFalse(writer.write(new StatisticsEvent(at(Duration.ofSeconds(3))) {
            @Override
            public String getUniqueKey() {
                return "anonymous";
            }
        }));
        Assert.assertEquals(at(Duration.ofSeconds(2)), writer.getBuffer().getWatermark());
    }

    @Test
    public void eventWrittenToEverySubscribedSeries() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));
        writer.register(countSeries("activity", PlayerLogin.class, PlayerCreated.class));

        writer.write(new PlayerLogin(at(Duration.ofSeconds(1)), "a", 0, false));
        writer.write(new PlayerCreated(at(Duration.ofSeconds(2)), "b", false));

        final StoragePage page = writer.getBuffer().tryGetWritablePage("Default", _timeline.pageIndex(0)).get();
        Assert.assertEquals(Optional.of(1L), page.getSection("logins", null).get().getValue(NumberKind.LONG, 0));
        Assert.assertEquals(Optional.of(2L), page.getSection("activity", null).get().getValue(NumberKind.LONG, 0));
        Assert.assertEquals(2, writer.getSeries().size());
    }

    @Test
    public void lateEventDropped() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));

        Assert.assertTrue(writer.write(new PlayerLogin(at(Duration.ofSeconds(70)), "a", 0, false)));
        Assert.assertFalse(writer.write(new PlayerLogin(at(Duration.ofSeconds(30)), "b", 0, false)));
        Assert.assertFalse(writer.write(new PlayerLogin(at(Duration.ofSeconds(65)), "c", 0, false)));
        Assert.assertTrue(writer.write(new PlayerLogin(at(Duration.ofSeconds(70)), "d", 0, false)));

        final StoragePage page = writer.getBuffer().tryGetWritablePage("Default", _timeline.pageIndex(0)).get();
        Assert.assertEquals(Optional.of(0L), page.getSection("logins", null).get().getValue(NumberKind.LONG, 0));
        Assert.assertEquals(Optional.of(2L), page.getSection("logins", null).get().getValue(NumberKind.LONG, 1));
    }

    @Test
    public void eventBeforeEpochDropped() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));

        Assert.assertFalse(writer.write(new PlayerLogin(TestBeanFactory.EPOCH.minusSeconds(1), "a", 0, false)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateSeriesKeyRejected() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));
        writer.register(countSeries("logins", PlayerCreated.class));
    }

    @Test
    public void advanceTimeFinalizesIdlePages() {
        final TimeSeriesPageWriter writer = createWriter(_timeline);
        writer.register(countSeries("logins", PlayerLogin.class));
        writer.write(new PlayerLogin(at(Duration.ofSeconds(10)), "a", 0, false));

        writer.advanceTime(at(Duration.ofMinutes(3)));
        Assert.assertFalse(writer.getBuffer().tryGetWritablePage("Default", _timeline.pageIndex(0)).get().isFinal());

        writer.advanceTime(at(Duration.ofMinutes(9)));
        Assert.assertTrue(writer.getBuffer().tryGetWritablePage("Default", _timeline.pageIndex(0)).get().isFinal());
        Assert.assertEquals(at(Duration.ofMinutes(9)), writer.getBuffer().getWatermark());

        // Moving back in time is ignored
        writer.advanceTime(at(Duration.ofMinutes(1)));
        Assert.assertEquals(at(Duration.ofMinutes(9)), writer.getBuffer().getWatermark());
    }

    @Test
    public void yearOfDailyPages() {
        final Timeline daily = new Timeline(TestBeanFactory.EPOCH, Resolutions.DAILY);
        final InMemoryPageStorage storage = new InMemoryPageStorage();
        final TimeSeriesPageWriter writer = new TimeSeriesPageWriter(new PageWriteBuffer(daily, storage));
        writer.register(countSeries("logins", PlayerLogin.class));

        for (int day = 0; day < 366; ++day) {
            Assert.assertTrue(writer.write(new PlayerLogin(TestBeanFactory.EPOCH.plus(Duration.ofDays(day)), "p" + day, 0, false)));
        }

        final ImmutableList<StoragePage> pages = writer.getBuffer().getPages();
        Assert.assertEquals(27, pages.size());
        Assert.assertEquals(26, pages.stream().filter(StoragePage::isFinal).count());

        writer.getBuffer().flush().toCompletableFuture().join();
        Assert.assertEquals(26, storage.getPageIds().size());
        Assert.assertEquals(1, writer.getBuffer().getPages().size());
        Assert.assertEquals(daily.pageIndex(26), writer.getBuffer().getPages().get(0).getPageIndex());
    }

    @SafeVarargs
    private static SimpleTimeSeries<Long> countSeries(final String key, final Class<? extends StatisticsEvent>... eventTypes) {
        return new SimpleTimeSeries.Builder<Long>()
                .setKey(key)
                .setEventTypes(ImmutableSet.copyOf(eventTypes))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
    }

    private static TimeSeriesPageWriter createWriter(final Timeline timeline) {
        return new TimeSeriesPageWriter(new PageWriteBuffer(timeline, new InMemoryPageStorage()));
    }

    private static Instant at(final Duration offset) {
        return TestBeanFactory.EPOCH.plus(offset);
    }

    private final Timeline _timeline = TestBeanFactory.createTimeline();
}
