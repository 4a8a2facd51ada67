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
package com.arpnetworking.statistics.series;

import com.arpnetworking.statistics.events.ErrorMessageCount;
import com.arpnetworking.statistics.events.LiveMetrics;
import com.arpnetworking.statistics.events.PlayerCreated;
import com.arpnetworking.statistics.events.PlayerPurchase;
import com.arpnetworking.statistics.events.PlayerSession;
import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.reader.ReadContext;
import com.arpnetworking.statistics.storage.InMemoryPageStorage;
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.statistics.storage.TieredPageStorage;
import com.arpnetworking.statistics.test.ManualClock;
import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Timeline;
import com.arpnetworking.statistics.writer.TimeSeriesPageWriter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tests for the {@link SimpleTimeSeries}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class SimpleTimeSeriesTest {

    @Test
    public void countsEventsPerBucket() {
        final SimpleTimeSeries<Long> series = new SimpleTimeSeries.Builder<Long>()
                .setKey("newUsers")
                .setEventTypes(ImmutableSet.of(PlayerCreated.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
        _writer.register(series);

        _writer.write(new PlayerCreated(at(Duration.ZERO), "a", false));
        _writer.write(new PlayerCreated(at(Duration.ofSeconds(30)), "b", false));
        _writer.write(new PlayerCreated(at(Duration.ofSeconds(90)), "c", true));

        Assert.assertEquals(
                ImmutableList.of(Optional.of(2L), Optional.of(1L), Optional.of(0L), Optional.of(0L)),
                read(series, Duration.ZERO, Duration.ofMinutes(4)));
        Assert.assertFalse(series.isNullable());

        _writer.advanceTime(at(Duration.ofMinutes(4)));
        Assert.assertTrue(_buffer.tryGetWritablePage("Default", _timeline.pageIndex(0)).get().isFinal());
        Assert.assertEquals(
                ImmutableList.of(Optional.of(2L), Optional.of(1L)),
                read(series, Duration.ZERO, Duration.ofMinutes(2)));
    }

    @Test
    public void bucketsWithoutPageAreEmpty() {
        final SimpleTimeSeries<Long> series = countSeries();
        _writer.register(series);
        _writer.write(new PlayerCreated(at(Duration.ofMinutes(5)), "a", false));

        Assert.assertEquals(
                ImmutableList.of(Optional.empty(), Optional.of(0L), Optional.of(1L)),
                read(series, Duration.ofMinutes(3), Duration.ofMinutes(6)));
    }

    @Test
    public void futureBucketsAreEmpty() {
        final SimpleTimeSeries<Long> series = countSeries();
        _writer.register(series);
        _writer.write(new PlayerCreated(at(Duration.ZERO), "a", false));
        _clock.setInstant(at(Duration.ofSeconds(30)));

        Assert.assertEquals(
                ImmutableList.of(Optional.of(1L), Optional.empty()),
                read(series, Duration.ZERO, Duration.ofMinutes(2)));
    }

    @Test
    public void sumsValues() {
        final SimpleTimeSeries<Long> series = new SimpleTimeSeries.Builder<Long>()
                .setKey("errorCount")
                .setEventTypes(ImmutableSet.of(ErrorMessageCount.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> Optional.of(((ErrorMessageCount) event).getCount()))
                .build();
        _writer.register(series);

        _writer.write(new ErrorMessageCount(at(Duration.ofSeconds(1)), 3));
        _writer.write(new ErrorMessageCount(at(Duration.ofSeconds(2)), 4));

        Assert.assertEquals(
                ImmutableList.of(Optional.of(7L), Optional.of(0L)),
                read(series, Duration.ZERO, Duration.ofMinutes(2)));
    }

    @Test
    public void sumsDoubleValues() {
        final SimpleTimeSeries<Double> series = new SimpleTimeSeries.Builder<Double>()
                .setKey("inAppRevenue")
                .setEventTypes(ImmutableSet.of(PlayerPurchase.class))
                .setNumberKind(NumberKind.DOUBLE)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> Optional.of(((PlayerPurchase) event).getDollarValue()))
                .build();
        _writer.register(series);

        _writer.write(new PlayerPurchase(at(Duration.ofSeconds(1)), "p1", 0.99, 0));
        _writer.write(new PlayerPurchase(at(Duration.ofSeconds(2)), "p2", 4.01, 3));

        final Optional<Double> total = read(series, Duration.ZERO, Duration.ofMinutes(1)).get(0);
        Assert.assertEquals(5.0, total.get(), 0.0001);
    }

    @Test
    public void averagesValues() {
        final SimpleTimeSeries<Long> series = new SimpleTimeSeries.Builder<Long>()
                .setKey("sessionLength")
                .setEventTypes(ImmutableSet.of(PlayerSession.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.AVG)
                .setParser(event -> Optional.of(((PlayerSession) event).getLength().getSeconds()))
                .build();
        _writer.register(series);

        _writer.write(new PlayerSession(at(Duration.ofSeconds(1)), "s1", Duration.ofSeconds(10), "ios", 0));
        _writer.write(new PlayerSession(at(Duration.ofSeconds(2)), "s2", Duration.ofSeconds(20), "android", 0));
        _writer.write(new PlayerSession(at(Duration.ofSeconds(150)), "s3", Duration.ofSeconds(7), "ios", 0));

        Assert.assertTrue(series.isNullable());
        Assert.assertEquals(
                ImmutableList.of(Optional.of(15L), Optional.empty(), Optional.of(7L)),
                read(series, Duration.ZERO, Duration.ofMinutes(3)));
        Assert.assertTrue(_buffer.tryGetWritablePage("Default", _timeline.pageIndex(0))
                .get()
                .getSection("sessionLength", SimpleTimeSeries.AVG_COUNT_COHORT)
                .isPresent());
    }

    @Test
    public void minimumAndMaximum() {
        final SimpleTimeSeries<Long> min = extremeSeries("minConcurrents", AccumulationMode.MIN);
        final SimpleTimeSeries<Long> max = extremeSeries("maxConcurrents", AccumulationMode.MAX);
        _writer.register(min);
        _writer.register(max);

        _writer.write(new LiveMetrics(at(Duration.ofSeconds(1)), 5));
        _writer.write(new LiveMetrics(at(Duration.ofSeconds(2)), 2));
        _writer.write(new LiveMetrics(at(Duration.ofSeconds(3)), 8));

        Assert.assertEquals(ImmutableList.of(Optional.of(2L), Optional.empty()), read(min, Duration.ZERO, Duration.ofMinutes(2)));
        Assert.assertEquals(ImmutableList.of(Optional.of(8L), Optional.empty()), read(max, Duration.ZERO, Duration.ofMinutes(2)));
    }

    @Test
    public void absentValuesAreSkipped() {
        final SimpleTimeSeries<Long> series = new SimpleTimeSeries.Builder<Long>()
                .setKey("maxConcurrents")
                .setEventTypes(ImmutableSet.of(LiveMetrics.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.MAX)
                .setParser(event -> Optional.empty())
                .build();
        _writer.register(series);

        _writer.write(new LiveMetrics(at(Duration.ofSeconds(1)), 5));

        Assert.assertEquals(ImmutableList.of(Optional.empty()), read(series, Duration.ZERO, Duration.ofMinutes(1)));
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void parserRequiredUnlessCounting() {
        new SimpleTimeSeries.Builder<Long>()
                .setKey("errorCount")
                .setEventTypes(ImmutableSet.of(ErrorMessageCount.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.SUM)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void eventTypesRequired() {
        new SimpleTimeSeries.Builder<Long>()
                .setKey("errorCount")
                .setEventTypes(ImmutableSet.of())
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void keyWithSeparatorRejected() {
        new SimpleTimeSeries.Builder<Long>()
                .setKey("error/count")
                .setEventTypes(ImmutableSet.of(ErrorMessageCount.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
    }

    private SimpleTimeSeries<Long> countSeries() {
        return new SimpleTimeSeries.Builder<Long>()
                .setKey("newUsers")
                .setEventTypes(ImmutableSet.of(PlayerCreated.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
    }

    private SimpleTimeSeries<Long> extremeSeries(final String key, final AccumulationMode mode) {
        return new SimpleTimeSeries.Builder<Long>()
                .setKey(key)
                .setEventTypes(ImmutableSet.of(LiveMetrics.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(mode)
                .setParser(event -> Optional.of(((LiveMetrics) event).getConcurrentUsers()))
                .build();
    }

    private <T> ImmutableList<Optional<T>> read(
            final SimpleReadableTimeSeries<T> series,
            final Duration start,
            final Duration end) {
        final ReadContext context = new ReadContext(_timeline, new TieredPageStorage(_buffer, _durableStorage), _clock);
        return series.getReader(context).readTimeSpan(at(start), at(end)).toCompletableFuture().join().getBuckets();
    }

    private static Instant at(final Duration offset) {
        return TestBeanFactory.EPOCH.plus(offset);
    }

    private final Timeline _timeline = TestBeanFactory.createTimeline();
    private final InMemoryPageStorage _durableStorage = new InMemoryPageStorage();
    private final PageWriteBuffer _buffer = new PageWriteBuffer(_timeline, _durableStorage);
    private final TimeSeriesPageWriter _writer = new TimeSeriesPageWriter(_buffer);
    private final ManualClock _clock = new ManualClock(TestBeanFactory.EPOCH.plus(Duration.ofDays(1)));
}
