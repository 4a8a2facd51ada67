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

import com.arpnetworking.statistics.test.FixedTimeSeriesReader;
import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Resolutions;
import com.arpnetworking.statistics.timeline.Timeline;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tests for the {@link FutureLookingTimeSeriesReader} and the
 * {@link CombinedTimeSeriesReader}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class DerivedTimeSeriesReaderTest {

    @Test
    public void futureLookingShiftsWindow() {
        final FutureLookingTimeSeriesReader<Long> reader = new FutureLookingTimeSeriesReader<>(_values, Duration.ofMinutes(2));

        final TimeSeriesView<Long> view = reader.readTimeSpan(at(0), at(2)).toCompletableFuture().join();

        Assert.assertEquals(ImmutableList.of(Optional.of(3L), Optional.empty()), view.getBuckets());
        Assert.assertEquals(at(0), view.getStartTime());
        Assert.assertEquals(at(2), view.getEndTime());
        Assert.assertEquals(_timeline, reader.getTimeline());
    }

    @Test
    public void futureLookingWithoutOffset() {
        final FutureLookingTimeSeriesReader<Long> reader = new FutureLookingTimeSeriesReader<>(_values, Duration.ZERO);

        Assert.assertEquals(
                ImmutableList.of(Optional.of(1L), Optional.of(2L)),
                reader.readTimeSpan(at(0), at(2)).toCompletableFuture().join().getBuckets());
    }

    @Test(expected = IllegalArgumentException.class)
    public void futureLookingRejectsNegativeOffset() {
        new FutureLookingTimeSeriesReader<>(_values, Duration.ofMinutes(-1));
    }

    @Test
    public void combinedPairsBuckets() {
        final CombinedTimeSeriesReader<Long, Long, Long> reader = new CombinedTimeSeriesReader<>(
                _values,
                _values,
                (first, second) -> first.flatMap(a -> second.map(b -> a * b)));

        Assert.assertEquals(
                ImmutableList.of(Optional.of(1L), Optional.of(4L), Optional.of(9L), Optional.empty()),
                reader.readTimeSpan(at(0), at(4)).toCompletableFuture().join().getBuckets());
    }

    @Test(expected = IllegalArgumentException.class)
    public void combinedRequiresSameTimeline() {
        final FixedTimeSeriesReader<Long> hourly =
                new FixedTimeSeriesReader<>(new Timeline(TestBeanFactory.EPOCH, Resolutions.HOURLY), ImmutableList.of());
        new CombinedTimeSeriesReader<Long, Long, Long>(_values, hourly, (first, second) -> first);
    }

    private static Instant at(final int minutes) {
        return TestBeanFactory.EPOCH.plus(Duration.ofMinutes(minutes));
    }

    private final Timeline _timeline = TestBeanFactory.createTimeline();
    private final FixedTimeSeriesReader<Long> _values = new FixedTimeSeriesReader<Long>(
            _timeline,
            ImmutableList.of(Optional.of(1L), Optional.of(2L), Optional.of(3L), Optional.empty(), Optional.of(4L)));
}
