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
package com.arpnetworking.statistics;

import com.arpnetworking.statistics.collector.StatisticsEventPublisher;
import com.arpnetworking.statistics.configuration.StatisticsConfiguration;
import com.arpnetworking.statistics.events.PlayerCreated;
import com.arpnetworking.statistics.query.TimeSeriesQueryService;
import com.arpnetworking.statistics.reader.TimeSeriesView;
import com.arpnetworking.statistics.storage.InMemoryPageStorage;
import com.arpnetworking.statistics.storage.PageStorage;
import com.arpnetworking.statistics.storage.WritablePageStorage;
import com.arpnetworking.statistics.timeline.Resolutions;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.apache.pekko.actor.ActorSystem;
import org.apache.pekko.testkit.javadsl.TestKit;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Tests for the {@link GuiceModule}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class GuiceModuleTest {

    @Before
    public void setUp() {
        _injector = Guice.createInjector(new GuiceModule(
                new StatisticsConfiguration.Builder()
                        .setFlushInterval(Duration.ofMillis(100))
                        .build()));
    }

    @After
    public void tearDown() {
        TestKit.shutdownActorSystem(_injector.getInstance(ActorSystem.class));
    }

    @Test
    public void inMemoryStorageWithoutDatabase() {
        Assert.assertTrue(_injector.getInstance(WritablePageStorage.class) instanceof InMemoryPageStorage);
        Assert.assertSame(_injector.getInstance(PageStorage.class), _injector.getInstance(PageStorage.class));
    }

    @Test
    public void publishedEventIsQueryable() {
        final StatisticsEventPublisher publisher = _injector.getInstance(StatisticsEventPublisher.class);
        final TimeSeriesQueryService queryService = _injector.getInstance(TimeSeriesQueryService.class);

        final PlayerCreated event = publisher.publish(timestamp -> new PlayerCreated(timestamp, "player", false));
        final Instant start = event.getTimestamp().truncatedTo(ChronoUnit.MINUTES);

        new TestKit(_injector.getInstance(ActorSystem.class)).awaitAssert(Duration.ofSeconds(15), () -> {
            final TimeSeriesView<?> view = queryService.readSimple(
                    "newUsers",
                    Resolutions.MINUTE.getName(),
                    start,
                    start.plus(Duration.ofMinutes(1)))
                    .toCompletableFuture()
                    .join();
            Assert.assertEquals(ImmutableList.of(Optional.of(1L)), view.getBuckets());
            return null;
        });
    }

    private Injector _injector;
}
