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

import com.arpnetworking.statistics.clock.EventClock;
import com.arpnetworking.statistics.collector.StatisticsCollector;
import com.arpnetworking.statistics.collector.StatisticsEventPublisher;
import com.arpnetworking.statistics.configuration.DatabaseConfiguration;
import com.arpnetworking.statistics.configuration.StatisticsConfiguration;
import com.arpnetworking.statistics.query.TimeSeriesQueryService;
import com.arpnetworking.statistics.registry.DefaultTimeSeriesRegistry;
import com.arpnetworking.statistics.registry.TimeSeriesRegistry;
import com.arpnetworking.statistics.storage.ActorProxyPageStorage;
import com.arpnetworking.statistics.storage.CachedPageStorage;
import com.arpnetworking.statistics.storage.DatabasePageStorage;
import com.arpnetworking.statistics.storage.InMemoryPageStorage;
import com.arpnetworking.statistics.storage.PageStorage;
import com.arpnetworking.statistics.storage.TieredPageStorage;
import com.arpnetworking.statistics.storage.WritablePageStorage;
import com.arpnetworking.statistics.utility.Database;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.inject.name.Names;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.pekko.actor.ActorRef;
import org.apache.pekko.actor.ActorSystem;

import java.time.Clock;
import java.util.Optional;

/**
 * The Guice module wiring the statistics engine from its configuration.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class GuiceModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public GuiceModule(final StatisticsConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(StatisticsConfiguration.class).toInstance(_configuration);

        final Optional<DatabaseConfiguration> databaseConfiguration = _configuration.getDatabaseConfiguration();
        if (databaseConfiguration.isPresent()) {
            bind(Database.class)
                    .annotatedWith(Names.named(DATABASE_NAME))
                    .toProvider(new DatabaseProvider(DATABASE_NAME, databaseConfiguration.get()))
                    .in(Singleton.class);
        }
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private Clock provideClock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private EventClock provideEventClock(final Clock clock) {
        return new EventClock(
                clock,
                _configuration.getClockStaleReservationThreshold(),
                _configuration.getClockReservationWarningThreshold());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TimeSeriesRegistry provideTimeSeriesRegistry() {
        return DefaultTimeSeriesRegistry.create();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ActorSystem provideActorSystem() {
        return ActorSystem.create("Statistics");
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private WritablePageStorage provideDurableStorage(final Injector injector, final ActorSystem system) {
        if (_configuration.getDatabaseConfiguration().isPresent()) {
            final Database database = injector.getInstance(Key.get(Database.class, Names.named(DATABASE_NAME)));
            system.registerOnTermination(database::shutdown);
            return new DatabasePageStorage(
                    database,
                    system.dispatchers().lookup(BLOCKING_DISPATCHER));
        }
        LOGGER.warn()
                .setMessage("No database configured, final pages are kept in memory")
                .log();
        return new InMemoryPageStorage();
    }

    @Provides
    @Singleton
    @Named("statistics-collector")
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ActorRef provideStatisticsCollector(
            final ActorSystem system,
            final EventClock eventClock,
            final TimeSeriesRegistry registry,
            final WritablePageStorage durableStorage) {
        return system.actorOf(
                StatisticsCollector.props(
                        eventClock,
                        registry,
                        durableStorage,
                        _configuration.getEpoch(),
                        _configuration.getFlushInterval()),
                "statistics-collector");
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private PageStorage provideReadStorage(
            final WritablePageStorage durableStorage,
            @Named("statistics-collector") final ActorRef collector,
            final Clock clock) {
        return new CachedPageStorage(
                new TieredPageStorage(durableStorage, new ActorProxyPageStorage(collector, _configuration.getAskTimeout())),
                _configuration.getCacheMaximumWeight(),
                _configuration.isCacheNonFinalPages(),
                clock);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private StatisticsEventPublisher provideEventPublisher(
            final EventClock eventClock,
            @Named("statistics-collector") final ActorRef collector) {
        return new StatisticsEventPublisher(eventClock, collector);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TimeSeriesQueryService provideQueryService(
            final TimeSeriesRegistry registry,
            final PageStorage storage,
            final Clock clock) {
        return new TimeSeriesQueryService(registry, storage, clock, _configuration.getEpoch());
    }

    private final StatisticsConfiguration _configuration;

    private static final String DATABASE_NAME = "statistics";
    private static final String BLOCKING_DISPATCHER = "pekko.actor.default-blocking-io-dispatcher";
    private static final Logger LOGGER = LoggerFactory.getLogger(GuiceModule.class);

    private static final class DatabaseProvider implements com.google.inject.Provider<Database> {

        private DatabaseProvider(final String name, final DatabaseConfiguration configuration) {
            _name = name;
            _configuration = configuration;
        }

        @Override
        public Database get() {
            return new Database(_name, _configuration);
        }

        private final String _name;
        private final DatabaseConfiguration _configuration;
    }
}
