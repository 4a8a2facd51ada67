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
package com.arpnetworking.statistics.registry;

import com.arpnetworking.statistics.events.ErrorMessageCount;
import com.arpnetworking.statistics.events.IncidentReport;
import com.arpnetworking.statistics.events.LiveMetrics;
import com.arpnetworking.statistics.events.PlayerCreated;
import com.arpnetworking.statistics.events.PlayerLogin;
import com.arpnetworking.statistics.events.PlayerPurchase;
import com.arpnetworking.statistics.events.PlayerSession;
import com.arpnetworking.statistics.events.StatisticsEvent;
import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.series.AccumulationMode;
import com.arpnetworking.statistics.series.CohortCombinedSeries;
import com.arpnetworking.statistics.series.CohortSample;
import com.arpnetworking.statistics.series.CohortSimpleCombinedSeries;
import com.arpnetworking.statistics.series.CohortTimeSeries;
import com.arpnetworking.statistics.series.Combiners;
import com.arpnetworking.statistics.series.DailyCohortTimeSeries;
import com.arpnetworking.statistics.series.SimpleCombinedSeries;
import com.arpnetworking.statistics.series.SimpleTimeSeries;
import com.arpnetworking.statistics.timeline.Resolutions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;

/**
 * The standard series of the game statistics.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class DefaultTimeSeriesRegistry {

    /**
     * Page key of the daily cohort series.
     */
    public static final String DAILY_COHORTS_PAGE_KEY = "DailyCohorts";

    /**
     * The days tracked by daily cohort series: every day of the first month,
     * then weekly up to half a year, then every four weeks up to about three
     * years.
     */
    public static final ImmutableList<Integer> COHORT_DAYS = createCohortDays();

    /**
     * Create the registry of the standard series.
     *
     * @return a new {@link TimeSeriesRegistry}
     */
    public static TimeSeriesRegistry create() {
        final SimpleTimeSeries<Long> newUsers = new SimpleTimeSeries.Builder<Long>()
                .setKey("newUsers")
                .setEventTypes(ImmutableSet.of(PlayerCreated.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
        final SimpleTimeSeries<Long> numSessions = new SimpleTimeSeries.Builder<Long>()
                .setKey("numSessions")
                .setEventTypes(ImmutableSet.of(PlayerSession.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();
        final SimpleTimeSeries<Long> sessionLength = new SimpleTimeSeries.Builder<Long>()
                .setKey("sessionLength")
                .setEventTypes(ImmutableSet.of(PlayerSession.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> Optional.of(((PlayerSession) event).getLength().toMillis()))
                .build();
        final SimpleTimeSeries<Double> inAppRevenue = new SimpleTimeSeries.Builder<Double>()
                .setKey("inAppRevenue")
                .setEventTypes(ImmutableSet.of(PlayerPurchase.class))
                .setNumberKind(NumberKind.DOUBLE)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> Optional.of(((PlayerPurchase) event).getDollarValue()))
                .build();
        final SimpleTimeSeries<Long> dau = new SimpleTimeSeries.Builder<Long>()
                .setKey("dau")
                .setEventTypes(ImmutableSet.of(PlayerCreated.class, PlayerLogin.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> isActiveUser(event) ? Optional.of(1L) : Optional.empty())
                .build();
        final SimpleTimeSeries<Long> errorCount = new SimpleTimeSeries.Builder<Long>()
                .setKey("errorCount")
                .setEventTypes(ImmutableSet.of(ErrorMessageCount.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.SUM)
                .setParser(event -> Optional.of(((ErrorMessageCount) event).getCount()))
                .build();
        final SimpleTimeSeries<Long> concurrents = new SimpleTimeSeries.Builder<Long>()
                .setKey("concurrents")
                .setEventTypes(ImmutableSet.of(LiveMetrics.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.AVG)
                .setParser(event -> Optional.of(((LiveMetrics) event).getConcurrentUsers()))
                .build();
        final SimpleTimeSeries<Long> incidentReportCount = new SimpleTimeSeries.Builder<Long>()
                .setKey("incidentReportCount")
                .setEventTypes(ImmutableSet.of(IncidentReport.class))
                .setNumberKind(NumberKind.LONG)
                .setMode(AccumulationMode.COUNT)
                .build();

        final CohortTimeSeries<Long> dauCohorts = new CohortTimeSeries.Builder<Long>()
                .setKey("dauCohorts")
                .setEventTypes(ImmutableSet.of(PlayerCreated.class, PlayerLogin.class))
                .setNumberKind(NumberKind.LONG)
                .setCohorts(ImmutableList.of(HUMANS_COHORT, BOTS_COHORT))
                .setParser(DefaultTimeSeriesRegistry::parseUserKind)
                .build();

        final DailyCohortTimeSeries<Long> dailyLogins = new DailyCohortTimeSeries.Builder<Long>()
                .setKey("dailyLogins")
                .setStoragePageKey(DAILY_COHORTS_PAGE_KEY)
                .setEventTypes(ImmutableSet.of(PlayerLogin.class))
                .setNumberKind(NumberKind.LONG)
                .setDays(COHORT_DAYS)
                .setParser(event -> parseCohortDay(((PlayerLogin) event).getDaysSinceRegistered(), 1L))
                .build();
        final DailyCohortTimeSeries<Double> dailyIapRevenue = new DailyCohortTimeSeries.Builder<Double>()
                .setKey("dailyIapRevenue")
                .setStoragePageKey(DAILY_COHORTS_PAGE_KEY)
                .setEventTypes(ImmutableSet.of(PlayerPurchase.class))
                .setNumberKind(NumberKind.DOUBLE)
                .setDays(COHORT_DAYS)
                .setParser(event -> {
                    final PlayerPurchase purchase = (PlayerPurchase) event;
                    return parseCohortDay(purchase.getDaysSinceRegistered(), purchase.getDollarValue());
                })
                .build();

        return new TimeSeriesRegistry.Builder(Resolutions.ALL)
                .addWrittenSimpleSeries(newUsers)
                .addWrittenSimpleSeries(numSessions)
                .addWrittenSimpleSeries(sessionLength)
                .addWrittenSimpleSeries(inAppRevenue)
                .addWrittenSimpleSeries(dau)
                .addWrittenSimpleSeries(errorCount)
                .addWrittenSimpleSeries(concurrents)
                .addWrittenSimpleSeries(incidentReportCount)
                .addSimpleSeries(new SimpleCombinedSeries<>("avgSessionLength", sessionLength, numSessions, Combiners.ratio()))
                .addSimpleSeries(new SimpleCombinedSeries<>("arpDau", inAppRevenue, dau, Combiners.ratio()))
                .addWrittenCohortSeries(dauCohorts, Resolutions.ALL)
                .addWrittenCohortSeries(dailyLogins, ImmutableList.of(Resolutions.DAILY))
                .addWrittenCohortSeries(dailyIapRevenue, ImmutableList.of(Resolutions.DAILY))
                .addCohortSeries(new CohortSimpleCombinedSeries<>("retention", dailyLogins, newUsers, Combiners.ratio()))
                .addCohortSeries(new CohortCombinedSeries<>("arpDauPerDay", dailyIapRevenue, dailyLogins, Combiners.ratio()))
                .build();
    }

    private static boolean isActiveUser(final StatisticsEvent event) {
        if (event instanceof PlayerLogin) {
            return ((PlayerLogin) event).getDaysSinceRegistered() > 0;
        }
        return event instanceof PlayerCreated;
    }

    private static Optional<CohortSample<Long>> parseUserKind(final StatisticsEvent event) {
        if (!isActiveUser(event)) {
            return Optional.empty();
        }
        final boolean bot;
        if (event instanceof PlayerLogin) {
            bot = ((PlayerLogin) event).isBot();
        } else {
            bot = ((PlayerCreated) event).isBot();
        }
        return Optional.of(CohortSample.of(bot ? BOTS_COHORT : HUMANS_COHORT, 1L));
    }

    private static <T extends Number> Optional<CohortSample<T>> parseCohortDay(final int days, final T value) {
        // Days between the tracked ones are not recorded
        if (!COHORT_DAY_SET.contains(days)) {
            return Optional.empty();
        }
        return Optional.of(CohortSample.ofDay(days, value));
    }

    private static ImmutableList<Integer> createCohortDays() {
        final ImmutableList.Builder<Integer> days = ImmutableList.builder();
        int day = 0;
        for (; day <= 31; ++day) {
            days.add(day);
        }
        for (day = 35; day <= 182; day += 7) {
            days.add(day);
        }
        for (day = 196; day <= 1120; day += 28) {
            days.add(day);
        }
        return days.build();
    }

    private DefaultTimeSeriesRegistry() { }

    private static final ImmutableSet<Integer> COHORT_DAY_SET = ImmutableSet.copyOf(COHORT_DAYS);
    private static final String HUMANS_COHORT = "humans";
    private static final String BOTS_COHORT = "bots";
}
