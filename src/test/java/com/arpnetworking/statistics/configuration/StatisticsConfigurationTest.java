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
package com.arpnetworking.statistics.configuration;

import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Tests for the {@link StatisticsConfiguration}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class StatisticsConfigurationTest {

    @Test
    public void defaults() {
        final StatisticsConfiguration configuration = new StatisticsConfiguration.Builder().build();
        Assert.assertEquals(Instant.parse("2000-01-01T00:00:00Z"), configuration.getEpoch());
        Assert.assertEquals(64L * 1024 * 1024, configuration.getCacheMaximumWeight());
        Assert.assertFalse(configuration.isCacheNonFinalPages());
        Assert.assertEquals(Duration.ofSeconds(5), configuration.getFlushInterval());
        Assert.assertEquals(Duration.ofSeconds(10), configuration.getClockStaleReservationThreshold());
        Assert.assertEquals(100, configuration.getClockReservationWarningThreshold());
        Assert.assertEquals(Duration.ofSeconds(5), configuration.getAskTimeout());
        Assert.assertFalse(configuration.getDatabaseConfiguration().isPresent());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void cacheWeightMustBePositive() {
        new StatisticsConfiguration.Builder()
                .setCacheMaximumWeight(0L)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void databaseUrlRequired() {
        new DatabaseConfiguration.Builder()
                .setDriverName("org.h2.Driver")
                .setUsername("sa")
                .setPassword("")
                .build();
    }

    @Test
    public void readFromJson() throws IOException {
        final String json = "{"
                + "\"epoch\":\"2020-01-01T00:00:00Z\","
                + "\"flushInterval\":\"PT1S\","
                + "\"cacheNonFinalPages\":true,"
                + "\"databaseConfiguration\":{"
                + "\"jdbcUrl\":\"jdbc:postgresql://localhost:5432/statistics\","
                + "\"driverName\":\"org.postgresql.Driver\","
                + "\"username\":\"statistics\","
                + "\"password\":\"secret\","
                + "\"maximumConnections\":4"
                + "}}";
        final StatisticsConfiguration configuration = StatisticsConfiguration.createObjectMapper()
                .readValue(json, StatisticsConfiguration.class);

        Assert.assertEquals(Instant.parse("2020-01-01T00:00:00Z"), configuration.getEpoch());
        Assert.assertEquals(Duration.ofSeconds(1), configuration.getFlushInterval());
        Assert.assertTrue(configuration.isCacheNonFinalPages());
        Assert.assertEquals(Duration.ofSeconds(5), configuration.getAskTimeout());
        final DatabaseConfiguration database = configuration.getDatabaseConfiguration().get();
        Assert.assertEquals("jdbc:postgresql://localhost:5432/statistics", database.getJdbcUrl());
        Assert.assertEquals(1, database.getMinimumConnections());
        Assert.assertEquals(4, database.getMaximumConnections());
        Assert.assertFalse(database.isRunDdl());
        Assert.assertFalse(configuration.toString().contains("secret"));
    }
}
