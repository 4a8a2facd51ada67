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
package com.arpnetworking.statistics.timeline;

import com.google.common.collect.ImmutableList;

import java.time.Duration;

/**
 * The standard resolutions collected by the statistics engine.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Resolutions {

    /**
     * One minute buckets, four hour pages.
     */
    public static final Resolution MINUTE = Resolution.of("Minute", Duration.ofMinutes(1), 240);

    /**
     * One hour buckets, one day pages.
     */
    public static final Resolution HOURLY = Resolution.of("Hourly", Duration.ofHours(1), 24);

    /**
     * One day buckets, fourteen day pages.
     */
    public static final Resolution DAILY = Resolution.of("Daily", Duration.ofDays(1), 14);

    /**
     * All the standard resolutions from finest to coarsest.
     */
    public static final ImmutableList<Resolution> ALL = ImmutableList.of(MINUTE, HOURLY, DAILY);

    private Resolutions() { }
}
