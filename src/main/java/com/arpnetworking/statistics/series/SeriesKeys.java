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

/**
 * Validation of series keys and cohort labels, which become parts of section
 * ids and so must not contain the '/' separator.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SeriesKeys {

    /**
     * Prefix of cohort labels reserved for internal bookkeeping.
     */
    public static final String RESERVED_COHORT_PREFIX = "~";

    /**
     * Check that a series key is usable.
     *
     * @param key the series key
     * @return the key
     */
    public static String checkSeriesKey(final String key) {
        if (key == null || key.isBlank() || key.contains("/")) {
            throw new IllegalArgumentException(String.format("Invalid series key; key=%s", key));
        }
        return key;
    }

    /**
     * Check that a user supplied cohort label is usable.
     *
     * @param cohort the cohort label
     * @return the cohort label
     */
    public static String checkCohort(final String cohort) {
        if (cohort == null || cohort.isBlank() || cohort.contains("/") || cohort.startsWith(RESERVED_COHORT_PREFIX)) {
            throw new IllegalArgumentException(String.format("Invalid cohort; cohort=%s", cohort));
        }
        return cohort;
    }

    private SeriesKeys() { }
}
