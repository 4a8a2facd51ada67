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
 * How the values of a simple series are combined within a bucket.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum AccumulationMode {
    /**
     * Count the matching events.
     */
    COUNT(false),
    /**
     * Sum the values of the matching events.
     */
    SUM(false),
    /**
     * Average the values of the matching events.
     */
    AVG(true),
    /**
     * The smallest value of the matching events.
     */
    MIN(true),
    /**
     * The largest value of the matching events.
     */
    MAX(true);

    AccumulationMode(final boolean nullable) {
        _nullable = nullable;
    }

    /**
     * Whether a bucket without events has no value rather than zero.
     *
     * @return true if empty buckets have no value
     */
    public boolean isNullable() {
        return _nullable;
    }

    private final boolean _nullable;
}
