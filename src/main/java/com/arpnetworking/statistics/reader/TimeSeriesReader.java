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

import com.arpnetworking.statistics.timeline.Timeline;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Reads the buckets of a series over a range of time.
 *
 * @param <T> the type of the values read
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface TimeSeriesReader<T> {

    Timeline getTimeline();

    /**
     * Read the buckets covering {@code [start, end)}.
     *
     * @param start the start of the range (inclusive)
     * @param end the end of the range (exclusive)
     * @return the buckets
     */
    CompletionStage<TimeSeriesView<T>> readTimeSpan(Instant start, Instant end);

    /**
     * Read the bucket containing an instant.
     *
     * @param time the instant
     * @return the value of the bucket, if any
     */
    default CompletionStage<Optional<T>> read(final Instant time) {
        return readTimeSpan(time, time.plusMillis(1))
                .thenApply(view -> view.getBuckets().isEmpty() ? Optional.empty() : view.getBuckets().get(0));
    }
}
