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

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Common functions for combined series.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Combiners {

    /**
     * The first value divided by the second. Absent unless both values are
     * present and the second is not zero.
     *
     * @param <A> the type of the dividend
     * @param <B> the type of the divisor
     * @return the combiner
     */
    public static <A extends Number, B extends Number> BiFunction<Optional<A>, Optional<B>, Optional<Double>> ratio() {
        return (first, second) -> {
            if (first.isPresent() && second.isPresent() && second.get().doubleValue() != 0) {
                return Optional.of(first.get().doubleValue() / second.get().doubleValue());
            }
            return Optional.empty();
        };
    }

    /**
     * The sum of both values, treating an absent value as zero. Absent only
     * when both values are absent.
     *
     * @param <A> the type of the first value
     * @param <B> the type of the second value
     * @return the combiner
     */
    public static <A extends Number, B extends Number> BiFunction<Optional<A>, Optional<B>, Optional<Double>> sum() {
        return (first, second) -> {
            if (!first.isPresent() && !second.isPresent()) {
                return Optional.empty();
            }
            return Optional.of(first.map(Number::doubleValue).orElse(0.0) + second.map(Number::doubleValue).orElse(0.0));
        };
    }

    private Combiners() { }
}
