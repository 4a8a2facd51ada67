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
package com.arpnetworking.statistics.page;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;

import java.nio.ByteBuffer;

/**
 * The closed set of numeric types that can be stored in a {@link PageSection}.
 * Each kind knows its encoded width and the arithmetic needed to accumulate
 * values of its type.
 *
 * @param <T> the boxed numeric type
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class NumberKind<T extends Number> {

    /**
     * 32-bit signed integers.
     */
    public static final NumberKind<Integer> INTEGER = new IntegerKind();

    /**
     * 64-bit signed integers.
     */
    public static final NumberKind<Long> LONG = new LongKind();

    /**
     * 32-bit floating point.
     */
    public static final NumberKind<Float> FLOAT = new FloatKind();

    /**
     * 64-bit floating point.
     */
    public static final NumberKind<Double> DOUBLE = new DoubleKind();

    /**
     * Look up a kind by its name.
     *
     * @param name the name of the kind
     * @return the {@link NumberKind}
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NumberKind<?> fromName(final String name) {
        final NumberKind<?> kind = KINDS.get(name);
        if (kind == null) {
            throw new IllegalArgumentException(String.format("Unknown number kind; name=%s", name));
        }
        return kind;
    }

    @JsonValue
    public String getName() {
        return _name;
    }

    public int getByteSize() {
        return _byteSize;
    }

    public Class<T> getType() {
        return _type;
    }

    /**
     * Convert an arbitrary number into this kind.
     *
     * @param value the value to convert
     * @return the converted value
     */
    public abstract T convert(Number value);

    /**
     * The additive identity.
     *
     * @return zero of this kind
     */
    public abstract T zero();

    /**
     * The multiplicative identity.
     *
     * @return one of this kind
     */
    public abstract T one();

    /**
     * Add two values.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the sum
     */
    public abstract T add(T left, T right);

    /**
     * The smaller of two values.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the minimum
     */
    public abstract T min(T left, T right);

    /**
     * The larger of two values.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the maximum
     */
    public abstract T max(T left, T right);

    /**
     * Divide a value by a positive count. Integral kinds truncate.
     *
     * @param value the dividend
     * @param count the divisor
     * @return the quotient
     */
    public abstract T divide(T value, long count);

    abstract T read(ByteBuffer buffer, int offset);

    abstract void write(ByteBuffer buffer, int offset, T value);

    @Override
    public String toString() {
        return _name;
    }

    private NumberKind(final String name, final int byteSize, final Class<T> type) {
        _name = name;
        _byteSize = byteSize;
        _type = type;
    }

    private final String _name;
    private final int _byteSize;
    private final Class<T> _type;

    private static final ImmutableMap<String, NumberKind<?>> KINDS = ImmutableMap.of(
            INTEGER.getName(), INTEGER,
            LONG.getName(), LONG,
            FLOAT.getName(), FLOAT,
            DOUBLE.getName(), DOUBLE);

    private static final class IntegerKind extends NumberKind<Integer> {
        IntegerKind() {
            super("INTEGER", Integer.BYTES, Integer.class);
        }

        @Override
        public Integer convert(final Number value) {
            return value.intValue();
        }

        @Override
        public Integer zero() {
            return 0;
        }

        @Override
        public Integer one() {
            return 1;
        }

        @Override
        public Integer add(final Integer left, final Integer right) {
            return left + right;
        }

        @Override
        public Integer min(final Integer left, final Integer right) {
            return Math.min(left, right);
        }

        @Override
        public Integer max(final Integer left, final Integer right) {
            return Math.max(left, right);
        }

        @Override
        public Integer divide(final Integer value, final long count) {
            return (int) (value / count);
        }

        @Override
        Integer read(final ByteBuffer buffer, final int offset) {
            return buffer.getInt(offset);
        }

        @Override
        void write(final ByteBuffer buffer, final int offset, final Integer value) {
            buffer.putInt(offset, value);
        }
    }

    private static final class LongKind extends NumberKind<Long> {
        LongKind() {
            super("LONG", Long.BYTES, Long.class);
        }

        @Override
        public Long convert(final Number value) {
            return value.longValue();
        }

        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long one() {
            return 1L;
        }

        @Override
        public Long add(final Long left, final Long right) {
            return left + right;
        }

        @Override
        public Long min(final Long left, final Long right) {
            return Math.min(left, right);
        }

        @Override
        public Long max(final Long left, final Long right) {
            return Math.max(left, right);
        }

        @Override
        public Long divide(final Long value, final long count) {
            return value / count;
        }

        @Override
        Long read(final ByteBuffer buffer, final int offset) {
            return buffer.getLong(offset);
        }

        @Override
        void write(final ByteBuffer buffer, final int offset, final Long value) {
            buffer.putLong(offset, value);
        }
    }

    private static final class FloatKind extends NumberKind<Float> {
        FloatKind() {
            super("FLOAT", Float.BYTES, Float.class);
        }

        @Override
        public Float convert(final Number value) {
            return value.floatValue();
        }

        @Override
        public Float zero() {
            return 0f;
        }

        @Override
        public Float one() {
            return 1f;
        }

        @Override
        public Float add(final Float left, final Float right) {
            return left + right;
        }

        @Override
        public Float min(final Float left, final Float right) {
            return Math.min(left, right);
        }

        @Override
        public Float max(final Float left, final Float right) {
            return Math.max(left, right);
        }

        @Override
        public Float divide(final Float value, final long count) {
            return value / count;
        }

        @Override
        Float read(final ByteBuffer buffer, final int offset) {
            return buffer.getFloat(offset);
        }

        @Override
        void write(final ByteBuffer buffer, final int offset, final Float value) {
            buffer.putFloat(offset, value);
        }
    }

    private static final class DoubleKind extends NumberKind<Double> {
        DoubleKind() {
            super("DOUBLE", Double.BYTES, Double.class);
        }

        @Override
        public Double convert(final Number value) {
            return value.doubleValue();
        }

        @Override
        public Double zero() {
            return 0d;
        }

        @Override
        public Double one() {
            return 1d;
        }

        @Override
        public Double add(final Double left, final Double right) {
            return left + right;
        }

        @Override
        public Double min(final Double left, final Double right) {
            return Math.min(left, right);
        }

        @Override
        public Double max(final Double left, final Double right) {
            return Math.max(left, right);
        }

        @Override
        public Double divide(final Double value, final long count) {
            return value / count;
        }

        @Override
        Double read(final ByteBuffer buffer, final int offset) {
            return buffer.getDouble(offset);
        }

        @Override
        void write(final ByteBuffer buffer, final int offset, final Double value) {
            buffer.putDouble(offset, value);
        }
    }
}
