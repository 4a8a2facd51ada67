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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Fixed number of numeric buckets for a single series (and cohort) within a
 * page. Values are packed into a byte buffer tagged with the {@link NumberKind}
 * used to create it; every access is checked against that kind.
 *
 * A nullable section also tracks whether each bucket holds a value, which
 * distinguishes an empty bucket from a bucket holding zero.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PageSection {

    /**
     * Create an empty section.
     *
     * @param kind the numeric kind of the section
     * @param numBuckets the number of buckets
     * @param nullable whether buckets may be empty
     * @return a new {@link PageSection}
     */
    public static PageSection create(final NumberKind<?> kind, final int numBuckets, final boolean nullable) {
        if (numBuckets <= 0) {
            throw new IllegalArgumentException(String.format("Number of buckets must be positive; numBuckets=%d", numBuckets));
        }
        return new PageSection(
                kind,
                numBuckets,
                new byte[kind.getByteSize() * numBuckets],
                nullable ? new byte[numBuckets] : null);
    }

    /**
     * Read a bucket.
     *
     * @param kind the numeric kind the caller expects
     * @param bucket the bucket to read
     * @param <T> the boxed numeric type
     * @return the value, or empty if the section is nullable and the bucket has no value
     */
    public <T extends Number> Optional<T> getValue(final NumberKind<T> kind, final int bucket) {
        checkKind(kind);
        checkBucket(bucket);
        if (_presence != null && _presence[bucket] == 0) {
            return Optional.empty();
        }
        return Optional.of(kind.read(ByteBuffer.wrap(_data), bucket * kind.getByteSize()));
    }

    /**
     * Write a bucket. Writing {@code null} clears a nullable bucket.
     *
     * @param kind the numeric kind the caller expects
     * @param bucket the bucket to write
     * @param value the value to write
     * @param <T> the boxed numeric type
     */
    public <T extends Number> void setValue(final NumberKind<T> kind, final int bucket, @Nullable final T value) {
        checkKind(kind);
        checkBucket(bucket);
        final ByteBuffer buffer = ByteBuffer.wrap(_data);
        if (value == null) {
            if (_presence == null) {
                throw new IllegalArgumentException(String.format("Cannot clear a bucket of a non-nullable section; bucket=%d", bucket));
            }
            _presence[bucket] = 0;
            kind.write(buffer, bucket * kind.getByteSize(), kind.zero());
        } else {
            kind.write(buffer, bucket * kind.getByteSize(), value);
            if (_presence != null) {
                _presence[bucket] = 1;
            }
        }
    }

    @JsonProperty("kind")
    public NumberKind<?> getKind() {
        return _kind;
    }

    @JsonProperty("numBuckets")
    public int getNumBuckets() {
        return _numBuckets;
    }

    @JsonIgnore
    public boolean isNullable() {
        return _presence != null;
    }

    /**
     * The number of bytes held by this section.
     *
     * @return the size of the value buffer plus the presence flags
     */
    @JsonIgnore
    public int getDataSize() {
        return _data.length + (_presence == null ? 0 : _presence.length);
    }

    /**
     * Create an independent copy of this section.
     *
     * @return a deep copy
     */
    public PageSection copy() {
        return new PageSection(
                _kind,
                _numBuckets,
                _data.clone(),
                _presence == null ? null : _presence.clone());
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final PageSection other = (PageSection) object;

        return _numBuckets == other._numBuckets
                && _kind.equals(other._kind)
                && Arrays.equals(_data, other._data)
                && Arrays.equals(_presence, other._presence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_kind, _numBuckets, Arrays.hashCode(_data), Arrays.hashCode(_presence));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Kind", _kind)
                .add("NumBuckets", _numBuckets)
                .add("Nullable", isNullable())
                .toString();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    @JsonProperty("data")
    byte[] getData() {
        return _data;
    }

    @Nullable
    @SuppressFBWarnings("EI_EXPOSE_REP")
    @JsonProperty("presence")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    byte[] getPresence() {
        return _presence;
    }

    @JsonCreator
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    PageSection(
            @JsonProperty("kind") final NumberKind<?> kind,
            @JsonProperty("numBuckets") final int numBuckets,
            @JsonProperty("data") final byte[] data,
            @JsonProperty("presence") @Nullable final byte[] presence) {
        if (data.length != kind.getByteSize() * numBuckets) {
            throw new IllegalArgumentException(
                    String.format("Section data does not match its kind; kind=%s, numBuckets=%d, bytes=%d", kind, numBuckets, data.length));
        }
        if (presence != null && presence.length != numBuckets) {
            throw new IllegalArgumentException(
                    String.format("Section presence flags do not match its size; numBuckets=%d, flags=%d", numBuckets, presence.length));
        }
        _kind = kind;
        _numBuckets = numBuckets;
        _data = data;
        _presence = presence;
    }

    private void checkKind(final NumberKind<?> kind) {
        if (!_kind.equals(kind)) {
            throw new NumberKindMismatchException(_kind, kind);
        }
    }

    private void checkBucket(final int bucket) {
        if (bucket < 0 || bucket >= _numBuckets) {
            throw new IndexOutOfBoundsException(String.format("Bucket out of range; bucket=%d, numBuckets=%d", bucket, _numBuckets));
        }
    }

    private final NumberKind<?> _kind;
    private final int _numBuckets;
    private final byte[] _data;
    @Nullable
    private final byte[] _presence;
}
