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

import com.arpnetworking.statistics.page.NumberKind;
import com.arpnetworking.statistics.page.PageSection;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.statistics.storage.PageWriteBuffer;
import com.arpnetworking.statistics.timeline.PageIndex;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Base for series writers. Keeps the sections of the series in the current
 * page and creates the page and its sections on the first non-null write.
 *
 * @param <T> the numeric type stored by the series
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class AbstractSeriesWriter<T extends Number> implements SeriesWriter {

    @Override
    public WritableTimeSeries<T> getSeries() {
        return _series;
    }

    @Override
    public final void resetPage(final PageWriteBuffer buffer, final PageIndex pageIndex) {
        _buffer = buffer;
        _pageIndex = pageIndex;
        _sections.clear();
        _page = buffer.tryGetWritablePage(_series.getStoragePageKey(), pageIndex).orElse(null);
        if (_page != null) {
            final String seriesKey = _series.getKey();
            _page.getSection(seriesKey, null).ifPresent(section -> _sections.put(seriesKey, section));
            for (final String cohort : _page.cohortsOf(seriesKey)) {
                _page.getSection(seriesKey, cohort)
                        .ifPresent(section -> _sections.put(StoragePage.sectionId(seriesKey, cohort), section));
            }
        }
    }

    /**
     * Protected constructor.
     *
     * @param series the series written
     */
    protected AbstractSeriesWriter(final WritableTimeSeries<T> series) {
        _series = series;
    }

    /**
     * Read a bucket of a section of the series.
     *
     * @param cohort the cohort, or null for the series itself
     * @param bucket the bucket
     * @return the value, if any
     */
    protected Optional<T> getValue(@Nullable final String cohort, final int bucket) {
        return getValue(_series.getNumberKind(), cohort, bucket);
    }

    /**
     * Read a bucket of a section of the series stored with a specific kind.
     *
     * @param kind the kind of the section
     * @param cohort the cohort, or null for the series itself
     * @param bucket the bucket
     * @param <V> the numeric type of the section
     * @return the value, if any
     */
    protected <V extends Number> Optional<V> getValue(final NumberKind<V> kind, @Nullable final String cohort, final int bucket) {
        @Nullable final PageSection section = _sections.get(StoragePage.sectionId(_series.getKey(), cohort));
        if (section == null) {
            return Optional.empty();
        }
        return section.getValue(kind, bucket);
    }

    /**
     * Write a bucket of a section of the series.
     *
     * @param cohort the cohort, or null for the series itself
     * @param bucket the bucket
     * @param value the value
     */
    protected void setValue(@Nullable final String cohort, final int bucket, @Nullable final T value) {
        setValue(_series.getNumberKind(), _series.isNullable(), cohort, bucket, value);
    }

    /**
     * Write a bucket of a section of the series stored with a specific kind.
     * Writing null to a section that does not exist does nothing.
     *
     * @param kind the kind of the section
     * @param nullable whether the section is nullable if it is created
     * @param cohort the cohort, or null for the series itself
     * @param bucket the bucket
     * @param value the value
     * @param <V> the numeric type of the section
     */
    protected <V extends Number> void setValue(
            final NumberKind<V> kind,
            final boolean nullable,
            @Nullable final String cohort,
            final int bucket,
            @Nullable final V value) {
        final String sectionId = StoragePage.sectionId(_series.getKey(), cohort);
        @Nullable PageSection section = _sections.get(sectionId);
        if (section == null) {
            if (value == null) {
                return;
            }
            if (_buffer == null || _pageIndex == null) {
                throw new IllegalStateException(String.format("Writer has no current page; series=%s", _series.getKey()));
            }
            if (_page == null) {
                _page = _buffer.getOrCreateWritablePage(_series.getStoragePageKey(), _pageIndex);
            }
            section = _page.getOrCreateSection(_series.getKey(), cohort, kind, nullable);
            _sections.put(sectionId, section);
        }
        section.setValue(kind, bucket, value);
    }

    private final WritableTimeSeries<T> _series;
    private final Map<String, PageSection> _sections = new HashMap<>();
    @Nullable
    private PageWriteBuffer _buffer;
    @Nullable
    private PageIndex _pageIndex;
    @Nullable
    private StoragePage _page;
}
