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

import com.arpnetworking.statistics.timeline.PageIndex;
import com.arpnetworking.statistics.timeline.Timeline;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * The sections of all series sharing a page key for one page of a timeline.
 * A page is open while the writer may still add to it and becomes final once
 * the writer moves past it. A final page is never modified again.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class StoragePage {

    /**
     * Public constructor.
     *
     * @param pageKey the page key shared by the series stored in the page
     * @param pageIndex the page this instance holds
     */
    public StoragePage(final String pageKey, final PageIndex pageIndex) {
        this(PageId.of(pageKey, pageIndex), new TreeMap<>(), false);
    }

    /**
     * Build the id of a section.
     *
     * @param seriesKey the key of the series
     * @param cohort the cohort within the series, or null for the series itself
     * @return the section id
     */
    public static String sectionId(final String seriesKey, @Nullable final String cohort) {
        if (cohort == null || cohort.isEmpty()) {
            return seriesKey;
        }
        if (cohort.contains("/")) {
            throw new IllegalArgumentException(String.format("Cohort must not contain '/'; cohort=%s", cohort));
        }
        return seriesKey + "/" + cohort;
    }

    /**
     * Find a section.
     *
     * @param seriesKey the key of the series
     * @param cohort the cohort within the series, or null for the series itself
     * @return the section if it exists
     */
    public Optional<PageSection> getSection(final String seriesKey, @Nullable final String cohort) {
        return Optional.ofNullable(_sections.get(sectionId(seriesKey, cohort)));
    }

    /**
     * Find a section or create it if it does not yet exist.
     *
     * @param seriesKey the key of the series
     * @param cohort the cohort within the series, or null for the series itself
     * @param kind the numeric kind of the section
     * @param nullable whether the section distinguishes empty buckets from zero
     * @return the section
     */
    public PageSection getOrCreateSection(
            final String seriesKey,
            @Nullable final String cohort,
            final NumberKind<?> kind,
            final boolean nullable) {
        final String sectionId = sectionId(seriesKey, cohort);
        final PageSection existing = _sections.get(sectionId);
        if (existing != null) {
            return existing;
        }
        if (_final) {
            throw new IllegalStateException(String.format("Cannot add a section to a final page; page=%s, section=%s", _id, sectionId));
        }
        final PageSection section = PageSection.create(kind, getTimeline().getResolution().getNumBucketsPerPage(), nullable);
        _sections.put(sectionId, section);
        return section;
    }

    /**
     * The cohorts of a series that have a section in this page.
     *
     * @param seriesKey the key of the series
     * @return the cohort names
     */
    public ImmutableList<String> cohortsOf(final String seriesKey) {
        final ImmutableList.Builder<String> cohorts = ImmutableList.builder();
        for (final String sectionId : _sections.keySet()) {
            final int separator = sectionId.indexOf('/');
            if (separator > 0 && sectionId.substring(0, separator).equals(seriesKey)) {
                cohorts.add(sectionId.substring(separator + 1));
            }
        }
        return cohorts.build();
    }

    /**
     * Mark the page final. A final page is never modified again.
     */
    public void setFinal() {
        _final = true;
    }

    @JsonProperty("final")
    public boolean isFinal() {
        return _final;
    }

    @JsonIgnore
    public PageId getId() {
        return _id;
    }

    @JsonIgnore
    public String getUniqueId() {
        return _id.getUniqueId();
    }

    @JsonProperty("pageKey")
    public String getPageKey() {
        return _id.getPageKey();
    }

    @JsonProperty("timeline")
    public Timeline getTimeline() {
        return _id.getTimeline();
    }

    @JsonIgnore
    public PageIndex getPageIndex() {
        return _id.getPageIndex();
    }

    @JsonProperty("pageIndex")
    public long getIndex() {
        return _id.getPageIndex().getIndex();
    }

    @JsonIgnore
    public Instant getStartTime() {
        return getPageIndex().getStartTime();
    }

    @JsonIgnore
    public Instant getEndTime() {
        return getPageIndex().getEndTime();
    }

    @JsonProperty("sections")
    public ImmutableMap<String, PageSection> getSections() {
        return ImmutableMap.copyOf(_sections);
    }

    /**
     * Approximate number of bytes held by the page, used to weigh it in caches.
     *
     * @return the approximate size
     */
    @JsonIgnore
    public long getApproximateSize() {
        long size = getPageKey().length();
        for (final Map.Entry<String, PageSection> entry : _sections.entrySet()) {
            size += entry.getKey().length() + entry.getValue().getDataSize();
        }
        return size;
    }

    /**
     * Create an independent copy of this page.
     *
     * @return a deep copy
     */
    public StoragePage copy() {
        return new StoragePage(_id, new TreeMap<>(Maps.transformValues(_sections, PageSection::copy)), _final);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final StoragePage other = (StoragePage) object;

        return _final == other._final
                && _id.equals(other._id)
                && _sections.equals(other._sections);
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id.getUniqueId())
                .add("Final", _final)
                .add("Sections", _sections.keySet())
                .toString();
    }

    @JsonCreator
    StoragePage(
            @JsonProperty("pageKey") final String pageKey,
            @JsonProperty("timeline") final Timeline timeline,
            @JsonProperty("pageIndex") final long pageIndex,
            @JsonProperty("sections") final Map<String, PageSection> sections,
            @JsonProperty("final") final boolean isFinal) {
        this(PageId.of(pageKey, timeline.pageIndex(pageIndex)), new TreeMap<>(sections), isFinal);
    }

    private StoragePage(final PageId id, final TreeMap<String, PageSection> sections, final boolean isFinal) {
        _id = id;
        _sections = sections;
        _final = isFinal;
    }

    private final PageId _id;
    private final TreeMap<String, PageSection> _sections;
    private volatile boolean _final;
}
