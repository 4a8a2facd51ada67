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

import com.arpnetworking.statistics.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

/**
 * Tests for the {@link Timeline}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class TimelineTest {

    @Test
    public void bucketIndexOfEpoch() {
        final BucketIndex index = _timeline.bucketIndexOf(TestBeanFactory.EPOCH);
        Assert.assertEquals(0, index.getPage().getIndex());
        Assert.assertEquals(0, index.getBucket());
        Assert.assertEquals(TestBeanFactory.EPOCH, index.getStartTime());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(1)), index.getEndTime());
    }

    @Test
    public void bucketIndexOfLaterTime() {
        final BucketIndex index = _timeline.bucketIndexOf(TestBeanFactory.EPOCH.plus(Duration.ofSeconds(5 * 60 + 30)));
        Assert.assertEquals(1, index.getPage().getIndex());
        Assert.assertEquals(1, index.getBucket());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(5)), index.getStartTime());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(4)), index.getPage().getStartTime());
        Assert.assertEquals(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(8)), index.getPage().getEndTime());
    }

    @Test(expected = IllegalArgumentException.class)
    public void timeBeforeEpoch() {
        _timeline.bucketIndexOf(TestBeanFactory.EPOCH.minusMillis(1));
    }

    @Test
    public void bucketsForRangeSpanningPages() {
        final ImmutableList<BucketIndex> buckets = _timeline.bucketsForRange(
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(3)),
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(9)));
        Assert.assertEquals(
                ImmutableList.of(
                        _timeline.bucketIndex(0, 3),
                        _timeline.bucketIndex(1, 0),
                        _timeline.bucketIndex(1, 1),
                        _timeline.bucketIndex(1, 2),
                        _timeline.bucketIndex(1, 3),
                        _timeline.bucketIndex(2, 0)),
                buckets);
    }

    @Test
    public void bucketsForRangeRoundsEndUp() {
        final ImmutableList<BucketIndex> buckets = _timeline.bucketsForRange(
                TestBeanFactory.EPOCH.plus(Duration.ofSeconds(30)),
                TestBeanFactory.EPOCH.plus(Duration.ofSeconds(61)));
        Assert.assertEquals(ImmutableList.of(_timeline.bucketIndex(0, 0), _timeline.bucketIndex(0, 1)), buckets);
    }

    @Test
    public void bucketsForRangeEndingOnBoundary() {
        final ImmutableList<BucketIndex> buckets = _timeline.bucketsForRange(
                TestBeanFactory.EPOCH,
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(2)));
        Assert.assertEquals(ImmutableList.of(_timeline.bucketIndex(0, 0), _timeline.bucketIndex(0, 1)), buckets);
    }

    @Test
    public void bucketsForEmptyRange() {
        final Instant time = TestBeanFactory.EPOCH.plus(Duration.ofSeconds(90));
        Assert.assertTrue(_timeline.bucketsForRange(time, time).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void bucketsForInvertedRange() {
        _timeline.bucketsForRange(TestBeanFactory.EPOCH.plus(Duration.ofMinutes(2)), TestBeanFactory.EPOCH);
    }

    @Test
    public void bucketsForRangeAreContiguous() {
        final Timeline hourly = new Timeline(TestBeanFactory.EPOCH, Resolutions.HOURLY);
        final ImmutableList<BucketIndex> buckets = hourly.bucketsForRange(
                TestBeanFactory.EPOCH.plus(Duration.ofMinutes(90)),
                TestBeanFactory.EPOCH.plus(Duration.ofDays(3)));
        Assert.assertEquals(71, buckets.size());
        for (int i = 1; i < buckets.size(); ++i) {
            Assert.assertTrue(buckets.get(i - 1).compareTo(buckets.get(i)) < 0);
            Assert.assertEquals(buckets.get(i - 1).getEndTime(), buckets.get(i).getStartTime());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void compareAcrossTimelines() {
        final Timeline other = new Timeline(TestBeanFactory.EPOCH.plus(Duration.ofDays(1)), TestBeanFactory.SMALL_MINUTE);
        _timeline.pageIndex(0).compareTo(other.pageIndex(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void resolutionNameWithSeparator() {
        Resolution.of("Bad/Name", Duration.ofMinutes(1), 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void resolutionWithoutBuckets() {
        Resolution.of("Empty", Duration.ofMinutes(1), 0);
    }

    private final Timeline _timeline = TestBeanFactory.createTimeline();
}
