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

import com.arpnetworking.statistics.test.TestBeanFactory;
import com.arpnetworking.statistics.timeline.Timeline;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link PageId}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class PageIdTest {

    @Test
    public void uniqueIdFormat() {
        final PageId id = PageId.of("Default", _timeline.pageIndex(3));
        Assert.assertEquals("SmallMinute/ea60/16f5e66e800/4/Default/3", id.getUniqueId());
    }

    @Test
    public void parseIsInverseOfFormat() {
        final PageId id = PageId.of("DailyCohorts", _timeline.pageIndex(12345));
        final PageId parsed = PageId.parse(id.getUniqueId());
        Assert.assertEquals(id, parsed);
        Assert.assertEquals(_timeline, parsed.getTimeline());
        Assert.assertEquals("DailyCohorts", parsed.getPageKey());
        Assert.assertEquals(12345, parsed.getPageIndex().getIndex());
        Assert.assertEquals(id.getUniqueId(), parsed.getUniqueId());
    }

    @Test
    public void blankPageKeyIsDefault() {
        Assert.assertEquals(PageId.DEFAULT_PAGE_KEY, PageId.of(" ", _timeline.pageIndex(0)).getPageKey());
    }

    @Test(expected = IllegalArgumentException.class)
    public void pageKeyWithSeparator() {
        PageId.of("a/b", _timeline.pageIndex(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseTooFewParts() {
        PageId.parse("SmallMinute/ea60/16f5e66e800/4/Default");
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseTooManyParts() {
        PageId.parse("SmallMinute/ea60/16f5e66e800/4/Default/3/7");
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseBadHex() {
        PageId.parse("SmallMinute/xyz/16f5e66e800/4/Default/3");
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseBadPageIndex() {
        PageId.parse("SmallMinute/ea60/16f5e66e800/4/Default/three");
    }

    private final Timeline _timeline = TestBeanFactory.createTimeline();
}
