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
package com.arpnetworking.statistics.storage;

import com.arpnetworking.statistics.collector.PageReadRequest;
import com.arpnetworking.statistics.collector.PageReadResponse;
import com.arpnetworking.statistics.page.StoragePage;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import org.apache.pekko.actor.ActorRef;
import org.apache.pekko.pattern.Patterns;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Reads pages that have not been persisted yet from the actor that owns the
 * write buffers.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ActorProxyPageStorage extends ReadOnlyPageStorage {

    /**
     * Public constructor.
     *
     * @param collector the actor owning the write buffers
     * @param timeout how long to wait for a reply
     */
    public ActorProxyPageStorage(final ActorRef collector, final Duration timeout) {
        _collector = collector;
        _timeout = timeout;
    }

    @Override
    public CompletionStage<Optional<StoragePage>> tryGet(final String pageId) {
        return Patterns.ask(_collector, new PageReadRequest(pageId), _timeout)
                .whenComplete((response, throwable) -> {
                    if (throwable != null) {
                        LOGGER.error()
                                .setMessage("Failed to read page from collector")
                                .addData("pageId", pageId)
                                .addData("collector", _collector)
                                .setThrowable(throwable)
                                .log();
                    }
                })
                .thenApply(response -> ((PageReadResponse) response).getPage());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Collector", _collector)
                .add("Timeout", _timeout)
                .toString();
    }

    private final ActorRef _collector;
    private final Duration _timeout;

    private static final Logger LOGGER = LoggerFactory.getLogger(ActorProxyPageStorage.class);
}
