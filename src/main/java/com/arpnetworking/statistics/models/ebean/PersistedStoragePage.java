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
package com.arpnetworking.statistics.models.ebean;

import com.arpnetworking.statistics.utility.Database;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.ebean.annotation.WhenCreated;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.sql.Timestamp;
import java.util.Optional;

/**
 * Model for a persisted final statistics page. The payload holds the whole
 * serialized page; the other columns are derived from it for lookups and
 * pruning.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
// CHECKSTYLE.OFF: MemberNameCheck
@Entity
@Table(name = "pages", schema = "statistics")
public class PersistedStoragePage {
    /**
     * Fetches a page by its unique key.
     *
     * @param uniqueKey the unique id of the page
     * @param database the database backing the data
     * @return the page if found
     */
    public static Optional<PersistedStoragePage> findByUniqueKey(final String uniqueKey, final Database database) {
        return Optional.ofNullable(database.getEbeanServer().find(PersistedStoragePage.class, uniqueKey));
    }

    public String getUniqueKey() {
        return uniqueKey;
    }

    public void setUniqueKey(final String value) {
        uniqueKey = value;
    }

    public String getResolutionName() {
        return resolutionName;
    }

    public void setResolutionName(final String value) {
        resolutionName = value;
    }

    public Timestamp getStartTime() {
        return startTime;
    }

    public void setStartTime(final Timestamp value) {
        startTime = value;
    }

    public Timestamp getEndTime() {
        return endTime;
    }

    public void setEndTime(final Timestamp value) {
        endTime = value;
    }

    public Timestamp getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(final Timestamp value) {
        createdAt = value;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getPayload() {
        return payload;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setPayload(final byte[] value) {
        payload = value;
    }

    @Id
    @Column(name = "unique_key", length = 128)
    private String uniqueKey;

    @Column(name = "resolution_name", length = 64)
    private String resolutionName;

    @Column(name = "start_time")
    private Timestamp startTime;

    @Column(name = "end_time")
    private Timestamp endTime;

    @WhenCreated
    @Column(name = "created_at")
    private Timestamp createdAt;

    @Lob
    @Column(name = "payload")
    private byte[] payload;
}
// CHECKSTYLE.ON: MemberNameCheck
