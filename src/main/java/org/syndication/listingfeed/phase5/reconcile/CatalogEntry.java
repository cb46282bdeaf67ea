/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.syndication.listingfeed.phase5.reconcile;

import org.syndication.listingfeed.shared.ListingRecord;

import java.time.Instant;

/**
 * Persistent catalog view of a listing: the last extracted record plus its lifecycle.
 * {@code soldAt} is set exactly when the status is {@link ListingStatus#SOLD}.
 */
public class CatalogEntry {

    private ListingRecord record;
    private String slug;
    private ListingStatus status = ListingStatus.ACTIVE;
    private Instant soldAt;
    private Instant firstSeenAt;
    private Instant lastSeenAt;
    private Instant updatedAt;

    public CatalogEntry(ListingRecord record) {
        this.record = record;
    }

    public String getId() {
        return record.getId();
    }

    public ListingRecord getRecord() {
        return record;
    }

    public void setRecord(ListingRecord record) {
        this.record = record;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public ListingStatus getStatus() {
        return status;
    }

    public void setStatus(ListingStatus status) {
        this.status = status;
    }

    public Instant getSoldAt() {
        return soldAt;
    }

    public void setSoldAt(Instant soldAt) {
        this.soldAt = soldAt;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public boolean isActive() {
        return status == ListingStatus.ACTIVE;
    }

    @Override
    public String toString() {
        return "CatalogEntry{id=" + getId() + ", slug=" + slug + ", status=" + status + "}";
    }
}
