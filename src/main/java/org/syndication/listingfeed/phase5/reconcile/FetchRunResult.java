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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Audit record of one committed import run. Written once, never updated.
 */
@JsonPropertyOrder({"createdAt", "bundleDate", "sourceUrl", "sourceName", "itemsTotal",
        "itemsAdded", "itemsUpdated", "itemsMarkedSold", "durationSeconds"})
public class FetchRunResult {

    private Instant createdAt;
    private LocalDate bundleDate;
    private String sourceUrl;
    private String sourceName;
    private int itemsTotal;
    private int itemsAdded;
    private int itemsUpdated;
    private int itemsMarkedSold;
    private double durationSeconds;

    public FetchRunResult() {
    }

    public FetchRunResult(Instant createdAt, LocalDate bundleDate, String sourceUrl, String sourceName) {
        this.createdAt = createdAt;
        this.bundleDate = bundleDate;
        this.sourceUrl = sourceUrl;
        this.sourceName = sourceName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDate getBundleDate() {
        return bundleDate;
    }

    public void setBundleDate(LocalDate bundleDate) {
        this.bundleDate = bundleDate;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public int getItemsTotal() {
        return itemsTotal;
    }

    public void setItemsTotal(int itemsTotal) {
        this.itemsTotal = itemsTotal;
    }

    public int getItemsAdded() {
        return itemsAdded;
    }

    public void setItemsAdded(int itemsAdded) {
        this.itemsAdded = itemsAdded;
    }

    public int getItemsUpdated() {
        return itemsUpdated;
    }

    public void setItemsUpdated(int itemsUpdated) {
        this.itemsUpdated = itemsUpdated;
    }

    public int getItemsMarkedSold() {
        return itemsMarkedSold;
    }

    public void setItemsMarkedSold(int itemsMarkedSold) {
        this.itemsMarkedSold = itemsMarkedSold;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    /**
     * One-line operator summary, e.g. {@code total=120 +3 ~117 sold=2}.
     */
    public String summary() {
        return String.format("total=%d +%d ~%d sold=%d", itemsTotal, itemsAdded, itemsUpdated, itemsMarkedSold);
    }

    @Override
    public String toString() {
        return "FetchRunResult{" + sourceName + " " + summary() + "}";
    }
}
