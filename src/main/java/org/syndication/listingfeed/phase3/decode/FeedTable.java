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
package org.syndication.listingfeed.phase3.decode;

import org.syndication.listingfeed.shared.FeedLayout;

/**
 * The tables of a bundle and the archive entry each is read from.
 */
public enum FeedTable {
    LISTINGS(FeedLayout.Listings.ENTRY),
    REMARKS(FeedLayout.Remarks.ENTRY),
    CHARACTERISTICS(FeedLayout.Characteristics.ENTRY),
    PHOTOS(FeedLayout.Photos.ENTRY),
    UNITS(FeedLayout.Units.ENTRY),
    ROOMS(FeedLayout.Rooms.ENTRY),
    /** Free-text narrative, decoded per id on demand rather than with the others. */
    ADDENDA(FeedLayout.Addenda.ENTRY);

    private final String entryName;

    FeedTable(String entryName) {
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }

    public boolean isDecodedOnDemand() {
        return this == ADDENDA;
    }

    /**
     * Table for an archive entry name (case-sensitive), or {@code null} when the entry is not part of the feed.
     */
    public static FeedTable forEntry(String entryName) {
        for (FeedTable table : values()) {
            if (table.entryName.equals(entryName)) {
                return table;
            }
        }
        return null;
    }
}
