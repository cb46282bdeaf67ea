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

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Scoped unit of work against the catalog. Nothing is visible to others until
 * {@link #commit()}; closing an uncommitted transaction rolls it back.
 */
public interface CatalogTransaction extends AutoCloseable {

    /**
     * Creates the entry for a new id or overwrites the mutable fields of an existing one.
     * Either way the entry ends up ACTIVE with no sold timestamp and {@code lastSeenAt = now}.
     */
    UpsertResult upsert(ListingRecord record, Instant now) throws SQLException;

    /**
     * Retires every ACTIVE entry whose id is not in {@code seenIds}.
     *
     * @return number of entries retired
     */
    int markSoldExcept(Set<String> seenIds, Instant now) throws SQLException;

    /**
     * Replaces the stored photos of a listing; sequence numbers are list positions starting at 1.
     */
    void replacePhotos(String id, List<String> urls) throws SQLException;

    void appendRunResult(FetchRunResult result) throws SQLException;

    void commit() throws SQLException;

    @Override
    void close() throws SQLException;
}
