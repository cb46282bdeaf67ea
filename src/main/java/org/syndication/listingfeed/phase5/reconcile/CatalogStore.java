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

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * The listing catalog. All writes of a run go through one {@link CatalogTransaction}.
 */
public interface CatalogStore extends AutoCloseable {

    /**
     * Opens the unit of work of one run.
     */
    CatalogTransaction begin() throws SQLException;

    Optional<CatalogEntry> findEntry(String id) throws SQLException;

    /**
     * Stored photo URLs of a listing, ordered by sequence.
     */
    List<String> findPhotos(String id) throws SQLException;

    /**
     * Every committed run result, oldest first.
     */
    List<FetchRunResult> listRunResults() throws SQLException;

    @Override
    void close() throws SQLException;
}
