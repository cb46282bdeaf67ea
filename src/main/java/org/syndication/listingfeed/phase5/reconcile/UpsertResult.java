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

/**
 * Outcome of writing one record through to the catalog.
 */
public class UpsertResult {

    private final CatalogEntry entry;
    private final boolean created;

    public UpsertResult(CatalogEntry entry, boolean created) {
        this.entry = entry;
        this.created = created;
    }

    public CatalogEntry getEntry() {
        return entry;
    }

    /**
     * {@code true} when the id was new to the catalog, {@code false} when an entry was overwritten.
     */
    public boolean isCreated() {
        return created;
    }
}
